package com.nosota.mshop.controller;

import com.nosota.mshop.api.AuthApi;
import com.nosota.mshop.api.request.LoginRequest;
import com.nosota.mshop.api.request.RegisterRequest;
import com.nosota.mshop.api.response.AuthResponse;
import com.nosota.mshop.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AuthController implements AuthApi {

    private final AuthService authService;

    @Override
    public ResponseEntity<AuthResponse> register(RegisterRequest request) throws Exception {
        AuthResponse response = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<AuthResponse> login(LoginRequest request) throws Exception {
        return ResponseEntity.ok(authService.login(request));
    }
}
