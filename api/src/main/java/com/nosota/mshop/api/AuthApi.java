package com.nosota.mshop.api;

import com.nosota.mshop.api.request.LoginRequest;
import com.nosota.mshop.api.request.RegisterRequest;
import com.nosota.mshop.api.response.AuthResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Account API: registration and login. Both endpoints are public.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>AuthController - in service module (server-side implementation)</li>
 *   <li>AuthClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/auth")
public interface AuthApi {

    /**
     * Registers a regular user with the signup bonus on the wallet.
     *
     * @param request Name, username, email and password
     * @return 201 with a fresh token and the public user view
     */
    @PostMapping("/register")
    ResponseEntity<AuthResponse> register(@RequestBody @Valid RegisterRequest request) throws Exception;

    /**
     * Exchanges username and password for a token.
     * <p>
     * An unknown username and a wrong password produce the same 401 response.
     *
     * @param request Username and password
     * @return Fresh token and the public user view
     */
    @PostMapping("/login")
    ResponseEntity<AuthResponse> login(@RequestBody @Valid LoginRequest request) throws Exception;
}
