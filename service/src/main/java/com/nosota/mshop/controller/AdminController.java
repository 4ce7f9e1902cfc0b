package com.nosota.mshop.controller;

import com.nosota.mshop.api.AdminApi;
import com.nosota.mshop.api.dto.UserDTO;
import com.nosota.mshop.api.response.StatsResponse;
import com.nosota.mshop.mapper.UserMapper;
import com.nosota.mshop.service.AdminReportingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AdminController implements AdminApi {

    private final AdminReportingService adminReportingService;

    @Override
    public ResponseEntity<List<UserDTO>> listUsers() {
        return ResponseEntity.ok(UserMapper.INSTANCE.toDTOList(adminReportingService.listUsers()));
    }

    @Override
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(adminReportingService.getStats());
    }
}
