package com.nosota.mshop.api;

import com.nosota.mshop.api.dto.UserDTO;
import com.nosota.mshop.api.response.StatsResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

/**
 * Admin-only reporting endpoints.
 */
@RequestMapping("/api/admin")
public interface AdminApi {

    @GetMapping("/users")
    ResponseEntity<List<UserDTO>> listUsers() throws Exception;

    @GetMapping("/stats")
    ResponseEntity<StatsResponse> getStats() throws Exception;
}
