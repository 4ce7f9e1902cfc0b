package com.nosota.mshop.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.mshop.config.CorrelationIdFilter;
import com.nosota.mshop.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes security failures in the same body format as {@code GlobalExceptionHandler}:
 * 401 when no valid token was presented, 403 when the caller is not an admin.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.warn("Unauthenticated [correlationId={}]: {} {}",
                MDC.get(CorrelationIdFilter.MDC_KEY), request.getMethod(), request.getRequestURI());
        write(response, ErrorResponse.of(
                HttpStatus.UNAUTHORIZED.value(),
                "Unauthenticated",
                AccessControlService.UNAUTHENTICATED_MESSAGE,
                request.getRequestURI()));
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.warn("Forbidden [correlationId={}]: {} {}",
                MDC.get(CorrelationIdFilter.MDC_KEY), request.getMethod(), request.getRequestURI());
        write(response, ErrorResponse.of(
                HttpStatus.FORBIDDEN.value(),
                "Forbidden",
                AccessControlService.FORBIDDEN_MESSAGE,
                request.getRequestURI()));
    }

    private void write(HttpServletResponse response, ErrorResponse error) throws IOException {
        response.setStatus(error.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
