package com.codesandbox.engine.api;

import com.codesandbox.engine.api.dto.ApiResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires {@code X-Api-Key} to match the configured key.
 * Registered for /v1/sandbox/** in {@link com.codesandbox.engine.config.WebConfig}.
 */
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyInterceptor.class);

    public static final String HEADER = "X-Api-Key";

    private final byte[]       apiKey;
    private final ObjectMapper objectMapper;

    public ApiKeyInterceptor(@Value("${sandbox.api-key}") String apiKey, ObjectMapper objectMapper) {
        this.apiKey       = apiKey.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        String presented = request.getHeader(HEADER);
        if (presented != null
                && MessageDigest.isEqual(apiKey, presented.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("Rejected {} {} from {}: missing or wrong {}",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr(), HEADER);
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), ApiResponse.error(-401, "Unauthorized"));
        return false;
    }
}
