package com.example.conversations.security;

import com.example.conversations.config.ConversationsProperties;
import com.example.conversations.exception.AuthenticationFailedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the API key header on handlers annotated with {@link ApiKeyRequired}.
 * Other handlers pass through untouched.
 */
@Slf4j
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

    private final byte[] expectedKey;
    private final String headerName;

    public ApiKeyInterceptor(ConversationsProperties properties) {
        this.expectedKey = properties.getSecurity().getApiKey().getBytes(StandardCharsets.UTF_8);
        this.headerName = properties.getSecurity().getHeaderName();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method) || !method.hasMethodAnnotation(ApiKeyRequired.class)) {
            return true;
        }
        String supplied = request.getHeader(headerName);
        if (supplied == null || !MessageDigest.isEqual(expectedKey, supplied.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected {} {}: missing or invalid API key", request.getMethod(), request.getRequestURI());
            throw new AuthenticationFailedException();
        }
        return true;
    }
}
