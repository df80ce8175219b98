package com.finpal.assistant.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * JSON bodies for 401 / 403 responses raised by the security filter chain, shaped like the
 * controller error responses so the pages can show one kind of error.
 */
@Component
public class JsonAuthErrorHandlers implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonAuthErrorHandlers.class);

    private final ObjectMapper mapper;

    public JsonAuthErrorHandlers(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException) throws IOException {
        writeJson(response, 401, authException, request, "UNAUTHORIZED");
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException) throws IOException {
        writeJson(response, 403, accessDeniedException, request, "FORBIDDEN");
    }

    private void writeJson(HttpServletResponse response, int status, Exception ex, HttpServletRequest request, String code) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");

        String traceId = RequestContextHolder.currentTraceId().orElse(null);
        Map<String, Object> details = new HashMap<>();
        details.put("path", request.getRequestURI());
        details.put("timestamp", Instant.now().toString());
        if (ex instanceof OAuth2AuthenticationException oauthEx && oauthEx.getError() != null) {
            details.put("oauth2ErrorCode", oauthEx.getError().getErrorCode());
            details.put("oauth2ErrorDescription", oauthEx.getError().getDescription());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("code", code);
        body.put("message", ex.getMessage());
        body.put("details", details);
        body.put("traceId", traceId);

        log.warn("Auth failure status={} code={} path={} traceId={} msg={}", status, code, request.getRequestURI(), traceId, ex.getMessage());
        mapper.writeValue(response.getOutputStream(), body);
    }
}
