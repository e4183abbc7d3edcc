package com.talentrelay.relay.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentrelay.config.RelayProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Assigns the request id and enforces the shared backend token on {@code /api/**}.
 */
@Component
public class RelayRequestFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RelayRequestFilter.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String BACKEND_TOKEN_HEADER = "X-Backend-Token";
    public static final String REQUEST_ID_ATTRIBUTE = "relay.requestId";
    public static final String MDC_REQUEST_ID = "requestId";

    private final RelayProperties properties;
    private final ObjectMapper objectMapper;

    public RelayRequestFilter(RelayProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
        throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            String route = request.getRequestURI();
            String expectedToken = properties.getBackendSharedToken();
            if (route.startsWith("/api/") && !expectedToken.isEmpty()
                && !expectedToken.equals(request.getHeader(BACKEND_TOKEN_HEADER))) {
                log.warn(
                    "request.unauthorized requestId={} route={} remote={} userAgent={}",
                    requestId,
                    route,
                    request.getRemoteAddr(),
                    request.getHeader("User-Agent")
                );
                writeUnauthorized(response, requestId);
                return;
            }
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void writeUnauthorized(HttpServletResponse response, String requestId) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", "Unauthorized");
        body.put("requestId", requestId);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
