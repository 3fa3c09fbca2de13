package com.linlay.taskagent.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskagent.config.AppAuthProperties;
import com.linlay.taskagent.model.api.ApiResponse;
import com.linlay.taskagent.security.JwtVerifier.JwtPrincipal;
import com.linlay.taskagent.service.ChatErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.PathContainer;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Requires a valid bearer token on {@code /api/{userId}/**} whose subject equals {@code userId}.
 */
@Component
public class ApiJwtAuthWebFilter implements WebFilter {

    public static final String JWT_PRINCIPAL_ATTR = "TASK_AGENT_JWT_PRINCIPAL";

    private static final Logger log = LoggerFactory.getLogger(ApiJwtAuthWebFilter.class);
    private static final String API_SEGMENT = "api";
    private static final String AUTH_PREFIX = "Bearer ";

    private final AppAuthProperties authProperties;
    private final JwtVerifier jwtVerifier;
    private final ObjectMapper objectMapper;

    public ApiJwtAuthWebFilter(AppAuthProperties authProperties, JwtVerifier jwtVerifier, ObjectMapper objectMapper) {
        this.authProperties = authProperties;
        this.jwtVerifier = jwtVerifier;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!authProperties.isEnabled()) {
            return chain.filter(exchange);
        }
        List<String> segments = leadingSegments(exchange.getRequest().getPath().pathWithinApplication(), 2);
        if (segments.isEmpty() || !API_SEGMENT.equals(segments.get(0))) {
            return chain.filter(exchange);
        }
        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }

        JwtPrincipal principal = jwtVerifier.verify(resolveBearerToken(exchange)).orElse(null);
        if (principal == null) {
            return writeError(exchange, HttpStatus.UNAUTHORIZED, "unauthorized", "Missing or invalid bearer token");
        }
        String pathUserId = segments.size() < 2 || !StringUtils.hasText(segments.get(1)) ? null : segments.get(1);
        if (pathUserId == null || !pathUserId.equals(principal.subject())) {
            log.warn("Reject token subject={} for path user={}", principal.subject(), pathUserId);
            return writeError(
                    exchange,
                    HttpStatus.FORBIDDEN,
                    ChatErrorCode.FORBIDDEN.code(),
                    "Token subject does not match the requested user"
            );
        }

        exchange.getAttributes().put(JWT_PRINCIPAL_ATTR, principal);
        return chain.filter(exchange);
    }

    /**
     * Percent-decoded path segments, matched the same way request mappings match them, so the
     * user id checked here is the one the controllers bind.
     */
    private List<String> leadingSegments(PathContainer path, int limit) {
        List<String> segments = new ArrayList<>(limit);
        for (PathContainer.Element element : path.elements()) {
            if (element instanceof PathContainer.PathSegment segment) {
                segments.add(segment.valueToMatch());
                if (segments.size() == limit) {
                    break;
                }
            }
        }
        return segments;
    }

    private String resolveBearerToken(ServerWebExchange exchange) {
        String authorization = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authorization) || !authorization.startsWith(AUTH_PREFIX)) {
            return null;
        }
        String token = authorization.substring(AUTH_PREFIX.length()).trim();
        return StringUtils.hasText(token) ? token : null;
    }

    private Mono<Void> writeError(ServerWebExchange exchange, HttpStatus status, String error, String message) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ApiResponse.failure(status.value(), message, error));
        } catch (JsonProcessingException ex) {
            body = ("{\"code\":" + status.value() + "}").getBytes(StandardCharsets.UTF_8);
        }
        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
