package com.deva.user_directory_service.pipeline;

import com.deva.user_directory_service.config.UserDirectoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Logs the request on the way in and the final status and body on the way out.
 * Reads only; the exchange is left as it was found.
 */
public class LoggingMiddleware implements Middleware {
    static final String REDACTED = "***";

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    private final UserDirectoryProperties.Logging properties;

    public LoggingMiddleware(UserDirectoryProperties.Logging properties) {
        this.properties = properties;
    }

    @Override
    public void handle(ApiExchange exchange, RequestHandler next) throws Exception {
        log.info("Incoming request: method={}, path={}", exchange.method(), exchange.path());
        log.info("Headers: {}", describe(exchange.requestHeaders()));
        if (exchange.hasRequestBody()) {
            log.info("Request body: {}", truncate(exchange.requestBodyAsString()));
        }

        next.handle(exchange);

        log.info("Outgoing response: status={}", exchange.status());
        log.info("Response body: {}", truncate(exchange.responseBodyAsString()));
    }

    String describe(HttpHeaders headers) {
        return headers.entrySet().stream()
                .map(this::describeHeader)
                .collect(Collectors.joining(", "));
    }

    private String describeHeader(Map.Entry<String, List<String>> header) {
        boolean redacted = properties.redactedHeaders().stream()
                .anyMatch(name -> name.equalsIgnoreCase(header.getKey()));
        String value = redacted ? REDACTED : String.join(",", header.getValue());
        return header.getKey() + ": " + value;
    }

    String truncate(String body) {
        int max = properties.maxBodyLength();
        if (body.length() <= max) {
            return body;
        }
        return body.substring(0, max) + "...(" + body.length() + " chars)";
    }
}
