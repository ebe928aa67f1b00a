package com.deva.user_directory_service.pipeline;

import com.deva.user_directory_service.model.ApiError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;

/**
 * Fault boundary. Anything thrown further in becomes a 500 with {@code {error, details}}.
 */
public class ErrorHandlingMiddleware implements Middleware {
    static final String INTERNAL_ERROR = "Internal server error.";

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlingMiddleware.class);

    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public ErrorHandlingMiddleware(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handle(ApiExchange exchange, RequestHandler next) {
        try {
            next.handle(exchange);
        } catch (Exception ex) {
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
            log.error("Unhandled exception on {} {}: {}", exchange.method(), exchange.path(), cause.getMessage(), ex);
            meterRegistry.counter("userdirectory.pipeline.faults", "exception", cause.getClass().getSimpleName())
                    .increment();
            exchange.respond(HttpStatus.INTERNAL_SERVER_ERROR.value(), MediaType.APPLICATION_JSON,
                    write(new ApiError(INTERNAL_ERROR, details(cause))));
        }
    }

    private static String details(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }

    private byte[] write(ApiError error) {
        try {
            return objectMapper.writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            return ("{\"error\":\"" + INTERNAL_ERROR + "\"}").getBytes(StandardCharsets.UTF_8);
        }
    }
}
