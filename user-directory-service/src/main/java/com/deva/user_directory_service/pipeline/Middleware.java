package com.deva.user_directory_service.pipeline;

/**
 * A stage of the request pipeline.
 *
 * A stage either produces the response itself and returns without touching {@code next}
 * (short-circuit), or calls {@code next} and may look at the response once it returns.
 */
@FunctionalInterface
public interface Middleware {

    void handle(ApiExchange exchange, RequestHandler next) throws Exception;
}
