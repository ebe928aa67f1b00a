package com.deva.user_directory_service.pipeline;

@FunctionalInterface
public interface RequestHandler {

    void handle(ApiExchange exchange) throws Exception;
}
