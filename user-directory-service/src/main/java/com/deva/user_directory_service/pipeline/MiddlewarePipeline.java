package com.deva.user_directory_service.pipeline;

import java.util.List;

/**
 * Fixed, ordered list of stages. The first stage sees the request first and the response last.
 */
public final class MiddlewarePipeline {

    private final List<Middleware> stages;

    public MiddlewarePipeline(List<Middleware> stages) {
        this.stages = List.copyOf(stages);
    }

    public static MiddlewarePipeline of(Middleware... stages) {
        return new MiddlewarePipeline(List.of(stages));
    }

    public List<Middleware> stages() {
        return stages;
    }

    public RequestHandler wrap(RequestHandler terminal) {
        RequestHandler next = terminal;
        for (int i = stages.size() - 1; i >= 0; i--) {
            Middleware stage = stages.get(i);
            RequestHandler inner = next;
            next = exchange -> stage.handle(exchange, inner);
        }
        return next;
    }

    public void execute(ApiExchange exchange, RequestHandler terminal) throws Exception {
        wrap(terminal).handle(exchange);
    }
}
