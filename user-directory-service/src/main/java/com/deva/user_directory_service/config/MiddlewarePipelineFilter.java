package com.deva.user_directory_service.config;

import com.deva.user_directory_service.model.ApiError;
import com.deva.user_directory_service.pipeline.ApiExchange;
import com.deva.user_directory_service.pipeline.MiddlewarePipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Runs every request through the {@link MiddlewarePipeline}. The rest of the servlet chain
 * (security and Spring MVC) is the pipeline's terminal handler; whatever it produces is captured
 * into the exchange, and the exchange is what finally gets written to the client.
 */
public class MiddlewarePipelineFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(MiddlewarePipelineFilter.class);

    private final MiddlewarePipeline pipeline;
    private final List<String> excludedPaths;
    private final int maxBodyBytes;
    private final ObjectMapper objectMapper;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public MiddlewarePipelineFilter(MiddlewarePipeline pipeline,
                                    UserDirectoryProperties.Pipeline properties,
                                    ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.excludedPaths = properties.excludedPaths();
        this.maxBodyBytes = properties.maxBodyBytes();
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = pathWithinApplication(request);
        return excludedPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (request.getContentLengthLong() > maxBodyBytes) {
            rejectTooLarge(request, response);
            return;
        }
        // one byte over the limit is enough to tell a chunked body is too big
        byte[] body = request.getInputStream().readNBytes((int) Math.min((long) maxBodyBytes + 1, Integer.MAX_VALUE));
        if (body.length > maxBodyBytes) {
            rejectTooLarge(request, response);
            return;
        }
        ApiExchange exchange = new ApiExchange(request.getMethod(), request.getRequestURI(), readHeaders(request), body);
        HttpHeaders outerHeaders = readHeaders(response);

        try {
            pipeline.execute(exchange, ex -> dispatch(ex, request, response, filterChain));
        } catch (ServletException | IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ServletException(e);
        }

        write(exchange, outerHeaders, response);
    }

    private void rejectTooLarge(HttpServletRequest request, HttpServletResponse response) throws IOException {
        log.warn("Rejected {} {}: body larger than {} bytes", request.getMethod(), request.getRequestURI(), maxBodyBytes);
        byte[] body = objectMapper.writeValueAsBytes(
                ApiError.of("Request body must not exceed " + maxBodyBytes + " bytes."));
        response.setStatus(HttpStatus.PAYLOAD_TOO_LARGE.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
        response.flushBuffer();
    }

    private void dispatch(ApiExchange exchange,
                          HttpServletRequest request,
                          HttpServletResponse response,
                          FilterChain filterChain) throws ServletException, IOException {
        ContentCachingResponseWrapper captured = new ContentCachingResponseWrapper(response);
        filterChain.doFilter(new BufferedBodyRequest(request, exchange.requestBody()), captured);

        exchange.setStatus(captured.getStatus());
        HttpHeaders headers = exchange.responseHeaders();
        for (String name : captured.getHeaderNames()) {
            if (HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name) || HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name)) {
                continue;
            }
            headers.put(name, List.copyOf(captured.getHeaders(name)));
        }
        if (captured.getContentType() != null) {
            headers.set(HttpHeaders.CONTENT_TYPE, captured.getContentType());
        }
        exchange.setResponseBody(captured.getContentAsByteArray());
    }

    private void write(ApiExchange exchange, HttpHeaders outerHeaders, HttpServletResponse response) throws IOException {
        if (response.isCommitted()) {
            // sendError() further in already committed the container's own error response
            log.debug("Response for {} {} already committed with status {}",
                    exchange.method(), exchange.path(), response.getStatus());
            return;
        }
        response.reset();
        response.setStatus(exchange.status());
        // headers set by filters outside the pipeline, e.g. the correlation id
        outerHeaders.forEach((name, values) -> {
            if (!exchange.responseHeaders().containsKey(name)) {
                values.forEach(value -> response.addHeader(name, value));
            }
        });
        exchange.responseHeaders().forEach((name, values) -> values.forEach(value -> response.addHeader(name, value)));
        byte[] body = exchange.responseBody();
        response.setContentLength(body.length);
        if (body.length > 0) {
            response.getOutputStream().write(body);
        }
        response.flushBuffer();
    }

    private static HttpHeaders readHeaders(HttpServletRequest request) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, Collections.list(request.getHeaders(name)));
        }
        return headers;
    }

    private static HttpHeaders readHeaders(HttpServletResponse response) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : response.getHeaderNames()) {
            headers.put(name, List.copyOf(response.getHeaders(name)));
        }
        return headers;
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        return contextPath != null && uri.startsWith(contextPath) ? uri.substring(contextPath.length()) : uri;
    }
}
