package com.deva.user_directory_service.pipeline;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Per-request context handed by reference through every pipeline stage.
 *
 * The request body is held as bytes: each {@link #openRequestBody()} starts from the beginning,
 * so a stage that reads the body never leaves it consumed for the next one.
 */
public class ApiExchange {

    private static final byte[] EMPTY = new byte[0];

    private final String method;
    private final String path;
    private final HttpHeaders requestHeaders;
    private final byte[] requestBody;

    private int status = 200;
    private final HttpHeaders responseHeaders = new HttpHeaders();
    private byte[] responseBody = EMPTY;

    public ApiExchange(String method, String path, HttpHeaders requestHeaders, byte[] requestBody) {
        this.method = method;
        this.path = path;
        this.requestHeaders = HttpHeaders.readOnlyHttpHeaders(requestHeaders);
        this.requestBody = requestBody != null ? requestBody.clone() : EMPTY;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public HttpHeaders requestHeaders() {
        return requestHeaders;
    }

    public boolean hasRequestBody() {
        return requestBody.length > 0;
    }

    public InputStream openRequestBody() {
        return new ByteArrayInputStream(requestBody);
    }

    public byte[] requestBody() {
        return requestBody.clone();
    }

    public String requestBodyAsString() {
        return new String(requestBody, StandardCharsets.UTF_8);
    }

    public int status() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public HttpHeaders responseHeaders() {
        return responseHeaders;
    }

    public byte[] responseBody() {
        return responseBody.clone();
    }

    public String responseBodyAsString() {
        return new String(responseBody, StandardCharsets.UTF_8);
    }

    public void setResponseBody(byte[] body) {
        this.responseBody = body != null ? body.clone() : EMPTY;
    }

    public void respond(int status, MediaType contentType, byte[] body) {
        resetResponse();
        this.status = status;
        if (contentType != null) {
            responseHeaders.setContentType(contentType);
        }
        setResponseBody(body);
    }

    public void resetResponse() {
        status = 200;
        responseHeaders.clear();
        responseBody = EMPTY;
    }
}
