package com.deva.user_directory_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String error,
        String details
) {
    public static ApiError of(String error) {
        return new ApiError(error, null);
    }
}
