package com.deva.user_directory_service.service;

public enum ValidationError {
    NAME_EMPTY("UserName must be at least 3 characters long and cannot be empty."),
    NAME_TOO_SHORT("UserName must be at least 3 characters long and cannot be empty."),
    NAME_CONTAINS_WHITESPACE("UserName cannot contain spaces."),
    AGE_OUT_OF_RANGE("UserAge must be between 0 and 120.");

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
