package com.deva.user_directory_service.service;

public record UpdateResult(Status status, String message) {

    public enum Status {
        UPDATED,
        INVALID,
        NOT_FOUND,
        DUPLICATE
    }

    static UpdateResult updated() {
        return new UpdateResult(Status.UPDATED, null);
    }

    static UpdateResult invalid(ValidationError error) {
        return new UpdateResult(Status.INVALID, error.message());
    }

    static UpdateResult notFound() {
        return new UpdateResult(Status.NOT_FOUND, null);
    }

    static UpdateResult duplicate() {
        return new UpdateResult(Status.DUPLICATE, UserDirectory.DUPLICATE_MESSAGE);
    }
}
