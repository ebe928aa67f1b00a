package com.deva.user_directory_service.service;

import com.deva.user_directory_service.model.User;

public record CreateResult(Status status, User user, String message) {

    public enum Status {
        CREATED,
        INVALID,
        DUPLICATE
    }

    static CreateResult created(User user) {
        return new CreateResult(Status.CREATED, user, null);
    }

    static CreateResult invalid(ValidationError error) {
        return new CreateResult(Status.INVALID, null, error.message());
    }

    static CreateResult duplicate() {
        return new CreateResult(Status.DUPLICATE, null, UserDirectory.DUPLICATE_MESSAGE);
    }
}
