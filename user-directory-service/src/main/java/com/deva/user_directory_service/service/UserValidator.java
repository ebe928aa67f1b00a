package com.deva.user_directory_service.service;

import com.deva.user_directory_service.model.User;

import java.util.Optional;

public final class UserValidator {

    public static final int MIN_NAME_LENGTH = 3;
    public static final int MIN_AGE = 0;
    public static final int MAX_AGE = 120;

    private UserValidator() {}

    /**
     * Checks a candidate for both create and update. Only the first failing rule is reported.
     */
    public static Optional<ValidationError> validate(User candidate) {
        String name = candidate.userName();
        if (name == null || name.isBlank()) {
            return Optional.of(ValidationError.NAME_EMPTY);
        }
        if (name.trim().length() < MIN_NAME_LENGTH) {
            return Optional.of(ValidationError.NAME_TOO_SHORT);
        }
        if (name.chars().anyMatch(Character::isWhitespace)) {
            return Optional.of(ValidationError.NAME_CONTAINS_WHITESPACE);
        }
        if (candidate.userAge() < MIN_AGE || candidate.userAge() > MAX_AGE) {
            return Optional.of(ValidationError.AGE_OUT_OF_RANGE);
        }
        return Optional.empty();
    }
}
