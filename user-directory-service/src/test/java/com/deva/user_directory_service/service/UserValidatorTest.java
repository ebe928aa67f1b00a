package com.deva.user_directory_service.service;

import com.deva.user_directory_service.model.User;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UserValidatorTest {

    @Test
    void acceptsValidUser() {
        assertThat(UserValidator.validate(new User("David", 28))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 120})
    void acceptsAgeBounds(int age) {
        assertThat(UserValidator.validate(new User("Bob", age))).isEmpty();
    }

    @Test
    void rejectsTwoLetterName() {
        assertThat(UserValidator.validate(new User("Da", 28))).contains(ValidationError.NAME_TOO_SHORT);
    }

    @Test
    void shortnessIsMeasuredAfterTrimming() {
        assertThat(UserValidator.validate(new User("  Da  ", 28))).contains(ValidationError.NAME_TOO_SHORT);
    }

    @Test
    void rejectsBlankOrMissingName() {
        assertThat(UserValidator.validate(new User("   ", 28))).contains(ValidationError.NAME_EMPTY);
        assertThat(UserValidator.validate(new User("", 28))).contains(ValidationError.NAME_EMPTY);
        assertThat(UserValidator.validate(new User(null, 28))).contains(ValidationError.NAME_EMPTY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Da vid", "David\t", "Da\nvid"})
    void rejectsEmbeddedWhitespace(String name) {
        assertThat(UserValidator.validate(new User(name, 28))).contains(ValidationError.NAME_CONTAINS_WHITESPACE);
    }

    @ParameterizedTest
    @ValueSource(ints = {-5, -1, 121})
    void rejectsAgeOutsideRange(int age) {
        assertThat(UserValidator.validate(new User("David", age))).contains(ValidationError.AGE_OUT_OF_RANGE);
    }

    @Test
    void messagesMatchTheApiContract() {
        assertThat(ValidationError.NAME_TOO_SHORT.message())
                .isEqualTo("UserName must be at least 3 characters long and cannot be empty.");
        assertThat(ValidationError.NAME_CONTAINS_WHITESPACE.message()).isEqualTo("UserName cannot contain spaces.");
        assertThat(ValidationError.AGE_OUT_OF_RANGE.message()).isEqualTo("UserAge must be between 0 and 120.");
    }
}
