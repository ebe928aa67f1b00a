package com.deva.user_directory_service.service;

import com.deva.user_directory_service.model.User;
import com.deva.user_directory_service.repository.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class UserDirectory {
    static final String DUPLICATE_MESSAGE = "A user with the same username already exists.";

    private static final Logger log = LoggerFactory.getLogger(UserDirectory.class);

    private final UserStore userStore;

    public UserDirectory(UserStore userStore) {
        this.userStore = userStore;
    }

    public List<User> list() {
        return userStore.list();
    }

    public Optional<User> find(String name) {
        return userStore.get(name);
    }

    public CreateResult create(User candidate) {
        Optional<ValidationError> error = UserValidator.validate(candidate);
        if (error.isPresent()) {
            return CreateResult.invalid(error.get());
        }
        if (!userStore.insert(candidate.userName(), candidate)) {
            log.debug("create rejected, {} already exists", candidate.userName());
            return CreateResult.duplicate();
        }
        return CreateResult.created(candidate);
    }

    public UpdateResult update(String name, User candidate) {
        Optional<ValidationError> error = UserValidator.validate(candidate);
        if (error.isPresent()) {
            return UpdateResult.invalid(error.get());
        }
        return switch (userStore.replace(name, candidate)) {
            case REPLACED -> UpdateResult.updated();
            case NOT_FOUND -> UpdateResult.notFound();
            case NAME_TAKEN -> UpdateResult.duplicate();
        };
    }

    public boolean delete(String name) {
        return userStore.remove(name);
    }
}
