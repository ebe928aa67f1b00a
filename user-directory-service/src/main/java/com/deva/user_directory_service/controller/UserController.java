package com.deva.user_directory_service.controller;

import com.deva.user_directory_service.model.ApiError;
import com.deva.user_directory_service.model.User;
import com.deva.user_directory_service.service.CreateResult;
import com.deva.user_directory_service.service.UpdateResult;
import com.deva.user_directory_service.service.UserDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Bodies are bound by hand so that unreadable JSON surfaces as a fault for the pipeline's
 * error stage instead of being answered by Spring MVC's own 400 handling.
 */
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserDirectory userDirectory;
    private final ObjectMapper objectMapper;

    public UserController(UserDirectory userDirectory, ObjectMapper objectMapper) {
        this.userDirectory = userDirectory;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public ResponseEntity<List<User>> getAllUsers() {
        return ResponseEntity.ok(userDirectory.list());
    }

    @GetMapping("/{username}")
    public ResponseEntity<User> getUser(@PathVariable("username") String username) {
        return userDirectory.find(username)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<?> createUser(@RequestBody(required = false) String body) throws IOException {
        CreateResult result = userDirectory.create(readUser(body));
        return switch (result.status()) {
            case CREATED -> {
                URI location = UriComponentsBuilder.fromPath("/users/{username}")
                        .buildAndExpand(result.user().userName())
                        .encode()
                        .toUri();
                yield ResponseEntity.created(location).body(result.user());
            }
            case INVALID, DUPLICATE -> ResponseEntity.badRequest().body(ApiError.of(result.message()));
        };
    }

    @PutMapping("/{username}")
    public ResponseEntity<?> updateUser(@PathVariable("username") String username,
                                        @RequestBody(required = false) String body) throws IOException {
        UpdateResult result = userDirectory.update(username, readUser(body));
        return switch (result.status()) {
            case UPDATED -> ResponseEntity.noContent().build();
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case INVALID, DUPLICATE -> ResponseEntity.badRequest().body(ApiError.of(result.message()));
        };
    }

    @DeleteMapping("/{username}")
    public ResponseEntity<Void> deleteUser(@PathVariable("username") String username) {
        return userDirectory.delete(username)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private User readUser(String body) throws IOException {
        User user = objectMapper.readValue(body != null ? body : "", User.class);
        if (user == null) {
            throw new IllegalArgumentException("Request body must be a JSON object.");
        }
        return user;
    }
}
