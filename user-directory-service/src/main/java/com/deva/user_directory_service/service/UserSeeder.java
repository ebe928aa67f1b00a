package com.deva.user_directory_service.service;

import com.deva.user_directory_service.config.UserDirectoryProperties;
import com.deva.user_directory_service.model.User;
import com.deva.user_directory_service.repository.UserStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fills the store while the context is still starting, so the web server never serves an empty directory.
 */
@Component
public class UserSeeder {
    private static final Logger log = LoggerFactory.getLogger(UserSeeder.class);

    private final UserStore userStore;
    private final UserDirectoryProperties properties;

    public UserSeeder(UserStore userStore, UserDirectoryProperties properties) {
        this.userStore = userStore;
        this.properties = properties;
    }

    @PostConstruct
    public void seed() {
        for (User user : properties.seed()) {
            if (!userStore.insert(user.userName(), user)) {
                log.warn("Seed user {} skipped, name already present", user.userName());
            }
        }
        log.info("User store seeded with {} users", userStore.size());
    }
}
