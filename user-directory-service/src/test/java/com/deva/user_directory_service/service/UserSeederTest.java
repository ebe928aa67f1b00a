package com.deva.user_directory_service.service;

import com.deva.user_directory_service.config.UserDirectoryProperties;
import com.deva.user_directory_service.model.User;
import com.deva.user_directory_service.repository.UserStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UserSeederTest {

    /**
     * The runner only refreshes the context and never calls startup runners,
     * so a populated store here means seeding happened during bean initialization.
     */
    @Test
    void storeIsSeededOnceTheContextIsRefreshed() {
        new ApplicationContextRunner()
                .withBean(UserDirectoryProperties.class, () -> new UserDirectoryProperties(null, null, null, null))
                .withBean(UserStore.class)
                .withBean(UserSeeder.class)
                .run(context -> assertThat(context.getBean(UserStore.class).list())
                        .containsExactlyInAnyOrder(new User("Alice", 25), new User("Bob", 30), new User("Charlie", 35)));
    }

    @Test
    void seedKeepsExistingRecords() {
        UserStore store = new UserStore();
        store.insert("alice", new User("alice", 99));
        UserDirectoryProperties properties = new UserDirectoryProperties(null, null, null,
                List.of(new User("Alice", 25), new User("Dora", 50)));

        new UserSeeder(store, properties).seed();

        assertThat(store.get("Alice")).contains(new User("alice", 99));
        assertThat(store.get("Dora")).contains(new User("Dora", 50));
        assertThat(store.size()).isEqualTo(2);
    }
}
