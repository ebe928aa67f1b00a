package com.deva.user_directory_service.service;

import com.deva.user_directory_service.model.User;
import com.deva.user_directory_service.repository.UserStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class UserDirectoryTest {

    private UserStore store;
    private UserDirectory directory;

    @BeforeEach
    void setUp() {
        store = new UserStore();
        directory = new UserDirectory(store);
        store.insert("Alice", new User("Alice", 25));
    }

    @Test
    void createdUserCanBeReadBackUnchanged() {
        User david = new User("David", 28);

        CreateResult result = directory.create(david);

        assertThat(result.status()).isEqualTo(CreateResult.Status.CREATED);
        assertThat(result.user()).isEqualTo(david);
        assertThat(directory.find("David")).contains(david);
    }

    @Test
    void secondCreateWithSameNameInAnyCaseIsDuplicate() {
        CreateResult result = directory.create(new User("ALICE", 40));

        assertThat(result.status()).isEqualTo(CreateResult.Status.DUPLICATE);
        assertThat(result.message()).isEqualTo("A user with the same username already exists.");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void invalidCreateDoesNotTouchStore() {
        CreateResult result = directory.create(new User("Da", 28));

        assertThat(result.status()).isEqualTo(CreateResult.Status.INVALID);
        assertThat(result.message()).isEqualTo(ValidationError.NAME_TOO_SHORT.message());
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void updateOfAbsentUserIsNotFound() {
        UpdateResult result = directory.update("Zed", new User("Zed", 30));

        assertThat(result.status()).isEqualTo(UpdateResult.Status.NOT_FOUND);
        assertThat(store.list()).containsExactly(new User("Alice", 25));
    }

    @Test
    void updateValidatesBeforeLookingUp() {
        UpdateResult result = directory.update("Zed", new User("Zed", 121));

        assertThat(result.status()).isEqualTo(UpdateResult.Status.INVALID);
        assertThat(result.message()).isEqualTo(ValidationError.AGE_OUT_OF_RANGE.message());
    }

    @Test
    void renameMovesUserToNewName() {
        UpdateResult result = directory.update("alice", new User("AliceUpdated", 26));

        assertThat(result.status()).isEqualTo(UpdateResult.Status.UPDATED);
        assertThat(directory.find("AliceUpdated")).contains(new User("AliceUpdated", 26));
        assertThat(directory.find("Alice")).isEmpty();
    }

    @Test
    void renameOntoExistingUserIsDuplicate() {
        directory.create(new User("Bob", 30));

        UpdateResult result = directory.update("Alice", new User("Bob", 26));

        assertThat(result.status()).isEqualTo(UpdateResult.Status.DUPLICATE);
        assertThat(directory.find("Alice")).contains(new User("Alice", 25));
    }

    @Test
    void secondDeleteIsNotFound() {
        assertThat(directory.delete("Alice")).isTrue();
        assertThat(directory.delete("Alice")).isFalse();
    }

    @Test
    void parallelCreatesOfSameNameProduceExactlyOneUser() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CreateResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return directory.create(new User("David", 28));
                }));
            }
            start.countDown();

            List<CreateResult> results = new ArrayList<>();
            for (Future<CreateResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            assertThat(results).filteredOn(r -> r.status() == CreateResult.Status.CREATED).hasSize(1);
            assertThat(results).filteredOn(r -> r.status() == CreateResult.Status.DUPLICATE).hasSize(callers - 1);
            assertThat(directory.list()).filteredOn(u -> u.userName().equals("David")).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
