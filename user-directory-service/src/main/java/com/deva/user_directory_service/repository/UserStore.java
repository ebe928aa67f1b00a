package com.deva.user_directory_service.repository;

import com.deva.user_directory_service.model.User;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread-safe in-memory user table keyed by case-insensitive user name.
 *
 * Values are immutable {@link User} records, so an update swaps the whole value
 * and readers never see a half-written record.
 *
 * Single-key operations share the read side of {@link #rekeyLock} and rely on the map's per-key atomicity.
 * Moving a record to a new key touches two keys, so it holds the write side: no reader or writer
 * observes the record under both names, or under neither.
 */
@Repository
public class UserStore {

    public enum ReplaceOutcome {
        REPLACED,
        NOT_FOUND,
        NAME_TAKEN
    }

    private final ConcurrentMap<String, User> users = new ConcurrentHashMap<>();
    private final ReadWriteLock rekeyLock = new ReentrantReadWriteLock();

    public List<User> list() {
        return shared(() -> List.copyOf(users.values()));
    }

    public Optional<User> get(String name) {
        return shared(() -> Optional.ofNullable(users.get(key(name))));
    }

    public boolean insert(String name, User user) {
        return shared(() -> users.putIfAbsent(key(name), user) == null);
    }

    public boolean remove(String name) {
        return shared(() -> users.remove(key(name)) != null);
    }

    public ReplaceOutcome replace(String name, User user) {
        String oldKey = key(name);
        String newKey = key(user.userName());

        if (oldKey.equals(newKey)) {
            return shared(() -> users.computeIfPresent(oldKey, (k, existing) -> user) != null
                    ? ReplaceOutcome.REPLACED
                    : ReplaceOutcome.NOT_FOUND);
        }
        return exclusive(() -> {
            if (!users.containsKey(oldKey)) {
                return ReplaceOutcome.NOT_FOUND;
            }
            if (users.putIfAbsent(newKey, user) != null) {
                return ReplaceOutcome.NAME_TAKEN;
            }
            users.remove(oldKey);
            return ReplaceOutcome.REPLACED;
        });
    }

    public int size() {
        return shared(users::size);
    }

    public void clear() {
        exclusive(() -> {
            users.clear();
            return null;
        });
    }

    private <T> T shared(Supplier<T> action) {
        return locked(rekeyLock.readLock(), action);
    }

    private <T> T exclusive(Supplier<T> action) {
        return locked(rekeyLock.writeLock(), action);
    }

    private static <T> T locked(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
