package com.wailer.store;

import com.wailer.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongConsumer;

/**
 * {@link UserDirectory} kept in memory. Users are stored by reference, so
 * changing a saved {@link User} is immediately visible to lookups, the way a
 * database row would be after an update.
 */
public class InMemoryUserDirectory implements UserDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryUserDirectory.class);

    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final List<LongConsumer> deletionListeners = new CopyOnWriteArrayList<>();

    public User save(final User user) {
        users.put(user.getId(), user);
        return user;
    }

    @Override
    public Optional<User> find(final Long userId) {
        if (userId == null) return Optional.empty();
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public boolean delete(final Long userId) {
        if (userId == null || users.remove(userId) == null) return false;

        LOG.info("User deleted: userId={}", userId);
        for (final LongConsumer listener : deletionListeners) {
            listener.accept(userId);
        }
        return true;
    }

    @Override
    public void addDeletionListener(final LongConsumer listener) {
        deletionListeners.add(listener);
    }

    @Override
    public void removeDeletionListener(final LongConsumer listener) {
        deletionListeners.remove(listener);
    }

    public int deletionListenerCount() {
        return deletionListeners.size();
    }
}
