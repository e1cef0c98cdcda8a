package com.wailer.store;

import com.wailer.model.BaseMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe {@link MessageStore} kept in a {@link ConcurrentHashMap}.
 *
 * <p>Suitable for tests and single-process use; contents are lost on restart.
 */
public class InMemoryMessageStore<T extends BaseMessage> implements MessageStore<T> {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryMessageStore.class);

    private final Map<UUID, T> records = new ConcurrentHashMap<>();
    private final Class<T> type;

    public InMemoryMessageStore(final Class<T> type) {
        this.type = type;
    }

    @Override
    public void create(final T message) {
        final T previous = records.putIfAbsent(message.getId(), detach(message));
        if (previous != null) {
            throw new IllegalStateException(type.getSimpleName() + " " + message.getId() + " already exists");
        }
        LOG.debug("Created {} id={} type={}", type.getSimpleName(), message.getId(), message.getType());
    }

    @Override
    public Optional<T> findById(final UUID id) {
        return Optional.ofNullable(records.get(id)).map(this::detach);
    }

    @Override
    public void update(final T message) {
        final T replaced = records.computeIfPresent(message.getId(), (id, current) -> detach(message));
        if (replaced == null) {
            throw new IllegalStateException(type.getSimpleName() + " " + message.getId() + " does not exist");
        }
    }

    @Override
    public boolean delete(final UUID id) {
        return records.remove(id) != null;
    }

    @Override
    public int deleteByOwner(final Long ownerId) {
        final List<UUID> ids = records.values().stream()
                .filter(m -> Objects.equals(m.getOwnerId(), ownerId))
                .map(BaseMessage::getId)
                .collect(Collectors.toList());
        ids.forEach(records::remove);
        if (!ids.isEmpty()) {
            LOG.info("Deleted {} {} record(s) owned by userId={}", ids.size(), type.getSimpleName(), ownerId);
        }
        return ids.size();
    }

    @Override
    public List<T> findByOwner(final Long ownerId) {
        return records.values().stream()
                .filter(m -> Objects.equals(m.getOwnerId(), ownerId))
                .map(this::detach)
                .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }

    private T detach(final T message) {
        return type.cast(message.copy());
    }
}
