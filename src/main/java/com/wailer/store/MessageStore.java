package com.wailer.store;

import com.wailer.model.BaseMessage;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for sent messages.
 *
 * <p>Implementations hand out detached copies: changing a record returned by
 * {@link #findById} has no effect until it is passed to {@link #update}.
 */
public interface MessageStore<T extends BaseMessage> {

    /**
     * Persists a new record.
     *
     * @throws IllegalStateException if a record with the same id already exists
     */
    void create(T message);

    Optional<T> findById(UUID id);

    /**
     * Replaces the stored record with the same id.
     *
     * @throws IllegalStateException if no such record exists (it may have been deleted meanwhile)
     */
    void update(T message);

    boolean delete(UUID id);

    /** Deletes every record owned by {@code ownerId}; returns how many were removed. */
    int deleteByOwner(Long ownerId);

    List<T> findByOwner(Long ownerId);
}
