package com.wailer.store;

import com.wailer.model.User;

import java.util.Optional;
import java.util.function.LongConsumer;

/**
 * Looks up users for message types that address or greet them.
 *
 * <p>Deleting a user notifies the registered deletion listeners; the
 * dispatchers use this to delete every message owned by that user.
 */
public interface UserDirectory {

    Optional<User> find(Long userId);

    /** Returns true if the user existed. Listeners are only notified in that case. */
    boolean delete(Long userId);

    void addDeletionListener(LongConsumer listener);

    /** Removes a listener previously added, compared by identity. */
    void removeDeletionListener(LongConsumer listener);
}
