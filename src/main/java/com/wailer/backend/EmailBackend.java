package com.wailer.backend;

import com.wailer.model.OutgoingEmail;

import java.util.List;

/**
 * Delivers rendered emails through one provider.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; a single instance is shared by
 *       every sender.</li>
 *   <li>{@link #sendMessages} reports how many emails the provider accepted.
 *       Transport failures are logged and counted as not delivered instead of
 *       being thrown; callers compare the count with the batch size.</li>
 *   <li>A malformed address is a caller bug and is thrown as
 *       {@link com.wailer.error.InvalidAddressException}.</li>
 *   <li>Implementations must close their HTTP clients when {@link #close()} is called.</li>
 * </ul>
 */
public interface EmailBackend extends AutoCloseable {

    /** Provider name for logging (e.g. "mailjet", "mandrill"). */
    String providerName();

    /** Number of emails the provider accepted. */
    int sendMessages(List<OutgoingEmail> messages);

    /**
     * Returns {@code true} if this backend has the credentials it needs.
     * Checked at startup to fail fast.
     */
    boolean isConfigured();

    @Override
    void close();
}
