package com.wailer.backend;

import com.wailer.model.OutgoingSms;

import java.util.List;

/**
 * Delivers rendered SMS through one provider. Same contract as
 * {@link EmailBackend}: thread-safe, failures reported through the count.
 */
public interface SmsBackend extends AutoCloseable {

    String providerName();

    /**
     * Number of deliveries the provider accepted. Backends that fan a message
     * out to one call per recipient count each recipient separately.
     */
    int sendMessages(List<OutgoingSms> messages);

    boolean isConfigured();

    @Override
    void close();
}
