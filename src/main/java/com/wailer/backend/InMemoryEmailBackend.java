package com.wailer.backend;

import com.wailer.model.OutgoingEmail;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps emails in an outbox instead of sending them. Every email counts as
 * delivered. Meant for tests and local development.
 */
public class InMemoryEmailBackend implements EmailBackend {

    private final List<OutgoingEmail> outbox = new ArrayList<>();

    @Override public String providerName() { return "memory"; }
    @Override public boolean isConfigured() { return true; }

    @Override
    public synchronized int sendMessages(final List<OutgoingEmail> messages) {
        outbox.addAll(messages);
        return messages.size();
    }

    /** Snapshot of everything sent so far, oldest first. */
    public synchronized List<OutgoingEmail> outbox() {
        return List.copyOf(outbox);
    }

    public synchronized OutgoingEmail last() {
        if (outbox.isEmpty()) throw new IllegalStateException("Outbox is empty");
        return outbox.get(outbox.size() - 1);
    }

    public synchronized void clear() {
        outbox.clear();
    }

    @Override
    public void close() {}
}
