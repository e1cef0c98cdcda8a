package com.wailer.backend;

import com.wailer.model.OutgoingSms;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps SMS in an outbox instead of sending them. Every message counts as
 * delivered. Meant for tests and local development.
 */
public class InMemorySmsBackend implements SmsBackend {

    private final List<OutgoingSms> outbox = new ArrayList<>();

    @Override public String providerName() { return "memory"; }
    @Override public boolean isConfigured() { return true; }

    @Override
    public synchronized int sendMessages(final List<OutgoingSms> messages) {
        outbox.addAll(messages);
        return messages.size();
    }

    public synchronized List<OutgoingSms> outbox() {
        return List.copyOf(outbox);
    }

    public synchronized OutgoingSms last() {
        if (outbox.isEmpty()) throw new IllegalStateException("Outbox is empty");
        return outbox.get(outbox.size() - 1);
    }

    public synchronized void clear() {
        outbox.clear();
    }

    @Override
    public void close() {}
}
