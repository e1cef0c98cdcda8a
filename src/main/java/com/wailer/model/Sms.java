package com.wailer.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A sent (or about to be sent) SMS. The recipient is stored in E.164 form and
 * the sender may be empty when the provider picks one.
 */
public final class Sms extends BaseMessage {

    public Sms(final UUID id, final String type, final JsonNode data, final Long ownerId, final Instant createdAt) {
        super(id, type, data, ownerId, createdAt);
    }

    private Sms(final Sms other) {
        super(other);
    }

    public static Sms create(final String type, final JsonNode data, final Long ownerId, final Instant now) {
        return new Sms(UUID.randomUUID(), type, data, ownerId, now);
    }

    @Override
    public Sms copy() {
        return new Sms(this);
    }

    /** Relative link to view this SMS in a browser. */
    public String link() {
        return "/sms/" + getId() + ".txt";
    }
}
