package com.wailer.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A sent (or about to be sent) email, with what is needed to render it again.
 */
public final class Email extends BaseMessage {

    public Email(final UUID id, final String type, final JsonNode data, final Long ownerId, final Instant createdAt) {
        super(id, type, data, ownerId, createdAt);
    }

    private Email(final Email other) {
        super(other);
    }

    public static Email create(final String type, final JsonNode data, final Long ownerId, final Instant now) {
        return new Email(UUID.randomUUID(), type, data, ownerId, now);
    }

    @Override
    public Email copy() {
        return new Email(this);
    }

    /** Relative link to view this email in a browser, as HTML. */
    public String htmlLink() {
        return "/emails/" + getId() + ".html";
    }

    /** Relative link to view this email in a browser, as plain text. */
    public String textLink() {
        return "/emails/" + getId() + ".txt";
    }
}
