package com.wailer.model;

import java.util.List;
import java.util.Objects;

/** Immutable, rendered SMS handed over to an {@link com.wailer.backend.SmsBackend}. */
public final class OutgoingSms {

    private final String       originator;  // may be empty: let the provider decide
    private final List<String> recipients;  // E.164
    private final String       body;

    public OutgoingSms(final String originator, final List<String> recipients, final String body) {
        this.originator = originator != null ? originator : "";
        this.recipients = List.copyOf(recipients);
        this.body       = Objects.requireNonNull(body, "body");
    }

    public String       getOriginator() { return originator; }
    public List<String> getRecipients() { return recipients; }
    public String       getBody()       { return body; }

    @Override
    public String toString() {
        return "OutgoingSms{originator=" + originator
             + ", recipients=" + recipients.size()
             + ", length=" + body.length() + "}";
    }
}
