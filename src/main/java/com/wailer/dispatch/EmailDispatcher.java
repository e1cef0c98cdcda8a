package com.wailer.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.wailer.backend.EmailBackend;
import com.wailer.model.Email;
import com.wailer.model.OutgoingEmail;
import com.wailer.store.MessageStore;
import com.wailer.type.EmailType;
import com.wailer.type.MessageEnvironment;
import com.wailer.type.TypeRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Sends emails through an {@link EmailBackend}.
 *
 * <p>The text and HTML parts are both optional: a part whose template the type
 * does not define is left out of the outgoing email.
 */
public class EmailDispatcher extends AbstractDispatcher<Email, EmailType> {

    private final EmailBackend backend;

    public EmailDispatcher(
            final TypeRegistry registry,
            final MessageEnvironment env,
            final MessageStore<Email> store,
            final EmailBackend backend) {
        this(registry, env, store, backend, Clock.systemUTC());
    }

    public EmailDispatcher(
            final TypeRegistry registry,
            final MessageEnvironment env,
            final MessageStore<Email> store,
            final EmailBackend backend,
            final Clock clock) {
        super(registry, env, store, clock);
        this.backend = backend;
    }

    @Override
    protected void checkRegistered(final String typeName) {
        registry.resolveEmail(typeName);
    }

    @Override
    protected Email newRecord(final String typeName, final JsonNode data, final Long ownerId, final Instant now) {
        return Email.create(typeName, data, ownerId, now);
    }

    @Override
    protected EmailType instantiate(final Email record) {
        return registry.resolveEmail(record.getType()).create(record, env);
    }

    @Override
    protected int deliver(final EmailType type, final String sender, final String recipient) {
        final OutgoingEmail.Builder email = OutgoingEmail.builder(sender)
                .to(recipient)
                .subject(type.subject())
                .text(optionalPart(type::textContent))
                .html(optionalPart(type::htmlContent));
        type.attachments().forEach(email::attach);
        type.headers().forEach(email::header);

        return backend.sendMessages(List.of(email.build()));
    }

    @Override
    protected String kindName() {
        return "Email";
    }

    /** Renders one part, or returns null when the type has no template for it. */
    static String optionalPart(final Part part) {
        try {
            return part.render();
        } catch (UnsupportedOperationException e) {
            return null;
        }
    }

    @FunctionalInterface
    interface Part {
        String render();
    }
}
