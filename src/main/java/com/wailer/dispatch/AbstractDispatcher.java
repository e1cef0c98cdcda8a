package com.wailer.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wailer.error.TemplateException;
import com.wailer.model.BaseMessage;
import com.wailer.model.User;
import com.wailer.render.LocaleContext;
import com.wailer.store.MessageStore;
import com.wailer.type.MessageEnvironment;
import com.wailer.type.MessageType;
import com.wailer.type.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongConsumer;

/**
 * Send pipeline shared by emails and SMS.
 *
 * <h2>send</h2>
 * <ol>
 *   <li>Resolve the type name; an unknown name fails before anything is stored.</li>
 *   <li>Create the record and a type instance bound to it.</li>
 *   <li>Compute the context once and freeze it into the record.</li>
 *   <li>Persist the record, then deliver it with {@link #sendNow}.</li>
 * </ol>
 *
 * <h2>sendNow</h2>
 * Renders the record from its frozen context under the type's locale and hands
 * it to the backend. Recipient and sender are asked again from the type, so a
 * re-send reaches the current address. A failure while rendering or delivering
 * propagates and leaves {@code sentAt} untouched; the record stays stored.
 *
 * <p>A dispatcher registers a deletion listener on the environment's user
 * directory for as long as it is open; {@link #close} removes it.
 */
public abstract class AbstractDispatcher<R extends BaseMessage, T extends MessageType<R>>
        implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractDispatcher.class);

    protected final TypeRegistry       registry;
    protected final MessageEnvironment env;
    protected final MessageStore<R>    store;
    private final Clock                clock;
    private final LongConsumer         ownerCascade;

    protected AbstractDispatcher(
            final TypeRegistry registry,
            final MessageEnvironment env,
            final MessageStore<R> store,
            final Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.env      = Objects.requireNonNull(env, "env");
        this.store    = Objects.requireNonNull(store, "store");
        this.clock    = Objects.requireNonNull(clock, "clock");

        this.ownerCascade = store::deleteByOwner;
        env.users().addDeletionListener(ownerCascade);
    }

    /**
     * Stops deleting this dispatcher's messages when their owner is deleted.
     * The backend is not closed; whoever built it owns it.
     */
    @Override
    public void close() {
        env.users().removeDeletionListener(ownerCascade);
    }

    // ── Hooks ─────────────────────────────────────────────────────────────────

    /** Fails with {@link com.wailer.error.ConfigurationException} if the name is unknown. */
    protected abstract void checkRegistered(String typeName);

    protected abstract R newRecord(String typeName, JsonNode data, Long ownerId, Instant now);

    protected abstract T instantiate(R record);

    /** Renders the message and submits it. Returns the count the backend reported. */
    protected abstract int deliver(T type, String sender, String recipient);

    protected abstract String kindName();

    // ── Pipeline ──────────────────────────────────────────────────────────────

    public R send(final String typeName, final Object data) {
        return send(typeName, data, null);
    }

    /**
     * Creates, stores and delivers a new message.
     *
     * @param data  any value Jackson can turn into JSON; it is stored with the record
     * @param owner user the message belongs to, deleted along with them; may be null
     */
    public R send(final String typeName, final Object data, final User owner) {
        checkRegistered(typeName);

        final JsonNode tree = env.mapper().valueToTree(data);
        final R record = newRecord(typeName, tree, owner != null ? owner.getId() : null, clock.instant());
        final T type = instantiate(record);

        record.setAddressing(type.from(), type.to());
        record.freezeContext(freeze(type));
        store.create(record);

        LOG.info("{} created: id={} type={}", kindName(), record.getId(), typeName);
        return sendNow(record);
    }

    /**
     * Delivers a stored record, again or for the first time.
     *
     * @return the record as stored after the send
     */
    public R sendNow(final R record) {
        final T type = instantiate(record);

        try (LocaleContext.Scope ignored = LocaleContext.override(type.locale())) {
            final String recipient = type.to();
            final String sender    = type.from();

            final int delivered = deliver(type, sender, recipient);
            if (delivered == 0) {
                LOG.warn("{} not accepted by backend: id={} type={}", kindName(), record.getId(), record.getType());
            } else {
                LOG.info("{} sent: id={} type={} delivered={}", kindName(), record.getId(), record.getType(), delivered);
            }

            record.markSent(sender, recipient, clock.instant());
        }

        store.update(record);
        return record;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private ObjectNode freeze(final T type) {
        final Map<String, Object> context = type.computeContext();
        if (context == null) {
            return env.mapper().createObjectNode();
        }
        try {
            return env.mapper().valueToTree(context);
        } catch (IllegalArgumentException e) {
            throw new TemplateException("Context of " + kindName() + " type '"
                    + type.record().getType() + "' cannot be stored as JSON", e);
        }
    }
}
