package com.wailer.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.wailer.backend.SmsBackend;
import com.wailer.model.OutgoingSms;
import com.wailer.model.Sms;
import com.wailer.store.MessageStore;
import com.wailer.type.MessageEnvironment;
import com.wailer.type.SmsType;
import com.wailer.type.TypeRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/** Sends SMS through an {@link SmsBackend}. */
public class SmsDispatcher extends AbstractDispatcher<Sms, SmsType> {

    private final SmsBackend backend;

    public SmsDispatcher(
            final TypeRegistry registry,
            final MessageEnvironment env,
            final MessageStore<Sms> store,
            final SmsBackend backend) {
        this(registry, env, store, backend, Clock.systemUTC());
    }

    public SmsDispatcher(
            final TypeRegistry registry,
            final MessageEnvironment env,
            final MessageStore<Sms> store,
            final SmsBackend backend,
            final Clock clock) {
        super(registry, env, store, clock);
        this.backend = backend;
    }

    @Override
    protected void checkRegistered(final String typeName) {
        registry.resolveSms(typeName);
    }

    @Override
    protected Sms newRecord(final String typeName, final JsonNode data, final Long ownerId, final Instant now) {
        return Sms.create(typeName, data, ownerId, now);
    }

    @Override
    protected SmsType instantiate(final Sms record) {
        return registry.resolveSms(record.getType()).create(record, env);
    }

    @Override
    protected int deliver(final SmsType type, final String sender, final String recipient) {
        return backend.sendMessages(List.of(new OutgoingSms(sender, List.of(recipient), type.content())));
    }

    @Override
    protected String kindName() {
        return "SMS";
    }
}
