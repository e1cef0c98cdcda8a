package com.wailer.type;

import com.wailer.config.WailerConfig;
import com.wailer.error.ConfigurationException;
import com.wailer.model.BaseMessage;
import com.wailer.model.Email;
import com.wailer.model.Sms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps logical type names ({@code "hello"}, {@code "password-reset"}) to the
 * factories of their email or SMS type.
 *
 * <p>Immutable once built. Types are registered either in code:
 * <pre>{@code
 * TypeRegistry.builder()
 *         .email("hello", Hello::new)
 *         .sms("hello", HelloSms::new)
 *         .build();
 * }</pre>
 * or from {@code wailer.email-types} / {@code wailer.sms-types}, where each
 * entry names a class with a {@code (Email|Sms, MessageEnvironment)}
 * constructor. Every configured class is checked when the registry is built,
 * so a typo stops the application at startup instead of at the first send.
 */
public final class TypeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<String, MessageTypeFactory<Email, EmailType>> emailTypes;
    private final Map<String, MessageTypeFactory<Sms, SmsType>>     smsTypes;

    private TypeRegistry(final Builder b) {
        this.emailTypes = Collections.unmodifiableMap(new LinkedHashMap<>(b.emailTypes));
        this.smsTypes   = Collections.unmodifiableMap(new LinkedHashMap<>(b.smsTypes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the registry from configuration.
     *
     * @throws ConfigurationException if a class is missing, has the wrong supertype or no usable constructor
     */
    public static TypeRegistry fromConfig(final WailerConfig config) {
        final Builder builder = builder();
        config.getEmailTypes().forEach((name, className) ->
                builder.email(name, reflectiveFactory(name, className, EmailType.class, Email.class)));
        config.getSmsTypes().forEach((name, className) ->
                builder.sms(name, reflectiveFactory(name, className, SmsType.class, Sms.class)));

        final TypeRegistry registry = builder.build();
        LOG.info("Message types registered: email={} sms={}",
                registry.names(MessageKind.EMAIL), registry.names(MessageKind.SMS));
        return registry;
    }

    /**
     * Looks up the factory for {@code typeName}.
     *
     * @throws ConfigurationException if the name is not registered for that kind
     */
    public MessageTypeFactory<?, ?> resolve(final MessageKind kind, final String typeName) {
        return kind == MessageKind.EMAIL ? resolveEmail(typeName) : resolveSms(typeName);
    }

    public MessageTypeFactory<Email, EmailType> resolveEmail(final String typeName) {
        return lookup(emailTypes, MessageKind.EMAIL, typeName);
    }

    public MessageTypeFactory<Sms, SmsType> resolveSms(final String typeName) {
        return lookup(smsTypes, MessageKind.SMS, typeName);
    }

    public boolean contains(final MessageKind kind, final String typeName) {
        return (kind == MessageKind.EMAIL ? emailTypes : smsTypes).containsKey(typeName);
    }

    public Set<String> names(final MessageKind kind) {
        return (kind == MessageKind.EMAIL ? emailTypes : smsTypes).keySet();
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static final class Builder {
        private final Map<String, MessageTypeFactory<Email, EmailType>> emailTypes = new LinkedHashMap<>();
        private final Map<String, MessageTypeFactory<Sms, SmsType>>     smsTypes   = new LinkedHashMap<>();

        private Builder() {}

        public Builder email(final String name, final MessageTypeFactory<Email, EmailType> factory) {
            register(emailTypes, MessageKind.EMAIL, name, factory);
            return this;
        }

        public Builder sms(final String name, final MessageTypeFactory<Sms, SmsType> factory) {
            register(smsTypes, MessageKind.SMS, name, factory);
            return this;
        }

        public TypeRegistry build() { return new TypeRegistry(this); }

        private static <F> void register(
                final Map<String, F> target,
                final MessageKind kind,
                final String name,
                final F factory) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException(kind + " type name must not be blank");
            }
            if (factory == null) {
                throw new ConfigurationException(kind + " type '" + name + "' has no factory");
            }
            if (target.putIfAbsent(name, factory) != null) {
                throw new ConfigurationException(kind + " type '" + name + "' is registered twice");
            }
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static <F> F lookup(final Map<String, F> types, final MessageKind kind, final String typeName) {
        final F factory = types.get(typeName);
        if (factory == null) {
            throw new ConfigurationException("Unknown " + kind + " type '" + typeName
                    + "'; registered: " + types.keySet());
        }
        return factory;
    }

    private static <R extends BaseMessage, T extends MessageType<R>> MessageTypeFactory<R, T> reflectiveFactory(
            final String name,
            final String className,
            final Class<T> supertype,
            final Class<R> recordType) {
        final Class<?> raw;
        try {
            raw = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Type '" + name + "': class " + className + " not found", e);
        }
        if (!supertype.isAssignableFrom(raw)) {
            throw new ConfigurationException("Type '" + name + "': " + className
                    + " does not extend " + supertype.getSimpleName());
        }

        final Constructor<? extends T> constructor;
        try {
            constructor = raw.asSubclass(supertype).getConstructor(recordType, MessageEnvironment.class);
        } catch (NoSuchMethodException e) {
            throw new ConfigurationException("Type '" + name + "': " + className + " needs a public ("
                    + recordType.getSimpleName() + ", MessageEnvironment) constructor", e);
        }

        return (record, env) -> {
            try {
                return constructor.newInstance(record, env);
            } catch (InvocationTargetException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw new ConfigurationException("Type '" + name + "': constructor failed", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new ConfigurationException("Type '" + name + "': cannot instantiate " + className, e);
            }
        };
    }
}
