package com.wailer.type;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wailer.model.BaseMessage;

import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * Common contract of email and SMS types.
 *
 * <p>A type instance is bound to one stored message and is cheap to create: the
 * dispatchers build a fresh one for every send, re-send and re-display. It may
 * cache lookups in its own fields (a user loaded from {@code data}), but must
 * not keep any other state.
 *
 * <h2>Context</h2>
 * {@link #computeContext()} is called exactly once in the life of a message,
 * when it is first sent. Its result is frozen into the message as JSON and is
 * what every later rendering reads through {@link #context()}. Anything that
 * must look the same when the message is displayed again in a month belongs in
 * there; {@link #to()} and {@link #from()} on the other hand are re-evaluated at
 * each send, so an updated address is honoured by a re-send.
 */
public abstract class MessageType<R extends BaseMessage> {

    private final R                  record;
    private final MessageEnvironment env;
    private final JsonNode           data;

    protected MessageType(final R record, final MessageEnvironment env) {
        this.record = record;
        this.env    = env;
        this.data   = record.getData();
    }

    /** Locale that is active while this message is rendered and sent. */
    public abstract Locale locale();

    /** Recipient: an email address, or a phone number in E.164 form. */
    public abstract String to();

    /** Sender: an email address, or an SMS originator (possibly empty). */
    public abstract String from();

    /**
     * Builds the context from {@link #data()} and whatever live lookup is
     * needed. Values must be JSON-serialisable.
     */
    public abstract Map<String, Object> computeContext();

    public R record() {
        return record;
    }

    protected MessageEnvironment env() {
        return env;
    }

    /** The caller-supplied data this message was sent with. */
    public JsonNode data() {
        return data;
    }

    /**
     * The frozen context.
     *
     * @throws IllegalStateException if called before the context was computed
     */
    public ObjectNode context() {
        final ObjectNode context = record.getContext();
        if (context == null) {
            throw new IllegalStateException("Context of message " + record.getId() + " is not frozen yet");
        }
        return context;
    }

    protected String contextText(final String key) {
        return context().path(key).asText();
    }

    protected String dataText(final String key) {
        return data.path(key).asText();
    }

    /** Localised string in the active locale. */
    protected String translate(final String key, final Object... args) {
        return env.translations().translate(key, args);
    }

    /** Absolute origin that relative links are resolved against. */
    public String baseUrl() {
        return env.baseUrls().resolve();
    }

    /** Turns a path such as {@code "/"} or {@code "/account"} into an absolute URL. */
    public String makeAbsolute(final String path) {
        final String base = baseUrl();
        return URI.create(base.endsWith("/") ? base : base + "/").resolve(path).toString();
    }
}
