package com.wailer.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Fields shared by stored emails and SMS.
 *
 * <p>{@code data} is the caller's input and {@code context} is the snapshot
 * computed from it once, at send time. Both are held as private deep copies:
 * mutating a node handed out by a getter never changes the record. The context
 * can be frozen only once; afterwards every rendering of this message reads the
 * same values, whatever happened to the entities it was computed from.
 */
public abstract class BaseMessage {

    private final UUID    id;
    private final String  type;
    private final JsonNode data;
    private final Long    ownerId;   // user owning this message, for cascade deletion only
    private final Instant createdAt;

    private ObjectNode context;
    private String     sender;
    private String     recipient;
    private Instant    sentAt;

    protected BaseMessage(
            final UUID id,
            final String type,
            final JsonNode data,
            final Long ownerId,
            final Instant createdAt) {
        this.id        = Objects.requireNonNull(id, "id");
        this.type      = Objects.requireNonNull(type, "type");
        this.data      = data == null ? NullNode.getInstance() : data.deepCopy();
        this.ownerId   = ownerId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    protected BaseMessage(final BaseMessage other) {
        this(other.id, other.type, other.data, other.ownerId, other.createdAt);
        this.context   = other.context == null ? null : other.context.deepCopy();
        this.sender    = other.sender;
        this.recipient = other.recipient;
        this.sentAt    = other.sentAt;
    }

    /** Detached copy, used by stores so that callers never share state with them. */
    public abstract BaseMessage copy();

    public UUID     getId()        { return id; }
    public String   getType()      { return type; }
    public JsonNode getData()      { return data.deepCopy(); }
    public Long     getOwnerId()   { return ownerId; }
    public Instant  getCreatedAt() { return createdAt; }
    public String   getSender()    { return sender; }
    public String   getRecipient() { return recipient; }
    public Instant  getSentAt()    { return sentAt; }

    public ObjectNode getContext() {
        return context == null ? null : context.deepCopy();
    }

    public boolean isContextFrozen() {
        return context != null;
    }

    public boolean isSent() {
        return sentAt != null;
    }

    /**
     * Stores the rendering context. Can only happen once per message.
     *
     * @throws IllegalStateException if the context was already frozen
     */
    public void freezeContext(final ObjectNode value) {
        if (context != null) {
            throw new IllegalStateException("Context of message " + id + " is already frozen");
        }
        this.context = Objects.requireNonNull(value, "context").deepCopy();
    }

    public void setAddressing(final String sender, final String recipient) {
        this.sender    = sender;
        this.recipient = recipient;
    }

    public void markSent(final String sender, final String recipient, final Instant at) {
        setAddressing(sender, recipient);
        this.sentAt = Objects.requireNonNull(at, "at");
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((BaseMessage) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id
             + ", type=" + type
             + ", sentAt=" + sentAt + "}";
    }
}
