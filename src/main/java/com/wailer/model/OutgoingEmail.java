package com.wailer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, fully rendered email handed over to an
 * {@link com.wailer.backend.EmailBackend}.
 *
 * <p>Addresses are kept in their raw {@code "Name <addr@example.com>"} form;
 * each backend parses them into its own wire format. Either of the text and
 * HTML parts may be absent, but a well-formed email has at least one.
 */
public final class OutgoingEmail {

    private final String              from;
    private final List<String>        to;
    private final List<String>        cc;
    private final List<String>        bcc;
    private final String              subject;
    private final String              text;   // null when the type has no text part
    private final String              html;   // null when the type has no HTML part
    private final List<Attachment>    attachments;
    private final Map<String, String> headers;

    private OutgoingEmail(final Builder b) {
        this.from        = Objects.requireNonNull(b.from, "from");
        this.to          = List.copyOf(b.to);
        this.cc          = List.copyOf(b.cc);
        this.bcc         = List.copyOf(b.bcc);
        this.subject     = b.subject != null ? b.subject : "";
        this.text        = b.text;
        this.html        = b.html;
        this.attachments = List.copyOf(b.attachments);
        this.headers     = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
    }

    public static Builder builder(final String from) {
        return new Builder(from);
    }

    public static final class Builder {
        private final String from;
        private final List<String> to  = new ArrayList<>();
        private final List<String> cc  = new ArrayList<>();
        private final List<String> bcc = new ArrayList<>();
        private String subject;
        private String text;
        private String html;
        private final List<Attachment> attachments = new ArrayList<>();
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String from) {
            this.from = from;
        }

        public Builder to(final String... addresses)  { to.addAll(List.of(addresses));  return this; }
        public Builder cc(final String... addresses)  { cc.addAll(List.of(addresses));  return this; }
        public Builder bcc(final String... addresses) { bcc.addAll(List.of(addresses)); return this; }
        public Builder subject(final String v)        { this.subject = v; return this; }
        public Builder text(final String v)           { this.text = v; return this; }
        public Builder html(final String v)           { this.html = v; return this; }

        public Builder attach(final Attachment attachment) {
            attachments.add(attachment);
            return this;
        }

        public Builder header(final String name, final String value) {
            headers.put(name, value);
            return this;
        }

        public OutgoingEmail build() { return new OutgoingEmail(this); }
    }

    public String              getFrom()        { return from; }
    public List<String>        getTo()          { return to; }
    public List<String>        getCc()          { return cc; }
    public List<String>        getBcc()         { return bcc; }
    public String              getSubject()     { return subject; }
    public String              getText()        { return text; }
    public String              getHtml()        { return html; }
    public List<Attachment>    getAttachments() { return attachments; }
    public Map<String, String> getHeaders()     { return headers; }

    public boolean hasText() { return text != null && !text.isEmpty(); }
    public boolean hasHtml() { return html != null && !html.isEmpty(); }

    @Override
    public String toString() {
        return "OutgoingEmail{to=" + to.size() + " recipient(s)"
             + ", subject=" + subject
             + ", text=" + hasText()
             + ", html=" + hasHtml()
             + ", attachments=" + attachments.size() + "}";
    }
}
