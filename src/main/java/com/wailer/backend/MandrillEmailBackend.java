package com.wailer.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wailer.model.Attachment;
import com.wailer.model.EmailAddress;
import com.wailer.model.OutgoingEmail;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Email backend backed by the Mandrill (Mailchimp Transactional) messages API.
 *
 * <p>Mandrill has no batch endpoint for distinct messages, so each email is one
 * call. Recipients are a single list where each entry is tagged {@code to},
 * {@code cc} or {@code bcc}. An email counts as delivered only if the call
 * succeeded and Mandrill reports {@code "sent"} for every recipient; queued,
 * rejected and invalid recipients make the whole email count as failed.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code MANDRILL_API_KEY}, sent in the request body</li>
 * </ul>
 *
 * <p>API reference: <a href="https://mailchimp.com/developer/transactional/api/messages/send-new-message/">
 * Mandrill messages/send</a>
 */
public class MandrillEmailBackend implements EmailBackend {

    private static final Logger LOG = LoggerFactory.getLogger(MandrillEmailBackend.class);
    private static final String SEND_PATH = "/api/1.0/messages/send";

    static final Set<String> RESERVED_HEADERS = Headers.lowercase(
            "From", "Sender", "Subject", "To", "Cc", "Bcc", "Return-Path", "Delivered-To",
            "DKIM-Signature", "DomainKey-Status", "Received-SPF", "Authentication-Results",
            "Received", "User-Agent", "List-Id", "Date", "X-CSA-Complaints", "Message-Id");

    /** Role of a recipient in Mandrill's single recipient list. */
    enum RecipientType {
        TO("to"), CC("cc"), BCC("bcc");

        private final String wire;

        RecipientType(final String wire) { this.wire = wire; }

        String wire() { return wire; }
    }

    private final String apiKey;
    private final String baseUrl;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public MandrillEmailBackend(final String baseUrl, final String apiKey) {
        this(baseUrl, apiKey, ProviderHttp.DEFAULT_CONNECT_TIMEOUT, ProviderHttp.DEFAULT_READ_TIMEOUT);
    }

    public MandrillEmailBackend(
            final String baseUrl,
            final String apiKey,
            final Duration connectTimeout,
            final Duration readTimeout) {
        this.baseUrl = ProviderHttp.stripTrailingSlash(baseUrl);
        this.apiKey  = apiKey;
        this.http    = ProviderHttp.client(connectTimeout, readTimeout);
    }

    @Override
    public String providerName() { return "mandrill"; }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public int sendMessages(final List<OutgoingEmail> messages) {
        int done = 0;
        for (final OutgoingEmail message : messages) {
            if (sendOne(message)) {
                done++;
            }
        }
        return done;
    }

    private boolean sendOne(final OutgoingEmail message) {
        final ObjectNode root = mapper.createObjectNode();
        root.put("key", apiKey);
        root.set("message", makeMessage(message));

        final Request request = new Request.Builder()
                .url(baseUrl + SEND_PATH)
                .post(RequestBody.create(toJson(root), ProviderHttp.JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            final String body = ProviderHttp.bodyOf(response);
            if (!response.isSuccessful()) {
                LOG.warn("Mandrill rejected email: subject={} http={} body={}",
                        message.getSubject(), response.code(), body);
                return false;
            }

            final JsonNode results = mapper.readTree(body);
            for (final JsonNode result : results) {
                final String status = result.path("status").asText();
                if (!"sent".equals(status)) {
                    LOG.warn("Mandrill did not send: to={} status={} reason={}",
                            EmailAddresses.mask(result.path("email").asText()), status,
                            result.path("reject_reason").asText("-"));
                    return false;
                }
            }
            LOG.info("Mandrill email sent: subject={} recipients={}", message.getSubject(), results.size());
            return true;
        } catch (IOException e) {
            LOG.error("Mandrill IO error: subject={} error={}", message.getSubject(), e.getMessage());
            return false;
        }
    }

    /** Converts one email into Mandrill's {@code message} object. */
    ObjectNode makeMessage(final OutgoingEmail message) {
        final ObjectNode node = mapper.createObjectNode();

        final EmailAddress from = EmailAddresses.parse(message.getFrom());
        node.put("from_email", from.getAddress());
        from.getDisplayName().ifPresent(name -> node.put("from_name", name));

        final ArrayNode to = node.putArray("to");
        addRecipients(to, message.getTo(), RecipientType.TO);
        addRecipients(to, message.getCc(), RecipientType.CC);
        addRecipients(to, message.getBcc(), RecipientType.BCC);

        node.put("subject", message.getSubject());

        if (message.hasText()) {
            node.put("text", message.getText());
        }
        if (message.hasHtml()) {
            node.put("html", message.getHtml());
        }

        if (!message.getAttachments().isEmpty()) {
            final ArrayNode attachments = node.putArray("attachments");
            for (final Attachment attachment : message.getAttachments()) {
                final ObjectNode a = attachments.addObject();
                a.put("name", attachment.getFilename());
                a.put("type", attachment.getContentType());
                a.put("content", Base64.getEncoder().encodeToString(attachment.getContent()));
            }
        }

        final Map<String, String> headers = Headers.allowed(message.getHeaders(), RESERVED_HEADERS);
        if (!headers.isEmpty()) {
            final ObjectNode h = node.putObject("headers");
            headers.forEach(h::put);
        }

        return node;
    }

    private void addRecipients(final ArrayNode target, final List<String> raw, final RecipientType type) {
        for (final String address : raw) {
            final EmailAddress parsed = EmailAddresses.parse(address);
            final ObjectNode entry = target.addObject();
            entry.put("email", parsed.getAddress());
            entry.put("type", type.wire());
            parsed.getDisplayName().ifPresent(name -> entry.put("name", name));
        }
    }

    private String toJson(final ObjectNode root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize Mandrill payload", e);
        }
    }

    @Override
    public void close() {
        ProviderHttp.shutdown(http);
    }
}
