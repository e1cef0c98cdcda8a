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
 * Email backend backed by the Mailjet Send API v3.1.
 *
 * <p>The whole batch goes out in a single call and Mailjet answers with one
 * status per message. A non-2xx answer means nothing was sent: the batch counts
 * as zero. Inline attachments are not supported.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code MAILJET_API_KEY_PUBLIC} and {@code MAILJET_API_KEY_PRIVATE} (HTTP Basic)</li>
 * </ul>
 *
 * <p>API reference: <a href="https://dev.mailjet.com/email/reference/send-emails/">
 * Mailjet Send API v3.1</a>
 */
public class MailjetEmailBackend implements EmailBackend {

    private static final Logger LOG = LoggerFactory.getLogger(MailjetEmailBackend.class);
    private static final String SEND_PATH = "/v3.1/send";

    /** Headers Mailjet sets itself; passing them would be rejected or ignored. */
    static final Set<String> RESERVED_HEADERS = Headers.lowercase(
            "From", "Sender", "Subject", "To", "Cc", "Bcc", "Return-Path", "Delivered-To",
            "DKIM-Signature", "DomainKey-Status", "Received-SPF", "Authentication-Results",
            "Received", "X-Mailjet-Prio", "X-Mailjet-Debug", "User-Agent", "X-Mailer",
            "X-MJ-CustomID", "X-MJ-EventPayload", "X-MJ-Vars", "X-MJ-TemplateErrorDeliver",
            "X-MJ-TemplateErrorReporting", "X-MJ-TemplateLanguage", "X-Mailjet-TrackOpen",
            "X-Mailjet-TrackClick", "X-MJ-TemplateID", "X-MJ-WorkflowID", "X-Feedback-Id",
            "X-Mailjet-Segmentation", "List-Id", "X-MJ-MID", "X-MJ-ErrorMessage", "Date",
            "X-CSA-Complaints", "Message-Id", "X-Mailjet-Campaign", "X-MJ-StatisticsContactsListID");

    private final String apiKeyPublic;
    private final String apiKeyPrivate;
    private final String baseUrl;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public MailjetEmailBackend(final String baseUrl, final String apiKeyPublic, final String apiKeyPrivate) {
        this(baseUrl, apiKeyPublic, apiKeyPrivate,
                ProviderHttp.DEFAULT_CONNECT_TIMEOUT, ProviderHttp.DEFAULT_READ_TIMEOUT);
    }

    public MailjetEmailBackend(
            final String baseUrl,
            final String apiKeyPublic,
            final String apiKeyPrivate,
            final Duration connectTimeout,
            final Duration readTimeout) {
        this.baseUrl       = ProviderHttp.stripTrailingSlash(baseUrl);
        this.apiKeyPublic  = apiKeyPublic;
        this.apiKeyPrivate = apiKeyPrivate;
        this.http          = ProviderHttp.client(connectTimeout, readTimeout);
    }

    @Override
    public String providerName() { return "mailjet"; }

    @Override
    public boolean isConfigured() {
        return apiKeyPublic  != null && !apiKeyPublic.isBlank()
            && apiKeyPrivate != null && !apiKeyPrivate.isBlank();
    }

    @Override
    public int sendMessages(final List<OutgoingEmail> messages) {
        if (messages.isEmpty()) return 0;

        final ObjectNode root = mapper.createObjectNode();
        final ArrayNode out = root.putArray("Messages");
        for (final OutgoingEmail message : messages) {
            out.add(makeMessage(message));
        }

        final Request request = new Request.Builder()
                .url(baseUrl + SEND_PATH)
                .addHeader("Authorization", Credentials.basic(apiKeyPublic, apiKeyPrivate))
                .post(RequestBody.create(toJson(root), ProviderHttp.JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            final String body = ProviderHttp.bodyOf(response);
            if (!response.isSuccessful()) {
                LOG.warn("Mailjet rejected batch: messages={} http={} body={}",
                        messages.size(), response.code(), body);
                return 0;
            }

            int sent = 0;
            for (final JsonNode status : mapper.readTree(body).path("Messages")) {
                if ("success".equals(status.path("Status").asText())) {
                    sent++;
                }
            }
            LOG.info("Mailjet batch sent: messages={} accepted={}", messages.size(), sent);
            return sent;
        } catch (IOException e) {
            LOG.error("Mailjet IO error: messages={} error={}", messages.size(), e.getMessage());
            return 0;
        }
    }

    /** Converts one email into an entry of the {@code Messages} array. */
    ObjectNode makeMessage(final OutgoingEmail message) {
        final ObjectNode node = mapper.createObjectNode();

        node.set("From", address(EmailAddresses.parse(message.getFrom())));
        node.set("To", addresses(message.getTo()));
        node.put("Subject", message.getSubject());

        if (message.hasText()) {
            node.put("TextPart", message.getText());
        }
        if (message.hasHtml()) {
            node.put("HTMLPart", message.getHtml());
        }
        if (!message.getCc().isEmpty()) {
            node.set("Cc", addresses(message.getCc()));
        }
        if (!message.getBcc().isEmpty()) {
            node.set("Bcc", addresses(message.getBcc()));
        }

        if (!message.getAttachments().isEmpty()) {
            final ArrayNode attachments = node.putArray("Attachments");
            for (final Attachment attachment : message.getAttachments()) {
                final ObjectNode a = attachments.addObject();
                a.put("Filename", attachment.getFilename());
                a.put("ContentType", attachment.getContentType());
                a.put("Base64Content", Base64.getEncoder().encodeToString(attachment.getContent()));
            }
        }

        final Map<String, String> headers = Headers.allowed(message.getHeaders(), RESERVED_HEADERS);
        if (!headers.isEmpty()) {
            final ObjectNode h = node.putObject("Headers");
            headers.forEach(h::put);
        }

        return node;
    }

    private ArrayNode addresses(final List<String> raw) {
        final ArrayNode array = mapper.createArrayNode();
        for (final String address : raw) {
            array.add(address(EmailAddresses.parse(address)));
        }
        return array;
    }

    private ObjectNode address(final EmailAddress address) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("Email", address.getAddress());
        address.getDisplayName().ifPresent(name -> node.put("Name", name));
        return node;
    }

    private String toJson(final ObjectNode root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize Mailjet payload", e);
        }
    }

    @Override
    public void close() {
        ProviderHttp.shutdown(http);
    }
}
