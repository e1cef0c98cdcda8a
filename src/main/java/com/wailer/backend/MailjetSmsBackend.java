package com.wailer.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wailer.model.OutgoingSms;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * SMS backend backed by the Mailjet SMS API v4.
 *
 * <p>Mailjet has no bulk SMS endpoint: every recipient of every message is a
 * separate call, and the returned count is the number of calls that succeeded.
 * A failing recipient therefore does not prevent the others from being sent.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code MAILJET_API_TOKEN}: an SMS API token (Bearer authentication)</li>
 * </ul>
 *
 * <p>API reference: <a href="https://dev.mailjet.com/sms/reference/send-message/">
 * Mailjet SMS send</a>
 */
public class MailjetSmsBackend implements SmsBackend {

    private static final Logger LOG = LoggerFactory.getLogger(MailjetSmsBackend.class);
    private static final String SEND_PATH = "/v4/sms-send";

    private final String apiToken;
    private final String baseUrl;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public MailjetSmsBackend(final String baseUrl, final String apiToken) {
        this(baseUrl, apiToken, ProviderHttp.DEFAULT_CONNECT_TIMEOUT, ProviderHttp.DEFAULT_READ_TIMEOUT);
    }

    public MailjetSmsBackend(
            final String baseUrl,
            final String apiToken,
            final Duration connectTimeout,
            final Duration readTimeout) {
        this.baseUrl  = ProviderHttp.stripTrailingSlash(baseUrl);
        this.apiToken = apiToken;
        this.http     = ProviderHttp.client(connectTimeout, readTimeout);
    }

    @Override public String providerName() { return "mailjet"; }

    @Override
    public boolean isConfigured() {
        return apiToken != null && !apiToken.isBlank();
    }

    @Override
    public int sendMessages(final List<OutgoingSms> messages) {
        int sent = 0;
        for (final OutgoingSms message : messages) {
            for (final ObjectNode call : makeCalls(message)) {
                if (post(call)) {
                    sent++;
                }
            }
        }
        return sent;
    }

    /** One {@code {From, To, Text}} payload per recipient. */
    List<ObjectNode> makeCalls(final OutgoingSms message) {
        final List<ObjectNode> calls = new ArrayList<>(message.getRecipients().size());
        for (final String to : message.getRecipients()) {
            final ObjectNode call = mapper.createObjectNode();
            call.put("From", message.getOriginator());
            call.put("To", to);
            call.put("Text", message.getBody());
            calls.add(call);
        }
        return calls;
    }

    private boolean post(final ObjectNode call) {
        final String to = call.path("To").asText();
        final Request request = new Request.Builder()
                .url(baseUrl + SEND_PATH)
                .addHeader("Authorization", "Bearer " + apiToken)
                .post(RequestBody.create(toJson(call), ProviderHttp.JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            if (response.isSuccessful()) {
                LOG.info("Mailjet SMS sent: to={}", EmailAddresses.maskPhone(to));
                return true;
            }
            LOG.warn("Mailjet rejected SMS: to={} http={} body={}",
                    EmailAddresses.maskPhone(to), response.code(), ProviderHttp.bodyOf(response));
            return false;
        } catch (IOException e) {
            LOG.error("Mailjet SMS IO error: to={} error={}", EmailAddresses.maskPhone(to), e.getMessage());
            return false;
        }
    }

    private String toJson(final ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize Mailjet SMS payload", e);
        }
    }

    @Override
    public void close() {
        ProviderHttp.shutdown(http);
    }
}
