package com.wailer.backend;

import com.wailer.model.OutgoingEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Writes emails to the log instead of sending them. The default backend. */
public class ConsoleEmailBackend implements EmailBackend {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleEmailBackend.class);

    @Override public String providerName() { return "console"; }
    @Override public boolean isConfigured() { return true; }

    @Override
    public int sendMessages(final List<OutgoingEmail> messages) {
        for (final OutgoingEmail m : messages) {
            LOG.info("Email from={} to={} cc={} bcc={} subject={}\n--- text ---\n{}\n--- html ---\n{}",
                    m.getFrom(), m.getTo(), m.getCc(), m.getBcc(), m.getSubject(),
                    m.hasText() ? m.getText() : "(none)",
                    m.hasHtml() ? m.getHtml() : "(none)");
        }
        return messages.size();
    }

    @Override
    public void close() {}
}
