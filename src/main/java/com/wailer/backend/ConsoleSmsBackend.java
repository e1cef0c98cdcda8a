package com.wailer.backend;

import com.wailer.model.OutgoingSms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Writes SMS to the log instead of sending them. The default backend. */
public class ConsoleSmsBackend implements SmsBackend {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleSmsBackend.class);

    @Override public String providerName() { return "console"; }
    @Override public boolean isConfigured() { return true; }

    @Override
    public int sendMessages(final List<OutgoingSms> messages) {
        for (final OutgoingSms m : messages) {
            LOG.info("SMS from={} to={}\n{}", m.getOriginator(), m.getRecipients(), m.getBody());
        }
        return messages.size();
    }

    @Override
    public void close() {}
}
