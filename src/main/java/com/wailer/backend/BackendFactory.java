package com.wailer.backend;

import com.wailer.config.WailerConfig;
import com.wailer.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the email and SMS backends named in {@code wailer.email.backend} and
 * {@code wailer.sms.backend}.
 *
 * <p>A provider backend without credentials is refused at startup rather than
 * failing on the first send.
 */
public final class BackendFactory {

    private static final Logger LOG = LoggerFactory.getLogger(BackendFactory.class);

    private BackendFactory() {}

    public static EmailBackend buildEmailBackend(final WailerConfig config) {
        final String name = config.getEmailBackend();
        final EmailBackend backend = switch (name.toLowerCase()) {
            case "mailjet" -> new MailjetEmailBackend(
                    config.getMailjetBaseUrl(),
                    config.getMailjetApiKeyPublic(),
                    config.getMailjetApiKeyPrivate(),
                    config.getHttpConnectTimeout(),
                    config.getHttpReadTimeout());

            case "mandrill" -> new MandrillEmailBackend(
                    config.getMandrillBaseUrl(),
                    config.getMandrillApiKey(),
                    config.getHttpConnectTimeout(),
                    config.getHttpReadTimeout());

            case "memory"  -> new InMemoryEmailBackend();
            case "console" -> new ConsoleEmailBackend();

            default -> throw new ConfigurationException("Unknown email backend: " + name);
        };

        if (!backend.isConfigured()) {
            backend.close();
            throw new ConfigurationException("Email backend '" + name + "' is selected but missing credentials");
        }
        LOG.info("Email backend ready: provider={}", backend.providerName());
        return backend;
    }

    public static SmsBackend buildSmsBackend(final WailerConfig config) {
        final String name = config.getSmsBackend();
        final SmsBackend backend = switch (name.toLowerCase()) {
            case "mailjet" -> new MailjetSmsBackend(
                    config.getMailjetBaseUrl(),
                    config.getMailjetApiToken(),
                    config.getHttpConnectTimeout(),
                    config.getHttpReadTimeout());

            case "memory"  -> new InMemorySmsBackend();
            case "console" -> new ConsoleSmsBackend();

            default -> throw new ConfigurationException("Unknown SMS backend: " + name);
        };

        if (!backend.isConfigured()) {
            backend.close();
            throw new ConfigurationException("SMS backend '" + name + "' is selected but missing credentials");
        }
        LOG.info("SMS backend ready: provider={}", backend.providerName());
        return backend;
    }
}
