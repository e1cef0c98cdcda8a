package com.wailer.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Typed configuration for Wailer, loaded from {@code application.conf} via
 * Typesafe Config.
 *
 * <p>All secrets (API keys, tokens) are read from environment variables via
 * Typesafe Config substitution (e.g. {@code ${?MAILJET_API_KEY_PUBLIC}}).
 * This class never logs secret values; only their presence is checked by the
 * backends.
 */
public final class WailerConfig {

    private final Config raw;

    private WailerConfig(final Config config) {
        this.raw = config;
    }

    public static WailerConfig load() {
        return new WailerConfig(ConfigFactory.load().resolve());
    }

    /** Wraps an already-built config, layered over the bundled defaults. */
    public static WailerConfig from(final Config config) {
        return new WailerConfig(config.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    public Config raw() {
        return raw;
    }

    // ── Message types ─────────────────────────────────────────────────────────

    public Map<String, String> getEmailTypes() {
        return stringMap("wailer.email-types");
    }

    public Map<String, String> getSmsTypes() {
        return stringMap("wailer.sms-types");
    }

    // ── Addressing ────────────────────────────────────────────────────────────

    public String getDefaultFromEmail() {
        return raw.getString("wailer.default-from-email");
    }

    /** Sender numbers for SMS, picked by matching the recipient's country code. */
    public List<String> getSmsSenders() {
        return raw.getStringList("wailer.sms-senders");
    }

    public Locale getDefaultLocale() {
        return Locale.forLanguageTag(raw.getString("wailer.default-locale"));
    }

    // ── Absolute URLs ─────────────────────────────────────────────────────────

    public Optional<String> getBaseUrl() {
        return optString("wailer.base-url");
    }

    public Optional<String> getSiteId() {
        return optString("wailer.site-id");
    }

    public boolean isInlineCss() {
        return raw.getBoolean("wailer.html.inline-css");
    }

    public boolean isPreserveInternalLinks() {
        return raw.getBoolean("wailer.html.preserve-internal-links");
    }

    public boolean isPreserveInlineReferences() {
        return raw.getBoolean("wailer.html.preserve-inline-references");
    }

    // ── Backends ──────────────────────────────────────────────────────────────

    public String getEmailBackend() {
        return raw.getString("wailer.email.backend");
    }

    public String getSmsBackend() {
        return raw.getString("wailer.sms.backend");
    }

    public String getMailjetBaseUrl() {
        return raw.getString("wailer.mailjet.base-url");
    }

    public String getMailjetApiKeyPublic() {
        return optString("wailer.mailjet.api-key-public").orElse("");
    }

    public String getMailjetApiKeyPrivate() {
        return optString("wailer.mailjet.api-key-private").orElse("");
    }

    public String getMailjetApiToken() {
        return optString("wailer.mailjet.api-token").orElse("");
    }

    public String getMandrillBaseUrl() {
        return raw.getString("wailer.mandrill.base-url");
    }

    public String getMandrillApiKey() {
        return optString("wailer.mandrill.api-key").orElse("");
    }

    // ── HTTP ──────────────────────────────────────────────────────────────────

    public Duration getHttpConnectTimeout() {
        return raw.getDuration("wailer.http.connect-timeout");
    }

    public Duration getHttpReadTimeout() {
        return raw.getDuration("wailer.http.read-timeout");
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private Optional<String> optString(final String path) {
        if (!raw.hasPath(path)) return Optional.empty();
        final String value = raw.getString(path);
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private Map<String, String> stringMap(final String path) {
        final Map<String, String> out = new LinkedHashMap<>();
        if (!raw.hasPath(path)) return out;

        final ConfigObject object = raw.getObject(path);
        for (final Map.Entry<String, ConfigValue> entry : object.entrySet()) {
            out.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
        }
        return out;
    }
}
