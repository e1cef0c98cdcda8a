package com.wailer.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Localised strings, read from {@code i18n/messages*.properties} on the
 * classpath and formatted with {@link MessageFormat}.
 *
 * <p>The same catalogue serves Java code (subjects, SMS bodies) and templates
 * ({@code #{key(args)}} expressions, see {@link BundleMessageResolver}).
 * A key missing from the catalogue is returned as-is and logged once per call
 * at debug level, so a forgotten translation shows up in the output instead of
 * failing the send.
 */
public class Translations {

    private static final Logger LOG = LoggerFactory.getLogger(Translations.class);
    public static final String DEFAULT_BASE_NAME = "i18n/messages";

    private final String baseName;
    private final ResourceBundle.Control control =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    public Translations() {
        this(DEFAULT_BASE_NAME);
    }

    public Translations(final String baseName) {
        this.baseName = baseName;
    }

    /** Translates {@code key} into the locale active on the current thread. */
    public String translate(final String key, final Object... args) {
        return translate(LocaleContext.current(), key, args);
    }

    public String translate(final Locale locale, final String key, final Object... args) {
        final String pattern = lookup(locale, key);
        if (pattern == null) {
            LOG.debug("No translation for key={} locale={}", key, locale);
            return key;
        }
        return new MessageFormat(pattern, locale).format(args == null ? new Object[0] : args);
    }

    /** Raw pattern for {@code key}, or null when no bundle of the chain defines it. */
    public String lookup(final Locale locale, final String key) {
        try {
            final ResourceBundle bundle = ResourceBundle.getBundle(baseName, locale, control);
            return bundle.containsKey(key) ? bundle.getString(key) : null;
        } catch (MissingResourceException e) {
            return null;
        }
    }
}
