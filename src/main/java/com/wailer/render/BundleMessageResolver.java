package com.wailer.render;

import org.thymeleaf.context.ITemplateContext;
import org.thymeleaf.messageresolver.AbstractMessageResolver;

/**
 * Resolves Thymeleaf {@code #{...}} expressions against {@link Translations}, so
 * that templates and Java code share one message catalogue.
 */
public class BundleMessageResolver extends AbstractMessageResolver {

    private final Translations translations;

    public BundleMessageResolver(final Translations translations) {
        this.translations = translations;
        setName("wailer-bundle");
    }

    @Override
    public String resolveMessage(
            final ITemplateContext context,
            final Class<?> origin,
            final String key,
            final Object[] messageParameters) {
        if (translations.lookup(context.getLocale(), key) == null) {
            return null;
        }
        return translations.translate(context.getLocale(), key, messageParameters);
    }

    @Override
    public String createAbsentMessageRepresentation(
            final ITemplateContext context,
            final Class<?> origin,
            final String key,
            final Object[] messageParameters) {
        return "??" + key + "_" + context.getLocale() + "??";
    }
}
