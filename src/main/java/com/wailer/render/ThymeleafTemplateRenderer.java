package com.wailer.render;

import com.wailer.error.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.Map;

/**
 * {@link TemplateRenderer} backed by Thymeleaf classpath templates.
 *
 * <p>Templates live under {@code templates/} and are addressed with their
 * suffix: {@code *.html} is parsed in HTML mode, {@code *.txt} in TEXT mode
 * (use {@code [(${name})]} and {@code [(#{key})]} inlining there). Messages
 * come from {@link Translations} through {@link BundleMessageResolver}.
 */
public class ThymeleafTemplateRenderer implements TemplateRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(ThymeleafTemplateRenderer.class);

    private final TemplateEngine engine;

    public ThymeleafTemplateRenderer(final Translations translations) {
        this(translations, "templates/");
    }

    public ThymeleafTemplateRenderer(final Translations translations, final String prefix) {
        this.engine = createEngine(translations, prefix);
    }

    @Override
    public String render(final String templateId, final Map<String, Object> context) {
        final Context ctx = new Context(LocaleContext.current());
        context.forEach(ctx::setVariable);

        try {
            final String out = engine.process(templateId, ctx);
            LOG.debug("Rendered template '{}' locale={} size={}", templateId, ctx.getLocale(), out.length());
            return out;
        } catch (TemplateEngineException e) {
            throw new TemplateException("Failed to render template '" + templateId + "': " + e.getMessage(), e);
        }
    }

    private static TemplateEngine createEngine(final Translations translations, final String prefix) {
        final ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix(prefix);
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.getTextTemplateModePatternSpec().addPattern("*.txt");
        resolver.getHtmlTemplateModePatternSpec().addPattern("*.html");
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCheckExistence(true);
        resolver.setCacheable(true);

        final TemplateEngine engine = new TemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setMessageResolver(new BundleMessageResolver(translations));
        return engine;
    }
}
