package com.wailer.type;

import com.fasterxml.jackson.core.type.TypeReference;
import com.wailer.model.Attachment;
import com.wailer.model.Email;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes one kind of email: who it goes to, what it says and how it is
 * rendered.
 *
 * <p>Implement {@link #templateTextPath()}, {@link #templateHtmlPath()} or both.
 * A path method that is not overridden throws
 * {@link UnsupportedOperationException}, which the dispatcher reads as "this
 * email has no such part". Providers usually refuse an email with neither.
 */
public abstract class EmailType extends MessageType<Email> {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

    protected EmailType(final Email record, final MessageEnvironment env) {
        super(record, env);
    }

    public abstract String subject();

    /** Defaults to {@code wailer.default-from-email}. */
    @Override
    public String from() {
        return env().config().getDefaultFromEmail();
    }

    public String templateHtmlPath() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no HTML template");
    }

    public String templateTextPath() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no text template");
    }

    /** Variables handed to both templates: {@code self} (the stored email) plus the frozen context. */
    public Map<String, Object> templateContext() {
        final Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("self", record());
        vars.putAll(env().mapper().convertValue(context(), MAP));
        return vars;
    }

    public String textContent() {
        return env().templates().render(templateTextPath(), templateContext());
    }

    /** Renders the HTML template, then makes every link in it absolute. */
    public String htmlContent() {
        final String html = env().templates().render(templateHtmlPath(), templateContext());
        return env().htmlPostProcessor().process(html, baseUrl());
    }

    public List<Attachment> attachments() {
        return List.of();
    }

    /** Extra headers; each backend drops the ones its provider manages itself. */
    public Map<String, String> headers() {
        return Map.of();
    }
}
