package com.wailer.fixture;

import com.wailer.model.Email;
import com.wailer.type.EmailType;
import com.wailer.type.MessageEnvironment;
import com.wailer.type.MessageTypeFactory;

import java.util.Locale;
import java.util.Map;

/** Fixed content, used to check sending and the omission of text or HTML parts. */
public class StaticEmail extends EmailType {

    private final boolean withText;
    private final boolean withHtml;

    public StaticEmail(final Email record, final MessageEnvironment env) {
        this(record, env, true, true);
    }

    private StaticEmail(final Email record, final MessageEnvironment env, final boolean withText, final boolean withHtml) {
        super(record, env);
        this.withText = withText;
        this.withHtml = withHtml;
    }

    public static MessageTypeFactory<Email, EmailType> textOnly() {
        return (record, env) -> new StaticEmail(record, env, true, false);
    }

    public static MessageTypeFactory<Email, EmailType> htmlOnly() {
        return (record, env) -> new StaticEmail(record, env, false, true);
    }

    @Override public Locale locale() { return Locale.FRENCH; }
    @Override public String to()     { return "foo@bar.com"; }
    @Override public String subject() { return "Static Subject"; }

    @Override
    public Map<String, Object> computeContext() {
        return Map.of("prefix", "Static");
    }

    @Override
    public String templateTextPath() {
        return withText ? "static/static.txt" : super.templateTextPath();
    }

    @Override
    public String templateHtmlPath() {
        return withHtml ? "static/static.html" : super.templateHtmlPath();
    }
}
