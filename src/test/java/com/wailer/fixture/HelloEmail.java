package com.wailer.fixture;

import com.wailer.model.Email;
import com.wailer.type.EmailType;
import com.wailer.type.MessageEnvironment;

import java.util.Locale;
import java.util.Map;

/** Greets whoever is described in {@code data}: first_name, last_name, email, locale. */
public class HelloEmail extends EmailType {

    static final String TEXT_TEMPLATE = "hello/hello.txt";
    static final String HTML_TEMPLATE = "hello/hello.html";

    public HelloEmail(final Email record, final MessageEnvironment env) {
        super(record, env);
    }

    @Override
    public Locale locale() {
        return Locale.forLanguageTag(dataText("locale"));
    }

    @Override
    public String to() {
        return dataText("email");
    }

    @Override
    public Map<String, Object> computeContext() {
        return Map.of("name", dataText("first_name") + " " + dataText("last_name"));
    }

    @Override
    public String subject() {
        return translate("hello.subject", contextText("name"));
    }

    @Override public String templateTextPath() { return TEXT_TEMPLATE; }
    @Override public String templateHtmlPath() { return HTML_TEMPLATE; }
}
