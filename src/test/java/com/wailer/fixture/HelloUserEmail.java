package com.wailer.fixture;

import com.wailer.model.Email;
import com.wailer.model.User;
import com.wailer.type.EmailType;
import com.wailer.type.MessageEnvironment;

import java.util.Locale;
import java.util.Map;

/**
 * Same greeting as {@link HelloEmail}, for a live user looked up from
 * {@code data.user_id}. Name and locale are frozen; the address is not.
 */
public class HelloUserEmail extends EmailType {

    private final User user;

    public HelloUserEmail(final Email record, final MessageEnvironment env) {
        super(record, env);
        this.user = env.users().find(data().path("user_id").asLong()).orElse(null);
    }

    @Override
    public Locale locale() {
        return Locale.forLanguageTag(contextText("locale"));
    }

    @Override
    public String to() {
        return user().getEmail();
    }

    @Override
    public Map<String, Object> computeContext() {
        return Map.of(
                "name", user().getFullName(),
                "locale", user().getLocale());
    }

    @Override
    public String subject() {
        return translate("hello.subject", contextText("name"));
    }

    @Override public String templateTextPath() { return HelloEmail.TEXT_TEMPLATE; }
    @Override public String templateHtmlPath() { return HelloEmail.HTML_TEMPLATE; }

    private User user() {
        if (user == null) {
            throw new IllegalStateException("User " + data().path("user_id") + " does not exist");
        }
        return user;
    }
}
