package com.wailer.fixture;

import com.typesafe.config.ConfigFactory;
import com.wailer.config.WailerConfig;
import com.wailer.type.TypeRegistry;

/** Shared test setup: configuration and the registry of fixture types. */
public final class Fixtures {

    private Fixtures() {}

    public static WailerConfig config() {
        return config("");
    }

    /** Test configuration with {@code overrides} (HOCON) applied on top. */
    public static WailerConfig config(final String overrides) {
        return WailerConfig.from(ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseString(
                        "wailer.base-url = \"https://example.org\"\n"
                      + "wailer.default-from-email = \"Wailer <noreply@example.org>\"\n"
                      + "wailer.email.backend = memory\n"
                      + "wailer.sms.backend = memory\n")));
    }

    public static TypeRegistry registry() {
        return TypeRegistry.builder()
                .email("static", StaticEmail::new)
                .email("static-no-text", StaticEmail.htmlOnly())
                .email("static-no-html", StaticEmail.textOnly())
                .email("hello", HelloEmail::new)
                .email("hello-user", HelloUserEmail::new)
                .email("links", LinksEmail::new)
                .email("styled-html", StyledEmail::new)
                .sms("hello", HelloSms::new)
                .sms("hello-user", HelloUserSms::new)
                .sms("come-home-user", HelloUserSms.comeHome())
                .build();
    }
}
