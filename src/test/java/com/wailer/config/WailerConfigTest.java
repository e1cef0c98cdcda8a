package com.wailer.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

class WailerConfigTest {

    @Test
    void defaults_comeFromReferenceConf() {
        final WailerConfig config = WailerConfig.from(ConfigFactory.empty());

        assertThat(config.getEmailTypes()).isEmpty();
        assertThat(config.getSmsSenders()).isEmpty();
        assertThat(config.getDefaultLocale()).isEqualTo(Locale.ENGLISH);
        assertThat(config.isInlineCss()).isTrue();
        assertThat(config.isPreserveInternalLinks()).isTrue();
        assertThat(config.isPreserveInlineReferences()).isTrue();
        assertThat(config.getMailjetBaseUrl()).isEqualTo("https://api.mailjet.com");
        assertThat(config.getMandrillBaseUrl()).isEqualTo("https://mandrillapp.com");
        assertThat(config.getHttpConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getHttpReadTimeout()).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void blankStrings_areAbsent() {
        final WailerConfig config = WailerConfig.from(ConfigFactory.parseString(
                "wailer.base-url = \"  \"\nwailer.site-id = \"\""));

        assertThat(config.getBaseUrl()).isEmpty();
        assertThat(config.getSiteId()).isEmpty();
    }

    @Test
    void overrides_areRead() {
        final WailerConfig config = WailerConfig.from(ConfigFactory.parseString(
                "wailer {\n"
              + "  base-url = \"https://example.org\"\n"
              + "  default-locale = fr-CA\n"
              + "  sms-senders = [\"+33612345678\"]\n"
              + "  email-types { hello = com.example.Hello, \"password-reset\" = com.example.Reset }\n"
              + "  http.read-timeout = 2s\n"
              + "}"));

        assertThat(config.getBaseUrl()).contains("https://example.org");
        assertThat(config.getDefaultLocale()).isEqualTo(Locale.CANADA_FRENCH);
        assertThat(config.getSmsSenders()).containsExactly("+33612345678");
        assertThat(config.getEmailTypes())
                .containsEntry("hello", "com.example.Hello")
                .containsEntry("password-reset", "com.example.Reset");
        assertThat(config.getHttpReadTimeout()).isEqualTo(Duration.ofSeconds(2));
    }
}
