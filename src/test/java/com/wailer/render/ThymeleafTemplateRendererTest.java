package com.wailer.render;

import com.wailer.error.TemplateException;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ThymeleafTemplateRendererTest {

    private final ThymeleafTemplateRenderer renderer = new ThymeleafTemplateRenderer(new Translations());

    @Test
    void render_textTemplate_inlinesMessages() {
        try (LocaleContext.Scope ignored = LocaleContext.override(Locale.ENGLISH)) {
            assertThat(renderer.render("hello/hello.txt", Map.of("name", "Jane Roe")))
                    .isEqualTo("Hello Jane Roe!\n\nSee you later\n");
        }
    }

    @Test
    void render_htmlTemplate_escapesValues() {
        final String html = renderer.render("static/static.html", Map.of("prefix", "<b>"));

        assertThat(html).contains("&lt;b&gt; HTML en français");
    }

    @Test
    void render_missingTemplate_throws() {
        assertThatThrownBy(() -> renderer.render("nope/nope.html", Map.of()))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("nope/nope.html");
    }
}
