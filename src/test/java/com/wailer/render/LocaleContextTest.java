package com.wailer.render;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

class LocaleContextTest {

    @Test
    void override_isRestoredOnClose() {
        final Locale before = LocaleContext.current();

        try (LocaleContext.Scope outer = LocaleContext.override(Locale.FRENCH)) {
            assertThat(LocaleContext.current()).isEqualTo(Locale.FRENCH);

            try (LocaleContext.Scope inner = LocaleContext.override(Locale.GERMAN)) {
                assertThat(LocaleContext.current()).isEqualTo(Locale.GERMAN);
            }
            assertThat(LocaleContext.current()).isEqualTo(Locale.FRENCH);
        }

        assertThat(LocaleContext.current()).isEqualTo(before);
    }

    @Test
    void override_isRestoredWhenBodyThrows() {
        final Locale before = LocaleContext.current();

        assertThatThrownBy(() -> {
            try (LocaleContext.Scope ignored = LocaleContext.override(Locale.FRENCH)) {
                throw new IllegalStateException("render failed");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(LocaleContext.current()).isEqualTo(before);
    }

    @Test
    void override_isThreadLocal() throws Exception {
        final Locale[] seen = new Locale[1];

        try (LocaleContext.Scope ignored = LocaleContext.override(Locale.FRENCH)) {
            final Thread other = new Thread(() -> seen[0] = LocaleContext.current());
            other.start();
            other.join();
        }

        assertThat(seen[0]).isNotEqualTo(Locale.FRENCH);
    }
}
