package com.wailer.render;

import java.util.Locale;
import java.util.Objects;

/**
 * Thread-local "current locale" used by translations and template rendering.
 *
 * <p>Overrides are scoped: {@link #override(Locale)} returns a handle that puts
 * back the previous locale when closed, so nesting works and a failing send
 * never leaves its locale behind on a pooled thread.
 *
 * <pre>{@code
 * try (LocaleContext.Scope ignored = LocaleContext.override(Locale.FRENCH)) {
 *     renderer.render("hello/hello.txt", vars);
 * }
 * }</pre>
 */
public final class LocaleContext {

    private static final ThreadLocal<Locale> CURRENT = new ThreadLocal<>();
    private static volatile Locale fallback = Locale.ENGLISH;

    private LocaleContext() {}

    /** The active locale on this thread, or the process-wide fallback. */
    public static Locale current() {
        final Locale locale = CURRENT.get();
        return locale != null ? locale : fallback;
    }

    public static void setFallback(final Locale locale) {
        fallback = Objects.requireNonNull(locale, "locale");
    }

    public static Scope override(final Locale locale) {
        final Locale previous = CURRENT.get();
        CURRENT.set(Objects.requireNonNull(locale, "locale"));
        return new Scope(previous);
    }

    /** Restores the locale that was active before the matching {@link #override}. */
    public static final class Scope implements AutoCloseable {

        private final Locale previous;
        private boolean closed;

        private Scope(final Locale previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
