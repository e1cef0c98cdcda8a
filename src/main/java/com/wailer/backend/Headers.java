package com.wailer.backend;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Filters extra email headers against a provider's reserved set. */
final class Headers {

    private Headers() {}

    static Set<String> lowercase(final String... names) {
        return Stream.of(names)
                .map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Keeps, in order, the headers whose lower-cased name is not reserved. */
    static Map<String, String> allowed(final Map<String, String> headers, final Set<String> reserved) {
        final Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (!reserved.contains(name.toLowerCase(Locale.ROOT))) {
                out.put(name, value);
            }
        });
        return out;
    }
}
