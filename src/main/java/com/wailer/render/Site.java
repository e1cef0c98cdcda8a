package com.wailer.render;

import java.util.Objects;

/** A site served by the application, identified by its public domain (with optional port). */
public final class Site {

    private final String id;
    private final String domain;

    public Site(final String id, final String domain) {
        this.id     = Objects.requireNonNull(id, "id");
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public String getId()     { return id; }
    public String getDomain() { return domain; }

    @Override
    public String toString() {
        return "Site{id=" + id + ", domain=" + domain + "}";
    }
}
