package com.wailer.render;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SiteRegistry} held in memory. The first site registered becomes the
 * default unless another one is explicitly chosen.
 */
public class InMemorySiteRegistry implements SiteRegistry {

    private final Map<String, Site> sites = new ConcurrentHashMap<>();
    private volatile String defaultId;

    public InMemorySiteRegistry save(final Site site) {
        sites.put(site.getId(), site);
        if (defaultId == null) defaultId = site.getId();
        return this;
    }

    public InMemorySiteRegistry setDefault(final String siteId) {
        this.defaultId = siteId;
        return this;
    }

    @Override
    public Optional<Site> find(final String siteId) {
        return Optional.ofNullable(sites.get(siteId));
    }

    @Override
    public Optional<Site> defaultSite() {
        return defaultId == null ? Optional.empty() : find(defaultId);
    }
}
