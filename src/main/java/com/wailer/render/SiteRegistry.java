package com.wailer.render;

import java.util.Optional;

/** Knows which domains the application is served on. */
public interface SiteRegistry {

    Optional<Site> find(String siteId);

    /** The site to use when no site id is configured. */
    Optional<Site> defaultSite();
}
