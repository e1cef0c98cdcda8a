package com.wailer.render;

import com.wailer.error.TemplateException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Works out the absolute origin ({@code scheme://domain[:port]}) that relative
 * links in messages are resolved against.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>The configured base URL, used verbatim.</li>
 *   <li>The site registry, if there is one: the configured site id, else the
 *       default site. Loopback domains ({@code localhost}, {@code 127.0.0.1},
 *       {@code [::1]}...) get {@code http}, anything else {@code https}.</li>
 *   <li>Otherwise a {@link TemplateException}.</li>
 * </ol>
 */
public class BaseUrlResolver {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final String       configuredBaseUrl;
    private final String       siteId;
    private final SiteRegistry sites;   // null when the application has no site registry

    public BaseUrlResolver(final String configuredBaseUrl, final String siteId, final SiteRegistry sites) {
        this.configuredBaseUrl = configuredBaseUrl;
        this.siteId            = siteId;
        this.sites             = sites;
    }

    public String resolve() {
        if (configuredBaseUrl != null && !configuredBaseUrl.isBlank()) {
            return configuredBaseUrl;
        }

        if (sites != null) {
            final Optional<Site> site = siteId != null && !siteId.isBlank()
                    ? sites.find(siteId)
                    : sites.defaultSite();
            if (site.isPresent()) {
                final String domain = site.get().getDomain();
                final String scheme = isLoopback(stripPort(domain)) ? "http" : "https";
                return scheme + "://" + domain;
            }
        }

        throw new TemplateException("Cannot determine absolute URL: configure wailer.base-url or a site");
    }

    static String stripPort(final String domain) {
        if (domain.startsWith("[")) {
            final int end = domain.indexOf(']');
            return end > 0 ? domain.substring(1, end) : domain;
        }
        final int colon = domain.indexOf(':');
        // More than one colon means a bare IPv6 literal, which has no port
        if (colon >= 0 && colon == domain.lastIndexOf(':')) {
            return domain.substring(0, colon);
        }
        return domain;
    }

    static boolean isLoopback(final String host) {
        if ("localhost".equals(host)) return true;
        if (!IPV4.matcher(host).matches() && !host.contains(":")) return false;

        // Only IP literals get here, so this never hits DNS
        try {
            return InetAddress.getByName(host).isLoopbackAddress();
        } catch (UnknownHostException e) {
            return false;
        }
    }
}
