package com.wailer.render;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Rewrites every {@code href} and {@code src} attribute of an HTML document into
 * an absolute URL resolved against the base URL.
 *
 * <p>Values that already carry a scheme ({@code https:}, {@code tel:},
 * {@code mailto:}, {@code cid:}...) are left alone. Fragment-only links
 * ({@code href="#top"}) and inline references ({@code src="cid:logo"}) are kept
 * verbatim when the matching option is on; otherwise they are resolved like any
 * other relative value. Values that are not valid URIs are left unchanged.
 *
 * <p>Only element attributes are touched. Text content and comments go through
 * as they are.
 */
public class LinkAbsolutizer implements HtmlPostProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(LinkAbsolutizer.class);

    private final boolean preserveInternalLinks;
    private final boolean preserveInlineReferences;

    public LinkAbsolutizer(final boolean preserveInternalLinks, final boolean preserveInlineReferences) {
        this.preserveInternalLinks    = preserveInternalLinks;
        this.preserveInlineReferences = preserveInlineReferences;
    }

    @Override
    public String process(final String html, final String baseUrl) {
        return new EmailHtmlTransformer(false, this).process(html, baseUrl);
    }

    /** Rewrites the link attributes of a parsed document in place. */
    public void absolutize(final Document doc, final String baseUrl) {
        final URI base = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");

        for (final Element el : doc.select("[href]")) {
            el.attr("href", rewrite("href", el.attr("href"), base));
        }
        for (final Element el : doc.select("[src]")) {
            el.attr("src", rewrite("src", el.attr("src"), base));
        }
    }

    private String rewrite(final String attribute, final String value, final URI base) {
        final String trimmed = value.trim();
        if (trimmed.isEmpty()) return value;

        if (trimmed.regionMatches(true, 0, "tel:", 0, 4)) return value;
        if (preserveInternalLinks && "href".equals(attribute) && trimmed.startsWith("#")) return value;
        if (preserveInlineReferences && "src".equals(attribute)
                && trimmed.regionMatches(true, 0, "cid:", 0, 4)) return value;

        try {
            final URI uri = new URI(trimmed);
            if (uri.isAbsolute()) return value;
            return base.resolve(uri).toString();
        } catch (URISyntaxException e) {
            LOG.debug("Leaving non-URI {} value untouched: {}", attribute, trimmed);
            return value;
        }
    }
}
