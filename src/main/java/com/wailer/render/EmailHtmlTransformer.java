package com.wailer.render;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.Locale;
import java.util.Objects;

/**
 * Default {@link HtmlPostProcessor} for email bodies: inlines {@code <style>}
 * rules into {@code style} attributes, then makes links absolute.
 *
 * <p>A complete document ({@code <html>...}) comes back as a complete document.
 * A fragment comes back as a fragment, without the wrappers the parser adds.
 */
public class EmailHtmlTransformer implements HtmlPostProcessor {

    private final boolean         inlineCss;
    private final CssInliner      inliner = new CssInliner();
    private final LinkAbsolutizer absolutizer;

    public EmailHtmlTransformer(final boolean inlineCss, final LinkAbsolutizer absolutizer) {
        this.inlineCss   = inlineCss;
        this.absolutizer = Objects.requireNonNull(absolutizer, "absolutizer");
    }

    @Override
    public String process(final String html, final String baseUrl) {
        if (html == null || html.isEmpty()) return html;

        final Document doc = Jsoup.parse(html, baseUrl);
        doc.outputSettings().prettyPrint(false);

        if (inlineCss) inliner.inline(doc);
        absolutizer.absolutize(doc, baseUrl);

        if (html.toLowerCase(Locale.ROOT).contains("<html")) return doc.outerHtml();
        // fragments: head-only elements such as a kept <style> are moved to head by the parser
        return doc.head().html() + doc.body().html();
    }
}
