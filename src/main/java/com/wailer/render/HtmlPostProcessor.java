package com.wailer.render;

/**
 * Post-processes rendered HTML before it is sent, typically to make it fit for
 * email clients (absolute links, inlined styles).
 */
public interface HtmlPostProcessor {

    String process(String html, String baseUrl);
}
