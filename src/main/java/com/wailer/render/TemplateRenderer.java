package com.wailer.render;

import java.util.Map;

/**
 * Renders a template identified by its classpath-relative id (e.g.
 * {@code "hello/hello.txt"}) in the locale active in {@link LocaleContext}.
 */
public interface TemplateRenderer {

    /**
     * @throws com.wailer.error.TemplateException if the template is missing or fails to render
     */
    String render(String templateId, Map<String, Object> context);
}
