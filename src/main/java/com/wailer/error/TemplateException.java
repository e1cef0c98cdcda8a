package com.wailer.error;

/**
 * Something went wrong while rendering a message: a template failed, the
 * context could not be frozen to JSON, or no absolute URL could be determined.
 */
public class TemplateException extends WailerException {

    public TemplateException(final String message) {
        super(message);
    }

    public TemplateException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
