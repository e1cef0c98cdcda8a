package com.wailer.error;

/**
 * Root of every error raised by the messaging pipeline.
 *
 * <p>All subclasses are unchecked: callers of {@code send()} are not expected to
 * recover from most of them, and the ones they can recover from (an unknown
 * type name, a bad address) signal bugs in the calling code.
 */
public class WailerException extends RuntimeException {

    public WailerException(final String message) {
        super(message);
    }

    public WailerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
