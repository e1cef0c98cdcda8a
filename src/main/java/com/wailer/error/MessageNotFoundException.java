package com.wailer.error;

/** No stored message (or no such rendering of it) exists for a re-display request. */
public class MessageNotFoundException extends WailerException {

    public MessageNotFoundException(final String message) {
        super(message);
    }
}
