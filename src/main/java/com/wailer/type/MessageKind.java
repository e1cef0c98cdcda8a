package com.wailer.type;

/** The two kinds of messages, each with its own registry of types. */
public enum MessageKind {
    EMAIL,
    SMS
}
