package com.wailer.type;

import com.wailer.model.BaseMessage;

/** Builds a message type bound to a stored message. Usually a constructor reference. */
@FunctionalInterface
public interface MessageTypeFactory<R extends BaseMessage, T extends MessageType<R>> {

    T create(R record, MessageEnvironment env);
}
