package com.javis.channels;

import com.javis.shared.model.InboundMessage;

@FunctionalInterface
public interface MessageSink {
    void accept(InboundMessage message);
}
