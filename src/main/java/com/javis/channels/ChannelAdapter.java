package com.javis.channels;

import com.javis.shared.model.OutboundMessage;

public interface ChannelAdapter {
    String id();
    void start(MessageSink sink);
    void send(OutboundMessage msg);
    void stop();
}
