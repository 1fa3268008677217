package com.javis.shared.model;

import java.time.Instant;

/** A line of user input as received by a channel. */
public record InboundMessage(
    String channelId,
    String senderId,
    String text,
    Instant receivedAt
) {}
