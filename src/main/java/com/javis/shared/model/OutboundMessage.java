package com.javis.shared.model;

public record OutboundMessage(String channelId, String text) {}
