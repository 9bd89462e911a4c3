package io.kneo.iptv.service.exceptions;

import lombok.Getter;

@Getter
public class ChannelNotFoundException extends RuntimeException {
    private final String channelId;

    public ChannelNotFoundException(String channelId) {
        super("Channel not found: " + channelId);
        this.channelId = channelId;
    }
}
