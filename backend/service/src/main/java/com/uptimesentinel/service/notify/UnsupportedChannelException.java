package com.uptimesentinel.service.notify;

public class UnsupportedChannelException extends IllegalArgumentException {
    private final String channelType;

    public UnsupportedChannelException(String channelType) {
        super("Unsupported channel type: " + channelType);
        this.channelType = channelType;
    }

    public String channelType() {
        return channelType;
    }
}
