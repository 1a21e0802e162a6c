package com.company.guardian.exception;

public class ChannelNotFoundException extends GuardianException {
    public ChannelNotFoundException(String channelName) {
        super("Alert channel not found: " + channelName);
    }
}
