package com.uptimesentinel.service.notify;

/**
 * Delivers one notification over one configured channel. Returns false when the remote side
 * rejected the message; may throw on misconfiguration or transport errors.
 */
public interface ChannelSender {
    String type();

    boolean send(StatusNotification notification);
}
