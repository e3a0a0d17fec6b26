package com.uptimesentinel.service.notify;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.events.NotificationDelivered;
import com.uptimesentinel.core.events.StatusChanged;
import com.uptimesentinel.core.model.ChannelConfig;
import com.uptimesentinel.core.model.CheckOutcome;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class NotificationDispatcher {
    private static final Logger LOGGER = Logger.getLogger(NotificationDispatcher.class.getName());

    private final ChannelSenderRegistry senders;
    private final EventBus eventBus;
    private final Clock clock;

    public NotificationDispatcher(ChannelSenderRegistry senders, EventBus eventBus, Clock clock) {
        this.senders = senders;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public static boolean shouldNotify(CheckStatus previous, CheckStatus current) {
        return previous == null || previous != current;
    }

    public DispatchSummary dispatch(Monitor monitor, CheckOutcome outcome, CheckStatus previousStatus) {
        if (!shouldNotify(previousStatus, outcome.status())) {
            return DispatchSummary.skipped();
        }
        StatusNotification notification = StatusNotification.of(monitor, outcome, previousStatus);
        LOGGER.info(notification.headline()
                + (previousStatus == null ? " (first check)" : " (was " + previousStatus.label() + ")"));
        eventBus.publish(new StatusChanged(
                clock.instant(),
                monitor.id(),
                monitor.url(),
                previousStatus == null ? null : previousStatus.label(),
                outcome.status().label()
        ));

        int delivered = 0;
        for (ChannelConfig channel : monitor.channels()) {
            if (deliver(channel, notification)) {
                delivered++;
            }
        }
        return new DispatchSummary(true, monitor.channels().size(), delivered);
    }

    private boolean deliver(ChannelConfig channel, StatusNotification notification) {
        try {
            ChannelSender sender = senders.create(channel);
            boolean success = sender.send(notification);
            if (!success) {
                LOGGER.warning("Channel " + sender.type() + " rejected notification for monitor " + notification.monitorId());
            }
            publishDelivery(notification, channel, success, success ? "delivered" : "rejected by channel");
            return success;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Channel " + channel.type() + " failed for monitor " + notification.monitorId(), ex);
            publishDelivery(notification, channel, false, ex.getMessage());
            return false;
        }
    }

    private void publishDelivery(StatusNotification notification, ChannelConfig channel, boolean success, String detail) {
        eventBus.publish(new NotificationDelivered(clock.instant(), notification.monitorId(), channel.type(), success, detail));
    }
}
