package com.communitychat.server.notification;

import com.communitychat.server.model.AdminNotification;

/**
 * Forwards a stored admin notification to an external channel.
 */
public interface NotificationPublisher {

    void publish(AdminNotification notification);
}
