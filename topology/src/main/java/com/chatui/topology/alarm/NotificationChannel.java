package com.chatui.topology.alarm;

// Fan-out target of alarm transitions, the SNS alerts topic in a deployment
@FunctionalInterface
public interface NotificationChannel {

    void deliver(AlarmNotification notification);
}
