package com.chatui.topology.alarm;

public record AlarmNotification(
    String alarmName,
    String description,
    AlarmState previousState,
    AlarmState state,
    double triggeringValue
) {
}
