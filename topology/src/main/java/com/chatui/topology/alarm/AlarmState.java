package com.chatui.topology.alarm;

public enum AlarmState {
    INSUFFICIENT_DATA,
    OK,
    ALARM
}
