package com.bko.coachbot.dispatch;

public enum DispatchStatus {
    SENT,
    REJECTED
}
