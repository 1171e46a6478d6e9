package com.bko.coachbot.content;

public enum IntentKind {
    MORNING_MOTIVATION,
    CHECK_IN,
    HEALTH_UPDATE,
    CHAT_REPLY
}
