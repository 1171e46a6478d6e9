package com.bko.coachbot.content.domain;

public interface ChatPort {
    ChatResult chat(ChatCommand command);

    /**
     * @param temperature sampling temperature, {@code null} for the model default
     */
    record ChatCommand(String model, String prompt, Float temperature) {}

    record ChatResult(String model, String text) {}
}
