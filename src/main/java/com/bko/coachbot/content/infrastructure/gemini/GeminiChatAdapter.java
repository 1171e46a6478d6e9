package com.bko.coachbot.content.infrastructure.gemini;

import com.bko.coachbot.content.domain.ChatPort;
import com.google.genai.Client;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;

public class GeminiChatAdapter implements ChatPort {
    private final Client client;

    public GeminiChatAdapter(Client client) {
        this.client = client;
    }

    @Override
    public ChatResult chat(ChatCommand command) {
        String model = command.model();
        GenerateContentConfig config = command.temperature() == null
                ? null
                : GenerateContentConfig.builder().temperature(command.temperature()).build();
        GenerateContentResponse response = client.models.generateContent(model, command.prompt(), config);
        String text = response != null ? response.text() : "";
        return new ChatResult(model, text);
    }
}
