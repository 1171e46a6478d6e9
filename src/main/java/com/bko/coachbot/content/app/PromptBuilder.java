package com.bko.coachbot.content.app;

import com.bko.coachbot.content.IntentKind;
import com.bko.coachbot.content.UserContext;
import org.springframework.stereotype.Component;

@Component
public class PromptBuilder {
    private static final String COACH_INSTRUCTIONS =
            "IDENTITY:\n"
                    + "You are a health-focused assistant talking to a user on Telegram. Your goal is to become the "
                    + "user's trusted health authority with clear, concise guidance that never overwhelms.\n\n"
                    + "CONTEXT:\n"
                    + "User's name: %s\n"
                    + "User's health data: %s\n"
                    + "Recent chat history: %s\n"
                    + "Current message to respond to: %s\n\n"
                    + "RULES:\n"
                    + "1) Keep it short, preferably under 3 sentences, in plain direct language.\n"
                    + "2) Do not ask for data that is already in the health data above.\n"
                    + "3) Base advice on sleep quality, recovery (HRV, resting heart rate) and strain.\n"
                    + "4) Start with small, easy suggestions and build trust before asking for more.\n"
                    + "5) Be proactive but not overbearing.\n";

    private static final String MOTIVATION_INSTRUCTIONS =
            "You are an intense, no-nonsense motivational coach who delivers powerful, concise messages "
                    + "that hit hard.\n\n"
                    + "User's name: %s\n"
                    + "Context: %s\n\n"
                    + "Write a short, high-impact motivational message (max 2-3 sentences) that:\n"
                    + "1. Uses powerful, decisive language\n"
                    + "2. Creates urgency and intensity\n"
                    + "3. Pushes the user beyond their comfort zone\n\n"
                    + "The message should feel like a battle cry, not gentle encouragement.";

    private static final String REPORT_INSTRUCTIONS =
            "You are a health and fitness assistant with access to the user's WHOOP data.\n"
                    + "%s asked for a health report. These are the latest values per metric:\n\n"
                    + "%s\n\n"
                    + "Give a brief but insightful analysis of how the user is doing overall, referencing specific "
                    + "data points where it helps. Keep it short, polite and action-oriented.";

    private static final String CHECK_IN_MESSAGE = "(none: open the conversation with a short proactive check-in)";

    public String build(IntentKind kind, UserContext context) {
        String health = orDefault(context.healthSummary(), "No data");
        String history = context.recentConversation().isEmpty()
                ? "No history"
                : String.join("\n", context.recentConversation());
        return switch (kind) {
            case MORNING_MOTIVATION -> String.format(MOTIVATION_INSTRUCTIONS, context.userName(), health);
            case HEALTH_UPDATE -> String.format(REPORT_INSTRUCTIONS, context.userName(), health);
            case CHAT_REPLY -> String.format(COACH_INSTRUCTIONS, context.userName(), health, history,
                    orDefault(context.incomingMessage(), ""));
            case CHECK_IN -> String.format(COACH_INSTRUCTIONS, context.userName(), health, history, CHECK_IN_MESSAGE);
        };
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
