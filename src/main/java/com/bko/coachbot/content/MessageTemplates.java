package com.bko.coachbot.content;

/**
 * Static texts: fallbacks for every intent plus the fixed bot replies.
 */
public final class MessageTemplates {
    public static final String TRY_AGAIN_LATER =
            "Sorry, I ran into a problem handling that. Please try again later.";
    public static final String START_FIRST =
            "I don't know you yet. Send /start so I can set up your profile.";
    public static final String NOT_LINKED =
            "Your Whoop account is not linked yet. Use /linkwhoop to connect it.";
    public static final String RELINK_REQUIRED =
            "I lost access to your Whoop data. Use /linkwhoop to connect your account again.";
    public static final String UNLINKED =
            "Your Whoop account has been unlinked and the stored tokens were deleted.";
    public static final String LINKED =
            "Your Whoop account is linked. I can now read your sleep, recovery and workouts. ✅";

    private MessageTemplates() {
    }

    public static String welcome(String name) {
        return "Welcome, " + name + ". I am your health optimization assistant. 🤖\n\n"
                + "My job is to turn your health data into small, concrete decisions that add up. 📊\n\n"
                + "To start, connect your wearable:\n"
                + "- Use /linkwhoop to connect your Whoop device ⌚️\n"
                + "- I will then follow your sleep 😴, recovery 🔄 and activity 🏃\n\n"
                + "Other commands:\n"
                + "- /report for a summary of your latest data\n"
                + "- /motivateme when you need a push 💪\n"
                + "- /unlinkwhoop to disconnect your wearable\n\n"
                + "Ready to begin? 💪";
    }

    public static String linkInvitation(String url) {
        return "Tap the link below to connect your Whoop account. It stays valid for 15 minutes.\n\n" + url;
    }

    public static String fallback(IntentKind kind, String name) {
        return switch (kind) {
            case MORNING_MOTIVATION -> "WAKE UP WARRIOR! Your greatness awaits. NO EXCUSES! 💪";
            case CHECK_IN -> "Hi " + name + ", quick check-in: how are you feeling today? "
                    + "A short walk and an early night go a long way.";
            case HEALTH_UPDATE -> "I couldn't put your health report together right now. "
                    + "Your data is safe; ask again with /report in a little while.";
            case CHAT_REPLY -> "I couldn't come up with a good answer right now. Please try again in a moment.";
        };
    }
}
