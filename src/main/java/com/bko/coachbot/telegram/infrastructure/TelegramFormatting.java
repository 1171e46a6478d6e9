package com.bko.coachbot.telegram.infrastructure;

/**
 * Generated text uses {@code **bold**}; the bot sends HTML, so everything else is escaped first.
 */
final class TelegramFormatting {

    private TelegramFormatting() {
    }

    static String toHtml(String text) {
        String escaped = text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
        String[] parts = escaped.split("\\*\\*", -1);
        if (parts.length < 3) {
            return escaped;
        }
        StringBuilder html = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            if (i % 2 == 1 && i + 1 < parts.length) {
                html.append("<b>").append(parts[i]).append("</b>");
            } else if (i % 2 == 1) {
                html.append("**").append(parts[i]);
            } else {
                html.append(parts[i]);
            }
        }
        return html.toString();
    }
}
