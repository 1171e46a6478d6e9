package com.bko.coachbot.content;

/**
 * Text ready to send, tagged with the branch that produced it.
 */
public record MessageBody(String text, Source source) {
    public enum Source { GENERATED, TEMPLATE }

    public static MessageBody generated(String text) {
        return new MessageBody(text, Source.GENERATED);
    }

    public static MessageBody template(String text) {
        return new MessageBody(text, Source.TEMPLATE);
    }

    public boolean isGenerated() {
        return source == Source.GENERATED;
    }
}
