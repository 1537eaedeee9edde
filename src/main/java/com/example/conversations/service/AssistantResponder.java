package com.example.conversations.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Deterministic keyword classifier that picks the assistant's reply to a user message.
 *
 * <p>Rules are checked in order and the first match wins. Keywords match whole words,
 * case-insensitively, so "this" does not count as the greeting "hi". The same rule means
 * longer forms are not keywords either: "helpful", "thankful" and "hellooo" fall through
 * to the later rules.</p>
 */
@Component
public class AssistantResponder {

    public static final String GREETING_REPLY = "Hello! How can I assist you today?";
    public static final String HELP_REPLY = "I'm here to help! What do you need assistance with?";
    public static final String QUESTION_REPLY = "That's an interesting question. Let me think about that...";
    public static final String GRATITUDE_REPLY = "You're welcome! Is there anything else I can help with?";
    public static final String DEFAULT_REPLY = "I understand. Can you tell me more about that?";

    private static final List<Rule> RULES = List.of(
            new Rule(keywords("hello", "hi", "hey"), GREETING_REPLY),
            new Rule(keywords("help", "support"), HELP_REPLY),
            new Rule(Pattern.compile("\\?"), QUESTION_REPLY),
            new Rule(keywords("thank", "thanks"), GRATITUDE_REPLY)
    );

    /**
     * @param text user message text; {@code null} is treated as empty
     * @return the reply, never empty
     */
    public String replyTo(String text) {
        String input = text == null ? "" : text;
        return RULES.stream()
                .filter(rule -> rule.pattern().matcher(input).find())
                .map(Rule::reply)
                .findFirst()
                .orElse(DEFAULT_REPLY);
    }

    private static Pattern keywords(String... words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private record Rule(Pattern pattern, String reply) {
    }
}
