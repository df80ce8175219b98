package com.finpal.assistant.query;

import com.finpal.assistant.model.FinancialRecord;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Answers a free-text message from a user's financial record by walking an ordered rule
 * table. Stateless: the same message and record always produce the same reply, except for
 * the server time embedded in the fallback reply. Never throws for a string input.
 */
public class QueryResponder {

    static final String EMPTY_MESSAGE_REPLY = "I didn't get that. Please send a message.";
    private static final DateTimeFormatter SERVER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final List<TopicRule> rules;
    private final Clock clock;

    public QueryResponder(List<TopicRule> rules, Clock clock) {
        this.rules = List.copyOf(rules);
        this.clock = clock;
    }

    public QueryReply respond(String message, FinancialRecord record) {
        if (message == null || message.isBlank()) {
            return new QueryReply(Topic.EMPTY_MESSAGE, EMPTY_MESSAGE_REPLY);
        }
        FinancialRecord snapshot = record != null ? record : FinancialRecord.empty();
        String normalized = message.toLowerCase(Locale.ROOT);
        for (TopicRule rule : rules) {
            if (rule.matches(normalized)) {
                return new QueryReply(rule.topic(), rule.reply(snapshot));
            }
        }
        return new QueryReply(Topic.FALLBACK, fallback(message));
    }

    private String fallback(String message) {
        String serverTime = LocalDateTime.now(clock).format(SERVER_TIME);
        return "I am still Learning, I don't have information about it. \"" + message
                + "\" — (server time: " + serverTime + ")";
    }
}
