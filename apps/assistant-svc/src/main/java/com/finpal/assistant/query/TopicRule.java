package com.finpal.assistant.query;

import com.finpal.assistant.model.FinancialRecord;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * One entry of the responder's rule table. Matches when the lower-cased message contains
 * any of the triggers; the replier then builds the sentence from the user's record.
 */
public record TopicRule(Topic topic, List<String> triggers, Function<FinancialRecord, String> replier) {

    public TopicRule {
        if (topic == null) {
            throw new IllegalArgumentException("topic must be provided");
        }
        if (triggers == null || triggers.isEmpty()) {
            throw new IllegalArgumentException("triggers must not be empty");
        }
        if (replier == null) {
            throw new IllegalArgumentException("replier must be provided");
        }
        triggers = triggers.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
    }

    /** {@code normalizedMessage} must already be lower-cased. */
    public boolean matches(String normalizedMessage) {
        for (String trigger : triggers) {
            if (normalizedMessage.contains(trigger)) {
                return true;
            }
        }
        return false;
    }

    public String reply(FinancialRecord record) {
        return replier.apply(record);
    }
}
