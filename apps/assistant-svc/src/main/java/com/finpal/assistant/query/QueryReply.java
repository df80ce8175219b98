package com.finpal.assistant.query;

public record QueryReply(Topic topic, String text) {
}
