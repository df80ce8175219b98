package com.finpal.assistant.config;

import com.finpal.assistant.query.QueryResponder;
import com.finpal.assistant.query.TopicRules;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueryConfig {

    @Bean
    Clock clock(FinpalProperties properties) {
        return Clock.system(properties.query().zoneOrDefault());
    }

    @Bean
    QueryResponder queryResponder(Clock clock) {
        return new QueryResponder(TopicRules.defaults(), clock);
    }
}
