package com.finpal.assistant.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final FinpalProperties props;

    public StartupDiagnostics(FinpalProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        // structural info only, never the secret itself
        var storage = props.storage();
        log.info("Storage config: users='{}', finance='{}', seedDemoData={}",
                storage.usersPath().toAbsolutePath(), storage.financePath().toAbsolutePath(), storage.seedDemoDataFlag());
        log.info("Security config: jwtSecretLength={}, tokenTtlSeconds={}, env(FINPAL_JWT_SECRET) set={}",
                props.security().jwtSecret().length(), props.security().tokenTtlOrDefault(),
                System.getenv("FINPAL_JWT_SECRET") != null);
        log.info("Query config: zone='{}'", props.query().zoneOrDefault());
    }
}
