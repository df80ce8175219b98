package com.finpal.assistant.config;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "finpal")
public record FinpalProperties(
        Storage storage,
        Security security,
        Query query
) {

    @ConstructorBinding
    public FinpalProperties {
        if (storage == null) {
            throw new IllegalArgumentException("storage configuration must be provided");
        }
        if (security == null) {
            throw new IllegalArgumentException("security configuration must be provided");
        }
        // query may be null; defaults to the system time zone
    }

    public Query query() {
        return query != null ? query : new Query(null);
    }

    public record Storage(String dataDir, String usersFile, String financeFile, Boolean seedDemoData) {
        public Storage {
            if (dataDir == null || dataDir.isBlank()) {
                throw new IllegalArgumentException("dataDir must be provided");
            }
            if (usersFile == null || usersFile.isBlank()) {
                usersFile = "users.json";
            }
            if (financeFile == null || financeFile.isBlank()) {
                financeFile = "finance.json";
            }
        }

        public Path usersPath() {
            return Path.of(dataDir).resolve(usersFile);
        }

        public Path financePath() {
            return Path.of(dataDir).resolve(financeFile);
        }

        public boolean seedDemoDataFlag() {
            return seedDemoData == null || seedDemoData;
        }
    }

    public record Security(String jwtSecret, Long tokenTtlSeconds) {
        public Security {
            if (jwtSecret == null || jwtSecret.isBlank()) {
                throw new IllegalArgumentException("jwtSecret must be provided");
            }
            if (tokenTtlSeconds != null && tokenTtlSeconds <= 0) {
                throw new IllegalArgumentException("tokenTtlSeconds must be positive");
            }
        }

        public long tokenTtlOrDefault() {
            return tokenTtlSeconds != null ? tokenTtlSeconds : 3600L;
        }
    }

    public record Query(String zone) {
        public Query {
            if (zone != null && !zone.isBlank()) {
                try {
                    ZoneId.of(zone);
                } catch (DateTimeException ex) {
                    throw new IllegalArgumentException("zone is not a valid time zone id: " + zone, ex);
                }
            }
        }

        public ZoneId zoneOrDefault() {
            return (zone != null && !zone.isBlank()) ? ZoneId.of(zone) : ZoneId.systemDefault();
        }
    }
}
