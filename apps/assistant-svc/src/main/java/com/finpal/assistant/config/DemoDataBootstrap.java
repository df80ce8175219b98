package com.finpal.assistant.config;

import com.finpal.assistant.model.FinancialRecord;
import com.finpal.assistant.repository.FinanceRecordRepository;
import com.finpal.assistant.user.UserAccount;
import com.finpal.assistant.user.UserRepository;
import jakarta.annotation.PostConstruct;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a demo user and its finance entry when the store files do not exist yet.
 * Existing files are never touched. Disable with finpal.storage.seed-demo-data=false.
 */
@Component
public class DemoDataBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DemoDataBootstrap.class);

    static final String DEMO_PHONE = "9823533097";

    private final FinpalProperties properties;
    private final UserRepository userRepository;
    private final FinanceRecordRepository financeRecordRepository;

    public DemoDataBootstrap(FinpalProperties properties,
                             UserRepository userRepository,
                             FinanceRecordRepository financeRecordRepository) {
        this.properties = properties;
        this.userRepository = userRepository;
        this.financeRecordRepository = financeRecordRepository;
    }

    @PostConstruct
    void maybeSeed() {
        if (!properties.storage().seedDemoDataFlag()) {
            log.info("Demo data seeding disabled (finpal.storage.seed-demo-data=false)");
            return;
        }
        boolean usersSeeded = userRepository.seedIfMissing(
                Map.of(DEMO_PHONE, new UserAccount(null, "Demo User", "demo123")));
        boolean financeSeeded = financeRecordRepository.seedIfMissing(
                Map.of(DEMO_PHONE, new FinancialRecord(850_000L, 600_000L, 400_000L, 300_000L, 820L)));
        if (usersSeeded || financeSeeded) {
            log.info("Demo data seeded: users={}, finance={}", usersSeeded, financeSeeded);
        } else {
            log.info("Demo data seeding skipped: store files already present");
        }
    }
}
