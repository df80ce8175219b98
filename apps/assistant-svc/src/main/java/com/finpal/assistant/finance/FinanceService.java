package com.finpal.assistant.finance;

import com.finpal.assistant.model.FinancialRecord;
import com.finpal.assistant.repository.FinanceRecordRepository;
import com.finpal.assistant.security.IdentifierMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FinanceService {
    private static final Logger log = LoggerFactory.getLogger(FinanceService.class);

    private final FinanceRecordRepository financeRecordRepository;

    public FinanceService(FinanceRecordRepository financeRecordRepository) {
        this.financeRecordRepository = financeRecordRepository;
    }

    /** Stored record for {@code phone}, or an empty record when there is none. */
    public FinancialRecord find(String phone) {
        return financeRecordRepository.findByIdentifier(normalize(phone))
                .orElseGet(FinancialRecord::empty);
    }

    /**
     * Overwrites the fields present in {@code updates}, creating the record if needed.
     * Fields not mentioned keep their stored values.
     */
    public FinancialRecord update(String phone, FinancialRecord updates) {
        if (updates == null || updates.isEmpty()) {
            throw new IllegalArgumentException("No data provided");
        }
        String key = normalize(phone);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("phone must be provided");
        }
        FinancialRecord merged = financeRecordRepository.update(key,
                current -> (current != null ? current : FinancialRecord.empty()).mergedWith(updates));
        log.info("Finance record updated for phone={}", IdentifierMasker.mask(key));
        return merged;
    }

    private static String normalize(String phone) {
        return phone == null ? "" : phone.trim();
    }
}
