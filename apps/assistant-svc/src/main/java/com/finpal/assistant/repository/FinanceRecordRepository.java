package com.finpal.assistant.repository;

import com.finpal.assistant.model.FinancialRecord;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface FinanceRecordRepository {

    Optional<FinancialRecord> findByIdentifier(String identifier);

    void save(String identifier, FinancialRecord record);

    boolean saveIfAbsent(String identifier, FinancialRecord record);

    FinancialRecord update(String identifier, UnaryOperator<FinancialRecord> remapping);

    boolean seedIfMissing(Map<String, FinancialRecord> seed);
}
