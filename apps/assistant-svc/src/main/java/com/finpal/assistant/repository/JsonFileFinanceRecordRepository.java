package com.finpal.assistant.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finpal.assistant.config.FinpalProperties;
import com.finpal.assistant.model.FinancialRecord;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileFinanceRecordRepository implements FinanceRecordRepository {

    private final JsonDocumentStore<FinancialRecord> store;

    public JsonFileFinanceRecordRepository(FinpalProperties properties, ObjectMapper objectMapper) {
        this.store = new JsonDocumentStore<>(properties.storage().financePath(), objectMapper, FinancialRecord.class);
    }

    @Override
    public Optional<FinancialRecord> findByIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return store.get(identifier);
    }

    @Override
    public void save(String identifier, FinancialRecord record) {
        store.put(identifier, record);
    }

    @Override
    public boolean saveIfAbsent(String identifier, FinancialRecord record) {
        return store.putIfAbsent(identifier, record);
    }

    @Override
    public FinancialRecord update(String identifier, UnaryOperator<FinancialRecord> remapping) {
        return store.update(identifier, remapping);
    }

    @Override
    public boolean seedIfMissing(Map<String, FinancialRecord> seed) {
        return store.initializeIfMissing(seed);
    }
}
