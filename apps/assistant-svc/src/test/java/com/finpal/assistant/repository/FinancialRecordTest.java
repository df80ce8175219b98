package com.finpal.assistant.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finpal.assistant.model.FinancialRecord;
import org.junit.jupiter.api.Test;

class FinancialRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void emptyRecordSerializesAsEmptyObject() throws Exception {
        assertThat(objectMapper.writeValueAsString(FinancialRecord.empty())).isEqualTo("{}");
    }

    @Test
    void mergeKeepsFieldsMissingFromUpdate() {
        FinancialRecord current = new FinancialRecord(100L, 200L, 300L, 400L, 700L);

        FinancialRecord merged = current.mergedWith(new FinancialRecord(null, null, null, 0L, 750L));

        assertThat(merged).isEqualTo(new FinancialRecord(100L, 200L, 300L, 0L, 750L));
    }

    @Test
    void readsSnakeCaseFieldsAndIgnoresUnknownOnes() throws Exception {
        FinancialRecord record = objectMapper.readValue(
                "{\"bank_balance\":850000,\"credit_score\":820,\"nickname\":\"main\"}", FinancialRecord.class);

        assertThat(record).isEqualTo(new FinancialRecord(850_000L, null, null, null, 820L));
        assertThat(record.isEmpty()).isFalse();
    }
}
