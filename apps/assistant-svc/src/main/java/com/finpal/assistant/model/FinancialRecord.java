package com.finpal.assistant.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-user financial snapshot. A {@code null} component means the value is not known,
 * which is not the same thing as a known zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FinancialRecord(
        @JsonProperty("bank_balance") Long bankBalance,
        @JsonProperty("mutual_funds") Long mutualFunds,
        @JsonProperty("stocks") Long stocks,
        @JsonProperty("loan") Long loan,
        @JsonProperty("credit_score") Long creditScore
) {

    private static final FinancialRecord EMPTY = new FinancialRecord(null, null, null, null, null);

    public static FinancialRecord empty() {
        return EMPTY;
    }

    /** Record created for a freshly registered user: every field known and zero. */
    public static FinancialRecord zeroed() {
        return new FinancialRecord(0L, 0L, 0L, 0L, 0L);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return bankBalance == null && mutualFunds == null && stocks == null && loan == null && creditScore == null;
    }

    /**
     * Returns a copy where every field present in {@code updates} replaces the current value.
     * Fields absent from {@code updates} are kept.
     */
    public FinancialRecord mergedWith(FinancialRecord updates) {
        if (updates == null) {
            return this;
        }
        return new FinancialRecord(
                updates.bankBalance != null ? updates.bankBalance : bankBalance,
                updates.mutualFunds != null ? updates.mutualFunds : mutualFunds,
                updates.stocks != null ? updates.stocks : stocks,
                updates.loan != null ? updates.loan : loan,
                updates.creditScore != null ? updates.creditScore : creditScore
        );
    }

    public static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
