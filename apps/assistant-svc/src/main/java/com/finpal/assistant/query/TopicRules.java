package com.finpal.assistant.query;

import static com.finpal.assistant.model.FinancialRecord.orZero;

import com.finpal.assistant.model.FinancialRecord;
import java.math.BigInteger;
import java.util.List;

/**
 * The built-in rule table, in priority order. The first matching rule wins, so a message
 * mentioning both "loan" and "credit" is answered by the loan rule.
 * Only the loan rule distinguishes a stored zero from other values.
 */
public final class TopicRules {

    private TopicRules() {
    }

    public static List<TopicRule> defaults() {
        return List.of(
                new TopicRule(Topic.BANK_BALANCE, List.of("balance", "bank", "savings"), TopicRules::bankBalance),
                new TopicRule(Topic.MUTUAL_FUNDS, List.of("mutual", "mf", "fund"), TopicRules::mutualFunds),
                new TopicRule(Topic.STOCKS, List.of("stock", "equity", "shares"), TopicRules::stocks),
                new TopicRule(Topic.LOAN, List.of("loan", "debt", "liability", "liabilities"), TopicRules::loan),
                new TopicRule(Topic.CREDIT_SCORE, List.of("credit", "cibil", "score"), TopicRules::creditScore),
                new TopicRule(Topic.NET_WORTH, List.of("net worth", "total worth", "networth", "worth"), TopicRules::netWorth)
        );
    }

    static String bankBalance(FinancialRecord record) {
        if (record.bankBalance() == null) {
            return "I don't have your bank balance information.";
        }
        return "Your bank balance is " + RupeeFormatter.format(record.bankBalance()) + ".";
    }

    static String mutualFunds(FinancialRecord record) {
        if (record.mutualFunds() == null) {
            return "I don't have mutual funds information for you.";
        }
        return "Your mutual funds are worth " + RupeeFormatter.format(record.mutualFunds()) + ".";
    }

    static String stocks(FinancialRecord record) {
        if (record.stocks() == null) {
            return "I don't have stock holdings information for you.";
        }
        return "Your stock holdings are worth " + RupeeFormatter.format(record.stocks()) + ".";
    }

    static String loan(FinancialRecord record) {
        Long loan = record.loan();
        if (loan == null) {
            return "I don't have loan / liability details for you.";
        }
        if (loan == 0L) {
            return "You have no active loans or liabilities.";
        }
        return "Your current loan is " + RupeeFormatter.format(loan) + ".";
    }

    static String creditScore(FinancialRecord record) {
        if (record.creditScore() == null) {
            return "Your credit score is not available.";
        }
        return "Your credit score is " + record.creditScore() + ".";
    }

    // absent fields count as zero here, unlike the single-field rules; summed without overflow
    static String netWorth(FinancialRecord record) {
        BigInteger netWorth = amount(record.bankBalance())
                .add(amount(record.mutualFunds()))
                .add(amount(record.stocks()))
                .subtract(amount(record.loan()));
        if (netWorth.signum() < 0) {
            return "Your liabilities exceed your assets by " + RupeeFormatter.format(netWorth.negate()) + ".";
        }
        return "Your total net worth is " + RupeeFormatter.format(netWorth) + ".";
    }

    private static BigInteger amount(Long value) {
        return BigInteger.valueOf(orZero(value));
    }
}
