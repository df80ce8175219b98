package com.finpal.assistant.query;

public enum Topic {
    BANK_BALANCE,
    MUTUAL_FUNDS,
    STOCKS,
    LOAN,
    CREDIT_SCORE,
    NET_WORTH,
    /** Blank message; no rule was evaluated. */
    EMPTY_MESSAGE,
    /** No rule matched; the message is echoed back. */
    FALLBACK
}
