package com.finpal.assistant.query;

import com.finpal.assistant.model.FinancialRecord;
import com.finpal.assistant.repository.FinanceRecordRepository;
import com.finpal.assistant.security.IdentifierMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QueryService {
    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final FinanceRecordRepository financeRecordRepository;
    private final QueryResponder queryResponder;

    public QueryService(FinanceRecordRepository financeRecordRepository, QueryResponder queryResponder) {
        this.financeRecordRepository = financeRecordRepository;
        this.queryResponder = queryResponder;
    }

    /**
     * Answers {@code message} for the user identified by {@code identifier}. An unknown or blank
     * identifier is answered from an empty record rather than rejected.
     */
    public String respond(String identifier, String message) {
        String phone = identifier == null ? "" : identifier.trim();
        FinancialRecord record = financeRecordRepository.findByIdentifier(phone)
                .orElseGet(FinancialRecord::empty);
        QueryReply reply = queryResponder.respond(message, record);
        log.debug("Query answered: topic={} phone={} recordEmpty={}",
                reply.topic(), IdentifierMasker.mask(phone), record.isEmpty());
        return reply.text();
    }
}
