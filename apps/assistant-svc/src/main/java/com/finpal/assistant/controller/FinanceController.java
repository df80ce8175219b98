package com.finpal.assistant.controller;

import com.finpal.assistant.controller.dto.FinanceUpdateResponseDto;
import com.finpal.assistant.finance.FinanceService;
import com.finpal.assistant.model.FinancialRecord;
import com.finpal.assistant.security.AuthenticatedUserProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FinanceController {

    private final FinanceService financeService;
    private final AuthenticatedUserProvider authenticatedUserProvider;
    private final LenientRequestBodyReader bodyReader;

    public FinanceController(FinanceService financeService,
                             AuthenticatedUserProvider authenticatedUserProvider,
                             LenientRequestBodyReader bodyReader) {
        this.financeService = financeService;
        this.authenticatedUserProvider = authenticatedUserProvider;
        this.bodyReader = bodyReader;
    }

    /** Stored finance record, or {} when the phone has none. */
    @GetMapping(path = "/mcp/{phone}", produces = MediaType.APPLICATION_JSON_VALUE)
    public FinancialRecord financeRecord(@PathVariable String phone) {
        return financeService.find(phone);
    }

    @PostMapping(path = "/update_finance/{phone}", produces = MediaType.APPLICATION_JSON_VALUE)
    public FinanceUpdateResponseDto updateFinance(@PathVariable String phone,
                                                  @RequestBody(required = false) String body) {
        String owner = phone.trim();
        authenticatedUserProvider.requireSameUser(owner);
        FinancialRecord updates = bodyReader.read(body, FinancialRecord.class, FinancialRecord::empty);
        return new FinanceUpdateResponseDto(true, financeService.update(owner, updates));
    }
}
