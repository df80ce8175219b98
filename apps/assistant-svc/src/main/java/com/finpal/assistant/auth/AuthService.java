package com.finpal.assistant.auth;

import com.finpal.assistant.model.FinancialRecord;
import com.finpal.assistant.repository.FinanceRecordRepository;
import com.finpal.assistant.security.IdentifierMasker;
import com.finpal.assistant.security.JwtIssuerService;
import com.finpal.assistant.user.UserAccount;
import com.finpal.assistant.user.UserRepository;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Login and registration against the user directory. Passwords are stored and compared as
 * plain text.
 */
@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final Set<String> ACCOUNT_FIELDS = Set.of("phone", "name", "password");

    private final UserRepository userRepository;
    private final FinanceRecordRepository financeRecordRepository;
    private final JwtIssuerService jwtIssuerService;

    public AuthService(UserRepository userRepository,
                       FinanceRecordRepository financeRecordRepository,
                       JwtIssuerService jwtIssuerService) {
        this.userRepository = userRepository;
        this.financeRecordRepository = financeRecordRepository;
        this.jwtIssuerService = jwtIssuerService;
    }

    public record LoginResult(String phone, String name, FinancialRecord finance, String accessToken, long expiresIn) {}

    public LoginResult login(String phone, String password) {
        String trimmedPhone = phone == null ? "" : phone.trim();
        if (trimmedPhone.isEmpty() || password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Missing phone or password");
        }
        UserAccount user = userRepository.findByPhone(trimmedPhone)
                .filter(account -> account.passwordMatches(password))
                .orElseThrow(() -> {
                    log.info("Login rejected for phone={}", IdentifierMasker.mask(trimmedPhone));
                    return new InvalidCredentialsException();
                });
        FinancialRecord finance = financeRecordRepository.findByIdentifier(trimmedPhone)
                .orElseGet(FinancialRecord::empty);
        String token = jwtIssuerService.issue(trimmedPhone);
        log.info("Login succeeded for phone={}", IdentifierMasker.mask(trimmedPhone));
        return new LoginResult(trimmedPhone, user.getName(), finance, token, jwtIssuerService.defaultTtlSeconds());
    }

    /**
     * Registers a user from the submitted form fields. Fields other than name, phone and password
     * are kept on the account as profile data. A zeroed finance record is created unless one
     * already exists for the phone.
     */
    public void register(Map<String, Object> fields) {
        String name = text(fields.get("name")).trim();
        String phone = text(fields.get("phone")).trim();
        String password = text(fields.get("password"));
        if (name.isEmpty() || phone.isEmpty() || password.isEmpty()) {
            throw new IllegalArgumentException("Missing name/phone/password");
        }

        UserAccount account = new UserAccount(phone, name, password);
        fields.forEach((key, value) -> {
            if (!ACCOUNT_FIELDS.contains(key)) {
                account.putProfileField(key, value);
            }
        });
        if (!userRepository.saveIfAbsent(phone, account)) {
            log.info("Registration rejected, phone={} already registered", IdentifierMasker.mask(phone));
            throw new PhoneAlreadyRegisteredException();
        }
        boolean financeCreated = financeRecordRepository.saveIfAbsent(phone, FinancialRecord.zeroed());
        log.info("Registered phone={} profileFields={} financeCreated={}",
                IdentifierMasker.mask(phone), account.getProfile().keySet(), financeCreated);
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
