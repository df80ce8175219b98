package com.finpal.assistant.user;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finpal.assistant.config.FinpalProperties;
import com.finpal.assistant.repository.JsonDocumentStore;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileUserRepository implements UserRepository {

    private final JsonDocumentStore<UserAccount> store;

    public JsonFileUserRepository(FinpalProperties properties, ObjectMapper objectMapper) {
        this.store = new JsonDocumentStore<>(properties.storage().usersPath(), objectMapper, UserAccount.class);
    }

    @Override
    public Optional<UserAccount> findByPhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return Optional.empty();
        }
        return store.get(phone).map(account -> {
            // seeded entries carry no phone field; the directory key is authoritative
            if (account.getPhone() == null) {
                account.setPhone(phone);
            }
            return account;
        });
    }

    @Override
    public boolean existsByPhone(String phone) {
        return phone != null && !phone.isBlank() && store.containsKey(phone);
    }

    @Override
    public boolean saveIfAbsent(String phone, UserAccount account) {
        return store.putIfAbsent(phone, account);
    }

    @Override
    public boolean seedIfMissing(Map<String, UserAccount> seed) {
        return store.initializeIfMissing(seed);
    }
}
