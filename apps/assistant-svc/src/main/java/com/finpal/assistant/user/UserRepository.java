package com.finpal.assistant.user;

import java.util.Map;
import java.util.Optional;

public interface UserRepository {

    Optional<UserAccount> findByPhone(String phone);

    boolean existsByPhone(String phone);

    /** Stores the account unless the phone is already registered; returns whether it was stored. */
    boolean saveIfAbsent(String phone, UserAccount account);

    boolean seedIfMissing(Map<String, UserAccount> seed);
}
