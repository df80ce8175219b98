package com.finpal.assistant.security;

import com.finpal.assistant.config.FinpalProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

@Service
public class JwtIssuerService {

    public static final String ISSUER = "finpal";

    private final SecretKey key;
    private final long defaultTtlSeconds;

    public JwtIssuerService(FinpalProperties properties) {
        byte[] bytes = properties.security().jwtSecret().getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) { // HS256 needs at least 256-bit secret
            throw new IllegalStateException("jwtSecret must be at least 32 bytes");
        }
        this.key = Keys.hmacShaKeyFor(bytes);
        this.defaultTtlSeconds = properties.security().tokenTtlOrDefault();
    }

    public long defaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public String issue(String phone) {
        return issue(phone, defaultTtlSeconds);
    }

    public String issue(String phone, long ttlSeconds) {
        Instant now = Instant.now();
        return Jwts.builder()
                .setSubject(phone)
                .claim("scope", "user")
                .setIssuer(ISSUER)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }
}
