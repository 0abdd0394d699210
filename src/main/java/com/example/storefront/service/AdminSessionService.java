package com.example.storefront.service;

import com.example.storefront.config.AdminProperties;
import com.example.storefront.exception.UnauthorizedException;
import com.example.storefront.exception.UnauthorizedException.Reason;
import com.example.storefront.model.LoginResult;
import com.example.storefront.persistence.document.AdminSessionDocument;
import com.example.storefront.persistence.repository.AdminSessionRepository;
import com.example.storefront.util.Timestamps;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;

/**
 * Issues and checks admin bearer tokens. A session is active from login until {@code expires_at} and is
 * never renewed; after that every lookup is rejected and a new login is required.
 */
@Service
public class AdminSessionService {

    private static final Logger log = LoggerFactory.getLogger(AdminSessionService.class);
    private static final int TOKEN_BYTES = 16;

    private final AdminSessionRepository adminSessionRepository;
    private final AdminProperties adminProperties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder();
    private final String passwordHash;

    public AdminSessionService(AdminSessionRepository adminSessionRepository, AdminProperties adminProperties, Clock clock) {
        Assert.hasText(adminProperties.getPassword(), "admin password required");
        this.adminSessionRepository = adminSessionRepository;
        this.adminProperties = adminProperties;
        this.clock = clock;
        this.passwordHash = passwordEncoder.encode(adminProperties.getPassword());
    }

    public LoginResult login(String username, String password) {
        boolean usernameMatches = constantTimeEquals(username, adminProperties.getUsername());
        boolean passwordMatches = password != null && passwordEncoder.matches(password, passwordHash);
        if (!usernameMatches || !passwordMatches) {
            log.info("Rejected admin login for user {}", username);
            throw new UnauthorizedException(Reason.INVALID_CREDENTIALS);
        }

        Instant now = Timestamps.now(clock);
        AdminSessionDocument session = AdminSessionDocument.builder()
            .token(generateToken())
            .createdAt(now)
            .expiresAt(now.plus(adminProperties.getSessionTtl()))
            .build();
        adminSessionRepository.insert(session);

        log.info("Admin session issued, expires at {}", session.getExpiresAt());
        return new LoginResult(session.getToken(), Timestamps.format(session.getExpiresAt()));
    }

    public void authorize(String token) {
        if (!StringUtils.hasText(token)) {
            throw reject(Reason.MISSING_TOKEN);
        }
        AdminSessionDocument session = adminSessionRepository.findByToken(token)
            .orElseThrow(() -> reject(Reason.INVALID_TOKEN));
        if (session.isExpiredAt(Instant.now(clock))) {
            throw reject(Reason.SESSION_EXPIRED);
        }
    }

    private UnauthorizedException reject(Reason reason) {
        log.debug("Admin authorization rejected: {}", reason);
        return new UnauthorizedException(reason);
    }

    private String generateToken() {
        byte[] buffer = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(buffer);
        return Hex.encodeHexString(buffer);
    }

    private static boolean constantTimeEquals(String provided, String expected) {
        if (provided == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
            provided.getBytes(StandardCharsets.UTF_8),
            expected.getBytes(StandardCharsets.UTF_8)
        );
    }
}
