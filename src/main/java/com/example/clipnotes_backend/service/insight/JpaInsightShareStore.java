package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.model.InsightShare;
import com.example.clipnotes_backend.repository.InsightShareRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.Nullable;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link InsightShareStore} backed by the {@code insight_share} table.
 */
public class JpaInsightShareStore implements InsightShareStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaInsightShareStore.class);
    static final String DEFAULT_TOKEN_SALT = "clipnotes-share-token";
    static final int MAX_ATTEMPTS = 5;
    private static final int TOKEN_BYTES = 16;

    private final InsightShareRepository shareRepository;
    private final String tokenSalt;
    private final Clock clock;
    private final Supplier<String> tokenGenerator;

    public JpaInsightShareStore(InsightShareRepository shareRepository, @Nullable String tokenSalt, Clock clock) {
        this(shareRepository, tokenSalt, clock, randomTokens(new SecureRandom()));
    }

    JpaInsightShareStore(InsightShareRepository shareRepository, @Nullable String tokenSalt, Clock clock,
                         Supplier<String> tokenGenerator) {
        if (tokenSalt == null || tokenSalt.isBlank()) {
            LOGGER.warn("JpaInsightShareStore insights.share.token-salt is not configured; falling back to the development salt");
        }
        this.shareRepository = shareRepository;
        this.tokenSalt = tokenSalt == null || tokenSalt.isBlank() ? DEFAULT_TOKEN_SALT : tokenSalt;
        this.clock = clock;
        this.tokenGenerator = tokenGenerator;
    }

    @Override
    public String createShare(InsightWindow window, Map<String, Object> payload, @Nullable Instant expiresAt) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String token = tokenGenerator.get();
            String tokenHash = hashToken(token);
            if (shareRepository.existsById(tokenHash)) {
                LOGGER.warn("JpaInsightShareStore token collision attempt={} window={}", attempt, window);
                continue;
            }
            InsightShare share = new InsightShare(tokenHash, window, payload, clock.instant());
            share.setExpiresAt(expiresAt);
            try {
                shareRepository.saveAndFlush(share);
            } catch (DataIntegrityViolationException ex) {
                LOGGER.warn("JpaInsightShareStore token collision on insert attempt={} window={}", attempt, window);
                continue;
            }
            LOGGER.info("JpaInsightShareStore created window={} hash={}", window, abbreviate(tokenHash));
            return token;
        }
        throw new ShareUnavailableException("Unable to generate unique share token");
    }

    @Override
    public InsightShare getShare(String token) {
        String tokenHash = hashToken(token);
        InsightShare share = shareRepository.findById(tokenHash)
                .orElseThrow(ShareTokenNotFoundException::new);

        Instant now = clock.instant();
        try {
            shareRepository.touch(tokenHash, now);
            share.setLastAccessedAt(now);
        } catch (DataAccessException ex) {
            LOGGER.warn("JpaInsightShareStore touch failed hash={}: {}", abbreviate(tokenHash), ex.getMessage());
        }
        return share;
    }

    @Override
    @Transactional
    public void updatePayload(String token, Map<String, Object> payload, @Nullable Instant expiresAt) {
        String tokenHash = hashToken(token);
        InsightShare share = shareRepository.findById(tokenHash)
                .orElseThrow(ShareTokenNotFoundException::new);
        share.setPayload(payload);
        share.setExpiresAt(expiresAt);
        share.setLastAccessedAt(clock.instant());
        shareRepository.save(share);
    }

    /**
     * Computes the persisted key for a plaintext token: hex SHA-256 over {@code salt ":" token}.
     */
    String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(tokenSalt.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) ':');
            digest.update(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Supplier<String> randomTokens(SecureRandom random) {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return () -> {
            byte[] bytes = new byte[TOKEN_BYTES];
            random.nextBytes(bytes);
            return encoder.encodeToString(bytes);
        };
    }

    private static String abbreviate(String tokenHash) {
        return tokenHash.substring(0, 12);
    }
}
