package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.model.InsightShare;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Persistence for share links. Rows are keyed by a salted hash; plaintext tokens leave only
 * through {@link #createShare}.
 */
public interface InsightShareStore {

    /**
     * Mints a new token and stores the payload under its hash.
     *
     * @param window    window the token is bound to.
     * @param payload   serialized snapshot.
     * @param expiresAt optional expiry recorded with the row.
     * @return the plaintext token.
     * @throws ShareUnavailableException when no unique token could be generated.
     */
    String createShare(InsightWindow window, Map<String, Object> payload, @Nullable Instant expiresAt);

    /**
     * Looks up a share and records the access time on a best-effort basis.
     *
     * @param token plaintext token.
     * @return stored share.
     * @throws ShareTokenNotFoundException when the token is unknown.
     */
    InsightShare getShare(String token);

    /**
     * Overwrites the stored payload and expiry and bumps the access time.
     *
     * @throws ShareTokenNotFoundException when the token is unknown.
     */
    void updatePayload(String token, Map<String, Object> payload, @Nullable Instant expiresAt);
}
