package com.codeops.lineage.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;

/**
 * SHA-256 digests used for change detection and commit identity.
 *
 * <p>The content hash covers only the canonical content. The commit hash chains the content
 * with the message, author, commit timestamp and the parent's hash, so two commits share a
 * hash only when every one of those inputs is equal.</p>
 */
@Component
@RequiredArgsConstructor
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";
    private static final char FIELD_SEPARATOR = '\n';

    private final ContentCodec contentCodec;

    public String contentHash(Map<String, Object> content) {
        return sha256(contentCodec.encode(content));
    }

    /**
     * Computes the identifying hash of a commit.
     *
     * @param content    the committed content
     * @param message    the commit message
     * @param authorId   the author
     * @param timestamp  the commit date
     * @param parentHash hash of the primary parent, or null for a root commit
     * @return hex-encoded SHA-256 digest
     */
    public String commitHash(Map<String, Object> content, String message, UUID authorId,
                             Instant timestamp, String parentHash) {
        StringBuilder input = new StringBuilder(contentCodec.encode(content))
                .append(FIELD_SEPARATOR).append(message != null ? message : "")
                .append(FIELD_SEPARATOR).append(authorId)
                .append(FIELD_SEPARATOR).append(timestamp)
                .append(FIELD_SEPARATOR).append(parentHash != null ? parentHash : "");
        return sha256(input.toString());
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
