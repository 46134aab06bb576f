package com.williamcallahan.webingest.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Content-addressed identities for web content records.
 */
@Component
public class ContentHasher {

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final HexFormat HEX = HexFormat.of();
    private static final char IDENTITY_SEPARATOR = '\n';

    /**
     * Digests UTF-8 text with SHA-256.
     *
     * @param text text to digest
     * @return 64 lowercase hex characters
     */
    public String sha256(String text) {
        Objects.requireNonNull(text, "text");
        try {
            byte[] digest = MessageDigest.getInstance(DIGEST_ALGORITHM).digest(text.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available in this JVM", e);
        }
    }

    /**
     * Generates the content-addressed identity of a web content record.
     *
     * <p>The canonical URL and the body are joined with a newline. A missing URL hashes as
     * the empty string, so URL-less records are identified by their text alone.</p>
     *
     * @param canonicalUrl canonical source URL, may be null
     * @param text body text
     * @return identity hash shared by every record with the same URL and text
     */
    public String contentHash(String canonicalUrl, String text) {
        String urlPart = canonicalUrl == null ? "" : canonicalUrl;
        return sha256(urlPart + IDENTITY_SEPARATOR + text);
    }
}
