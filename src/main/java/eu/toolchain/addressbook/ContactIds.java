package eu.toolchain.addressbook;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Generates virtually unique contact ids.
 *
 * An id is the hex encoded SHA-256 of a short random string salted with the id of the parent node, followed by the
 * current time in seconds.
 */
public final class ContactIds {
    private static final int SALT_LENGTH = 5;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContactIds() {
    }

    public static String generate() {
        return generate("");
    }

    public static String generate(String parentId) {
        return generate(parentId, ThreadLocalRandom.current(), System.currentTimeMillis());
    }

    static String generate(String parentId, Random random, long now) {
        final String seed = randomLetters(random, SALT_LENGTH) + (parentId == null ? "" : parentId);
        return sha256(seed) + TimeUnit.SECONDS.convert(now, TimeUnit.MILLISECONDS);
    }

    private static String randomLetters(Random random, int length) {
        final StringBuilder builder = new StringBuilder(length);

        for (int i = 0; i < length; i++)
            builder.append((char) ('a' + random.nextInt(26)));

        return builder.toString();
    }

    private static String sha256(String input) {
        final MessageDigest digest;

        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }

        final byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
        final char[] out = new char[hash.length * 2];

        for (int i = 0; i < hash.length; i++) {
            out[i * 2] = HEX[(hash[i] >> 4) & 0xf];
            out[i * 2 + 1] = HEX[hash[i] & 0xf];
        }

        return new String(out);
    }
}
