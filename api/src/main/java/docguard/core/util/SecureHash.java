package docguard.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Hex digests for document content, template files and redacted values.
 *
 * <p>Only digests are ever written to the audit trail, never the hashed input.
 */
public final class SecureHash {

    public static final String SHA_256 = "SHA-256";
    public static final String SHA_512 = "SHA-512";

    private static final int MAX_HEX_CHARS = 64;
    private static final int BUFFER_SIZE = 8192;

    private SecureHash() {}

    /**
     * Full SHA-256 hex digest of the UTF-8 bytes of {@code input}.
     *
     * @param input the string to hash
     * @return 64 lower-case hex characters
     */
    public static String sha256Hex(String input) {
        return HexFormat.of().formatHex(digest(SHA_256).digest(input.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Hex digest of a file, streamed.
     *
     * @param file      the file
     * @param algorithm {@link #SHA_256} or {@link #SHA_512}
     * @return lower-case hex digest
     * @throws IOException if the file cannot be read
     */
    public static String fileDigestHex(Path file, String algorithm) throws IOException {
        final var digest = digest(algorithm);
        try (InputStream in = Files.newInputStream(file)) {
            final var buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Compare two hex digests in constant time, ignoring case.
     *
     * @param expected the trusted digest
     * @param actual   the computed digest
     * @return true when both are present and equal
     */
    public static boolean digestsMatch(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII),
                actual.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Whether the JVM provides a supported digest algorithm.
     *
     * @param algorithm algorithm name
     * @return true for SHA-256 and SHA-512
     */
    public static boolean isSupported(String algorithm) {
        return SHA_256.equalsIgnoreCase(algorithm) || SHA_512.equalsIgnoreCase(algorithm);
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
    }
}
