package ae.teletronics.ingest.application.util;

import ae.teletronics.ingest.ports.StreamSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Hashing {
    private Hashing() {}

    public static String sha256Hex(byte[] data) {
        return HexFormat.of().formatHex(digest("SHA-256").digest(data));
    }

    public static String sha256Hex(StreamSource source) {
        MessageDigest md = digest("SHA-256");
        try (InputStream in = new DigestInputStream(source.openStream(), md)) {
            byte[] buf = new byte[8192];
            while (in.read(buf) != -1) { /* drain */ }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed computing sha256", e);
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /** Used for request signatures, not for content fingerprints. */
    public static String sha1Hex(String text) {
        return HexFormat.of().formatHex(digest("SHA-1").digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
