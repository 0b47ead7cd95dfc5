package ae.teletronics.ingest.application.util;

import java.security.SecureRandom;

public final class TokenGenerator {
    private static final char[] ALPHANUMERIC = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final char[] LOWER_ALPHANUMERIC = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final SecureRandom RNG = new SecureRandom();
    private TokenGenerator() {}

    public static String randomToken(int len) {
        return random(ALPHANUMERIC, len);
    }

    /** Safe inside file names and object keys on case-insensitive stores. */
    public static String randomSuffix(int len) {
        return random(LOWER_ALPHANUMERIC, len);
    }

    private static String random(char[] alphabet, int len) {
        char[] c = new char[len];
        for (int i = 0; i < len; i++) c[i] = alphabet[RNG.nextInt(alphabet.length)];
        return new String(c);
    }
}
