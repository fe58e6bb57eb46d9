package blog.platform.security;

import lombok.Value;

import java.util.Base64;
import java.util.Optional;

/**
 * Parsed Argon2 hash in PHC string format:
 * {@code $argon2id$v=19$m=19456,t=2,p=1$<salt>$<digest>}
 */
@Value
public class PhcHash {
    String algorithm;
    int version;
    int memoryKib;
    int iterations;
    int parallelism;
    byte[] salt;
    byte[] digest;

    private static final int DEFAULT_VERSION = 0x13;

    /**
     * Parse an encoded hash. Returns empty for anything that is not a well-formed Argon2 PHC string.
     */
    public static Optional<PhcHash> parse(String encoded) {
        if (encoded == null || !encoded.startsWith("$")) {
            return Optional.empty();
        }
        String[] parts = encoded.split("\\$", -1);
        // leading "$" yields an empty first element
        if (parts.length != 5 && parts.length != 6) {
            return Optional.empty();
        }
        int index = 1;
        String algorithm = parts[index++];
        if (!algorithm.equals("argon2id") && !algorithm.equals("argon2i") && !algorithm.equals("argon2d")) {
            return Optional.empty();
        }

        int version = DEFAULT_VERSION;
        if (parts.length == 6) {
            String versionPart = parts[index++];
            if (!versionPart.startsWith("v=")) {
                return Optional.empty();
            }
            Integer parsed = parsePositive(versionPart.substring(2));
            if (parsed == null || (parsed != 0x10 && parsed != 0x13)) {
                return Optional.empty();
            }
            version = parsed;
        }

        String[] params = parts[index++].split(",", -1);
        if (params.length != 3
                || !params[0].startsWith("m=")
                || !params[1].startsWith("t=")
                || !params[2].startsWith("p=")) {
            return Optional.empty();
        }
        Integer memory = parsePositive(params[0].substring(2));
        Integer iterations = parsePositive(params[1].substring(2));
        Integer parallelism = parsePositive(params[2].substring(2));
        if (memory == null || iterations == null || parallelism == null) {
            return Optional.empty();
        }

        byte[] salt = decode(parts[index++]);
        byte[] digest = decode(parts[index]);
        if (salt == null || digest == null) {
            return Optional.empty();
        }
        return Optional.of(new PhcHash(algorithm, version, memory, iterations, parallelism, salt, digest));
    }

    private static Integer parsePositive(String raw) {
        try {
            int value = Integer.parseInt(raw);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static byte[] decode(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            byte[] bytes = Base64.getDecoder().decode(raw);
            return bytes.length == 0 ? null : bytes;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
