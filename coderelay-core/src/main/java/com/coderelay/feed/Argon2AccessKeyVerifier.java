package com.coderelay.feed;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * Checks a listener's access key against a stored argon2 hash in PHC string form:
 * {@code $argon2id$v=19$m=19456,t=2,p=1$<salt>$<hash>}, salt and hash in unpadded Base64.
 *
 * <p>Only the hash is configured, so the access key itself never has to be kept on the server.
 * The codename is not part of the check.
 */
public final class Argon2AccessKeyVerifier implements AccessKeyVerifier {

    public static final int DEFAULT_MEMORY_KB = 19456;
    public static final int DEFAULT_ITERATIONS = 2;
    public static final int DEFAULT_PARALLELISM = 1;

    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;

    private final Argon2Parameters parameters;
    private final byte[] expected;

    private Argon2AccessKeyVerifier(Argon2Parameters parameters, byte[] expected) {
        this.parameters = parameters;
        this.expected = expected;
    }

    /**
     * Parses a PHC-encoded argon2 hash.
     *
     * @throws IllegalArgumentException if the string is not a well-formed argon2 hash
     */
    public static Argon2AccessKeyVerifier fromPhc(String phc) {
        Objects.requireNonNull(phc, "phc cannot be null");
        String[] parts = phc.split("\\$");
        if (parts.length < 5 || !parts[0].isEmpty()) {
            throw new IllegalArgumentException("Not a PHC string: " + phc);
        }
        int index = 1;
        int type = type(parts[index++]);
        int version = Argon2Parameters.ARGON2_VERSION_10;
        if (parts[index].startsWith("v=")) {
            version = parseNumber(parts[index++].substring(2), "v");
        }
        if (parts.length - index != 3) {
            throw new IllegalArgumentException("Malformed argon2 hash: " + phc);
        }

        int memory = -1;
        int iterations = -1;
        int parallelism = -1;
        for (String setting : parts[index++].split(",")) {
            String[] pair = setting.split("=", 2);
            if (pair.length != 2) {
                throw new IllegalArgumentException("Malformed argon2 parameter: " + setting);
            }
            switch (pair[0]) {
                case "m":
                    memory = parseNumber(pair[1], "m");
                    break;
                case "t":
                    iterations = parseNumber(pair[1], "t");
                    break;
                case "p":
                    parallelism = parseNumber(pair[1], "p");
                    break;
                default:
                    throw new IllegalArgumentException("Unknown argon2 parameter: " + pair[0]);
            }
        }
        if (memory <= 0 || iterations <= 0 || parallelism <= 0) {
            throw new IllegalArgumentException("argon2 hash lacks m, t or p: " + phc);
        }

        byte[] salt = decode(parts[index++]);
        byte[] hash = decode(parts[index]);
        Argon2Parameters parameters = new Argon2Parameters.Builder(type)
                .withVersion(version)
                .withMemoryAsKB(memory)
                .withIterations(iterations)
                .withParallelism(parallelism)
                .withSalt(salt)
                .build();
        return new Argon2AccessKeyVerifier(parameters, hash);
    }

    /**
     * Hashes {@code accessKey} with a random salt and the default argon2id cost.
     */
    public static String encode(String accessKey) {
        byte[] salt = new byte[SALT_LENGTH];
        new SecureRandom().nextBytes(salt);
        return encode(accessKey, salt, DEFAULT_MEMORY_KB, DEFAULT_ITERATIONS, DEFAULT_PARALLELISM);
    }

    /**
     * Hashes {@code accessKey} with argon2id v19 and returns the PHC string.
     */
    public static String encode(String accessKey, byte[] salt, int memoryKb, int iterations, int parallelism) {
        Objects.requireNonNull(accessKey, "accessKey cannot be null");
        Argon2Parameters parameters = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withMemoryAsKB(memoryKb)
                .withIterations(iterations)
                .withParallelism(parallelism)
                .withSalt(salt)
                .build();
        byte[] hash = derive(parameters, accessKey, HASH_LENGTH);
        Base64.Encoder encoder = Base64.getEncoder().withoutPadding();
        return "$argon2id$v=" + Argon2Parameters.ARGON2_VERSION_13
                + "$m=" + memoryKb + ",t=" + iterations + ",p=" + parallelism
                + "$" + encoder.encodeToString(salt)
                + "$" + encoder.encodeToString(hash);
    }

    @Override
    public boolean verify(String accessKey, String codename) {
        if (accessKey == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, derive(parameters, accessKey, expected.length));
    }

    private static byte[] derive(Argon2Parameters parameters, String accessKey, int length) {
        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(parameters);
        byte[] out = new byte[length];
        generator.generateBytes(accessKey.getBytes(StandardCharsets.UTF_8), out);
        return out;
    }

    private static int type(String name) {
        switch (name) {
            case "argon2id":
                return Argon2Parameters.ARGON2_id;
            case "argon2i":
                return Argon2Parameters.ARGON2_i;
            case "argon2d":
                return Argon2Parameters.ARGON2_d;
            default:
                throw new IllegalArgumentException("Not an argon2 hash: " + name);
        }
    }

    private static int parseNumber(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("argon2 parameter " + name + " is not a number: " + value, e);
        }
    }

    private static byte[] decode(String base64) {
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("argon2 salt or hash is not Base64: " + base64, e);
        }
    }
}
