package com.coderelay.feed;

/**
 * Decides whether a listener's credential grants access to the feed.
 */
@FunctionalInterface
public interface AccessKeyVerifier {

    /**
     * @param accessKey the key the listener presented, in the {@code hash} field of its credential
     */
    boolean verify(String accessKey, String codename);

    /**
     * The default verifier: checks the key against a stored argon2 hash.
     *
     * @param phcHash e.g. {@code $argon2id$v=19$m=19456,t=2,p=1$...$...}
     * @see Argon2AccessKeyVerifier#encode(String)
     */
    static AccessKeyVerifier argon2(String phcHash) {
        return Argon2AccessKeyVerifier.fromPhc(phcHash);
    }
}
