package com.coderelay.feed;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code {"hash": ..., "codename": ...}} message a listener sends to authenticate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedCredential(String hash, String codename) {

    @JsonCreator
    public FeedCredential(@JsonProperty("hash") String hash, @JsonProperty("codename") String codename) {
        this.hash = hash;
        this.codename = codename;
    }
}
