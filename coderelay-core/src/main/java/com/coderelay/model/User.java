package com.coderelay.model;

/**
 * A known identity and its stored access level.
 */
public record User(long id, int accessLevel) {
}
