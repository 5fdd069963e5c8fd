package com.coderelay.model;

/**
 * An announced code and the reference to the message that announced it.
 */
public record CodeRow(String code, int messageRef, boolean finalized) {
}
