package com.coderelay.model;

/**
 * Capability values stored in {@code users.authorized}.
 *
 * <p>Levels are compared by bitwise-or overlap rather than set inclusion, and {@link #ALL}
 * is a sentinel that overlaps every positive request.
 */
public final class AccessLevel {

    public static final int NONE = 0;
    public static final int SEND = 1;
    public static final int COOKIE = 2;
    public static final int ALL = 0x7FFFFFFF;

    private AccessLevel() {
    }

    /**
     * @param requested the capability the caller asks for
     * @param stored    the level on record for the caller, {@link #NONE} when unknown
     * @return true when {@code (requested | stored) > 0}
     */
    public static boolean permits(int requested, int stored) {
        return (requested | stored) > 0;
    }

    /**
     * Parses an approval keyword. Unknown keywords fall back to {@link #COOKIE}.
     */
    public static int fromKeyword(String keyword) {
        if (keyword == null) {
            return COOKIE;
        }
        switch (keyword.trim().toLowerCase()) {
            case "all":
                return ALL;
            case "message":
                return SEND;
            default:
                return COOKIE;
        }
    }
}
