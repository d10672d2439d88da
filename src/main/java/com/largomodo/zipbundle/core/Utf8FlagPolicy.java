package com.largomodo.zipbundle.core;

/**
 * Controls general purpose bit 11 (language encoding flag) on written entries.
 * <p>
 * Entry names are always encoded as UTF-8. Pure ASCII names decode identically under
 * CP437 and UTF-8, so the flag only matters once a name leaves the ASCII range.
 */
public enum Utf8FlagPolicy {
    /** Set the flag only for names containing non-ASCII characters. */
    AUTO,
    /** Set the flag on every entry. */
    ALWAYS;

    /**
     * @param name Entry name as supplied by the caller
     * @return true if bit 11 must be set for this name
     */
    public boolean requiresFlag(String name) {
        if (this == ALWAYS) {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            if (name.charAt(i) > 0x7F) {
                return true;
            }
        }
        return false;
    }
}
