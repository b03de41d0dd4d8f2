package org.tsappend.datapipeline.services;

import java.util.Locale;

/**
 * How the existing store is made available to a run.
 */
public enum ExistingStoreAccess {
    /** Download the store into a staging area, then read it locally. */
    STAGE,
    /** Read the store through a file-system mount. Not supported. */
    MOUNT;

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public static ExistingStoreAccess parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported store access method: " + value, e);
        }
    }
}
