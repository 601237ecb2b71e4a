package tech.gmsaprovisioner.directory.ldap;

import java.time.Instant;

/**
 * Conversions for Active Directory attribute encodings.
 */
final class AdValues {

    /** 100ns intervals between 1601-01-01 and 1970-01-01. */
    private static final long FILETIME_EPOCH_OFFSET_MILLIS = 11_644_473_600_000L;

    private AdValues() {
    }

    /**
     * Format a binary objectGUID in registry form. The first three fields are
     * stored little-endian.
     */
    static String formatGuid(byte[] b) {
        if (b == null || b.length != 16) {
            return "";
        }
        return String.format("%02x%02x%02x%02x-%02x%02x-%02x%02x-%02x%02x-%02x%02x%02x%02x%02x%02x",
            b[3], b[2], b[1], b[0],
            b[5], b[4],
            b[7], b[6],
            b[8], b[9],
            b[10], b[11], b[12], b[13], b[14], b[15]);
    }

    static long toFileTime(Instant instant) {
        return (instant.toEpochMilli() + FILETIME_EPOCH_OFFSET_MILLIS) * 10_000L;
    }

    static Instant fromFileTime(long fileTime) {
        return Instant.ofEpochMilli(fileTime / 10_000L - FILETIME_EPOCH_OFFSET_MILLIS);
    }
}
