package tech.gmsaprovisioner.directory;

import java.time.Instant;

/**
 * Outcome of the KDS root key check for one invocation.
 *
 * @param exists        a usable root key is present after the check
 * @param created       this invocation created the key
 * @param keyId         identifier (cn) of the key that will be used
 * @param effectiveTime time from which the key can derive passwords
 */
public record RootKeyState(
    boolean exists,
    boolean created,
    String keyId,
    Instant effectiveTime
) {

    public static RootKeyState existing(String keyId, Instant effectiveTime) {
        return new RootKeyState(true, false, keyId, effectiveTime);
    }

    public static RootKeyState created(String keyId, Instant effectiveTime) {
        return new RootKeyState(true, true, keyId, effectiveTime);
    }

    public boolean isEffectiveAt(Instant now) {
        return exists && (effectiveTime == null || !effectiveTime.isAfter(now));
    }
}
