package tech.gmsaprovisioner.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Time-sorted identifiers for invocations. Sorting the IDs sorts the
 * invocations by start time, which keeps log searches simple.
 */
public final class InvocationIds {

    private InvocationIds() {
    }

    /** e.g. {@code inv-0HZXEQ5Y8JY5Z} */
    public static String invocationId() {
        return "inv-" + TsidCreator.getTsid();
    }

    /** Used when the caller sent no correlation header. */
    public static String correlationId() {
        return "corr-" + TsidCreator.getTsid();
    }
}
