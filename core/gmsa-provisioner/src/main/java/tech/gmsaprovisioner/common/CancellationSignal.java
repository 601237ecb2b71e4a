package tech.gmsaprovisioner.common;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between the HTTP layer and a running workflow.
 *
 * <p>The gateway trips it when the webhook caller disconnects. The workflow
 * only honours it up to the mutating step; once the account creation has been
 * issued, verification runs to completion regardless.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
