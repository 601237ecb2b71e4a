package tech.gmsaprovisioner.common;

import tech.gmsaprovisioner.shared.InvocationIds;

import java.time.Instant;

/**
 * Context for one provisioning invocation.
 *
 * <p>Carries tracing IDs and the cancellation signal through the workflow.
 * Created at the start of an invocation and discarded at its end.
 *
 * @param invocationId  Unique ID for this invocation (generated)
 * @param correlationId ID for distributed tracing (usually from the webhook request)
 * @param initiatedAt   When the invocation was initiated
 * @param cancellation  Signal tripped when the caller withdraws
 */
public record ExecutionContext(
    String invocationId,
    String correlationId,
    Instant initiatedAt,
    CancellationSignal cancellation
) {

    /**
     * Create a context for an invocation that has no upstream correlation ID.
     * The correlation ID starts as the invocation ID.
     */
    public static ExecutionContext create() {
        String invocationId = InvocationIds.invocationId();
        return new ExecutionContext(invocationId, invocationId, Instant.now(), CancellationSignal.create());
    }

    /**
     * Create a context within an HTTP request, preserving the correlation ID
     * populated by {@link TracingFilter}.
     */
    public static ExecutionContext from(TracingContext tracingContext, CancellationSignal cancellation) {
        return new ExecutionContext(
            InvocationIds.invocationId(),
            tracingContext.getCorrelationId(),
            Instant.now(),
            cancellation
        );
    }

    public boolean isCancelled() {
        return cancellation != null && cancellation.isCancelled();
    }
}
