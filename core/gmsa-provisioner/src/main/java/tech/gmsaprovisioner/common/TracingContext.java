package tech.gmsaprovisioner.common;

import jakarta.enterprise.context.RequestScoped;
import tech.gmsaprovisioner.shared.InvocationIds;

/**
 * Correlation ID of the current webhook delivery.
 *
 * <p>Workflow engines keep the same tracking header when they redeliver, so
 * every attempt at one logical provisioning shares an ID in the logs.
 */
@RequestScoped
public class TracingContext {

    private String correlationId;

    void adopt(String correlationId) {
        this.correlationId = correlationId;
    }

    /**
     * The caller's correlation ID, or a generated one if it sent none.
     */
    public String getCorrelationId() {
        if (correlationId == null) {
            correlationId = InvocationIds.correlationId();
        }
        return correlationId;
    }
}
