package tech.gmsaprovisioner.common;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Picks the correlation ID for a delivery and echoes it as
 * {@code X-Correlation-ID} on the response.
 *
 * <p>Headers are tried in order; the Logic Apps tracking headers cover
 * engines that do not set a generic one.
 */
@Provider
public class TracingFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(TracingFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final List<String> CORRELATION_HEADERS = List.of(
        CORRELATION_ID_HEADER,
        "X-Request-ID",
        "x-ms-client-tracking-id",
        "x-ms-workflow-run-id"
    );

    @Inject
    TracingContext tracingContext;

    @Override
    public void filter(ContainerRequestContext request) {
        for (String header : CORRELATION_HEADERS) {
            String value = request.getHeaderString(header);
            if (value != null && !value.isBlank()) {
                tracingContext.adopt(value.trim());
                return;
            }
        }
        LOG.debugf("No correlation header on %s, generated %s",
            request.getUriInfo().getPath(), tracingContext.getCorrelationId());
    }

    @Override
    public void filter(ContainerRequestContext request, ContainerResponseContext response) {
        response.getHeaders().putSingle(CORRELATION_ID_HEADER, tracingContext.getCorrelationId());
    }
}
