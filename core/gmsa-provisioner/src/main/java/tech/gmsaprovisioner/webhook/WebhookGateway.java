package tech.gmsaprovisioner.webhook;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.common.ExecutionContext;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.config.WebhookConfig;
import tech.gmsaprovisioner.credential.CredentialBroker;
import tech.gmsaprovisioner.provisioning.ProvisioningRequest;
import tech.gmsaprovisioner.provisioning.ProvisioningResult;
import tech.gmsaprovisioner.provisioning.ProvisioningWorkflow;
import tech.gmsaprovisioner.reporting.ResultReporter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Entry point for a webhook delivery: token check, payload parsing, workflow.
 *
 * <p>The token is checked before the body is parsed. Every delivery produces
 * exactly one reported {@link ProvisioningResult}.
 */
@ApplicationScoped
public class WebhookGateway {

    private static final Logger LOG = Logger.getLogger(WebhookGateway.class);

    @Inject
    WebhookConfig config;

    @Inject
    CredentialBroker credentialBroker;

    @Inject
    WebhookPayloadParser parser;

    @Inject
    ProvisioningWorkflow workflow;

    @Inject
    ResultReporter reporter;

    /**
     * @param body         raw request body
     * @param headerLookup HTTP header lookup by name
     */
    public ProvisioningResult handle(String body, Function<String, String> headerLookup, ExecutionContext context) {
        ProvisioningResult result = process(body, headerLookup, context);
        reporter.record(result);
        return result;
    }

    private ProvisioningResult process(String body, Function<String, String> headerLookup, ExecutionContext context) {
        Optional<String> expectedToken;
        try {
            expectedToken = credentialBroker.fetchWebhookToken();
        } catch (ProvisioningException e) {
            return new ProvisioningResult.Failed(null, e.kind(), e.getMessage(), Instant.now());
        }

        if (expectedToken.isPresent()) {
            String presented = headerLookup.apply(config.tokenHeader());
            if (presented == null) {
                presented = parser.envelopeHeader(body, config.tokenHeader()).orElse(null);
            }
            if (!tokenMatches(expectedToken.get(), presented)) {
                LOG.warnf("Rejected webhook delivery %s: missing or invalid %s",
                    context.correlationId(), config.tokenHeader());
                return new ProvisioningResult.Failed(null, ErrorKind.UNAUTHORIZED,
                    "Webhook token missing or invalid", Instant.now());
            }
        }

        ProvisioningRequest request;
        try {
            request = parser.parse(body);
        } catch (ProvisioningException e) {
            LOG.warnf("Rejected webhook delivery %s: %s", context.correlationId(), e.getMessage());
            return new ProvisioningResult.Failed(null, e.kind(), e.getMessage(), Instant.now());
        }

        return workflow.execute(request, context);
    }

    static boolean tokenMatches(String expected, String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            presented.trim().getBytes(StandardCharsets.UTF_8));
    }
}
