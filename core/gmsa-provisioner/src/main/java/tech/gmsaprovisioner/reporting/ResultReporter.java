package tech.gmsaprovisioner.reporting;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.provisioning.ProvisioningResult;

import java.time.Instant;

/**
 * Turns a {@link ProvisioningResult} into the JSON document returned to the
 * webhook caller, and records one audit line and one metric per invocation.
 */
@ApplicationScoped
public class ResultReporter {

    private static final Logger LOG = Logger.getLogger(ResultReporter.class);

    static final String RESULTS_COUNTER = "gmsa.provisioning.results";

    @Inject
    MeterRegistry registry;

    public void record(ProvisioningResult result) {
        String error = "none";
        if (result instanceof ProvisioningResult.Success success) {
            LOG.infof("gMSA provisioning %s account=%s dn=%s guid=%s",
                success.status(), success.accountName(), success.distinguishedName(), success.objectId());
        } else if (result instanceof ProvisioningResult.AlreadyExists existing) {
            LOG.infof("gMSA provisioning %s account=%s dn=%s",
                existing.status(), existing.accountName(), existing.distinguishedName());
        } else if (result instanceof ProvisioningResult.Failed failed) {
            error = failed.errorKind().wireName();
            LOG.warnf("gMSA provisioning %s account=%s error=%s details=%s",
                failed.status(), failed.accountName(), error, failed.errorMessage());
        }

        registry.counter(RESULTS_COUNTER, "status", result.status(), "error", error).increment();
    }

    public ObjectNode render(ProvisioningResult result) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("Status", result.status());
        node.put("AccountName", result.accountName());

        if (result instanceof ProvisioningResult.Success success) {
            node.put("DNSHostName", success.dnsHostName());
            node.put("DistinguishedName", success.distinguishedName());
            node.put("SamAccountName", success.samAccountName());
            node.put("ObjectGUID", success.objectId());
            node.put("Created", iso(success.createdAt()));
            node.put("Message", "gMSA " + success.accountName() + " created successfully");
        } else if (result instanceof ProvisioningResult.AlreadyExists existing) {
            node.put("DistinguishedName", existing.distinguishedName());
            node.put("Message", "gMSA " + existing.accountName() + " already exists");
        } else if (result instanceof ProvisioningResult.Failed failed) {
            node.put("Error", failed.errorKind().wireName());
            node.put("ErrorDetails", failed.errorMessage());
        }

        node.put("Timestamp", iso(result.timestamp()));
        return node;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
