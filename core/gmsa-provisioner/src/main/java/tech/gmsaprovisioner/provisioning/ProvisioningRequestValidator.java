package tech.gmsaprovisioner.provisioning;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Local checks on a {@link ProvisioningRequest}. Runs before any remote call.
 */
public final class ProvisioningRequestValidator {

    static final int MAX_ACCOUNT_NAME_LENGTH = 19;

    private static final Pattern ILLEGAL_ACCOUNT_CHARS = Pattern.compile("[\"/\\\\\\[\\]:;|=,+*?<>@]");
    private static final Pattern DNS_LABEL = Pattern.compile("^(?!-)[A-Za-z0-9-]{1,63}(?<!-)$");
    private static final Pattern GUID = Pattern.compile(
        "^\\{?[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}}?$");

    private ProvisioningRequestValidator() {
    }

    /**
     * @return violation messages, empty if the request is valid
     */
    public static List<String> validate(ProvisioningRequest request) {
        List<String> violations = new ArrayList<>();
        if (request == null) {
            violations.add("Request body is required");
            return violations;
        }

        String accountName = request.accountName();
        if (accountName == null || accountName.isBlank()) {
            violations.add("AccountName is required");
        } else {
            String name = accountName.trim();
            if (name.endsWith("$")) {
                name = name.substring(0, name.length() - 1);
            }
            if (name.isEmpty()) {
                violations.add("AccountName is required");
            } else if (name.length() > MAX_ACCOUNT_NAME_LENGTH) {
                violations.add("AccountName must be at most " + MAX_ACCOUNT_NAME_LENGTH + " characters");
            }
            if (ILLEGAL_ACCOUNT_CHARS.matcher(name).find()) {
                violations.add("AccountName contains characters not allowed in an account name");
            }
            if (name.indexOf('$') >= 0) {
                violations.add("AccountName may contain $ only as its single last character");
            }
        }

        String dnsHostName = request.dnsHostName();
        if (dnsHostName == null || dnsHostName.isBlank()) {
            violations.add("DnsHostName is required");
        } else if (!isDnsName(dnsHostName.trim())) {
            violations.add("DnsHostName is not a valid DNS name: " + dnsHostName.trim());
        }

        String rootKeyId = request.kdsRootKeyId();
        if (rootKeyId != null && !rootKeyId.isBlank() && !GUID.matcher(rootKeyId.trim()).matches()) {
            violations.add("KdsRootKeyId is not a GUID: " + rootKeyId.trim());
        }

        return violations;
    }

    static boolean isDnsName(String name) {
        String host = name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
        if (host.isEmpty() || host.length() > 253) {
            return false;
        }
        for (String label : host.split("\\.", -1)) {
            if (!DNS_LABEL.matcher(label).matches()) {
                return false;
            }
        }
        return true;
    }
}
