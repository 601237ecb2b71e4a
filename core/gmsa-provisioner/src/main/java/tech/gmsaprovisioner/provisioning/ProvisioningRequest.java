package tech.gmsaprovisioner.provisioning;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.gmsaprovisioner.directory.CreationParameters;

import java.util.List;

/**
 * Inbound request to provision one gMSA.
 *
 * <p>Property names follow the workflow engine's PowerShell-style casing; the
 * gateway's mapper matches them case-insensitively.
 */
public record ProvisioningRequest(
    @JsonProperty("AccountName")
    String accountName,

    @JsonProperty("DnsHostName")
    @JsonAlias({"DNSHostName"})
    String dnsHostName,

    @JsonProperty("PrincipalsAllowedToRetrieve")
    @JsonAlias({"PrincipalsAllowedToRetrieveManagedPassword"})
    List<String> principalsAllowedToRetrieve,

    @JsonProperty("Description")
    String description,

    @JsonProperty("ServicePrincipalNames")
    List<String> servicePrincipalNames,

    @JsonProperty("OrganizationalUnit")
    @JsonAlias({"Path"})
    String organizationalUnit,

    @JsonProperty("KdsRootKeyId")
    String kdsRootKeyId
) {

    /**
     * Request carrying only the required fields.
     */
    public static ProvisioningRequest of(String accountName, String dnsHostName) {
        return new ProvisioningRequest(accountName, dnsHostName, null, null, null, null, null);
    }

    /**
     * Creation parameters for this request. Call only after validation.
     */
    public CreationParameters toCreationParameters() {
        return CreationParameters.builder()
            .accountName(accountName)
            .dnsHostName(dnsHostName)
            .principalsAllowedToRetrieve(principalsAllowedToRetrieve)
            .description(description)
            .servicePrincipalNames(servicePrincipalNames)
            .organizationalUnit(organizationalUnit)
            .build();
    }

    /**
     * Requested root key id, or null when the request does not pin one.
     */
    public String requestedRootKeyId() {
        return kdsRootKeyId == null || kdsRootKeyId.isBlank()
            ? null
            : kdsRootKeyId.trim().replace("{", "").replace("}", "");
    }
}
