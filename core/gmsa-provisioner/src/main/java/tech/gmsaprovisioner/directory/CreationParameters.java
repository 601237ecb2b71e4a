package tech.gmsaprovisioner.directory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parameter set for creating one gMSA.
 *
 * <p>Optional fields that are blank or empty are dropped at build time rather
 * than carried as empty values: the directory treats an explicitly empty
 * attribute differently from an absent one.
 */
public final class CreationParameters {

    public static final String NAME = "Name";
    public static final String SAM_ACCOUNT_NAME = "SamAccountName";
    public static final String DNS_HOST_NAME = "DNSHostName";
    public static final String PRINCIPALS_ALLOWED = "PrincipalsAllowedToRetrieveManagedPassword";
    public static final String DESCRIPTION = "Description";
    public static final String SERVICE_PRINCIPAL_NAMES = "ServicePrincipalNames";
    public static final String PATH = "Path";

    private final String accountName;
    private final String dnsHostName;
    private final List<String> principalsAllowedToRetrieve;
    private final String description;
    private final List<String> servicePrincipalNames;
    private final String organizationalUnit;

    private CreationParameters(Builder builder) {
        this.accountName = builder.accountName;
        this.dnsHostName = builder.dnsHostName;
        this.principalsAllowedToRetrieve = builder.principalsAllowedToRetrieve;
        this.description = builder.description;
        this.servicePrincipalNames = builder.servicePrincipalNames;
        this.organizationalUnit = builder.organizationalUnit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Account name without the trailing {@code $}.
     */
    public String accountName() {
        return accountName;
    }

    public String samAccountName() {
        return accountName + "$";
    }

    public String dnsHostName() {
        return dnsHostName;
    }

    public List<String> principalsAllowedToRetrieve() {
        return principalsAllowedToRetrieve;
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public List<String> servicePrincipalNames() {
        return servicePrincipalNames;
    }

    public Optional<String> organizationalUnit() {
        return Optional.ofNullable(organizationalUnit);
    }

    /**
     * Names of the parameters this set actually carries, in creation order.
     */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        names.add(NAME);
        names.add(SAM_ACCOUNT_NAME);
        names.add(DNS_HOST_NAME);
        if (!principalsAllowedToRetrieve.isEmpty()) {
            names.add(PRINCIPALS_ALLOWED);
        }
        if (description != null) {
            names.add(DESCRIPTION);
        }
        if (!servicePrincipalNames.isEmpty()) {
            names.add(SERVICE_PRINCIPAL_NAMES);
        }
        if (organizationalUnit != null) {
            names.add(PATH);
        }
        return Collections.unmodifiableSet(names);
    }

    @Override
    public String toString() {
        return "CreationParameters" + names() + "[accountName=" + accountName + ", dnsHostName=" + dnsHostName + "]";
    }

    public static final class Builder {

        private String accountName;
        private String dnsHostName;
        private List<String> principalsAllowedToRetrieve = List.of();
        private String description;
        private List<String> servicePrincipalNames = List.of();
        private String organizationalUnit;

        private Builder() {
        }

        public Builder accountName(String accountName) {
            String trimmed = blankToNull(accountName);
            if (trimmed != null && trimmed.endsWith("$")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            this.accountName = trimmed;
            return this;
        }

        public Builder dnsHostName(String dnsHostName) {
            this.dnsHostName = blankToNull(dnsHostName);
            return this;
        }

        public Builder principalsAllowedToRetrieve(List<String> principals) {
            this.principalsAllowedToRetrieve = nonBlank(principals);
            return this;
        }

        public Builder description(String description) {
            this.description = blankToNull(description);
            return this;
        }

        public Builder servicePrincipalNames(List<String> servicePrincipalNames) {
            this.servicePrincipalNames = nonBlank(servicePrincipalNames);
            return this;
        }

        public Builder organizationalUnit(String organizationalUnit) {
            this.organizationalUnit = blankToNull(organizationalUnit);
            return this;
        }

        public CreationParameters build() {
            Objects.requireNonNull(accountName, "accountName");
            Objects.requireNonNull(dnsHostName, "dnsHostName");
            if (accountName.isEmpty() || accountName.indexOf('$') >= 0) {
                throw new IllegalArgumentException("Invalid account name: " + accountName + "$");
            }
            return new CreationParameters(this);
        }

        private static String blankToNull(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            return value.trim();
        }

        private static List<String> nonBlank(List<String> values) {
            if (values == null) {
                return List.of();
            }
            return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .distinct()
                .toList();
        }
    }
}
