package tech.gmsaprovisioner.credential;

import java.util.Objects;

/**
 * Directory admin identity for one provisioning invocation.
 *
 * <p>Held only in memory by the invocation that fetched it. {@link #toString()}
 * never reveals the password, so the value is safe to pass through log
 * statements by accident.
 */
public final class DirectoryCredential {

    private final String username;
    private final String password;

    private DirectoryCredential(String username, String password) {
        this.username = username;
        this.password = password;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    @Override
    public String toString() {
        return "DirectoryCredential[username=" + username + ", password=***]";
    }

    public static final class Builder {

        private String username;
        private String password;

        private Builder() {
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public DirectoryCredential build() {
            Objects.requireNonNull(username, "username");
            Objects.requireNonNull(password, "password");
            return new DirectoryCredential(username, password);
        }
    }
}
