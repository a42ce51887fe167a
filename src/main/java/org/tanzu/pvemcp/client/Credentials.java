package org.tanzu.pvemcp.client;

import java.util.Objects;

/**
 * Username, authentication realm and password used to obtain a ticket from an endpoint.
 *
 * The password never appears in {@link #toString()}.
 */
public final class Credentials {

    /** Default PVE realm for local Linux accounts */
    public static final String DEFAULT_REALM = "pam";

    private final String username;
    private final String realm;
    private final String password;

    public Credentials(String username, String realm, String password) {
        this.username = Objects.requireNonNull(username, "username");
        this.realm = realm == null || realm.isBlank() ? DEFAULT_REALM : realm;
        this.password = Objects.requireNonNull(password, "password");
    }

    public String getUsername() { return username; }
    public String getRealm() { return realm; }
    public String getPassword() { return password; }

    /**
     * Gets the login name sent to the ticket endpoint.
     *
     * A username that already names its realm ({@code root@pam}) is used as is.
     *
     * @return The user id in {@code user@realm} form
     */
    public String principal() {
        return username.contains("@") ? username : username + "@" + realm;
    }

    @Override
    public String toString() {
        return "Credentials{username='" + principal() + "', password='[HIDDEN]'}";
    }
}
