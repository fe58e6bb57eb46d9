package blog.platform.domain;

import lombok.Value;

/**
 * User together with the stored password hash, used only by the login flow
 */
@Value
public class UserCredentials {
    User user;
    String passwordHash;

    @Override
    public String toString() {
        return "UserCredentials(user=" + user + ", passwordHash=<redacted>)";
    }
}
