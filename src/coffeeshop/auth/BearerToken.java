package coffeeshop.auth;

import static coffeeshop.auth.AuthException.Kind.MALFORMED_HEADER;
import static coffeeshop.auth.AuthException.Kind.MISSING_HEADER;

public class BearerToken {
    public static final String SCHEME = "Bearer";

    private BearerToken() {
    }

    /**
     * Pulls the raw token out of an Authorization header value of the form
     * {@code Bearer <token>}. The scheme is matched case-sensitively.
     *
     * @param authzHeader the header value, or null if the request had none
     */
    public static String extract(String authzHeader) throws AuthException {
        if (authzHeader == null) {
            throw new AuthException(MISSING_HEADER, "Authorization header is expected.");
        }
        String[] parts = authzHeader.split(" ", -1);
        if (!parts[0].equals(SCHEME)) {
            throw new AuthException(MALFORMED_HEADER, "Authorization header must start with \"Bearer\".");
        }
        if (parts.length == 1 || parts[1].isEmpty()) {
            throw new AuthException(MALFORMED_HEADER, "Token not found.");
        }
        if (parts.length > 2) {
            throw new AuthException(MALFORMED_HEADER, "Authorization header must be bearer token.");
        }
        return parts[1];
    }
}
