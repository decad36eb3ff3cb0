package coffeeshop.auth;

public interface Authorizer {
    /**
     * Verifies a raw bearer token and checks that it grants {@code requiredPermission}.
     */
    Claims verify(String token, String requiredPermission) throws AuthException;

    /**
     * Extracts the token from an Authorization header value and verifies it.
     */
    default Claims authorize(String authzHeader, String requiredPermission) throws AuthException {
        return verify(BearerToken.extract(authzHeader), requiredPermission);
    }
}
