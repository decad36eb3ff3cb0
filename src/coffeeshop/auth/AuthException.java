package coffeeshop.auth;

/**
 * A bearer token was missing, invalid or lacked the permission an operation requires.
 */
public class AuthException extends Exception {
    public enum Kind {
        MISSING_HEADER(401, "authorization_header_missing"),
        MALFORMED_HEADER(401, "invalid_header"),
        MALFORMED_TOKEN(401, "invalid_token"),
        UNKNOWN_KEY(401, "unknown_key"),
        INVALID_SIGNATURE(401, "invalid_signature"),
        TOKEN_EXPIRED(401, "token_expired"),
        INVALID_CLAIMS(401, "invalid_claims"),
        PERMISSIONS_CLAIM_MISSING(400, "permissions_missing"),
        PERMISSION_DENIED(403, "unauthorized"),
        KEY_SET_UNAVAILABLE(401, "jwks_unavailable");

        private final int status;
        private final String code;

        Kind(int status, String code) {
            this.status = status;
            this.code = code;
        }

        public int status() {
            return status;
        }

        public String code() {
            return code;
        }
    }

    private final Kind kind;

    public AuthException(Kind kind, String message, Exception cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AuthException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public int statusCode() {
        return kind.status();
    }

    public String errorCode() {
        return kind.code();
    }
}
