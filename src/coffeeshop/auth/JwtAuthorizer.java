package coffeeshop.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.AsymmetricJWK;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.security.PublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import static coffeeshop.auth.AuthException.Kind.*;

/**
 * Verifies RS256-style JSON Web Tokens against a provider's published key set
 * and checks the {@code permissions} claim.
 */
public class JwtAuthorizer implements Authorizer {
    private static final Logger log = Logger.getLogger(JwtAuthorizer.class.getName());

    private final JwksCache keys;
    private final String issuer;
    private final String audience;
    private final Set<JWSAlgorithm> algorithms;
    private final Duration clockSkew;
    private final Clock clock;
    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    public JwtAuthorizer(JwksCache keys, String issuer, String audience, Set<JWSAlgorithm> algorithms) {
        this(keys, issuer, audience, algorithms, Duration.ZERO, Clock.systemUTC());
    }

    JwtAuthorizer(JwksCache keys, String issuer, String audience, Set<JWSAlgorithm> algorithms,
                  Duration clockSkew, Clock clock) {
        if (algorithms.isEmpty()) {
            throw new IllegalArgumentException("at least one signing algorithm must be accepted");
        }
        this.keys = keys;
        this.issuer = issuer;
        this.audience = audience;
        this.algorithms = Set.copyOf(algorithms);
        this.clockSkew = clockSkew;
        this.clock = clock;
    }

    @Override
    public Claims verify(String token, String requiredPermission) throws AuthException {
        try {
            Claims claims = decode(token);
            if (!claims.hasPermission(requiredPermission)) {
                throw new AuthException(PERMISSION_DENIED, "Permission not found.");
            }
            return claims;
        } catch (AuthException e) {
            log.fine("Rejected token (" + e.kind() + "): " + e.getMessage());
            throw e;
        }
    }

    private Claims decode(String token) throws AuthException {
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new AuthException(MALFORMED_TOKEN, "Unable to parse authentication token.", e);
        }

        JWSHeader header = jwt.getHeader();
        String keyId = header.getKeyID();
        if (keyId == null) {
            throw new AuthException(MALFORMED_TOKEN, "Authorization malformed.");
        }

        JWK jwk = keys.lookup(keyId);
        if (jwk == null) {
            throw new AuthException(UNKNOWN_KEY, "Unable to find the appropriate key.");
        }

        verifySignature(jwt, jwk);

        JWTClaimsSet claimsSet;
        try {
            claimsSet = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new AuthException(MALFORMED_TOKEN, "Unable to parse authentication token.", e);
        }
        verifyClaims(claimsSet);
        return new Claims(claimsSet, permissions(claimsSet));
    }

    private void verifySignature(SignedJWT jwt, JWK jwk) throws AuthException {
        JWSAlgorithm alg = jwt.getHeader().getAlgorithm();
        if (!algorithms.contains(alg)) {
            throw new AuthException(INVALID_SIGNATURE, "Signing algorithm " + alg + " is not accepted.");
        }
        if (!(jwk instanceof AsymmetricJWK)) {
            throw new AuthException(INVALID_SIGNATURE, "Signing key " + jwk.getKeyID() + " is not a public key.");
        }
        try {
            PublicKey publicKey = ((AsymmetricJWK) jwk).toPublicKey();
            JWSVerifier verifier = verifierFactory.createJWSVerifier(jwt.getHeader(), publicKey);
            if (!jwt.verify(verifier)) {
                throw new AuthException(INVALID_SIGNATURE, "Token signature is invalid.");
            }
        } catch (JOSEException e) {
            log.log(Level.WARNING, "Unable to verify signature with key " + jwk.getKeyID(), e);
            throw new AuthException(INVALID_SIGNATURE, "Unable to verify token signature.", e);
        }
    }

    private void verifyClaims(JWTClaimsSet claimsSet) throws AuthException {
        Instant now = clock.instant();

        Date exp = claimsSet.getExpirationTime();
        if (exp == null) {
            throw new AuthException(INVALID_CLAIMS, "Token has no expiration time.");
        }
        if (!now.isBefore(exp.toInstant().plus(clockSkew))) {
            throw new AuthException(TOKEN_EXPIRED, "Token expired.");
        }

        Date nbf = claimsSet.getNotBeforeTime();
        if (nbf != null && now.plus(clockSkew).isBefore(nbf.toInstant())) {
            throw new AuthException(INVALID_CLAIMS, "Token is not yet valid.");
        }

        List<String> aud = claimsSet.getAudience();
        if (aud == null || !aud.contains(audience)) {
            throw new AuthException(INVALID_CLAIMS, "Incorrect claims. Please, check the audience and issuer.");
        }
        if (!issuer.equals(claimsSet.getIssuer())) {
            throw new AuthException(INVALID_CLAIMS, "Incorrect claims. Please, check the audience and issuer.");
        }
    }

    private static List<String> permissions(JWTClaimsSet claimsSet) throws AuthException {
        if (claimsSet.getClaim(Claims.PERMISSIONS) == null) {
            throw new AuthException(PERMISSIONS_CLAIM_MISSING, "Permissions not included in JWT.");
        }
        List<String> permissions;
        try {
            permissions = claimsSet.getStringListClaim(Claims.PERMISSIONS);
        } catch (ParseException e) {
            throw new AuthException(INVALID_CLAIMS, "Permissions claim must be a list of strings.", e);
        }
        if (permissions.contains(null)) {
            throw new AuthException(INVALID_CLAIMS, "Permissions claim must be a list of strings.");
        }
        return permissions;
    }
}
