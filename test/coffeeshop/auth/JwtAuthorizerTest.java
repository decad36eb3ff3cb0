package coffeeshop.auth;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.PlainHeader;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jwt.PlainJWT;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Date;
import java.util.Set;

import static coffeeshop.auth.AuthException.Kind.*;
import static org.junit.Assert.*;

public class JwtAuthorizerTest {
    private FakeIdentityProvider tokens;
    private JwtAuthorizer authorizer;

    @Before
    public void setUp() throws Exception {
        tokens = new FakeIdentityProvider();
        authorizer = tokens.authorizer();
    }

    @Test
    public void grantedPermissionReturnsClaims() throws Exception {
        Claims claims = authorizer.verify(tokens.token("post:drinks", "patch:drinks"), "post:drinks");
        assertEquals(Set.of("post:drinks", "patch:drinks"), claims.permissions());
        assertEquals("auth0|barista", claims.subject());
        assertEquals(FakeIdentityProvider.ISSUER, claims.issuer());
        assertTrue(claims.audience().contains(FakeIdentityProvider.AUDIENCE));
        assertEquals(Date.from(tokens.now.plus(1, ChronoUnit.HOURS)), claims.expirationTime());
    }

    @Test
    public void emptyPermissionsAreDenied() throws Exception {
        AuthException e = expectFailure(tokens.token(), "get:drinks-detail");
        assertEquals(PERMISSION_DENIED, e.kind());
        assertEquals(403, e.statusCode());
    }

    @Test
    public void wrongPermissionIsDenied() throws Exception {
        String token = tokens.token("get:drinks-detail");
        assertTrue(authorizer.verify(token, "get:drinks-detail").hasPermission("get:drinks-detail"));
        AuthException e = expectFailure(token, "delete:drinks");
        assertEquals(PERMISSION_DENIED, e.kind());
        assertEquals(403, e.statusCode());
    }

    @Test
    public void expiredTokenIsRejectedWhateverItsPermissions() throws Exception {
        String token = tokens.sign(tokens.claims("post:drinks")
                .expirationTime(Date.from(tokens.now.minus(5, ChronoUnit.MINUTES)))
                .build());
        AuthException e = expectFailure(token, "post:drinks");
        assertEquals(TOKEN_EXPIRED, e.kind());
        assertEquals(401, e.statusCode());
    }

    @Test
    public void tokenExpiringNowIsExpired() throws Exception {
        String token = tokens.sign(tokens.claims("post:drinks").expirationTime(Date.from(tokens.now)).build());
        assertEquals(TOKEN_EXPIRED, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void clockSkewToleratesRecentExpiry() throws Exception {
        JwtAuthorizer lenient = new JwtAuthorizer(
                new JwksCache(new ImmutableJWKSet<>(tokens.publicKeys())),
                FakeIdentityProvider.ISSUER, FakeIdentityProvider.AUDIENCE, Collections.singleton(JWSAlgorithm.RS256),
                Duration.ofSeconds(60), Clock.fixed(tokens.now, ZoneOffset.UTC));
        String token = tokens.sign(tokens.claims("post:drinks")
                .expirationTime(Date.from(tokens.now.minusSeconds(30)))
                .build());
        assertTrue(lenient.verify(token, "post:drinks").hasPermission("post:drinks"));
    }

    @Test
    public void missingExpirationIsInvalid() throws Exception {
        String token = tokens.sign(tokens.claims("post:drinks").expirationTime(null).build());
        assertEquals(INVALID_CLAIMS, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void notYetValidTokenIsInvalid() throws Exception {
        String token = tokens.sign(tokens.claims("post:drinks")
                .notBeforeTime(Date.from(tokens.now.plus(10, ChronoUnit.MINUTES)))
                .build());
        assertEquals(INVALID_CLAIMS, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void keyMissingFromKeySetIsUnknown() throws Exception {
        RSAKey stranger = new RSAKeyGenerator(2048).keyID("stranger").generate();
        String token = FakeIdentityProvider.sign(stranger, tokens.claims("post:drinks").build());
        AuthException e = expectFailure(token, "post:drinks");
        assertEquals(UNKNOWN_KEY, e.kind());
        assertEquals(401, e.statusCode());
    }

    @Test
    public void impostorKeyWithOurKeyIdFailsSignatureCheck() throws Exception {
        RSAKey impostor = new RSAKeyGenerator(2048).keyID(tokens.signingKey.getKeyID()).generate();
        String token = FakeIdentityProvider.sign(impostor, tokens.claims("post:drinks").build());
        assertEquals(INVALID_SIGNATURE, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void tamperedPayloadFailsSignatureCheck() throws Exception {
        String[] modest = tokens.token("get:drinks-detail").split("\\.");
        String[] greedy = tokens.token("delete:drinks").split("\\.");
        String forged = modest[0] + "." + greedy[1] + "." + modest[2];
        assertEquals(INVALID_SIGNATURE, expectFailure(forged, "delete:drinks").kind());
    }

    @Test
    public void symmetricAlgorithmIsRejected() throws Exception {
        String token = tokens.hmacToken(tokens.claims("get:drinks-detail").build());
        AuthException e = expectFailure(token, "get:drinks-detail");
        assertEquals(INVALID_SIGNATURE, e.kind());
        assertEquals(401, e.statusCode());
    }

    @Test
    public void unsignedTokenIsMalformed() throws Exception {
        String token = new PlainJWT(new PlainHeader(), tokens.claims("post:drinks").build()).serialize();
        assertEquals(MALFORMED_TOKEN, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void garbageIsMalformed() {
        assertEquals(MALFORMED_TOKEN, expectFailure("not-a-jwt", "post:drinks").kind());
        assertEquals(MALFORMED_TOKEN, expectFailure("a.b.c", "post:drinks").kind());
    }

    @Test
    public void tokenWithoutKeyIdIsMalformed() throws Exception {
        RSAKey anonymous = new RSAKeyGenerator(2048).generate();
        String token = FakeIdentityProvider.sign(anonymous, tokens.claims("post:drinks").build());
        assertEquals(MALFORMED_TOKEN, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void wrongAudienceIsInvalid() throws Exception {
        String token = tokens.sign(tokens.claims("post:drinks").audience("someone-else").build());
        assertEquals(INVALID_CLAIMS, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void wrongIssuerIsInvalid() throws Exception {
        String token = tokens.sign(tokens.claims("post:drinks").issuer("https://evil.example.com/").build());
        assertEquals(INVALID_CLAIMS, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void missingPermissionsClaimIsBadRequest() throws Exception {
        String token = tokens.sign(tokens.claims().claim("permissions", null).build());
        AuthException e = expectFailure(token, "post:drinks");
        assertEquals(PERMISSIONS_CLAIM_MISSING, e.kind());
        assertEquals(400, e.statusCode());
    }

    @Test
    public void permissionsMustBeAList() throws Exception {
        String token = tokens.sign(tokens.claims().claim("permissions", "post:drinks").build());
        assertEquals(INVALID_CLAIMS, expectFailure(token, "post:drinks").kind());
    }

    @Test
    public void verifyingTwiceGivesEqualClaims() throws Exception {
        String token = tokens.token("get:drinks-detail");
        Claims first = authorizer.verify(token, "get:drinks-detail");
        Claims second = authorizer.verify(token, "get:drinks-detail");
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void authorizeReadsTheBearerHeader() throws Exception {
        String token = tokens.token("post:drinks");
        assertEquals(Set.of("post:drinks"), authorizer.authorize("Bearer " + token, "post:drinks").permissions());
        assertEquals(MISSING_HEADER, expectAuthorizeFailure(null).kind());
        assertEquals(MALFORMED_HEADER, expectAuthorizeFailure("bearer " + token).kind());
    }

    @Test
    public void symmetricAlgorithmsCannotBeConfigured() {
        try {
            AuthConfig.parseAlgorithms("RS256,HS256");
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("HS256"));
        }
    }

    private AuthException expectFailure(String token, String permission) {
        try {
            Claims claims = authorizer.verify(token, permission);
            fail("expected AuthException but got " + claims);
            return null;
        } catch (AuthException e) {
            return e;
        }
    }

    private AuthException expectAuthorizeFailure(String header) {
        try {
            authorizer.authorize(header, "post:drinks");
            fail("expected AuthException");
            return null;
        } catch (AuthException e) {
            return e;
        }
    }
}
