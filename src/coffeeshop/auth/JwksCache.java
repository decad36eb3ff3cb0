package coffeeshop.auth;

import com.nimbusds.jose.KeySourceException;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKMatcher;
import com.nimbusds.jose.jwk.JWKSelector;
import com.nimbusds.jose.jwk.source.DefaultJWKSetCache;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.jwk.source.RemoteJWKSet;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.nimbusds.jose.util.ResourceRetriever;

import java.net.URL;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static coffeeshop.auth.AuthException.Kind.KEY_SET_UNAVAILABLE;

/**
 * Process-wide cache of the identity provider's published signing keys.
 * <p>
 * Backed by a {@link RemoteJWKSet}: the first lookup fetches the key set, a set
 * older than the TTL is refetched on the next lookup, and a key id that isn't in
 * the cached set triggers one refetch before the lookup gives up.
 */
public class JwksCache {
    private static final Logger log = Logger.getLogger(JwksCache.class.getName());

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    public static final int DEFAULT_TIMEOUT_MILLIS = 5000;
    public static final int SIZE_LIMIT = 50 * 1024;

    private final JWKSource<SecurityContext> keySource;

    public JwksCache(URL jwksUrl) {
        this(jwksUrl, DEFAULT_TTL, DEFAULT_TIMEOUT_MILLIS);
    }

    public JwksCache(URL jwksUrl, Duration ttl, int timeoutMillis) {
        this(jwksUrl, new DefaultResourceRetriever(timeoutMillis, timeoutMillis, SIZE_LIMIT), ttl);
    }

    JwksCache(URL jwksUrl, ResourceRetriever retriever, Duration ttl) {
        this(new RemoteJWKSet<>(jwksUrl, retriever,
                new DefaultJWKSetCache(ttl.toMillis(), -1, TimeUnit.MILLISECONDS)));
    }

    JwksCache(JWKSource<SecurityContext> keySource) {
        this.keySource = keySource;
    }

    /**
     * Returns the key with the given id, or null if the provider doesn't publish one.
     */
    public JWK lookup(String keyId) throws AuthException {
        JWKSelector selector = new JWKSelector(new JWKMatcher.Builder().keyID(keyId).build());
        List<JWK> matches;
        try {
            matches = keySource.get(selector, null);
        } catch (KeySourceException e) {
            log.log(Level.WARNING, "Unable to fetch signing key set", e);
            throw new AuthException(KEY_SET_UNAVAILABLE, "Unable to fetch signing keys.", e);
        }
        return matches.isEmpty() ? null : matches.get(0);
    }
}
