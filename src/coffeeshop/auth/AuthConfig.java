package coffeeshop.auth;

import com.nimbusds.jose.JWSAlgorithm;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Connection details for the identity provider that issues our bearer tokens.
 */
public class AuthConfig {
    private final String domain;
    private final String audience;
    private final Set<JWSAlgorithm> algorithms;
    private Duration jwksTtl = JwksCache.DEFAULT_TTL;
    private int jwksTimeoutMillis = JwksCache.DEFAULT_TIMEOUT_MILLIS;

    public AuthConfig(String domain, String audience, Set<JWSAlgorithm> algorithms) {
        if (domain == null || domain.isEmpty()) {
            throw new IllegalArgumentException("auth domain must be set");
        }
        if (audience == null || audience.isEmpty()) {
            throw new IllegalArgumentException("API audience must be set");
        }
        this.domain = domain.replaceFirst("^https?://", "").replaceFirst("/+$", "");
        this.audience = audience;
        this.algorithms = algorithms;
    }

    /**
     * Parses an algorithm allow-list given either as a comma separated list
     * ({@code RS256,PS256}) or as a JSON-style array ({@code ["RS256"]}).
     */
    public static Set<JWSAlgorithm> parseAlgorithms(String value) {
        Set<JWSAlgorithm> algorithms = new LinkedHashSet<>();
        for (String name : value.replaceAll("[\\[\\]\"' ]", "").split(",")) {
            if (name.isEmpty()) continue;
            JWSAlgorithm alg = JWSAlgorithm.parse(name);
            if (JWSAlgorithm.Family.HMAC_SHA.contains(alg)) {
                throw new IllegalArgumentException("symmetric algorithm " + name + " cannot be verified with published keys");
            }
            algorithms.add(alg);
        }
        if (algorithms.isEmpty()) {
            throw new IllegalArgumentException("no signing algorithms given");
        }
        return algorithms;
    }

    public URL jwksUrl() {
        try {
            return new URL("https://" + domain + "/.well-known/jwks.json");
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("invalid auth domain: " + domain, e);
        }
    }

    public String issuer() {
        return "https://" + domain + "/";
    }

    public Authorizer toAuthorizer() {
        JwksCache keys = new JwksCache(jwksUrl(), jwksTtl, jwksTimeoutMillis);
        return new JwtAuthorizer(keys, issuer(), audience, algorithms);
    }

    public void setJwksTtl(Duration jwksTtl) {
        this.jwksTtl = jwksTtl;
    }

    public void setJwksTimeoutMillis(int jwksTimeoutMillis) {
        this.jwksTimeoutMillis = jwksTimeoutMillis;
    }

    public String getDomain() {
        return domain;
    }

    public String getAudience() {
        return audience;
    }

    public Set<JWSAlgorithm> getAlgorithms() {
        return algorithms;
    }
}
