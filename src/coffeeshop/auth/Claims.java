package coffeeshop.auth;

import com.nimbusds.jwt.JWTClaimsSet;

import java.util.*;

/**
 * The verified payload of a bearer token. Immutable.
 */
public class Claims {
    public static final String PERMISSIONS = "permissions";

    private final JWTClaimsSet claimsSet;
    private final Set<String> permissions;

    public Claims(JWTClaimsSet claimsSet, Collection<String> permissions) {
        this.claimsSet = claimsSet;
        this.permissions = Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
    }

    /**
     * Claims for an unauthenticated caller holding just the given permission.
     */
    public static Claims anonymous(String permission) {
        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .subject("anonymous")
                .claim(PERMISSIONS, List.of(permission))
                .build();
        return new Claims(claimsSet, List.of(permission));
    }

    public String subject() {
        return claimsSet.getSubject();
    }

    public String issuer() {
        return claimsSet.getIssuer();
    }

    public List<String> audience() {
        return claimsSet.getAudience();
    }

    public Date expirationTime() {
        return claimsSet.getExpirationTime();
    }

    public Set<String> permissions() {
        return permissions;
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Claims claims = (Claims) o;
        return claimsSet.getClaims().equals(claims.claimsSet.getClaims()) &&
                permissions.equals(claims.permissions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(claimsSet.getClaims(), permissions);
    }

    @Override
    public String toString() {
        return "Claims{sub=" + subject() + ", permissions=" + permissions + "}";
    }
}
