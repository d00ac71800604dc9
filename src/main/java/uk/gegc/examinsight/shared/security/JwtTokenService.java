package uk.gegc.examinsight.shared.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.List;
import java.util.UUID;

/**
 * Validates access tokens issued by the authentication service.
 * The token subject is the user's UUID; it becomes the principal name.
 */
@Component
@Slf4j
public class JwtTokenService {

    private static final String ACCESS_TOKEN_TYPE = "access";

    @Value("${jwt.secret}")
    private String base64secret;

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(base64secret);
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public Authentication getAuthentication(String token) {
        Claims claims = getClaims(token);
        return new UsernamePasswordAuthenticationToken(
                claims.getSubject(),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_USER"))
        );
    }

    public boolean validateToken(String token) {
        try {
            Claims claims = getClaims(token);

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.warn("JWT token missing subject");
                return false;
            }
            UUID.fromString(subject);

            String type = claims.get("type", String.class);
            if (type != null && !ACCESS_TOKEN_TYPE.equals(type)) {
                log.debug("Rejecting JWT of type '{}' for subject {}", type, subject);
                return false;
            }
            return true;
        } catch (ExpiredJwtException ex) {
            log.debug("JWT token is expired: {}", ex.getMessage());
            return false;
        } catch (MalformedJwtException ex) {
            log.warn("Malformed JWT token received: {}", ex.getMessage());
            return false;
        } catch (SignatureException ex) {
            log.warn("Invalid JWT signature detected: {}", ex.getMessage());
            return false;
        } catch (IllegalArgumentException ex) {
            log.warn("JWT token rejected: {}", ex.getMessage());
            return false;
        } catch (JwtException ex) {
            log.error("Unexpected JWT exception: {}", ex.getMessage());
            return false;
        }
    }

    public Claims getClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
