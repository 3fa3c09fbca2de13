package com.linlay.taskagent.security;

import com.linlay.taskagent.config.AppAuthProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

/**
 * Verifies bearer tokens whose subject is the caller's user id.
 */
@Component
public class JwtVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtVerifier.class);
    private static final int MIN_HMAC_SECRET_BYTES = 32;

    private final AppAuthProperties authProperties;
    private final Clock clock;

    private volatile JWSVerifier hmacVerifier;
    private volatile JWSVerifier rsaVerifier;

    @Autowired
    public JwtVerifier(AppAuthProperties authProperties) {
        this(authProperties, Clock.systemUTC());
    }

    JwtVerifier(AppAuthProperties authProperties, Clock clock) {
        this.authProperties = authProperties;
        this.clock = clock;
    }

    @PostConstruct
    void initialize() {
        hmacVerifier = resolveHmacVerifier();
        rsaVerifier = resolveRsaVerifier();
        if (authProperties.isEnabled() && hmacVerifier == null && rsaVerifier == null) {
            throw new IllegalStateException(
                    "agent.auth.enabled requires agent.auth.hmac-secret or agent.auth.local-public-key"
            );
        }
    }

    public Optional<JwtPrincipal> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token.trim());
            claims = jwt.getJWTClaimsSet();
        } catch (Exception ex) {
            log.debug("Reject unparsable token: {}", ex.getMessage());
            return Optional.empty();
        }
        if (!validateClaims(claims) || !verifySignature(jwt)) {
            return Optional.empty();
        }
        Instant issuedAt = claims.getIssueTime() == null ? clock.instant() : claims.getIssueTime().toInstant();
        return Optional.of(new JwtPrincipal(claims.getSubject(), issuedAt, claims.getExpirationTime().toInstant()));
    }

    private boolean validateClaims(JWTClaimsSet claims) {
        if (claims == null) {
            return false;
        }
        Date expiration = claims.getExpirationTime();
        if (expiration == null || expiration.toInstant().isBefore(clock.instant())) {
            return false;
        }
        if (StringUtils.hasText(authProperties.getIssuer())
                && !authProperties.getIssuer().equals(claims.getIssuer())) {
            return false;
        }
        return StringUtils.hasText(claims.getSubject());
    }

    private boolean verifySignature(SignedJWT jwt) {
        JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
        JWSVerifier verifier;
        if (JWSAlgorithm.HS256.equals(algorithm)) {
            verifier = hmacVerifier;
        } else if (JWSAlgorithm.RS256.equals(algorithm)) {
            verifier = rsaVerifier;
        } else {
            return false;
        }
        if (verifier == null) {
            return false;
        }
        try {
            return jwt.verify(verifier);
        } catch (JOSEException ex) {
            return false;
        }
    }

    private JWSVerifier resolveHmacVerifier() {
        String secret = authProperties.getHmacSecret();
        if (!StringUtils.hasText(secret)) {
            return null;
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_HMAC_SECRET_BYTES) {
            throw new IllegalStateException("agent.auth.hmac-secret must be at least " + MIN_HMAC_SECRET_BYTES + " bytes");
        }
        try {
            return new MACVerifier(secretBytes);
        } catch (JOSEException ex) {
            throw new IllegalStateException("agent.auth.hmac-secret cannot be used for HS256", ex);
        }
    }

    private JWSVerifier resolveRsaVerifier() {
        String pem = authProperties.getLocalPublicKey();
        if (!StringUtils.hasText(pem)) {
            return null;
        }
        String normalized = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s+", "");
        try {
            byte[] der = Base64.getDecoder().decode(normalized);
            RSAPublicKey publicKey = (RSAPublicKey) KeyFactory.getInstance("RSA")
                    .generatePublic(new X509EncodedKeySpec(der));
            return new RSASSAVerifier(publicKey);
        } catch (IllegalArgumentException | GeneralSecurityException | ClassCastException ex) {
            log.error("Invalid local public key configuration", ex);
            throw new IllegalStateException("agent.auth.local-public-key is not a valid PEM RSA public key", ex);
        }
    }

    public record JwtPrincipal(String subject, Instant issuedAt, Instant expiresAt) {
    }
}
