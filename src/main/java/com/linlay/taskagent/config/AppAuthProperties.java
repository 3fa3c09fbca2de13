package com.linlay.taskagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bearer token check for {@code /api/**}. Tokens are HS256 signed with {@code hmac-secret} or RS256
 * signed with the key matching {@code local-public-key}; both may be configured at once.
 */
@ConfigurationProperties(prefix = "agent.auth")
public class AppAuthProperties {

    private boolean enabled = false;
    private String hmacSecret;
    private String localPublicKey;
    private String issuer;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHmacSecret() {
        return hmacSecret;
    }

    public void setHmacSecret(String hmacSecret) {
        this.hmacSecret = hmacSecret;
    }

    public String getLocalPublicKey() {
        return localPublicKey;
    }

    public void setLocalPublicKey(String localPublicKey) {
        this.localPublicKey = localPublicKey;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }
}
