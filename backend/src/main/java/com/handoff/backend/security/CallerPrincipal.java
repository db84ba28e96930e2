package com.handoff.backend.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallerPrincipal {

    public enum Mode {
        TOKEN,
        SIGNATURE
    }

    private Mode mode;
    /** SHA-256 of the shared token for token callers, null for signed callers. */
    private String tokenHash;
    private String remoteAddress;

    /**
     * Identity used for rate limiting: the token when one was presented, otherwise the network address.
     */
    public String rateLimitIdentity() {
        if (tokenHash != null) {
            return "token:" + tokenHash;
        }
        return "ip:" + remoteAddress;
    }
}
