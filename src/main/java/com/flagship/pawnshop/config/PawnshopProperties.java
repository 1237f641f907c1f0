package com.flagship.pawnshop.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed view of the {@code pawnshop.*} configuration block.
 *
 * Bound once at start-up and injected into the few components that need it
 * (token issuing, pagination limits, bootstrap account). The loan lifecycle
 * engine takes no configuration.
 */
@ConfigurationProperties(prefix = "pawnshop")
@Getter
@Setter
public class PawnshopProperties {

    private Security security = new Security();
    private Pagination pagination = new Pagination();
    private Bootstrap bootstrap = new Bootstrap();

    @Getter
    @Setter
    public static class Security {
        /**
         * HMAC secret for signing access tokens. Must be at least 32 bytes.
         */
        private String jwtSecret;
        private String issuer = "pawnshop-ledger";
        private Duration tokenTtl = Duration.ofHours(8);
        private String cookieName = "access_token";
    }

    @Getter
    @Setter
    public static class Pagination {
        private int defaultLimit = 100;
        private int maxLimit = 100;
    }

    @Getter
    @Setter
    public static class Bootstrap {
        private boolean enabled = true;
        private String adminUsername = "admin";
        private String adminEmail = "admin@pawnshop.local";
        private String adminPassword;
    }
}
