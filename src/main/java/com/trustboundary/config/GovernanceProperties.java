package com.trustboundary.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Settings under the {@code governance} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {

    @Valid
    private final Ledger ledger = new Ledger();

    @Valid
    private final Seal seal = new Seal();

    @Valid
    private final Tether tether = new Tether();

    @Valid
    private final TrustDecay trustDecay = new TrustDecay();

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    @Valid
    private final Verification verification = new Verification();

    @Valid
    private final Attestation attestation = new Attestation();

    private final Registry registry = new Registry();

    @Data
    public static class Ledger {
        /** Directory holding crossings.json and verifications.json. */
        @NotBlank
        private String directory = "data/ledger";

        /** Re-check each ledger's seal when it is loaded. */
        private boolean verifySealOnLoad = true;
    }

    @Data
    public static class Seal {
        /** Base64 HMAC key. When unset an ephemeral key is generated at startup. */
        private String key;

        @NotBlank
        private String algorithm = "HmacSHA256";
    }

    @Data
    public static class Tether {
        /** Component name to the operations it may perform. Use bracket keys in YAML. */
        private Map<String, Set<String>> contracts = new LinkedHashMap<>(Map.of(
            "BoundaryCrossingProtocol", Set.of("submit", "authorize", "execute", "attest"),
            "BoundaryIntegrityVerifier", Set.of("verify", "report_violation")));
    }

    @Data
    public static class TrustDecay {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double denied = 0.05;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double failed = 0.02;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double unauthorized = 0.1;
    }

    @Data
    public static class RateLimit {
        @Positive
        private long maximumTrackedKeys = 10_000;
    }

    @Data
    public static class Verification {
        @Valid
        private final Schedule schedule = new Schedule();

        @Data
        public static class Schedule {
            private boolean enabled = false;

            @Positive
            private long intervalMs = 86_400_000L;
        }
    }

    @Data
    public static class Attestation {
        @NotNull
        private Duration validity = Duration.ofDays(365);
    }

    @Data
    public static class Registry {
        /** Optional JSON array of boundary definitions loaded at startup. */
        private String definitionsFile;
    }
}
