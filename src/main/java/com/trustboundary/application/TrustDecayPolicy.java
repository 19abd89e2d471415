package com.trustboundary.application;

import com.trustboundary.domain.model.TrustDecayReason;
import lombok.Value;

/**
 * Trust decay magnitudes per reason.
 */
@Value
public class TrustDecayPolicy {

    double denied;
    double failed;
    double unauthorized;

    public static TrustDecayPolicy defaults() {
        return new TrustDecayPolicy(0.05, 0.02, 0.1);
    }

    public double magnitudeFor(TrustDecayReason reason) {
        return switch (reason) {
            case DENIED -> denied;
            case FAILED -> failed;
            case UNAUTHORIZED -> unauthorized;
        };
    }
}
