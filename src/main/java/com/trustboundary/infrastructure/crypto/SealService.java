package com.trustboundary.infrastructure.crypto;

/**
 * Cryptographic seal and signature service.
 *
 * <p>Implementations integrate with an HSM/KMS or a signing service. All methods
 * are failure-shaped: verification answers {@code false} rather than throwing.
 *
 * @since 1.0.0
 */
public interface SealService {

    /**
     * Seal content.
     *
     * @param content canonical content to seal
     * @return opaque seal string
     */
    String create(String content);

    /**
     * Check that a seal was produced over exactly this content.
     */
    boolean verify(String content, String seal);

    /**
     * Check a caller-visible state snapshot before a mutating operation proceeds.
     *
     * @param component component performing the operation
     * @param operation operation name
     * @param stateSnapshot JSON snapshot with {@code operation}, {@code timestamp}
     *        and {@code record_count}
     * @return {@code true} if the operation may proceed
     */
    boolean verifyContractTether(String component, String operation, String stateSnapshot);
}
