package com.trustboundary.infrastructure.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keyed-MAC seal service.
 *
 * <p>Seals have the form {@code <algorithm>:<base64 mac>}, e.g.
 * {@code hmacsha256:q1w2...}. Verification recomputes the MAC and compares in
 * constant time.
 *
 * <p>Contract tether: a component may only run operations declared in its
 * contract, and the snapshot must be well formed (matching operation name,
 * a timestamp, a non-negative record count). Components without a contract
 * are rejected.
 *
 * <p>Key material is held in memory; production deployments replace this bean
 * with an HSM/KMS-backed implementation.
 */
@Slf4j
public class HmacSealService implements SealService {

    private final SecretKeySpec key;
    private final String algorithm;
    private final String prefix;
    private final Map<String, Set<String>> contracts;
    private final ObjectMapper mapper;

    public HmacSealService(byte[] keyBytes, String algorithm, Map<String, Set<String>> contracts, ObjectMapper mapper) {
        Objects.requireNonNull(keyBytes, "keyBytes must not be null");
        if (keyBytes.length < 16) {
            throw new IllegalArgumentException("Seal key must be at least 128 bits");
        }
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        this.key = new SecretKeySpec(keyBytes.clone(), algorithm);
        this.prefix = algorithm.toLowerCase(Locale.ROOT) + ":";
        this.contracts = Map.copyOf(contracts);
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");

        // Fail at construction rather than on first seal
        newMac();
    }

    @Override
    public String create(String content) {
        Objects.requireNonNull(content, "content must not be null");
        byte[] mac = newMac().doFinal(content.getBytes(StandardCharsets.UTF_8));
        return prefix + Base64.getEncoder().encodeToString(mac);
    }

    @Override
    public boolean verify(String content, String seal) {
        if (content == null || seal == null || !seal.startsWith(prefix)) {
            return false;
        }
        byte[] presented;
        try {
            presented = Base64.getDecoder().decode(seal.substring(prefix.length()));
        } catch (IllegalArgumentException e) {
            log.debug("Seal is not valid base64");
            return false;
        }
        byte[] expected = newMac().doFinal(content.getBytes(StandardCharsets.UTF_8));
        return MessageDigest.isEqual(expected, presented);
    }

    @Override
    public boolean verifyContractTether(String component, String operation, String stateSnapshot) {
        Set<String> allowed = contracts.get(component);
        if (allowed == null || !allowed.contains(operation)) {
            log.warn("No contract permits {}.{}", component, operation);
            return false;
        }
        try {
            JsonNode snapshot = mapper.readTree(stateSnapshot);
            boolean wellFormed = operation.equals(snapshot.path("operation").asText())
                && snapshot.hasNonNull("timestamp")
                && snapshot.path("record_count").canConvertToLong()
                && snapshot.path("record_count").asLong() >= 0;
            if (!wellFormed) {
                log.warn("Malformed tether snapshot for {}.{}", component, operation);
            }
            return wellFormed;
        } catch (Exception e) {
            log.warn("Unreadable tether snapshot for {}.{}: {}", component, operation, e.getMessage());
            return false;
        }
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            throw new SealException("Seal algorithm unavailable: " + algorithm, e);
        }
    }

    /**
     * Exception thrown when the seal primitive itself cannot be used.
     */
    public static class SealException extends RuntimeException {
        public SealException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
