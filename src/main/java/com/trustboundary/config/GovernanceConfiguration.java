package com.trustboundary.config;

import com.trustboundary.application.ContractTether;
import com.trustboundary.application.ImpactAssessor;
import com.trustboundary.application.IntegrityScorer;
import com.trustboundary.application.TrustDecayPolicy;
import com.trustboundary.application.control.ControlEvaluator;
import com.trustboundary.application.control.FilterPolicy;
import com.trustboundary.application.control.IsolationPolicy;
import com.trustboundary.application.control.ParameterFilterPolicy;
import com.trustboundary.application.control.ParameterIsolationPolicy;
import com.trustboundary.application.control.RateLimiter;
import com.trustboundary.domain.repository.CrossingRepository;
import com.trustboundary.domain.repository.VerificationRepository;
import com.trustboundary.infrastructure.attestation.AttestationService;
import com.trustboundary.infrastructure.attestation.InMemoryAttestationService;
import com.trustboundary.infrastructure.audit.AuditService;
import com.trustboundary.infrastructure.audit.LoggingAuditService;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.infrastructure.crypto.HmacSealService;
import com.trustboundary.infrastructure.crypto.SealService;
import com.trustboundary.infrastructure.mutation.MutationDetector;
import com.trustboundary.infrastructure.mutation.SnapshotMutationDetector;
import com.trustboundary.infrastructure.persistence.JsonCrossingRepository;
import com.trustboundary.infrastructure.persistence.JsonVerificationRepository;
import com.trustboundary.infrastructure.ratelimit.CaffeineRateLimiter;
import com.trustboundary.infrastructure.registry.BoundaryDefinitionLoader;
import com.trustboundary.infrastructure.registry.BoundaryRegistry;
import com.trustboundary.infrastructure.registry.InMemoryBoundaryRegistry;
import com.trustboundary.infrastructure.transport.CrossingExecutor;
import com.trustboundary.infrastructure.transport.SimulatedCrossingExecutor;
import com.trustboundary.infrastructure.trust.RecordingTrustDecayService;
import com.trustboundary.infrastructure.trust.TrustDecayService;
import com.trustboundary.infrastructure.validation.BeanValidationSchemaValidator;
import com.trustboundary.infrastructure.validation.SchemaValidator;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

/**
 * Wires the governance collaborators.
 *
 * <p>Every collaborator is declared {@link ConditionalOnMissingBean}, so a
 * deployment replaces a default (e.g. a KMS-backed {@link SealService} or a
 * registry client) by defining its own bean.
 */
@Configuration
@Slf4j
public class GovernanceConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock governanceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CanonicalJson canonicalJson() {
        return new CanonicalJson();
    }

    @Bean
    @ConditionalOnMissingBean
    public SealService sealService(GovernanceProperties properties, CanonicalJson canonicalJson) {
        GovernanceProperties.Seal seal = properties.getSeal();
        byte[] key;
        if (seal.getKey() == null || seal.getKey().isBlank()) {
            log.warn("No governance.seal.key configured - using an ephemeral key; "
                + "ledgers written now will not verify after a restart");
            key = new byte[32];
            new SecureRandom().nextBytes(key);
        } else {
            key = Base64.getDecoder().decode(seal.getKey());
        }
        log.info("Configuring {} seal service for {} contract(s)",
            seal.getAlgorithm(), properties.getTether().getContracts().size());
        return new HmacSealService(key, seal.getAlgorithm(), properties.getTether().getContracts(),
            canonicalJson.mapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditService auditService() {
        return new LoggingAuditService();
    }

    @Bean
    @ConditionalOnMissingBean
    public AttestationService attestationService(SealService sealService, CanonicalJson canonicalJson,
                                                 Clock clock, GovernanceProperties properties) {
        return new InMemoryAttestationService(sealService, canonicalJson, clock,
            properties.getAttestation().getValidity());
    }

    @Bean
    @ConditionalOnMissingBean
    public MutationDetector mutationDetector(Clock clock) {
        return new SnapshotMutationDetector(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaValidator schemaValidator(Validator validator) {
        return new BeanValidationSchemaValidator(validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public BoundaryDefinitionLoader boundaryDefinitionLoader() {
        return new BoundaryDefinitionLoader();
    }

    @Bean
    @ConditionalOnMissingBean(BoundaryRegistry.class)
    public InMemoryBoundaryRegistry boundaryRegistry(GovernanceProperties properties,
                                                     BoundaryDefinitionLoader loader) {
        InMemoryBoundaryRegistry registry = new InMemoryBoundaryRegistry();
        String definitions = properties.getRegistry().getDefinitionsFile();
        if (definitions != null && !definitions.isBlank()) {
            loader.loadInto(registry, Path.of(definitions));
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(Clock clock, GovernanceProperties properties) {
        return new CaffeineRateLimiter(clock, properties.getRateLimit().getMaximumTrackedKeys());
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterPolicy filterPolicy() {
        return new ParameterFilterPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public IsolationPolicy isolationPolicy() {
        return new ParameterIsolationPolicy();
    }

    @Bean
    public ControlEvaluator controlEvaluator(RateLimiter rateLimiter, FilterPolicy filterPolicy,
                                             IsolationPolicy isolationPolicy) {
        return new ControlEvaluator(rateLimiter, filterPolicy, isolationPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public CrossingExecutor crossingExecutor() {
        log.warn("No crossing transport configured - crossings are simulated");
        return new SimulatedCrossingExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public TrustDecayService trustDecayService(AuditService auditService) {
        return new RecordingTrustDecayService(auditService);
    }

    @Bean
    @ConditionalOnMissingBean
    public CrossingRepository crossingRepository(GovernanceProperties properties, CanonicalJson canonicalJson,
                                                 SealService sealService) {
        GovernanceProperties.Ledger ledger = properties.getLedger();
        return new JsonCrossingRepository(Path.of(ledger.getDirectory()), canonicalJson, sealService,
            ledger.isVerifySealOnLoad());
    }

    @Bean
    @ConditionalOnMissingBean
    public VerificationRepository verificationRepository(GovernanceProperties properties,
                                                         CanonicalJson canonicalJson, SealService sealService) {
        GovernanceProperties.Ledger ledger = properties.getLedger();
        return new JsonVerificationRepository(Path.of(ledger.getDirectory()), canonicalJson, sealService,
            ledger.isVerifySealOnLoad());
    }

    @Bean
    public ContractTether contractTether(SealService sealService, CanonicalJson canonicalJson, Clock clock,
                                         AuditService auditService) {
        return new ContractTether(sealService, canonicalJson, clock, auditService);
    }

    @Bean
    public TrustDecayPolicy trustDecayPolicy(GovernanceProperties properties) {
        GovernanceProperties.TrustDecay decay = properties.getTrustDecay();
        return new TrustDecayPolicy(decay.getDenied(), decay.getFailed(), decay.getUnauthorized());
    }

    @Bean
    public ImpactAssessor impactAssessor(TrustDecayPolicy trustDecayPolicy, Clock clock) {
        return new ImpactAssessor(trustDecayPolicy, clock);
    }

    @Bean
    public IntegrityScorer integrityScorer() {
        return new IntegrityScorer();
    }
}
