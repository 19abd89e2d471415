package com.trustboundary;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Trust boundary governance service.
 *
 * <p>Hosts the two governance components as Spring beans:
 * <ul>
 *   <li><strong>Boundary Crossing Protocol</strong>: validates, authorizes, executes and audits crossings</li>
 *   <li><strong>Boundary Integrity Verifier</strong>: scores boundary health and records violations</li>
 * </ul>
 * Both write to sealed JSON ledgers under {@code governance.ledger.directory}.
 * Both components can also be constructed directly and embedded as a library.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class TrustBoundaryApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustBoundaryApplication.class, args);
        log.info("Trust boundary governance started");
    }
}
