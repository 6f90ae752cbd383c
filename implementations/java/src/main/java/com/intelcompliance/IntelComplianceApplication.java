package com.intelcompliance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Compliance and incident-response core for the intelligence platform.
 *
 * <p>Security features:
 * <ul>
 *   <li><strong>Key Management</strong>: purpose-scoped keys, wrapped under a root secret, rotated on schedule</li>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM bound to classification and context</li>
 *   <li><strong>Audit Trail</strong>: append-only, signed, CJI metadata sealed at rest</li>
 *   <li><strong>Incident Response</strong>: detection rules, containment, forensics, recovery</li>
 *   <li><strong>Compliance Scoring</strong>: per-area scores derived from audit evidence</li>
 * </ul>
 *
 * <p><strong>Architecture:</strong>
 * <ul>
 *   <li>Hexagonal architecture (ports and adapters)</li>
 *   <li>Domain repositories as ports, Spring Data adapters in infrastructure</li>
 *   <li>Cross-component notifications through application events</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class IntelComplianceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntelComplianceApplication.class, args);

        log.info("""
            ╔═══════════════════════════════════════════════════════════╗
            ║  Intel Compliance Core                                    ║
            ║  Encryption: AES-256-GCM                                  ║
            ║  Audit Trail: SIGNED, APPEND-ONLY                         ║
            ║  Incident Detection: ENABLED                              ║
            ╚═══════════════════════════════════════════════════════════╝
            """);
    }
}
