package com.intelcompliance.infrastructure.crypto;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Exposes the crypto self-test as the {@code crypto} health component.
 * Key identifiers are reported; key material never is.
 */
@Component("crypto")
@RequiredArgsConstructor
public class CryptoHealthIndicator implements HealthIndicator {

    private final CryptoService cryptoService;

    @Override
    public Health health() {
        CryptoSelfTestReport report = cryptoService.selfTest();
        Health.Builder builder = report.isHealthy() ? Health.up() : Health.down();
        builder.withDetail("encryption", report.isEncryptionWorking())
            .withDetail("decryption", report.isDecryptionWorking())
            .withDetail("integrity", report.isIntegrityWorking())
            .withDetail("searchHash", report.isSearchHashWorking())
            .withDetail("activeKeys", report.getActiveKeyIds() != null ? report.getActiveKeyIds() : Map.of())
            .withDetail("testedAt", report.getTestedAt().toString());
        if (report.getError() != null) {
            builder.withDetail("error", report.getError());
        }
        return builder.build();
    }
}
