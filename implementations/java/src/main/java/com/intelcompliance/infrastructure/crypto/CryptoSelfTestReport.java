package com.intelcompliance.infrastructure.crypto;

import com.intelcompliance.domain.model.KeyPurpose;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class CryptoSelfTestReport {
    boolean encryptionWorking;
    boolean decryptionWorking;
    boolean integrityWorking;
    boolean searchHashWorking;
    Map<KeyPurpose, String> activeKeyIds;
    String error;
    Instant testedAt;

    public boolean isHealthy() {
        return encryptionWorking && decryptionWorking && integrityWorking && searchHashWorking;
    }
}
