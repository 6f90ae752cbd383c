package com.intelcompliance.application.incident;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Incident ids of the form {@code INC-yyyyMMddHHmmss-XXXXXXXX} (UTC, upper-case hex suffix).
 */
@Component
public class IncidentIdGenerator {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final SecureRandom random = new SecureRandom();

    public String next(Instant at) {
        byte[] suffix = new byte[4];
        random.nextBytes(suffix);
        return "INC-" + TIMESTAMP.format(at) + "-" + HexFormat.of().withUpperCase().formatHex(suffix);
    }
}
