package com.intelcompliance.infrastructure.containment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.intelcompliance.config.ComplianceProperties;
import com.intelcompliance.domain.model.ContainmentActionType;
import com.intelcompliance.domain.model.SecurityIncident;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Temporary block list of network addresses.
 *
 * <p>Entries expire after {@code compliance.incident.network-block-duration}
 * (24 hours by default). Edge components consult {@link #isBlocked}.
 * Only IP literals are accepted; host names are never resolved.
 */
@Component
@Slf4j
public class NetworkAddressBlocker implements ContainmentExecutor {

    private static final Pattern IPV4 = Pattern.compile(
        "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]{2,45}$");

    private final Cache<String, BlockedAddress> blocked;
    private final Duration blockDuration;
    private final Clock clock;

    public NetworkAddressBlocker(ComplianceProperties properties, Clock clock) {
        this.blockDuration = properties.getIncident().getNetworkBlockDuration();
        this.clock = clock;
        this.blocked = Caffeine.newBuilder()
            .expireAfterWrite(blockDuration)
            .maximumSize(100_000)
            .build();
    }

    @Override
    public boolean supports(ContainmentActionType type) {
        return type == ContainmentActionType.BLOCK_NETWORK_ADDRESS;
    }

    @Override
    public String execute(ContainmentActionType type, String target, SecurityIncident incident, String actor) {
        String address = normalize(target);
        Instant now = clock.instant();
        BlockedAddress entry = new BlockedAddress(address, incident.getId(), now, now.plus(blockDuration));
        blocked.put(address, entry);

        log.warn("SECURITY ALERT: network address {} blocked until {} for incident {}",
            address, entry.expiresAt(), incident.getId());
        return "Blocked " + address + " until " + entry.expiresAt();
    }

    public boolean isBlocked(String address) {
        return blockOf(address).isPresent();
    }

    public Optional<BlockedAddress> blockOf(String address) {
        String normalized;
        try {
            normalized = normalize(address);
        } catch (ContainmentException e) {
            return Optional.empty();
        }
        return Optional.ofNullable(blocked.getIfPresent(normalized));
    }

    static String normalize(String target) {
        if (target == null || target.isBlank()) {
            throw new ContainmentException("Network address is required");
        }
        String candidate = target.trim();
        if (IPV4.matcher(candidate).matches()) {
            return candidate;
        }
        if (candidate.indexOf(':') >= 0 && IPV6_CHARS.matcher(candidate).matches()) {
            try {
                // A literal containing ':' is parsed, never looked up
                return InetAddress.getByName(candidate).getHostAddress();
            } catch (UnknownHostException e) {
                throw new ContainmentException("Invalid IPv6 address: " + candidate, e);
            }
        }
        throw new ContainmentException("Not an IP address literal: " + candidate);
    }

    public record BlockedAddress(String address, String incidentId, Instant blockedAt, Instant expiresAt) {
    }
}
