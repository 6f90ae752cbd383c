package com.intelcompliance.infrastructure.forensics;

import com.intelcompliance.domain.model.TimeWindow;

import java.util.Map;

/**
 * Port producing a read-only state snapshot of one system for forensics.
 * Snapshots must be JSON-serialisable and must not change the system.
 */
public interface SystemStateProvider {

    Map<String, Object> capture(String systemId, TimeWindow window);
}
