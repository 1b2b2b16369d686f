package com.circuitbox.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Root breaker of the tree. Holds only ON or OFF.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MasterSwitch {

    @Builder.Default
    private BreakerState state = BreakerState.OFF;
    private boolean emergencyShutdown;
    private Instant lastStateChange;
    private String lastChangedBy;

    private Instant startTime;
    @Builder.Default
    private Duration uptime = Duration.ZERO;
    private int powerCycles;

    @Builder.Default
    private SystemStatus systemStatus = SystemStatus.OFFLINE;

    public boolean isOn() {
        return state == BreakerState.ON;
    }
}
