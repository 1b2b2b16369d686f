package com.circuitbox.backend.dto;

import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.MasterSwitch;
import com.circuitbox.backend.model.SystemStatus;

import java.time.Duration;
import java.time.Instant;

public record MasterSwitchSnapshot(
        BreakerState state,
        boolean emergencyShutdown,
        Instant lastStateChange,
        String lastChangedBy,
        Instant startTime,
        Duration uptime,
        int powerCycles,
        SystemStatus systemStatus
) {
    public static MasterSwitchSnapshot from(MasterSwitch master) {
        return new MasterSwitchSnapshot(
                master.getState(),
                master.isEmergencyShutdown(),
                master.getLastStateChange(),
                master.getLastChangedBy(),
                master.getStartTime(),
                master.getUptime(),
                master.getPowerCycles(),
                master.getSystemStatus()
        );
    }
}
