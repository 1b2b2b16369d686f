package com.circuitbox.backend.dto;

public record ProbeResult(boolean reachable, long latencyMs) {

    public static ProbeResult reachable(long latencyMs) {
        return new ProbeResult(true, latencyMs);
    }

    public static ProbeResult unreachable(long latencyMs) {
        return new ProbeResult(false, latencyMs);
    }
}
