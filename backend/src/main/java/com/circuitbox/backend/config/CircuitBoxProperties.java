package com.circuitbox.backend.config;

import com.circuitbox.backend.model.CircuitCategory;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "circuitbox")
@Validated
@Data
public class CircuitBoxProperties {

    private String version = "2.1.0";
    private Breaker breaker = new Breaker();
    private Audit audit = new Audit();
    private Probe probe = new Probe();
    private Bootstrap bootstrap = new Bootstrap();

    @Data
    public static class Breaker {
        @Min(1)
        private int tripThreshold = 5;
        @Min(1)
        private long cooldownSeconds = 30;
        @Positive
        private double maxLatencyMs = 50.0;
        @Min(1)
        private int maxCircuitsPerPanel = 50;
    }

    @Data
    public static class Audit {
        @Min(1)
        private int capacity = 10_000;
        @Min(1)
        private int alertCapacity = 1_000;
        private long flushIntervalMs = 5_000;
        private boolean logSinkEnabled = false;
    }

    @Data
    public static class Probe {
        @Min(1)
        private long timeoutMs = 500;
        private int poolSize = 4;
    }

    @Data
    public static class Bootstrap {
        private boolean enabled = false;
        private boolean powerOn = false;
        private List<PanelDefinition> panels = new ArrayList<>();
    }

    @Data
    public static class PanelDefinition {
        private String id;
        private String name;
        private String description;
        private Integer position;
        private Integer maxCircuits;
        private List<CircuitDefinition> circuits = new ArrayList<>();
    }

    @Data
    public static class CircuitDefinition {
        private String id;
        private String name;
        private String description;
        private CircuitCategory category = CircuitCategory.CUSTOM;
        private String endpoint;
        private Map<String, Object> settings = new LinkedHashMap<>();
    }
}
