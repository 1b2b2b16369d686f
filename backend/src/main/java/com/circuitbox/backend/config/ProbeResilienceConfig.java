package com.circuitbox.backend.config;

import com.circuitbox.backend.service.probe.HealthProbe;
import com.circuitbox.backend.service.probe.PassiveHealthProbe;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ProbeResilienceConfig {

    @Bean
    public TimeLimiter probeTimeLimiter(CircuitBoxProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(properties.getProbe().getTimeoutMs()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("health-probe", config);
    }

    @Bean
    @ConditionalOnMissingBean(HealthProbe.class)
    public HealthProbe healthProbe() {
        return new PassiveHealthProbe();
    }
}
