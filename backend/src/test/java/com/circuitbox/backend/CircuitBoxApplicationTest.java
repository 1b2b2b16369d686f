package com.circuitbox.backend;

import com.circuitbox.backend.dto.PanelSnapshot;
import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.CircuitHealth;
import com.circuitbox.backend.service.breaker.BreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class CircuitBoxApplicationTest {

    @Autowired
    private BreakerRegistry breakerRegistry;

    @Autowired
    @Qualifier("probeExecutor")
    private ThreadPoolTaskExecutor probeExecutor;

    @Autowired
    @Qualifier("breakerResetScheduler")
    private ThreadPoolTaskScheduler breakerResetScheduler;

    @Autowired
    private TimeLimiter probeTimeLimiter;

    @Test
    void bootstrapsConfiguredTopologyAndPowersItOn() {
        assertThat(breakerRegistry.getPanels()).extracting(PanelSnapshot::id).containsExactly("core", "edge");
        assertThat(breakerRegistry.getCircuit("edge-webhooks")).isPresent();

        try {
            assertThat(breakerRegistry.masterOn("it")).isTrue();

            assertThat(breakerRegistry.getPanels()).allSatisfy(panel -> {
                assertThat(panel.state()).isEqualTo(BreakerState.ON);
                assertThat(panel.circuits()).allSatisfy(c -> assertThat(c.health()).isEqualTo(CircuitHealth.HEALTHY));
            });
        } finally {
            breakerRegistry.masterOff("it");
        }
    }

    @Test
    void executorsAreBoundedAndProbeTimeoutIsConfigured() {
        assertThat(probeExecutor.getCorePoolSize()).isEqualTo(2);
        assertThat(probeExecutor.getMaxPoolSize()).isEqualTo(4);
        assertThat(probeExecutor.getThreadNamePrefix()).isEqualTo("probe-");
        assertThat(breakerResetScheduler.getThreadNamePrefix()).isEqualTo("breaker-reset-");
        assertThat(probeTimeLimiter.getTimeLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofMillis(500));
    }
}
