package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.dto.BreakerStateSnapshot;
import com.circuitbox.backend.dto.CircuitDescriptor;
import com.circuitbox.backend.dto.CircuitSnapshot;
import com.circuitbox.backend.dto.PanelDescriptor;
import com.circuitbox.backend.dto.PanelSnapshot;
import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.CircuitCategory;
import com.circuitbox.backend.model.CircuitHealth;
import com.circuitbox.backend.model.SystemAlert;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BreakerRegistryTest {

    @Test
    void panelsAreOrderedByPosition() {
        BreakerFixture fx = new BreakerFixture();

        fx.registry.addPanel(new PanelDescriptor("late", "Late", null, 10, null));
        fx.registry.addPanel(PanelDescriptor.of("appended", "Appended"));
        fx.registry.addPanel(new PanelDescriptor("first", "First", null, 1, null));

        assertThat(fx.registry.getPanels()).extracting(PanelSnapshot::id)
                .containsExactly("first", "appended", "late");
        assertThat(fx.panel("appended").position()).isEqualTo(2);
    }

    @Test
    void newPanelStartsOffAndUnlockedWithDefaultCapacity() {
        BreakerFixture fx = new BreakerFixture();

        PanelSnapshot panel = fx.registry.addPanel(PanelDescriptor.of("p1", "Panel 1")).orElseThrow();

        assertThat(panel.state()).isEqualTo(BreakerState.OFF);
        assertThat(panel.lockedOut()).isFalse();
        assertThat(panel.health()).isEqualTo(CircuitHealth.OFFLINE);
        assertThat(panel.maxCircuits()).isEqualTo(50);
    }

    @Test
    void duplicatePanelIsRejected() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1");

        assertThat(fx.registry.addPanel(PanelDescriptor.of("p1", "Again"))).isEmpty();
        assertThat(fx.registry.addPanel(PanelDescriptor.of(" ", "Blank"))).isEmpty();
        assertThat(fx.registry.getPanels()).hasSize(1);
    }

    @Test
    void newCircuitCarriesConfiguredDefaults() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1");
        fx.properties.getBreaker().setTripThreshold(3);
        fx.properties.getBreaker().setCooldownSeconds(10);

        CircuitSnapshot circuit = fx.registry.addCircuit("p1", new CircuitDescriptor("db", "DB", "primary",
                CircuitCategory.DATABASE, "jdbc://db", Map.of("pool", 8))).orElseThrow();

        assertThat(circuit.state()).isEqualTo(BreakerState.OFF);
        assertThat(circuit.health()).isEqualTo(CircuitHealth.OFFLINE);
        assertThat(circuit.tripThreshold()).isEqualTo(3);
        assertThat(circuit.cooldown()).isEqualTo(Duration.ofSeconds(10));
        assertThat(circuit.latency().maxAllowed()).isEqualTo(50.0);
        assertThat(circuit.settings()).containsEntry("pool", 8);
        assertThat(circuit.createdAt()).isEqualTo(BreakerFixture.START);
        assertThat(fx.panel("p1").totalCircuits()).isEqualTo(1);
    }

    @Test
    void circuitRegistrationRejectsUnknownPanelFullPanelAndDuplicateId() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1", "c1");
        fx.registry.addPanel(new PanelDescriptor("tiny", "Tiny", null, null, 1));
        fx.registry.addCircuit("tiny", CircuitDescriptor.of("t1", "T1", CircuitCategory.CUSTOM));

        assertThat(fx.registry.addCircuit("missing", CircuitDescriptor.of("x", "X", null))).isEmpty();
        assertThat(fx.registry.addCircuit("tiny", CircuitDescriptor.of("t2", "T2", null))).isEmpty();
        assertThat(fx.registry.addCircuit("tiny", CircuitDescriptor.of("c1", "C1", null))).isEmpty();
        assertThat(fx.registry.addCircuit("p1", CircuitDescriptor.of("t1", "T1", null))).isEmpty();

        assertThat(fx.panel("tiny").circuits()).extracting(CircuitSnapshot::id).containsExactly("t1");
    }

    @Test
    void looksUpOwningPanelOfCircuit() {
        BreakerFixture fx = new BreakerFixture()
                .withPanel("p1", "c1")
                .withPanel("p2", "c2");

        assertThat(fx.registry.getPanelForCircuit("c2")).map(PanelSnapshot::id).contains("p2");
        assertThat(fx.registry.getPanelForCircuit("nope")).isEmpty();
        assertThat(fx.registry.getCircuit("nope")).isEmpty();
    }

    @Test
    void snapshotIsDetachedFromLiveState() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1", "c1");
        BreakerStateSnapshot before = fx.registry.getState();

        fx.registry.masterOn("ops");
        fx.reportErrors("c1", 5);

        assertThat(before.masterSwitch().state()).isEqualTo(BreakerState.OFF);
        assertThat(before.panels().get(0).circuits().get(0).state()).isEqualTo(BreakerState.OFF);
        assertThat(before.panels().get(0).circuits().get(0).errorCount()).isZero();
        assertThatThrownBy(() -> before.panels().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> before.panels().get(0).circuits().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void snapshotHeaderSummarizesHealthAndAlerts() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1", "c1");
        fx.registry.masterOn("ops");
        fx.reportErrors("c1", 5);

        BreakerStateSnapshot state = fx.registry.getState();

        assertThat(state.instanceId()).isEqualTo(fx.registry.getInstanceId());
        assertThat(state.version()).isEqualTo("2.1.0");
        assertThat(state.overallHealth()).isEqualTo(CircuitHealth.CRITICAL);
        assertThat(state.criticalAlerts()).isEqualTo(1);
        assertThat(state.warningAlerts()).isEqualTo(4);
        assertThat(state.lastHealthCheck()).isEqualTo(BreakerFixture.START);
    }

    @Test
    void uptimeRunsWhileOnAndAccumulatesAcrossSessions() {
        BreakerFixture fx = new BreakerFixture();
        assertThat(fx.registry.isPoweredOn()).isFalse();

        fx.registry.masterOn("ops");
        fx.clock.advance(Duration.ofSeconds(90));
        assertThat(fx.registry.isPoweredOn()).isTrue();
        assertThat(fx.registry.getUptime()).isEqualTo(Duration.ofSeconds(90));

        fx.registry.masterOff("ops");
        fx.clock.advance(Duration.ofHours(1));
        assertThat(fx.registry.getUptime()).isEqualTo(Duration.ofSeconds(90));

        fx.registry.masterOn("ops");
        fx.clock.advance(Duration.ofSeconds(10));
        assertThat(fx.registry.getUptime()).isEqualTo(Duration.ofSeconds(100));
        assertThat(fx.registry.getMasterSwitch().powerCycles()).isEqualTo(2);
    }

    @Test
    void acknowledgingAlertIsAuditedOnce() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1", "c1");
        fx.registry.masterOn("ops");
        fx.registry.tripCircuit("c1", "manual");
        SystemAlert tripAlert = fx.registry.getAlerts().stream()
                .filter(alert -> alert.getMessage().startsWith("CIRCUIT TRIPPED"))
                .findFirst()
                .orElseThrow();

        assertThat(fx.registry.acknowledgeAlert(tripAlert.getId(), "ops")).isTrue();
        assertThat(fx.registry.acknowledgeAlert(tripAlert.getId(), "ops")).isFalse();

        assertThat(fx.registry.getState().criticalAlerts()).isZero();
        assertThat(fx.auditOf("ALERT_ACKNOWLEDGED")).hasSize(1);
    }

    @Test
    void auditLogIsNewestFirst() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1", "c1");

        fx.registry.masterOn("ops");
        fx.registry.masterOff("ops");

        assertThat(fx.registry.getAuditLog().get(0).getAction()).isEqualTo("MASTER_OFF");
    }

    @Test
    void resetDropsTreeTimersAndLogs() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1", "c1");
        fx.registry.masterOn("ops");
        fx.reportErrors("c1", 5);

        fx.registry.reset();

        assertThat(fx.registry.getPanels()).isEmpty();
        assertThat(fx.registry.getAlerts()).isEmpty();
        assertThat(fx.registry.getAuditLog()).isEmpty();
        assertThat(fx.registry.isPoweredOn()).isFalse();
        assertThat(fx.registry.getMasterSwitch().powerCycles()).isZero();
        assertThat(fx.registry.pendingAutoResets()).isZero();
        assertThat(fx.registry.addPanel(PanelDescriptor.of("p1", "Again"))).isPresent();
    }

    @Test
    void shutdownCancelsPendingTimers() {
        BreakerFixture fx = new BreakerFixture().withPanel("p1", "c1", "c2");
        fx.registry.masterOn("ops");
        fx.registry.tripCircuit("c1", "a");
        fx.registry.tripCircuit("c2", "b");
        assertThat(fx.registry.pendingAutoResets()).isEqualTo(2);

        fx.registry.shutdown();

        assertThat(fx.registry.pendingAutoResets()).isZero();
    }
}
