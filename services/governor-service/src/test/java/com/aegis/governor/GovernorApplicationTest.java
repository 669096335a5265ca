package com.aegis.governor;

import static org.assertj.core.api.Assertions.assertThat;

import com.aegis.governance.engine.FailureOutcome;
import com.aegis.governance.engine.GovernanceEngine;
import com.aegis.governor.config.GovernorProperties;
import com.aegis.governor.infrastructure.GovernorHealthIndicator;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

/**
 * Integration tests for the governor application. The 'test' profile configures one service and
 * needs no external infrastructure.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@DisplayName("Governor Application")
class GovernorApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private GovernanceEngine engine;
    @Autowired private GovernorHealthIndicator healthIndicator;
    @Autowired private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
    }

    @Test
    @DisplayName("Governor properties are loaded from test profile")
    void governorPropertiesAreLoaded() {
        var props = context.getBean(GovernorProperties.class);
        assertThat(props.name()).isEqualTo("governor-test");
        assertThat(props.environment()).isEqualTo("test");
        assertThat(props.breaker().failureThreshold()).isEqualTo(2);
        assertThat(props.services()).extracting(GovernorProperties.ServiceProperties::name).containsExactly("search");
    }

    @Test
    @DisplayName("Configured services are set up at start-up")
    void servicesAreSetUp() {
        assertThat(engine.ownerOf("search-index")).contains("search");
        assertThat(engine.getSystemStatus().currentTiers()).containsEntry("search", "primary");
        assertThat(engine.breakers().get("search-index")).hasValueSatisfying(
                breaker -> assertThat(breaker.config().failureThreshold()).isEqualTo(2));
    }

    @Test
    @DisplayName("Health indicator is UP while nothing is degraded")
    void healthIsUp() {
        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsKeys("degradationLevel", "circuitBreakers", "openIncidents");
    }

    @Test
    @DisplayName("A failure moves the service to fallback and is reported by health and metrics")
    void failureIsGoverned() {
        var result = engine.handleFailure("search-index", 0.01, 5000, 0);

        assertThat(result.outcome()).isEqualTo(FailureOutcome.HANDLED);
        assertThat(engine.getSystemStatus().activeFallbacks()).containsExactly("search");
        assertThat(healthIndicator.health().getStatus()).isEqualTo(GovernorHealthIndicator.DEGRADED);
        assertThat(meterRegistry.find("aegis.failures.detected").tag("governor", "governor-test").counter())
                .isNotNull();
    }
}
