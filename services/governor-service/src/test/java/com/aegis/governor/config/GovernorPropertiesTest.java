package com.aegis.governor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.engine.GovernanceSettings;
import com.aegis.governance.engine.ServiceDefinition;
import com.aegis.governance.fallback.FallbackTier;
import com.aegis.governance.fallback.TierKind;
import com.aegis.governance.model.DependencyType;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link GovernorProperties}: compact-constructor defaults and the mapping to engine
 * types, without starting a Spring context.
 */
@DisplayName("GovernorProperties")
class GovernorPropertiesTest {

    private static GovernorProperties.ServiceProperties checkout(List<GovernorProperties.TierProperties> tiers) {
        return new GovernorProperties.ServiceProperties("checkout",
                List.of(new GovernorProperties.DependencyProperties("payments-db", DependencyType.DATABASE,
                        "postgres://payments-db", 0, Duration.ofSeconds(2), null)),
                tiers, null, false, 0, 0);
    }

    @Test
    @DisplayName("defaults every omitted section")
    void defaultsOmittedSections() {
        var props = new GovernorProperties("gov", null, null, null, null, null, 0);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.detection().criticalLatencyMs()).isEqualTo(2000);
        assertThat(props.detection().probeTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.breaker().failureThreshold()).isEqualTo(5);
        assertThat(props.recovery().rollbackErrorRate()).isEqualTo(0.05);
        assertThat(props.services()).isEmpty();
        assertThat(props.toSettings().historyRetention()).isEqualTo(1000);
    }

    @Test
    @DisplayName("maps thresholds to engine settings")
    void mapsSettings() {
        var props = new GovernorProperties("gov", "prod",
                new GovernorProperties.Detection(1500, 0.02, 500, 10, Duration.ofSeconds(1)),
                null,
                new GovernorProperties.Recovery(4, 300, 0.005, 50, 0.03, "sre", DegradationLevel.DEGRADED_L3),
                null, 250);

        GovernanceSettings settings = props.toSettings();

        assertThat(settings.detection().criticalLatencyMs()).isEqualTo(1500);
        assertThat(settings.detection().criticalErrorRate()).isEqualTo(0.02);
        assertThat(settings.validation().minHealthPasses()).isEqualTo(4);
        assertThat(settings.validation().rollbackErrorRate()).isEqualTo(0.03);
        assertThat(settings.planOwner()).isEqualTo("sre");
        assertThat(settings.criticalFloor()).isEqualTo(DegradationLevel.DEGRADED_L3);
        assertThat(settings.historyRetention()).isEqualTo(250);
    }

    @Test
    @DisplayName("builds a service definition with kind defaults and overrides")
    void buildsServiceDefinition() {
        var service = checkout(List.of(
                new GovernorProperties.TierProperties("primary", TierKind.PRIMARY, "v2", 0),
                new GovernorProperties.TierProperties("cache", TierKind.CACHE, "redis", 70)));

        ServiceDefinition definition = service.toDefinition(new GovernorProperties.Breaker(3, 0, null));

        assertThat(definition.fallback().tiers()).extracting(FallbackTier::qualityPercent).containsExactly(100, 70);
        assertThat(definition.fallback().autoFailover()).isTrue();
        assertThat(definition.fallback().autoRecovery()).isFalse();
        assertThat(definition.fallback().failureThreshold()).isEqualTo(1);
        assertThat(definition.breakerConfig().failureThreshold()).isEqualTo(3);
        assertThat(definition.breakerConfig().successThreshold()).isEqualTo(3);
        assertThat(definition.dependencies()).singleElement().satisfies(dep -> {
            assertThat(dep.slaTargetPercent()).isEqualTo(99.9);
            assertThat(dep.circuitBreakerEnabled()).isTrue();
            assertThat(dep.timeout()).isEqualTo(Duration.ofSeconds(2));
        });
    }

    @Test
    @DisplayName("rejects a chain whose quality does not decrease")
    void rejectsInvalidChain() {
        var service = checkout(List.of(
                new GovernorProperties.TierProperties("primary", TierKind.PRIMARY, "v2", 0),
                new GovernorProperties.TierProperties("secondary", TierKind.SECONDARY, "v1", 100)));

        assertThatThrownBy(() -> service.toDefinition(new GovernorProperties.Breaker(0, 0, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
