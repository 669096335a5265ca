package com.aegis.governor.config;

import com.aegis.governance.engine.GovernanceEngine;
import com.aegis.governance.spi.AuditSink;
import com.aegis.governance.spi.NotificationSink;
import com.aegis.governor.infrastructure.LoggingAuditSink;
import com.aegis.governor.infrastructure.LoggingNotificationSink;
import com.aegis.observability.MetricFactory;
import com.aegis.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the governance engine and its collaborators.
 *
 * <p>The audit and notification sinks, the clock and the OpenTelemetry instance are only defaults:
 * a deployment that provides its own bean of the same type replaces them.
 */
@Configuration(proxyBeanMethods = false)
public class GovernorConfiguration {

    static final String INSTRUMENTATION_SCOPE = "com.aegis.governor";

    @Bean
    @ConditionalOnMissingBean
    public Clock governorClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, GovernorProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper(ObjectProvider<OpenTelemetry> openTelemetry) {
        OpenTelemetry otel = openTelemetry.getIfAvailable(GlobalOpenTelemetry::get);
        return new SpanHelper(otel.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public GovernanceEngine governanceEngine(GovernorProperties properties, AuditSink auditSink,
                                             NotificationSink notificationSink, MetricFactory metricFactory,
                                             SpanHelper spanHelper, Clock clock) {
        return new GovernanceEngine(properties.toSettings(), auditSink, notificationSink, metricFactory,
                spanHelper, clock);
    }
}
