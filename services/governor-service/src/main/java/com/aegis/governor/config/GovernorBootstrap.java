package com.aegis.governor.config;

import com.aegis.governance.engine.GovernanceEngine;
import com.aegis.governance.engine.SetupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Sets up every service listed under {@code aegis.governor.services} once the context is ready.
 * An invalid chain or a dependency claimed by two services fails start-up.
 */
@Component
public class GovernorBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(GovernorBootstrap.class);

    private final GovernorProperties properties;
    private final GovernanceEngine engine;

    public GovernorBootstrap(GovernorProperties properties, GovernanceEngine engine) {
        this.properties = properties;
        this.engine = engine;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (GovernorProperties.ServiceProperties service : properties.services()) {
            SetupResult result = engine.setupService(service.toDefinition(properties.breaker()));
            log.info("Service {} ready: {} dependencies, chain {}", result.service(),
                    result.dependencyIds().size(), result.tierIds());
        }
        log.info("Governor '{}' ({}) governing {} services", properties.name(), properties.environment(),
                properties.services().size());
    }
}
