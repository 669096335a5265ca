package com.aegis.governor;

import com.aegis.governor.config.GovernorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Aegis governor host.
 *
 * <p>Binds {@code aegis.governor.*}, builds the {@link com.aegis.governance.engine.GovernanceEngine}
 * and sets up every configured service at start-up. Telemetry feeds, pagers and audit stores talk
 * to the engine bean; the default sinks write JSON to the log.
 */
@SpringBootApplication
@EnableConfigurationProperties(GovernorProperties.class)
public class GovernorApplication {

    private static final Logger log = LoggerFactory.getLogger(GovernorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GovernorApplication.class, args);
        log.info("Aegis governor started");
    }
}
