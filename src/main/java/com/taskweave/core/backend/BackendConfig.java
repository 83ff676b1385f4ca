package com.taskweave.core.backend;

import com.taskweave.core.config.TaskweaveProperties;
import com.taskweave.core.context.ContextCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Provides the CLI-backed primary and secondary backends unless the
 * application defines its own.
 */
@Configuration
public class BackendConfig {

    private static final Logger log = LoggerFactory.getLogger(BackendConfig.class);

    @Bean
    @ConditionalOnMissingBean(PrimaryBackend.class)
    public PrimaryBackend primaryBackend(TaskweaveProperties properties) {
        var primary = properties.getPrimary();
        log.info("Primary backend command: {}", primary.getCommand());
        return new CliPrimaryBackend(primary.getCommand(), primary.getCredentialsEnv(),
                Duration.ofSeconds(primary.getTimeoutSeconds()), ContextCodec.defaultMapper());
    }

    @Bean
    @ConditionalOnMissingBean(SecondaryBackend.class)
    public SecondaryBackend secondaryBackend(TaskweaveProperties properties) {
        var secondary = properties.getSecondary();
        log.info("Secondary backend command: {}", secondary.getCommand());
        return new CliSecondaryBackend(secondary.getCommand(), Duration.ofSeconds(secondary.getTimeoutSeconds()));
    }
}
