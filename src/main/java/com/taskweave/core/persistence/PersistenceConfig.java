package com.taskweave.core.persistence;

import com.taskweave.core.config.TaskweaveProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the hot and archive
 * {@link ContextRepository} beans.
 * <p>
 * When {@code taskweave.context.store-dir} is set, contexts are written as JSON
 * files under that directory and archived under {@code archive-dir} (defaulting
 * to {@code <store-dir>/archive}). Otherwise both repositories are in-memory,
 * which is suitable for development and testing but not durable across restarts.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    public static final String ARCHIVE = "archiveContextRepository";

    @Bean
    public Clock taskweaveClock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ContextRepository contextRepository(TaskweaveProperties properties, Clock clock) {
        String storeDir = properties.getContext().getStoreDir();
        if (storeDir == null || storeDir.isBlank()) {
            log.info("No context store directory configured; using in-memory context repository (state will not persist across restarts)");
            return new InMemoryContextRepository(clock);
        }
        log.info("Configuring file context repository at {}", storeDir);
        return new FileContextRepository(Path.of(storeDir), clock);
    }

    @Bean(name = ARCHIVE)
    public ContextRepository archiveContextRepository(TaskweaveProperties properties, Clock clock) {
        var context = properties.getContext();
        String archiveDir = context.getArchiveDir();
        if (archiveDir == null || archiveDir.isBlank()) {
            if (context.getStoreDir() == null || context.getStoreDir().isBlank()) {
                return new InMemoryContextRepository(clock);
            }
            archiveDir = Path.of(context.getStoreDir()).resolve("archive").toString();
        }
        log.info("Configuring context archive at {}", archiveDir);
        return new FileContextRepository(Path.of(archiveDir), clock);
    }
}
