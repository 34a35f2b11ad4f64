package com.fleetwarden.core.sync;

import com.fleetwarden.core.config.EnvSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the board settings resolved from options and environment.
 */
@Configuration
public class SyncConfig {

    private static final Logger log = LoggerFactory.getLogger(SyncConfig.class);

    @Bean
    public ProjectSettings projectSettings(SyncProperties properties, EnvSettings env) {
        ProjectSettings settings = ProjectSettings.resolve(properties, env);
        log.info("Board: repo={} mode={} board={} taskLabels={} (enforced={})",
                settings.repoSlug(), settings.mode().name().toLowerCase(), settings.boardId(),
                settings.taskScopeLabels(), settings.enforceTaskLabel());
        return settings;
    }
}
