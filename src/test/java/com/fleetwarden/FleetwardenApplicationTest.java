package com.fleetwarden;

import com.fleetwarden.core.sync.SyncScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FleetwardenApplicationTest {

    @TempDir
    Path stateDir;

    @Test
    @DisplayName("serve mode starts the web server and the board sync loop")
    void serveModeRunsSync() {
        try (ConfigurableApplicationContext ctx = new SpringApplicationBuilder(FleetwardenApplication.class)
                .properties(FleetwardenApplication.modeProperties(true))
                .run("serve",
                        "--server.port=0",
                        "--fleetwarden.sync.repository=acme/rockets",
                        "--fleetwarden.sync.initial-delay-ms=3600000",
                        "--fleetwarden.state.dir=" + stateDir)) {
            assertInstanceOf(WebServerApplicationContext.class, ctx);
            assertTrue(ctx.getBean(SyncScheduler.class).isRunning());
        }
    }

    @Test
    @DisplayName("serve mode still honours an explicit sync opt-out")
    void serveModeOptOut() {
        try (ConfigurableApplicationContext ctx = new SpringApplicationBuilder(FleetwardenApplication.class)
                .properties(FleetwardenApplication.modeProperties(true))
                .run("serve",
                        "--server.port=0",
                        "--fleetwarden.sync.enabled=false",
                        "--fleetwarden.state.dir=" + stateDir)) {
            assertFalse(ctx.getBean(SyncScheduler.class).isRunning());
        }
    }

    @Test
    @DisplayName("one-shot commands run without a web server or sync loop")
    void cliModeProperties() {
        List<String> props = List.of(FleetwardenApplication.modeProperties(false));

        assertTrue(props.contains("spring.main.web-application-type=none"));
        assertTrue(props.contains("fleetwarden.sync.enabled=false"));
    }
}
