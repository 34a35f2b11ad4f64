package com.fleetwarden.integration;

import com.fleetwarden.core.classifier.ErrorClassifier;
import com.fleetwarden.core.events.AgentEventBus;
import com.fleetwarden.core.events.AgentEventType;
import com.fleetwarden.core.events.EventLogFilter;
import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.TaskStatus;
import com.fleetwarden.core.store.InMemoryTaskStore;
import com.fleetwarden.core.sync.ProjectSettings;
import com.fleetwarden.core.sync.SyncScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the full context in CLI mode and checks the core services are wired together.
 */
@SpringBootTest(properties = {
        "spring.main.web-application-type=none",
        "fleetwarden.sync.enabled=false",
        "fleetwarden.sync.repository=acme/rockets",
        "fleetwarden.state.dir=${java.io.tmpdir}/fleetwarden-context-test"
})
class ApplicationContextTest {

    @Autowired
    private AgentEventBus eventBus;

    @Autowired
    private InMemoryTaskStore store;

    @Autowired
    private ErrorClassifier classifier;

    @Autowired
    private ProjectSettings settings;

    @Autowired
    private SyncScheduler syncScheduler;

    @Test
    @DisplayName("board settings come from configuration")
    void settingsResolved() {
        assertEquals("acme/rockets", settings.repoSlug());
        assertFalse(syncScheduler.isRunning());
    }

    @Test
    @DisplayName("an agent completion flows through the bus into the task store")
    void completionUpdatesStore() {
        store.upsert(FleetTask.of("501", "Wire it up", TaskStatus.INPROGRESS));

        eventBus.onStatusChange("501", TaskStatus.INREVIEW, "agent");

        assertEquals(TaskStatus.INREVIEW, store.findTask("501").orElseThrow().status());
        assertFalse(eventBus.getEventLog(new EventLogFilter("501", AgentEventType.TASK_STATUS_CHANGE, null, 10, true))
                .isEmpty());
    }

    @Test
    @DisplayName("the bus classifies errors with the shared classifier")
    void sharedClassifier() {
        eventBus.onAgentError("502", "error: failed to push some refs", "", null);

        assertTrue(classifier.getStats().taskBreakdown().containsKey("502"));
        assertEquals(1, eventBus.getErrorHistory("502").size());
    }
}
