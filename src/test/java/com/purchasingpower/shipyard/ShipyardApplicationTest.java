package com.purchasingpower.shipyard;

import com.purchasingpower.shipyard.build.BuildPipeline;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.configuration.ShipyardProperties;
import com.purchasingpower.shipyard.deploy.DeployPipeline;
import com.purchasingpower.shipyard.event.LoggingEventListener;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "shipyard.phase=none",
        "shipyard.registry=registry.local:5000/team",
        "shipyard.registry-auth=registry.local:5000:ci:secret,ci:other",
        "shipyard.fail-fast=true"
})
@DisplayName("Application Context Tests")
class ShipyardApplicationTest {

    @Autowired
    private ShipyardProperties properties;

    @Autowired
    private BuildPipeline buildPipeline;

    @Autowired
    private DeployPipeline deployPipeline;

    @Autowired
    private PipelineEventPublisher publisher;

    @Autowired
    private LoggingEventListener loggingListener;

    @Autowired
    private PhaseRunner phaseRunner;

    @Test
    @DisplayName("Should wire both pipelines without running a phase")
    void testContextLoads() {
        assertNotNull(buildPipeline);
        assertNotNull(deployPipeline);
        assertNotNull(publisher);
        assertNotNull(loggingListener);
        assertEquals(0, phaseRunner.getExitCode());
    }

    @Test
    @DisplayName("Should bind run settings from configuration")
    void testRunConfiguration_ShouldBindProperties() {
        RunConfiguration config = RunConfiguration.from(properties);

        assertEquals(ShipyardProperties.Phase.NONE, properties.getPhase());
        assertTrue(config.isFailFast());
        assertFalse(config.isForce());
        assertEquals("registry.local:5000/team", config.getRegistry());
        assertEquals(List.of("registry.local:5000:ci:secret", "ci:other"), config.getRegistryAuth());
        assertEquals("main.js", config.getEntryFileName());
        assertEquals("node:12-alpine", config.getBaseImage());
        assertEquals(Path.of(".").toAbsolutePath().normalize(), config.getWorkingDir());
    }
}
