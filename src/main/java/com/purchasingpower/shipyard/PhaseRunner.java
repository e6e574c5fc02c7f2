package com.purchasingpower.shipyard;

import com.purchasingpower.shipyard.build.BuildPipeline;
import com.purchasingpower.shipyard.build.BuildRunResult;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.configuration.ShipyardProperties;
import com.purchasingpower.shipyard.deploy.DeployPipeline;
import com.purchasingpower.shipyard.deploy.DeployRunResult;
import com.purchasingpower.shipyard.exception.ShipyardException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Runs the phase selected by {@code shipyard.phase} once the context is up.
 * Exit code is 0 on success and 1 on any failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PhaseRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ShipyardProperties properties;
    private final BuildPipeline buildPipeline;
    private final DeployPipeline deployPipeline;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getPhase() == ShipyardProperties.Phase.NONE) {
            log.debug("No phase selected");
            return;
        }

        RunConfiguration config = RunConfiguration.from(properties);
        try {
            boolean success = switch (properties.getPhase()) {
                case BUILD -> build(config);
                case DEPLOY -> deploy(config);
                case NONE -> true;
            };
            exitCode = success ? 0 : 1;
        } catch (ShipyardException | UncheckedIOException e) {
            log.error("{} failed: {}", properties.getPhase(), e.getMessage(), e);
            exitCode = 1;
        }
    }

    private boolean build(RunConfiguration config) {
        BuildRunResult result = buildPipeline.run(config);
        if (result.isSuccess()) {
            log.info("Builds complete");
        } else {
            log.error("Build failed: {}", result.summary());
        }
        return result.isSuccess();
    }

    private boolean deploy(RunConfiguration config) {
        DeployRunResult result = deployPipeline.run(config);
        if (result.isSuccess()) {
            log.info("Deployments complete");
        } else {
            log.error("Deployment failed: {}", result.summary());
        }
        return result.isSuccess();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
