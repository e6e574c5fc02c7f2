package com.purchasingpower.shipyard.adapter;

import com.purchasingpower.shipyard.configuration.ShipyardProperties;
import com.purchasingpower.shipyard.configuration.ToolProperties;
import com.purchasingpower.shipyard.util.CommandRunner;
import com.purchasingpower.shipyard.util.CommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class KubectlApplyTransport implements ClusterApplyTransport {

    private final ShipyardProperties props;
    private final CommandRunner commandRunner;

    @Override
    public ApplyResult apply(Path manifest) throws IOException {
        List<String> command = new ArrayList<>(ToolProperties.split(props.getTools().getKubectl()));
        command.add("apply");
        command.add("-f");
        command.add(manifest.toString());

        CommandResult result = commandRunner.run(command, manifest.toAbsolutePath().getParent());
        return new ApplyResult(result.exitCode(), result.stdout(), result.stderr());
    }
}
