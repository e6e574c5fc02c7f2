package com.purchasingpower.shipyard.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.shipyard.configuration.ShipyardProperties;
import com.purchasingpower.shipyard.util.CommandRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Webpack Stats Parsing Tests")
class WebpackProcessBundlerTest {

    private final WebpackProcessBundler bundler =
            new WebpackProcessBundler(new ShipyardProperties(), new CommandRunner(), new ObjectMapper());

    @Test
    @DisplayName("Should read errors given as objects or plain strings")
    void testParseErrors_ShouldReadBothShapes() {
        String stats = """
                {"hash":"abc","errors":[{"message":"Module not found: './missing'"},"SyntaxError: Unexpected token"]}
                """;

        assertEquals(List.of("Module not found: './missing'", "SyntaxError: Unexpected token"), bundler.parseErrors(stats));
    }

    @Test
    @DisplayName("Should report no errors for a successful build")
    void testParseErrors_ShouldAcceptCleanStats() {
        assertTrue(bundler.parseErrors("{\"hash\":\"abc\",\"errors\":[]}").isEmpty());
        assertTrue(bundler.parseErrors("").isEmpty());
    }

    @Test
    @DisplayName("Should turn unreadable stats into an error")
    void testParseErrors_ShouldRejectGarbage() {
        assertEquals(1, bundler.parseErrors("webpack crashed").size());
    }
}
