package com.purchasingpower.shipyard.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.shipyard.configuration.ShipyardProperties;
import com.purchasingpower.shipyard.util.CommandRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ESLint Output Parsing Tests")
class EslintProcessLintEngineTest {

    private final EslintProcessLintEngine engine =
            new EslintProcessLintEngine(new ShipyardProperties(), new CommandRunner(), new ObjectMapper());

    @Test
    @DisplayName("Should keep errors and warnings but only block on errors")
    void testParse_ShouldSeparateErrorsFromWarnings() throws Exception {
        String json = """
                [{"filePath":"/repo/build/svc/a/main.js","messages":[
                  {"ruleId":"no-undef","severity":2,"message":"'x' is not defined.","line":3,"column":7,"nodeType":"Identifier"},
                  {"ruleId":"no-console","severity":1,"message":"Unexpected console statement.","line":4,"column":1}
                ],"errorCount":1,"warningCount":1}]
                """;

        LintReport report = engine.parse(Path.of("build/svc/a/main.js"), json);

        assertEquals(2, report.messages().size());
        assertTrue(report.hasErrors());
        assertEquals(1, report.errors().size());
        LintMessage error = report.errors().get(0);
        assertEquals("no-undef", error.ruleId());
        assertEquals(3, error.line());
        assertEquals(7, error.column());
    }

    @Test
    @DisplayName("Should report a clean file without errors")
    void testParse_ShouldAcceptCleanFile() throws Exception {
        LintReport report = engine.parse(Path.of("main.js"), "[{\"filePath\":\"main.js\",\"messages\":[]}]");

        assertFalse(report.hasErrors());
        assertTrue(report.messages().isEmpty());
    }
}
