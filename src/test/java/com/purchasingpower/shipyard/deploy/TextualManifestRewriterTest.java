package com.purchasingpower.shipyard.deploy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Textual Manifest Rewriter Tests")
class TextualManifestRewriterTest {

    private final TextualManifestRewriter rewriter = new TextualManifestRewriter();

    @Test
    @DisplayName("Should replace every occurrence of an artifact path")
    void testRewrite_ShouldReplaceAllOccurrences() {
        String document = "image: dist/svc/a\n# built from dist/svc/a\n";

        String rewritten = rewriter.rewrite(document, Map.of("dist/svc/a", "docker.io/svc-a:abc"));

        assertEquals("image: docker.io/svc-a:abc\n# built from docker.io/svc-a:abc\n", rewritten);
    }

    @Test
    @DisplayName("Should not let a shorter path rewrite part of a longer one")
    void testRewrite_ShouldPreferLongestPath() {
        Map<String, String> references = new LinkedHashMap<>();
        references.put("dist/api", "docker.io/api:1");
        references.put("dist/api-admin", "docker.io/api-admin:2");

        String rewritten = rewriter.rewrite("a: dist/api\nb: dist/api-admin\n", references);

        assertEquals("a: docker.io/api:1\nb: docker.io/api-admin:2\n", rewritten);
    }

    @Test
    @DisplayName("Should leave documents without artifact paths untouched")
    void testRewrite_ShouldKeepUnrelatedDocument() {
        String document = "kind: ConfigMap\n";

        assertEquals(document, rewriter.rewrite(document, Map.of("dist/svc/a", "docker.io/svc-a:abc")));
    }
}
