package com.purchasingpower.shipyard.deploy;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Map;

/**
 * Plain substring replacement of every occurrence of each artifact path.
 * Longer paths are replaced first so that {@code dist/api} never rewrites part of {@code dist/api-admin}.
 */
@Component
public class TextualManifestRewriter implements ManifestRewriter {

    @Override
    public String rewrite(String document, Map<String, String> imageReferences) {
        String result = document;
        for (Map.Entry<String, String> replacement : imageReferences.entrySet().stream()
                .sorted(Map.Entry.<String, String>comparingByKey(Comparator.comparingInt(String::length)).reversed())
                .toList()) {
            result = result.replace(replacement.getKey(), replacement.getValue());
        }
        return result;
    }
}
