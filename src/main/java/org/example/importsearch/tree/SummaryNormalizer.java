package org.example.importsearch.tree;

import org.example.importsearch.model.PathNames;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles dependency names recorded as bare module names with the file keys of a summary.
 *
 * <p>A child name {@code utils} is replaced by {@code utils.py} when {@code utils.py}
 * is itself a key of the summary. The child keeps its position in the list.</p>
 */
public final class SummaryNormalizer {

    private SummaryNormalizer() {
    }

    /**
     * Returns a normalized copy of the summary. The input map and its lists are not modified.
     */
    public static Map<String, List<String>> normalize(Map<String, List<String>> summary) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : summary.entrySet()) {
            List<String> children = new ArrayList<>(entry.getValue().size());
            for (String child : entry.getValue()) {
                children.add(normalizeName(child, summary));
            }
            normalized.put(entry.getKey(), children);
        }
        return normalized;
    }

    private static String normalizeName(String name, Map<String, List<String>> summary) {
        if (PathNames.hasSourceSuffix(name)) {
            return name;
        }
        String withSuffix = name + PathNames.SOURCE_SUFFIX;
        return summary.containsKey(withSuffix) ? withSuffix : name;
    }
}
