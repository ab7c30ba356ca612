package io.tiller.core.chart;

import java.util.List;
import java.util.StringJoiner;

/// Helpers for multi-document manifest text.
public final class Manifests {

    /// Separator placed between concatenated documents.
    public static final String SEPARATOR = "\n---\n";

    private Manifests() {}

    /// Concatenates manifests in the given order, skipping blank entries.
    ///
    /// Leading and trailing document separators of each entry are dropped so that
    /// the result never contains empty documents.
    ///
    /// @param manifests manifests to join, not null
    /// @return joined text, empty if every entry is blank
    public static String join(List<String> manifests) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (String manifest : manifests) {
            String trimmed = trim(manifest);
            if (!trimmed.isEmpty()) {
                joiner.add(trimmed);
            }
        }
        return joiner.toString();
    }

    private static String trim(String manifest) {
        if (manifest == null) {
            return "";
        }
        String text = manifest.strip();
        while (text.startsWith("---")) {
            text = text.substring(3).strip();
        }
        while (text.endsWith("---")) {
            text = text.substring(0, text.length() - 3).strip();
        }
        return text;
    }
}
