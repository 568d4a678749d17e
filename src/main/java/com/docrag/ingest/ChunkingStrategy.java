package com.docrag.ingest;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported chunking strategies keyed by file extension.
 */
public enum ChunkingStrategy {
    PLAIN_TEXT(List.of("txt")),
    MARKDOWN(List.of("md", "markdown"));

    private final List<String> extensions;

    ChunkingStrategy(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<String> extensions() {
        return extensions;
    }

    public static ChunkingStrategy forExtension(String fileExtension) throws UnsupportedFileTypeException {
        String normalized = fileExtension == null ? "" : fileExtension.toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (ChunkingStrategy strategy : values()) {
            if (strategy.extensions.contains(normalized)) {
                return strategy;
            }
        }
        throw new UnsupportedFileTypeException("File type ." + normalized
                + " is not supported. Supported types: " + supportedExtensionsDescription());
    }

    public static List<String> supportedExtensions() {
        return Arrays.stream(values())
                .flatMap(strategy -> strategy.extensions.stream())
                .toList();
    }

    private static String supportedExtensionsDescription() {
        return supportedExtensions().stream()
                .map(extension -> "." + extension)
                .collect(Collectors.joining(", "));
    }
}
