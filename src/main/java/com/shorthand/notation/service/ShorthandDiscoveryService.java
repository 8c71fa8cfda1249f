package com.shorthand.notation.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NoArgsConstructor;

/**
 * Resolves a command-line input (one file or a directory tree) to the
 * shorthand files it names.
 */
@NoArgsConstructor
public class ShorthandDiscoveryService {

    public static final String EXTENSION = ".pys";

    /**
     * A regular file is returned as-is whatever its extension. A directory is
     * walked recursively for {@code *.pys} files, in path order.
     */
    public List<Path> discover(Path input) throws IOException {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new IOException("Not a file or directory: " + input);
        }
        try (Stream<Path> stream = Files.walk(input)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isShorthandFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isShorthandFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }
}
