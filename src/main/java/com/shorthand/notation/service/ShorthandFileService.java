package com.shorthand.notation.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.formatter.FormatConfig;
import com.shorthand.notation.formatter.ShorthandFormatter;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.parser.ShorthandParser;
import com.shorthand.notation.util.FileWriteUtil;

import lombok.NoArgsConstructor;

/**
 * File-level parse and format operations used by the CLI.
 * {@code ParseException} and {@code FormatException} propagate unchanged.
 */
@NoArgsConstructor
public class ShorthandFileService {
    private static final Logger log = LoggerFactory.getLogger(ShorthandFileService.class);

    private final ShorthandFormatter formatter = new ShorthandFormatter();

    public String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    public ShorthandDocument parse(Path path) throws IOException {
        log.debug("Parsing shorthand file: {}", path);
        return ShorthandParser.parseText(read(path));
    }

    public String format(Path path, FormatConfig config) throws IOException {
        log.debug("Formatting shorthand file: {}", path);
        return formatter.format(read(path), config);
    }

    /**
     * Rewrites the file in place when its canonical form differs.
     *
     * @return true if the file was changed
     */
    public boolean formatInPlace(Path path, FormatConfig config) throws IOException {
        String original = read(path);
        String formatted = formatter.format(original, config);
        if (original.equals(formatted)) {
            return false;
        }
        FileWriteUtil.safeWriteString(path, formatted);
        return true;
    }
}
