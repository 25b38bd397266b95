package com.scout.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Write-to-temp-then-rename primitive for every JSON file the service owns.
 *
 * <p>The temp file lives in the target's directory so the rename never crosses a
 * filesystem. When the filesystem refuses an atomic move the file is replaced with a
 * plain move, which still never leaves a half-written target behind.
 */
@Slf4j
public final class AtomicFiles {

    private static final String TEMP_SUFFIX = ".tmp";

    private AtomicFiles() {
    }

    public static void writeJson(ObjectMapper objectMapper, Path target, Object value) throws IOException {
        write(target, objectMapper.writeValueAsBytes(value));
    }

    public static void write(Path target, byte[] content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, "." + target.getFileName(), TEMP_SUFFIX);
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, using plain replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
