package com.scout.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.exception.CacheIOException;
import com.scout.model.dto.CacheRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File tier of the response cache: one JSON document per key.
 * File pattern: {directory}/{key}.json
 */
@Slf4j
public class CacheFileRepository {

    private static final String EXTENSION = ".json";
    private static final String GLOB = "*" + EXTENSION;
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public CacheFileRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path getDirectory() {
        return directory;
    }

    public void createDirectory() throws IOException {
        Files.createDirectories(directory);
    }

    /**
     * Read a record.
     *
     * @param key cache key
     * @return record if a file exists for the key, expired or not
     * @throws CacheIOException if the file cannot be read or parsed
     */
    public Optional<CacheRecord> read(String key) {
        Path file = resolve(key);
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CacheRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            throw new CacheIOException("Failed to read cache file " + file, e);
        }
    }

    public void write(CacheRecord record) {
        Path file = resolve(record.getKey());
        try {
            AtomicFiles.writeJson(objectMapper, file, record);
        } catch (IOException e) {
            throw new CacheIOException("Failed to write cache file " + file, e);
        }
    }

    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new CacheIOException("Failed to delete cache file for key " + key, e);
        }
    }

    /**
     * Delete every cache file.
     *
     * @return number of files removed
     */
    public int deleteAll() {
        int removed = 0;
        for (Path file : listFiles()) {
            try {
                if (Files.deleteIfExists(file)) {
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Failed to delete cache file {}", file, e);
            }
        }
        return removed;
    }

    /**
     * Remove records that expired before {@code now} and records that cannot be parsed.
     *
     * @return number of files removed
     */
    public int deleteExpired(Instant now) {
        int removed = 0;
        for (Path file : listFiles()) {
            boolean remove;
            try {
                CacheRecord record = objectMapper.readValue(file.toFile(), CacheRecord.class);
                remove = record.getExpiresAt() == null || record.isExpired(now);
            } catch (IOException e) {
                log.debug("Unreadable cache file {}, removing", file);
                remove = true;
            }

            if (remove) {
                try {
                    if (Files.deleteIfExists(file)) {
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("Failed to delete cache file {}", file, e);
                }
            }
        }
        return removed;
    }

    public int count() {
        return listFiles().size();
    }

    /**
     * Probe that the directory accepts writes.
     */
    public boolean isWritable() {
        Path probe = directory.resolve(".health_check");
        try {
            Files.writeString(probe, "ok");
            Files.delete(probe);
            return true;
        } catch (IOException e) {
            log.warn("Cache directory {} is not writable: {}", directory, e.getMessage());
            return false;
        }
    }

    private List<Path> listFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, GLOB)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new CacheIOException("Failed to list cache directory " + directory, e);
        }
        return files;
    }

    /**
     * Keys that are not plain file names are hashed so a key can never escape the directory.
     */
    private Path resolve(String key) {
        String fileName = SAFE_KEY.matcher(key).matches() ? key : DigestUtils.sha256Hex(key);
        return directory.resolve(fileName + EXTENSION);
    }
}
