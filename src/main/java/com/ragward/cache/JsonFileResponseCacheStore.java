package com.ragward.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache store persisted as one JSON object mapping key to {@code {"return", "create_time"}}.
 *
 * The whole file is rewritten (temp file + atomic move) after every new entry, so it suits
 * question-answering volumes rather than bulk workloads.
 */
@Slf4j
public class JsonFileResponseCacheStore extends AbstractResponseCacheStore {

    private static final TypeReference<Map<String, CacheEntry>> FILE_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public JsonFileResponseCacheStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public String getName() {
        return "file";
    }

    @Override
    protected Optional<CacheEntry> doGet(CacheKey key) {
        return Optional.ofNullable(entries.get(key.getDigest()));
    }

    @Override
    protected Optional<CacheEntry> storeIfAbsent(CacheEntry candidate) {
        CacheEntry existing = entries.putIfAbsent(candidate.getKey().getDigest(), candidate);
        if (existing != null) {
            return Optional.of(existing);
        }

        try {
            flush();
        } catch (IOException e) {
            // The entry stays served from memory; the next successful flush persists it.
            log.error("Failed to persist cache file {}", file, e);
        }
        return Optional.empty();
    }

    @Override
    protected long countEntries() {
        return entries.size();
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("Cache file {} not found, starting empty", file);
            return;
        }
        try {
            Map<String, CacheEntry> stored = objectMapper.readValue(file.toFile(), FILE_TYPE);
            stored.forEach((digest, entry) -> entries.put(digest, entry.withKey(CacheKey.of(digest))));
            log.info("Loaded {} cached responses from {}", entries.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable cache file: " + file, e);
        }
    }

    private void flush() throws IOException {
        synchronized (writeLock) {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new TreeMap<>(entries));
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        }
    }
}
