package com.storescout.scan.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storescout.scan.model.CacheMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * One JSON file per identifier: {@code {cached_at, identifier, data}} where {@code data} is the
 * flavor-serialized payload. Writes go through a temp file and an atomic move, so concurrent
 * readers see either the old or the new entry.
 */
public class FileTtlCache<T> implements TtlCache<T> {
    private static final Logger log = LoggerFactory.getLogger(FileTtlCache.class);
    private static final String FILE_SUFFIX = ".cache";

    private final Path directory;
    private final Duration ttl;
    private final CacheFlavor<T> flavor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileTtlCache(Path directory, Duration ttl, CacheFlavor<T> flavor, ObjectMapper objectMapper, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be zero or positive");
        }
        this.directory = directory;
        this.ttl = ttl;
        this.flavor = flavor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static <T> FileTtlCache<T> ofDays(
        Path directory,
        int ttlDays,
        CacheFlavor<T> flavor,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        return new FileTtlCache<>(directory, Duration.ofDays(Math.max(0, ttlDays)), flavor, objectMapper, clock);
    }

    @Override
    public Optional<T> get(String identifier, boolean forceRefresh) {
        if (forceRefresh) {
            return Optional.empty();
        }
        Optional<StoredEntry> entry = readEntry(identifier);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (isExpired(entry.get().cachedAt())) {
            log.debug("Cache for {} has expired", identifier);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(flavor.deserialize(entry.get().data()));
        } catch (IOException | RuntimeException e) {
            log.warn("Error reading cache payload for {}: {}", identifier, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String identifier, T value) {
        Path target = fileFor(identifier);
        Path temp = null;
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("cached_at", Instant.now(clock).toString());
            root.put("identifier", identifier);
            root.put("data", flavor.serialize(value));

            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root), StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
            temp = null;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save cache for {}: {}", identifier, e.getMessage());
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public void clear(String identifier) {
        try {
            Files.deleteIfExists(fileFor(identifier));
        } catch (IOException e) {
            log.warn("Failed to clear cache for {}: {}", identifier, e.getMessage());
        }
    }

    @Override
    public boolean isValid(String identifier) {
        return get(identifier, false).isPresent();
    }

    @Override
    public Optional<CacheMetadata> metadata(String identifier) {
        return readEntry(identifier).map(entry -> {
            Duration age = Duration.between(entry.cachedAt(), Instant.now(clock));
            return new CacheMetadata(entry.cachedAt(), age, age.compareTo(ttl) > 0);
        });
    }

    public Path fileFor(String identifier) {
        return directory.resolve(flavor.cacheKey(identifier) + FILE_SUFFIX);
    }

    private boolean isExpired(Instant cachedAt) {
        return Duration.between(cachedAt, Instant.now(clock)).compareTo(ttl) > 0;
    }

    private Optional<StoredEntry> readEntry(String identifier) {
        Path file = fileFor(identifier);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                log.warn("Cache for {} is not a JSON object", identifier);
                return Optional.empty();
            }
            String cachedAt = root.path("cached_at").asText("");
            if (cachedAt.isBlank()) {
                log.warn("Cache for {} missing 'cached_at' timestamp", identifier);
                return Optional.empty();
            }
            JsonNode data = root.get("data");
            if (data == null || !data.isTextual()) {
                log.warn("Cache for {} missing 'data' payload", identifier);
                return Optional.empty();
            }
            return Optional.of(new StoredEntry(parseTimestamp(cachedAt), data.asText()));
        } catch (IOException | DateTimeParseException e) {
            log.warn("Error reading cache for {}: {}", identifier, e.getMessage());
            return Optional.empty();
        }
    }

    // Older entries were written as zone-less local timestamps.
    private Instant parseTimestamp(String value) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return ((LocalDateTime) parsed).atZone(clock.getZone()).toInstant();
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not remove temp cache file {}: {}", path, e.getMessage());
        }
    }

    private record StoredEntry(Instant cachedAt, String data) {
    }
}
