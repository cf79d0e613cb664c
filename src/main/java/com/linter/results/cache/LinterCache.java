package com.linter.results.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linter.results.core.model.Finding;
import com.linter.results.core.model.ToolVersion;
import com.linter.results.metrics.CacheMetrics;
import com.linter.results.metrics.NoOpCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persisted per-file cache of lint findings.
 *
 * <p>A cache is created once per run, either fresh or from a previously saved
 * document, updated as files are analyzed and saved at the end of the run.
 * A loaded document is rejected when it was written by another tool version,
 * under another configuration, or claims a last run in the future.</p>
 *
 * <p>All state is guarded by a single lock. File entries are replaced, never
 * mutated in place, so they may be decoded outside the lock.</p>
 *
 * <pre>
 * LinterCache cache = LinterCache.builder()
 *     .currentVersion(ToolVersion.current())
 *     .configurationHash(config.hash())
 *     .load(cachePath);
 * cache.findings("Sources/App.swift").orElseGet(() -> analyze(...));
 * cache.save(cachePath);
 * </pre>
 */
public final class LinterCache {
    private static final Logger log = LoggerFactory.getLogger(LinterCache.class);

    static final String VERSION = "version";
    static final String CONFIGURATION_HASH = "configuration_hash";
    static final String LAST_RUN_DATE = "last_run_date";
    static final String FILES = "files";
    static final String VIOLATIONS = "violations";

    /** 2001-01-01T00:00:00Z, the origin of persisted {@code last_run_date} values. */
    static final long REFERENCE_EPOCH_SECONDS = 978_307_200L;
    private static final double MAX_REFERENCE_SECONDS = 1e15;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectReader DOCUMENT_READER = MAPPER.readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final ReentrantLock lock = new ReentrantLock();
    private final String version;
    private final Long configurationHash;
    private final Map<String, JsonNode> files;
    private final Clock clock;
    private final CacheMetrics metrics;
    private JsonNode lastRunDate;

    /**
     * Creates an empty cache for the given version and configuration.
     *
     * @param currentVersion    the running tool version
     * @param configurationHash fingerprint of the active configuration, or null
     */
    public LinterCache(ToolVersion currentVersion, Long configurationHash) {
        this(currentVersion.value(), configurationHash, null, new LinkedHashMap<>(),
                Clock.systemUTC(), NoOpCacheMetrics.INSTANCE);
    }

    private LinterCache(String version, Long configurationHash, JsonNode lastRunDate,
                        Map<String, JsonNode> files, Clock clock, CacheMetrics metrics) {
        this.version = version;
        this.configurationHash = configurationHash;
        this.lastRunDate = lastRunDate;
        this.files = files;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Rebuilds a cache from a parsed document.
     *
     * @throws LinterCacheException if the document is unusable for this run
     */
    public static LinterCache fromDocument(JsonNode document, ToolVersion currentVersion,
                                           Long configurationHash) {
        return builder().currentVersion(currentVersion).configurationHash(configurationHash).load(document);
    }

    /**
     * Reads and rebuilds a cache from a UTF-8 JSON file.
     *
     * @throws IOException          if the file cannot be read or is not valid JSON
     * @throws LinterCacheException if the document is unusable for this run
     */
    public static LinterCache fromFile(Path file, ToolVersion currentVersion,
                                       Long configurationHash) throws IOException {
        return builder().currentVersion(currentVersion).configurationHash(configurationHash).load(file);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getVersion() {
        return version;
    }

    public Optional<Long> getConfigurationHash() {
        return Optional.ofNullable(configurationHash);
    }

    /**
     * Returns the time of the last save, or empty if none is recorded.
     * Resolution is one microsecond.
     */
    public Optional<Instant> getLastRunDate() {
        JsonNode value;
        lock.lock();
        try {
            value = lastRunDate;
        } finally {
            lock.unlock();
        }
        if (value == null || !value.isNumber()) {
            return Optional.empty();
        }
        return fromReferenceSeconds(value.doubleValue());
    }

    /**
     * Records the time of the last run, truncated to microseconds; {@code null} clears it.
     */
    public void setLastRunDate(Instant date) {
        JsonNode value = date == null ? null
                : JsonNodeFactory.instance.numberNode(toReferenceSeconds(date.truncatedTo(ChronoUnit.MICROS)));
        lock.lock();
        try {
            lastRunDate = value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the cached findings of {@code file}.
     */
    public void cacheFindings(List<Finding> findings, String file) {
        Objects.requireNonNull(findings, "findings is required");
        Objects.requireNonNull(file, "file is required");
        ArrayNode violations = JsonNodeFactory.instance.arrayNode(findings.size());
        for (Finding finding : findings) {
            violations.add(FindingCodec.encode(finding));
        }
        ObjectNode entry = JsonNodeFactory.instance.objectNode();
        entry.set(VIOLATIONS, violations);

        lock.lock();
        try {
            files.put(file, entry);
        } finally {
            lock.unlock();
        }
        metrics.recordFindingsCached(findings.size());
    }

    /**
     * Drops the cached findings of {@code file}. Later reads return empty.
     * The entry is kept as an empty array, the shape existing cache files use.
     */
    public void clearFindings(String file) {
        Objects.requireNonNull(file, "file is required");
        lock.lock();
        try {
            files.put(file, JsonNodeFactory.instance.arrayNode());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached findings of {@code file} in their original order.
     * Records that cannot be rebuilt are skipped.
     *
     * @return the findings, or empty if nothing readable is cached for the file
     */
    public Optional<List<Finding>> findings(String file) {
        Objects.requireNonNull(file, "file is required");
        JsonNode entry;
        lock.lock();
        try {
            entry = files.get(file);
        } finally {
            lock.unlock();
        }

        Optional<ArrayNode> violations = readableViolations(entry);
        if (violations.isEmpty()) {
            metrics.recordCacheMiss();
            return Optional.empty();
        }
        List<Finding> result = new ArrayList<>(violations.get().size());
        for (JsonNode record : violations.get()) {
            FindingCodec.decode(record, file).ifPresent(result::add);
        }
        metrics.recordCacheHit();
        return Optional.of(Collections.unmodifiableList(result));
    }

    /**
     * Returns the files that currently have readable cached findings.
     */
    public Set<String> cachedFiles() {
        lock.lock();
        try {
            Set<String> result = new LinkedHashSet<>();
            files.forEach((file, entry) -> {
                if (readableViolations(entry).isPresent()) {
                    result.add(file);
                }
            });
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a detached copy of the document this cache saves.
     */
    public ObjectNode toDocument() {
        lock.lock();
        try {
            return buildDocument().deepCopy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stamps the last run date and atomically replaces {@code destination} with this cache.
     *
     * @throws IOException if serialization or the write fails
     */
    public void save(Path destination) throws IOException {
        Objects.requireNonNull(destination, "destination is required");
        long start = System.nanoTime();
        setLastRunDate(clock.instant());

        byte[] json;
        int fileCount;
        lock.lock();
        try {
            json = MAPPER.writeValueAsBytes(buildDocument());
            fileCount = files.size();
        } finally {
            lock.unlock();
        }

        writeAtomically(destination, json);
        metrics.recordSave(Duration.ofNanos(System.nanoTime() - start));
        log.debug("cache.saved path={} files={} bytes={}", destination, fileCount, json.length);
    }

    private ObjectNode buildDocument() {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put(VERSION, version);
        if (configurationHash != null) {
            document.put(CONFIGURATION_HASH, configurationHash.longValue());
        }
        if (lastRunDate != null) {
            document.set(LAST_RUN_DATE, lastRunDate);
        }
        ObjectNode filesNode = document.putObject(FILES);
        files.forEach(filesNode::set);
        return document;
    }

    private static Optional<ArrayNode> readableViolations(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        JsonNode violations = entry.get(VIOLATIONS);
        if (violations == null || !violations.isArray()) {
            return Optional.empty();
        }
        for (JsonNode record : violations) {
            if (!record.isObject()) {
                return Optional.empty();
            }
        }
        return Optional.of((ArrayNode) violations);
    }

    private static void writeAtomically(Path destination, byte[] content) throws IOException {
        Path dir = destination.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createFile(dir.resolve(destination.getFileName() + "." + UUID.randomUUID() + ".tmp"));
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("cache.save atomic move unsupported path={}, replacing", destination);
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static double toReferenceSeconds(Instant instant) {
        return (instant.getEpochSecond() - REFERENCE_EPOCH_SECONDS) + instant.getNano() / 1_000_000_000.0;
    }

    static Optional<Instant> fromReferenceSeconds(double seconds) {
        if (!Double.isFinite(seconds) || Math.abs(seconds) > MAX_REFERENCE_SECONDS) {
            return Optional.empty();
        }
        long whole = (long) Math.floor(seconds);
        long micros = Math.round((seconds - whole) * 1_000_000);
        if (micros == 1_000_000) {
            whole++;
            micros = 0;
        }
        return Optional.of(Instant.ofEpochSecond(whole + REFERENCE_EPOCH_SECONDS, micros * 1_000));
    }

    public static class Builder {
        private ToolVersion currentVersion;
        private Long configurationHash;
        private Clock clock = Clock.systemUTC();
        private CacheMetrics metrics = NoOpCacheMetrics.INSTANCE;

        public Builder currentVersion(ToolVersion currentVersion) {
            this.currentVersion = currentVersion;
            return this;
        }

        public Builder configurationHash(Long configurationHash) {
            this.configurationHash = configurationHash;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(CacheMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Creates an empty cache.
         */
        public LinterCache build() {
            return new LinterCache(versionValue(), configurationHash, null, new LinkedHashMap<>(),
                    requireClock(), requireMetrics());
        }

        /**
         * Rebuilds a cache from a parsed document, checking format, version,
         * configuration and last run date in that order.
         *
         * @throws LinterCacheException if the document is unusable for this run
         */
        public LinterCache load(JsonNode document) {
            String expectedVersion = versionValue();
            Clock c = requireClock();

            if (document == null || !document.isObject()) {
                throw new LinterCacheException(LinterCacheException.Reason.INVALID_FORMAT,
                        "Cache document is not a JSON object");
            }

            JsonNode versionNode = document.get(VERSION);
            String storedVersion = versionNode != null && versionNode.isTextual() ? versionNode.textValue() : null;
            if (!expectedVersion.equals(storedVersion)) {
                throw new LinterCacheException(LinterCacheException.Reason.DIFFERENT_VERSION,
                        "Cache version " + storedVersion + " does not match " + expectedVersion);
            }

            Long storedHash = readLong(document.get(CONFIGURATION_HASH));
            if (!Objects.equals(storedHash, configurationHash)) {
                throw new LinterCacheException(LinterCacheException.Reason.DIFFERENT_CONFIGURATION,
                        "Cache configuration hash " + storedHash + " does not match " + configurationHash);
            }

            JsonNode lastRun = document.get(LAST_RUN_DATE);
            if (lastRun != null && lastRun.isNumber()
                    && lastRun.doubleValue() > toReferenceSeconds(c.instant())) {
                throw new LinterCacheException(LinterCacheException.Reason.INCONSISTENT_LAST_RUN_DATE,
                        "Cache last run date lies in the future");
            }

            Map<String, JsonNode> files = new LinkedHashMap<>();
            JsonNode filesNode = document.get(FILES);
            if (filesNode != null && filesNode.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = filesNode.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> field = it.next();
                    files.put(field.getKey(), field.getValue().deepCopy());
                }
            }
            JsonNode storedLastRun = lastRun == null || lastRun.isNull() ? null : lastRun.deepCopy();
            return new LinterCache(expectedVersion, configurationHash, storedLastRun, files, c, requireMetrics());
        }

        /**
         * Reads a UTF-8 JSON cache file and rebuilds the cache from it.
         *
         * @throws IOException          if the file cannot be read or parsed
         * @throws LinterCacheException if the document is unusable for this run
         */
        public LinterCache load(Path file) throws IOException {
            Objects.requireNonNull(file, "file is required");
            JsonNode document = DOCUMENT_READER.readValue(Files.readAllBytes(file));
            return load(document);
        }

        private String versionValue() {
            return Objects.requireNonNull(currentVersion, "currentVersion is required").value();
        }

        private Clock requireClock() {
            return Objects.requireNonNull(clock, "clock is required");
        }

        private CacheMetrics requireMetrics() {
            return Objects.requireNonNull(metrics, "metrics is required");
        }

        private static Long readLong(JsonNode value) {
            if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
                return null;
            }
            return value.longValue();
        }
    }
}
