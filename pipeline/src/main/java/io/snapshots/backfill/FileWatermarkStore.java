package io.snapshots.backfill;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Watermarks kept in a small JSON document ({@code {"job": "2024-05-01T13:00:00Z"}}). Every write rewrites
 * the file through a temp file and an atomic move, so a crash leaves either the old or the new content.
 */
public class FileWatermarkStore implements WatermarkStore {
    private static final Logger log = LoggerFactory.getLogger(FileWatermarkStore.class);
    private static final TypeReference<TreeMap<String, Instant>> TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, Instant> cache;

    public FileWatermarkStore(Path file) throws IOException {
        this.file = file;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.cache = Files.exists(file) && Files.size(file) > 0 ? mapper.readValue(file.toFile(), TYPE) : new TreeMap<>();
        log.debug("Loaded {} watermark(s) from {}", cache.size(), file);
    }

    @Override
    public synchronized Optional<Instant> get(String job) {
        return Optional.ofNullable(cache.get(job));
    }

    @Override
    public synchronized void put(String job, Instant watermark) {
        cache.put(job, watermark);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), cache);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("could not persist watermark for " + job + " to " + file, e);
        }
    }
}
