package com.ticketflow.orchestrator.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ticketflow.orchestrator.config.EngineProperties;
import com.ticketflow.orchestrator.model.RunSnapshot;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * {@link RunStore} backed by one directory per run under {@code ticketflow.engine.runs-dir}.
 *
 * <pre>
 * runs/&lt;run_id&gt;/params.json   captured parameters, secrets redacted
 *                 status.json   latest snapshot, replaced atomically
 *                 run.log       append-only engine and program output
 *                 artifacts/    copies of validated step outputs
 * </pre>
 *
 * The log is read only up to the length committed by completed appends, so
 * readers never see half of a write.
 */
@Component
public class FileRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(FileRunStore.class);

    static final String PARAMS_FILE   = "params.json";
    static final String STATUS_FILE   = "status.json";
    static final String LOG_FILE      = "run.log";
    static final String ARTIFACTS_DIR = "artifacts";

    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path         runsDir;
    private final int          chunkBytes;
    private final ObjectMapper mapper;
    private final Clock        clock;

    private final Map<String, Entry> runs = new ConcurrentHashMap<>();

    public FileRunStore(EngineProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.runsDir    = properties.getRunsDir().toAbsolutePath().normalize();
        this.chunkBytes = properties.getLogChunkBytes();
        this.clock      = clock;
        this.mapper     = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Per-run state. Writers hold {@code lock}; readers use the atomics only. */
    private static final class Entry {
        final Object                       lock     = new Object();
        final AtomicReference<RunSnapshot> snapshot;
        final AtomicLong                   committed;

        Entry(RunSnapshot snapshot, long committed) {
            this.snapshot  = new AtomicReference<>(snapshot);
            this.committed = new AtomicLong(committed);
        }
    }

    // ------------------------------------------------------------------
    // Startup recovery
    // ------------------------------------------------------------------

    /**
     * Load every run found on disk. Runs that were still active when the
     * engine stopped are marked FAILED with an INTERRUPTED step.
     */
    @PostConstruct
    public void load() {
        try {
            Files.createDirectories(runsDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create runs directory " + runsDir, e);
        }
        int loaded = 0;
        int interrupted = 0;
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(runsDir, Files::isDirectory)) {
            for (Path dir : dirs) {
                Path status = dir.resolve(STATUS_FILE);
                if (!Files.isRegularFile(status)) continue;
                RunSnapshot snapshot;
                try {
                    snapshot = mapper.readValue(status.toFile(), RunSnapshot.class);
                } catch (IOException e) {
                    log.warn("Ignoring run directory {}: unreadable {} ({})", dir, STATUS_FILE, e.getMessage());
                    continue;
                }
                Path logFile = dir.resolve(LOG_FILE);
                long length = Files.exists(logFile) ? Files.size(logFile) : 0L;
                runs.put(snapshot.runId(), new Entry(snapshot, length));
                loaded++;
                if (!snapshot.isTerminal()) {
                    String message = "Engine stopped while the run was " + snapshot.overallState();
                    save(snapshot.interrupted(clock.instant(), message));
                    appendLog(snapshot.runId(), "[" + LocalDateTime.now(clock).format(LOG_TIMESTAMP)
                            + "] [ERROR] " + message + ", marked FAILED on restart\n");
                    interrupted++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan runs directory " + runsDir, e);
        }
        log.info("Loaded {} runs from {} ({} marked interrupted)", loaded, runsDir, interrupted);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public Path runDirectory(String runId) {
        return runsDir.resolve(runId);
    }

    @Override
    public void create(RunSnapshot initial, String seedFromRunId) {
        String runId = initial.runId();
        if (seedFromRunId != null && !runs.containsKey(seedFromRunId)) {
            throw new RunNotFoundException(seedFromRunId);
        }
        Path dir = runDirectory(runId);
        try {
            Files.createDirectories(dir.resolve(ARTIFACTS_DIR));
            if (seedFromRunId != null) {
                Path seedArtifacts = runDirectory(seedFromRunId).resolve(ARTIFACTS_DIR);
                int copied = copyTree(seedArtifacts, dir);
                copyTree(seedArtifacts, dir.resolve(ARTIFACTS_DIR));
                log.info("Seeded run {} with {} files from {}", runId, copied, seedFromRunId);
            }
            mapper.writeValue(dir.resolve(PARAMS_FILE).toFile(), initial.parameters());
            Files.write(dir.resolve(LOG_FILE), new byte[0]);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create run directory " + dir, e);
        }
        Entry entry = new Entry(initial, 0L);
        if (runs.putIfAbsent(runId, entry) != null) {
            throw new IllegalStateException("Run " + runId + " already exists");
        }
        writeStatus(dir, initial);
    }

    /**
     * Publish {@code snapshot} to readers, then write it to status.json. Readers
     * see the new snapshot even when the write fails; the failure is rethrown.
     */
    @Override
    public void save(RunSnapshot snapshot) {
        Entry entry = entry(snapshot.runId());
        synchronized (entry.lock) {
            entry.snapshot.set(snapshot);
            try {
                writeStatus(runDirectory(snapshot.runId()), snapshot);
            } catch (UncheckedIOException e) {
                log.error("Run {} is {} in memory but its {} could not be written: {}",
                        snapshot.runId(), snapshot.overallState(), STATUS_FILE, e.getMessage());
                throw e;
            }
        }
    }

    @Override
    public void appendLog(String runId, String text) {
        Entry entry = entry(runId);
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        synchronized (entry.lock) {
            try {
                Files.write(runDirectory(runId).resolve(LOG_FILE), bytes,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot append to log of run " + runId, e);
            }
            entry.committed.addAndGet(bytes.length);
        }
    }

    @Override
    public List<String> captureArtifacts(String runId, List<String> declaredOutputs) {
        entry(runId);
        Path dir       = runDirectory(runId);
        Path artifacts = dir.resolve(ARTIFACTS_DIR);
        List<String> captured = new ArrayList<>();
        try {
            for (String declared : declaredOutputs) {
                boolean isDir   = declared.endsWith("/");
                String relative = isDir ? declared.substring(0, declared.length() - 1) : declared;
                Path source     = dir.resolve(relative).normalize();
                Path target     = artifacts.resolve(relative).normalize();
                if (isDir) {
                    copyTree(source, target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                }
                captured.add(ARTIFACTS_DIR + "/" + declared);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot capture artifacts of run " + runId, e);
        }
        return captured;
    }

    private void writeStatus(Path dir, RunSnapshot snapshot) {
        Path target = dir.resolve(STATUS_FILE);
        Path tmp    = dir.resolve(STATUS_FILE + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public LogChunk readLog(String runId, long fromOffset) {
        if (fromOffset < 0) {
            throw new IllegalArgumentException("Log offset must not be negative: " + fromOffset);
        }
        Entry entry = entry(runId);
        long committed = entry.committed.get();
        if (fromOffset >= committed) {
            return LogChunk.empty(fromOffset);
        }
        int wanted = (int) Math.min(chunkBytes, committed - fromOffset);
        ByteBuffer buffer = ByteBuffer.allocate(wanted);
        try (FileChannel channel = FileChannel.open(runDirectory(runId).resolve(LOG_FILE), StandardOpenOption.READ)) {
            long position = fromOffset;
            while (buffer.hasRemaining()) {
                int n = channel.read(buffer, position);
                if (n < 0) break;
                position += n;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read log of run " + runId, e);
        }
        int length = utf8Boundary(buffer.array(), buffer.position());
        byte[] bytes = Arrays.copyOf(buffer.array(), length);
        return new LogChunk(bytes, fromOffset, fromOffset + length);
    }

    /**
     * Largest prefix length of {@code data[0..length)} that does not end inside
     * a multi-byte UTF-8 sequence.
     */
    static int utf8Boundary(byte[] data, int length) {
        int lead = length - 1;
        while (lead >= 0 && length - lead <= 4 && (data[lead] & 0xC0) == 0x80) {
            lead--;
        }
        if (lead < 0) return length;
        int b = data[lead] & 0xFF;
        int needed = b < 0x80 ? 1 : b >= 0xF0 ? 4 : b >= 0xE0 ? 3 : b >= 0xC0 ? 2 : 1;
        return lead + needed <= length ? length : lead;
    }

    @Override
    public RunSnapshot getStatus(String runId) {
        return entry(runId).snapshot.get();
    }

    @Override
    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    @Override
    public List<RunSnapshot> listRuns() {
        return runs.values().stream()
                .map(e -> e.snapshot.get())
                .sorted(Comparator.comparing(RunSnapshot::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(RunSnapshot::runId, Comparator.reverseOrder()))
                .toList();
    }

    @Override
    public List<ArtifactEntry> listArtifacts(String runId) {
        entry(runId);
        Path artifacts = runDirectory(runId).resolve(ARTIFACTS_DIR);
        if (!Files.isDirectory(artifacts)) return List.of();
        List<ArtifactEntry> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(artifacts)) {
            for (Path child : children.sorted().toList()) {
                String relative = runDirectory(runId).relativize(child).toString().replace('\\', '/');
                Instant modified = Files.getLastModifiedTime(child).toInstant();
                if (Files.isDirectory(child)) {
                    long size = 0;
                    int count = 0;
                    try (Stream<Path> files = Files.walk(child)) {
                        for (Path f : files.filter(Files::isRegularFile).toList()) {
                            size += Files.size(f);
                            count++;
                        }
                    }
                    entries.add(new ArtifactEntry(child.getFileName().toString(), relative + "/",
                            ArtifactEntry.Type.DIRECTORY, size, count, modified));
                } else {
                    entries.add(new ArtifactEntry(child.getFileName().toString(), relative,
                            ArtifactEntry.Type.FILE, Files.size(child), 1, modified));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list artifacts of run " + runId, e);
        }
        return entries;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Entry entry(String runId) {
        Entry entry = runs.get(runId);
        if (entry == null) throw new RunNotFoundException(runId);
        return entry;
    }

    /** Copy every regular file below {@code source} to the same relative path below {@code target}. */
    static int copyTree(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source)) return 0;
        int copied = 0;
        try (Stream<Path> files = Files.walk(source)) {
            for (Path file : files.filter(Files::isRegularFile).toList()) {
                Path dest = target.resolve(source.relativize(file).toString());
                Files.createDirectories(dest.getParent());
                Files.copy(file, dest, StandardCopyOption.REPLACE_EXISTING);
                copied++;
            }
        }
        return copied;
    }
}
