package org.netpreserve.fedicrawl.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.config.CheckpointConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Durable, append-only checkpoint storage.
 * <p>
 * Checkpoints go to the shared store and, when backups are enabled, also to one JSON file each. If the store can't
 * be reached the backup files are used instead, so a crawl can still checkpoint and resume.
 */
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);
    private static final String BACKUP_SUFFIX = ".json";

    private final CheckpointDAO dao;
    private final CheckpointConfig config;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final TimeBasedEpochGenerator idGenerator = Generators.timeBasedEpochGenerator();
    private final Map<String, Long> lastSequence = new ConcurrentHashMap<>();

    public CheckpointStore(CheckpointDAO dao, CheckpointConfig config) {
        this(dao, config, Clock.systemUTC());
    }

    public CheckpointStore(CheckpointDAO dao, CheckpointConfig config, Clock clock) {
        this.dao = dao;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Writes a new checkpoint and prunes old ones.
     *
     * @return the new checkpoint's id
     */
    public String save(String scraperType, String sessionId, byte[] state, CheckpointMetadata metadata) {
        String id = idGenerator.generate().toString();
        Instant timestamp = clock.instant();
        long sequence;
        boolean stored;
        try {
            sequence = dao.insert(id, scraperType, sessionId, timestamp, state, metadata);
            stored = true;
        } catch (JdbiException e) {
            log.warn("Checkpoint store unavailable, checkpoint {} is backup only: {}", id, e.getMessage());
            sequence = Math.max(lastSequence.getOrDefault(scraperType, 0L), latestBackupSequence(scraperType)) + 1;
            stored = false;
        }
        lastSequence.put(scraperType, sequence);
        var checkpoint = new Checkpoint(id, scraperType, sessionId, sequence, timestamp, state, metadata);

        boolean backedUp = config.backup() && writeBackup(checkpoint);
        if (!stored && !backedUp) {
            log.error("Checkpoint {} of {} could not be persisted anywhere", id, scraperType);
        }
        log.atInfo().addKeyValue("id", id)
                .addKeyValue("scraperType", scraperType)
                .addKeyValue("sequence", sequence)
                .addKeyValue("status", metadata.get(CheckpointMetadata.STATUS))
                .log("Saved checkpoint");
        prune(scraperType);
        return id;
    }

    /**
     * Finds the newest checkpoint of a scraper type, or nothing if it is older than the configured maximum age.
     */
    public Optional<Checkpoint> loadLatest(String scraperType) {
        Checkpoint checkpoint;
        try {
            checkpoint = dao.latest(scraperType);
        } catch (JdbiException e) {
            log.warn("Checkpoint store unavailable, looking for a backup: {}", e.getMessage());
            checkpoint = latestBackup(scraperType);
        }
        if (checkpoint == null) return Optional.empty();
        Duration age = Duration.between(checkpoint.timestamp(), clock.instant());
        if (age.compareTo(config.maxAge()) > 0) {
            log.atInfo().addKeyValue("id", checkpoint.id()).addKeyValue("age", age)
                    .log("Ignoring checkpoint older than the maximum age");
            return Optional.empty();
        }
        return Optional.of(checkpoint);
    }

    public Optional<Checkpoint> load(String id) {
        return Optional.ofNullable(dao.find(id));
    }

    /**
     * @param scraperType scraper type to list, or null for all
     * @return checkpoints, newest first
     */
    public List<Checkpoint> list(@Nullable String scraperType) {
        return scraperType == null ? dao.listAll() : dao.list(scraperType);
    }

    /**
     * @return false if there was no such checkpoint
     */
    public boolean delete(String id) {
        if (!dao.exists(id)) return false;
        dao.delete(id);
        deleteBackups(path -> path.getFileName().toString().endsWith("-" + id + BACKUP_SUFFIX));
        return true;
    }

    /**
     * Keeps the newest {@code frequency * 2} checkpoints of a scraper type and deletes the rest.
     *
     * @return the number of checkpoints deleted from the store
     */
    public int prune(String scraperType) {
        int keep = config.retention();
        int deleted = 0;
        try {
            deleted = dao.prune(scraperType, keep);
        } catch (JdbiException e) {
            log.warn("Unable to prune checkpoints: {}", e.getMessage());
        }
        List<Path> backups = backupFiles(scraperType);
        for (int i = keep; i < backups.size(); i++) {
            try {
                Files.deleteIfExists(backups.get(i));
            } catch (IOException e) {
                log.warn("Unable to delete old checkpoint backup {}", backups.get(i), e);
            }
        }
        if (deleted > 0) log.debug("Pruned {} old {} checkpoints", deleted, scraperType);
        return deleted;
    }

    /**
     * Writes every checkpoint of a scraper type to a JSON file.
     *
     * @return the number of checkpoints exported
     */
    public int exportTo(String scraperType, Path file) throws IOException {
        List<Checkpoint> checkpoints = dao.list(scraperType);
        var export = new CheckpointExport(scraperType, clock.instant(), checkpoints.size(), checkpoints);
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), export);
        log.info("Exported {} {} checkpoints to {}", checkpoints.size(), scraperType, file);
        return checkpoints.size();
    }

    /**
     * Reads checkpoints written by {@link #exportTo}. Existing checkpoints are never overwritten: a checkpoint whose
     * id is already present is skipped, and one whose sequence is taken by another checkpoint is given the next
     * sequence of its scraper type.
     *
     * @throws IllegalArgumentException if the file holds checkpoints of another scraper type
     */
    public ImportResult importFrom(String scraperType, Path file) throws IOException {
        CheckpointExport export = mapper.readValue(file.toFile(), CheckpointExport.class);
        if (!scraperType.equals(export.scraperType())) {
            throw new IllegalArgumentException("Export is for scraper type " + export.scraperType() +
                                               " not " + scraperType);
        }
        int imported = 0;
        int skipped = 0;
        int renumbered = 0;
        for (Checkpoint checkpoint : export.checkpoints()) {
            if (!scraperType.equals(checkpoint.scraperType())) {
                throw new IllegalArgumentException("Checkpoint " + checkpoint.id() + " is for scraper type " +
                                                   checkpoint.scraperType());
            }
            if (dao.exists(checkpoint.id())) {
                skipped++;
            } else if (dao.sequenceTaken(scraperType, checkpoint.sequence())) {
                long sequence = dao.insert(checkpoint.id(), scraperType, checkpoint.sessionId(),
                        checkpoint.timestamp(), checkpoint.state(), checkpoint.metadata());
                log.atWarn().addKeyValue("checkpoint", checkpoint.id())
                        .addKeyValue("sequence", checkpoint.sequence())
                        .log("Sequence already taken, imported as sequence {}", sequence);
                imported++;
                renumbered++;
            } else if (dao.insertIfAbsent(checkpoint)) {
                imported++;
            } else {
                skipped++;
            }
        }
        log.info("Imported {} checkpoints from {} ({} renumbered), skipped {} already present", imported, file,
                renumbered, skipped);
        return new ImportResult(imported, skipped, renumbered);
    }

    private boolean writeBackup(Checkpoint checkpoint) {
        Path dir = config.backupDir();
        Path file = dir.resolve(String.format("%s-%010d-%s%s", checkpoint.scraperType(), checkpoint.sequence(),
                checkpoint.id(), BACKUP_SUFFIX));
        try {
            Files.createDirectories(dir);
            Path tmp = dir.resolve(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), checkpoint);
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (IOException e) {
            log.warn("Unable to write checkpoint backup {}", file, e);
            return false;
        }
    }

    @Nullable
    private Checkpoint latestBackup(String scraperType) {
        for (Path file : backupFiles(scraperType)) {
            try {
                return mapper.readValue(file.toFile(), Checkpoint.class);
            } catch (IOException e) {
                log.warn("Skipping unreadable checkpoint backup {}", file, e);
            }
        }
        return null;
    }

    private long latestBackupSequence(String scraperType) {
        List<Path> backups = backupFiles(scraperType);
        if (backups.isEmpty()) return 0;
        String name = backups.get(0).getFileName().toString();
        int start = scraperType.length() + 1;
        int end = name.indexOf('-', start);
        try {
            return Long.parseLong(name.substring(start, end < 0 ? name.length() : end));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Backup files of a scraper type, newest first.
     */
    private List<Path> backupFiles(String scraperType) {
        Path dir = config.backupDir();
        if (!config.backup() || dir == null || !Files.isDirectory(dir)) return List.of();
        String prefix = scraperType + "-";
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(BACKUP_SUFFIX)
                               && Character.isDigit(name.charAt(prefix.length()));
                    })
                    .sorted(Comparator.comparing((Path path) -> path.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) {
            log.warn("Unable to list checkpoint backups in {}", dir, e);
            return List.of();
        }
    }

    private void deleteBackups(Predicate<Path> predicate) {
        Path dir = config.backupDir();
        if (!config.backup() || dir == null || !Files.isDirectory(dir)) return;
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path path : stream.filter(predicate).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Unable to delete checkpoint backups in {}", dir, e);
        }
    }
}
