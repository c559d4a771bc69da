package com.eyelevel.contentmoderation.service.backup;

import com.eyelevel.contentmoderation.common.json.JsonSerializer;
import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.repository.ModerationJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes point-in-time JSON snapshots of the whole job store.
 * <p>
 * A snapshot is written to a temporary file and moved into place atomically, so a reader never sees
 * a partial backup. Only the newest {@code app.moderation.backup.retention} snapshots are kept.
 * Backups are recovery aids only and never change pipeline state.
 */
@Slf4j
@Service
public class JobStoreBackupService {

    static final String BACKUP_PREFIX = "jobs_backup_";
    static final String BACKUP_SUFFIX = ".json";
    private static final Pattern BACKUP_NAME = Pattern.compile("^jobs_backup_(\\d+)\\.json$");

    private final ModerationJobRepository jobRepository;
    private final JsonSerializer jsonSerializer;
    private final Clock clock;
    private final Path backupDirectory;
    private final int retention;

    public JobStoreBackupService(final ModerationJobRepository jobRepository,
                                 @Qualifier("jacksonJsonSerializer") final JsonSerializer jsonSerializer,
                                 final Clock clock,
                                 final ModerationProperties properties) {
        this.jobRepository = jobRepository;
        this.jsonSerializer = jsonSerializer;
        this.clock = clock;
        this.backupDirectory = Path.of(properties.getBackup().getDirectory());
        this.retention = Math.max(1, properties.getBackup().getRetention());
    }

    /**
     * @return The path of the new snapshot, or empty if the backup failed.
     */
    public Optional<Path> createBackup() {
        final Path target = backupDirectory.resolve(BACKUP_PREFIX + clock.millis() + BACKUP_SUFFIX);
        File tempFile = null;
        try {
            final List<ModerationJob> jobs = jobRepository.findAll(Sort.by(Sort.Direction.ASC, "createdAt"));
            FileUtils.forceMkdir(backupDirectory.toFile());
            tempFile = Files.createTempFile(backupDirectory, BACKUP_PREFIX, ".tmp").toFile();
            FileUtils.writeStringToFile(tempFile, jsonSerializer.serialize(jobs, true), StandardCharsets.UTF_8);
            Files.move(tempFile.toPath(), target, StandardCopyOption.ATOMIC_MOVE);
            log.info("Backed up {} job(s) to {}.", jobs.size(), target);
        } catch (final IOException | RuntimeException e) {
            log.error("Failed to write job store backup {}.", target, e);
            FileUtils.deleteQuietly(tempFile);
            return Optional.empty();
        }

        pruneOldBackups();
        return Optional.of(target);
    }

    /**
     * @return The existing snapshots, newest first.
     */
    public List<Path> listBackups() {
        if (!Files.isDirectory(backupDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(backupDirectory)) {
            return files.filter(path -> BACKUP_NAME.matcher(path.getFileName().toString()).matches())
                        .sorted(Comparator.comparingLong(JobStoreBackupService::timestampOf).reversed())
                        .toList();
        } catch (final IOException e) {
            log.error("Failed to list job store backups in {}.", backupDirectory, e);
            return List.of();
        }
    }

    private void pruneOldBackups() {
        final List<Path> backups = listBackups();
        for (final Path stale : backups.subList(Math.min(retention, backups.size()), backups.size())) {
            try {
                Files.deleteIfExists(stale);
                log.debug("Deleted old job store backup {}.", stale);
            } catch (final IOException e) {
                log.warn("Failed to delete old job store backup {}: {}", stale, e.getMessage());
            }
        }
    }

    private static long timestampOf(final Path path) {
        final Matcher matcher = BACKUP_NAME.matcher(path.getFileName().toString());
        return matcher.matches() ? Long.parseLong(matcher.group(1)) : 0L;
    }
}
