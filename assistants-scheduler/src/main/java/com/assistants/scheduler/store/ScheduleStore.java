package com.assistants.scheduler.store;

import com.assistants.common.infra.JsonFile;
import com.assistants.scheduler.model.ScheduleRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * File-per-record schedule persistence under {@code <root>/schedules}.
 *
 * <p>
 * Writes replace the whole file atomically. Reads are forgiving: a missing,
 * unreadable or malformed file is reported as absent so that batch scans keep
 * going. Writes are strict: validation and I/O failures reach the caller.
 * </p>
 */
@Slf4j
public class ScheduleStore {

    public static final String SCHEDULES_DIRNAME = "schedules";
    private static final String RECORD_SUFFIX = ".json";

    private final Path schedulesDir;

    /**
     * @param root state root, e.g. {@code <project>/.assistants}
     */
    public ScheduleStore(Path root) {
        this.schedulesDir = root.resolve(SCHEDULES_DIRNAME);
    }

    public Path getSchedulesDir() {
        return schedulesDir;
    }

    /**
     * Path of a record file; the id is validated first.
     *
     * @throws ScheduleValidationException for an unsafe id
     */
    public Path recordPath(String id) {
        return schedulesDir.resolve(ScheduleIds.requireSafe(id) + RECORD_SUFFIX);
    }

    // --- Writes ---

    /**
     * Persist the full record, replacing any previous version.
     *
     * @throws ScheduleValidationException if the id is unsafe; nothing is written
     * @throws IOException                 if the file cannot be written
     */
    public void save(ScheduleRecord record) throws IOException {
        Objects.requireNonNull(record, "record");
        Path path = recordPath(record.getId());
        JsonFile.save(path, record);
        log.debug("Saved schedule {}", record.getId());
    }

    /**
     * Read-modify-write of one record.
     *
     * @param updater receives the current record, returns the replacement; it
     *                may not change the id
     * @return the saved record, or empty if no readable record exists
     * @throws IOException if the updated record cannot be written
     */
    public Optional<ScheduleRecord> update(String id, UnaryOperator<ScheduleRecord> updater) throws IOException {
        Optional<ScheduleRecord> current = get(id);
        if (current.isEmpty())
            return Optional.empty();

        ScheduleRecord updated = updater.apply(current.get());
        if (updated == null)
            return Optional.empty();
        if (!id.equals(updated.getId())) {
            throw new ScheduleValidationException(
                    "Updater changed schedule id from " + id + " to " + updated.getId());
        }
        save(updated);
        return Optional.of(updated);
    }

    /**
     * Remove a record.
     *
     * @return true if a file was deleted, false if it was absent or the id is
     *         unsafe
     * @throws IOException if an existing file cannot be deleted
     */
    public boolean delete(String id) throws IOException {
        if (!ScheduleIds.isSafe(id))
            return false;
        boolean deleted = Files.deleteIfExists(recordPath(id));
        if (deleted) {
            log.debug("Deleted schedule {}", id);
        }
        return deleted;
    }

    // --- Reads ---

    /**
     * Read one record.
     *
     * @return the record, or empty when the id is unsafe, the file is missing
     *         or unreadable, or the content is not a record with an id
     */
    public Optional<ScheduleRecord> get(String id) {
        if (!ScheduleIds.isSafe(id))
            return Optional.empty();
        return readRecord(recordPath(id));
    }

    /**
     * Every readable record, ordered by file name. Malformed files are skipped.
     */
    public List<ScheduleRecord> list(ScheduleListFilter filter) {
        List<ScheduleRecord> records = new ArrayList<>();
        if (!Files.isDirectory(schedulesDir))
            return records;

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(schedulesDir, "*" + RECORD_SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list schedules in {}: {}", schedulesDir, e.getMessage());
            return records;
        }
        files.sort(null);

        for (Path file : files) {
            readRecord(file).ifPresent(records::add);
        }

        if (filter != null && filter.appliesSessionFilter()) {
            String sessionId = filter.sessionId();
            records.removeIf(r -> !r.isGlobal() && !sessionId.equals(r.getSessionId()));
        }
        return records;
    }

    /**
     * Every record regardless of session.
     */
    public List<ScheduleRecord> list() {
        return list(ScheduleListFilter.everything());
    }

    /**
     * Active records whose {@code nextRunAt} is set and not after {@code now}.
     */
    public List<ScheduleRecord> getDue(long now) {
        List<ScheduleRecord> due = new ArrayList<>();
        for (ScheduleRecord record : list()) {
            if (record.isDue(now)) {
                due.add(record);
            }
        }
        return due;
    }

    private Optional<ScheduleRecord> readRecord(Path path) {
        try {
            ScheduleRecord record = JsonFile.read(path, ScheduleRecord.class);
            if (record == null || record.getId() == null || record.getId().isBlank()) {
                log.debug("Skipping schedule file without id: {}", path.getFileName());
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.debug("Skipping unreadable schedule file {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
