package com.assistants.common.infra;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import java.util.UUID;

/**
 * JSON file load/save with atomic replacement and owner-only permissions.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Shared mapper: pretty-printed, null fields omitted, unknown properties
     * ignored.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Read and parse a JSON file, surfacing the failure. A missing file raises
     * {@link java.nio.file.NoSuchFileException}, malformed content raises
     * {@link JsonProcessingException}.
     */
    public static <T> T read(Path path, Class<T> type) throws IOException {
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        return MAPPER.readValue(raw, type);
    }

    /**
     * Serialize to the on-disk representation (pretty JSON plus trailing newline).
     */
    public static String toJson(Object data) throws JsonProcessingException {
        return MAPPER.writeValueAsString(data) + "\n";
    }

    /**
     * Save data as a JSON file. Content goes to a temp file in the same
     * directory first and is then renamed over the target, so readers see
     * either the old or the new file, never a partial one.
     */
    public static void save(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = writeTemp(dir, path.getFileName().toString(), toJson(data));
        try {
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Write content to a uniquely named temp file next to {@code baseName} in
     * {@code dir}. The caller owns the returned file.
     */
    public static Path writeTemp(Path dir, String baseName, String content) throws IOException {
        Path tmp = dir.resolve(baseName + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        restrictPermissions(tmp);
        return tmp;
    }

    private static void restrictPermissions(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, Set.of(
                    PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
        } catch (UnsupportedOperationException ignored) {
            // non-POSIX file system, keep default permissions
        }
    }
}
