package com.assistants.common.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTest {

    @TempDir
    Path tempDir;

    public static class Sample {
        public String name;
        public Integer count;
    }

    @Test
    void save_createsParentDirsAndWritesPrettyJson() throws IOException {
        Path path = tempDir.resolve("a").resolve("b").resolve("sample.json");
        Sample sample = new Sample();
        sample.name = "x";

        JsonFile.save(path, sample);

        String raw = Files.readString(path);
        assertTrue(raw.contains("\"name\" : \"x\""));
        assertFalse(raw.contains("count"), "null fields are omitted");
        assertTrue(raw.endsWith("\n"));
    }

    @Test
    void save_replacesExistingFileAndLeavesNoTempFiles() throws IOException {
        Path path = tempDir.resolve("sample.json");
        JsonFile.save(path, Map.of("v", 1));
        JsonFile.save(path, Map.of("v", 2));

        assertEquals(2, JsonFile.mapper().readTree(Files.readString(path)).get("v").asInt());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(path), files.toList());
        }
    }

    @Test
    void read_ignoresUnknownProperties() throws IOException {
        Path path = tempDir.resolve("sample.json");
        Files.writeString(path, "{\"name\":\"x\",\"count\":3,\"extra\":true}");

        Sample sample = JsonFile.read(path, Sample.class);

        assertEquals("x", sample.name);
        assertEquals(3, sample.count);
    }

    @Test
    void read_missingFile_throwsNoSuchFile() {
        assertThrows(NoSuchFileException.class, () -> JsonFile.read(tempDir.resolve("none.json"), Sample.class));
    }

    @Test
    void read_malformed_throwsJsonProcessingException() throws IOException {
        Path path = tempDir.resolve("bad.json");
        Files.writeString(path, "{ nope");

        assertThrows(JsonProcessingException.class, () -> JsonFile.read(path, Sample.class));
    }

    @Test
    void writeTemp_createsUniqueFiles() throws IOException {
        Path first = JsonFile.writeTemp(tempDir, "lock.json", "{}");
        Path second = JsonFile.writeTemp(tempDir, "lock.json", "{}");

        assertNotEquals(first, second);
        assertTrue(first.getFileName().toString().startsWith("lock.json."));
        assertTrue(first.getFileName().toString().endsWith(".tmp"));
        assertEquals("{}", Files.readString(second));
    }
}
