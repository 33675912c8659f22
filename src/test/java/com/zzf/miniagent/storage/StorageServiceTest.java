package com.zzf.miniagent.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StorageService storage;

    @BeforeEach
    void setUp() {
        storage = new StorageService(tempDir, objectMapper);
    }

    @Test
    void writesNestedKeysAsJsonFiles() throws IOException {
        storage.write(List.of("sessions", "alpha"), Map.of("n", 1));

        Path file = tempDir.resolve("sessions").resolve("alpha.json");
        assertTrue(Files.exists(file));
        assertEquals(1, objectMapper.readTree(file.toFile()).get("n").asInt());
        assertEquals(1, storage.read(List.of("sessions", "alpha"), JsonNode.class).get("n").asInt());
    }

    @Test
    void readOfMissingKeyIsNull() throws IOException {
        assertNull(storage.read(List.of("nothing"), JsonNode.class));
    }

    @Test
    void removeReportsWhetherSomethingWasDeleted() throws IOException {
        storage.write(List.of("a"), Map.of());
        assertTrue(storage.remove(List.of("a")));
        assertFalse(storage.remove(List.of("a")));
    }

    @Test
    void listReturnsSortedKeysUnderPrefix() throws IOException {
        storage.write(List.of("b"), Map.of());
        storage.write(List.of("a"), Map.of());
        storage.write(List.of("dir", "c"), Map.of());
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        assertEquals(List.of(List.of("a"), List.of("b"), List.of("dir", "c")), storage.list(List.of()));
        assertEquals(List.of(List.of("dir", "c")), storage.list(List.of("dir")));
        assertTrue(storage.list(List.of("missing")).isEmpty());
    }

    @Test
    void rejectsKeysThatEscapeTheRoot() {
        assertThrows(IllegalArgumentException.class, () -> storage.write(List.of(), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> storage.write(List.of(".."), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> storage.write(List.of("a/b"), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> storage.read(List.of(" "), JsonNode.class));
    }
}
