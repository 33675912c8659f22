package com.zzf.miniagent.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JSON documents on disk, addressed by a key path: {@code ["a", "b"]} is {@code <root>/a/b.json}.
 */
@Slf4j
public class StorageService {

    private final Path root;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public StorageService(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    public Path getRoot() {
        return root;
    }

    private ReadWriteLock getLock(Path path) {
        return locks.computeIfAbsent(path.toString(), k -> new ReentrantReadWriteLock());
    }

    /**
     * @return the document, or null if there is none under this key
     */
    public <T> T read(List<String> key, Class<T> clazz) throws IOException {
        Path target = getTargetPath(key);
        ReadWriteLock lock = getLock(target);
        lock.readLock().lock();
        try {
            if (!Files.exists(target)) {
                return null;
            }
            return objectMapper.readValue(target.toFile(), clazz);
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> void write(List<String> key, T content) throws IOException {
        Path target = getTargetPath(key);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), content);
            log.debug("storage.write path={}", target);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(List<String> key) throws IOException {
        Path target = getTargetPath(key);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            return Files.deleteIfExists(target);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Keys of every document under {@code prefix}, sorted.
     */
    public List<List<String>> list(List<String> prefix) throws IOException {
        Path dir = root;
        for (String p : prefix) {
            dir = dir.resolve(p);
        }
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .map(this::toKey)
                    .sorted((a, b) -> String.join("/", a).compareTo(String.join("/", b)))
                    .collect(Collectors.toList());
        }
    }

    private List<String> toKey(Path file) {
        Path relative = root.relativize(file);
        List<String> key = new ArrayList<>();
        for (int i = 0; i < relative.getNameCount(); i++) {
            String name = relative.getName(i).toString();
            if (i == relative.getNameCount() - 1) {
                name = name.substring(0, name.length() - ".json".length());
            }
            key.add(name);
        }
        return key;
    }

    private Path getTargetPath(List<String> key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("storage key must not be empty");
        }
        Path path = root;
        for (int i = 0; i < key.size(); i++) {
            String part = key.get(i);
            if (part == null || part.isBlank() || part.contains("/") || part.contains("\\") || part.equals("..")) {
                throw new IllegalArgumentException("invalid storage key part: " + part);
            }
            if (i == key.size() - 1) {
                part += ".json";
            }
            path = path.resolve(part);
        }
        return path;
    }
}
