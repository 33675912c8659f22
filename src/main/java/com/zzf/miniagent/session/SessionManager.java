package com.zzf.miniagent.session;

import com.zzf.miniagent.context.ConversationStore;
import com.zzf.miniagent.storage.StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves and restores the top level conversation, one file per session name.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionManager {

    private final StorageService storage;
    private final Clock clock;

    public SessionManager(StorageService storage) {
        this(storage, Clock.systemUTC());
    }

    public SessionData save(String name, ConversationStore conversation) throws IOException {
        SessionData data = new SessionData(checkName(name), new ArrayList<>(conversation.snapshot()),
                OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        storage.write(List.of(name), data);
        log.info("session.save name={} messages={}", name, data.getMessages().size());
        return data;
    }

    /**
     * Replaces the conversation with the saved one.
     *
     * @throws NoSuchFileException if no session has this name
     */
    public SessionData load(String name, ConversationStore conversation) throws IOException {
        SessionData data = storage.read(List.of(checkName(name)), SessionData.class);
        if (data == null) {
            throw new NoSuchFileException(storage.getRoot().resolve(name + ".json").toString());
        }
        conversation.load(data.getMessages());
        log.info("session.load name={} messages={}", name, conversation.size());
        return data;
    }

    public List<String> list() throws IOException {
        List<String> names = new ArrayList<>();
        for (List<String> key : storage.list(List.of())) {
            if (key.size() == 1) {
                names.add(key.get(0));
            }
        }
        return names;
    }

    private static String checkName(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("invalid session name: " + name);
        }
        return name;
    }
}
