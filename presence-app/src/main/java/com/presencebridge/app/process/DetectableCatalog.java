package com.presencebridge.app.process;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Applications the process watcher can recognise, loaded from a JSON array of
 * {@code {id, name, executables[]}} objects.
 */
@Slf4j
public class DetectableCatalog {

    private final List<DetectableApp> apps;

    public DetectableCatalog(List<DetectableApp> apps) {
        this.apps = List.copyOf(apps);
    }

    /**
     * Empty when the file is missing or unreadable.
     */
    public static Optional<DetectableCatalog> load(Path path, ObjectMapper mapper) {
        if (!Files.exists(path)) {
            log.warn("Detectables catalog not found: {}", path);
            return Optional.empty();
        }
        try {
            List<DetectableApp> apps = mapper.readValue(Files.readString(path),
                    new TypeReference<List<DetectableApp>>() {
                    });
            List<DetectableApp> usable = apps.stream()
                    .filter(app -> app != null && app.getId() != null && !app.getId().isBlank())
                    .toList();
            log.info("Loaded {} detectable applications from {}", usable.size(), path);
            return Optional.of(new DetectableCatalog(usable));
        } catch (IOException e) {
            log.warn("Failed to read detectables catalog {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * First application whose executables match, in catalog order.
     */
    public Optional<DetectableApp> match(String executable) {
        for (DetectableApp app : apps) {
            if (app.matches(executable)) {
                return Optional.of(app);
            }
        }
        return Optional.empty();
    }

    List<DetectableApp> getApps() {
        return apps;
    }

    public int size() {
        return apps.size();
    }
}
