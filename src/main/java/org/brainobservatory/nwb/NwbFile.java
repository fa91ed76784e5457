package org.brainobservatory.nwb;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory neurophysiology container for one imaging session.
 *
 * <p>Not thread-safe. Callers writing several modalities serialize access themselves.</p>
 */
@Getter
public final class NwbFile {
    private final String identifier;
    private final String sessionDescription;
    @Getter(AccessLevel.NONE)
    private final Map<String, ProcessingModule> processing = new LinkedHashMap<>();

    public NwbFile(String identifier, String sessionDescription) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.sessionDescription = Objects.requireNonNull(sessionDescription, "sessionDescription");
    }

    /**
     * Creates and registers an empty processing module.
     */
    public ProcessingModule createProcessingModule(String name, String description) {
        Objects.requireNonNull(name, "name");
        if (processing.containsKey(name)) {
            throw new IllegalArgumentException("processing module already exists: " + name);
        }
        ProcessingModule module = new ProcessingModule(name, description);
        processing.put(name, module);
        return module;
    }

    public Optional<ProcessingModule> getProcessingModule(String name) {
        return Optional.ofNullable(processing.get(name));
    }

    public Map<String, ProcessingModule> getProcessingModules() {
        return Collections.unmodifiableMap(processing);
    }
}
