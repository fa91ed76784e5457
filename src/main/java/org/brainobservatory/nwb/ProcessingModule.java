package org.brainobservatory.nwb;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Processing namespace holding named data interfaces.
 */
@Getter
public final class ProcessingModule {
    private final String name;
    private final String description;
    @Getter(AccessLevel.NONE)
    private final Map<String, RoiResponseInterface> dataInterfaces = new LinkedHashMap<>();

    ProcessingModule(String name, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
    }

    /**
     * Registers a data interface. Names are unique within the module.
     */
    public void addDataInterface(RoiResponseInterface dataInterface) {
        Objects.requireNonNull(dataInterface, "dataInterface");
        if (dataInterfaces.containsKey(dataInterface.getName())) {
            throw new IllegalArgumentException(
                    name + ": data interface already exists: " + dataInterface.getName()
            );
        }
        dataInterfaces.put(dataInterface.getName(), dataInterface);
    }

    public boolean hasDataInterface(String interfaceName) {
        return dataInterfaces.containsKey(interfaceName);
    }

    public Optional<RoiResponseInterface> getDataInterface(String interfaceName) {
        return Optional.ofNullable(dataInterfaces.get(interfaceName));
    }

    public Map<String, RoiResponseInterface> getDataInterfaces() {
        return Collections.unmodifiableMap(dataInterfaces);
    }
}
