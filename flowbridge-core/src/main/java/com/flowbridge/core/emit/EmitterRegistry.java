package com.flowbridge.core.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Emitters discovered through {@link ServiceLoader}.
 */
public final class EmitterRegistry {

    private static final Logger log = LoggerFactory.getLogger(EmitterRegistry.class);

    private EmitterRegistry() {
        // Utility class
    }

    /**
     * Discovers all registered emitters.
     *
     * @return emitters sorted by id
     */
    public static List<TargetEmitter> discover() {
        log.debug("Discovering target emitters via ServiceLoader");
        List<TargetEmitter> emitters = new ArrayList<>();
        ServiceLoader.load(TargetEmitter.class).forEach(emitters::add);
        emitters.sort(Comparator.comparing(TargetEmitter::getId));
        log.debug("Found {} emitters: {}", emitters.size(), emitters.stream().map(TargetEmitter::getId).toList());
        return emitters;
    }

    /**
     * Finds an emitter by id.
     *
     * @param id emitter id
     * @return the emitter, or empty if none is registered under the id
     */
    public static Optional<TargetEmitter> find(String id) {
        return discover().stream().filter(e -> e.getId().equals(id)).findFirst();
    }
}
