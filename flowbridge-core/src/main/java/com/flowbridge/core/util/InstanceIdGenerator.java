package com.flowbridge.core.util;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Produces instance ids in the runtime's {@code <RuntimeType>-<5 hex>} form.
 *
 * <p>With a seed, the sequence of ids is reproducible: compiling the same document twice with
 * the same seed yields identical ids. Without one, ids are random. Ids are unique within one
 * generator; a collision draws again.
 */
public class InstanceIdGenerator {

    private static final int SUFFIX_BOUND = 0x100000;

    private final Long seed;
    private final Random random;
    private final Set<String> issued = new HashSet<>();

    /**
     * Creates a generator.
     *
     * @param seed seed for reproducible ids, or null for random ids
     */
    public InstanceIdGenerator(Long seed) {
        this.seed = seed;
        this.random = seed == null ? new Random() : new Random(seed);
    }

    /**
     * Returns a fresh id for a component of the given runtime type.
     *
     * @param runtimeType runtime type tag, used as prefix
     * @return unique id
     */
    public String next(String runtimeType) {
        String id;
        do {
            id = runtimeType + "-" + String.format("%05x", random.nextInt(SUFFIX_BOUND));
        } while (!issued.add(id));
        return id;
    }

    /**
     * Returns the id of the whole flow.
     *
     * @param flowName workflow name
     * @return UUID-shaped id, derived from seed and name when seeded
     */
    public String flowId(String flowName) {
        if (seed == null) {
            return UUID.randomUUID().toString();
        }
        return IdGenerator.generateUuidLike(String.valueOf(seed), flowName);
    }

    /**
     * Returns whether the generator was seeded.
     *
     * @return true for reproducible ids
     */
    public boolean isSeeded() {
        return seed != null;
    }
}
