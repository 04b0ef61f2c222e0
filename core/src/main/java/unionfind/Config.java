package unionfind;

import java.util.Collection;
import java.util.Optional;

public class Config {
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.OVERWRITE;
    private boolean growthEnabled = false;
    private boolean statsEnabled = false;
    private Optional<Integer> initialCapacity = Optional.empty();
    private static final int defaultInitialCapacity = 16;

    public static Config withDefaults() {
        return new Config();
    }

    /**
     * What to do when the same element shows up more than once, either in the construction universe or via
     * {@link DisjointSetForest#add(Object)}.
     */
    public enum DuplicatePolicy {
        /** later duplicates collapse onto the existing node, silently */
        OVERWRITE,
        /** duplicates are an error, reported as {@link InvalidInputException} */
        REJECT
    }

    public Config withDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        if (duplicatePolicy == null)
            throw new IllegalArgumentException("duplicatePolicy must not be null");
        this.duplicatePolicy = duplicatePolicy;
        return this;
    }

    public Config rejectDuplicates() {
        return withDuplicatePolicy(DuplicatePolicy.REJECT);
    }

    /* If enabled, elements can be appended after construction via `DisjointSetForest.add`.
     * The universe is fixed otherwise. */
    public Config enableGrowth() {
        this.growthEnabled = true;
        return this;
    }

    /* If specified, the forest counts finds, unions, merges and compressed links. */
    public Config withStatsEnabled() {
        this.statsEnabled = true;
        return this;
    }

    /**
     * sizing hint for the node arena and the element index.
     * defaults to the universe size if that is known upfront, 16 otherwise
     */
    public Config withInitialCapacity(int initialCapacity) {
        if (initialCapacity < 0)
            throw new IllegalArgumentException("initialCapacity must not be negative, but was " + initialCapacity);
        this.initialCapacity = Optional.of(initialCapacity);
        return this;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public boolean isGrowthEnabled() {
        return growthEnabled;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    public Optional<Integer> getInitialCapacity() {
        return initialCapacity;
    }

    int initialCapacityOr(Iterable<?> universe) {
        if (initialCapacity.isPresent()) return initialCapacity.get();
        if (universe instanceof Collection) return ((Collection<?>) universe).size();
        return defaultInitialCapacity;
    }
}
