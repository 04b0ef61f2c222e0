package unionfind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import gnu.trove.impl.Constants;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Disjoint-set forest over a fixed universe of elements, using union by rank and full path compression.
 *
 * Nodes live in an index-based arena: slot {@code i} holds an element, its parent slot and its rank, and a root is
 * marked by {@code parent[i] == i}. Element to slot lookups go through a Trove primitive map, so the only
 * per-element objects are the elements themselves.
 *
 * Not thread-safe, not even for {@link #find(Object)}, which compresses paths as a side effect.
 */
public class DisjointSetForest<E> implements UnionFind<E> {
  private static final Logger logger = LogManager.getLogger(DisjointSetForest.class);
  private static final int NO_ENTRY = -1;

  private final Config config;
  private final ForestStats stats;
  // Maps element -> slot
  private final TObjectIntHashMap<E> slotByElement;

  private Object[] elements;
  private int[] parent;
  private int[] rank;
  /* only meaningful for roots */
  private int[] setSize;
  private int size;
  private int setCount;

  public DisjointSetForest(Iterable<? extends E> universe) {
    this(universe, Config.withDefaults());
  }

  public DisjointSetForest(Iterable<? extends E> universe, Config config) {
    checkNotNull(universe, "universe must not be null");
    this.config = checkNotNull(config, "config must not be null");
    this.stats = new ForestStats(config.isStatsEnabled());

    final int capacity = Math.max(config.initialCapacityOr(universe), 1);
    this.slotByElement = new TObjectIntHashMap<>(capacity, Constants.DEFAULT_LOAD_FACTOR, NO_ENTRY);
    this.elements = new Object[capacity];
    this.parent = new int[capacity];
    this.rank = new int[capacity];
    this.setSize = new int[capacity];

    int duplicates = 0;
    for (E element : universe) {
      if (!insert(element)) duplicates++;
    }
    logger.debug("created forest with {} elements, duplicatePolicy={}, {} duplicate(s) collapsed",
        size, config.getDuplicatePolicy(), duplicates);
  }

  @Override
  public E find(E element) {
    return elementAt(findRoot(slotOf(element)));
  }

  @Override
  public boolean union(E a, E b) {
    // resolve both before touching any pointers
    final int slotA = slotOf(a);
    final int slotB = slotOf(b);

    int rootA = findRoot(slotA);
    int rootB = findRoot(slotB);
    if (rootA == rootB) {
      if (stats.statsEnabled) stats.recordUnion(false);
      return false;
    }

    if (rank[rootA] < rank[rootB]) {
      int tmp = rootA;
      rootA = rootB;
      rootB = tmp;
    } else if (rank[rootA] == rank[rootB]) {
      rank[rootA]++;
    }
    // rootA survives: either strictly higher rank, or the tie-break winner (root of `a`)
    parent[rootB] = rootA;
    setSize[rootA] += setSize[rootB];
    setCount--;

    if (stats.statsEnabled) stats.recordUnion(true);
    logger.trace("merged set of {} into set of {}", elementAt(rootB), elementAt(rootA));
    return true;
  }

  @Override
  public boolean connected(E a, E b) {
    final int slotA = slotOf(a);
    final int slotB = slotOf(b);
    return findRoot(slotA) == findRoot(slotB);
  }

  @Override
  public boolean contains(E element) {
    return element != null && slotByElement.containsKey(element);
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public int setCount() {
    return setCount;
  }

  @Override
  public int setSize(E element) {
    return setSize[findRoot(slotOf(element))];
  }

  @Override
  public Set<E> setOf(E element) {
    final int root = findRoot(slotOf(element));
    ImmutableSet.Builder<E> members = ImmutableSet.builderWithExpectedSize(setSize[root]);
    for (int slot = 0; slot < size; slot++) {
      if (findRoot(slot) == root) members.add(elementAt(slot));
    }
    return members.build();
  }

  /**
   * Unmodifiable live view of the universe, in insertion order.
   */
  @Override
  public Set<E> elements() {
    return new AbstractSet<E>() {
      @Override
      @SuppressWarnings("unchecked")
      public boolean contains(Object o) {
        return DisjointSetForest.this.contains((E) o);
      }

      @Override
      public Iterator<E> iterator() {
        return Iterators.unmodifiableIterator(arenaView().iterator());
      }

      @Override
      public int size() {
        return size;
      }
    };
  }

  @Override
  public Collection<Set<E>> equivalenceClasses() {
    // position of each root's class in `classes`, indexed by root slot
    final int[] classByRoot = new int[size];
    Arrays.fill(classByRoot, NO_ENTRY);
    final List<ImmutableSet.Builder<E>> classes = new ArrayList<>(setCount);

    for (int slot = 0; slot < size; slot++) {
      int root = findRoot(slot);
      if (classByRoot[root] == NO_ENTRY) {
        classByRoot[root] = classes.size();
        classes.add(ImmutableSet.builderWithExpectedSize(setSize[root]));
      }
      classes.get(classByRoot[root]).add(elementAt(slot));
    }

    ImmutableList.Builder<Set<E>> result = ImmutableList.builderWithExpectedSize(classes.size());
    for (ImmutableSet.Builder<E> members : classes) {
      result.add(members.build());
    }
    return result.build();
  }

  /**
   * Appends a new singleton set. Only available if the forest was configured with {@link Config#enableGrowth()}.
   *
   * @throws UnsupportedOperationException if growth is not enabled
   * @throws InvalidInputException for a null element, or for a duplicate under {@link Config.DuplicatePolicy#REJECT}
   */
  public void add(E element) {
    if (!config.isGrowthEnabled())
      throw new UnsupportedOperationException("universe is fixed at construction, enable growth via Config.enableGrowth()");
    if (insert(element)) {
      logger.debug("added element {}, universe now has {} elements", element, size);
    }
  }

  public ForestStats stats() {
    return stats;
  }

  /* raw parent pointer, without any compression - for naive root walks in tests */
  E parentOf(E element) {
    return elementAt(parent[slotOf(element)]);
  }

  int rankOf(E element) {
    return rank[slotOf(element)];
  }

  /**
   * @return false if the element was already present and collapsed onto its existing node
   */
  private boolean insert(E element) {
    if (element == null)
      throw new InvalidInputException("null elements are not supported");

    if (slotByElement.containsKey(element)) {
      if (config.getDuplicatePolicy() == Config.DuplicatePolicy.REJECT)
        throw new InvalidInputException("duplicate element in universe: " + element);
      return false;
    }

    ensureCapacity(size + 1);
    final int slot = size++;
    elements[slot] = element;
    parent[slot] = slot;
    rank[slot] = 0;
    setSize[slot] = 1;
    slotByElement.put(element, slot);
    setCount++;
    return true;
  }

  private void ensureCapacity(int required) {
    if (required <= elements.length) return;
    final int newCapacity = Math.max(required, elements.length * 2);
    elements = Arrays.copyOf(elements, newCapacity);
    parent = Arrays.copyOf(parent, newCapacity);
    rank = Arrays.copyOf(rank, newCapacity);
    setSize = Arrays.copyOf(setSize, newCapacity);
  }

  private int slotOf(E element) {
    final int slot = element == null ? NO_ENTRY : slotByElement.get(element);
    if (slot == NO_ENTRY) throw new ElementNotFoundException(element);
    return slot;
  }

  /**
   * Walks up to the root, then points every node on the way directly at it.
   * Iterative, so degenerate chains cannot exhaust the JVM stack.
   */
  private int findRoot(int slot) {
    int root = slot;
    while (parent[root] != root) {
      root = parent[root];
    }

    int rewritten = 0;
    int current = slot;
    while (current != root) {
      int next = parent[current];
      if (next != root) {
        parent[current] = root;
        rewritten++;
      }
      current = next;
    }

    if (stats.statsEnabled) stats.recordFind(rewritten);
    return root;
  }

  @SuppressWarnings("unchecked")
  private E elementAt(int slot) {
    return (E) elements[slot];
  }

  @SuppressWarnings("unchecked")
  private List<E> arenaView() {
    return (List<E>) (List<?>) Arrays.asList(elements).subList(0, size);
  }

  @Override
  public String toString() {
    return "parent=" + Arrays.toString(Arrays.copyOf(parent, size)) + ", rank=" + Arrays.toString(Arrays.copyOf(rank, size));
  }
}
