package unionfind;

import java.util.Collection;
import java.util.Set;

/**
 * A partition of a universe of elements into disjoint sets, supporting merge and same-set queries.
 *
 * Note that {@link #find(Object)} and everything built on it mutate internal state (path compression), even though
 * they never change the partition itself. Implementations are not expected to be thread-safe,
 * see {@link UnionFinds#synchronizedUnionFind(UnionFind)}.
 */
public interface UnionFind<E> {

  /**
   * Returns the representative of the set containing {@code element}.
   * Mutating: rewrites the parent pointers of every node on the traversed path to point at the representative.
   *
   * @throws ElementNotFoundException if the element is not part of the universe
   */
  E find(E element);

  /**
   * Merges the sets containing {@code a} and {@code b}.
   * @return true if the sets were different and are now merged, false if they were already the same
   * @throws ElementNotFoundException if either element is not part of the universe
   */
  boolean union(E a, E b);

  /**
   * @throws ElementNotFoundException if either element is not part of the universe
   */
  boolean connected(E a, E b);

  boolean contains(E element);

  /** number of elements in the universe */
  int size();

  /** current number of disjoint sets */
  int setCount();

  /** number of elements in the set containing {@code element} */
  int setSize(E element);

  /** immutable snapshot of the set containing {@code element} */
  Set<E> setOf(E element);

  /** all elements of the universe, in insertion order */
  Set<E> elements();

  /** immutable snapshot of all sets, ordered by their first member in insertion order */
  Collection<Set<E>> equivalenceClasses();
}
