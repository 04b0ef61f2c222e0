package unionfind.util;

import unionfind.UnionFind;

import java.util.*;

public class PartitionDiff {

  /** compare two partitions element by element
   * identity of elements is given by equals/hashCode. Representatives are not compared, since two structures
   * describing the same partition may well have picked different roots.
   * An empty result means both structures partition the same universe in the same way.
   */
  public static <E> List<String> compare(UnionFind<E> partition1, UnionFind<E> partition2) {
    final List<String> diff = new ArrayList<>();
    if (partition1.size() != partition2.size()) {
      diff.add(String.format("element count differs: partition1=%d, partition2=%d", partition1.size(), partition2.size()));
    }
    if (partition1.setCount() != partition2.setCount()) {
      diff.add(String.format("set count differs: partition1=%d, partition2=%d", partition1.setCount(), partition2.setCount()));
    }

    for (E element : partition1.elements()) {
      if (!partition2.contains(element)) diff.add(String.format("element %s only exists in partition1", element));
    }
    for (E element : partition2.elements()) {
      if (!partition1.contains(element)) diff.add(String.format("element %s only exists in partition2", element));
    }

    compareMembership(partition1, partition2, "partition1", "partition2", diff);
    compareMembership(partition2, partition1, "partition2", "partition1", diff);
    return diff;
  }

  /**
   * for every class in `from`, check that each shared member is connected to the first shared member in `to`
   */
  private static <E> void compareMembership(UnionFind<E> from, UnionFind<E> to, String fromName, String toName, List<String> diff) {
    for (Set<E> equivalenceClass : from.equivalenceClasses()) {
      E anchor = null;
      for (E element : equivalenceClass) {
        if (!to.contains(element)) continue;
        if (anchor == null) {
          anchor = element;
        } else if (!to.connected(anchor, element)) {
          diff.add(String.format("%s and %s are connected in %s, but not in %s", anchor, element, fromName, toName));
        }
      }
    }
  }
}
