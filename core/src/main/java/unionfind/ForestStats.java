package unionfind;

import java.util.concurrent.atomic.AtomicLong;

public class ForestStats {
  public final boolean statsEnabled;
  private final AtomicLong findCount = new AtomicLong(0);
  private final AtomicLong unionCount = new AtomicLong(0);
  private final AtomicLong mergeCount = new AtomicLong(0);
  private final AtomicLong compressedLinks = new AtomicLong(0);

  ForestStats(boolean statsEnabled) {
    this.statsEnabled = statsEnabled;
  }

  void recordFind(int rewrittenLinks) {
    findCount.incrementAndGet();
    compressedLinks.addAndGet(rewrittenLinks);
  }

  void recordUnion(boolean merged) {
    unionCount.incrementAndGet();
    if (merged) mergeCount.incrementAndGet();
  }

  /** number of root lookups, including the ones done on behalf of `union` and `connected` */
  public final long getFindCount() {
    checkEnabled();
    return findCount.get();
  }

  public final long getUnionCount() {
    checkEnabled();
    return unionCount.get();
  }

  /** unions that actually joined two different sets */
  public final long getMergeCount() {
    checkEnabled();
    return mergeCount.get();
  }

  /** parent pointers rewritten by path compression */
  public final long getCompressedLinks() {
    checkEnabled();
    return compressedLinks.get();
  }

  private void checkEnabled() {
    if (!statsEnabled) throw new IllegalStateException("forest statistics not enabled");
  }

  @Override
  public String toString() {
    if (!statsEnabled) return "ForestStats{disabled}";
    return String.format("ForestStats{finds=%d, unions=%d, merges=%d, compressedLinks=%d}",
        findCount.get(), unionCount.get(), mergeCount.get(), compressedLinks.get());
  }
}
