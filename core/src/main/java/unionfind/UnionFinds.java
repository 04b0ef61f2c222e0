package unionfind;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

public final class UnionFinds {

  private UnionFinds() {}

  /**
   * Returns a view of {@code delegate} that serializes every call on a single lock, including {@code find}
   * and {@code connected}, which mutate parent pointers.
   * {@link UnionFind#elements()} returns a snapshot rather than a live view.
   * The delegate must not be accessed directly afterwards.
   */
  public static <E> UnionFind<E> synchronizedUnionFind(UnionFind<E> delegate) {
    return new SynchronizedUnionFind<>(checkNotNull(delegate, "delegate must not be null"));
  }

  private static final class SynchronizedUnionFind<E> implements UnionFind<E> {
    private final UnionFind<E> delegate;
    private final Object mutex = new Object();

    SynchronizedUnionFind(UnionFind<E> delegate) {
      this.delegate = delegate;
    }

    @Override
    public E find(E element) {
      synchronized (mutex) {
        return delegate.find(element);
      }
    }

    @Override
    public boolean union(E a, E b) {
      synchronized (mutex) {
        return delegate.union(a, b);
      }
    }

    @Override
    public boolean connected(E a, E b) {
      synchronized (mutex) {
        return delegate.connected(a, b);
      }
    }

    @Override
    public boolean contains(E element) {
      synchronized (mutex) {
        return delegate.contains(element);
      }
    }

    @Override
    public int size() {
      synchronized (mutex) {
        return delegate.size();
      }
    }

    @Override
    public int setCount() {
      synchronized (mutex) {
        return delegate.setCount();
      }
    }

    @Override
    public int setSize(E element) {
      synchronized (mutex) {
        return delegate.setSize(element);
      }
    }

    @Override
    public Set<E> setOf(E element) {
      synchronized (mutex) {
        return delegate.setOf(element);
      }
    }

    @Override
    public Set<E> elements() {
      synchronized (mutex) {
        return ImmutableSet.copyOf(delegate.elements());
      }
    }

    @Override
    public Collection<Set<E>> equivalenceClasses() {
      synchronized (mutex) {
        return delegate.equivalenceClasses();
      }
    }

    @Override
    public String toString() {
      synchronized (mutex) {
        return delegate.toString();
      }
    }
  }
}
