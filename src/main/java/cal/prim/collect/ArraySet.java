package cal.prim.collect;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Equivalence;
import org.checkerframework.checker.nullness.qual.Nullable;

import javax.annotation.Nonnull;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A duplicate-free collection backed by a contiguous, resizable array.
 *
 * <p>Uniqueness and membership are decided by an {@link Equivalence} supplied at
 * construction rather than by {@link Object#equals(Object)}.  There is no hashing:
 * {@link #contains(Object)}, {@link #add(Object)} and {@link #remove(Object)} scan
 * the occupied slots linearly.
 *
 * <p>Elements occupy slots <code>[0, size())</code> with no gaps.  New elements are
 * appended, so a set that has never seen a removal iterates in insertion order.
 * {@link #remove(Object)} moves the last element into the vacated slot, so after
 * a removal the iteration order is <em>not</em> insertion order.
 *
 * <p>Storage is allocated lazily on the first insertion.  When an insertion finds
 * the buffer full its capacity doubles (starting from 1); when a removal leaves the
 * set at a quarter of its capacity or less the capacity halves.  If a larger buffer
 * cannot be allocated the insertion fails and the set is unchanged.  If a smaller
 * buffer cannot be allocated the removal still happens and the set keeps its larger
 * buffer.
 *
 * <p>Two sets configured with semantically different equivalences for the same
 * element type should not be compared with {@link #equals(Object)}; the result
 * depends on which one the method is invoked on.
 *
 * <p>Instances of this class are not thread-safe.  Iterators are read-only and fail
 * fast if the set is structurally modified after they were created.
 *
 * @param <T> the type of the elements; <code>null</code> is not permitted
 */
public class ArraySet<T> implements Iterable<T> {

  private static final Object[] NO_SLOTS = new Object[0];

  private Equivalence<? super T> equivalence;
  private SlotAllocator allocator;

  /** backing buffer; its length is the capacity */
  private Object[] slots;
  private int count;

  /** bumped by every structural modification, checked by iterators */
  private int generation;

  public ArraySet(Equivalence<? super T> equivalence) {
    this(equivalence, SlotAllocator.HEAP);
  }

  public ArraySet(Equivalence<? super T> equivalence, SlotAllocator allocator) {
    this.equivalence = Objects.requireNonNull(equivalence, "equivalence may not be null");
    this.allocator = Objects.requireNonNull(allocator, "allocator may not be null");
    this.slots = NO_SLOTS;
    this.count = 0;
    this.generation = 0;
  }

  /**
   * Create a deep copy of a set.  The copy has the same capacity as
   * <code>source</code> (not just enough room for its elements) and the same
   * equivalence and allocator.
   *
   * @param source the set to copy
   * @return the copy, or an {@link FailureKind#ALLOCATION_FAILURE} if its buffer
   *   could not be allocated
   */
  public static <T> Result<ArraySet<T>> copyOf(ArraySet<T> source) {
    ArraySet<T> copy = new ArraySet<>(source.equivalence, source.allocator);
    if (source.slots.length > 0) {
      Object[] buffer;
      try {
        buffer = source.allocator.allocate(source.slots.length);
      } catch (AllocationFailed e) {
        return Result.failure(FailureKind.ALLOCATION_FAILURE, e.getMessage());
      }
      System.arraycopy(source.slots, 0, buffer, 0, source.count);
      copy.slots = buffer;
      copy.count = source.count;
    }
    return Result.success(copy);
  }

  /**
   * Build a set by {@link #add(Object) adding} every element of a sequence in order.
   * If any insertion fails, nothing of the partially-built set escapes.
   *
   * @param equivalence the equivalence of the new set
   * @param elements a finite sequence of elements
   * @return the new set, or the first failure encountered
   */
  public static <T> Result<ArraySet<T>> of(Equivalence<? super T> equivalence, Iterable<? extends T> elements) {
    return of(equivalence, SlotAllocator.HEAP, elements.iterator());
  }

  public static <T> Result<ArraySet<T>> of(Equivalence<? super T> equivalence, SlotAllocator allocator, Iterator<? extends T> elements) {
    ArraySet<T> result = new ArraySet<>(equivalence, allocator);
    while (elements.hasNext()) {
      Result<Boolean> added = result.add(elements.next());
      if (added instanceof Result.Failure<Boolean> f) {
        result.clear();
        return f.cast();
      }
    }
    return Result.success(result);
  }

  /**
   * Insert a value if no equivalent value is present.
   *
   * @param value the value to insert
   * @return <code>true</code> if the value was inserted, <code>false</code> if an
   *   equivalent value was already present, or an {@link FailureKind#ALLOCATION_FAILURE}
   *   (in which case the set is unchanged)
   */
  public Result<Boolean> add(T value) {
    Objects.requireNonNull(value, "value may not be null");
    if (contains(value)) {
      return Result.success(false);
    }

    if (count == slots.length) {
      try {
        grow();
      } catch (AllocationFailed e) {
        return Result.failure(FailureKind.ALLOCATION_FAILURE, e.getMessage());
      }
    }

    slots[count] = value;
    ++count;
    ++generation;
    return Result.success(true);
  }

  /**
   * Remove the value equivalent to <code>value</code>, if there is one.  The last
   * element of the set takes the place of the removed one.
   *
   * @param value the value to remove
   * @return true if a value was removed
   */
  public boolean remove(T value) {
    int i = indexOf(value);
    if (i < 0) {
      return false;
    }

    slots[i] = slots[count - 1];
    slots[count - 1] = null;
    --count;
    ++generation;

    if (slots.length > 0 && count <= slots.length / 4) {
      try {
        reallocate(slots.length / 2);
      } catch (AllocationFailed e) {
        // The removal stands; the buffer stays over-allocated until a later shrink succeeds.
      }
    }
    return true;
  }

  public boolean contains(T value) {
    return indexOf(value) >= 0;
  }

  /**
   * Read the element in a slot.
   *
   * @param index a slot in <code>[0, size())</code>
   * @return the element, or a {@link FailureKind#RANGE_VIOLATION} for any other index
   */
  public Result<T> get(int index) {
    if (index < 0 || index >= count) {
      return Result.failure(FailureKind.RANGE_VIOLATION, "index " + index + " out of range for size " + count);
    }
    return Result.success(elementAt(index));
  }

  public int size() {
    return count;
  }

  public boolean isEmpty() {
    return count == 0;
  }

  @VisibleForTesting
  int capacity() {
    return slots.length;
  }

  Equivalence<? super T> equivalence() {
    return equivalence;
  }

  SlotAllocator allocator() {
    return allocator;
  }

  /**
   * Replace the contents of this set with a copy of <code>other</code>.  The copy
   * is made before this set is touched, so on failure this set is unchanged.
   *
   * @param other the set to copy
   * @return success, or an {@link FailureKind#ALLOCATION_FAILURE}
   */
  public Result<Void> assign(ArraySet<T> other) {
    if (other != this) {
      Result<ArraySet<T>> tmp = copyOf(other);
      if (tmp instanceof Result.Failure<ArraySet<T>> f) {
        return f.cast();
      }
      swap(tmp.orElseThrow());
    }
    return Result.success(null);
  }

  /**
   * Exchange the entire state of two sets.  No elements are copied.
   *
   * @param other the set to swap with
   */
  public void swap(ArraySet<T> other) {
    Equivalence<? super T> e = equivalence;
    equivalence = other.equivalence;
    other.equivalence = e;

    SlotAllocator a = allocator;
    allocator = other.allocator;
    other.allocator = a;

    Object[] s = slots;
    slots = other.slots;
    other.slots = s;

    int c = count;
    count = other.count;
    other.count = c;

    ++generation;
    ++other.generation;
  }

  /**
   * Remove every element and release the backing buffer.
   */
  public void clear() {
    slots = NO_SLOTS;
    count = 0;
    ++generation;
  }

  @Override
  public @Nonnull Iterator<T> iterator() {
    return new Cursor<>(this);
  }

  /**
   * Two sets are equal if they have the same size and every element of
   * <code>o</code> is {@link #contains(Object) contained} in this set.  The order
   * of the elements is irrelevant.  A set whose elements this set's equivalence
   * cannot compare is not equal to it.
   */
  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) return true;
    if (!(o instanceof ArraySet<?> other)) return false;
    if (count != other.count) return false;
    try {
      for (int i = 0; i < other.count; ++i) {
        if (indexOf(other.slots[i]) < 0) {
          return false;
        }
      }
    } catch (ClassCastException e) {
      return false;
    }
    return true;
  }

  // Equal sets always have equal sizes, whatever the equivalence.
  @Override
  public int hashCode() {
    return count;
  }

  /**
   * The textual form <code>"N (e1) (e2) ... (eN)"</code>, with the elements in
   * iteration order.
   */
  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append(count);
    for (int i = 0; i < count; ++i) {
      builder.append(" (").append(slots[i]).append(')');
    }
    return builder.toString();
  }

  @SuppressWarnings("unchecked")
  private T elementAt(int index) {
    return (T) slots[index];
  }

  @SuppressWarnings("unchecked")
  private int indexOf(Object value) {
    for (int i = 0; i < count; ++i) {
      if (equivalence.equivalent(elementAt(i), (T) value)) {
        return i;
      }
    }
    return -1;
  }

  private void grow() throws AllocationFailed {
    if (slots.length > Integer.MAX_VALUE / 2) {
      throw new AllocationFailed("capacity " + slots.length + " cannot be doubled");
    }
    reallocate(slots.length > 0 ? slots.length * 2 : 1);
  }

  /**
   * Move the elements into a buffer of the given capacity.  The current buffer is
   * only replaced once the new one has been filled.
   */
  private void reallocate(int newCapacity) throws AllocationFailed {
    Object[] buffer = newCapacity == 0 ? NO_SLOTS : allocator.allocate(newCapacity);
    System.arraycopy(slots, 0, buffer, 0, count);
    slots = buffer;
  }

  private static final class Cursor<E> implements Iterator<E> {

    private final ArraySet<E> owner;
    private final int generation;
    private int position;

    private Cursor(ArraySet<E> owner) {
      this.owner = owner;
      this.generation = owner.generation;
      this.position = 0;
    }

    @Override
    public boolean hasNext() {
      return position < owner.count;
    }

    @Override
    public E next() {
      if (owner.generation != generation) {
        throw new ConcurrentModificationException();
      }
      if (position >= owner.count) {
        throw new NoSuchElementException();
      }
      return owner.elementAt(position++);
    }

    /**
     * Two cursors are equal if they point at the same slot of the same set and
     * neither has been invalidated by a modification the other has not seen.
     */
    @Override
    public boolean equals(@Nullable Object o) {
      return o instanceof Cursor<?> other &&
              owner == other.owner &&
              generation == other.generation &&
              position == other.position;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(owner) * 31 + position;
    }

  }

}
