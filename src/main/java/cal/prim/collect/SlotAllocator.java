package cal.prim.collect;

/**
 * Source of backing buffers for an {@link ArraySet}.
 *
 * <p>Implementations must return a fresh array of exactly the requested
 * length or throw {@link AllocationFailed}.  They are never asked for a
 * zero-length buffer.
 */
@FunctionalInterface
public interface SlotAllocator {

  Object[] allocate(int capacity) throws AllocationFailed;

  /**
   * Allocates on the Java heap.  Running out of memory is reported as
   * {@link AllocationFailed}.
   */
  SlotAllocator HEAP = capacity -> {
    try {
      return new Object[capacity];
    } catch (OutOfMemoryError e) {
      throw new AllocationFailed("cannot allocate " + capacity + " slots", e);
    }
  };

}
