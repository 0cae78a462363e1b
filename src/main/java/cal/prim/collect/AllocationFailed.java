package cal.prim.collect;

/**
 * An exception indicating that a {@link SlotAllocator} could not provide a
 * buffer of the requested capacity.
 */
public class AllocationFailed extends Exception {
  public AllocationFailed(String message) {
    super(message);
  }

  public AllocationFailed(String message, Throwable cause) {
    super(message, cause);
  }
}
