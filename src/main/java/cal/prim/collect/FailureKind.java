package cal.prim.collect;

public enum FailureKind {
  /** A backing buffer could not be allocated. */
  ALLOCATION_FAILURE,

  /** An index was outside <code>[0, size())</code>. */
  RANGE_VIOLATION
}
