package cal.prim.collect;

import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of an {@link ArraySet} operation that can fail.  A result is
 * either a {@link Success} carrying a value or a {@link Failure} carrying the
 * {@link FailureKind} and a human-readable detail.
 *
 * <p>Operations that return a <code>Result</code> never throw for the failure
 * kinds they report; callers branch on the result instead.  Callers that would
 * rather have an exception can use {@link #orElseThrow()}.
 *
 * @param <V> the type of the value carried on success
 */
public sealed interface Result<V> permits Result.Success, Result.Failure {

  record Success<V>(V value) implements Result<V> {
  }

  record Failure<V>(FailureKind kind, String detail) implements Result<V> {
    public Failure {
      Objects.requireNonNull(kind);
      Objects.requireNonNull(detail);
    }

    /**
     * Re-type this failure.  Failures carry no value, so this is always safe.
     */
    public <W> Failure<W> cast() {
      return new Failure<>(kind, detail);
    }
  }

  static <V> Result<V> success(V value) {
    return new Success<>(value);
  }

  static <V> Result<V> failure(FailureKind kind, String detail) {
    return new Failure<>(kind, detail);
  }

  default boolean isSuccess() {
    return this instanceof Success<?>;
  }

  /**
   * Get the value of a successful result.
   *
   * @return the value
   * @throws IndexOutOfBoundsException if this is a {@link FailureKind#RANGE_VIOLATION}
   * @throws IllegalStateException if this is any other failure
   */
  default V orElseThrow() {
    if (this instanceof Success<V> s) {
      return s.value();
    }
    Failure<V> f = (Failure<V>) this;
    if (f.kind() == FailureKind.RANGE_VIOLATION) {
      throw new IndexOutOfBoundsException(f.detail());
    }
    throw new IllegalStateException(f.kind() + ": " + f.detail());
  }

  default <W> Result<W> map(Function<? super V, ? extends W> f) {
    if (this instanceof Success<V> s) {
      return success(f.apply(s.value()));
    }
    return ((Failure<V>) this).cast();
  }

}
