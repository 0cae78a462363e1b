package cal.prim.collect;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Operations over whole {@link ArraySet ArraySets}.  Every operation builds a new
 * set and leaves its arguments untouched.  Results use the equivalence and
 * allocator of the first argument.  If building the result fails, the partial
 * result is cleared and the failure is returned.
 */
public final class ArraySets {

  private ArraySets() {
  }

  /**
   * Select the elements of a set that satisfy a predicate.
   *
   * @param source the set to select from
   * @param predicate the selection criterion
   * @return the matching elements of <code>source</code>, in <code>source</code>'s order
   */
  public static <T> Result<ArraySet<T>> filter(ArraySet<T> source, Predicate<? super T> predicate) {
    ArraySet<T> result = new ArraySet<>(source.equivalence(), source.allocator());
    for (T e : source) {
      if (predicate.test(e)) {
        Result<Boolean> added = result.add(e);
        if (added instanceof Result.Failure<Boolean> f) {
          result.clear();
          return f.cast();
        }
      }
    }
    return Result.success(result);
  }

  /**
   * Compute the union of two sets: every element of <code>a</code> in its order,
   * followed by the elements of <code>b</code> that are not in <code>a</code>, in
   * <code>b</code>'s order.
   */
  public static <T> Result<ArraySet<T>> union(ArraySet<T> a, ArraySet<T> b) {
    Result<ArraySet<T>> copy = ArraySet.copyOf(a);
    if (copy instanceof Result.Failure<ArraySet<T>> f) {
      return f;
    }
    ArraySet<T> result = copy.orElseThrow();
    for (T e : b) {
      Result<Boolean> added = result.add(e);
      if (added instanceof Result.Failure<Boolean> f) {
        result.clear();
        return f.cast();
      }
    }
    return Result.success(result);
  }

  /**
   * Compute the intersection of two sets: the elements of <code>a</code> that are
   * also contained in <code>b</code>, in <code>a</code>'s order.
   */
  public static <T> Result<ArraySet<T>> intersection(ArraySet<T> a, ArraySet<T> b) {
    return filter(a, b::contains);
  }

  /**
   * Write the {@link ArraySet#toString() textual form} of a set to a file,
   * reporting problems on standard error.
   *
   * @see #save(ArraySet, Path, Consumer)
   */
  public static void save(ArraySet<String> set, Path destination) {
    save(set, destination, System.err::println);
  }

  /**
   * Write the {@link ArraySet#toString() textual form} of a set to a file in UTF-8.
   * An existing file is replaced.
   *
   * <p>This method never throws on I/O problems.  If the file cannot be opened
   * nothing is written and a message goes to <code>diagnostics</code>; a failure
   * while writing is reported the same way.
   *
   * @param set the set to save
   * @param destination the file to write
   * @param diagnostics receives a message for each failure
   */
  public static void save(ArraySet<String> set, Path destination, Consumer<String> diagnostics) {
    Writer out;
    try {
      out = Files.newBufferedWriter(destination, StandardCharsets.UTF_8);
    } catch (IOException e) {
      diagnostics.accept("Failed to open file: " + destination + " (" + e + ')');
      return;
    }

    try (out) {
      out.write(set.toString());
    } catch (IOException e) {
      diagnostics.accept("Failed to write file: " + destination + " (" + e + ')');
    }
  }

}
