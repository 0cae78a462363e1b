package cal.prim.collect;

import com.google.common.base.Equivalence;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Test
public class ArraySetTests {

  private static final Equivalence<Person> SAME_NAME = Equivalence.equals().onResultOf(Person::name);

  private static ArraySet<Integer> ints(Integer... values) {
    return ArraySet.<Integer>of(Equivalence.equals(), Arrays.asList(values)).orElseThrow();
  }

  private static ArraySet<String> strings(String... values) {
    return ArraySet.<String>of(Equivalence.equals(), Arrays.asList(values)).orElseThrow();
  }

  private static <T> List<T> toList(ArraySet<T> set) {
    List<T> result = new ArrayList<>();
    set.forEach(result::add);
    return result;
  }

  /**
   * Check the occupancy bounds that every mutation must leave behind.
   */
  private static void checkOccupancy(ArraySet<?> set) {
    int capacity = set.capacity();
    Assert.assertTrue(capacity >= 0);
    Assert.assertTrue(set.size() <= capacity, set.size() + " > " + capacity);
    if (set.size() > 0) {
      Assert.assertTrue(set.size() > capacity / 4, "size " + set.size() + " too small for capacity " + capacity);
    }
  }

  @Test
  public void testNewSetIsEmptyAndUnallocated() {
    ArraySet<Integer> set = new ArraySet<>(Equivalence.equals());
    Assert.assertEquals(set.size(), 0);
    Assert.assertTrue(set.isEmpty());
    Assert.assertEquals(set.capacity(), 0);
    Assert.assertEquals(set.toString(), "0");
  }

  @Test
  public void testAddRejectsDuplicates() {
    ArraySet<Integer> set = new ArraySet<>(Equivalence.equals());
    Assert.assertEquals(set.add(1), Result.success(true));
    Assert.assertEquals(set.add(2), Result.success(true));
    Assert.assertEquals(set.add(3), Result.success(true));
    Assert.assertEquals(set.add(2), Result.success(false));
    Assert.assertEquals(set.size(), 3);
    Assert.assertEquals(set.toString(), "3 (1) (2) (3)");
  }

  @Test
  public void testAddReturnsFalseExactlyWhenContained() {
    ArraySet<Integer> set = new ArraySet<>(Equivalence.equals());
    int[] values = {5, 3, 5, 8, 3, 3, 1, 8, 13, 1};
    for (int v : values) {
      boolean present = set.contains(v);
      Assert.assertEquals(set.add(v).orElseThrow().booleanValue(), !present);
    }
    Assert.assertEquals(toList(set), List.of(5, 3, 8, 1, 13));
  }

  @Test(expectedExceptions = NullPointerException.class)
  public void testNullIsRejected() {
    new ArraySet<String>(Equivalence.equals()).add(null);
  }

  @Test
  public void testCustomEquivalence() {
    ArraySet<Person> set = new ArraySet<>(SAME_NAME);
    Assert.assertTrue(set.add(new Person("Alice", 30)).orElseThrow());
    Assert.assertFalse(set.add(new Person("Alice", 31)).orElseThrow());
    Assert.assertTrue(set.add(new Person("Bob", 30)).orElseThrow());
    Assert.assertTrue(set.contains(new Person("Bob", 99)));
    Assert.assertEquals(set.toString(), "2 (Name: Alice, Age: 30) (Name: Bob, Age: 30)");

    Assert.assertTrue(set.remove(new Person("Alice", 0)));
    Assert.assertEquals(set.toString(), "1 (Name: Bob, Age: 30)");
  }

  @Test
  public void testRemoveBackfillsFromTheEnd() {
    ArraySet<String> set = strings("a", "b", "c", "d");
    Assert.assertTrue(set.remove("b"));
    Assert.assertEquals(toList(set), List.of("a", "d", "c"));
    Assert.assertTrue(set.remove("a"));
    Assert.assertEquals(toList(set), List.of("c", "d"));
    Assert.assertTrue(set.remove("d"));
    Assert.assertEquals(toList(set), List.of("c"));
  }

  @Test
  public void testRemoveFirstOfTwo() {
    ArraySet<String> set = new ArraySet<>(Equivalence.equals());
    set.add("a");
    set.add("b");
    Assert.assertTrue(set.remove("a"));
    Assert.assertTrue(set.contains("b"));
    Assert.assertFalse(set.contains("a"));
    Assert.assertEquals(set.toString(), "1 (b)");
  }

  @Test
  public void testRemoveMissingLeavesSetAlone() {
    ArraySet<Integer> set = ints(1, 2, 3);
    Assert.assertFalse(set.remove(4));
    Assert.assertEquals(set.toString(), "3 (1) (2) (3)");
    Assert.assertEquals(set.capacity(), 4);
  }

  @Test
  public void testGet() {
    ArraySet<String> set = strings("x", "y");
    Assert.assertEquals(set.get(0).orElseThrow(), "x");
    Assert.assertEquals(set.get(1).orElseThrow(), "y");
  }

  @Test
  public void testGetOutOfRange() {
    ArraySet<String> empty = new ArraySet<>(Equivalence.equals());
    ArraySet<String> set = strings("x", "y");
    for (Result<String> r : List.of(set.get(2), set.get(-1), set.get(Integer.MIN_VALUE), empty.get(0), empty.get(-1))) {
      Assert.assertTrue(r instanceof Result.Failure<String> f && f.kind() == FailureKind.RANGE_VIOLATION, r.toString());
    }
  }

  @Test(expectedExceptions = IndexOutOfBoundsException.class)
  public void testGetOutOfRangeThrowsOnDemand() {
    strings("x").get(1).orElseThrow();
  }

  @Test
  public void testCapacityDoubles() {
    ArraySet<Integer> set = new ArraySet<>(Equivalence.equals());
    List<Integer> capacities = new ArrayList<>();
    for (int i = 0; i < 9; ++i) {
      set.add(i);
      capacities.add(set.capacity());
    }
    Assert.assertEquals(capacities, List.of(1, 2, 4, 4, 8, 8, 8, 8, 16));
  }

  @Test
  public void testRemovingLastElementReleasesStorage() {
    ArraySet<Integer> set = ints(7);
    Assert.assertEquals(set.capacity(), 1);
    Assert.assertTrue(set.remove(7));
    Assert.assertEquals(set.capacity(), 0);
    Assert.assertTrue(set.isEmpty());
  }

  @Test
  public void testShrinkWhileDraining() {
    List<Integer> input = IntStream.range(0, 1000).boxed().collect(Collectors.toList());
    ArraySet<Integer> set = ArraySet.<Integer>of(Equivalence.equals(), input).orElseThrow();
    Assert.assertEquals(set.size(), 1000);
    Assert.assertEquals(set.capacity(), 1024);

    int previousCapacity = set.capacity();
    for (int i = 0; i < 990; ++i) {
      Assert.assertTrue(set.remove(i));
      checkOccupancy(set);
      Assert.assertTrue(set.capacity() == previousCapacity || set.capacity() == previousCapacity / 2);
      previousCapacity = set.capacity();
    }

    Assert.assertEquals(set.size(), 10);
    Assert.assertEquals(set.capacity(), 32);
    for (int i = 990; i < 1000; ++i) {
      Assert.assertTrue(set.contains(i));
    }
  }

  @Test
  public void testOccupancyUnderMixedOperations() {
    ArraySet<Integer> set = new ArraySet<>(Equivalence.equals());
    Random random = new Random(33);
    for (int step = 0; step < 5000; ++step) {
      int value = random.nextInt(200);
      if (random.nextInt(3) == 0) {
        set.add(value);
      } else {
        set.remove(value);
      }
      checkOccupancy(set);
    }
  }

  @Test
  public void testCopyIsDeepAndKeepsCapacity() {
    ArraySet<Integer> original = ints(1, 2, 3);
    ArraySet<Integer> copy = ArraySet.copyOf(original).orElseThrow();
    Assert.assertEquals(copy.size(), 3);
    Assert.assertEquals(copy.capacity(), 4);
    Assert.assertTrue(copy.equals(original));

    copy.add(4);
    original.remove(1);
    Assert.assertEquals(copy.toString(), "4 (1) (2) (3) (4)");
    Assert.assertEquals(original.toString(), "2 (3) (2)");
  }

  @Test
  public void testCopyOfEmptySet() {
    ArraySet<Integer> copy = ArraySet.copyOf(new ArraySet<Integer>(Equivalence.equals())).orElseThrow();
    Assert.assertTrue(copy.isEmpty());
    Assert.assertEquals(copy.capacity(), 0);
  }

  @Test
  public void testAssign() {
    ArraySet<Integer> a = ints(4, 5);
    ArraySet<Integer> b = ints(7, 8, 9);
    Assert.assertTrue(a.assign(b).isSuccess());
    Assert.assertEquals(a.toString(), "3 (7) (8) (9)");
    Assert.assertEquals(a.capacity(), 4);

    // independent afterwards
    a.add(10);
    Assert.assertEquals(b.size(), 3);
  }

  @Test
  public void testAssignToSelf() {
    ArraySet<Integer> a = ints(4, 5);
    Assert.assertTrue(a.assign(a).isSuccess());
    Assert.assertEquals(a.toString(), "2 (4) (5)");
  }

  @Test
  public void testSwap() {
    ArraySet<Integer> a = ints(1, 2, 3);
    ArraySet<Integer> b = ints(9);
    a.swap(b);
    Assert.assertEquals(a.toString(), "1 (9)");
    Assert.assertEquals(a.capacity(), 1);
    Assert.assertEquals(b.toString(), "3 (1) (2) (3)");
    Assert.assertEquals(b.capacity(), 4);
  }

  @Test
  public void testClear() {
    ArraySet<Integer> set = ints(1, 2, 3);
    set.clear();
    Assert.assertTrue(set.isEmpty());
    Assert.assertEquals(set.capacity(), 0);
    Assert.assertEquals(set.toString(), "0");

    // usable again, like a fresh set
    Assert.assertTrue(set.add(3).orElseThrow());
    Assert.assertEquals(set.capacity(), 1);
  }

  @Test
  public void testEqualityIgnoresOrder() {
    ArraySet<String> a = strings("a", "b", "c");
    ArraySet<String> b = strings("c", "a", "b");
    // not assertEquals: TestNG compares Iterables in order
    Assert.assertTrue(a.equals(b));
    Assert.assertTrue(b.equals(a));
    Assert.assertEquals(a.hashCode(), b.hashCode());

    Assert.assertFalse(a.equals(strings("a", "b")));
    Assert.assertFalse(a.equals(strings("a", "b", "d")));
    Assert.assertFalse(a.equals("3 (a) (b) (c)"));
    Assert.assertFalse(a.equals(null));
  }

  @Test
  public void testEqualityUsesEquivalence() {
    ArraySet<Person> a = new ArraySet<>(SAME_NAME);
    a.add(new Person("Alice", 1));
    a.add(new Person("Bob", 2));
    ArraySet<Person> b = new ArraySet<>(SAME_NAME);
    b.add(new Person("Bob", 20));
    b.add(new Person("Alice", 10));
    Assert.assertTrue(a.equals(b));
  }

  @Test
  public void testNotEqualToSetOfAnotherType() {
    ArraySet<Person> people = new ArraySet<>(SAME_NAME);
    people.add(new Person("Ann", 1));
    Object names = strings("Ann");
    Assert.assertFalse(people.equals(names));
    Assert.assertFalse(names.equals(people));
  }

  @Test
  public void testRangeConstructionDropsDuplicates() {
    ArraySet<String> set = strings("b", "a", "b", "c", "a");
    Assert.assertEquals(set.toString(), "3 (b) (a) (c)");
  }

}
