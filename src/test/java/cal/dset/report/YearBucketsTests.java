package cal.dset.report;

import cal.dset.types.Row;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

@Test
public class YearBucketsTests {

  private static List<Row> dated(String... dates) {
    List<Row> result = new ArrayList<>();
    int i = 0;
    for (String d : dates) {
      result.add(Row.of("painting " + i++, d));
    }
    return result;
  }

  @Test
  public void testFindYear() {
    Assert.assertEquals(YearBuckets.findYear("1503"), OptionalInt.of(1503));
    Assert.assertEquals(YearBuckets.findYear("c. 1450-1460"), OptionalInt.of(1450));
    Assert.assertEquals(YearBuckets.findYear("about 100 AD"), OptionalInt.of(100));
    Assert.assertEquals(YearBuckets.findYear("2024"), OptionalInt.of(2024));
  }

  @Test
  public void testFindYearOutOfRange() {
    Assert.assertEquals(YearBuckets.findYear("99"), OptionalInt.empty());
    Assert.assertEquals(YearBuckets.findYear("2025"), OptionalInt.empty());
    Assert.assertEquals(YearBuckets.findYear("unknown"), OptionalInt.empty());
    Assert.assertEquals(YearBuckets.findYear(""), OptionalInt.empty());
    Assert.assertFalse(YearBuckets.containsYear("late 15th century"));
  }

  @Test
  public void testFindYearSkipsUnusableRuns() {
    // five digits is not a year; a later run still counts
    Assert.assertEquals(YearBuckets.findYear("inv. 12345, 1482"), OptionalInt.of(1482));
    Assert.assertEquals(YearBuckets.findYear("2999 or 1600"), OptionalInt.of(1600));
    Assert.assertTrue(YearBuckets.containsYear("1600"));
  }

  @Test
  public void testIntervalWidening() {
    Assert.assertEquals(YearBuckets.interval(1500, 1500, 1), 50);
    Assert.assertEquals(YearBuckets.interval(1400, 1849, 10), 50);
    Assert.assertEquals(YearBuckets.interval(1400, 1900, 10), 75);
    Assert.assertEquals(YearBuckets.interval(1400, 1900, 5), 112);
    Assert.assertEquals(YearBuckets.interval(1400, 1900, 3), 168);
  }

  @Test
  public void testBuckets() {
    List<String> diagnostics = new ArrayList<>();
    YearBuckets.Histogram h = YearBuckets.compute(
            dated("1400", "c. 1410", "1480", "1900", "undated"), 1, 10, diagnostics::add);
    Assert.assertEquals(h.interval(), 75);
    Assert.assertEquals(h.buckets(), List.of(
            new YearBuckets.Bucket(1400, 1474, 2),
            new YearBuckets.Bucket(1475, 1549, 1),
            new YearBuckets.Bucket(1850, 1924, 1)));
    Assert.assertEquals(diagnostics, List.of("No valid year in record: painting 4, undated"));
  }

  @Test
  public void testBucketsInNumericOrder() {
    YearBuckets.Histogram h = YearBuckets.compute(dated("1010", "950"), 1, 10, d -> { });
    Assert.assertEquals(h.buckets().get(0).toString(), "950-999: 1");
    Assert.assertEquals(h.buckets().get(1).toString(), "1000-1049: 1");
  }

  @Test
  public void testNoYears() {
    List<String> diagnostics = new ArrayList<>();
    YearBuckets.Histogram h = YearBuckets.compute(dated("?", "n.d."), 1, 10, diagnostics::add);
    Assert.assertEquals(h.buckets(), List.of());
    Assert.assertEquals(diagnostics.size(), 2);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testMaxBucketsMustBePositive() {
    YearBuckets.compute(dated("1500"), 1, 0, d -> { });
  }

}
