package xcsp2cpo.core.model;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import xcsp2cpo.core.MalformedInstanceException;

/**
 * Non-empty finite set of integers, stored as canonical closed intervals.
 *
 * <p>A domain is either a single range {@code lo..hi} or a union of ranges and values such as
 * {@code 1..3 7 9..10}.
 */
public final class Domain {
  private final ImmutableRangeSet<Integer> ranges;

  private Domain(ImmutableRangeSet<Integer> ranges) {
    if (ranges.isEmpty()) {
      throw new MalformedInstanceException("Domain must not be empty");
    }
    this.ranges = ranges;
  }

  public static Domain range(int lo, int hi) {
    if (lo > hi) {
      throw new MalformedInstanceException("Domain range " + lo + ".." + hi + " is empty");
    }
    return new Domain(
        ImmutableRangeSet.of(Range.closed(lo, hi).canonical(DiscreteDomain.integers())));
  }

  public static Domain values(int... values) {
    Objects.requireNonNull(values, "values");
    RangeSet<Integer> set = TreeRangeSet.create();
    for (int value : values) {
      set.add(Range.singleton(value).canonical(DiscreteDomain.integers()));
    }
    return new Domain(ImmutableRangeSet.copyOf(set));
  }

  public static Domain values(List<Integer> values) {
    Objects.requireNonNull(values, "values");
    return values(values.stream().mapToInt(Integer::intValue).toArray());
  }

  /** Union of closed ranges; each range must have {@code lo <= hi}. */
  public static Domain of(List<Range<Integer>> closedRanges) {
    Objects.requireNonNull(closedRanges, "closedRanges");
    RangeSet<Integer> set = TreeRangeSet.create();
    for (Range<Integer> range : closedRanges) {
      set.add(range.canonical(DiscreteDomain.integers()));
    }
    return new Domain(ImmutableRangeSet.copyOf(set));
  }

  /** True for a single contiguous interval. */
  public boolean isRange() {
    return ranges.asRanges().size() == 1;
  }

  public int min() {
    return bounds().first();
  }

  /** Largest value; canonical ranges ending at {@link Integer#MAX_VALUE} have no upper bound. */
  public int max() {
    return bounds().last();
  }

  private ContiguousSet<Integer> bounds() {
    return ContiguousSet.create(ranges.span(), DiscreteDomain.integers());
  }

  public boolean contains(int value) {
    return ranges.contains(value);
  }

  public long size() {
    long size = 0;
    for (Range<Integer> range : ranges.asRanges()) {
      size += ContiguousSet.create(range, DiscreteDomain.integers()).size();
    }
    return size;
  }

  /** Values in ascending order. */
  public List<Integer> values() {
    List<Integer> values = new ArrayList<>();
    for (Range<Integer> range : ranges.asRanges()) {
      values.addAll(ContiguousSet.create(range, DiscreteDomain.integers()));
    }
    return values;
  }

  /** Closed intervals {@code [lo, hi]} in ascending order. */
  public List<int[]> intervals() {
    List<int[]> intervals = new ArrayList<>();
    for (Range<Integer> range : ranges.asRanges()) {
      ContiguousSet<Integer> set = ContiguousSet.create(range, DiscreteDomain.integers());
      intervals.add(new int[] {set.first(), set.last()});
    }
    return intervals;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Domain other)) {
      return false;
    }
    return ranges.equals(other.ranges);
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }

  @Override
  public String toString() {
    return intervals().stream()
        .map(iv -> iv[0] == iv[1] ? Integer.toString(iv[0]) : iv[0] + ".." + iv[1])
        .collect(Collectors.joining(" "));
  }
}
