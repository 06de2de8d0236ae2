package xcsp2cpo.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import xcsp2cpo.core.MalformedInstanceException;

final class DomainTest {

  @Test
  void contiguousRangeReportsBounds() {
    Domain domain = Domain.range(3, 8);

    assertTrue(domain.isRange(), "A single interval is a range");
    assertEquals(3, domain.min(), "Lower bound");
    assertEquals(8, domain.max(), "Upper bound");
    assertEquals(6L, domain.size(), "3..8 holds six values");
    assertEquals("3..8", domain.toString(), "Range rendering");
  }

  @Test
  void valuesMergeIntoCanonicalIntervals() {
    Domain domain = Domain.values(7, 1, 2, 3, 2);

    assertFalse(domain.isRange(), "1..3 and 7 are two intervals");
    assertEquals(List.of(1, 2, 3, 7), domain.values(), "Values are sorted and deduplicated");
    assertEquals("1..3 7", domain.toString(), "Interval rendering");
    assertEquals(Domain.values(List.of(1, 2, 3, 7)), domain, "Equality is by content");
  }

  @Test
  void adjacentValuesFormOneRange() {
    assertTrue(Domain.values(4, 5, 6).isRange(), "Consecutive values collapse into a range");
    assertEquals(Domain.range(4, 6), Domain.values(4, 5, 6), "Same set as 4..6");
  }

  @Test
  void emptyDomainsAreMalformed() {
    assertThrows(MalformedInstanceException.class, () -> Domain.range(5, 1), "Inverted range");
    assertThrows(
        MalformedInstanceException.class, () -> Domain.values(new int[0]), "No values at all");
  }

  @Test
  void membershipFollowsIntervals() {
    Domain domain = Domain.values(-2, 0, 1);

    assertTrue(domain.contains(-2), "Negative member");
    assertFalse(domain.contains(-1), "Gap between intervals");
    assertEquals(-2, domain.min(), "Negative lower bound");
    assertEquals(1, domain.max(), "Upper bound of the last interval");
  }

  @Test
  void boundsReachIntegerExtremes() {
    Domain upper = Domain.range(0, Integer.MAX_VALUE);
    Domain both = Domain.values(Integer.MIN_VALUE, Integer.MAX_VALUE);

    assertEquals(Integer.MAX_VALUE, upper.max(), "Range closed at MAX_VALUE");
    assertEquals(0, upper.min(), "Lower bound unaffected");
    assertEquals(Integer.MIN_VALUE, both.min(), "Singleton at MIN_VALUE");
    assertEquals(Integer.MAX_VALUE, both.max(), "Singleton at MAX_VALUE");
  }
}
