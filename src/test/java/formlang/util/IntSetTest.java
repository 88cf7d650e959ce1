package formlang.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.Test;

public class IntSetTest {

  @Test
  public void testCanonicalForm() {
    final IntSet set = IntSet.of(3, 1, 2, 3);
    assertEquals(IntSet.of(List.of(1, 2, 3)), set);
    assertEquals(IntSet.of(1, 2, 3).hashCode(), set.hashCode());
    assertEquals(3, set.size());
    assertEquals("{1,2,3}", set.toString());
    assertEquals(Set.of(1, 2, 3), set.toSet());
  }

  @Test
  public void testMembership() {
    final IntSet set = IntSet.of(2, 4, 8);
    assertTrue(set.contains(4));
    assertFalse(set.contains(5));
    assertTrue(set.intersects(Set.of(7, 8)));
    assertFalse(set.intersects(Set.of(1, 3)));
    assertTrue(IntSet.EMPTY.isEmpty());
    assertFalse(IntSet.EMPTY.intersects(Set.of(1)));
  }

  @Test
  public void testOrdering() {
    assertThat(IntSet.of(1, 2).compareTo(IntSet.of(1, 3)), lessThan(0));
    assertThat(IntSet.of(2).compareTo(IntSet.of(1, 5)), greaterThan(0));
    assertEquals(0, IntSet.of(4, 1).compareTo(IntSet.of(1, 4)));
  }
}
