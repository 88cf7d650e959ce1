package formlang.util;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;
import java.util.stream.Collectors;

/**
 * Immutable set of integers.
 *
 * <p>Elements are kept sorted and distinct, so two sets with the same members
 * are equal (and hash the same) no matter the order in which the members were
 * collected. This makes them usable as canonical keys for composite states.
 */
public final class IntSet implements Comparable<IntSet> {

  public static final IntSet EMPTY = new IntSet(new int[0]);

  // Sorted and distinct elements
  private final int[] elements;

  private IntSet(int[] sortedDistinct) {
    this.elements = sortedDistinct;
  }

  public static IntSet of(int... elems) {
    return new IntSet(Arrays.stream(elems).sorted().distinct().toArray());
  }

  public static IntSet of(Collection<Integer> elems) {
    return new IntSet(new TreeSet<Integer>(elems).stream().mapToInt((Integer i) -> i.intValue()).toArray());
  }

  public IntStream stream() {
    return Arrays.stream(elements);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(int element) {
    return Arrays.binarySearch(elements, element) >= 0;
  }

  /**
   * Check whether at least one element of this set is in the other set.
   *
   * @param other set to test against
   * @return whether the intersection is non-empty
   */
  public boolean intersects(Set<Integer> other) {
    for (int element : elements) {
      if (other.contains(element)) {
        return true;
      }
    }
    return false;
  }

  public Set<Integer> toSet() {
    return stream().boxed().collect(Collectors.toCollection(TreeSet::new));
  }

  @Override
  public int compareTo(IntSet other) {
    return Arrays.compare(elements, other.elements);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof IntSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((IntSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(elements)
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
