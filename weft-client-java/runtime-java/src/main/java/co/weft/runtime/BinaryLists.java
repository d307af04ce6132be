package co.weft.runtime;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Content-based {@code equals}, {@code hashCode} and {@code toString} for lists of
 * {@code byte[]}, the counterpart of {@link Arrays} for list-of-Bytes fields.
 */
public final class BinaryLists {

  private BinaryLists() {}

  public static boolean equals(List<byte[]> a, List<byte[]> b) {
    if (a == b) return true;
    if (a == null || b == null || a.size() != b.size()) return false;
    Iterator<byte[]> left = a.iterator();
    Iterator<byte[]> right = b.iterator();
    while (left.hasNext()) {
      if (!Arrays.equals(left.next(), right.next())) return false;
    }
    return true;
  }

  public static int hashCode(List<byte[]> values) {
    if (values == null) return 0;
    int hash = 1;
    for (byte[] value : values) {
      hash = 31 * hash + Arrays.hashCode(value);
    }
    return hash;
  }

  public static String toString(List<byte[]> values) {
    if (values == null) return "null";
    StringBuilder sb = new StringBuilder("[");
    for (byte[] value : values) {
      if (sb.length() > 1) sb.append(", ");
      sb.append(Arrays.toString(value));
    }
    return sb.append(']').toString();
  }
}
