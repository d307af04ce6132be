package co.weft.runtime;

/** Reserved entry names. */
final class WireFormat {

  /** Entry carrying the tag of a tagged-family member or union variant. */
  static final String TAG = ".tag";

  private WireFormat() {}
}
