package co.weft.core.types;

import java.util.Collections;
import java.util.List;

/**
 * The resolved, read-only type model of one schema document.
 */
public final class Api {
  private final List<Namespace> namespaces;

  Api(List<Namespace> namespaces) {
    this.namespaces = Collections.unmodifiableList(namespaces);
  }

  public List<Namespace> namespaces() {
    return namespaces;
  }

  /** Namespace by name, or {@code null}. */
  public Namespace namespace(String name) {
    for (Namespace ns : namespaces) {
      if (ns.name().equals(name)) return ns;
    }
    return null;
  }

  /** Total number of structs and unions across all namespaces. */
  public int typeCount() {
    int n = 0;
    for (Namespace ns : namespaces) n += ns.types().size();
    return n;
  }
}
