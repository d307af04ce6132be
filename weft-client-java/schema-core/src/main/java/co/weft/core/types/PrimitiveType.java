package co.weft.core.types;

/** Built-in types without parameters or constraints. */
public enum PrimitiveType implements ModeledType {
  VOID("Void"),
  BOOLEAN("Boolean"),
  BYTES("Bytes"),
  TIMESTAMP("Timestamp");

  private final String schemaName;

  PrimitiveType(String schemaName) {
    this.schemaName = schemaName;
  }

  @Override
  public String describe() {
    return schemaName;
  }
}
