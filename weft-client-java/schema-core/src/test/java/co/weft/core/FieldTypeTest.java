package co.weft.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

public class FieldTypeTest {

  @ParameterizedTest
  @ValueSource(strings = {
    "Void", "Boolean", "Int32", "UInt32", "Int64", "UInt64",
    "Float32", "Float64", "String", "Bytes", "Timestamp", "List"
  })
  void acceptsBuiltInNames(String name) {
    assertThat(FieldType.isValid(name)).isTrue();
    assertThat(FieldType.fromName(name).schemaName()).isEqualTo(name);
  }

  @ParameterizedTest
  @ValueSource(strings = {"string", "int32", "Integer", "Map", "Point", "ns.Point", ""})
  void rejectsOtherNames(String name) {
    assertThat(FieldType.isValid(name)).isFalse();
  }

  @Test
  void rejectsNull() {
    assertThat(FieldType.isValid(null)).isFalse();
    assertThatThrownBy(() -> FieldType.fromName(null))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void classifiesNumericKinds() {
    assertThat(FieldType.INT32.isNumeric()).isTrue();
    assertThat(FieldType.UINT64.isIntegral()).isTrue();
    assertThat(FieldType.FLOAT32.isNumeric()).isTrue();
    assertThat(FieldType.FLOAT32.isIntegral()).isFalse();
    assertThat(FieldType.STRING.isNumeric()).isFalse();
    assertThat(FieldType.LIST.isIntegral()).isFalse();
  }
}
