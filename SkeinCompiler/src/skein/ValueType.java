package skein;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

public enum ValueType {
  NUMBER("Number"),
  STRING("String"),
  BOOLEAN("Bool");

  private final String typeName;

  ValueType(String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  private static final ImmutableMap<String, ValueType> NAME_MAP =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(t -> t.typeName, t -> t));

  public static Optional<ValueType> parse(String typeName) {
    return Optional.ofNullable(NAME_MAP.get(typeName));
  }

  @Override
  public String toString() {
    return typeName;
  }
}
