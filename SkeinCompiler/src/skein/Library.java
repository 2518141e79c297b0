package skein;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class Library {

  public static final String VISITED = "visited";
  public static final String VISITED_COUNT = "visited_count";

  private static final String VISIT_TRACKING_PREFIX = "$Skein.Internal.Visiting.";

  @AutoValue
  public abstract static class Function {
    public abstract String name();

    public abstract ImmutableList<ValueType> parameterTypes();

    public abstract ValueType returnType();

    public abstract boolean tracksVisits();

    public static Function create(
        String name, List<ValueType> parameterTypes, ValueType returnType) {
      return new AutoValue_Library_Function(
          name, ImmutableList.copyOf(parameterTypes), returnType, false);
    }

    public static Function visitTracking(String name, ValueType returnType) {
      return new AutoValue_Library_Function(
          name, ImmutableList.of(ValueType.STRING), returnType, true);
    }
  }

  private static final Library STANDARD =
      builder()
          .addFunction(Function.visitTracking(VISITED, ValueType.BOOLEAN))
          .addFunction(Function.visitTracking(VISITED_COUNT, ValueType.NUMBER))
          .build();

  public static Library standard() {
    return STANDARD;
  }

  public abstract ImmutableMap<String, Function> functions();

  public Optional<Function> function(String name) {
    return Optional.ofNullable(functions().get(name));
  }

  public boolean tracksVisits(String functionName) {
    return function(functionName).map(Function::tracksVisits).orElse(false);
  }

  // On a name clash, other's function wins.
  public Library union(Library other) {
    Builder builder = builder();
    functions()
        .values()
        .stream()
        .filter(f -> !other.functions().containsKey(f.name()))
        .forEach(builder::addFunction);
    other.functions().values().forEach(builder::addFunction);
    return builder.build();
  }

  public static String generateUniqueVisitedVariableForNode(String nodeName) {
    return VISIT_TRACKING_PREFIX + nodeName;
  }

  public static Builder builder() {
    return new AutoValue_Library.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract ImmutableMap.Builder<String, Function> functionsBuilder();

    public Builder addFunction(Function function) {
      functionsBuilder().put(function.name(), function);
      return this;
    }

    public abstract Library build();
  }
}
