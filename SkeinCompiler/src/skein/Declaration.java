package skein;

import java.util.Optional;
import java.util.OptionalInt;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class Declaration {

  public enum Origin {
    // <<declare>> in a source file, or supplied with the job.
    EXPLICIT,
    // Synthesized by the compiler.
    DERIVED;
  }

  public abstract String name();

  public abstract ValueType type();

  public abstract Value defaultValue();

  public abstract Optional<String> description();

  public abstract Optional<String> sourceFileName();

  public abstract Optional<String> sourceNodeName();

  public abstract OptionalInt sourceLine();

  public abstract Origin origin();

  public static Builder builder(String name, Value defaultValue) {
    return new AutoValue_Declaration.Builder()
        .setName(name)
        .setDefaultValue(defaultValue)
        .setType(defaultValue.type())
        .setOrigin(Origin.EXPLICIT);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setType(ValueType type);

    public abstract Builder setDefaultValue(Value defaultValue);

    public abstract Builder setDescription(String description);

    public abstract Builder setSourceFileName(String sourceFileName);

    public abstract Builder setSourceNodeName(String sourceNodeName);

    public abstract Builder setSourceLine(int sourceLine);

    public abstract Builder setOrigin(Origin origin);

    @ForOverride
    abstract Declaration autoBuild();

    public final Declaration build() {
      Declaration declaration = autoBuild();
      Preconditions.checkState(
          declaration.type() == declaration.defaultValue().type(),
          "%s is declared as %s but defaults to %s",
          declaration.name(),
          declaration.type(),
          declaration.defaultValue());
      return declaration;
    }
  }
}
