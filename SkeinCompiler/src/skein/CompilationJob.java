package skein;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class CompilationJob {

  public enum CompilationType {
    FULL_COMPILATION,
    // Callers only want the string table. The same passes still run.
    STRINGS_ONLY;
  }

  public abstract ImmutableList<SourceFile> files();

  public abstract Optional<Library> library();

  public abstract CompilationType compilationType();

  public abstract ImmutableList<Declaration> variableDeclarations();

  public static Builder builder() {
    return new AutoValue_CompilationJob.Builder()
        .setCompilationType(CompilationType.FULL_COMPILATION);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract ImmutableList.Builder<SourceFile> filesBuilder();

    public Builder addFile(SourceFile file) {
      filesBuilder().add(file);
      return this;
    }

    public Builder addFile(String fileName, String source) {
      return addFile(SourceFile.create(fileName, source));
    }

    public Builder addFiles(Iterable<SourceFile> files) {
      filesBuilder().addAll(files);
      return this;
    }

    public abstract Builder setLibrary(Library library);

    public abstract Builder setCompilationType(CompilationType compilationType);

    abstract ImmutableList.Builder<Declaration> variableDeclarationsBuilder();

    public Builder addVariableDeclaration(Declaration declaration) {
      variableDeclarationsBuilder().add(declaration);
      return this;
    }

    public abstract CompilationJob build();
  }
}
