package skein;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class SourceFile {
  public abstract String fileName();

  public abstract String source();

  public static SourceFile create(String fileName, String source) {
    return new AutoValue_SourceFile(fileName, source);
  }
}
