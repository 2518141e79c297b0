package skein;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class StringInfo {
  public abstract String text();

  public abstract String fileName();

  public abstract String nodeName();

  public abstract int lineNumber();

  public abstract boolean isImplicitTag();

  public abstract ImmutableList<String> tags();

  public static StringInfo create(
      String text,
      String fileName,
      String nodeName,
      int lineNumber,
      boolean isImplicitTag,
      List<String> tags) {
    return new AutoValue_StringInfo(
        text, fileName, nodeName, lineNumber, isImplicitTag, ImmutableList.copyOf(tags));
  }
}
