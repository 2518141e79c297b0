package skein;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

final class StringTableManager {
  private final Map<String, StringInfo> stringTable;

  StringTableManager() {
    this.stringTable = new LinkedHashMap<>();
  }

  // Copies `other`, so a pass can work on its own table and merge back afterwards.
  StringTableManager(StringTableManager other) {
    this.stringTable = new LinkedHashMap<>(other.stringTable);
  }

  boolean containsKey(String lineId) {
    return stringTable.containsKey(lineId);
  }

  int size() {
    return stringTable.size();
  }

  void register(String lineId, StringInfo info) {
    stringTable.put(lineId, info);
  }

  void extend(StringTableManager other) {
    stringTable.putAll(other.stringTable);
  }

  ImmutableMap<String, StringInfo> build() {
    return ImmutableMap.copyOf(stringTable);
  }
}
