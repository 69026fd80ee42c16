package pretty;

import clojure.lang.*;

import java.util.Map;

import static pretty.Keywords.*;

/**
 * Rendering options. Built from a map with keyword keys:
 * {@code {:width 80, :indent 2}}. Keys not listed here are ignored.
 */
public final class PrettyConfig {
  public static final IPersistentMap DEFAULT_OPTIONS = PersistentHashMap.create(WIDTH, 80L, INDENT, 2L);
  public static final PrettyConfig DEFAULTS = create(PersistentArrayMap.EMPTY);

  public static PrettyConfig create(IPersistentMap overrides) {
    IPersistentMap options = DEFAULT_OPTIONS;
    for (Object o : overrides) {
      Map.Entry entry = (Map.Entry) o;
      options = options.assoc(entry.getKey(), entry.getValue());
    }
    return new PrettyConfig(
        nonNegativeInt(options, WIDTH),
        nonNegativeInt(options, INDENT),
        options);
  }

  public static PrettyConfig parse(String edn) {
    Object value;
    try {
      value = EdnReader.readString(edn, PersistentArrayMap.EMPTY);
    } catch (RuntimeException e) {
      throw new ConfigException("Unreadable configuration: " + e.getMessage(), edn, e);
    }
    if (value == null) {
      return DEFAULTS;
    } else if (value instanceof IPersistentMap) {
      return create((IPersistentMap) value);
    } else {
      throw new ConfigException("Configuration must be a map", value);
    }
  }

  private static int nonNegativeInt(IPersistentMap options, Object key) {
    Object value = options.valAt(key);
    if (value instanceof Long || value instanceof Integer) {
      long n = ((Number) value).longValue();
      if (n >= 0 && n <= Integer.MAX_VALUE) {
        return (int) n;
      }
    }
    throw new ConfigException("Invalid " + key + ": " + RT.printString(value), value);
  }

  public final int width;
  public final int indent;
  public final IPersistentMap options;

  private PrettyConfig(int width, int indent, IPersistentMap options) {
    this.width = width;
    this.indent = indent;
    this.options = options;
  }

  public DocCore bracket(String open, DocCore x, String close) {
    return Docs.bracket(indent, open, x, close);
  }

  @Override
  public String toString() {
    return options.toString();
  }
}
