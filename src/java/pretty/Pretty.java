package pretty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Pretty {
  private static final Logger LOG = LoggerFactory.getLogger(Pretty.class);

  private Pretty() {
  }

  /**
   * Renders {@code doc} choosing line breaks so that lines stay within
   * {@code width} columns where possible. Lines holding a single text
   * longer than the width are the only ones that may exceed it.
   */
  public static String pretty(int width, DocCore doc) {
    String output = layout(Resolver.best(width, 0, doc));
    if (LogLevel.isLogLevelEnabled(LogLevel.SUMMARY)) {
      LOG.debug("Rendered {} chars at width {}", output.length(), width);
    }
    return output;
  }

  public static String pretty(PrettyConfig config, DocCore doc) {
    return pretty(config.width, doc);
  }

  public static String layout(Layout layout) {
    StringBuilder sb = new StringBuilder();
    for (; layout != Layout.NIL; layout = layout.rest()) {
      layout.print(sb);
    }
    return sb.toString();
  }
}
