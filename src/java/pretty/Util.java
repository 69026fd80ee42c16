package pretty;

import java.util.Arrays;

public class Util {
  /**
   * String of {@code cols} spaces; negative counts give an empty string.
   */
  public static String spaces(int cols) {
    if (cols <= 0) {
      return "";
    }
    char[] chars = new char[cols];
    Arrays.fill(chars, ' ');
    return String.valueOf(chars);
  }
}
