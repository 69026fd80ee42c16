package pretty;

/**
 * Verbosity of the engine's own logging: 0 is silent, 1 logs each
 * rendering, 2 also logs every layout decision.
 */
public class LogLevel {
  public static final int SUMMARY = 1;
  public static final int DECISIONS = 2;

  private static volatile int logLevel = 0;

  public static void setLogLevel(int level) {
    logLevel = level;
  }

  public static boolean isLogLevelEnabled(int level) {
    return logLevel >= level;
  }
}
