package pretty;

public class ConfigException extends RuntimeException {
  public final Object causingValue;

  public ConfigException(String msg, Object causingValue) {
    this(msg, causingValue, null);
  }

  public ConfigException(String msg, Object causingValue, Throwable cause) {
    super(msg, cause, false, false);
    this.causingValue = causingValue;
  }
}
