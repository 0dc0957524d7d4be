package ratemeter;

import java.util.*;

import org.slf4j.*;

/**
 * LogHelper
 *
 * <p>joins its arguments with spaces into a single slf4j message
 */
public class LogHelper {
  private final Logger logger;

  public LogHelper(Object classOrInstance) {
    Class<?> classOfT = classOrInstance.getClass();
    if (classOrInstance instanceof Class)
      classOfT = (Class<?>) classOrInstance;
    logger = LoggerFactory.getLogger(classOfT);
  }

  public void log(Object... args) {
    if (logger.isInfoEnabled())
      logger.info(join(args));
  }

  /**
   * debug
   *
   * <p>args are not rendered unless debug is enabled for the owning class
   */
  public void debug(Object... args) {
    if (logger.isDebugEnabled())
      logger.debug(join(args));
  }

  private static String join(Object... args) {
    List<String> parts = new ArrayList<>();
    for (Object arg : args)
      parts.add("" + arg);
    return String.join(" ", parts);
  }

}
