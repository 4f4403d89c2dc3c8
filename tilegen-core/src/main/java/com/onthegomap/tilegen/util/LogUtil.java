package com.onthegomap.tilegen.util;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;

/**
 * Tags log lines from the current thread with the stage it is working on, like {@code [render:render-2]}, through the
 * SLF4J {@link MDC}. The log4j2 pattern prints it with {@code %X{stage}}.
 */
public final class LogUtil {

  private static final String PREFIX_KEY = "stage";
  private static final String NAME_KEY = "stage_name";

  private LogUtil() {}

  public static void setStage(String stage) {
    MDC.put(NAME_KEY, stage);
    MDC.put(PREFIX_KEY, "[" + stage + "] ");
  }

  /** Sets the stage to {@code parent:child}, dropping a leading {@code parent_} from {@code child}. */
  public static void setStage(String parent, String child) {
    if (parent == null) {
      setStage(child);
    } else {
      setStage(parent + ":" + StringUtils.removeStart(child, parent + "_"));
    }
  }

  public static void clearStage() {
    MDC.remove(NAME_KEY);
    MDC.remove(PREFIX_KEY);
  }

  /** Returns the stage for this thread, or {@code null} outside of any stage. */
  public static String getStage() {
    return MDC.get(NAME_KEY);
  }
}
