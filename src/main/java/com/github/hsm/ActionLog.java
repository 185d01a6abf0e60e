package com.github.hsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Ordered, drainable buffer of human-readable trace lines produced by one machine level. This is
 * the only way callers learn what scripts did. Every line is mirrored to the application log as
 * it is recorded; lines absorbed from a sub-machine were already mirrored by it and are only
 * buffered.
 */
public final class ActionLog {
  private static final Logger logger = LogManager.getLogger(ActionLog.class.getSimpleName());

  private final String machineId;
  private final String prefix;
  private final int maxLines;
  // bounded, yes it drops the oldest lines when nobody drains
  private final Deque<String> lines = new ArrayDeque<>();
  private long droppedLines;

  ActionLog(final String machineId, final String prefix, final int maxLines) {
    this.machineId = machineId;
    this.prefix = prefix == null ? "" : prefix;
    this.maxLines = maxLines;
  }

  /**
   * Record a line for this level; the level prefix is prepended.
   */
  public void log(final String message) {
    final String line = prefix + message;
    append(line);
    if (logger.isInfoEnabled()) {
      logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(line)
          .toString());
    }
  }

  /**
   * Append lines drained from a sub-machine, verbatim and in order.
   */
  public void absorb(final List<String> childLines) {
    for (final String line : childLines) {
      append(line);
    }
  }

  /**
   * Return every buffered line and empty the buffer.
   */
  public List<String> drain() {
    final List<String> drained = new ArrayList<>(lines);
    lines.clear();
    return drained;
  }

  public int size() {
    return lines.size();
  }

  long getDroppedLines() {
    return droppedLines;
  }

  private void append(final String line) {
    lines.addLast(line);
    while (lines.size() > maxLines) {
      lines.removeFirst();
      droppedLines++;
      if (droppedLines == 1 || droppedLines % maxLines == 0) {
        logger.warn(new StringBuilder().append("[m:").append(machineId)
            .append("] Action log is full, dropped ").append(droppedLines)
            .append(" undrained line(s) so far").toString());
      }
    }
  }
}
