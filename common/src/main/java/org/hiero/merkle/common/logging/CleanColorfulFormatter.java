// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A compact single line {@link Formatter} for console output that colours the log level with ANSI escape codes.
 * <p>
 * Output looks like {@code 12:01:07.123 INFO  [MerkleTool#run] message}.
 */
public class CleanColorfulFormatter extends Formatter {
    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String BLUE = "\u001B[34m";
    private static final String GREY = "\u001B[90m";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    /**
     * Install this formatter on every console handler of the root logger.
     */
    public static void makeLoggingColorful() {
        final Logger rootLogger = Logger.getLogger("");
        final CleanColorfulFormatter formatter = new CleanColorfulFormatter();
        boolean installed = false;
        for (final Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setFormatter(formatter);
                installed = true;
            }
        }
        if (!installed) {
            final ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setFormatter(formatter);
            rootLogger.addHandler(consoleHandler);
        }
    }

    @Override
    public String format(final LogRecord record) {
        final StringBuilder sb = new StringBuilder();
        sb.append(GREY)
                .append(TIME_FORMAT.format(LocalTime.ofInstant(record.getInstant(), ZoneId.systemDefault())))
                .append(RESET)
                .append(' ')
                .append(colorFor(record.getLevel()))
                .append(String.format("%-7s", record.getLevel().getName()))
                .append(RESET)
                .append(" [")
                .append(source(record))
                .append("] ")
                .append(formatMessage(record))
                .append(System.lineSeparator());
        if (record.getThrown() != null) {
            final StringWriter stackTrace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(stackTrace));
            sb.append(RED).append(stackTrace).append(RESET);
        }
        return sb.toString();
    }

    private static String source(final LogRecord record) {
        if (record.getSourceClassName() == null) {
            return record.getLoggerName();
        }
        final String className = record.getSourceClassName();
        final String simpleName = className.substring(className.lastIndexOf('.') + 1);
        return record.getSourceMethodName() == null ? simpleName : simpleName + "#" + record.getSourceMethodName();
    }

    private static String colorFor(final Level level) {
        if (level.intValue() >= Level.SEVERE.intValue()) {
            return RED;
        } else if (level.intValue() >= Level.WARNING.intValue()) {
            return YELLOW;
        } else if (level.intValue() >= Level.INFO.intValue()) {
            return GREEN;
        }
        return BLUE;
    }
}
