package com.parsetree;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public final class Logging {
    public static final String ROOT_LOGGER = "com.parsetree";

    // Held so the configured logger is not collected and reset
    private static final Logger PROJECT_LOGGER = Logger.getLogger(ROOT_LOGGER);

    private Logging() {}

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tH:%1$tM:%1$tS.%1$tL %4$s %3$s] %5$s%6$s%n");
    }

    public static void enable(Level level, OutputStream os) {
        enable(level, new PrintWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8), true));
    }

    /**
     * Sends this project's log records at {@code level} and above to {@code out},
     * flushing after each record. Records are not passed on to the root
     * logger's handlers, and handlers from earlier calls are removed.
     */
    public static void enable(Level level, PrintWriter out) {
        initFormat();
        Logger logger = PROJECT_LOGGER;
        Handler handler = new WriterHandler(out);
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(level);
        for (Handler old : logger.getHandlers()) {
            logger.removeHandler(old);
        }
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
        logger.setLevel(level);
    }

    private static final class WriterHandler extends Handler {
        private final PrintWriter out;

        WriterHandler(PrintWriter out) {
            this.out = out;
        }

        @Override
        public synchronized void publish(LogRecord record) {
            if (!isLoggable(record)) {
                return;
            }
            out.print(getFormatter().format(record));
            out.flush();
        }

        @Override
        public synchronized void flush() {
            out.flush();
        }

        // The writer belongs to the caller
        @Override
        public void close() {
            flush();
        }
    }
}
