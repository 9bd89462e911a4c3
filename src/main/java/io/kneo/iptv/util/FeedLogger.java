package io.kneo.iptv.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class FeedLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeedLogger.class);
    private static final String FEED_KEY = "feed";
    private static final String ACTION_KEY = "action";

    private FeedLogger() {
    }

    public static void logActivity(String feed, String action, String message, Object... args) {
        try {
            MDC.put(FEED_KEY, feed);
            MDC.put(ACTION_KEY, action);
            LOGGER.info("FEED_ACTIVITY - {} - {} - {}", feed, action, String.format(message, args));
        } finally {
            MDC.remove(FEED_KEY);
            MDC.remove(ACTION_KEY);
        }
    }

    public static void logFailure(String feed, String action, Throwable failure, String message, Object... args) {
        try {
            MDC.put(FEED_KEY, feed);
            MDC.put(ACTION_KEY, action);
            LOGGER.warn("FEED_FAILURE - {} - {} - {}: {}", feed, action, String.format(message, args), failure.getMessage());
            LOGGER.debug("Failure detail for feed {}", feed, failure);
        } finally {
            MDC.remove(FEED_KEY);
            MDC.remove(ACTION_KEY);
        }
    }
}
