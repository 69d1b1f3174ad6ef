package com.navblocks.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class Utils {
    private static final Logger LOG = LoggerFactory.getLogger("com.navblocks.network");

    static boolean isEmpty(String string) {
        return string == null || string.isEmpty();
    }

    static boolean notEmpty(String string) {
        return !isEmpty(string);
    }

    static void info(String pattern, Object... args) {
        if (LOG.isInfoEnabled())
            LOG.info(String.format(pattern, args));
    }

    static void info(Throwable error, String pattern, Object... args) {
        if (LOG.isInfoEnabled())
            LOG.info(String.format(pattern, args), error);
    }

    static void debug(String pattern, Object... args) {
        if (LOG.isDebugEnabled())
            LOG.debug(String.format(pattern, args));
    }
}
