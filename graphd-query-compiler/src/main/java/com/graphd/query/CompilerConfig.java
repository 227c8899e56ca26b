package com.graphd.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of the constraint compiler.
 *
 * <p>Values can be overridden with the environment variables
 * {@code GRAPHD_RESULT_PAGESIZE_DEFAULT} and
 * {@code GRAPHD_RESULT_PAGESIZE_MAX}. Unset, empty or malformed values
 * fall back to the defaults.</p>
 *
 * @param resultPageSizeDefault result page size if none is given
 * @param resultPageSizeMax upper bound on any result page size
 */
public record CompilerConfig(long resultPageSizeDefault,
        long resultPageSizeMax) {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CompilerConfig.class);

    /** Default result page size. */
    public static final long DEFAULT_RESULT_PAGE_SIZE = 1024L;

    /** Default maximum result page size. */
    public static final long DEFAULT_RESULT_PAGE_SIZE_MAX = 64L * 1024L;

    /** Environment variable for the default result page size. */
    static final String ENV_RESULT_PAGE_SIZE_DEFAULT =
        "GRAPHD_RESULT_PAGESIZE_DEFAULT";

    /** Environment variable for the maximum result page size. */
    static final String ENV_RESULT_PAGE_SIZE_MAX =
        "GRAPHD_RESULT_PAGESIZE_MAX";

    /**
     * Validates the page sizes.
     *
     * @param resultPageSizeDefault result page size if none is given
     * @param resultPageSizeMax upper bound on any result page size
     */
    public CompilerConfig {
        if (resultPageSizeDefault < 1 || resultPageSizeMax < 1) {
            throw new IllegalArgumentException(
                "result page sizes must be positive");
        }
    }

    /**
     * The built-in defaults.
     *
     * @return 1024 and 65536
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_RESULT_PAGE_SIZE,
            DEFAULT_RESULT_PAGE_SIZE_MAX);
    }

    /**
     * Read the configuration from the process environment.
     *
     * @return the configuration
     */
    public static CompilerConfig fromEnvironment() {
        return new CompilerConfig(
            getEnvOrDefault(ENV_RESULT_PAGE_SIZE_DEFAULT,
                DEFAULT_RESULT_PAGE_SIZE),
            getEnvOrDefault(ENV_RESULT_PAGE_SIZE_MAX,
                DEFAULT_RESULT_PAGE_SIZE_MAX));
    }

    /**
     * Parse a positive number, or fall back.
     *
     * @param name the setting's name, for the log
     * @param value null or the text
     * @param defaultValue value for unset, empty or malformed text
     * @return the value
     */
    static long parseOrDefault(final String name, final String value,
            final long defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            long n = Long.parseLong(value.trim());
            if (n > 0) {
                return n;
            }
            LOGGER.warn("{}={} is not positive; using {}", name, value,
                defaultValue);
        } catch (NumberFormatException e) {
            LOGGER.warn("{}={} is not a number; using {}", name, value,
                defaultValue);
        }
        return defaultValue;
    }

    private static long getEnvOrDefault(final String name,
            final long defaultValue) {
        return parseOrDefault(name, System.getenv(name), defaultValue);
    }
}
