package com.nayem.leasehold.core;

import java.util.Map;

/**
 * Builds the property bag sent with an abandon or dead-letter call.
 * <p>
 * The failure's exception type is recorded under {@link #EXCEPTIONS_KEY}. When
 * the message already carries that property from an earlier delivery, the new
 * type is appended after a {@code ':'}, so the value reads as the history of
 * failures across redeliveries, e.g. {@code "TimeoutException:IOException"}.
 * </p>
 */
public final class ExceptionTags {

    public static final String EXCEPTIONS_KEY = "Exceptions";

    static final char SEPARATOR = ':';

    private ExceptionTags() {
    }

    /**
     * @param userProperties incoming properties of the message
     * @param error          the processing failure, may be null
     * @return properties to send to the broker; empty when {@code error} is null
     */
    public static Map<String, Object> propertiesFor(Map<String, Object> userProperties, Throwable error) {
        if (error == null) {
            return Map.of();
        }

        String tag = typeName(error);
        Object previous = userProperties != null ? userProperties.get(EXCEPTIONS_KEY) : null;
        if (previous != null) {
            tag = previous.toString() + SEPARATOR + tag;
        }
        return Map.of(EXCEPTIONS_KEY, tag);
    }

    // anonymous and some synthetic classes have an empty simple name
    static String typeName(Throwable error) {
        String simpleName = error.getClass().getSimpleName();
        return simpleName.isEmpty() ? error.getClass().getName() : simpleName;
    }
}
