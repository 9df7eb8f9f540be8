package com.bastion.security.middleware;

import java.util.Map;
import java.util.TreeMap;

/**
 * Read access to the headers of an inbound request. Lookups are case-insensitive.
 */
@FunctionalInterface
public interface RequestHeaders {

    /** The first value of the named header, or null if absent. */
    String get(String name);

    static RequestHeaders of(Map<String, String> headers) {
        Map<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitive.putAll(headers);
        return caseInsensitive::get;
    }

    static RequestHeaders empty() {
        return name -> null;
    }
}
