// com/owldsl/util/URIUtils.java
package com.owldsl.util;

/**
 * Utility class for IRI handling
 */
public class URIUtils {

    private URIUtils() {
    }

    /**
     * Check whether a configuration key is already an absolute IRI
     */
    public static boolean isAbsolute(String reference) {
        if (reference == null) return false;
        return reference.contains("://") || reference.startsWith("urn:");
    }

    /**
     * Expand a short role name against a namespace; absolute IRIs are returned as is
     */
    public static String resolve(String reference, String namespace) {
        if (reference == null || isAbsolute(reference) || namespace == null || namespace.isEmpty()) {
            return reference;
        }
        return namespace + reference;
    }

    /**
     * Extract namespace from full URI
     */
    public static String getNamespace(String fullURI) {
        if (fullURI == null) return "";

        int hashIndex = fullURI.lastIndexOf('#');
        int slashIndex = fullURI.lastIndexOf('/');

        int splitIndex = Math.max(hashIndex, slashIndex);
        return splitIndex > 0 ? fullURI.substring(0, splitIndex + 1) : fullURI;
    }

    /**
     * Extract local name from full URI
     */
    public static String getLocalName(String fullURI) {
        if (fullURI == null) return "";

        int hashIndex = fullURI.lastIndexOf('#');
        int slashIndex = fullURI.lastIndexOf('/');

        int splitIndex = Math.max(hashIndex, slashIndex);
        return splitIndex >= 0 && splitIndex < fullURI.length() - 1 ?
                fullURI.substring(splitIndex + 1) : fullURI;
    }
}
