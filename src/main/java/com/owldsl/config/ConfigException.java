// com/owldsl/config/ConfigException.java
package com.owldsl.config;

/**
 * Malformed CNL configuration. Raised while loading; the session cannot continue.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
