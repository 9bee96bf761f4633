package com.gridt.admin.infrastructure.exception;

/**
 * The tool cannot start: no usable database URI. Raised before any storage is touched.
 */
public class ConfigurationException extends BusinessException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
