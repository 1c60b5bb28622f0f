package com.gatewayadmin.admin.error;

/**
 * The underlying store was unavailable or a query failed. Never used for
 * "no such row".
 */
public class StorageException extends ConfigException {

    public StorageException(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String code() {
        return "STORAGE_ERROR";
    }
}
