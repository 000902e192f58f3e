package com.rescontrol.store;

public class ResourceStoreException extends RuntimeException {

    public ResourceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
