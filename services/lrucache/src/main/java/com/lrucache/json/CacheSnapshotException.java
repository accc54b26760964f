package com.lrucache.json;

public class CacheSnapshotException extends RuntimeException {
    public CacheSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
