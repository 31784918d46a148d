package com.nei10u.panchanga.exception;

/**
 * 资源已释放后仍被调用。
 */
public class ClosedResourceException extends PanchangaException {

    public ClosedResourceException(String resource) {
        super(resource + " has been closed");
    }
}
