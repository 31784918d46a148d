package com.nei10u.panchanga.exception;

/**
 * 排盘过程中所有业务异常的基类（非受检）。
 */
public class PanchangaException extends RuntimeException {

    public PanchangaException(String message) {
        super(message);
    }

    public PanchangaException(String message, Throwable cause) {
        super(message, cause);
    }
}
