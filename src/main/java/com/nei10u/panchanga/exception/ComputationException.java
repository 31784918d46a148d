package com.nei10u.panchanga.exception;

/**
 * 星历计算失败（经度、黄道岁差等）。不重试，直接抛给调用方。
 */
public class ComputationException extends PanchangaException {

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
