package com.copilot.gateway.exception;

/**
 * 上游流在传输中途中断
 */
public class StreamException extends GatewayException {

    public StreamException(String message, Throwable cause) {
        super(message, 502, cause);
    }
}
