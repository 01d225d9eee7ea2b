package com.copilot.gateway.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * 已建立连接的上游响应，关闭时断开连接
 *
 * @param contentType 上游 Content-Type，可能为 null
 */
public record UpstreamResponse(int statusCode, String contentType, InputStream body) implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UpstreamResponse.class);

    public boolean isEventStream() {
        return contentType != null && contentType.contains("text/event-stream");
    }

    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("关闭上游连接失败: {}", e.getMessage());
        }
    }
}
