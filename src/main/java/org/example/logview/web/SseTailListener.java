package org.example.logview.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.logview.filesystem.LogViewException;
import org.example.logview.filesystem.TailListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * 把 tail 会话的回调写成 SSE 事件。
 * <p>
 * 每行一个事件，data 为 JSON 编码后的字符串；空闲时发送注释行 {@code :keepalive}（客户端忽略）；
 * 会话出错时先发送 {@code event: error}，然后结束流。
 */
class SseTailListener implements TailListener {

    private static final Logger log = LoggerFactory.getLogger(SseTailListener.class);

    private final SseEmitter emitter;
    private final ObjectMapper objectMapper;

    SseTailListener(SseEmitter emitter, ObjectMapper objectMapper) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onLine(String line) throws IOException {
        emitter.send(SseEmitter.event().data(objectMapper.writeValueAsString(line)));
    }

    @Override
    public void onIdle() throws IOException {
        emitter.send(SseEmitter.event().comment("keepalive"));
    }

    @Override
    public void onError(LogViewException error) {
        try {
            emitter.send(SseEmitter.event()
                    .name("error")
                    .data(objectMapper.writeValueAsString(error.getMessage())));
            emitter.complete();
        } catch (IOException e) {
            log.debug("发送 tail 错误事件失败（消费端可能已断开）：{}", e.toString());
            emitter.completeWithError(error);
        }
    }
}
