package org.example.logview.filesystem;

import java.io.IOException;

/**
 * tail 会话的消费端回调。
 * <p>
 * 回调在 tail 调度线程上执行，同一会话的回调严格串行、按文件中的顺序到达。
 */
public interface TailListener {

    /**
     * 新的一整行（不含行尾换行符）。
     *
     * @throws IOException 消费端已断开；会话随即关闭
     */
    void onLine(String line) throws IOException;

    /**
     * 会话因读取失败而终止。这是会话的最后一个回调，之后不会再有 {@link #onLine}。
     */
    void onError(LogViewException error);

    /**
     * 连续一段时间没有新行时调用，用来探测消费端是否仍然在线。
     *
     * @throws IOException 消费端已断开；会话随即关闭
     */
    default void onIdle() throws IOException {
    }
}
