package org.example.logview.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个 tail 会话：持有一个文件句柄与只增不减的读取偏移。
 * <p>
 * 状态流转：打开 -> 定位到文件末尾 -> 轮询循环。每轮轮询先把当前可读的完整行全部推送出去，
 * 读不到新数据时才把下一轮交给调度器延迟执行（不占用线程等待）。
 * <p>
 * 会话只会因为 {@link #close()}（消费端断开）或读取失败而结束，文件句柄在任一结束路径上都会被关闭。
 * 会话不可重启，也不在会话之间共享。
 */
public class TailSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TailSession.class);

    private final Path filePath;
    private final String displayPath;
    private final SeekableByteChannel channel;
    private final TailListener listener;
    private final ScheduledExecutorService scheduler;
    private final long pollIntervalNanos;
    private final long heartbeatIntervalNanos;
    private final ByteBuffer buffer;
    // 尚未遇到换行符的半行字节
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final ReentrantLock pollLock = new ReentrantLock();
    private final Runnable onClosed;

    private volatile boolean closed;
    private volatile long byteOffset;
    private volatile Instant lastPollAt;
    private volatile ScheduledFuture<?> nextPoll;
    // 最近一次向消费端写出（行或心跳）的时刻，只在持有 pollLock 时读写
    private long lastDeliveryNanos;

    TailSession(Path filePath, String displayPath, SeekableByteChannel channel, TailListener listener,
                ScheduledExecutorService scheduler, Duration pollInterval, Duration heartbeatInterval,
                int bufferBytes, Runnable onClosed) throws IOException {
        this.filePath = filePath;
        this.displayPath = displayPath;
        this.channel = channel;
        this.listener = listener;
        this.scheduler = scheduler;
        this.pollIntervalNanos = pollInterval.toNanos();
        this.heartbeatIntervalNanos = heartbeatInterval.toNanos();
        this.buffer = ByteBuffer.allocate(bufferBytes);
        this.onClosed = onClosed;
        this.byteOffset = channel.size();
        channel.position(byteOffset);
        this.lastDeliveryNanos = System.nanoTime();
    }

    public Path filePath() {
        return filePath;
    }

    public long byteOffset() {
        return byteOffset;
    }

    public Instant lastPollAt() {
        return lastPollAt;
    }

    public boolean isClosed() {
        return closed;
    }

    void start() {
        schedule(0L);
    }

    /**
     * 结束会话（幂等）。
     * <p>
     * 若此刻正有一轮轮询在执行，文件句柄由那一轮在结束时关闭；否则在这里直接关闭。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        ScheduledFuture<?> future = nextPoll;
        if (future != null) {
            future.cancel(false);
        }
        if (pollLock.tryLock()) {
            try {
                closeChannel();
            } finally {
                pollLock.unlock();
            }
        }
        log.info("tail 会话结束：{}", displayPath);
    }

    private void schedule(long delayNanos) {
        try {
            nextPoll = scheduler.schedule(this::poll, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            // 调度器已关闭（应用停机）
            log.debug("tail 调度器已关闭，结束会话：{}", displayPath);
            close();
        }
    }

    private void poll() {
        pollLock.lock();
        try {
            if (closed) {
                return;
            }
            lastPollAt = Instant.now();
            drain();
            heartbeatIfIdle();
        } catch (IOException e) {
            fail(e);
        } finally {
            if (closed) {
                closeChannel();
            }
            pollLock.unlock();
        }
        if (!closed) {
            schedule(pollIntervalNanos);
        } else {
            // close() 可能在上面的 finally 检查之后才把 closed 置位，此时它拿不到锁，句柄由这里关闭
            pollLock.lock();
            try {
                closeChannel();
            } finally {
                pollLock.unlock();
            }
        }
    }

    /**
     * 读到没有新数据为止，每遇到一个换行符就推送一行。
     */
    private void drain() throws IOException {
        while (!closed) {
            buffer.clear();
            int read = channel.read(buffer);
            if (read <= 0) {
                return;
            }
            byteOffset += read;
            buffer.flip();
            byte[] chunk = buffer.array();
            int lineStart = 0;
            for (int i = 0; i < read && !closed; i++) {
                if (chunk[i] == '\n') {
                    pending.write(chunk, lineStart, i - lineStart);
                    lineStart = i + 1;
                    emit(decodePendingLine());
                }
            }
            if (lineStart < read) {
                pending.write(chunk, lineStart, read - lineStart);
            }
        }
    }

    /**
     * 文件长时间没有新行时向消费端发一次心跳；消费端断开后只有写入才能发现。
     */
    private void heartbeatIfIdle() {
        if (closed || System.nanoTime() - lastDeliveryNanos < heartbeatIntervalNanos) {
            return;
        }
        lastDeliveryNanos = System.nanoTime();
        try {
            listener.onIdle();
        } catch (IOException e) {
            log.debug("tail 心跳发送失败，消费端已断开：{}（{}）", displayPath, e.toString());
            closed = true;
        } catch (RuntimeException e) {
            log.warn("tail 心跳回调异常，结束会话：{}", displayPath, e);
            closed = true;
        }
    }

    private String decodePendingLine() {
        byte[] bytes = pending.toByteArray();
        pending.reset();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        // new String(..., UTF_8) 对非法字节做替换
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    private void emit(String line) {
        lastDeliveryNanos = System.nanoTime();
        try {
            listener.onLine(line);
        } catch (IOException e) {
            log.debug("tail 消费端已断开：{}（{}）", displayPath, e.toString());
            closed = true;
        } catch (RuntimeException e) {
            log.warn("tail 消费端回调异常，结束会话：{}", displayPath, e);
            closed = true;
        }
    }

    private void fail(IOException cause) {
        log.warn("tail 读取失败，终止会话：{}", displayPath, cause);
        closed = true;
        try {
            listener.onError(new LogViewException(ErrorKind.IO_ERROR, "读取文件失败：" + displayPath, cause));
        } catch (RuntimeException e) {
            log.warn("tail 错误回调异常：{}", displayPath, e);
        }
    }

    private void closeChannel() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("关闭文件句柄失败：{}", displayPath, e);
        } finally {
            onClosed.run();
        }
    }
}
