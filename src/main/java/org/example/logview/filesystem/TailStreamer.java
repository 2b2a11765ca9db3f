package org.example.logview.filesystem;

import org.example.logview.access.GroupAuthorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 实时 tail：从文件当前末尾开始，持续推送新追加的行。
 * <p>
 * 采用固定间隔轮询，而不是操作系统的文件变更通知。所有会话共享一个调度线程池，
 * 会话在等待下一轮轮询时不占用线程。
 */
public class TailStreamer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TailStreamer.class);

    private final SecurePathResolver pathResolver;
    private final GroupAuthorizer authorizer;
    private final LogViewSettings settings;
    private final ScheduledExecutorService scheduler;
    private final ChannelOpener channelOpener;
    private final Set<TailSession> activeSessions = ConcurrentHashMap.newKeySet();

    public TailStreamer(SecurePathResolver pathResolver, GroupAuthorizer authorizer, LogViewSettings settings) {
        this(pathResolver, authorizer, settings, file -> Files.newByteChannel(file, StandardOpenOption.READ));
    }

    TailStreamer(SecurePathResolver pathResolver, GroupAuthorizer authorizer, LogViewSettings settings,
                 ChannelOpener channelOpener) {
        this.pathResolver = pathResolver;
        this.authorizer = authorizer;
        this.settings = settings;
        this.channelOpener = channelOpener;
        this.scheduler = Executors.newScheduledThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()), daemonThreads());
    }

    /**
     * 打开一个 tail 会话。
     * <p>
     * 前置校验（越界、授权、存在、普通文件）在返回之前同步完成，失败时直接抛出 {@link LogViewException}，
     * 此时不会产生任何回调。会话开始之后的读取失败通过 {@link TailListener#onError} 通知。
     * <p>
     * 已存在的内容不会被推送：会话从打开那一刻的文件末尾开始。
     *
     * @return 会话句柄；调用 {@link TailSession#close()} 结束并释放文件句柄
     */
    public TailSession tail(String username, String filePath, TailListener listener) {
        Objects.requireNonNull(listener, "listener");
        Path file = FileChecks.requireReadableFile(pathResolver, authorizer, username, filePath);

        SeekableByteChannel channel;
        try {
            channel = channelOpener.open(file);
        } catch (IOException e) {
            throw new LogViewException(ErrorKind.IO_ERROR, "打开文件失败：" + filePath, e);
        }

        TailSession session;
        try {
            AtomicReference<TailSession> self = new AtomicReference<>();
            session = new TailSession(file, filePath, channel, listener, scheduler,
                    settings.tailPollInterval(), settings.tailHeartbeatInterval(), settings.tailBufferBytes(),
                    () -> activeSessions.remove(self.get()));
            self.set(session);
        } catch (IOException e) {
            closeQuietly(channel, e);
            throw new LogViewException(ErrorKind.IO_ERROR, "定位文件末尾失败：" + filePath, e);
        }
        log.info("tail 会话开始：user={}, path={}, offset={}", username, filePath, session.byteOffset());
        activeSessions.add(session);
        session.start();
        return session;
    }

    /**
     * 当前未结束的会话数。
     */
    public int activeSessionCount() {
        return activeSessions.size();
    }

    /**
     * 结束所有会话并停止调度器（应用停机时由容器调用）。
     */
    @Override
    public void close() {
        for (TailSession session : List.copyOf(activeSessions)) {
            session.close();
        }
        scheduler.shutdown();
    }

    private static void closeQuietly(SeekableByteChannel channel, IOException primary) {
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    /**
     * 打开 tail 用的只读通道。
     */
    @FunctionalInterface
    interface ChannelOpener {
        SeekableByteChannel open(Path file) throws IOException;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "logview-tail-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
