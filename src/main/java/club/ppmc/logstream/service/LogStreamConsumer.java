/**
 * LogStreamConsumer.java
 *
 * 实时跟随读取一个会话的 LogSink，把新出现的每一行作为事件交给调用方。
 * 没有新行时以固定的轮询间隔休眠，连续 idleTimeout 没有新行则发出一个超时事件并结束；
 * 全局 ShutdownSignal 被触发时立即安静地结束。它从不因为到达文件末尾而阻塞或结束。
 * 多个消费者可以同时读取同一个 LogSink，彼此之间以及与写入者之间都互不阻塞。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.exception.LogResourceException;
import club.ppmc.logstream.exception.SessionNotFoundException;
import club.ppmc.logstream.log.LogSink;
import club.ppmc.logstream.log.LogSinkReader;
import club.ppmc.logstream.model.StreamEvent;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LogStreamConsumer {

    public static final String TIMEOUT_MESSAGE = "Connection timed out due to inactivity.";

    private final ShutdownSignal shutdownSignal;
    private final Duration pollInterval;

    public LogStreamConsumer(ShutdownSignal shutdownSignal, Duration pollInterval) {
        this.shutdownSignal = shutdownSignal;
        this.pollInterval = pollInterval;
    }

    /** 接收流事件的一方，通常把事件编码为SSE帧写入HTTP响应。 */
    @FunctionalInterface
    public interface EventSink {
        void accept(StreamEvent event) throws IOException;
    }

    /** 流结束的原因。 */
    public enum EndReason {
        IDLE_TIMEOUT,
        SHUTDOWN,
        INTERRUPTED
    }

    /**
     * 从头开始读取 sink 的内容并持续跟随，直到空闲超时或收到关闭信号。
     *
     * @throws SessionNotFoundException 日志文件不存在；抛出前已发出一个错误事件。
     * @throws LogResourceException     读取日志文件失败；抛出前已发出一个错误事件。
     * @throws IOException              向 events 写入失败，通常是客户端已断开。
     */
    public EndReason stream(LogSink sink, Duration idleTimeout, EventSink events) throws IOException {
        try (LogSinkReader reader = openReader(sink, events)) {
            long idleNanos = idleTimeout.toNanos();
            long lastActive = System.nanoTime();
            while (!shutdownSignal.isSet()) {
                Optional<String> line = readLine(sink, reader, events);
                if (line.isPresent()) {
                    events.accept(StreamEvent.data(line.get()));
                    lastActive = System.nanoTime();
                    continue;
                }
                if (System.nanoTime() - lastActive > idleNanos) {
                    events.accept(StreamEvent.timeout(TIMEOUT_MESSAGE));
                    log.debug("会话 {} 的日志流因空闲 {} 而结束", sink.getSessionId(), idleTimeout);
                    return EndReason.IDLE_TIMEOUT;
                }
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return EndReason.INTERRUPTED;
                }
            }
            log.debug("收到关闭信号，会话 {} 的日志流结束", sink.getSessionId());
            return EndReason.SHUTDOWN;
        }
    }

    private LogSinkReader openReader(LogSink sink, EventSink events) throws IOException {
        try {
            return sink.openReader();
        } catch (SessionNotFoundException e) {
            events.accept(StreamEvent.error(e.getMessage()));
            throw e;
        } catch (LogResourceException e) {
            events.accept(StreamEvent.error("Error reading log file: " + e.getMessage()));
            throw e;
        }
    }

    private Optional<String> readLine(LogSink sink, LogSinkReader reader, EventSink events) throws IOException {
        try {
            return reader.poll();
        } catch (IOException e) {
            log.error("读取会话 {} 的日志文件时出错", sink.getSessionId(), e);
            events.accept(StreamEvent.error("Error reading log file: " + e.getMessage()));
            throw new LogResourceException(sink.getSessionId(), "读取日志文件失败: " + e.getMessage(), e);
        }
    }
}
