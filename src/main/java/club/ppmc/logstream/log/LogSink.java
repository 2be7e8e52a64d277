/**
 * LogSink.java
 *
 * 单个会话的日志文件，只追加写入。
 * 所有写操作（追加、清空、删除）都在同一把锁内串行执行，因此任意读取者看到的行顺序就是写入顺序。
 * 读取不需要加锁：每个 LogSinkReader 持有自己的读取位置，只会向前移动。
 * 实例由 LogSinkStore 按会话ID唯一创建，不应直接 new。
 */
package club.ppmc.logstream.log;

import club.ppmc.logstream.exception.LogResourceException;
import club.ppmc.logstream.exception.SessionNotFoundException;
import club.ppmc.logstream.model.LogLevel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LogSink {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

    private final String sessionId;
    private final Path path;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile boolean closed;

    LogSink(String sessionId, Path path, Clock clock) {
        this.sessionId = sessionId;
        this.path = path;
        this.clock = clock;
        try {
            Files.createDirectories(path.getParent());
            if (Files.notExists(path)) {
                Files.createFile(path);
            }
        } catch (IOException e) {
            throw new LogResourceException(sessionId, "无法创建日志文件: " + path, e);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public Path getPath() {
        return path;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 追加一条带时间戳和级别前缀的日志。
     *
     * @return 若日志文件已被释放（会话已删除），返回 false 且不写入任何内容。
     * @throws LogResourceException 写文件失败时抛出。
     */
    public boolean append(LogLevel level, String message) {
        String line = String.format("%s - %s - %s%n",
                LocalDateTime.now(clock).format(TIMESTAMP_FORMAT), level.name(), message);
        writeLock.lock();
        try {
            if (closed) {
                log.debug("会话 {} 的日志已释放，丢弃一条 {} 日志。", sessionId, level);
                return false;
            }
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            return true;
        } catch (IOException e) {
            throw new LogResourceException(sessionId, "写入日志文件失败: " + path, e);
        } finally {
            writeLock.unlock();
        }
    }

    public boolean info(String message) {
        return append(LogLevel.INFO, message);
    }

    /**
     * 清空日志内容以便复用。已打开的读取者会在下次轮询时发现文件变短并从头读取。
     */
    public void truncate() {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            Files.write(path, new byte[0],
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            log.info("已清空会话 {} 的日志文件", sessionId);
        } catch (IOException e) {
            log.error("清空日志文件 {} 时出错", path, e);
            throw new LogResourceException(sessionId, "清空日志文件失败: " + path, e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 打开一个从文件开头读取的独立读取者。
     *
     * @throws SessionNotFoundException 日志文件不存在时抛出。
     * @throws LogResourceException     其他I/O错误。
     */
    public LogSinkReader openReader() {
        try {
            return new LogSinkReader(path);
        } catch (NoSuchFileException e) {
            throw SessionNotFoundException.logMissing(sessionId, path.toString());
        } catch (IOException e) {
            throw new LogResourceException(sessionId, "打开日志文件失败: " + path, e);
        }
    }

    /**
     * 停止接受新的写入。之后的 append 调用会被静默丢弃。
     */
    void close() {
        writeLock.lock();
        try {
            closed = true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 关闭并删除日志文件。
     *
     * @return 文件确实被删除时返回 true。
     */
    boolean delete() {
        writeLock.lock();
        try {
            closed = true;
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.error("删除日志文件 {} 时出错", path, e);
            return false;
        } finally {
            writeLock.unlock();
        }
    }
}
