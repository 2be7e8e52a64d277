/**
 * LogSinkStore.java
 *
 * 按会话ID索引的 LogSink 仓库，保证同一ID同一时刻最多只有一个实例。
 * 对已存在的ID再次 obtain 时返回原实例（可选择清空内容），而不是创建重复实例。
 * 它由 SessionRegistry 持有，生命周期显式可控，测试中可以创建多个互不相干的实例。
 */
package club.ppmc.logstream.log;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LogSinkStore {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String FILE_PREFIX = "session_";
    private static final String FILE_SUFFIX = ".log";

    private final Path directory;
    private final Clock clock;
    private final Map<String, LogSink> sinks = new HashMap<>();

    public LogSinkStore(Path directory, Clock clock) {
        this.directory = directory.toAbsolutePath().normalize();
        this.clock = clock;
    }

    /**
     * 日志文件名由会话ID确定性地生成。
     *
     * @throws IllegalArgumentException 会话ID包含不能用于文件名的字符。
     */
    public Path pathFor(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("非法的会话ID: " + sessionId);
        }
        return directory.resolve(FILE_PREFIX + sessionId + FILE_SUFFIX);
    }

    /**
     * 获取或创建会话的 LogSink。
     *
     * @param clearExisting 若实例已存在，是否清空其内容。
     */
    public synchronized LogSink obtain(String sessionId, boolean clearExisting) {
        LogSink existing = sinks.get(sessionId);
        if (existing != null) {
            if (clearExisting) {
                existing.truncate();
            }
            return existing;
        }
        Path path = pathFor(sessionId);
        var sink = new LogSink(sessionId, path, clock);
        if (clearExisting) {
            // 进程重启后可能残留同名文件
            sink.truncate();
        }
        sinks.put(sessionId, sink);
        return sink;
    }

    public synchronized Optional<LogSink> find(String sessionId) {
        return Optional.ofNullable(sinks.get(sessionId));
    }

    /**
     * 释放会话的 LogSink 并删除其日志文件。正在读取的 LogSinkReader 不受影响，
     * 之后对该实例的追加会被丢弃。ID不存在时什么也不做。
     *
     * @return 是否删除了日志文件。
     */
    public synchronized boolean release(String sessionId) {
        LogSink sink = sinks.remove(sessionId);
        if (sink == null) {
            return false;
        }
        boolean deleted = sink.delete();
        log.debug("已释放会话 {} 的日志 (文件已删除: {})", sessionId, deleted);
        return deleted;
    }

    /**
     * 关闭所有 LogSink，并删除日志目录下所有会话日志文件，包括不属于当前实例的残留文件。
     *
     * @return 删除的文件数。
     */
    public synchronized int releaseAll() {
        sinks.values().forEach(LogSink::close);
        sinks.clear();

        if (Files.notExists(directory)) {
            return 0;
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.error("列出日志目录 {} 时出错", directory, e);
            return 0;
        }

        int deleted = 0;
        for (Path file : files) {
            try {
                if (Files.deleteIfExists(file)) {
                    deleted++;
                }
            } catch (IOException e) {
                log.error("删除日志文件 {} 时出错", file, e);
            }
        }
        log.info("已删除 {} 个日志文件", deleted);
        return deleted;
    }

    public synchronized int size() {
        return sinks.size();
    }
}
