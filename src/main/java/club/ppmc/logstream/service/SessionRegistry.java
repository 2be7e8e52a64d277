/**
 * SessionRegistry.java
 *
 * 会话状态的唯一来源：维护会话元数据和监控器两张表，并持有按会话索引的 LogSinkStore。
 * 所有会同时涉及两张表的操作（注销、全部关闭等）都在同一把锁内完成，
 * 因此不会出现"会话已删除但监控器仍在表中"或反过来的中间状态。
 * 锁内只做有界耗时的操作：监控器的 stop() 最多等待一个宽限期，日志文件删除是本地文件操作。
 *
 * <p>注册表是普通对象而不是全局单例，测试中可以创建多个互不影响的实例。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.exception.DuplicateSessionException;
import club.ppmc.logstream.exception.SessionNotFoundException;
import club.ppmc.logstream.log.LogSink;
import club.ppmc.logstream.log.LogSinkStore;
import club.ppmc.logstream.model.LogLevel;
import club.ppmc.logstream.model.SessionInfo;
import club.ppmc.logstream.model.ShutdownReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SessionRegistry {

    private final Lock lock;
    private final LogSinkStore sinkStore;
    private final SystemMonitorFactory monitorFactory;
    private final Clock clock;

    // 以下两张表只能在持有 lock 时访问
    private final Map<String, SessionState> sessions = new LinkedHashMap<>();
    private final Map<String, SystemMonitor> monitors = new HashMap<>();

    public SessionRegistry(LogSinkStore sinkStore, SystemMonitorFactory monitorFactory, Clock clock) {
        this(new ReentrantLock(), sinkStore, monitorFactory, clock);
    }

    public SessionRegistry(
            Lock lock, LogSinkStore sinkStore, SystemMonitorFactory monitorFactory, Clock clock) {
        this.lock = lock;
        this.sinkStore = sinkStore;
        this.monitorFactory = monitorFactory;
        this.clock = clock;
    }

    /**
     * 以随机UUID创建并注册一个新会话，清空可能残留的同名日志，并写入一条创建日志。
     *
     * @return 新会话的ID。
     */
    public String createSession() {
        String sessionId = UUID.randomUUID().toString();
        lock.lock();
        try {
            registerLocked(sessionId, clock.instant());
            sinkStore.obtain(sessionId, false).info("Session created with ID: " + sessionId);
        } finally {
            lock.unlock();
        }
        return sessionId;
    }

    public SessionInfo register(String sessionId) {
        return register(sessionId, clock.instant());
    }

    /**
     * 注册一个新会话，并以"清空已有内容"的语义创建其 LogSink。
     *
     * @throws DuplicateSessionException 该ID已注册。
     */
    public SessionInfo register(String sessionId, Instant createdAt) {
        lock.lock();
        try {
            return registerLocked(sessionId, createdAt).toInfo(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 注销会话：停止其监控器、移除元数据并释放日志文件。ID不存在时什么也不做。
     * 正在读取该会话日志的流不受影响，只是之后不会再有新内容。
     *
     * @return 会话此前是否存在。
     */
    public boolean unregister(String sessionId) {
        lock.lock();
        try {
            stopMonitorLocked(sessionId);
            boolean removed = sessions.remove(sessionId) != null;
            if (removed) {
                log.info("已注销会话: {}", sessionId);
            }
            sinkStore.release(sessionId);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 为会话登记一个监控器。已有的监控器会先被停止再替换。
     * 会话不存在时，传入的监控器会被停止且不登记，以保持"monitoring 标志为真当且仅当存在已登记的监控器"。
     *
     * @return 是否登记成功。
     */
    public boolean attachMonitor(String sessionId, SystemMonitor monitor) {
        lock.lock();
        try {
            SessionState state = sessions.get(sessionId);
            if (state == null) {
                log.warn("会话 {} 不存在，放弃登记监控器。", sessionId);
                monitor.stop();
                return false;
            }
            attachMonitorLocked(sessionId, state, monitor);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 为会话启动一个新的监控器，替换任何正在运行的旧监控器。
     *
     * @throws SessionNotFoundException 会话不存在。
     */
    public SystemMonitor startMonitoring(String sessionId, Duration interval) {
        lock.lock();
        try {
            SessionState state = requireSession(sessionId);
            stopMonitorLocked(sessionId);
            SystemMonitor monitor = monitorFactory.create(sinkStore.obtain(sessionId, false));
            monitor.start(interval);
            attachMonitorLocked(sessionId, state, monitor);
            state.lastActivity = clock.instant();
            return monitor;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 停止会话的监控器。
     *
     * @return 是否确实停止了一个监控器；没有活动监控器时返回 false。
     */
    public boolean stopMonitor(String sessionId) {
        lock.lock();
        try {
            return stopMonitorLocked(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 停止所有监控器，清空两张表，并删除日志目录下的所有会话日志文件。
     * 与其他注册表操作互斥，因此它之前开始的操作要么完全生效，要么完全被清除。
     */
    public ShutdownReport shutdownAll() {
        lock.lock();
        try {
            int monitorCount = monitors.size();
            int stopped = 0;
            for (String sessionId : new ArrayList<>(monitors.keySet())) {
                if (stopMonitorLocked(sessionId)) {
                    stopped++;
                }
            }
            monitors.clear();
            int sessionCount = sessions.size();
            sessions.clear();

            int deletedLogs;
            try {
                deletedLogs = sinkStore.releaseAll();
            } catch (RuntimeException e) {
                log.error("清理日志文件时出错", e);
                deletedLogs = 0;
            }

            log.info("关闭完成: 停止了 {}/{} 个监控器，清除了 {} 个会话，删除了 {} 个日志文件",
                    stopped, monitorCount, sessionCount, deletedLogs);
            return new ShutdownReport(stopped, sessionCount, deletedLogs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 返回所有会话元数据的不可变副本。
     */
    public Map<String, SessionInfo> snapshotSessions() {
        lock.lock();
        try {
            Map<String, SessionInfo> copy = new LinkedHashMap<>();
            sessions.forEach((id, state) -> copy.put(id, state.toInfo(id)));
            return Collections.unmodifiableMap(copy);
        } finally {
            lock.unlock();
        }
    }

    public Optional<SessionInfo> find(String sessionId) {
        lock.lock();
        try {
            SessionState state = sessions.get(sessionId);
            return state == null ? Optional.empty() : Optional.of(state.toInfo(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String sessionId) {
        lock.lock();
        try {
            return sessions.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 更新会话的最近活动时间。会话不存在时不是错误，活动请求与删除并发是正常现象。
     *
     * @return 会话是否存在。
     */
    public boolean touch(String sessionId) {
        lock.lock();
        try {
            SessionState state = sessions.get(sessionId);
            if (state == null) {
                return false;
            }
            state.lastActivity = clock.instant();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取会话的 LogSink。
     *
     * @throws SessionNotFoundException 会话不存在。
     */
    public LogSink sink(String sessionId) {
        lock.lock();
        try {
            requireSession(sessionId);
            return sinkStore.obtain(sessionId, false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 以指定级别向会话日志追加一行，并更新活动时间。文件写入在锁外进行。
     *
     * @throws SessionNotFoundException 会话不存在。
     */
    public void appendLog(String sessionId, LogLevel level, String message) {
        LogSink sink = sink(sessionId);
        sink.append(level, message);
        touch(sessionId);
    }

    public int sessionCount() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public int activeMonitorCount() {
        lock.lock();
        try {
            return monitors.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> monitoredSessionIds() {
        lock.lock();
        try {
            return List.copyOf(monitors.keySet());
        } finally {
            lock.unlock();
        }
    }

    private SessionState registerLocked(String sessionId, Instant createdAt) {
        if (sessions.containsKey(sessionId)) {
            throw new DuplicateSessionException(sessionId);
        }
        sinkStore.obtain(sessionId, true);
        var state = new SessionState(createdAt);
        sessions.put(sessionId, state);
        log.info("已注册会话: {}", sessionId);
        return state;
    }

    private SessionState requireSession(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return state;
    }

    private void attachMonitorLocked(String sessionId, SessionState state, SystemMonitor monitor) {
        SystemMonitor previous = monitors.put(sessionId, monitor);
        if (previous != null && previous != monitor) {
            previous.stop();
        }
        state.monitoring = true;
        log.info("已为会话 {} 登记监控器", sessionId);
    }

    private boolean stopMonitorLocked(String sessionId) {
        SystemMonitor monitor = monitors.remove(sessionId);
        if (monitor == null) {
            return false;
        }
        SessionState state = sessions.get(sessionId);
        if (state != null) {
            state.monitoring = false;
        }
        try {
            monitor.stop();
            log.info("已停止会话 {} 的监控器", sessionId);
            return true;
        } catch (RuntimeException e) {
            log.error("停止会话 {} 的监控器时出错", sessionId, e);
            return false;
        }
    }

    private static final class SessionState {
        private final Instant createdAt;
        private Instant lastActivity;
        private boolean monitoring;

        private SessionState(Instant createdAt) {
            this.createdAt = createdAt;
            this.lastActivity = createdAt;
        }

        private SessionInfo toInfo(String sessionId) {
            return new SessionInfo(sessionId, createdAt, lastActivity, monitoring);
        }
    }
}
