/**
 * SystemMonitor.java
 *
 * 绑定到一个会话 LogSink 的后台监控任务。
 * 启动后在独立线程中循环：采样系统指标 -> 选择日志级别 -> 生成消息 -> 写入会话日志 -> 带抖动地休眠。
 * 状态机只有 Idle 和 Running 两个状态，重复 start 或在空闲时 stop 都是无操作。
 * stop() 最多等待 MonitorSettings.stopGrace 让循环退出，超时后照常返回，不做无限期的 join。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.log.LogSink;
import club.ppmc.logstream.model.LogEntry;
import club.ppmc.logstream.model.LogLevel;
import club.ppmc.logstream.model.SystemMetrics;
import java.time.Duration;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SystemMonitor {

    private static final LogLevel[] NOMINAL_LEVELS = {LogLevel.INFO, LogLevel.WARNING, LogLevel.ERROR};
    private static final double[] NOMINAL_WEIGHTS = {0.7, 0.2, 0.1};

    private final LogSink sink;
    private final MetricsSampler sampler;
    private final LogMessageFactory messageFactory;
    private final Executor executor;
    private final ShutdownSignal shutdownSignal;
    private final MonitorSettings settings;
    private final Random random;

    // 当前运行中的循环；为 null 表示处于 Idle 状态。只在 synchronized 方法中修改。
    private volatile Worker worker;

    public SystemMonitor(
            LogSink sink,
            MetricsSampler sampler,
            LogMessageFactory messageFactory,
            Executor executor,
            ShutdownSignal shutdownSignal,
            MonitorSettings settings,
            Random random) {
        this.sink = sink;
        this.sampler = sampler;
        this.messageFactory = messageFactory;
        this.executor = executor;
        this.shutdownSignal = shutdownSignal;
        this.settings = settings;
        this.random = random;
    }

    public String getSessionId() {
        return sink.getSessionId();
    }

    public boolean isRunning() {
        return worker != null;
    }

    /**
     * 启动监控循环，并同步写入一条启动日志。
     *
     * @param interval 两次日志之间的基础间隔。
     * @return 若已在运行，返回 false 且不做任何事。
     */
    public synchronized boolean start(Duration interval) {
        if (worker != null) {
            return false;
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("监控间隔必须为正数: " + interval);
        }
        var newWorker = new Worker(interval);
        // 启动日志先于循环写入，保证它是本次监控的第一行
        sink.info("Started system monitoring with interval: " + formatSeconds(interval));
        executor.execute(() -> runLoop(newWorker));
        this.worker = newWorker;
        log.info("会话 {} 的系统监控已启动，间隔 {}", sink.getSessionId(), interval);
        return true;
    }

    /**
     * 停止监控循环，最多等待一个宽限期让循环退出，并同步写入一条停止日志。
     *
     * @return 若本来就未运行，返回 false 且不写日志。
     */
    public synchronized boolean stop() {
        Worker current = this.worker;
        if (current == null) {
            return false;
        }
        this.worker = null;
        current.active.set(false);
        current.wakeUp.countDown();
        try {
            if (!current.exited.await(settings.stopGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("会话 {} 的监控循环未在 {} 内退出，将不再等待。", sink.getSessionId(), settings.stopGrace());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sink.info("Stopped system monitoring");
        log.info("会话 {} 的系统监控已停止", sink.getSessionId());
        return true;
    }

    private void runLoop(Worker w) {
        log.debug("会话 {} 的监控线程开始运行", sink.getSessionId());
        try {
            while (isActive(w)) {
                Duration pause;
                try {
                    LogEntry entry = nextEntry(sampler.sample());
                    // 采样可能耗时较长，写入前再确认一次没有被停止
                    if (!isActive(w)) {
                        break;
                    }
                    sink.append(entry.level(), entry.message());
                    pause = jittered(w.interval);
                } catch (RuntimeException e) {
                    log.error("会话 {} 的监控循环出错: {}", sink.getSessionId(), e.getMessage(), e);
                    pause = w.interval;
                }
                if (w.wakeUp.await(pause.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            w.exited.countDown();
            log.debug("会话 {} 的监控线程已退出", sink.getSessionId());
        }
    }

    private boolean isActive(Worker w) {
        return w.active.get() && !shutdownSignal.isSet();
    }

    /**
     * 按 70/20/10 的权重随机选出名义级别；若阈值判定为 ERROR 及以上，则以判定结果为准。
     */
    LogEntry nextEntry(SystemMetrics metrics) {
        LogLevel nominal = pickNominalLevel();
        LogLevel alarm = SeverityClassifier.classify(metrics);
        LogLevel level = alarm.isAtLeast(LogLevel.ERROR) && alarm.isAtLeast(nominal) ? alarm : nominal;
        return messageFactory.compose(level, metrics);
    }

    private LogLevel pickNominalLevel() {
        double roll;
        synchronized (random) {
            roll = random.nextDouble();
        }
        double cumulative = 0.0;
        for (int i = 0; i < NOMINAL_LEVELS.length; i++) {
            cumulative += NOMINAL_WEIGHTS[i];
            if (roll < cumulative) {
                return NOMINAL_LEVELS[i];
            }
        }
        return NOMINAL_LEVELS[NOMINAL_LEVELS.length - 1];
    }

    private Duration jittered(Duration interval) {
        long jitterMillis = settings.jitter().toMillis();
        if (jitterMillis <= 0) {
            return interval;
        }
        long offset;
        synchronized (random) {
            offset = (long) ((random.nextDouble() * 2 - 1) * jitterMillis);
        }
        return Duration.ofMillis(Math.max(0, interval.toMillis() + offset));
    }

    static String formatSeconds(Duration interval) {
        long millis = interval.toMillis();
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }

    private static final class Worker {
        private final Duration interval;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final CountDownLatch wakeUp = new CountDownLatch(1);
        private final CountDownLatch exited = new CountDownLatch(1);

        private Worker(Duration interval) {
            this.interval = interval;
        }
    }
}
