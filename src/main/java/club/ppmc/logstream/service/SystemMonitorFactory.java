/**
 * SystemMonitorFactory.java
 *
 * 为会话创建 SystemMonitor 实例，集中持有所有监控器共享的协作对象（采样器、线程池、关闭信号等）。
 * SessionRegistry 在重新开始监控时用它创建新的监控器，而不是修改旧实例。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.log.LogSink;
import java.util.Random;
import java.util.concurrent.Executor;

public class SystemMonitorFactory {

    private final MetricsSampler sampler;
    private final LogMessageFactory messageFactory;
    private final Executor executor;
    private final ShutdownSignal shutdownSignal;
    private final MonitorSettings settings;
    private final Random random;

    public SystemMonitorFactory(
            MetricsSampler sampler,
            Executor executor,
            ShutdownSignal shutdownSignal,
            MonitorSettings settings,
            Random random) {
        this.sampler = sampler;
        this.messageFactory = new LogMessageFactory(random);
        this.executor = executor;
        this.shutdownSignal = shutdownSignal;
        this.settings = settings;
        this.random = random;
    }

    public SystemMonitor create(LogSink sink) {
        return new SystemMonitor(sink, sampler, messageFactory, executor, shutdownSignal, settings, random);
    }
}
