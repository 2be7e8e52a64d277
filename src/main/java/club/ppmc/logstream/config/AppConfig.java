/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 把会话日志、监控和日志流相关的普通Java对象装配为Bean，所有可调参数都来自 application.properties。
 * 核心类本身不依赖Spring，测试中可以直接 new 出独立的实例。
 */
package club.ppmc.logstream.config;

import club.ppmc.logstream.log.LogSinkStore;
import club.ppmc.logstream.service.LogStreamConsumer;
import club.ppmc.logstream.service.MetricsSampler;
import club.ppmc.logstream.service.MonitorSettings;
import club.ppmc.logstream.service.OshiMetricsSampler;
import club.ppmc.logstream.service.SessionRegistry;
import club.ppmc.logstream.service.ShutdownSignal;
import club.ppmc.logstream.service.SystemMonitorFactory;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean，用于把日志行编码为SSE帧中的JSON字符串。
     * 关闭HTML转义，使日志中的 '<'、'=' 等字符原样输出。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder().disableHtmlEscaping().create();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** 进程级关闭信号，由 ShutdownCoordinator 触发。 */
    @Bean
    public ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    @Bean
    public MetricsSampler metricsSampler() {
        return new OshiMetricsSampler();
    }

    /**
     * 监控循环使用的线程池，每个活动的监控器占用一个守护线程。
     * 上下文关闭时调用 shutdownNow()，此前 ShutdownCoordinator 已停止所有监控器。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService monitorExecutor() {
        var threadFactory = new CustomizableThreadFactory("system-monitor-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public MonitorSettings monitorSettings(
            @Value("${app.monitor.jitter-millis:500}") long jitterMillis,
            @Value("${app.monitor.stop-grace-millis:2000}") long stopGraceMillis) {
        return new MonitorSettings(Duration.ofMillis(jitterMillis), Duration.ofMillis(stopGraceMillis));
    }

    @Bean
    public SystemMonitorFactory systemMonitorFactory(
            MetricsSampler metricsSampler,
            ExecutorService monitorExecutor,
            ShutdownSignal shutdownSignal,
            MonitorSettings monitorSettings) {
        return new SystemMonitorFactory(
                metricsSampler, monitorExecutor, shutdownSignal, monitorSettings, new Random());
    }

    @Bean
    public LogSinkStore logSinkStore(@Value("${app.logs.directory:./logs}") String logsDirectory, Clock clock) {
        return new LogSinkStore(Paths.get(logsDirectory), clock);
    }

    @Bean
    public SessionRegistry sessionRegistry(
            LogSinkStore logSinkStore, SystemMonitorFactory systemMonitorFactory, Clock clock) {
        return new SessionRegistry(logSinkStore, systemMonitorFactory, clock);
    }

    @Bean
    public LogStreamConsumer logStreamConsumer(
            ShutdownSignal shutdownSignal,
            @Value("${app.stream.poll-interval-millis:100}") long pollIntervalMillis) {
        return new LogStreamConsumer(shutdownSignal, Duration.ofMillis(pollIntervalMillis));
    }
}
