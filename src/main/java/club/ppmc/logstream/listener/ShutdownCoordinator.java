/**
 * ShutdownCoordinator.java
 *
 * 这是一个Spring事件监听器，负责进程关闭时的清理顺序。
 * 无论关闭来自 SIGINT/SIGTERM（经由 Spring Boot 的关闭钩子）还是 /shutdown 接口，
 * 上下文关闭事件都会先于Web服务器停止和Bean销毁发布。此时先触发全局关闭信号，
 * 让所有正在进行的日志流在一个轮询间隔内结束，再停止所有监控器并删除日志文件。
 */
package club.ppmc.logstream.listener;

import club.ppmc.logstream.model.ShutdownReport;
import club.ppmc.logstream.service.SessionRegistry;
import club.ppmc.logstream.service.ShutdownSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class ShutdownCoordinator {

    private final ShutdownSignal shutdownSignal;
    private final SessionRegistry sessionRegistry;
    private final ConfigurableApplicationContext applicationContext;

    public ShutdownCoordinator(
            ShutdownSignal shutdownSignal,
            SessionRegistry sessionRegistry,
            ConfigurableApplicationContext applicationContext) {
        this.shutdownSignal = shutdownSignal;
        this.sessionRegistry = sessionRegistry;
        this.applicationContext = applicationContext;
    }

    /**
     * 监听上下文关闭事件。
     */
    @EventListener
    public void handleContextClosed(ContextClosedEvent event) {
        if (event.getApplicationContext() != applicationContext) {
            return;
        }
        if (shutdownSignal.trigger()) {
            log.info("应用正在关闭，已设置全局关闭信号。");
        }
        log.info("正在清理会话并停止监控器...");
        ShutdownReport report = sessionRegistry.shutdownAll();
        log.info("清理完成: 停止了 {} 个监控器，清除了 {} 个会话，删除了 {} 个日志文件",
                report.monitorsStopped(), report.sessionsCleared(), report.logsDeleted());
    }

    /**
     * 处理显式的关闭请求：立即设置关闭信号，然后在独立线程中关闭应用上下文，
     * 以便当前HTTP请求能够正常返回。
     */
    public void requestShutdown() {
        if (shutdownSignal.trigger()) {
            log.info("收到关闭请求，已设置全局关闭信号。");
        } else {
            log.info("收到关闭请求，关闭信号此前已设置。");
        }
        var closer = new Thread(applicationContext::close, "shutdown-request");
        closer.setDaemon(false);
        closer.start();
    }
}
