/**
 * SessionController.java
 *
 * 该控制器处理会话的生命周期请求：创建、列出、删除会话，启动和停止后台监控，以及清除全部日志。
 * 所有操作都委托给 SessionRegistry 完成。
 */
package club.ppmc.logstream.controller;

import club.ppmc.logstream.exception.DuplicateSessionException;
import club.ppmc.logstream.exception.LogResourceException;
import club.ppmc.logstream.exception.SessionNotFoundException;
import club.ppmc.logstream.model.ShutdownReport;
import club.ppmc.logstream.service.SessionRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@Slf4j
public class SessionController {

    static final int MIN_INTERVAL_SECONDS = 1;
    static final int MAX_INTERVAL_SECONDS = 60;

    private final SessionRegistry sessionRegistry;
    private final int defaultIntervalSeconds;

    public SessionController(
            SessionRegistry sessionRegistry,
            @Value("${app.monitor.default-interval-seconds:2}") int defaultIntervalSeconds) {
        this.sessionRegistry = sessionRegistry;
        this.defaultIntervalSeconds = defaultIntervalSeconds;
    }

    /**
     * 创建一个新会话并返回其ID。
     */
    @PostMapping("/sessions")
    public ResponseEntity<Map<String, Object>> createSession() {
        try {
            String sessionId = sessionRegistry.createSession();
            return ResponseEntity.ok(Map.of("session_id", sessionId));
        } catch (DuplicateSessionException e) {
            log.error("生成的会话ID发生冲突", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.toErrorData());
        } catch (LogResourceException e) {
            log.error("创建会话时出错", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.toErrorData());
        }
    }

    /**
     * 列出当前所有会话的元数据快照。
     */
    @GetMapping("/sessions")
    public ResponseEntity<Map<String, Object>> listSessions() {
        return ResponseEntity.ok(Map.of("sessions", List.copyOf(sessionRegistry.snapshotSessions().values())));
    }

    /**
     * 删除会话：停止其监控并删除其日志。
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> deleteSession(@PathVariable String sessionId) {
        if (!sessionRegistry.unregister(sessionId)) {
            return notFound(sessionId);
        }
        return ResponseEntity.ok(Map.of("message", "Session " + sessionId + " deleted"));
    }

    /**
     * 为会话启动后台监控。若已有监控在运行，先停止旧的再启动新的。
     */
    @PostMapping("/sessions/{sessionId}/start-monitoring")
    public ResponseEntity<Map<String, Object>> startMonitoring(
            @PathVariable String sessionId, @RequestParam(required = false) Integer interval) {
        int seconds = interval != null ? interval : defaultIntervalSeconds;
        if (seconds < MIN_INTERVAL_SECONDS || seconds > MAX_INTERVAL_SECONDS) {
            return ResponseEntity.badRequest()
                    .body(Map.of("message", String.format("interval 必须在 %d 到 %d 秒之间",
                            MIN_INTERVAL_SECONDS, MAX_INTERVAL_SECONDS)));
        }
        try {
            sessionRegistry.startMonitoring(sessionId, Duration.ofSeconds(seconds));
            return ResponseEntity.ok(Map.of("message", "Started monitoring for session " + sessionId));
        } catch (SessionNotFoundException e) {
            return notFound(sessionId);
        } catch (LogResourceException e) {
            log.error("为会话 {} 启动监控时出错", sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.toErrorData());
        }
    }

    /**
     * 停止会话的后台监控。
     */
    @PostMapping("/sessions/{sessionId}/stop-monitoring")
    public ResponseEntity<Map<String, Object>> stopMonitoring(@PathVariable String sessionId) {
        if (!sessionRegistry.contains(sessionId)) {
            return notFound(sessionId);
        }
        boolean stopped = sessionRegistry.stopMonitor(sessionId);
        sessionRegistry.touch(sessionId);
        String message = stopped
                ? "Stopped monitoring for session " + sessionId
                : "Monitoring was not active for session " + sessionId;
        return ResponseEntity.ok(Map.of("message", message, "stopped", stopped));
    }

    /**
     * 清除所有会话的日志：停止全部监控器、清空注册表并删除所有日志文件。
     */
    @PostMapping("/clear-logs")
    public ResponseEntity<Map<String, Object>> clearLogs() {
        ShutdownReport report = sessionRegistry.shutdownAll();
        return ResponseEntity.ok(Map.of(
                "message", "All logs have been cleared. Deleted " + report.logsDeleted() + " files.",
                "details", Map.of(
                        "monitors_stopped", report.monitorsStopped(),
                        "sessions_cleared", report.sessionsCleared(),
                        "logs_deleted", report.logsDeleted())));
    }

    static ResponseEntity<Map<String, Object>> notFound(String sessionId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new SessionNotFoundException(sessionId).toErrorData());
    }
}
