/**
 * LogController.java
 *
 * 该控制器处理会话日志的读写请求。
 * GET 以 Server-Sent Events 的形式实时推送日志，每一行编码为一个 {@code data: <JSON字符串>} 帧；
 * POST 以调用方指定的级别向会话日志追加一行。
 */
package club.ppmc.logstream.controller;

import club.ppmc.logstream.exception.LogResourceException;
import club.ppmc.logstream.exception.SessionNotFoundException;
import club.ppmc.logstream.log.LogSink;
import club.ppmc.logstream.model.AddLogRequest;
import club.ppmc.logstream.model.LogLevel;
import club.ppmc.logstream.service.LogStreamConsumer;
import club.ppmc.logstream.service.SessionRegistry;
import club.ppmc.logstream.util.SseFrameWriter;
import com.google.gson.Gson;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
@RequestMapping("/api/sessions/{sessionId}/logs")
@Slf4j
public class LogController {

    static final int MIN_IDLE_TIMEOUT_SECONDS = 10;
    static final int MAX_IDLE_TIMEOUT_SECONDS = 3600;

    private final SessionRegistry sessionRegistry;
    private final LogStreamConsumer logStreamConsumer;
    private final Gson gson;
    private final int defaultIdleTimeoutSeconds;

    public LogController(
            SessionRegistry sessionRegistry,
            LogStreamConsumer logStreamConsumer,
            Gson gson,
            @Value("${app.stream.default-idle-timeout-seconds:300}") int defaultIdleTimeoutSeconds) {
        this.sessionRegistry = sessionRegistry;
        this.logStreamConsumer = logStreamConsumer;
        this.gson = gson;
        this.defaultIdleTimeoutSeconds = defaultIdleTimeoutSeconds;
    }

    /**
     * 以SSE实时推送会话日志，连续 idle_timeout 秒没有新内容时发送超时帧并结束。
     */
    @GetMapping
    public ResponseEntity<StreamingResponseBody> streamLogs(
            @PathVariable String sessionId,
            @RequestParam(name = "idle_timeout", required = false) Integer idleTimeout) {
        int timeoutSeconds = idleTimeout != null ? idleTimeout : defaultIdleTimeoutSeconds;
        if (timeoutSeconds < MIN_IDLE_TIMEOUT_SECONDS || timeoutSeconds > MAX_IDLE_TIMEOUT_SECONDS) {
            return jsonError(HttpStatus.BAD_REQUEST, Map.of("message", String.format(
                    "idle_timeout 必须在 %d 到 %d 秒之间", MIN_IDLE_TIMEOUT_SECONDS, MAX_IDLE_TIMEOUT_SECONDS)));
        }

        LogSink sink;
        try {
            sink = sessionRegistry.sink(sessionId);
        } catch (SessionNotFoundException e) {
            return jsonError(HttpStatus.NOT_FOUND, e.toErrorData());
        }
        if (Files.notExists(sink.getPath())) {
            return jsonError(HttpStatus.NOT_FOUND,
                    SessionNotFoundException.logMissing(sessionId, sink.getPath().toString()).toErrorData());
        }
        sessionRegistry.touch(sessionId);

        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        StreamingResponseBody body = out -> streamTo(sink, timeout, new SseFrameWriter(out, gson));

        var headers = new HttpHeaders();
        headers.setCacheControl("no-cache");
        headers.setConnection("keep-alive");
        return ResponseEntity.ok()
                .headers(headers)
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(body);
    }

    /**
     * 以指定级别向会话日志追加一行。
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> addLog(
            @PathVariable String sessionId, @Valid @RequestBody AddLogRequest request) {
        try {
            sessionRegistry.appendLog(sessionId, LogLevel.parse(request.getLevel()), request.getMessage());
            return ResponseEntity.ok(Map.of("message", "Log added successfully"));
        } catch (SessionNotFoundException e) {
            return SessionController.notFound(sessionId);
        } catch (LogResourceException e) {
            log.error("向会话 {} 追加日志时出错", sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.toErrorData());
        }
    }

    /**
     * 流式接口的返回类型固定为 StreamingResponseBody，错误响应也以同样方式写出JSON。
     */
    private ResponseEntity<StreamingResponseBody> jsonError(HttpStatus status, Map<String, Object> error) {
        byte[] payload = gson.toJson(error).getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(out -> out.write(payload));
    }

    private void streamTo(LogSink sink, Duration timeout, SseFrameWriter writer) {
        String sessionId = sink.getSessionId();
        try {
            LogStreamConsumer.EndReason reason = logStreamConsumer.stream(sink, timeout, writer);
            log.info("会话 {} 的日志流已结束: {}", sessionId, reason);
        } catch (SessionNotFoundException e) {
            // 响应头已发送，只能通过错误帧告知客户端
            log.warn("会话 {} 的日志流中止: {}", sessionId, e.getMessage());
        } catch (LogResourceException e) {
            log.error("会话 {} 的日志流因读取错误中止", sessionId, e);
        } catch (IOException e) {
            log.info("会话 {} 的日志流客户端已断开: {}", sessionId, e.getMessage());
        }
    }
}
