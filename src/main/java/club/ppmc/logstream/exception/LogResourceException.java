/**
 * LogResourceException.java
 *
 * 读写会话日志文件时发生的I/O故障。
 * 它只会终止触发它的那一个操作（一次追加或一个日志流），不会影响注册表或其他会话。
 */
package club.ppmc.logstream.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class LogResourceException extends RuntimeException {

    private final String sessionId;

    public LogResourceException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "RESOURCE_FAULT",
                "detail", getMessage(),
                "session_id", getSessionId() != null ? getSessionId() : ""
        );
    }
}
