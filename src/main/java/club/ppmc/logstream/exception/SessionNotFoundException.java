/**
 * SessionNotFoundException.java
 *
 * 表示请求的会话或其日志文件不存在。
 * 只有要求目标必须存在的操作（删除会话、读取日志流、追加日志等）才会抛出此异常，
 * Controller 层将其转换为 404 响应。
 */
package club.ppmc.logstream.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class SessionNotFoundException extends RuntimeException {

    /** 缺失的会话ID。 */
    private final String sessionId;

    /** 缺失的是会话本身 ("session") 还是其日志文件 ("log")。 */
    private final String resource;

    public SessionNotFoundException(String sessionId) {
        this(sessionId, "session", "Session not found");
    }

    public SessionNotFoundException(String sessionId, String resource, String message) {
        super(message);
        this.sessionId = sessionId;
        this.resource = resource;
    }

    public static SessionNotFoundException logMissing(String sessionId, String path) {
        return new SessionNotFoundException(sessionId, "log", "Log file not found: " + path);
    }

    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "NOT_FOUND",
                "resource", getResource(),
                "detail", getMessage(),
                "session_id", getSessionId() != null ? getSessionId() : ""
        );
    }
}
