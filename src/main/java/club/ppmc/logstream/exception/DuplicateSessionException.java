/**
 * DuplicateSessionException.java
 *
 * 注册一个已存在的会话ID时抛出。
 * 会话ID由服务端随机生成，正常情况下不会出现，属于断言级别的错误。
 */
package club.ppmc.logstream.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class DuplicateSessionException extends RuntimeException {

    private final String sessionId;

    public DuplicateSessionException(String sessionId) {
        super("Session already registered: " + sessionId);
        this.sessionId = sessionId;
    }

    public Map<String, Object> toErrorData() {
        return Map.of("type", "DUPLICATE_SESSION", "detail", getMessage(), "session_id", getSessionId());
    }
}
