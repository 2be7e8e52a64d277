/**
 * StreamEvent.java
 *
 * LogStreamConsumer 产出的一个事件。
 * DATA 是日志行本身；TIMEOUT 和 ERROR 是流结束前的最后一帧，每个流最多出现一次。
 */
package club.ppmc.logstream.model;

public record StreamEvent(Type type, String data) {

    public enum Type {
        DATA,
        TIMEOUT,
        ERROR
    }

    public static StreamEvent data(String line) {
        return new StreamEvent(Type.DATA, line);
    }

    public static StreamEvent timeout(String message) {
        return new StreamEvent(Type.TIMEOUT, message);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(Type.ERROR, message);
    }
}
