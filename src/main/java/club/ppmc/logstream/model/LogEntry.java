/**
 * LogEntry.java
 *
 * 一条待写入会话日志的消息：级别加文本。由 LogMessageFactory 生成。
 */
package club.ppmc.logstream.model;

public record LogEntry(LogLevel level, String message) {}
