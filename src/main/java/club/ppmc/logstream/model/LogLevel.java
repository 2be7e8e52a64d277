/**
 * LogLevel.java
 *
 * 会话日志行的严重级别。
 * 数值越大越严重，SystemMonitor 据此在"随机选出的级别"与"阈值判定出的告警级别"之间取较严重者。
 */
package club.ppmc.logstream.model;

import java.util.Locale;

public enum LogLevel {
    DEBUG(10),
    INFO(20),
    WARNING(30),
    ERROR(40),
    CRITICAL(50);

    private final int severity;

    LogLevel(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public boolean isAtLeast(LogLevel other) {
        return this.severity >= other.severity;
    }

    /**
     * 解析调用方提供的级别标签，大小写不敏感。
     * 无法识别或为空时退回 INFO，与添加日志接口的约定一致。
     */
    public static LogLevel parse(String tag) {
        if (tag == null || tag.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }
}
