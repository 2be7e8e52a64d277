/**
 * LogMessageFactory.java
 *
 * 根据日志级别和采样指标生成监控日志文本。
 * 每个级别先按阈值选择描述真实状况的消息，没有命中阈值时再使用该级别的默认文本。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.model.LogEntry;
import club.ppmc.logstream.model.LogLevel;
import club.ppmc.logstream.model.ProcessUsage;
import club.ppmc.logstream.model.SystemMetrics;
import java.util.List;
import java.util.Locale;
import java.util.Random;

public class LogMessageFactory {

    static final String SYSTEM_STATS_HEADER = "SYSTEM STATS:";

    private static final List<String> ERROR_MESSAGES = List.of(
            "Failed to process request due to resource limitations",
            "Background task terminated unexpectedly",
            "Database connection timeout",
            "Cache synchronization failed");

    private static final List<String> CRITICAL_MESSAGES = List.of(
            "Application service crashed",
            "Database connection pool exhausted",
            "Disk I/O error detected",
            "Network connectivity lost");

    private final Random random;

    public LogMessageFactory(Random random) {
        this.random = random;
    }

    public LogEntry compose(LogLevel level, SystemMetrics metrics) {
        String message = switch (level) {
            case DEBUG, INFO -> systemReport(metrics);
            case WARNING -> warningMessage(metrics);
            case ERROR -> errorMessage(metrics);
            case CRITICAL -> criticalMessage(metrics);
        };
        return new LogEntry(level == LogLevel.DEBUG ? LogLevel.INFO : level, message);
    }

    String systemReport(SystemMetrics m) {
        var report = new StringBuilder(SYSTEM_STATS_HEADER)
                .append(format("%n  RAM: %.1f%%", m.ramPercent()))
                .append(format("%n  Load Average: %.2f (1m), %s (5m), %s (15m)",
                        m.load1OrZero(), loadText(m.load5()), loadText(m.load15())))
                .append(format("%n  Process: %.2f MB, CPU: %.1f%%",
                        m.processRssBytes() / 1024.0 / 1024.0, m.cpuPercent()));

        List<ProcessUsage> top = m.topProcesses();
        if (!top.isEmpty()) {
            report.append(format("%n  Top Memory Usage:"));
            for (int i = 0; i < top.size(); i++) {
                ProcessUsage p = top.get(i);
                report.append(format("%n    %d. %s: %.2f%%", i + 1, p.name(), p.percent()));
            }
        }
        return report.toString();
    }

    String warningMessage(SystemMetrics m) {
        if (m.ramPercent() > SeverityClassifier.RAM_WARNING) {
            return format("High memory usage detected: %.1f%%", m.ramPercent());
        } else if (m.load1OrZero() > SeverityClassifier.LOAD_WARNING) {
            return format("High system load detected: %.2f", m.load1OrZero());
        } else if (m.cpuPercent() > SeverityClassifier.CPU_WARNING) {
            return format("High CPU usage detected: %.1f%%", m.cpuPercent());
        }
        return format("Potential resource contention.%n  RAM: %.1f%%%n  Load: %.2f",
                m.ramPercent(), m.load1OrZero());
    }

    String errorMessage(SystemMetrics m) {
        if (m.ramPercent() > SeverityClassifier.RAM_ERROR) {
            return format("Critical memory pressure: %.1f%%", m.ramPercent());
        } else if (m.load1OrZero() > SeverityClassifier.LOAD_ERROR) {
            return format("System overloaded: %.2f", m.load1OrZero());
        }
        return pick(ERROR_MESSAGES);
    }

    String criticalMessage(SystemMetrics m) {
        if (m.ramPercent() > SeverityClassifier.RAM_CRITICAL) {
            return format("System memory exhausted: %.1f%%", m.ramPercent());
        } else if (m.load1OrZero() > SeverityClassifier.LOAD_CRITICAL) {
            return format("System severely overloaded: %.2f", m.load1OrZero());
        }
        return pick(CRITICAL_MESSAGES);
    }

    private String pick(List<String> messages) {
        synchronized (random) {
            return messages.get(random.nextInt(messages.size()));
        }
    }

    private static String loadText(Double load) {
        return load != null ? format("%.2f", load) : "N/A";
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
