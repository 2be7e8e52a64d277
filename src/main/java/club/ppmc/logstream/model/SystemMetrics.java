/**
 * SystemMetrics.java
 *
 * 一次系统指标采样的不可变快照，由 MetricsSampler 产生，供 SystemMonitor 分级和生成日志文本。
 * 负载平均值在部分平台上不可用，此时对应字段为 null。
 */
package club.ppmc.logstream.model;

import java.util.List;

/**
 * 封装一次采样得到的系统指标。
 *
 * @param ramPercent      系统内存使用率 (0.0 到 100.0)。
 * @param load1           1分钟负载平均值，不可用时为 null。
 * @param load5           5分钟负载平均值，不可用时为 null。
 * @param load15          15分钟负载平均值，不可用时为 null。
 * @param cpuPercent      当前进程的CPU使用率 (百分比)。
 * @param processRssBytes 当前进程的常驻内存 (字节)。
 * @param topProcesses    按内存占用降序排列的进程，最多5项。
 */
public record SystemMetrics(
        double ramPercent,
        Double load1,
        Double load5,
        Double load15,
        double cpuPercent,
        long processRssBytes,
        List<ProcessUsage> topProcesses
) {

    public static final int MAX_TOP_PROCESSES = 5;

    public SystemMetrics {
        topProcesses = topProcesses == null
                ? List.of()
                : List.copyOf(topProcesses.subList(0, Math.min(MAX_TOP_PROCESSES, topProcesses.size())));
    }

    /** 分级规则中缺失的 load1 按 0 处理。 */
    public double load1OrZero() {
        return load1 != null ? load1 : 0.0;
    }
}
