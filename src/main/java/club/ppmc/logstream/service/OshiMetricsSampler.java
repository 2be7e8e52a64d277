/**
 * OshiMetricsSampler.java
 *
 * 基于 Oshi 库的跨平台系统指标采样器。
 * 采集系统内存使用率、负载平均值、本进程的CPU与常驻内存，以及内存占用最高的5个进程。
 * 多个会话的监控器共享同一个实例，因此 sample() 是同步方法：进程CPU使用率依赖上一次快照。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.exception.SamplingException;
import club.ppmc.logstream.model.ProcessUsage;
import club.ppmc.logstream.model.SystemMetrics;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

@Slf4j
public class OshiMetricsSampler implements MetricsSampler {

    private final HardwareAbstractionLayer hardware;
    private final OperatingSystem operatingSystem;
    private final CentralProcessor processor;

    // 用于计算CPU使用率的上一次快照
    private long[] prevSystemTicks;
    private OSProcess prevProcessSnapshot;

    public OshiMetricsSampler() {
        this(new SystemInfo());
    }

    public OshiMetricsSampler(SystemInfo systemInfo) {
        this.hardware = systemInfo.getHardware();
        this.operatingSystem = systemInfo.getOperatingSystem();
        this.processor = hardware.getProcessor();
        this.prevSystemTicks = processor.getSystemCpuLoadTicks();
        this.prevProcessSnapshot = operatingSystem.getProcess(operatingSystem.getProcessId());
        log.info("系统指标采样器已初始化，逻辑处理器数: {}", processor.getLogicalProcessorCount());
    }

    @Override
    public synchronized SystemMetrics sample() {
        try {
            GlobalMemory memory = hardware.getMemory();
            long totalMemory = memory.getTotal();
            double ramPercent = totalMemory > 0
                    ? (totalMemory - memory.getAvailable()) * 100.0 / totalMemory
                    : 0.0;

            double systemCpuPercent = processor.getSystemCpuLoadBetweenTicks(prevSystemTicks) * 100.0;
            this.prevSystemTicks = processor.getSystemCpuLoadTicks();

            // Windows 等平台没有负载平均值，返回负数
            double[] loadAverage = processor.getSystemLoadAverage(3);
            Double load1 = loadAverage[0] >= 0 ? loadAverage[0] : systemCpuPercent;
            Double load5 = loadAverage[1] >= 0 ? loadAverage[1] : null;
            Double load15 = loadAverage[2] >= 0 ? loadAverage[2] : null;

            OSProcess self = operatingSystem.getProcess(operatingSystem.getProcessId());
            double cpuPercent = 0.0;
            long rss = 0L;
            if (self != null) {
                cpuPercent = self.getProcessCpuLoadBetweenTicks(prevProcessSnapshot) * 100.0;
                rss = self.getResidentSetSize();
                this.prevProcessSnapshot = self;
            }

            return new SystemMetrics(
                    ramPercent, load1, load5, load15, cpuPercent, rss, topProcesses(totalMemory));
        } catch (RuntimeException e) {
            throw new SamplingException("采集系统指标失败: " + e.getMessage(), e);
        }
    }

    private List<ProcessUsage> topProcesses(long totalMemory) {
        if (totalMemory <= 0) {
            return List.of();
        }
        return operatingSystem
                .getProcesses(
                        OperatingSystem.ProcessFiltering.ALL_PROCESSES,
                        OperatingSystem.ProcessSorting.RSS_DESC,
                        SystemMetrics.MAX_TOP_PROCESSES)
                .stream()
                .map(p -> new ProcessUsage(
                        String.format("%s (PID: %d)", p.getName(), p.getProcessID()),
                        p.getResidentSetSize() * 100.0 / totalMemory))
                .collect(Collectors.toList());
    }
}
