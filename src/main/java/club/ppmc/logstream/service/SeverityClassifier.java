/**
 * SeverityClassifier.java
 *
 * 根据固定阈值对一次采样进行确定性分级。
 * 内存和负载分别判定，取两者中更严重的级别：
 * 内存 >95% 为 CRITICAL，>90% 为 ERROR；load1 >8 为 CRITICAL，>4 为 ERROR；
 * 内存 >80%、load1 >2 或 CPU >50% 为 WARNING；其余为 INFO。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.model.LogLevel;
import club.ppmc.logstream.model.SystemMetrics;

public final class SeverityClassifier {

    static final double RAM_CRITICAL = 95.0;
    static final double RAM_ERROR = 90.0;
    static final double RAM_WARNING = 80.0;
    static final double LOAD_CRITICAL = 8.0;
    static final double LOAD_ERROR = 4.0;
    static final double LOAD_WARNING = 2.0;
    static final double CPU_WARNING = 50.0;

    private SeverityClassifier() {}

    public static LogLevel classify(SystemMetrics metrics) {
        double ram = metrics.ramPercent();
        double load1 = metrics.load1OrZero();

        LogLevel byMemory;
        if (ram > RAM_CRITICAL) {
            byMemory = LogLevel.CRITICAL;
        } else if (ram > RAM_ERROR) {
            byMemory = LogLevel.ERROR;
        } else {
            byMemory = LogLevel.INFO;
        }

        LogLevel byLoad;
        if (load1 > LOAD_CRITICAL) {
            byLoad = LogLevel.CRITICAL;
        } else if (load1 > LOAD_ERROR) {
            byLoad = LogLevel.ERROR;
        } else {
            byLoad = LogLevel.INFO;
        }

        LogLevel worst = byMemory.isAtLeast(byLoad) ? byMemory : byLoad;
        if (worst != LogLevel.INFO) {
            return worst;
        }
        if (ram > RAM_WARNING || load1 > LOAD_WARNING || metrics.cpuPercent() > CPU_WARNING) {
            return LogLevel.WARNING;
        }
        return LogLevel.INFO;
    }
}
