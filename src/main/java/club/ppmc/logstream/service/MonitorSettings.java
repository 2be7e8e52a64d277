/**
 * MonitorSettings.java
 *
 * SystemMonitor 的时间参数。
 *
 * @param jitter    每次休眠在间隔基础上随机增减的最大幅度。
 * @param stopGrace stop() 等待循环退出的最长时间。
 */
package club.ppmc.logstream.service;

import java.time.Duration;

public record MonitorSettings(Duration jitter, Duration stopGrace) {

    public static MonitorSettings defaults() {
        return new MonitorSettings(Duration.ofMillis(500), Duration.ofSeconds(2));
    }
}
