/**
 * ProcessUsage.java
 *
 * 单个进程的内存占用，作为 SystemMetrics 中"内存占用排行"的一项。
 */
package club.ppmc.logstream.model;

/**
 * @param name    进程显示名，形如 "java (PID: 1234)"。
 * @param percent 该进程常驻内存占系统总内存的百分比 (0-100)。
 */
public record ProcessUsage(String name, double percent) {}
