/**
 * MetricsSampler.java
 *
 * 系统指标采样的抽象。生产环境使用基于 Oshi 的 OshiMetricsSampler，
 * 测试中用固定数值的实现替换，以获得确定的日志输出。
 */
package club.ppmc.logstream.service;

import club.ppmc.logstream.exception.SamplingException;
import club.ppmc.logstream.model.SystemMetrics;

@FunctionalInterface
public interface MetricsSampler {

    /**
     * 采集一次系统指标。
     *
     * @throws SamplingException 采样失败时抛出。
     */
    SystemMetrics sample();
}
