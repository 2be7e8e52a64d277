/**
 * SamplingException.java
 *
 * 系统指标采样失败。由 MetricsSampler 抛出，在 SystemMonitor 的循环内部被捕获并记录，
 * 循环在退避一个完整间隔后继续运行。
 */
package club.ppmc.logstream.exception;

public class SamplingException extends RuntimeException {

    public SamplingException(String message) {
        super(message);
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
