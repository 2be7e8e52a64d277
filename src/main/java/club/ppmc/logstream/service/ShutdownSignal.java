/**
 * ShutdownSignal.java
 *
 * 进程级的单向关闭信号。一旦触发便不会复位。
 * 所有长时间运行的循环（监控循环、日志流轮询）在每次迭代边界检查它并尽快退出。
 */
package club.ppmc.logstream.service;

import java.util.concurrent.atomic.AtomicBoolean;

public class ShutdownSignal {

    private final AtomicBoolean triggered = new AtomicBoolean(false);

    /**
     * 触发关闭信号。
     *
     * @return 本次调用是否是第一次触发。
     */
    public boolean trigger() {
        return triggered.compareAndSet(false, true);
    }

    public boolean isSet() {
        return triggered.get();
    }
}
