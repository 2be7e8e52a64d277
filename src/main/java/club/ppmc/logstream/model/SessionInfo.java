/**
 * SessionInfo.java
 *
 * 会话元数据的只读快照，由 SessionRegistry.snapshotSessions() 等方法返回给外部调用方。
 * 注册表内部持有可变状态，对外只暴露这个不可变记录。
 */
package club.ppmc.logstream.model;

import java.time.Instant;

/**
 * @param sessionId    会话标识 (UUID 字符串)。
 * @param createdAt    创建时间。
 * @param lastActivity 最近一次活动时间。
 * @param monitoring   当前是否有活动的监控器。
 */
public record SessionInfo(String sessionId, Instant createdAt, Instant lastActivity, boolean monitoring) {}
