/**
 * ShutdownReport.java
 *
 * SessionRegistry.shutdownAll() 的结果统计，同时作为 /api/clear-logs 的响应详情。
 */
package club.ppmc.logstream.model;

import com.google.gson.annotations.SerializedName;

public record ShutdownReport(
        @SerializedName("monitors_stopped") int monitorsStopped,
        @SerializedName("sessions_cleared") int sessionsCleared,
        @SerializedName("logs_deleted") int logsDeleted
) {}
