/**
 * AddLogRequest.java
 *
 * 向会话日志追加一行时的请求体。
 */
package club.ppmc.logstream.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AddLogRequest {

    @NotBlank(message = "日志内容不能为空")
    private String message;

    /** 级别标签，DEBUG/INFO/WARNING/ERROR/CRITICAL，缺省为 INFO。 */
    private String level = "INFO";
}
