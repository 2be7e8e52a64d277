/**
 * LogStreamBackendApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个应用程序。会话注册表、监控线程池等核心对象在 AppConfig 中装配，
 * 进程关闭时的清理由 ShutdownCoordinator 负责。
 */
package club.ppmc.logstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogStreamBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogStreamBackendApplication.class, args);
    }
}
