/**
 * ServerController.java
 *
 * 提供服务根路径的欢迎信息，以及请求优雅关闭服务的接口。
 */
package club.ppmc.logstream.controller;

import club.ppmc.logstream.listener.ShutdownCoordinator;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ServerController {

    private final ShutdownCoordinator shutdownCoordinator;

    public ServerController(ShutdownCoordinator shutdownCoordinator) {
        this.shutdownCoordinator = shutdownCoordinator;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "Welcome to the Log Stream API"));
    }

    /**
     * 请求优雅关闭：设置关闭信号，所有日志流随即结束，随后关闭应用。
     */
    @PostMapping("/shutdown")
    public ResponseEntity<Map<String, String>> shutdown() {
        shutdownCoordinator.requestShutdown();
        return ResponseEntity.ok(Map.of("message", "Shutdown initiated"));
    }
}
