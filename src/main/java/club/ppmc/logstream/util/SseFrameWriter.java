/**
 * SseFrameWriter.java
 *
 * 把 StreamEvent 编码为 Server-Sent Events 帧并写入输出流。
 * 每个事件的数据都是一个JSON字符串，帧格式为 {@code data: <JSON>\n\n}，
 * 这样多行内容或特殊字符都不会破坏SSE的分帧。每写一帧立即 flush。
 */
package club.ppmc.logstream.util;

import club.ppmc.logstream.model.StreamEvent;
import club.ppmc.logstream.service.LogStreamConsumer;
import com.google.gson.Gson;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public class SseFrameWriter implements LogStreamConsumer.EventSink {

    private final OutputStream out;
    private final Gson gson;

    public SseFrameWriter(OutputStream out, Gson gson) {
        this.out = out;
        this.gson = gson;
    }

    public static String frame(Gson gson, String data) {
        return "data: " + gson.toJson(data) + "\n\n";
    }

    @Override
    public void accept(StreamEvent event) throws IOException {
        out.write(frame(gson, event.data()).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
