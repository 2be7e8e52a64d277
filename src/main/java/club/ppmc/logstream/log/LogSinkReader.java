/**
 * LogSinkReader.java
 *
 * 一个跟随 (tail) 日志文件的非阻塞读取者。
 * 它记录自己的字节位置，每次 poll 只读取上次之后新增的完整行；文件末尾不完整的行会被暂存，
 * 直到写入者补上换行符。若文件被清空（长度小于当前位置），读取位置回到开头。
 */
package club.ppmc.logstream.log;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

public class LogSinkReader implements Closeable {

    private static final int CHUNK_SIZE = 8192;

    private final FileChannel channel;
    private final ByteBuffer buffer = ByteBuffer.allocate(CHUNK_SIZE);
    private final ByteArrayOutputStream partialLine = new ByteArrayOutputStream();
    private final Deque<String> completedLines = new ArrayDeque<>();
    private long position;

    LogSinkReader(Path path) throws IOException {
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
    }

    /**
     * 取下一行（不含行尾换行符）。没有新的完整行时立即返回空，不会阻塞等待。
     */
    public Optional<String> poll() throws IOException {
        if (completedLines.isEmpty()) {
            readAvailable();
        }
        return Optional.ofNullable(completedLines.pollFirst());
    }

    public long position() {
        return position;
    }

    private void readAvailable() throws IOException {
        long size = channel.size();
        if (size < position) {
            // 文件被清空
            position = 0;
            partialLine.reset();
        }
        while (position < size) {
            buffer.clear();
            int read = channel.read(buffer, position);
            if (read <= 0) {
                break;
            }
            position += read;
            buffer.flip();
            while (buffer.hasRemaining()) {
                byte b = buffer.get();
                if (b == '\n') {
                    completedLines.addLast(takePartialLine());
                } else {
                    partialLine.write(b);
                }
            }
        }
    }

    private String takePartialLine() {
        String line = partialLine.toString(StandardCharsets.UTF_8);
        partialLine.reset();
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
