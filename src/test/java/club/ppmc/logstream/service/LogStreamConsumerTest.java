package club.ppmc.logstream.service;

import club.ppmc.logstream.exception.SessionNotFoundException;
import club.ppmc.logstream.log.LogSink;
import club.ppmc.logstream.log.LogSinkStore;
import club.ppmc.logstream.model.LogLevel;
import club.ppmc.logstream.model.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LogStreamConsumerTest {

    private static final Duration POLL = Duration.ofMillis(100);

    @TempDir Path logsDir;

    private ShutdownSignal signal;
    private LogStreamConsumer consumer;
    private LogSink sink;

    @BeforeEach
    void setUp() {
        signal = new ShutdownSignal();
        consumer = new LogStreamConsumer(signal, POLL);
        sink = new LogSinkStore(logsDir, Clock.systemUTC()).obtain("s1", true);
    }

    private static List<StreamEvent> ofType(List<StreamEvent> events, StreamEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).collect(Collectors.toList());
    }

    @Test
    void emits_existing_lines_then_one_timeout_after_idle_period() throws Exception {
        sink.info("one");
        sink.info("two");
        List<StreamEvent> events = new CopyOnWriteArrayList<>();

        long start = System.nanoTime();
        LogStreamConsumer.EndReason reason = consumer.stream(sink, Duration.ofSeconds(1), events::add);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(LogStreamConsumer.EndReason.IDLE_TIMEOUT, reason);
        assertEquals(3, events.size());
        assertTrue(events.get(0).data().endsWith("INFO - one"));
        assertTrue(events.get(1).data().endsWith("INFO - two"));
        assertEquals(StreamEvent.timeout(LogStreamConsumer.TIMEOUT_MESSAGE), events.get(2));
        assertTrue(elapsedMillis >= 1000 && elapsedMillis < 1000 + 3 * POLL.toMillis() + 500,
                "timed out after " + elapsedMillis + "ms");
    }

    @Test
    void follows_lines_written_after_the_stream_started() throws Exception {
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        CompletableFuture<LogStreamConsumer.EndReason> streaming = CompletableFuture.supplyAsync(() -> {
            try {
                return consumer.stream(sink, Duration.ofSeconds(1), events::add);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });

        for (int i = 0; i < 5; i++) {
            Thread.sleep(150);
            sink.info("late-" + i);
        }

        assertEquals(LogStreamConsumer.EndReason.IDLE_TIMEOUT, streaming.get(5, TimeUnit.SECONDS));
        List<StreamEvent> data = ofType(events, StreamEvent.Type.DATA);
        assertEquals(5, data.size());
        for (int i = 0; i < 5; i++) {
            assertTrue(data.get(i).data().endsWith("late-" + i));
        }
        assertEquals(1, ofType(events, StreamEvent.Type.TIMEOUT).size());
    }

    @Test
    void activity_resets_the_idle_timer() throws Exception {
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        CompletableFuture<LogStreamConsumer.EndReason> streaming = CompletableFuture.supplyAsync(() -> {
            try {
                return consumer.stream(sink, Duration.ofMillis(600), events::add);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });

        // 总时长远超空闲超时，但每次间隔都小于它
        for (int i = 0; i < 6; i++) {
            Thread.sleep(300);
            assertFalse(streaming.isDone(), "stream ended while lines were still arriving");
            sink.info("tick-" + i);
        }

        streaming.get(5, TimeUnit.SECONDS);
        assertEquals(6, ofType(events, StreamEvent.Type.DATA).size());
    }

    @Test
    void shutdown_signal_ends_stream_quietly() throws Exception {
        sink.info("only line");
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        CompletableFuture<LogStreamConsumer.EndReason> streaming = CompletableFuture.supplyAsync(() -> {
            try {
                return consumer.stream(sink, Duration.ofMinutes(5), events::add);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(300);
        signal.trigger();

        assertEquals(LogStreamConsumer.EndReason.SHUTDOWN, streaming.get(1, TimeUnit.SECONDS));
        assertEquals(1, events.size());
        assertEquals(StreamEvent.Type.DATA, events.get(0).type());
    }

    @Test
    void missing_log_emits_one_error_frame_and_raises_not_found() throws Exception {
        Files.delete(sink.getPath());
        List<StreamEvent> events = new CopyOnWriteArrayList<>();

        assertThrows(SessionNotFoundException.class,
                () -> consumer.stream(sink, Duration.ofSeconds(1), events::add));

        assertEquals(1, events.size());
        assertEquals(StreamEvent.Type.ERROR, events.get(0).type());
        assertTrue(events.get(0).data().startsWith("Log file not found: "));
    }

    @Test
    void client_write_failure_propagates_and_ends_stream() {
        sink.info("line");
        LogStreamConsumer.EventSink broken = event -> {
            throw new IOException("Broken pipe");
        };

        IOException e = assertThrows(IOException.class, () -> consumer.stream(sink, Duration.ofSeconds(1), broken));
        assertEquals("Broken pipe", e.getMessage());
    }

    @Test
    void reader_keeps_append_order_under_concurrent_writes() throws Exception {
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        CompletableFuture<LogStreamConsumer.EndReason> streaming = CompletableFuture.supplyAsync(() -> {
            try {
                return consumer.stream(sink, Duration.ofSeconds(1), events::add);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        for (int i = 0; i < 500; i++) {
            sink.info("seq-" + i);
        }

        streaming.get(10, TimeUnit.SECONDS);
        List<StreamEvent> data = ofType(events, StreamEvent.Type.DATA);
        assertEquals(500, data.size());
        for (int i = 0; i < 500; i++) {
            assertTrue(data.get(i).data().endsWith(" - seq-" + i), data.get(i).data());
        }
    }

    @Test
    void stream_survives_session_log_being_released() throws Exception {
        var store = new LogSinkStore(logsDir.resolve("other"), Clock.systemUTC());
        LogSink released = store.obtain("s2", true);
        released.info("before delete");
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        CompletableFuture<LogStreamConsumer.EndReason> streaming = CompletableFuture.supplyAsync(() -> {
            try {
                return consumer.stream(released, Duration.ofSeconds(1), events::add);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(200);
        store.release("s2");
        assertFalse(released.append(LogLevel.INFO, "after delete"));

        assertEquals(LogStreamConsumer.EndReason.IDLE_TIMEOUT, streaming.get(5, TimeUnit.SECONDS));
        assertEquals(1, ofType(events, StreamEvent.Type.DATA).size());
        assertEquals(1, ofType(events, StreamEvent.Type.TIMEOUT).size());
    }
}
