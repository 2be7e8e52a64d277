package club.ppmc.logstream.service;

import club.ppmc.logstream.exception.DuplicateSessionException;
import club.ppmc.logstream.exception.SessionNotFoundException;
import club.ppmc.logstream.log.LogSink;
import club.ppmc.logstream.log.LogSinkStore;
import club.ppmc.logstream.model.LogLevel;
import club.ppmc.logstream.model.SessionInfo;
import club.ppmc.logstream.model.ShutdownReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private static final Duration INTERVAL = Duration.ofMillis(100);

    @TempDir Path logsDir;

    private ExecutorService executor;
    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = newRegistry(logsDir);
    }

    @AfterEach
    void tearDown() {
        registry.shutdownAll();
        executor.shutdownNow();
    }

    private SessionRegistry newRegistry(Path dir) {
        var factory = new SystemMonitorFactory(
                FixedMetricsSampler.calm(), executor, new ShutdownSignal(),
                new MonitorSettings(Duration.ZERO, Duration.ofSeconds(2)), new Random(3));
        return new SessionRegistry(new LogSinkStore(dir, clock), factory, clock);
    }

    private long logFileCount() throws Exception {
        try (Stream<Path> files = Files.list(logsDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log")).count();
        }
    }

    @Test
    void session_count_tracks_applied_registers_and_unregisters() {
        var rnd = new Random(11);
        List<String> live = new ArrayList<>();
        int next = 0;
        for (int step = 0; step < 300; step++) {
            if (live.isEmpty() || rnd.nextBoolean()) {
                String id = "s" + next++;
                registry.register(id);
                live.add(id);
            } else if (rnd.nextInt(4) == 0) {
                assertFalse(registry.unregister("absent-" + step));
            } else {
                assertTrue(registry.unregister(live.remove(rnd.nextInt(live.size()))));
            }
            assertEquals(live.size(), registry.sessionCount());
        }
    }

    @Test
    void unregister_of_unknown_session_is_a_no_op() {
        assertFalse(registry.unregister("nobody"));
        assertFalse(registry.unregister("nobody"));
        assertEquals(0, registry.sessionCount());
    }

    @Test
    void duplicate_register_is_rejected() {
        registry.register("s1");
        assertThrows(DuplicateSessionException.class, () -> registry.register("s1"));
        assertEquals(1, registry.sessionCount());
    }

    @Test
    void create_session_writes_creation_line_into_fresh_log() throws Exception {
        String id = registry.createSession();

        LogSink sink = registry.sink(id);
        List<String> lines = Files.readAllLines(sink.getPath());
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).endsWith("INFO - Session created with ID: " + id));

        SessionInfo info = registry.find(id).orElseThrow();
        assertEquals(clock.instant(), info.createdAt());
        assertFalse(info.monitoring());
    }

    @Test
    void unregister_deletes_the_log_artifact() throws Exception {
        registry.register("s1");
        Path log = registry.sink("s1").getPath();
        assertTrue(Files.exists(log));

        assertTrue(registry.unregister("s1"));

        assertFalse(Files.exists(log));
        assertThrows(SessionNotFoundException.class, () -> registry.sink("s1"));
    }

    @Test
    void stop_monitor_without_monitor_returns_false_and_logs_nothing() throws Exception {
        registry.register("s1");
        Path log = registry.sink("s1").getPath();
        long before = Files.size(log);

        assertFalse(registry.stopMonitor("s1"));
        assertFalse(registry.stopMonitor("unknown"));
        assertEquals(before, Files.size(log));
    }

    @Test
    void monitoring_flag_follows_monitor_registration() throws Exception {
        registry.register("s1");

        registry.startMonitoring("s1", INTERVAL);
        assertTrue(registry.find("s1").orElseThrow().monitoring());
        assertEquals(1, registry.activeMonitorCount());

        assertTrue(registry.stopMonitor("s1"));
        assertFalse(registry.find("s1").orElseThrow().monitoring());
        assertEquals(0, registry.activeMonitorCount());

        Path log = registry.sink("s1").getPath();
        long size = Files.size(log);
        Thread.sleep(400);
        assertEquals(size, Files.size(log), "no lines after stop returned");
    }

    @Test
    void restarting_monitoring_replaces_the_old_monitor() {
        registry.register("s1");

        SystemMonitor first = registry.startMonitoring("s1", INTERVAL);
        SystemMonitor second = registry.startMonitoring("s1", INTERVAL);

        assertNotSame(first, second);
        assertFalse(first.isRunning());
        assertTrue(second.isRunning());
        assertEquals(List.of("s1"), registry.monitoredSessionIds());
    }

    @Test
    void attach_replaces_and_stops_existing_monitor() {
        registry.register("s1");
        SystemMonitor old = registry.startMonitoring("s1", INTERVAL);
        var factory = new SystemMonitorFactory(FixedMetricsSampler.calm(), executor, new ShutdownSignal(),
                new MonitorSettings(Duration.ZERO, Duration.ofSeconds(2)), new Random(5));
        SystemMonitor replacement = factory.create(registry.sink("s1"));
        replacement.start(INTERVAL);

        assertTrue(registry.attachMonitor("s1", replacement));

        assertFalse(old.isRunning());
        assertEquals(1, registry.activeMonitorCount());
    }

    @Test
    void attach_to_unknown_session_stops_the_monitor() {
        registry.register("s1");
        var factory = new SystemMonitorFactory(FixedMetricsSampler.calm(), executor, new ShutdownSignal(),
                new MonitorSettings(Duration.ZERO, Duration.ofSeconds(2)), new Random(5));
        SystemMonitor orphan = factory.create(registry.sink("s1"));
        orphan.start(INTERVAL);

        assertFalse(registry.attachMonitor("ghost", orphan));
        assertFalse(orphan.isRunning());
        assertEquals(0, registry.activeMonitorCount());
    }

    @Test
    void start_monitoring_unknown_session_is_not_found() {
        assertThrows(SessionNotFoundException.class, () -> registry.startMonitoring("ghost", INTERVAL));
        assertEquals(0, registry.activeMonitorCount());
    }

    @Test
    void unregister_stops_attached_monitor() {
        registry.register("s1");
        SystemMonitor monitor = registry.startMonitoring("s1", INTERVAL);

        registry.unregister("s1");

        assertFalse(monitor.isRunning());
        assertEquals(0, registry.activeMonitorCount());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 1000})
    void shutdown_all_empties_everything_and_deletes_all_logs(int sessions) throws Exception {
        int monitored = Math.min(sessions, 5);
        for (int i = 0; i < sessions; i++) {
            registry.register("s" + i);
        }
        for (int i = 0; i < monitored; i++) {
            registry.startMonitoring("s" + i, INTERVAL);
        }
        assertEquals(sessions, logFileCount());

        ShutdownReport report = registry.shutdownAll();

        assertEquals(new ShutdownReport(monitored, sessions, sessions), report);
        assertEquals(0, registry.sessionCount());
        assertEquals(0, registry.activeMonitorCount());
        assertTrue(registry.snapshotSessions().isEmpty());
        assertEquals(0, logFileCount());
    }

    @Test
    void registry_is_usable_again_after_shutdown_all() {
        registry.register("s1");
        registry.shutdownAll();

        registry.register("s1");
        assertEquals(1, registry.sessionCount());
    }

    @Test
    void touch_updates_last_activity_and_ignores_unknown_ids() {
        registry.register("s1");
        Instant created = clock.instant();
        clock.advance(Duration.ofMinutes(5));

        assertTrue(registry.touch("s1"));
        assertFalse(registry.touch("ghost"));

        SessionInfo info = registry.find("s1").orElseThrow();
        assertEquals(created, info.createdAt());
        assertEquals(created.plus(Duration.ofMinutes(5)), info.lastActivity());
    }

    @Test
    void snapshot_is_detached_and_read_only() {
        registry.register("s1");
        Map<String, SessionInfo> snapshot = registry.snapshotSessions();

        registry.register("s2");
        registry.touch("s1");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("s1"));
    }

    @Test
    void append_log_writes_level_and_touches_session() throws Exception {
        registry.register("s1");
        clock.advance(Duration.ofSeconds(30));

        registry.appendLog("s1", LogLevel.ERROR, "boom");

        List<String> lines = Files.readAllLines(registry.sink("s1").getPath());
        assertTrue(lines.get(lines.size() - 1).endsWith("ERROR - boom"));
        assertEquals(clock.instant(), registry.find("s1").orElseThrow().lastActivity());
        assertThrows(SessionNotFoundException.class, () -> registry.appendLog("ghost", LogLevel.INFO, "x"));
    }

    @Test
    void independent_registries_do_not_share_state(@TempDir Path otherDir) {
        SessionRegistry other = newRegistry(otherDir);
        registry.register("s1");

        assertFalse(other.contains("s1"));
        other.register("s1");
        assertEquals(1, registry.sessionCount());
        assertEquals(1, other.sessionCount());
        other.shutdownAll();
    }

    @Test
    void concurrent_create_and_delete_leave_no_residue() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            results.add(pool.submit(() -> {
                go.await();
                int removed = 0;
                for (int i = 0; i < perThread; i++) {
                    String id = registry.createSession();
                    registry.touch(id);
                    if (registry.unregister(id)) {
                        removed++;
                    }
                }
                return removed;
            }));
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));
        for (Future<Integer> result : results) {
            assertEquals(perThread, result.get());
        }

        assertEquals(0, registry.sessionCount());
        assertEquals(0, logFileCount());
    }

    @Test
    void shutdown_all_racing_with_registration_leaves_consistent_state() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        for (int t = 0; t < 3; t++) {
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < 100; i++) {
                    registry.createSession();
                }
                return null;
            });
        }
        pool.submit(() -> {
            go.await();
            for (int i = 0; i < 10; i++) {
                registry.shutdownAll();
            }
            return null;
        });
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));

        // 留下的会话与日志文件一一对应
        assertEquals(registry.sessionCount(), logFileCount());
        for (String id : registry.snapshotSessions().keySet()) {
            assertTrue(Files.exists(registry.sink(id).getPath()));
        }
    }
}
