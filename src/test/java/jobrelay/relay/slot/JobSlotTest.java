package jobrelay.relay.slot;

import io.netty.channel.embedded.EmbeddedChannel;
import jobrelay.relay.hub.RecordingSubscriber;
import jobrelay.relay.model.EventType;
import jobrelay.relay.model.JobEvent;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.model.SlotState;
import jobrelay.relay.notify.Notification;
import jobrelay.relay.process.JobCommand;
import jobrelay.relay.scheduler.Scheduler;
import jobrelay.relay.server.SseSubscriber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobSlotTest {

    private static final JobCommand COMMAND = JobCommand.of("fake-program");

    private FakeProcessLauncher launcher;
    private Scheduler scheduler;
    private List<Notification> notifications;
    private List<String> notifiedUsers;
    private AtomicInteger completions;

    @BeforeEach
    void setUp() {
        launcher = new FakeProcessLauncher();
        scheduler = new Scheduler();
        notifications = new CopyOnWriteArrayList<>();
        notifiedUsers = new CopyOnWriteArrayList<>();
        completions = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private JobSlot newSlot(JobKind kind) {
        return newSlot(kind, Duration.ofSeconds(10));
    }

    private JobSlot newSlot(JobKind kind, Duration killGrace) {
        return new JobSlot(kind, (user, n) -> {
            notifiedUsers.add(user);
            notifications.add(n);
        }, scheduler, killGrace, slot -> completions.incrementAndGet());
    }

    @Test
    @DisplayName("Concurrent starts spawn exactly one program and all callers see the same stream")
    void concurrentStartsAreSingleFlight() throws Exception {
        launcher.launchDelayMillis = 50;
        JobSlot slot = newSlot(JobKind.VIDEO_REPROCESS);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<RecordingSubscriber> subscribers = new ArrayList<>();
        List<Future<StartOutcome>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                RecordingSubscriber sub = new RecordingSubscriber("client-" + i);
                subscribers.add(sub);
                outcomes.add(pool.submit(() -> {
                    go.await();
                    return slot.start(launcher, COMMAND, sub, null);
                }));
            }
            go.countDown();

            int started = 0;
            for (Future<StartOutcome> outcome : outcomes) {
                StartOutcome o = outcome.get(5, TimeUnit.SECONDS);
                if (o == StartOutcome.STARTED) {
                    started++;
                } else {
                    assertEquals(StartOutcome.ATTACHED, o);
                }
            }
            assertEquals(1, started);
            assertEquals(1, launcher.launches.get());
        } finally {
            pool.shutdownNow();
        }

        launcher.last().emit(JobEvent.progress(1, 2, 50, "[1/2] (50%)"));
        launcher.last().exit(0);

        for (RecordingSubscriber sub : subscribers) {
            assertEquals(List.of(EventType.PROGRESS, EventType.COMPLETE), sub.types(), sub.id());
            assertTrue(sub.isClosed());
        }
    }

    @Test
    void successfulExitPublishesCompleteWithElapsedTime() {
        JobSlot slot = newSlot(JobKind.AI_TITLES);
        RecordingSubscriber sub = new RecordingSubscriber("a");

        assertEquals(StartOutcome.STARTED, slot.start(launcher, COMMAND, sub, "user-1"));
        assertEquals(SlotState.RUNNING, slot.state());

        launcher.last().emit(JobEvent.stdout("working"));
        launcher.last().exit(0);

        JobEvent last = sub.events().get(sub.events().size() - 1);
        assertEquals(EventType.COMPLETE, last.type());
        assertEquals(0, last.exitCode());
        assertTrue(last.message().matches("AI title generation complete \\(\\d+s\\)"), last.message());
        assertEquals(SlotState.COMPLETE, slot.state());
        assertEquals(1, completions.get());

        assertEquals(List.of("user-1"), notifiedUsers);
        Notification n = notifications.get(0);
        assertEquals("AI Titles Complete", n.title());
        assertEquals("ai-titles", n.tag());
        assertFalse(n.requireInteraction());
    }

    @Test
    void nonZeroExitPublishesFailure() {
        JobSlot slot = newSlot(JobKind.VIDEO_REPROCESS);
        RecordingSubscriber sub = new RecordingSubscriber("a");
        slot.start(launcher, COMMAND, sub, "user-1");

        launcher.last().exit(7);

        JobEvent last = sub.events().get(0);
        assertEquals(EventType.COMPLETE, last.type());
        assertEquals(7, last.exitCode());
        assertEquals("Video reprocessing failed with code 7", last.message());

        SlotStatus status = slot.snapshot();
        assertEquals(7, status.exitCode());
        assertFalse(status.cancelled());
        assertNotNull(status.finishedAt());

        assertEquals("Video Reprocessing Failed", notifications.get(0).title());
        assertEquals("video-reprocessing", notifications.get(0).tag());
    }

    @Test
    void noNotificationWithoutUser() {
        JobSlot slot = newSlot(JobKind.VIDEO_OPTIMIZE);
        slot.start(launcher, COMMAND, null, null);
        launcher.last().exit(0);

        assertTrue(notifications.isEmpty());
    }

    @Test
    void notifierFailureDoesNotAffectSlot() {
        JobSlot slot = new JobSlot(JobKind.VIDEO_OPTIMIZE, (user, n) -> {
            throw new IllegalStateException("push service down");
        }, scheduler, Duration.ofSeconds(10), s -> completions.incrementAndGet());
        RecordingSubscriber sub = new RecordingSubscriber("a");
        slot.start(launcher, COMMAND, sub, "user-1");

        launcher.last().exit(0);

        assertEquals(SlotState.COMPLETE, slot.state());
        assertEquals(1, completions.get());
        assertTrue(sub.isClosed());
    }

    @Test
    @DisplayName("Stop publishes the cancellation at once and ignores the later exit")
    void stopCancelsWithoutWaitingForExit() {
        JobSlot slot = newSlot(JobKind.VIDEO_REPROCESS);
        RecordingSubscriber sub = new RecordingSubscriber("a");
        slot.start(launcher, COMMAND, sub, "user-1");
        FakeProcessLauncher.FakeProcess process = launcher.last();
        process.ignoreTerminate = true;

        assertEquals(StopOutcome.STOPPED, slot.stop());

        assertTrue(process.terminated);
        assertEquals(SlotState.COMPLETE, slot.state());
        List<JobEvent> events = sub.events();
        assertEquals(1, events.size());
        assertTrue(events.get(0).isCancellation());
        assertEquals("Video reprocessing stopped by user", events.get(0).message());
        assertNull(events.get(0).exitCode());
        assertTrue(sub.isClosed());

        // the program dies later; its exit is not a second terminal event
        process.exit(143);
        assertEquals(1, slot.snapshot().events().size());
        assertTrue(slot.snapshot().cancelled());
        assertNull(slot.snapshot().exitCode());
        assertTrue(notifications.isEmpty());
        assertEquals(1, completions.get());
    }

    @Test
    void lingeringProgramIsKilledAfterGrace() throws Exception {
        JobSlot slot = newSlot(JobKind.VIDEO_OPTIMIZE, Duration.ofMillis(50));
        slot.start(launcher, COMMAND, null, null);
        FakeProcessLauncher.FakeProcess process = launcher.last();
        process.ignoreTerminate = true;

        slot.stop();

        long deadline = System.currentTimeMillis() + 2000;
        while (!process.killed && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(process.killed);
    }

    @Test
    void stopOnIdleOrCompleteSlotDoesNothing() {
        JobSlot slot = newSlot(JobKind.AI_TITLES);
        assertEquals(StopOutcome.NOTHING_TO_STOP, slot.stop());

        slot.start(launcher, COMMAND, null, null);
        launcher.last().exit(0);
        assertEquals(StopOutcome.NOTHING_TO_STOP, slot.stop());
    }

    @Test
    void spawnFailurePublishesErrorAndCompletes() {
        launcher.failWith = new IOException("node: not found");
        JobSlot slot = newSlot(JobKind.AI_TITLES);
        RecordingSubscriber sub = new RecordingSubscriber("a");

        assertEquals(StartOutcome.SPAWN_FAILED, slot.start(launcher, COMMAND, sub, "user-1"));

        assertEquals(SlotState.COMPLETE, slot.state());
        assertEquals(List.of(EventType.ERROR), sub.types());
        assertEquals("Failed to start AI title generation: node: not found", sub.events().get(0).message());
        assertTrue(sub.isClosed());
        assertEquals(1, completions.get());
    }

    @Test
    void programErrorIsTerminal() {
        JobSlot slot = newSlot(JobKind.VIDEO_REPROCESS);
        RecordingSubscriber sub = new RecordingSubscriber("a");
        slot.start(launcher, COMMAND, sub, "user-1");

        launcher.last().emit(JobEvent.error("disk full"));
        assertTrue(launcher.last().terminated);
        assertFalse(launcher.last().isAlive());
        assertEquals(StopOutcome.NOTHING_TO_STOP, slot.stop());
        launcher.last().emit(JobEvent.stdout("after error"));
        launcher.last().exit(1);

        assertEquals(List.of(EventType.ERROR), sub.types());
        assertEquals(SlotState.COMPLETE, slot.state());
        assertEquals("Video Reprocessing Failed", notifications.get(0).title());
        assertEquals(1, notifications.size());
    }

    @Test
    void startOnCompleteSlotIsRejected() {
        JobSlot slot = newSlot(JobKind.AI_TITLES);
        slot.start(launcher, COMMAND, null, null);
        launcher.last().exit(0);

        RecordingSubscriber sub = new RecordingSubscriber("late");
        assertEquals(StartOutcome.ALREADY_COMPLETE, slot.start(launcher, COMMAND, sub, null));
        assertEquals(1, launcher.launches.get());
        assertTrue(sub.events().isEmpty());
    }

    @Test
    void attachToCompleteSlotReplaysAndCloses() {
        JobSlot slot = newSlot(JobKind.VIDEO_OPTIMIZE);
        slot.start(launcher, COMMAND, null, null);
        launcher.last().emit(JobEvent.stdout("one"));
        launcher.last().exit(0);

        RecordingSubscriber sub = new RecordingSubscriber("viewer");
        assertFalse(slot.attach(sub));
        assertEquals(List.of(EventType.STDOUT, EventType.COMPLETE), sub.types());
        assertTrue(sub.isClosed());
    }

    @Test
    @DisplayName("Detaching a subscriber leaves the job running")
    void detachDoesNotCancel() {
        JobSlot slot = newSlot(JobKind.VIDEO_OPTIMIZE);
        RecordingSubscriber sub = new RecordingSubscriber("a");
        slot.start(launcher, COMMAND, sub, null);

        slot.detach(sub);
        launcher.last().emit(JobEvent.stdout("still going"));

        assertEquals(SlotState.RUNNING, slot.state());
        assertFalse(launcher.last().terminated);
        assertTrue(sub.events().isEmpty());
        assertEquals(1, slot.snapshot().events().size());
        assertEquals(0, slot.snapshot().subscribers());
    }

    @Test
    void formatsElapsedTime() {
        assertEquals("0s", JobSlot.formatElapsed(Duration.ofMillis(200)));
        assertEquals("42s", JobSlot.formatElapsed(Duration.ofSeconds(42)));
        assertEquals("59s", JobSlot.formatElapsed(Duration.ofMillis(59_400)));
        assertEquals("1.0m", JobSlot.formatElapsed(Duration.ofSeconds(60)));
        assertEquals("3.5m", JobSlot.formatElapsed(Duration.ofSeconds(210)));
    }
    @Test
    @DisplayName("Stop on the event loop closes every SSE stream and completes the slot")
    void stopWithSseSubscribersOnEventLoop() {
        JobSlot slot = newSlot(JobKind.VIDEO_REPROCESS);
        EmbeddedChannel first = new EmbeddedChannel();
        EmbeddedChannel second = new EmbeddedChannel();
        SseSubscriber a = new SseSubscriber(first);
        SseSubscriber b = new SseSubscriber(second);

        slot.start(launcher, COMMAND, a, null);
        first.closeFuture().addListener(future -> slot.detach(a));
        assertEquals(StartOutcome.ATTACHED, slot.start(launcher, COMMAND, b, null));
        second.closeFuture().addListener(future -> slot.detach(b));

        assertEquals(StopOutcome.STOPPED, slot.stop());

        assertEquals(SlotState.COMPLETE, slot.state());
        assertFalse(first.isOpen());
        assertFalse(second.isOpen());
        assertEquals(0, slot.snapshot().subscribers());
        assertEquals(1, completions.get());

        // the SIGTERM exit that follows is not recorded
        launcher.last().exit(143);
        assertNull(slot.snapshot().exitCode());
        assertTrue(notifications.isEmpty());
        first.finishAndReleaseAll();
        second.finishAndReleaseAll();
    }

    @Test
    void deadSseStreamIsDroppedWhileOthersKeepReceiving() {
        JobSlot slot = newSlot(JobKind.VIDEO_OPTIMIZE);
        EmbeddedChannel dead = new EmbeddedChannel();
        EmbeddedChannel live = new EmbeddedChannel();
        SseSubscriber a = new SseSubscriber(dead);
        SseSubscriber b = new SseSubscriber(live);
        slot.start(launcher, COMMAND, a, null);
        dead.closeFuture().addListener(future -> slot.detach(a));
        slot.start(launcher, COMMAND, b, null);
        live.closeFuture().addListener(future -> slot.detach(b));

        dead.close();
        launcher.last().emit(JobEvent.stdout("one"));
        launcher.last().exit(0);

        assertEquals(SlotState.COMPLETE, slot.state());
        assertFalse(live.isOpen());
        assertEquals(3, live.outboundMessages().size(), "two frames plus the end of the response");
        dead.finishAndReleaseAll();
        live.finishAndReleaseAll();
    }

    @Test
    @DisplayName("A program-reported error ends the program before the kind can start again")
    void programErrorTerminatesProgram() throws Exception {
        JobSlotRegistry registry = new JobSlotRegistry(launcher, (user, n) -> {
        }, scheduler, Duration.ofMinutes(5), Duration.ofMillis(50));
        registry.start(JobKind.AI_TITLES, COMMAND, null, null);
        FakeProcessLauncher.FakeProcess first = launcher.last();
        first.ignoreTerminate = true;

        first.emit(JobEvent.error("quota exhausted"));

        assertTrue(first.terminated);
        long deadline = System.currentTimeMillis() + 2000;
        while (!first.killed && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(first.killed);
        assertFalse(first.isAlive());

        StartResult second = registry.start(JobKind.AI_TITLES, COMMAND, null, null);
        assertEquals(StartOutcome.STARTED, second.outcome());
        assertEquals(2, launcher.launches.get());
        assertEquals(1, registry.runningCount());
    }
}
