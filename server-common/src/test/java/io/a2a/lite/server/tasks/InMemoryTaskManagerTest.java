package io.a2a.lite.server.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.a2a.lite.server.util.ArtifactUtils;
import io.a2a.lite.spec.Artifact;
import io.a2a.lite.spec.InvalidParamsError;
import io.a2a.lite.spec.Message;
import io.a2a.lite.spec.PushNotificationConfig;
import io.a2a.lite.spec.PushNotificationNotConfiguredError;
import io.a2a.lite.spec.Task;
import io.a2a.lite.spec.TaskArtifactUpdateEvent;
import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.spec.TaskFinalStateError;
import io.a2a.lite.spec.TaskIdParams;
import io.a2a.lite.spec.TaskNotFoundError;
import io.a2a.lite.spec.TaskPushNotificationConfig;
import io.a2a.lite.spec.TaskQueryParams;
import io.a2a.lite.spec.TaskSendParams;
import io.a2a.lite.spec.TaskState;
import io.a2a.lite.spec.TaskStatusUpdateEvent;
import io.a2a.lite.spec.TextPart;
import io.a2a.lite.util.EventChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class InMemoryTaskManagerTest {

    private static final Message HELLO = Message.text(Message.Role.USER, "hello");

    private ExecutorService executor;
    private InMemoryTaskManager taskManager;
    private volatile TaskProcessor processor;

    @BeforeEach
    public void setUp() {
        executor = Executors.newCachedThreadPool();
        processor = (taskId, message, handle) -> {
            handle.updateStatus(TaskState.WORKING);
            handle.addArtifact(ArtifactUtils.newTextArtifact("echo", "echo: hello", 0));
            handle.updateStatus(TaskState.COMPLETED);
        };
        taskManager = createTaskManager(null);
    }

    @AfterEach
    public void tearDown() {
        taskManager.close();
        executor.shutdownNow();
    }

    private InMemoryTaskManager createTaskManager(PushNotificationSender pushSender) {
        TaskManagerConfig config = new TaskManagerConfig(10, Duration.ofSeconds(5), 4);
        return new InMemoryTaskManager((taskId, message, handle) -> processor.process(taskId, message, handle),
                config, executor, new InMemoryPushNotificationConfigStore(), pushSender);
    }

    private Task awaitFinal(String taskId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        Task task = taskManager.onGetTask(new TaskQueryParams(taskId));
        while (!task.status().state().isFinal() && System.nanoTime() < deadline) {
            Thread.sleep(10);
            task = taskManager.onGetTask(new TaskQueryParams(taskId));
        }
        assertTrue(task.status().state().isFinal(), "task did not finish: " + task.status().state());
        return task;
    }

    private static List<TaskEvent> drain(EventChannel<TaskEvent> channel) throws InterruptedException {
        List<TaskEvent> events = new ArrayList<>();
        TaskEvent event;
        while ((event = channel.poll(5, TimeUnit.SECONDS)) != null) {
            events.add(event);
        }
        assertTrue(channel.isDone(), "channel was not completed");
        return events;
    }

    private static TaskState stateOf(TaskEvent event) {
        return assertInstanceOf(TaskStatusUpdateEvent.class, event).status().state();
    }

    @Test
    public void testSendProcessGet() throws Exception {
        // given a processor that produces one artifact

        // when
        Task submitted = taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));

        // then
        assertEquals(TaskState.SUBMITTED, submitted.status().state());
        assertEquals(List.of(HELLO), submitted.history());

        Task task = awaitFinal("t1");
        assertEquals(TaskState.COMPLETED, task.status().state());
        assertEquals(1, task.artifacts().size());
        assertEquals(0, task.artifacts().get(0).index());
        assertEquals(List.of(new TextPart("echo: hello")), task.artifacts().get(0).parts());
        assertFalse(task.status().timestamp().isBefore(submitted.status().timestamp()));
    }

    @Test
    public void testSendValidation() {
        assertThrows(InvalidParamsError.class, () -> taskManager.onSendTask(new TaskSendParams(" ", null, HELLO)));
        assertThrows(InvalidParamsError.class, () -> taskManager.onSendTask(
                new TaskSendParams("t1", null, new Message(Message.Role.USER, List.of()))));
        assertThrows(InvalidParamsError.class, () -> taskManager.onSendTask(TaskSendParams.builder()
                .id("t1")
                .message(HELLO)
                .pushNotification(new PushNotificationConfig(""))
                .build()));
        assertThrows(TaskNotFoundError.class, () -> taskManager.onGetTask(new TaskQueryParams("t1")));
    }

    @Test
    public void testGetUnknownTask() {
        TaskNotFoundError error = assertThrows(TaskNotFoundError.class,
                () -> taskManager.onGetTask(new TaskQueryParams("missing")));
        assertEquals("Task with ID 'missing' was not found.", error.getData());
    }

    @Test
    public void testHistoryLength() throws Exception {
        processor = (taskId, message, handle) -> {
            handle.updateStatus(TaskState.WORKING, Message.text(Message.Role.AGENT, "thinking"));
            handle.updateStatus(TaskState.COMPLETED, Message.text(Message.Role.AGENT, "done"));
        };
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));
        awaitFinal("t1");

        // the "thinking" status message moved to history when it was replaced
        Task full = taskManager.onGetTask(new TaskQueryParams("t1"));
        assertEquals(2, full.history().size());
        assertEquals("done", ((TextPart) full.status().message().parts().get(0)).text());

        Task trimmed = taskManager.onGetTask(new TaskQueryParams("t1", 1));
        assertEquals(1, trimmed.history().size());
        assertEquals("thinking", ((TextPart) trimmed.history().get(0).parts().get(0)).text());

        assertEquals(0, taskManager.onGetTask(new TaskQueryParams("t1", 0)).history().size());
    }

    @Test
    public void testCancelUnknownTask() {
        assertThrows(TaskNotFoundError.class, () -> taskManager.onCancelTask(new TaskIdParams("missing")));
    }

    @Test
    public void testCancelCompletedTask() throws Exception {
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));
        Task completed = awaitFinal("t1");

        assertThrows(TaskFinalStateError.class, () -> taskManager.onCancelTask(new TaskIdParams("t1")));
        assertEquals(completed, taskManager.onGetTask(new TaskQueryParams("t1")));
    }

    @Test
    public void testCancelSubmittedTask() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<Boolean> canceledSeen = new AtomicReference<>();
        AtomicReference<Throwable> lateUpdate = new AtomicReference<>();
        processor = (taskId, message, handle) -> {
            started.countDown();
            try {
                new CountDownLatch(1).await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                canceledSeen.set(handle.isCanceled());
            }
            try {
                handle.updateStatus(TaskState.WORKING);
            } catch (TaskFinalStateError e) {
                lateUpdate.set(e);
            }
            finished.countDown();
        };
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Task canceled = taskManager.onCancelTask(new TaskIdParams("t1"));

        assertEquals(TaskState.CANCELED, canceled.status().state());
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals(Boolean.TRUE, canceledSeen.get());
        assertInstanceOf(TaskFinalStateError.class, lateUpdate.get());
        assertEquals(TaskState.CANCELED, taskManager.onGetTask(new TaskQueryParams("t1")).status().state());
    }

    @Test
    public void testProcessorExceptionFailsTask() throws Exception {
        processor = (taskId, message, handle) -> {
            handle.updateStatus(TaskState.WORKING);
            throw new IllegalStateException("model unavailable");
        };
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));

        Task task = awaitFinal("t1");

        assertEquals(TaskState.FAILED, task.status().state());
        String reason = ((TextPart) task.status().message().parts().get(0)).text();
        assertTrue(reason.contains("model unavailable"), reason);
    }

    @Test
    public void testProcessorErrorBeforeWorkingFailsTask() throws Exception {
        processor = (taskId, message, handle) -> {
            throw new AssertionError("boom");
        };
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));

        assertEquals(TaskState.FAILED, awaitFinal("t1").status().state());
    }

    @Test
    public void testProcessorReturningEarlyFailsTask() throws Exception {
        processor = (taskId, message, handle) -> handle.updateStatus(TaskState.WORKING);
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));

        Task task = awaitFinal("t1");

        assertEquals(TaskState.FAILED, task.status().state());
        String reason = ((TextPart) task.status().message().parts().get(0)).text();
        assertTrue(reason.contains("working"), reason);
    }

    @Test
    public void testIllegalTransitionLeavesTaskUnchanged() throws Exception {
        AtomicReference<Task> beforeIllegal = new AtomicReference<>();
        AtomicReference<Task> afterIllegal = new AtomicReference<>();
        processor = (taskId, message, handle) -> {
            beforeIllegal.set(handle.updateStatus(TaskState.WORKING));
            try {
                handle.updateStatus(TaskState.SUBMITTED);
            } catch (TaskFinalStateError e) {
                afterIllegal.set(taskManager.onGetTask(new TaskQueryParams(taskId)));
            }
            handle.updateStatus(TaskState.COMPLETED);
        };
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));

        assertEquals(TaskState.COMPLETED, awaitFinal("t1").status().state());
        assertEquals(beforeIllegal.get(), afterIllegal.get());
    }

    @Test
    public void testRepeatedWorkingUpdateIsRejected() throws Exception {
        AtomicReference<TaskFinalStateError> rejection = new AtomicReference<>();
        processor = (taskId, message, handle) -> {
            handle.updateStatus(TaskState.WORKING);
            try {
                handle.updateStatus(TaskState.WORKING);
            } catch (TaskFinalStateError e) {
                rejection.set(e);
            }
            handle.updateStatus(TaskState.COMPLETED);
        };
        EventChannel<TaskEvent> channel = taskManager.onSendTaskSubscribe(new TaskSendParams("t1", null, HELLO));

        List<TaskEvent> events = drain(channel);

        assertNotNull(rejection.get());
        assertEquals("Invalid task state transition", rejection.get().getMessage());
        assertEquals(2, events.size());
        assertEquals(TaskState.WORKING, stateOf(events.get(0)));
        assertEquals(TaskState.COMPLETED, stateOf(events.get(1)));
    }

    @Test
    public void testSendSubscribeStreamsEventsInOrder() throws Exception {
        EventChannel<TaskEvent> channel = taskManager.onSendTaskSubscribe(new TaskSendParams("t1", null, HELLO));

        List<TaskEvent> events = drain(channel);

        assertEquals(3, events.size());
        assertEquals(TaskState.WORKING, stateOf(events.get(0)));
        Artifact artifact = assertInstanceOf(TaskArtifactUpdateEvent.class, events.get(1)).artifact();
        assertEquals(0, artifact.index());
        assertEquals(TaskState.COMPLETED, stateOf(events.get(2)));
        assertTrue(events.get(2).isFinal());
        assertEquals(0, taskManager.subscriberCount("t1"));
    }

    @Test
    public void testResubscribeUnknownTask() {
        assertThrows(TaskNotFoundError.class, () -> taskManager.onResubscribe(new TaskIdParams("missing")));
    }

    @Test
    public void testResubscribeToFinalTask() throws Exception {
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));
        Task completed = awaitFinal("t1");

        List<TaskEvent> events = drain(taskManager.onResubscribe(new TaskIdParams("t1")));

        assertEquals(1, events.size());
        TaskStatusUpdateEvent event = assertInstanceOf(TaskStatusUpdateEvent.class, events.get(0));
        assertTrue(event.isFinal());
        assertEquals(completed.status(), event.status());
    }

    @Test
    public void testResubscribeToLiveTaskDoesNotReplay() throws Exception {
        CountDownLatch working = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        processor = (taskId, message, handle) -> {
            handle.updateStatus(TaskState.WORKING);
            handle.addArtifact(ArtifactUtils.newTextArtifact("early", "missed", 0));
            working.countDown();
            assertTrue(proceed.await(5, TimeUnit.SECONDS));
            handle.addArtifact(ArtifactUtils.newTextArtifact("late", "seen", 1));
            handle.updateStatus(TaskState.COMPLETED);
        };
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));
        assertTrue(working.await(5, TimeUnit.SECONDS));

        EventChannel<TaskEvent> channel = taskManager.onResubscribe(new TaskIdParams("t1"));
        proceed.countDown();
        List<TaskEvent> events = drain(channel);

        assertEquals(2, events.size());
        assertEquals("late", assertInstanceOf(TaskArtifactUpdateEvent.class, events.get(0)).artifact().name());
        assertEquals(TaskState.COMPLETED, stateOf(events.get(1)));
    }

    @Test
    public void testCancelledSubscriberDoesNotBlockOthers() throws Exception {
        CountDownLatch proceed = new CountDownLatch(1);
        processor = (taskId, message, handle) -> {
            assertTrue(proceed.await(5, TimeUnit.SECONDS));
            handle.updateStatus(TaskState.WORKING);
            handle.updateStatus(TaskState.WORKING, Message.text(Message.Role.AGENT, "50%"));
            handle.updateStatus(TaskState.COMPLETED);
        };
        EventChannel<TaskEvent> first = taskManager.onSendTaskSubscribe(new TaskSendParams("t1", null, HELLO));
        EventChannel<TaskEvent> gone = taskManager.onResubscribe(new TaskIdParams("t1"));
        EventChannel<TaskEvent> third = taskManager.onResubscribe(new TaskIdParams("t1"));
        assertEquals(3, taskManager.subscriberCount("t1"));

        gone.cancel();
        assertEquals(2, taskManager.subscriberCount("t1"));
        proceed.countDown();

        List<TaskEvent> firstEvents = drain(first);
        List<TaskEvent> thirdEvents = drain(third);
        assertEquals(3, firstEvents.size());
        assertEquals(firstEvents, thirdEvents);
        assertEquals(TaskState.COMPLETED, stateOf(firstEvents.get(2)));
        assertNull(gone.receive());
    }

    @Test
    public void testSendToExistingTaskResumesProcessor() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        AtomicReference<Message> resumedWith = new AtomicReference<>();
        processor = (taskId, message, handle) -> {
            invocations.incrementAndGet();
            handle.updateStatus(TaskState.WORKING);
            handle.updateStatus(TaskState.INPUT_REQUIRED, Message.text(Message.Role.AGENT, "which city?"));
            Message input = handle.awaitInput(Duration.ofSeconds(5));
            resumedWith.set(input);
            handle.updateStatus(TaskState.WORKING);
            handle.updateStatus(TaskState.COMPLETED);
        };
        EventChannel<TaskEvent> channel = taskManager.onSendTaskSubscribe(new TaskSendParams("t1", null, HELLO));
        assertEquals(TaskState.WORKING, stateOf(channel.poll(5, TimeUnit.SECONDS)));
        assertEquals(TaskState.INPUT_REQUIRED, stateOf(channel.poll(5, TimeUnit.SECONDS)));

        Message answer = Message.text(Message.Role.USER, "Paris");
        Task resumed = taskManager.onSendTask(new TaskSendParams("t1", null, answer));

        assertEquals(TaskState.INPUT_REQUIRED, resumed.status().state());
        assertEquals(3, resumed.history().size());
        assertEquals(answer, resumed.history().get(2));

        Task task = awaitFinal("t1");
        assertEquals(TaskState.COMPLETED, task.status().state());
        assertEquals(answer, resumedWith.get());
        assertEquals(1, invocations.get());
    }

    @Test
    public void testSendToFinalTask() throws Exception {
        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));
        awaitFinal("t1");

        assertThrows(TaskFinalStateError.class, () -> taskManager.onSendTask(new TaskSendParams("t1", null, HELLO)));
    }

    @Test
    public void testPushNotificationConfig() throws Exception {
        assertThrows(TaskNotFoundError.class, () -> taskManager.onPushNotificationSet(
                new TaskPushNotificationConfig("missing", new PushNotificationConfig("http://localhost/hook"))));

        taskManager.onSendTask(new TaskSendParams("t1", null, HELLO));

        assertThrows(PushNotificationNotConfiguredError.class,
                () -> taskManager.onPushNotificationGet(new TaskIdParams("t1")));
        assertThrows(InvalidParamsError.class, () -> taskManager.onPushNotificationSet(
                new TaskPushNotificationConfig("t1", new PushNotificationConfig(" "))));

        TaskPushNotificationConfig config = new TaskPushNotificationConfig("t1",
                new PushNotificationConfig("http://localhost/hook", "secret", null));
        assertEquals(config, taskManager.onPushNotificationSet(config));
        assertEquals(config, taskManager.onPushNotificationGet(new TaskIdParams("t1")));
    }

    @Test
    public void testPushNotificationConfigFromSendParams() {
        processor = (taskId, message, handle) -> {
            handle.updateStatus(TaskState.WORKING);
            handle.updateStatus(TaskState.COMPLETED);
        };
        PushNotificationConfig pushConfig = new PushNotificationConfig("http://localhost/hook");
        taskManager.onSendTask(TaskSendParams.builder()
                .id("t1")
                .message(HELLO)
                .pushNotification(pushConfig)
                .build());

        TaskPushNotificationConfig stored = taskManager.onPushNotificationGet(new TaskIdParams("t1"));
        assertNotNull(stored);
        assertEquals(pushConfig, stored.pushNotificationConfig());
    }

    @Test
    public void testPushNotificationSentAfterEveryStatusChange() throws Exception {
        PushNotificationSender pushSender = mock(PushNotificationSender.class);
        try (InMemoryTaskManager manager = createTaskManager(pushSender)) {
            EventChannel<TaskEvent> channel = manager.onSendTaskSubscribe(new TaskSendParams("t1", null, HELLO));
            drain(channel);

            verify(pushSender, timeout(5000).times(1))
                    .sendNotification(argThat(task -> task.status().state() == TaskState.WORKING));
            verify(pushSender, timeout(5000).times(1))
                    .sendNotification(argThat(task -> task.status().state() == TaskState.COMPLETED));
            verify(pushSender, times(2)).sendNotification(any());
            verify(pushSender, never()).sendNotification(argThat(task -> task.status().state() == TaskState.SUBMITTED));
        }
    }
}
