package io.a2a.lite.server.tasks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import io.a2a.lite.server.events.TaskEventBroadcaster;
import io.a2a.lite.server.util.ArtifactUtils;
import io.a2a.lite.spec.Artifact;
import io.a2a.lite.spec.InvalidParamsError;
import io.a2a.lite.spec.Message;
import io.a2a.lite.spec.PushNotificationConfig;
import io.a2a.lite.spec.PushNotificationNotConfiguredError;
import io.a2a.lite.spec.Task;
import io.a2a.lite.spec.TaskArtifactUpdateEvent;
import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.spec.TaskIdParams;
import io.a2a.lite.spec.TaskNotFoundError;
import io.a2a.lite.spec.TaskPushNotificationConfig;
import io.a2a.lite.spec.TaskQueryParams;
import io.a2a.lite.spec.TaskSendParams;
import io.a2a.lite.spec.TaskState;
import io.a2a.lite.spec.TaskStatus;
import io.a2a.lite.spec.TaskStatusUpdateEvent;
import io.a2a.lite.util.Assert;
import io.a2a.lite.util.EventChannel;
import io.a2a.lite.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskManager} keeping tasks in memory.
 * <p>
 * Each task has its own lock guarding its snapshot and its subscribers. Every change, whether it
 * comes from a request or from the task's processor, is validated by {@link TaskStateMachine},
 * stored, and broadcast while that lock is held, so the stored task and every subscriber see the
 * same sequence of changes.
 */
public class InMemoryTaskManager implements TaskManager, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTaskManager.class);

    private final TaskProcessor processor;
    private final TaskManagerConfig config;
    private final Executor executor;
    private final @Nullable ExecutorService ownedExecutor;
    private final TaskEventBroadcaster broadcaster;
    private final PushNotificationConfigStore pushConfigStore;
    private final @Nullable PushNotificationSender pushSender;

    // key is the task ID
    private final ConcurrentMap<String, TaskEntry> tasks = new ConcurrentHashMap<>();

    public InMemoryTaskManager(TaskProcessor processor) {
        this(processor, TaskManagerConfig.defaults());
    }

    public InMemoryTaskManager(TaskProcessor processor, TaskManagerConfig config) {
        this(processor, config, null, new InMemoryPushNotificationConfigStore(), null);
    }

    /**
     * @param processor the agent logic run for every new task
     * @param config the engine settings
     * @param executor the executor running processors; if {@code null} a fixed pool of
     * {@link TaskManagerConfig#processorThreads()} threads is created and shut down by {@link #close()}
     * @param pushConfigStore the store of push notification configurations
     * @param pushSender the sender notified after every status change, may be {@code null}
     */
    public InMemoryTaskManager(TaskProcessor processor, TaskManagerConfig config, @Nullable Executor executor,
                               PushNotificationConfigStore pushConfigStore,
                               @Nullable PushNotificationSender pushSender) {
        this.processor = Assert.checkNotNullParam("processor", processor);
        this.config = Assert.checkNotNullParam("config", config);
        this.pushConfigStore = Assert.checkNotNullParam("pushConfigStore", pushConfigStore);
        this.pushSender = pushSender;
        if (executor == null) {
            this.ownedExecutor = Executors.newFixedThreadPool(config.processorThreads(), new ProcessorThreadFactory());
            this.executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }
        this.broadcaster = new TaskEventBroadcaster(config.subscriberBufferSize(), config.subscriberSendTimeout());
    }

    @Override
    public Task onSendTask(TaskSendParams params) {
        return submit(params, false).task();
    }

    @Override
    public EventChannel<TaskEvent> onSendTaskSubscribe(TaskSendParams params) {
        EventChannel<TaskEvent> channel = submit(params, true).channel();
        return Assert.checkNotNullParam("channel", channel);
    }

    @Override
    public Task onGetTask(TaskQueryParams params) {
        Assert.checkNotNullParam("params", params);
        TaskEntry entry = requireEntry(params.id());
        return withHistoryLength(entry.task, params.historyLength());
    }

    @Override
    public Task onCancelTask(TaskIdParams params) {
        Assert.checkNotNullParam("params", params);
        TaskEntry entry = requireEntry(params.id());
        Task canceled;
        entry.lock.lock();
        try {
            canceled = applyStatus(entry, TaskState.CANCELED, null, false);
            entry.canceled = true;
            Future<?> processing = entry.processing;
            if (processing != null) {
                processing.cancel(true);
            }
        } finally {
            entry.lock.unlock();
        }
        LOGGER.debug("Task {} canceled", params.id());
        sendPushNotification(canceled);
        return canceled;
    }

    @Override
    public EventChannel<TaskEvent> onResubscribe(TaskIdParams params) {
        Assert.checkNotNullParam("params", params);
        TaskEntry entry = requireEntry(params.id());
        entry.lock.lock();
        try {
            Task task = entry.task;
            if (task.status().state().isFinal()) {
                EventChannel<TaskEvent> channel = new EventChannel<>(config.subscriberBufferSize());
                channel.trySend(new TaskStatusUpdateEvent(task.id(), task.status(), true));
                channel.complete();
                return channel;
            }
            return broadcaster.subscribe(task.id());
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public TaskPushNotificationConfig onPushNotificationSet(TaskPushNotificationConfig params) {
        Assert.checkNotNullParam("params", params);
        validatePushNotificationConfig(params.pushNotificationConfig());
        requireEntry(params.id());
        pushConfigStore.setInfo(params.id(), params.pushNotificationConfig());
        return params;
    }

    @Override
    public TaskPushNotificationConfig onPushNotificationGet(TaskIdParams params) {
        Assert.checkNotNullParam("params", params);
        requireEntry(params.id());
        PushNotificationConfig pushConfig = pushConfigStore.getInfo(params.id());
        if (pushConfig == null) {
            throw new PushNotificationNotConfiguredError(params.id());
        }
        return new TaskPushNotificationConfig(params.id(), pushConfig);
    }

    int subscriberCount(String taskId) {
        return broadcaster.subscriberCount(taskId);
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private Submission submit(TaskSendParams params, boolean subscribe) {
        validate(params);
        String taskId = params.id();
        Task initial = Task.builder()
                .id(taskId)
                .sessionId(params.sessionId())
                .status(new TaskStatus(TaskState.SUBMITTED))
                .history(List.of(params.message()))
                .metadata(params.metadata())
                .build();

        TaskEntry created = new TaskEntry(initial);
        TaskEntry existing;
        FutureTask<Void> processing = null;
        EventChannel<TaskEvent> channel = null;
        created.lock.lock();
        try {
            existing = tasks.putIfAbsent(taskId, created);
            if (existing == null) {
                storePushNotificationConfig(params);
                if (subscribe) {
                    channel = broadcaster.subscribe(taskId);
                }
                processing = new FutureTask<>(() -> runProcessor(created, params.message()), null);
                created.processing = processing;
            }
        } finally {
            created.lock.unlock();
        }

        if (existing != null) {
            return resume(existing, params, subscribe);
        }
        LOGGER.debug("Task {} submitted", taskId);
        try {
            executor.execute(processing);
        } catch (RejectedExecutionException e) {
            LOGGER.error("Could not start the processor of task {}", taskId, e);
            failUnfinished(created, e);
        }
        return new Submission(withHistoryLength(initial, params.historyLength()), channel);
    }

    private Submission resume(TaskEntry entry, TaskSendParams params, boolean subscribe) {
        entry.lock.lock();
        try {
            Task task = entry.task;
            TaskStateMachine.checkMutable(task.id(), task.status().state());
            storePushNotificationConfig(params);

            List<Message> history = new ArrayList<>(task.history());
            TaskStatus status = task.status();
            if (status.message() != null) {
                history.add(status.message());
                status = new TaskStatus(status.state(), null, status.timestamp());
            }
            history.add(params.message());
            Task updated = Task.builder(task)
                    .status(status)
                    .history(history)
                    .build();
            entry.task = updated;
            entry.inbox.offer(params.message());

            EventChannel<TaskEvent> channel = subscribe ? broadcaster.subscribe(task.id()) : null;
            LOGGER.debug("Task {} resumed in state {}", task.id(), task.status().state().asString());
            return new Submission(withHistoryLength(updated, params.historyLength()), channel);
        } finally {
            entry.lock.unlock();
        }
    }

    private void runProcessor(TaskEntry entry, Message message) {
        String taskId = entry.taskId;
        Throwable failure = null;
        try {
            processor.process(taskId, message, new EntryTaskHandle(entry));
        } catch (Throwable t) {
            failure = t;
        }
        entry.inbox.clear();
        if (entry.canceled) {
            if (failure != null) {
                LOGGER.debug("Processor of canceled task {} ended with {}", taskId, failure.toString());
            }
            return;
        }
        failUnfinished(entry, failure);
    }

    private void failUnfinished(TaskEntry entry, @Nullable Throwable failure) {
        Task failed;
        entry.lock.lock();
        try {
            TaskState current = entry.task.status().state();
            if (current.isFinal()) {
                if (failure != null) {
                    LOGGER.warn("Processor of task {} failed after the task became {}", entry.taskId,
                            current.asString(), failure);
                }
                return;
            }
            String reason;
            if (failure == null) {
                reason = "Task processor returned while the task was " + current.asString();
                LOGGER.error("Processor of task {} returned while the task was {}", entry.taskId, current.asString());
            } else {
                reason = "Task processor failed: " + describe(failure);
                LOGGER.error("Processor of task {} failed", entry.taskId, failure);
            }
            failed = applyStatus(entry, TaskState.FAILED, Message.text(Message.Role.AGENT, reason), true);
        } finally {
            entry.lock.unlock();
        }
        sendPushNotification(failed);
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null ? failure.getClass().getName() : failure.getClass().getName() + ": " + message;
    }

    // must hold entry.lock
    private Task applyStatus(TaskEntry entry, TaskState state, @Nullable Message message, boolean forced) {
        Task task = entry.task;
        TaskStatus current = task.status();
        if (forced) {
            TaskStateMachine.checkForcedFailure(task.id(), current.state());
        } else {
            TaskStateMachine.checkTransition(task.id(), current.state(), state);
        }
        TaskStatus status = new TaskStatus(state, message, Utils.nextTimestamp(current.timestamp()));
        Task.Builder builder = Task.builder(task).status(status);
        if (current.message() != null) {
            List<Message> history = new ArrayList<>(task.history());
            history.add(current.message());
            builder.history(history);
        }
        Task updated = builder.build();
        entry.task = updated;
        broadcaster.broadcast(new TaskStatusUpdateEvent(task.id(), status, state.isFinal()));
        return updated;
    }

    // must hold entry.lock
    private Task applyArtifact(TaskEntry entry, Artifact artifact) {
        Task task = entry.task;
        TaskStateMachine.checkMutable(task.id(), task.status().state());
        Task updated = Task.builder(task)
                .artifacts(ArtifactUtils.applyArtifact(task.artifacts(), artifact))
                .build();
        entry.task = updated;
        broadcaster.broadcast(new TaskArtifactUpdateEvent(task.id(), artifact));
        return updated;
    }

    private void sendPushNotification(Task task) {
        if (pushSender != null) {
            pushSender.sendNotification(task);
        }
    }

    private void storePushNotificationConfig(TaskSendParams params) {
        if (params.pushNotification() != null) {
            pushConfigStore.setInfo(params.id(), params.pushNotification());
        }
    }

    private TaskEntry requireEntry(String taskId) {
        TaskEntry entry = tasks.get(taskId);
        if (entry == null) {
            throw new TaskNotFoundError(taskId);
        }
        return entry;
    }

    private static void validate(@Nullable TaskSendParams params) {
        if (params == null) {
            throw new InvalidParamsError("params are required");
        }
        if (params.id().isBlank()) {
            throw new InvalidParamsError("task ID is required");
        }
        if (params.message().parts().isEmpty()) {
            throw new InvalidParamsError("message must have at least one part");
        }
        if (params.pushNotification() != null) {
            validatePushNotificationConfig(params.pushNotification());
        }
    }

    private static void validatePushNotificationConfig(PushNotificationConfig pushConfig) {
        if (pushConfig.url().isBlank()) {
            throw new InvalidParamsError("push notification URL is required");
        }
    }

    static Task withHistoryLength(Task task, @Nullable Integer historyLength) {
        if (historyLength == null || task.history().size() <= historyLength) {
            return task;
        }
        int size = task.history().size();
        return Task.builder(task)
                .history(task.history().subList(size - historyLength, size))
                .build();
    }

    private record Submission(Task task, @Nullable EventChannel<TaskEvent> channel) {
    }

    private static final class TaskEntry {
        final String taskId;
        final ReentrantLock lock = new ReentrantLock();
        final BlockingQueue<Message> inbox = new LinkedBlockingQueue<>();
        volatile Task task;
        volatile boolean canceled;
        volatile @Nullable Future<?> processing;

        TaskEntry(Task task) {
            this.taskId = task.id();
            this.task = task;
        }
    }

    private final class EntryTaskHandle implements TaskHandle {
        private final TaskEntry entry;

        EntryTaskHandle(TaskEntry entry) {
            this.entry = entry;
        }

        @Override
        public String taskId() {
            return entry.taskId;
        }

        @Override
        public Task updateStatus(TaskState state, @Nullable Message message) {
            Assert.checkNotNullParam("state", state);
            Task updated;
            entry.lock.lock();
            try {
                updated = applyStatus(entry, state, message, false);
            } finally {
                entry.lock.unlock();
            }
            sendPushNotification(updated);
            return updated;
        }

        @Override
        public Task addArtifact(Artifact artifact) {
            Assert.checkNotNullParam("artifact", artifact);
            entry.lock.lock();
            try {
                return applyArtifact(entry, artifact);
            } finally {
                entry.lock.unlock();
            }
        }

        @Override
        public boolean isCanceled() {
            return entry.canceled;
        }

        @Override
        public @Nullable Message awaitInput(Duration timeout) throws InterruptedException {
            return entry.inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    private static final class ProcessorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "a2a-task-processor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
