package io.a2a.lite.server.events;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.TimeUnit;

import io.a2a.lite.spec.TaskEvent;
import io.a2a.lite.util.Assert;
import io.a2a.lite.util.EventChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers task events to the streaming subscribers of each task.
 * <p>
 * Every subscriber owns a bounded {@link EventChannel}. Delivery is independent per subscriber:
 * a subscriber that cancelled its channel is removed silently, and one whose channel stays full
 * longer than the send timeout is dropped (its channel is completed) so that the producer of the
 * events is never blocked indefinitely. After a final event every channel of the task is
 * completed and the task is forgotten.
 * <p>
 * Callers serialise {@link #subscribe} and {@link #broadcast} per task; this class does not
 * order concurrent broadcasts for the same task.
 */
public class TaskEventBroadcaster {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskEventBroadcaster.class);

    private final ConcurrentMap<String, Set<EventChannel<TaskEvent>>> subscribers = new ConcurrentHashMap<>();
    private final int bufferSize;
    private final long sendTimeoutNanos;

    public TaskEventBroadcaster(int bufferSize, Duration sendTimeout) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be greater than 0");
        }
        this.bufferSize = bufferSize;
        this.sendTimeoutNanos = Assert.checkNotNullParam("sendTimeout", sendTimeout).toNanos();
    }

    /**
     * Registers a new subscriber for a task. Cancelling the returned channel unregisters it.
     *
     * @param taskId the task ID
     * @return the subscriber's channel
     */
    public EventChannel<TaskEvent> subscribe(String taskId) {
        EventChannel<TaskEvent> channel = new EventChannel<>(bufferSize);
        Set<EventChannel<TaskEvent>> taskSubscribers =
                subscribers.computeIfAbsent(taskId, id -> new CopyOnWriteArraySet<>());
        taskSubscribers.add(channel);
        channel.onCancel(() -> unsubscribe(taskId, channel));
        LOGGER.debug("Subscriber added for task {} ({} live)", taskId, taskSubscribers.size());
        return channel;
    }

    private void unsubscribe(String taskId, EventChannel<TaskEvent> channel) {
        subscribers.computeIfPresent(taskId, (id, taskSubscribers) -> {
            taskSubscribers.remove(channel);
            return taskSubscribers.isEmpty() ? null : taskSubscribers;
        });
    }

    /**
     * Delivers an event to every subscriber of its task.
     *
     * @param event the event
     */
    public void broadcast(TaskEvent event) {
        String taskId = event.id();
        Set<EventChannel<TaskEvent>> taskSubscribers = subscribers.get(taskId);
        if (taskSubscribers != null) {
            boolean interrupted = false;
            for (EventChannel<TaskEvent> channel : taskSubscribers) {
                boolean delivered;
                if (interrupted) {
                    delivered = channel.trySend(event);
                } else {
                    try {
                        delivered = channel.send(event, sendTimeoutNanos, TimeUnit.NANOSECONDS);
                    } catch (InterruptedException e) {
                        interrupted = true;
                        delivered = channel.trySend(event);
                    }
                }
                if (!delivered) {
                    unsubscribe(taskId, channel);
                    if (!channel.isCancelled() && channel.complete()) {
                        LOGGER.warn("Dropping slow subscriber of task {}: {} event not accepted within {} ms",
                                taskId, event.eventType(), TimeUnit.NANOSECONDS.toMillis(sendTimeoutNanos));
                    }
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        if (event.isFinal()) {
            closeAll(taskId);
        }
    }

    /**
     * Completes every subscriber channel of a task and forgets the task.
     *
     * @param taskId the task ID
     */
    public void closeAll(String taskId) {
        Set<EventChannel<TaskEvent>> taskSubscribers = subscribers.remove(taskId);
        if (taskSubscribers == null) {
            return;
        }
        for (EventChannel<TaskEvent> channel : List.copyOf(taskSubscribers)) {
            channel.complete();
        }
        LOGGER.debug("Closed {} subscriber(s) of task {}", taskSubscribers.size(), taskId);
    }

    public int subscriberCount(String taskId) {
        Set<EventChannel<TaskEvent>> taskSubscribers = subscribers.get(taskId);
        return taskSubscribers == null ? 0 : taskSubscribers.size();
    }

    /**
     * @return whether the task is tracked; a task is forgotten as soon as its last subscriber goes
     */
    public boolean hasSubscribers(String taskId) {
        return subscribers.containsKey(taskId);
    }
}
