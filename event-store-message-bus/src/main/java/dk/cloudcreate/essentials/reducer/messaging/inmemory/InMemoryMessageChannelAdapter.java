package dk.cloudcreate.essentials.reducer.messaging.inmemory;

import dk.cloudcreate.essentials.reducer.messaging.*;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.*;
import reactor.core.scheduler.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * In-process {@link MessageChannelAdapter}.<br>
 * Messages are delivered to:
 * <ul>
 *     <li>synchronous subscribers, called on the publishing thread before {@link #publishMessage(EventStoreMessage)} returns</li>
 *     <li>asynchronous subscribers, called on a {@link Scheduler}</li>
 *     <li>the hot {@link Flux} returned by {@link #messages()}</li>
 * </ul>
 * A subscriber failure is logged and doesn't affect the other subscribers or the publisher.<br>
 * A <code>fifo</code> adapter drops a message whose {@link EventStoreMessage#messageDeduplicationId()} has already been published.
 *
 * @param <MESSAGE> the message type
 */
public class InMemoryMessageChannelAdapter<MESSAGE extends EventStoreMessage<?>> implements MessageChannelAdapter<MESSAGE> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageChannelAdapter.class);

    private final String                                     name;
    private final boolean                                    fifo;
    private final Scheduler                                  asyncSubscriberScheduler;
    private final Sinks.Many<MESSAGE>                        sink;
    private final List<Subscription>                         syncSubscribers           = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<Consumer<MESSAGE>, Disposable> asyncSubscribers          = new ConcurrentHashMap<>();
    private final Set<String>                                publishedDeduplicationIds = ConcurrentHashMap.newKeySet();

    public InMemoryMessageChannelAdapter(String name) {
        this(name, false);
    }

    public InMemoryMessageChannelAdapter(String name, boolean fifo) {
        this(name, fifo, Schedulers.boundedElastic());
    }

    /**
     * @param name                     name used in log statements
     * @param fifo                     drop messages with an already published deduplication id
     * @param asyncSubscriberScheduler scheduler that asynchronous subscribers are called on
     */
    public InMemoryMessageChannelAdapter(String name, boolean fifo, Scheduler asyncSubscriberScheduler) {
        this.name = requireNonNull(name, "No name provided");
        this.fifo = fifo;
        this.asyncSubscriberScheduler = requireNonNull(asyncSubscriberScheduler, "No asyncSubscriberScheduler provided");
        this.sink = Sinks.many().multicast().directBestEffort();
    }

    public String getName() {
        return name;
    }

    public boolean isFifo() {
        return fifo;
    }

    @Override
    public synchronized void publishMessage(MESSAGE message) {
        requireNonNull(message, "No message provided");
        if (fifo && !publishedDeduplicationIds.add(message.messageDeduplicationId())) {
            log.debug("[{}] Skipping already published message '{}'", name, message.messageDeduplicationId());
            return;
        }
        log.trace("[{}] Delivering message '{}' to {} sync subscriber(s)", name, message.messageDeduplicationId(), syncSubscribers.size());
        syncSubscribers.forEach(subscription -> subscription.deliver(message));

        var emitResult = sink.tryEmitNext(message);
        if (emitResult == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.trace("[{}] No stream subscribers for message '{}'", name, message.messageDeduplicationId());
        } else {
            emitResult.orThrow();
        }
    }

    /**
     * Hot stream of the messages published after subscription
     */
    public Flux<MESSAGE> messages() {
        return sink.asFlux();
    }

    public InMemoryMessageChannelAdapter<MESSAGE> addSyncSubscriber(Consumer<MESSAGE> subscriber) {
        return addSyncSubscriber(MessageFilter.all(), subscriber);
    }

    /**
     * Call the <code>subscriber</code>, on the publishing thread, with every published message matching the <code>filter</code>
     */
    public InMemoryMessageChannelAdapter<MESSAGE> addSyncSubscriber(MessageFilter filter, Consumer<MESSAGE> subscriber) {
        syncSubscribers.add(new Subscription(requireNonNull(filter, "No filter provided"),
                                             requireNonNull(subscriber, "No subscriber provided")));
        return this;
    }

    public InMemoryMessageChannelAdapter<MESSAGE> removeSyncSubscriber(Consumer<MESSAGE> subscriber) {
        requireNonNull(subscriber, "No subscriber provided");
        syncSubscribers.removeIf(subscription -> subscription.subscriber == subscriber);
        return this;
    }

    public InMemoryMessageChannelAdapter<MESSAGE> addAsyncSubscriber(Consumer<MESSAGE> subscriber) {
        return addAsyncSubscriber(MessageFilter.all(), subscriber);
    }

    /**
     * Call the <code>subscriber</code>, on the asynchronous subscriber scheduler, with every published message matching the <code>filter</code>
     */
    public InMemoryMessageChannelAdapter<MESSAGE> addAsyncSubscriber(MessageFilter filter, Consumer<MESSAGE> subscriber) {
        requireNonNull(filter, "No filter provided");
        requireNonNull(subscriber, "No subscriber provided");
        var subscription = new Subscription(filter, subscriber);
        var disposable = messages().onBackpressureBuffer()
                                   .publishOn(asyncSubscriberScheduler)
                                   .subscribe(subscription::deliver);
        var previous = asyncSubscribers.put(subscriber, disposable);
        if (previous != null) {
            previous.dispose();
        }
        return this;
    }

    public InMemoryMessageChannelAdapter<MESSAGE> removeAsyncSubscriber(Consumer<MESSAGE> subscriber) {
        requireNonNull(subscriber, "No subscriber provided");
        var disposable = asyncSubscribers.remove(subscriber);
        if (disposable != null) {
            disposable.dispose();
        }
        return this;
    }

    public boolean hasSyncSubscriber(Consumer<MESSAGE> subscriber) {
        return syncSubscribers.stream().anyMatch(subscription -> subscription.subscriber == subscriber);
    }

    public boolean hasAsyncSubscriber(Consumer<MESSAGE> subscriber) {
        return asyncSubscribers.containsKey(subscriber);
    }

    @Override
    public String toString() {
        return "InMemoryMessageChannelAdapter{" +
                "name='" + name + '\'' +
                ", fifo=" + fifo +
                '}';
    }

    private class Subscription {
        private final MessageFilter     filter;
        private final Consumer<MESSAGE> subscriber;

        private Subscription(MessageFilter filter, Consumer<MESSAGE> subscriber) {
            this.filter = filter;
            this.subscriber = subscriber;
        }

        private void deliver(MESSAGE message) {
            if (!filter.test(message)) {
                return;
            }
            try {
                subscriber.accept(message);
            } catch (RuntimeException e) {
                log.error(msg("[{}] Failed to deliver message '{}' to subscriber {}",
                              name,
                              message.messageDeduplicationId(),
                              subscriber.getClass().getName()),
                          e);
            }
        }
    }
}
