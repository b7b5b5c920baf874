package dk.cloudcreate.essentials.reducer.messaging.inmemory;

import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import dk.cloudcreate.essentials.reducer.messaging.NotificationMessage;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.reducer.messaging.test_data.Counter.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class InMemoryMessageChannelAdapterTest {
    private static final EventStoreId OTHER_COUNTERS = EventStoreId.of("OTHER_COUNTERS");

    private InMemoryMessageChannelAdapter<NotificationMessage<?>> adapter;

    @Test
    void a_fifo_adapter_drops_duplicate_messages() {
        // Given
        adapter = new InMemoryMessageChannelAdapter<>("fifo", true);
        var received = new ArrayList<NotificationMessage<?>>();
        adapter.addSyncSubscriber(received::add);

        // When
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));
        adapter.publishMessage(NotificationMessage.of(OTHER_COUNTERS, created("counter-1")));

        // Then
        assertThat(received).extracting(NotificationMessage::messageDeduplicationId)
                            .containsExactly("COUNTERS#counter-1#1", "OTHER_COUNTERS#counter-1#1");
    }

    @Test
    void a_standard_adapter_delivers_duplicate_messages() {
        // Given
        adapter = new InMemoryMessageChannelAdapter<>("standard");
        var received = new ArrayList<NotificationMessage<?>>();
        adapter.addSyncSubscriber(received::add);

        // When
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));

        // Then
        assertThat(received).hasSize(2);
    }

    @Test
    void subscribers_only_receive_messages_matching_their_filter() {
        // Given
        adapter = new InMemoryMessageChannelAdapter<>("filtered");
        var otherStoreMessages  = new ArrayList<NotificationMessage<?>>();
        var incrementedMessages = new ArrayList<NotificationMessage<?>>();
        adapter.addSyncSubscriber(MessageFilter.eventStoreId(OTHER_COUNTERS), otherStoreMessages::add);
        adapter.addSyncSubscriber(MessageFilter.of(COUNTERS, COUNTER_INCREMENTED), incrementedMessages::add);

        // When
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));
        adapter.publishMessage(NotificationMessage.of(COUNTERS, incremented("counter-1", 2)));
        adapter.publishMessage(NotificationMessage.of(OTHER_COUNTERS, created("counter-2")));

        // Then
        assertThat(otherStoreMessages).extracting(message -> message.event().aggregateId()).containsExactly("counter-2");
        assertThat(incrementedMessages).extracting(message -> message.event().version()).containsExactly(2L);
    }

    @Test
    void a_failing_subscriber_doesnt_affect_other_subscribers() {
        // Given
        adapter = new InMemoryMessageChannelAdapter<>("failing");
        var received = new ArrayList<NotificationMessage<?>>();
        adapter.addSyncSubscriber(message -> {
            throw new IllegalStateException("Subscriber failed");
        });
        adapter.addSyncSubscriber(received::add);

        // When
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));
        adapter.publishMessage(NotificationMessage.of(COUNTERS, incremented("counter-1", 2)));

        // Then
        assertThat(received).hasSize(2);
    }

    @Test
    void async_subscribers_receive_messages_on_another_thread() {
        // Given
        adapter = new InMemoryMessageChannelAdapter<>("async");
        var publishingThread = Thread.currentThread();
        var receivedOn       = new CopyOnWriteArrayList<Thread>();
        Consumer<NotificationMessage<?>> subscriber = message -> receivedOn.add(Thread.currentThread());
        adapter.addAsyncSubscriber(subscriber);

        // When
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));
        adapter.publishMessage(NotificationMessage.of(COUNTERS, incremented("counter-1", 2)));

        // Then
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(receivedOn).hasSize(2));
        assertThat(receivedOn).doesNotContain(publishingThread);
        assertThat(adapter.hasAsyncSubscriber(subscriber)).isTrue();
    }

    @Test
    void removed_subscribers_receive_no_more_messages() {
        // Given
        adapter = new InMemoryMessageChannelAdapter<>("removal");
        var syncReceived  = new ArrayList<NotificationMessage<?>>();
        var asyncReceived = new CopyOnWriteArrayList<NotificationMessage<?>>();
        Consumer<NotificationMessage<?>> syncSubscriber  = syncReceived::add;
        Consumer<NotificationMessage<?>> asyncSubscriber = asyncReceived::add;
        adapter.addSyncSubscriber(syncSubscriber);
        adapter.addAsyncSubscriber(asyncSubscriber);
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(asyncReceived).hasSize(1));

        // When
        adapter.removeSyncSubscriber(syncSubscriber);
        adapter.removeAsyncSubscriber(asyncSubscriber);
        adapter.publishMessage(NotificationMessage.of(COUNTERS, incremented("counter-1", 2)));

        // Then
        assertThat(syncReceived).hasSize(1);
        assertThat(adapter.hasSyncSubscriber(syncSubscriber)).isFalse();
        assertThat(adapter.hasAsyncSubscriber(asyncSubscriber)).isFalse();
        await().during(Duration.ofMillis(200))
               .atMost(Duration.ofSeconds(1))
               .untilAsserted(() -> assertThat(asyncReceived).hasSize(1));
    }

    @Test
    void publishing_without_subscribers_is_allowed() {
        // Given
        adapter = new InMemoryMessageChannelAdapter<>("silent", true);

        // When
        adapter.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));

        // Then
        assertThat(adapter.isFifo()).isTrue();
        assertThat(adapter.getName()).isEqualTo("silent");
    }
}
