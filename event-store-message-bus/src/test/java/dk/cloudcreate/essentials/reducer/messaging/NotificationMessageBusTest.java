package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.inmemory.InMemoryEventStorageAdapter;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import dk.cloudcreate.essentials.reducer.messaging.inmemory.InMemoryMessageChannelAdapter;
import dk.cloudcreate.essentials.reducer.messaging.test_data.Counter;
import dk.cloudcreate.essentials.reducer.messaging.test_data.Counter.CounterEvent;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static dk.cloudcreate.essentials.reducer.messaging.test_data.Counter.*;
import static org.assertj.core.api.Assertions.*;

class NotificationMessageBusTest {
    private static final EventStoreId OTHER_COUNTERS = EventStoreId.of("OTHER_COUNTERS");

    private EventStore<CounterEvent, Counter>                      counters;
    private InMemoryMessageChannelAdapter<NotificationMessage<?>> channelAdapter;
    private NotificationMessageBus                                 bus;
    private List<NotificationMessage<?>>                           received;

    @BeforeEach
    void setup() {
        counters = Counter.newCounterEventStore(COUNTERS).setEventStorageAdapter(new InMemoryEventStorageAdapter());
        channelAdapter = new InMemoryMessageChannelAdapter<>("notifications");
        received = new CopyOnWriteArrayList<>();
        channelAdapter.addSyncSubscriber(received::add);
        bus = new NotificationMessageBus("COUNTER_NOTIFICATIONS", List.of(counters), channelAdapter);
        bus.connectSourceEventStores();
    }

    @Test
    void every_successful_push_is_published_once() {
        // When
        counters.pushEvent(created("counter-1"));
        counters.pushEvent(incremented("counter-1", 2));

        // Then
        assertThat(received).extracting(message -> message.event().version())
                            .containsExactly(1L, 2L);
        assertThat((CharSequence) received.get(0).eventStoreId()).isEqualTo(COUNTERS);
    }

    @Test
    void a_failed_push_publishes_nothing() {
        // Given
        counters.pushEvent(created("counter-1"));
        received.clear();

        // When
        assertThatThrownBy(() -> counters.pushEvent(created("counter-1")))
                .isInstanceOf(EventAlreadyExistsException.class);

        // Then
        assertThat(received).isEmpty();
    }

    @Test
    void grouped_pushes_are_published() {
        // When
        EventStore.pushEventGroup(counters.groupEvent(created("counter-1")),
                                  counters.groupEvent(created("counter-2")));

        // Then
        assertThat(received).extracting(message -> message.event().aggregateId())
                            .containsExactlyInAnyOrder("counter-1", "counter-2");
    }

    @Test
    void messages_carry_deduplication_and_group_ids() {
        // When
        var message = NotificationMessage.of(COUNTERS, incremented("counter-1", 3));

        // Then
        assertThat(message.messageDeduplicationId()).isEqualTo("COUNTERS#counter-1#3");
        assertThat(message.messageGroupId()).isEqualTo("COUNTERS#counter-1");
    }

    @Test
    void published_messages_are_streamed() {
        StepVerifier.create(channelAdapter.messages().take(2))
                    .then(() -> {
                        counters.pushEvent(created("counter-1"));
                        counters.pushEvent(incremented("counter-1", 2));
                    })
                    .expectNextMatches(message -> message.messageDeduplicationId().equals("COUNTERS#counter-1#1"))
                    .expectNextMatches(message -> message.messageDeduplicationId().equals("COUNTERS#counter-1#2"))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
    }

    @Test
    void publishing_without_an_adapter_fails() {
        // Given
        var unboundBus = new NotificationMessageBus("UNBOUND", List.of(counters));

        // When
        assertThatThrownBy(() -> unboundBus.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1"))))
                .isExactlyInstanceOf(UndefinedMessageChannelAdapterException.class)
                .satisfies(e -> assertThat(((UndefinedMessageChannelAdapterException) e).messageChannelId).isEqualTo("UNBOUND"));

        // Then
        assertThat(unboundBus.getMessageChannelAdapter()).isEmpty();
    }

    @Test
    void the_adapter_can_be_set_after_construction() {
        // Given
        var lateBus     = new NotificationMessageBus("LATE", List.of(counters));
        var lateAdapter = new InMemoryMessageChannelAdapter<NotificationMessage<?>>("late");
        var lateReceived = new ArrayList<NotificationMessage<?>>();
        lateAdapter.addSyncSubscriber(lateReceived::add);

        // When
        lateBus.setMessageChannelAdapter(lateAdapter);
        lateBus.publishMessage(NotificationMessage.of(COUNTERS, created("counter-1")));

        // Then
        assertThat(lateReceived).hasSize(1);
    }

    @Test
    void messages_from_other_event_stores_are_rejected() {
        // When
        assertThatThrownBy(() -> bus.publishMessage(NotificationMessage.of(OTHER_COUNTERS, created("counter-1"))))
                .isExactlyInstanceOf(EventStoreNotFoundException.class)
                .satisfies(e -> assertThat((CharSequence) ((EventStoreNotFoundException) e).eventStoreId).isEqualTo(OTHER_COUNTERS));

        // Then
        assertThat(received).isEmpty();
        assertThatThrownBy(() -> bus.getEventStore(OTHER_COUNTERS))
                .isExactlyInstanceOf(EventStoreNotFoundException.class);
        assertThat(bus.<CounterEvent, Counter>getEventStore(COUNTERS)).isSameAs(counters);
    }

    @Test
    void disconnected_event_stores_are_no_longer_published() {
        // Given
        bus.disconnectSourceEventStores();

        // When
        counters.pushEvent(created("counter-1"));

        // Then
        assertThat(received).isEmpty();
        assertThat(counters.getOnEventPushed()).isEmpty();
    }

    @Test
    void publishMessages_publishes_in_order() {
        // When
        bus.publishMessages(List.of(NotificationMessage.of(COUNTERS, created("counter-1")),
                                    NotificationMessage.of(COUNTERS, incremented("counter-1", 2))));

        // Then
        assertThat(received).extracting(NotificationMessage::messageDeduplicationId)
                            .containsExactly("COUNTERS#counter-1#1", "COUNTERS#counter-1#2");
    }
}
