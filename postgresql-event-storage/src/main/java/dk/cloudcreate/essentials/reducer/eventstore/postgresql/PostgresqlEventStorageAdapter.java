package dk.cloudcreate.essentials.reducer.eventstore.postgresql;

import com.fasterxml.jackson.core.JsonProcessingException;
import dk.cloudcreate.essentials.reducer.common.transaction.*;
import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.postgresql.persistence.EventStoreSqlLogger;
import dk.cloudcreate.essentials.reducer.eventstore.postgresql.serializer.json.JSONEventSerializer;
import dk.cloudcreate.essentials.reducer.eventstore.storage.*;
import dk.cloudcreate.essentials.reducer.eventstore.storage.ListAggregateIdsResult.ListedAggregateId;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import dk.cloudcreate.essentials.types.LongRange;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.*;

import java.sql.*;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link EventStorageAdapter} that stores the events of all event stores in a single PostgreSQL table.<br>
 * The events of an event store are separated by the <code>event_store_id</code> column and the table has a unique
 * constraint on <code>(event_store_id, aggregate_id, version)</code>, which is what rejects concurrent pushes of the same version.<br>
 * <br>
 * All statements run inside the current {@link HandleAwareUnitOfWork}. If there's no active {@link UnitOfWork} the adapter creates,
 * commits and rolls back its own, which makes {@link #pushEventGroup(List)} all-or-nothing.<br>
 * Payloads and metadata are stored as <code>jsonb</code> using the {@link JSONEventSerializer}, so remember to
 * {@link JSONEventSerializer#registerEventStore(EventStore) register} the event stores whose payloads should be deserialized into their Java types.
 */
public class PostgresqlEventStorageAdapter implements EventStorageAdapter {
    private static final Logger  log                        = LoggerFactory.getLogger(PostgresqlEventStorageAdapter.class);
    private static final Pattern VALID_TABLE_NAME           = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");
    private static final String  UNIQUE_VIOLATION_SQL_STATE = "23505";

    public static final String DEFAULT_EVENTS_TABLE_NAME = "event_store_events";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final JSONEventSerializer                                          jsonSerializer;
    private final String                                                       eventsTableName;
    private final String                                                       insertSql;
    private final String                                                       forcedInsertSql;

    public PostgresqlEventStorageAdapter(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                                         JSONEventSerializer jsonSerializer) {
        this(unitOfWorkFactory, jsonSerializer, DEFAULT_EVENTS_TABLE_NAME);
    }

    /**
     * Create the adapter and the events table (if it doesn't already exist)
     *
     * @param unitOfWorkFactory the unit of work factory providing the {@link Handle} the statements are run on
     * @param jsonSerializer    serializer for payloads and metadata
     * @param eventsTableName   name of the events table
     */
    public PostgresqlEventStorageAdapter(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                                         JSONEventSerializer jsonSerializer,
                                         String eventsTableName) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.eventsTableName = requireNonNull(eventsTableName, "No eventsTableName provided").toLowerCase(Locale.ROOT);
        if (!VALID_TABLE_NAME.matcher(this.eventsTableName).matches()) {
            throw new IllegalArgumentException(msg("Invalid events table name '{}'", eventsTableName));
        }
        insertSql = bind("INSERT INTO {:tableName} (event_store_id, aggregate_id, version, event_type, timestamp, payload, metadata)\n" +
                                 "     VALUES (:eventStoreId, :aggregateId, :version, :eventType, :timestamp, :payload::jsonb, :metadata::jsonb)",
                         arg("tableName", this.eventsTableName));
        forcedInsertSql = insertSql + "\n" +
                "     ON CONFLICT (event_store_id, aggregate_id, version) DO UPDATE SET\n" +
                "        event_type = EXCLUDED.event_type,\n" +
                "        timestamp = EXCLUDED.timestamp,\n" +
                "        payload = EXCLUDED.payload,\n" +
                "        metadata = EXCLUDED.metadata";

        unitOfWorkFactory.getJdbi().setSqlLogger(new EventStoreSqlLogger());
        initializeEventStorage();
    }

    public String getEventsTableName() {
        return eventsTableName;
    }

    public JSONEventSerializer getJsonSerializer() {
        return jsonSerializer;
    }

    private void initializeEventStorage() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            Optional<String> eventsTable = unitOfWork.handle()
                                                     .select("SELECT to_regclass(?)", eventsTableName)
                                                     .mapTo(String.class)
                                                     .findOne();
            if (eventsTable.isEmpty()) {
                createEventsTable(unitOfWork.handle());
            }
            ensureIndexes(unitOfWork.handle());
        });
    }

    private void createEventsTable(Handle handle) {
        log.info("Creating events table '{}'", eventsTableName);
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "    global_order bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                    "    event_store_id text NOT NULL,\n" +
                                    "    aggregate_id text NOT NULL,\n" +
                                    "    version bigint NOT NULL,\n" +
                                    "    event_type text NOT NULL,\n" +
                                    "    timestamp TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "    payload jsonb,\n" +
                                    "    metadata jsonb NOT NULL,\n" +
                                    "    UNIQUE (event_store_id, aggregate_id, version)\n" +
                                    ")",
                            arg("tableName", eventsTableName)));
    }

    private void ensureIndexes(Handle handle) {
        var numberOfChanges = handle.createUpdate(bind("CREATE INDEX IF NOT EXISTS {:tableName}_initial_events ON {:tableName} (event_store_id, version, timestamp)",
                                                       arg("tableName", eventsTableName)))
                                    .execute();
        log.info("'{}' initial events index {}",
                 eventsTableName,
                 numberOfChanges == 1 ? "created" : "already existed");
    }

    /**
     * Drop and re-create the events table. All events of all event stores are lost.
     */
    public void resetEventStorage() {
        log.info("Resetting events table '{}'", eventsTableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute("DROP TABLE IF EXISTS " + eventsTableName));
        initializeEventStorage();
    }

    @Override
    public <PAYLOAD> EventDetail<PAYLOAD> pushEvent(EventDetail<PAYLOAD> event, PushEventContext context) {
        requireNonNull(event, "No event provided");
        requireNonNull(context, "No context provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            insertEvent(unitOfWork.handle(), context.eventStoreId(), event, context.force());
            return event;
        });
    }

    @Override
    public List<EventDetail<?>> pushEventGroup(List<GroupedEvent<?, ?>> groupedEvents) {
        requireNonNull(groupedEvents, "No groupedEvents provided");
        if (groupedEvents.isEmpty()) {
            throw new IllegalArgumentException("Cannot push an empty event group");
        }
        groupedEvents.forEach(this::requireSameEventsTable);

        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            log.debug("Pushing group of {} event(s) to '{}'", groupedEvents.size(), eventsTableName);
            var storedEvents = new ArrayList<EventDetail<?>>(groupedEvents.size());
            for (var groupedEvent : groupedEvents) {
                insertEvent(unitOfWork.handle(), groupedEvent.eventStoreId(), groupedEvent.event(), false);
                storedEvents.add(groupedEvent.event());
            }
            return storedEvents;
        });
    }

    /**
     * A group can only be written in one transaction if every grouped event is stored in this adapter's events table
     */
    private void requireSameEventsTable(GroupedEvent<?, ?> groupedEvent) {
        var adapter = groupedEvent.eventStorageAdapter();
        if (adapter == this) {
            return;
        }
        if (adapter instanceof PostgresqlEventStorageAdapter) {
            var otherAdapter = (PostgresqlEventStorageAdapter) adapter;
            if (otherAdapter.unitOfWorkFactory.getJdbi() == unitOfWorkFactory.getJdbi() && otherAdapter.eventsTableName.equals(eventsTableName)) {
                return;
            }
        }
        throw new EventStoreException(msg("Event store '{}' doesn't store its events in events table '{}' and can't be part of the same event group",
                                          groupedEvent.eventStoreId(),
                                          eventsTableName));
    }

    private void insertEvent(Handle handle, EventStoreId eventStoreId, EventDetail<?> event, boolean force) {
        log.trace("[{}] Inserting event '{}' with version {} for aggregate '{}'{}",
                  eventStoreId,
                  event.type(),
                  event.version(),
                  event.aggregateId(),
                  force ? " (forced)" : "");
        var payload  = jsonSerializer.serializePayload(event.payload());
        var metadata = jsonSerializer.serializeMetadata(event.metadata());
        try {
            handle.createUpdate(force ? forcedInsertSql : insertSql)
                  .bind("eventStoreId", eventStoreId.toString())
                  .bind("aggregateId", event.aggregateId())
                  .bind("version", event.version())
                  .bind("eventType", event.type())
                  .bind("timestamp", event.timestamp())
                  .bind("payload", payload)
                  .bind("metadata", metadata)
                  .execute();
        } catch (JdbiException e) {
            if (isUniqueViolation(e)) {
                throw new EventAlreadyExistsException(eventStoreId, event.aggregateId(), event.version(), e);
            }
            throw new AppendEventException(msg("[{}] Failed to append event '{}' with version {} for aggregate '{}'",
                                               eventStoreId,
                                               event.type(),
                                               event.version(),
                                               event.aggregateId()),
                                           e);
        }
    }

    private static boolean isUniqueViolation(Throwable throwable) {
        var visited = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
        var cause   = throwable;
        while (cause != null && visited.add(cause)) {
            if (cause instanceof SQLException && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) cause).getSQLState())) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    @Override
    public <PAYLOAD> List<EventDetail<PAYLOAD>> getEvents(String aggregateId, EventStoreId eventStoreId, EventsQueryOptions options) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(eventStoreId, "No eventStoreId provided");
        requireNonNull(options, "No options provided");

        var versionRange = options.versionRange();
        if (versionRange.isEmpty()) {
            return List.of();
        }
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var query = unitOfWork.handle()
                                  .createQuery(getEventsSql(versionRange.get(), options))
                                  .bind("eventStoreId", eventStoreId.toString())
                                  .bind("aggregateId", aggregateId)
                                  .bind("versionFrom", versionRange.get().fromInclusive);
            if (versionRange.get().isClosedRange()) {
                query.bind("versionTo", versionRange.get().toInclusive);
            }
            options.limit().ifPresent(limit -> query.bind("limit", limit));
            return query.map(new EventDetailRowMapper<PAYLOAD>(eventStoreId))
                        .list();
        });
    }

    private String getEventsSql(LongRange versionRange, EventsQueryOptions options) {
        var sql = "SELECT * FROM {:tableName} WHERE\n" +
                "   event_store_id = :eventStoreId AND aggregate_id = :aggregateId AND version >= :versionFrom";
        if (versionRange.isClosedRange()) {
            sql += " AND version <= :versionTo";
        }
        sql += options.reverse() ? " ORDER BY version DESC" : " ORDER BY version ASC";
        if (options.limit().isPresent()) {
            sql += " LIMIT :limit";
        }
        return bind(sql, arg("tableName", eventsTableName));
    }

    /**
     * @return true if the calling thread has an active {@link UnitOfWork}, which this adapter joins and which other threads can't see until it's committed
     */
    @Override
    public boolean isTransactionActiveOnCurrentThread() {
        return unitOfWorkFactory.getCurrentUnitOfWork().isPresent();
    }

    @Override
    public ListAggregateIdsResult listAggregateIds(EventStoreId eventStoreId, ListAggregateIdsOptions options) {
        requireNonNull(eventStoreId, "No eventStoreId provided");
        requireNonNull(options, "No options provided");
        var pageToken = options.pageToken()
                               .map(this::readPageToken)
                               .orElseGet(() -> PageToken.from(options));

        var aggregateIds = unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var query = unitOfWork.handle()
                                  .createQuery(listAggregateIdsSql(pageToken))
                                  .bind("eventStoreId", eventStoreId.toString())
                                  .bind("firstVersion", EventDetail.FIRST_VERSION)
                                  .bind("offset", pageToken.offset);
            pageToken.initialEventAfter().ifPresent(after -> query.bind("initialEventAfter", after));
            pageToken.initialEventBefore().ifPresent(before -> query.bind("initialEventBefore", before));
            if (pageToken.limit != null) {
                // One extra row tells whether there's a next page
                query.bind("limit", pageToken.limit + 1);
            }
            return query.map((rs, ctx) -> new ListedAggregateId(rs.getString("aggregate_id"), rs.getObject("timestamp", OffsetDateTime.class)))
                        .list();
        });

        Optional<String> nextPageToken = Optional.empty();
        if (pageToken.limit != null && aggregateIds.size() > pageToken.limit) {
            aggregateIds = aggregateIds.subList(0, pageToken.limit);
            nextPageToken = Optional.of(writePageToken(pageToken.nextPage()));
        }
        log.debug("[{}] Listed {} aggregate id(s) using {}", eventStoreId, aggregateIds.size(), pageToken);
        return new ListAggregateIdsResult(aggregateIds, nextPageToken);
    }

    private String listAggregateIdsSql(PageToken pageToken) {
        var sql = "SELECT aggregate_id, timestamp FROM {:tableName} WHERE\n" +
                "   event_store_id = :eventStoreId AND version = :firstVersion";
        if (pageToken.initialEventAfter != null) {
            sql += " AND timestamp > :initialEventAfter";
        }
        if (pageToken.initialEventBefore != null) {
            sql += " AND timestamp < :initialEventBefore";
        }
        sql += pageToken.reverse ? " ORDER BY timestamp DESC, aggregate_id DESC" : " ORDER BY timestamp ASC, aggregate_id ASC";
        if (pageToken.limit != null) {
            sql += " LIMIT :limit";
        }
        sql += " OFFSET :offset";
        return bind(sql, arg("tableName", eventsTableName));
    }

    private PageToken readPageToken(String pageToken) {
        try {
            return jsonSerializer.getObjectMapper().readValue(pageToken, PageToken.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(msg("Invalid page token '{}'", pageToken), e);
        }
    }

    private String writePageToken(PageToken pageToken) {
        try {
            return jsonSerializer.getObjectMapper().writeValueAsString(pageToken);
        } catch (JsonProcessingException e) {
            throw new EventStoreException(msg("Failed to write page token {}", pageToken), e);
        }
    }

    @Override
    public String toString() {
        return "PostgresqlEventStorageAdapter{" +
                "eventsTableName='" + eventsTableName + '\'' +
                '}';
    }

    private class EventDetailRowMapper<PAYLOAD> implements RowMapper<EventDetail<PAYLOAD>> {
        private final EventStoreId eventStoreId;

        private EventDetailRowMapper(EventStoreId eventStoreId) {
            this.eventStoreId = eventStoreId;
        }

        @SuppressWarnings("unchecked")
        @Override
        public EventDetail<PAYLOAD> map(ResultSet rs, StatementContext ctx) throws SQLException {
            var     eventType = rs.getString("event_type");
            PAYLOAD payload   = (PAYLOAD) jsonSerializer.deserializePayload(eventStoreId, eventType, rs.getString("payload"));
            return EventDetail.<PAYLOAD>builder()
                              .aggregateId(rs.getString("aggregate_id"))
                              .version(rs.getLong("version"))
                              .type(eventType)
                              .timestamp(rs.getObject("timestamp", OffsetDateTime.class))
                              .payload(payload)
                              .metadata(jsonSerializer.deserializeMetadata(rs.getString("metadata")))
                              .build();
        }
    }

    /**
     * The query options and offset of the next page. Serialized as JSON into the {@link ListAggregateIdsResult#nextPageToken()}
     */
    static class PageToken {
        public Integer limit;
        public String  initialEventAfter;
        public String  initialEventBefore;
        public boolean reverse;
        public long    offset;

        static PageToken from(ListAggregateIdsOptions options) {
            var pageToken = new PageToken();
            pageToken.limit = options.limit().orElse(null);
            pageToken.initialEventAfter = options.initialEventAfter().map(OffsetDateTime::toString).orElse(null);
            pageToken.initialEventBefore = options.initialEventBefore().map(OffsetDateTime::toString).orElse(null);
            pageToken.reverse = options.reverse();
            return pageToken;
        }

        PageToken nextPage() {
            var pageToken = new PageToken();
            pageToken.limit = limit;
            pageToken.initialEventAfter = initialEventAfter;
            pageToken.initialEventBefore = initialEventBefore;
            pageToken.reverse = reverse;
            pageToken.offset = offset + limit;
            return pageToken;
        }

        Optional<OffsetDateTime> initialEventAfter() {
            return Optional.ofNullable(initialEventAfter).map(OffsetDateTime::parse);
        }

        Optional<OffsetDateTime> initialEventBefore() {
            return Optional.ofNullable(initialEventBefore).map(OffsetDateTime::parse);
        }

        @Override
        public String toString() {
            return "PageToken{" +
                    "limit=" + limit +
                    ", initialEventAfter='" + initialEventAfter + '\'' +
                    ", initialEventBefore='" + initialEventBefore + '\'' +
                    ", reverse=" + reverse +
                    ", offset=" + offset +
                    '}';
        }
    }
}
