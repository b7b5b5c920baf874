package dk.cloudcreate.essentials.reducer.eventstore.postgresql.persistence;

import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Logs the rendered SQL and execution time of every statement run against the events table.<br>
 * Successful statements are logged at TRACE and failed statements at ERROR, using the <code>EventStore.Sql</code> logger.
 */
public class EventStoreSqlLogger implements SqlLogger {
    public static final String LOGGER_NAME = "EventStore.Sql";

    private final Logger log;

    public EventStoreSqlLogger() {
        log = LoggerFactory.getLogger(LOGGER_NAME);
    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}",
                      Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(),
                      context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        log.error(msg("Failed Execution time: {} ms - {}",
                      Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis(),
                      context.getRenderedSql()),
                  ex);
    }
}
