package dk.cloudcreate.essentials.reducer.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link HandleAwareUnitOfWorkFactory} that manages the {@link Handle} and the underlying database transaction itself.<br>
 * The active {@link UnitOfWork} is bound to the current thread until it's committed or rolled back.<br>
 * Example:
 * <pre>{@code
 * var unitOfWorkFactory = GenericHandleAwareUnitOfWorkFactory.create(Jdbi.create(jdbcUrl, username, password));
 * unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute("..."));
 * }</pre>
 *
 * @param <UOW> the {@link UnitOfWork} sub-type created
 */
public abstract class GenericHandleAwareUnitOfWorkFactory<UOW extends GenericHandleAwareUnitOfWorkFactory.GenericHandleAwareUnitOfWork> implements HandleAwareUnitOfWorkFactory<UOW> {
    private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWorkFactory.class);

    private final Jdbi             jdbi;
    private final ThreadLocal<UOW> unitOfWorks = new ThreadLocal<>();

    protected GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    /**
     * Create a factory producing plain {@link GenericHandleAwareUnitOfWork}'s
     *
     * @param jdbi the jdbi instance
     * @return the new factory
     */
    public static GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWork> create(Jdbi jdbi) {
        return new GenericHandleAwareUnitOfWorkFactory<>(jdbi) {
            @Override
            protected GenericHandleAwareUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWork> unitOfWorkFactory) {
                return new GenericHandleAwareUnitOfWork(unitOfWorkFactory);
            }
        };
    }

    @Override
    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public UOW getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UOW getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            unitOfWork = createNewUnitOfWorkInstance(this);
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UOW> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    protected abstract UOW createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<UOW> unitOfWorkFactory);

    private void removeUnitOfWork() {
        unitOfWorks.remove();
    }

    public static class GenericHandleAwareUnitOfWork implements HandleAwareUnitOfWork {
        private final Logger                                    log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWork.class);
        private final GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;
        private       Handle                                    handle;
        private       UnitOfWorkStatus                          status;
        private       Exception                                 causeOfRollback;

        public GenericHandleAwareUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            this.status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted()) {
                log.trace("Starting UnitOfWork with initial status {}", status);
                handle = unitOfWorkFactory.getJdbi().open();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
            } else {
                close();
                throw new UnitOfWorkException(msg("Cannot start an already started UnitOfWork with status {}", status));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.Started) {
                try {
                    beforeCommitting();
                    log.trace("Committing UnitOfWork");
                    handle.commit();
                    status = UnitOfWorkStatus.Committed;
                } finally {
                    close();
                }
                afterCommitting();
            } else if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                rollback();
            } else if (status.isCompleted()) {
                throw new UnitOfWorkException(msg("Cannot commit UnitOfWork as it already has status {}", status));
            } else {
                throw new UnitOfWorkException(msg("Cannot commit UnitOfWork as it has status {}", status));
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                causeOfRollback = cause != null ? cause : causeOfRollback;
                log.debug(msg("Rolling back UnitOfWork with status {}", status), causeOfRollback);
                try {
                    handle.rollback();
                    status = UnitOfWorkStatus.RolledBack;
                } finally {
                    close();
                }
                afterRollback(causeOfRollback);
            } else {
                throw new UnitOfWorkException(msg("Cannot rollback UnitOfWork as it has status {}", status), cause);
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            } else {
                throw new UnitOfWorkException(msg("Cannot mark UnitOfWork for rollback only as it has status {}", status), cause);
            }
        }

        @Override
        public Handle handle() {
            if (handle == null) {
                throw new UnitOfWorkException("No active transaction");
            }
            return handle;
        }

        private void close() {
            unitOfWorkFactory.removeUnitOfWork();
            if (handle != null) {
                handle.close();
                handle = null;
            }
        }

        protected void beforeCommitting() {
        }

        protected void afterCommitting() {
        }

        protected void afterRollback(Exception cause) {
        }
    }
}
