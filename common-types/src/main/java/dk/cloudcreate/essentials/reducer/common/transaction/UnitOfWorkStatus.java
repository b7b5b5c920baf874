package dk.cloudcreate.essentials.reducer.common.transaction;

/**
 * The status of a {@link UnitOfWork}
 */
public enum UnitOfWorkStatus {
    /**
     * The {@link UnitOfWork} has been created, but not yet {@link #Started}
     */
    Ready(false),
    /**
     * The underlying transaction has begun
     */
    Started(false),
    Committed(true),
    RolledBack(true),
    /**
     * The {@link UnitOfWork} MUST be rolled back when it completes
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
