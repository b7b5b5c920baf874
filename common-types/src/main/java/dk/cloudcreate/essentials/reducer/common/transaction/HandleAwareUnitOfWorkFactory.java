package dk.cloudcreate.essentials.reducer.common.transaction;

import org.jdbi.v3.core.Jdbi;

/**
 * Specialization of {@link UnitOfWorkFactory} that creates and maintains {@link HandleAwareUnitOfWork}'s
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
    /**
     * The {@link Jdbi} instance the {@link HandleAwareUnitOfWork}'s get their {@link org.jdbi.v3.core.Handle} from
     */
    Jdbi getJdbi();
}
