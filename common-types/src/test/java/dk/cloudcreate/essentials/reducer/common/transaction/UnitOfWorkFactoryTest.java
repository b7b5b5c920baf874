package dk.cloudcreate.essentials.reducer.common.transaction;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class UnitOfWorkFactoryTest {
    private TestUnitOfWorkFactory unitOfWorkFactory;

    @BeforeEach
    void setup() {
        unitOfWorkFactory = new TestUnitOfWorkFactory();
    }

    @Test
    void a_new_unit_of_work_is_committed_when_the_function_succeeds() {
        // When
        var result = unitOfWorkFactory.withUnitOfWork(unitOfWork -> "done");

        // Then
        assertThat(result).isEqualTo("done");
        assertThat(unitOfWorkFactory.lastUnitOfWork.status()).isEqualTo(UnitOfWorkStatus.Committed);
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
    }

    @Test
    void a_new_unit_of_work_is_rolled_back_and_runtime_exceptions_are_rethrown_unchanged() {
        // Given
        var failure = new IllegalStateException("Failed");

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            throw failure;
        })).isSameAs(failure);

        // Then
        assertThat(unitOfWorkFactory.lastUnitOfWork.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
        assertThat(unitOfWorkFactory.lastUnitOfWork.getCauseOfRollback()).isSameAs(failure);
    }

    @Test
    void checked_exceptions_are_rethrown_as_unchecked_exceptions() {
        // Given
        var failure = new IOException("Failed");

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            throw failure;
        })).isInstanceOf(RuntimeException.class)
           .hasRootCause(failure);

        // Then
        assertThat(unitOfWorkFactory.lastUnitOfWork.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
    }

    @Test
    void a_nested_call_joins_the_existing_unit_of_work_without_committing_it() {
        // When
        unitOfWorkFactory.usingUnitOfWork(outer -> {
            unitOfWorkFactory.usingUnitOfWork(inner -> assertThat(inner).isSameAs(outer));
            assertThat(outer.status()).isEqualTo(UnitOfWorkStatus.Started);
        });

        // Then
        assertThat(unitOfWorkFactory.createdUnitOfWorks).isEqualTo(1);
        assertThat(unitOfWorkFactory.lastUnitOfWork.status()).isEqualTo(UnitOfWorkStatus.Committed);
    }

    @Test
    void a_failing_nested_call_marks_the_existing_unit_of_work_as_rollback_only() {
        // Given
        var failure = new IllegalArgumentException("Nested failure");

        // When
        unitOfWorkFactory.usingUnitOfWork(outer -> {
            assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(inner -> {
                throw failure;
            })).isSameAs(failure);
            assertThat(outer.status()).isEqualTo(UnitOfWorkStatus.MarkedForRollbackOnly);
        });

        // Then
        assertThat(unitOfWorkFactory.lastUnitOfWork.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
        assertThat(unitOfWorkFactory.lastUnitOfWork.getCauseOfRollback()).isSameAs(failure);
    }

    @Test
    void getRequiredUnitOfWork_fails_without_an_active_unit_of_work() {
        assertThatThrownBy(() -> unitOfWorkFactory.getRequiredUnitOfWork())
                .isExactlyInstanceOf(NoActiveUnitOfWorkException.class);
    }

    private static class TestUnitOfWorkFactory implements UnitOfWorkFactory<TestUnitOfWork> {
        private final ThreadLocal<TestUnitOfWork> current = new ThreadLocal<>();
        private       TestUnitOfWork              lastUnitOfWork;
        private       int                         createdUnitOfWorks;

        @Override
        public TestUnitOfWork getRequiredUnitOfWork() {
            return getCurrentUnitOfWork().orElseThrow(NoActiveUnitOfWorkException::new);
        }

        @Override
        public TestUnitOfWork getOrCreateNewUnitOfWork() {
            return getCurrentUnitOfWork().orElseGet(() -> {
                var unitOfWork = new TestUnitOfWork(current);
                unitOfWork.start();
                current.set(unitOfWork);
                lastUnitOfWork = unitOfWork;
                createdUnitOfWorks++;
                return unitOfWork;
            });
        }

        @Override
        public Optional<TestUnitOfWork> getCurrentUnitOfWork() {
            return Optional.ofNullable(current.get());
        }
    }

    /**
     * Tracks status only, there's no underlying transaction
     */
    private static class TestUnitOfWork implements UnitOfWork {
        private final ThreadLocal<TestUnitOfWork> current;
        private       UnitOfWorkStatus            status = UnitOfWorkStatus.Ready;
        private       Exception                   causeOfRollback;

        private TestUnitOfWork(ThreadLocal<TestUnitOfWork> current) {
            this.current = current;
        }

        @Override
        public void start() {
            status = UnitOfWorkStatus.Started;
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                rollback();
                return;
            }
            status = UnitOfWorkStatus.Committed;
            current.remove();
        }

        @Override
        public void rollback(Exception cause) {
            causeOfRollback = cause;
            status = UnitOfWorkStatus.RolledBack;
            current.remove();
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
            causeOfRollback = cause;
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
        }
    }
}
