package dk.cloudcreate.essentials.reducer.commands.test_data;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.List;

/**
 * Bank account aggregate holding the current balance
 */
public class BankAccount {
    public static final EventStoreId BANK_ACCOUNTS   = EventStoreId.of("BANK_ACCOUNTS");
    public static final String       ACCOUNT_OPENED  = "ACCOUNT_OPENED";
    public static final String       MONEY_DEPOSITED = "MONEY_DEPOSITED";

    public final String accountId;
    public final long   balance;
    public final long   version;

    public BankAccount(String accountId, long balance, long version) {
        this.accountId = accountId;
        this.balance = balance;
        this.version = version;
    }

    public static class BankAccountEvent {
    }

    public static class AccountOpened extends BankAccountEvent {
    }

    public static class MoneyDeposited extends BankAccountEvent {
        public final long amount;

        public MoneyDeposited(long amount) {
            this.amount = amount;
        }
    }

    public static final Reducer<BankAccount, BankAccountEvent> REDUCER = (account, event) -> {
        if (event.payload() instanceof MoneyDeposited) {
            return new BankAccount(account.accountId, account.balance + ((MoneyDeposited) event.payload()).amount, event.version());
        }
        return new BankAccount(event.aggregateId(), 0, event.version());
    };

    public static EventStore<BankAccountEvent, BankAccount> newBankAccountEventStore() {
        return new EventStore<BankAccountEvent, BankAccount>(BANK_ACCOUNTS,
                                                             List.of(EventType.of(ACCOUNT_OPENED, AccountOpened.class),
                                                                     EventType.of(MONEY_DEPOSITED, MoneyDeposited.class)),
                                                             REDUCER);
    }

    public static EventDetail<BankAccountEvent> accountOpened(String accountId) {
        return EventDetail.<BankAccountEvent>builder()
                          .aggregateId(accountId)
                          .version(EventDetail.FIRST_VERSION)
                          .type(ACCOUNT_OPENED)
                          .payload(new AccountOpened())
                          .build();
    }

    public static EventDetail<BankAccountEvent> moneyDeposited(String accountId, long version, long amount) {
        return EventDetail.<BankAccountEvent>builder()
                          .aggregateId(accountId)
                          .version(version)
                          .type(MONEY_DEPOSITED)
                          .payload(new MoneyDeposited(amount))
                          .build();
    }
}
