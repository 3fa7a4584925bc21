package com.chainbills.ledger.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Emits ledger events to the log once their transaction has committed.
 * Events of rolled back operations are never seen here.
 */
@Component
@Slf4j
public class LedgerEventLogger {

    @TransactionalEventListener
    public void onUserInitialized(UserInitializedEvent event) {
        log.info("[EVENT] UserInitialized {}", event);
    }

    @TransactionalEventListener
    public void onPayableCreated(PayableCreatedEvent event) {
        log.info("[EVENT] PayableCreated {}", event);
    }

    @TransactionalEventListener
    public void onPayableClosed(PayableClosedEvent event) {
        log.info("[EVENT] PayableClosed {}", event);
    }

    @TransactionalEventListener
    public void onPayableReopened(PayableReopenedEvent event) {
        log.info("[EVENT] PayableReopened {}", event);
    }

    @TransactionalEventListener
    public void onAllowedTokensUpdated(PayableAllowedTokensUpdatedEvent event) {
        log.info("[EVENT] PayableAllowedTokensUpdated {}", event);
    }

    @TransactionalEventListener
    public void onPaymentRecorded(PaymentRecordedEvent event) {
        log.info("[EVENT] PaymentRecorded {}", event);
    }

    @TransactionalEventListener
    public void onWithdrawalRecorded(WithdrawalRecordedEvent event) {
        log.info("[EVENT] WithdrawalRecorded {}", event);
    }
}
