package com.fairwaytour.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class FairwayDomainEventLogger {

    private static final Logger log = LoggerFactory.getLogger(FairwayDomainEventLogger.class);

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onDomainEvent(FairwayDomainEvent event) {
        log.info("{} committed for competition {}: {}",
                event.getClass().getSimpleName(),
                event.competitionId(),
                event);
    }
}
