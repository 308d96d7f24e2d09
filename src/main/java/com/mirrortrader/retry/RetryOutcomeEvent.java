package com.mirrortrader.retry;

import com.mirrortrader.domain.model.MirrorAction;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a queued submission leaves the retry queue, either accepted by the venue
 * or dead-lettered. The engine listens to reconcile the order it registered as PENDING.
 */
public class RetryOutcomeEvent extends ApplicationEvent {

    public enum Type {
        ACCEPTED,
        DEAD_LETTERED
    }

    private final Type type;
    private final MirrorAction action;
    private final Long orderId;
    private final DeadLetterRecord deadLetter;

    private RetryOutcomeEvent(Object source, Type type, MirrorAction action, Long orderId, DeadLetterRecord deadLetter) {
        super(source);
        this.type = type;
        this.action = action;
        this.orderId = orderId;
        this.deadLetter = deadLetter;
    }

    public static RetryOutcomeEvent accepted(Object source, MirrorAction action, long orderId) {
        return new RetryOutcomeEvent(source, Type.ACCEPTED, action, orderId, null);
    }

    public static RetryOutcomeEvent deadLettered(Object source, DeadLetterRecord deadLetter) {
        return new RetryOutcomeEvent(source, Type.DEAD_LETTERED, deadLetter.action(), null, deadLetter);
    }

    public Type getType() {
        return type;
    }

    public MirrorAction getAction() {
        return action;
    }

    /** Venue order id, set for ACCEPTED. */
    public Long getOrderId() {
        return orderId;
    }

    /** Set for DEAD_LETTERED. */
    public DeadLetterRecord getDeadLetter() {
        return deadLetter;
    }
}
