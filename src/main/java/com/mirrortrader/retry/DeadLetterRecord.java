package com.mirrortrader.retry;

import com.mirrortrader.domain.model.MirrorAction;
import java.time.Instant;

/** A submission that will not be retried again, kept for inspection. */
public record DeadLetterRecord(MirrorAction action, int attempts, String lastError, Instant timestamp) {}
