package com.fairwaytour.web;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class LockedException extends FairwayException {

    public LockedException(UUID participantId) {
        super(HttpStatus.LOCKED, "scorecard_locked",
                "Scorecard is locked and cannot be modified: " + participantId);
    }
}
