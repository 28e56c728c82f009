package com.fairwaytour.web;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class AlreadyFinalizedException extends FairwayException {

    public AlreadyFinalizedException(UUID competitionId) {
        super(HttpStatus.CONFLICT, "already_finalized",
                "Competition results are already final: " + competitionId);
    }
}
