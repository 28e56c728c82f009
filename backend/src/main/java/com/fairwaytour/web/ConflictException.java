package com.fairwaytour.web;

import org.springframework.http.HttpStatus;

public class ConflictException extends FairwayException {

    public ConflictException(String code, String message) {
        super(HttpStatus.CONFLICT, code, message);
    }

    public static ConflictException alreadyRegistered(String detail) {
        return new ConflictException("already_registered", detail);
    }

    public static ConflictException alreadyGrouped(String detail) {
        return new ConflictException("already_grouped", detail);
    }

    public static ConflictException groupFull(String detail) {
        return new ConflictException("group_full", detail);
    }

    public static ConflictException illegalTransition(String detail) {
        return new ConflictException("illegal_transition", detail);
    }

    public static ConflictException notInGroup(String detail) {
        return new ConflictException("not_in_group", detail);
    }

    public static ConflictException notOpenStart(String detail) {
        return new ConflictException("not_open_start", detail);
    }

    public static ConflictException registrationWindowClosed(String detail) {
        return new ConflictException("registration_window_closed", detail);
    }

    public static ConflictException notEnrolled(String detail) {
        return new ConflictException("not_enrolled", detail);
    }

    public static ConflictException incompleteScorecards(String detail) {
        return new ConflictException("incomplete_scorecards", detail);
    }

    public static ConflictException notFinalized(String detail) {
        return new ConflictException("not_finalized", detail);
    }
}
