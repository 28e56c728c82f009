package com.fairwaytour.service;

import com.fairwaytour.model.RegistrationStatus;
import com.fairwaytour.web.ConflictException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed registration status changes. A null "from" status means the player has no registration row.
 */
public final class RegistrationTransitions {

    private static final Set<RegistrationStatus> FROM_UNREGISTERED =
            Collections.unmodifiableSet(EnumSet.of(RegistrationStatus.LOOKING_FOR_GROUP, RegistrationStatus.REGISTERED));

    private static final Map<RegistrationStatus, Set<RegistrationStatus>> ALLOWED =
            new EnumMap<>(RegistrationStatus.class);

    static {
        ALLOWED.put(RegistrationStatus.LOOKING_FOR_GROUP, EnumSet.of(
                RegistrationStatus.REGISTERED,
                RegistrationStatus.PLAYING,
                RegistrationStatus.WITHDRAWN
        ));
        ALLOWED.put(RegistrationStatus.REGISTERED, EnumSet.of(
                RegistrationStatus.LOOKING_FOR_GROUP,
                RegistrationStatus.PLAYING,
                RegistrationStatus.WITHDRAWN
        ));
        ALLOWED.put(RegistrationStatus.PLAYING, EnumSet.of(
                RegistrationStatus.FINISHED,
                RegistrationStatus.WITHDRAWN
        ));
        ALLOWED.put(RegistrationStatus.FINISHED, EnumSet.noneOf(RegistrationStatus.class));
        ALLOWED.put(RegistrationStatus.WITHDRAWN, EnumSet.noneOf(RegistrationStatus.class));
    }

    private RegistrationTransitions() {
    }

    public static boolean isAllowed(RegistrationStatus from, RegistrationStatus to) {
        if (to == null) {
            return false;
        }
        if (from == null) {
            return FROM_UNREGISTERED.contains(to);
        }
        return ALLOWED.get(from).contains(to);
    }

    public static void require(RegistrationStatus from, RegistrationStatus to) {
        if (!isAllowed(from, to)) {
            throw ConflictException.illegalTransition(
                    "Cannot move registration from " + (from == null ? "UNREGISTERED" : from) + " to " + to
            );
        }
    }
}
