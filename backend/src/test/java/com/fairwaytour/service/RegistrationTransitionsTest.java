package com.fairwaytour.service;

import com.fairwaytour.model.RegistrationStatus;
import com.fairwaytour.web.ConflictException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegistrationTransitionsTest {

    @Test
    void unregisteredPlayersCanOnlyJoinAsLookingForGroupOrRegistered() {
        assertTrue(RegistrationTransitions.isAllowed(null, RegistrationStatus.LOOKING_FOR_GROUP));
        assertTrue(RegistrationTransitions.isAllowed(null, RegistrationStatus.REGISTERED));
        assertFalse(RegistrationTransitions.isAllowed(null, RegistrationStatus.PLAYING));
        assertFalse(RegistrationTransitions.isAllowed(null, RegistrationStatus.FINISHED));
        assertFalse(RegistrationTransitions.isAllowed(null, RegistrationStatus.WITHDRAWN));
    }

    @Test
    void groupingAndPlayTransitionsFollowTheTable() {
        assertTrue(RegistrationTransitions.isAllowed(RegistrationStatus.LOOKING_FOR_GROUP, RegistrationStatus.REGISTERED));
        assertTrue(RegistrationTransitions.isAllowed(RegistrationStatus.LOOKING_FOR_GROUP, RegistrationStatus.PLAYING));
        assertTrue(RegistrationTransitions.isAllowed(RegistrationStatus.REGISTERED, RegistrationStatus.LOOKING_FOR_GROUP));
        assertTrue(RegistrationTransitions.isAllowed(RegistrationStatus.REGISTERED, RegistrationStatus.PLAYING));
        assertTrue(RegistrationTransitions.isAllowed(RegistrationStatus.PLAYING, RegistrationStatus.FINISHED));
        assertTrue(RegistrationTransitions.isAllowed(RegistrationStatus.PLAYING, RegistrationStatus.WITHDRAWN));

        assertFalse(RegistrationTransitions.isAllowed(RegistrationStatus.LOOKING_FOR_GROUP, RegistrationStatus.FINISHED));
        assertFalse(RegistrationTransitions.isAllowed(RegistrationStatus.PLAYING, RegistrationStatus.LOOKING_FOR_GROUP));
        assertFalse(RegistrationTransitions.isAllowed(RegistrationStatus.PLAYING, RegistrationStatus.REGISTERED));
        assertFalse(RegistrationTransitions.isAllowed(RegistrationStatus.REGISTERED, RegistrationStatus.REGISTERED));
    }

    @ParameterizedTest
    @EnumSource(RegistrationStatus.class)
    void terminalStatusesAllowNoFurtherTransition(RegistrationStatus target) {
        assertFalse(RegistrationTransitions.isAllowed(RegistrationStatus.FINISHED, target));
        assertFalse(RegistrationTransitions.isAllowed(RegistrationStatus.WITHDRAWN, target));
    }

    @Test
    void requireRaisesIllegalTransitionConflict() {
        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> RegistrationTransitions.require(RegistrationStatus.FINISHED, RegistrationStatus.PLAYING)
        );

        assertEquals("illegal_transition", ex.getCode());
        assertDoesNotThrow(() -> RegistrationTransitions.require(
                RegistrationStatus.REGISTERED,
                RegistrationStatus.PLAYING
        ));
    }
}
