package com.fairwaytour.web;

import java.util.UUID;

/**
 * Identity of the caller as asserted by the upstream auth layer.
 */
public record CallerContext(
        UUID playerId,
        boolean admin
) {

    public static final CallerContext ANONYMOUS = new CallerContext(null, false);

    public UUID requirePlayerId() {
        if (playerId == null) {
            throw AuthorizationException.identityRequired();
        }
        return playerId;
    }
}
