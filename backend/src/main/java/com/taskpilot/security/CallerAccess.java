package com.taskpilot.security;

import com.taskpilot.exception.ForbiddenException;
import com.taskpilot.exception.UnauthorizedException;

/**
 * Binds the per-user path segment to the authenticated caller.
 */
public final class CallerAccess {

    private CallerAccess() {
    }

    public static String requireSameUser(String pathUserId, String callerId) {
        if (callerId == null) {
            throw new UnauthorizedException("Authentication required");
        }
        if (!callerId.equals(pathUserId)) {
            throw new ForbiddenException("Access denied");
        }
        return callerId;
    }
}
