package org.example.storybook.model;

import org.example.storybook.service.session.SessionState;

public record SessionStatus(
    String storyId,
    boolean hasSession,
    boolean contextInitialized,
    SessionState state
) {
    public static SessionStatus none(String storyId) {
        return new SessionStatus(storyId, false, false, SessionState.NONE);
    }
}
