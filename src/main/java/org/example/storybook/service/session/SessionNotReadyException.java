package org.example.storybook.service.session;

public class SessionNotReadyException extends RuntimeException {

    private final String storyId;
    private final SessionState state;

    public SessionNotReadyException(String storyId, SessionState state) {
        super("Visual session for story " + storyId + " is not ready (state " + state
                + "); ensure or rebuild the session first");
        this.storyId = storyId;
        this.state = state;
    }

    public String getStoryId() {
        return storyId;
    }

    public SessionState getState() {
        return state;
    }
}
