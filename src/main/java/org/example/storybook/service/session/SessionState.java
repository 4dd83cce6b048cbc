package org.example.storybook.service.session;

/**
 * Observable state of a story's visual session.
 */
public enum SessionState {
    /** No session handle exists. */
    NONE,
    /** A handle exists but priming was never confirmed; it must be rebuilt before use. */
    PARTIAL,
    /** Handle present and primed; ready for generation turns. */
    ACTIVE
}
