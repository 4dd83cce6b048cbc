package org.example.storybook.controller;

/**
 * Error body returned by the REST controllers.
 */
public record ApiError(String error, String requestId) {
}
