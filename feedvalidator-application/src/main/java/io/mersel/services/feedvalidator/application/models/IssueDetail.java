package io.mersel.services.feedvalidator.application.models;

/**
 * One underlying finding of an aggregate issue.
 *
 * @param message Human readable description
 * @param line    Source line in the feed, {@code null} when unknown
 */
public record IssueDetail(String message, Integer line) {

    public static IssueDetail of(String message) {
        return new IssueDetail(message, null);
    }
}
