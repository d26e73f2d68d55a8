package com.example.summarizer.summary;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** A summary as returned to clients: the payload plus its server-assigned id. */
@JsonPropertyOrder({"id", "url"})
public record SummaryResponse(long id, String url) {

    public static SummaryResponse from(TextSummary summary) {
        if (summary.getId() == null) {
            throw new IllegalArgumentException("Summary for " + summary.getUrl() + " has not been saved yet");
        }
        return new SummaryResponse(summary.getId(), summary.getUrl());
    }
}
