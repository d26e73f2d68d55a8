package com.example.summarizer.summary;

import jakarta.validation.constraints.NotBlank;

/** Request body for a new summary: the page to summarize. */
public record SummaryPayload(@NotBlank String url) {
}
