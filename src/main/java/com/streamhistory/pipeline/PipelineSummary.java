package com.streamhistory.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Run diagnostics written as {@code pipeline_summary.json}: how many records each stage
 * read, rejected and kept, and whether the run was degraded to Spotify-only mode.
 * {@code apple_music_skip_reason} says why a given Apple Music export was not used, and is null otherwise.
 */
@JsonPropertyOrder({"generated_at", "apple_music_supplied", "apple_music_skip_reason", "canonical_event_count", "providers", "drops_by_rule", "failure_samples"})
public record PipelineSummary(
    @JsonProperty("generated_at") Instant generatedAt,
    @JsonProperty("apple_music_supplied") boolean appleMusicSupplied,
    @JsonProperty("apple_music_skip_reason") String appleMusicSkipReason,
    @JsonProperty("canonical_event_count") int canonicalEventCount,
    @JsonProperty("providers") List<ProviderCounts> providers,
    @JsonProperty("drops_by_rule") Map<String, Integer> dropsByRule,
    @JsonProperty("failure_samples") List<String> failureSamples
) {
    public PipelineSummary {
        providers = List.copyOf(providers);
        failureSamples = List.copyOf(failureSamples);
    }

    /**
     * Per-provider stage counts. {@code records_read} counts every element seen in the input,
     * including the ones that failed to parse.
     */
    @JsonPropertyOrder({"provider", "records_read", "parse_failures", "adapted", "kept", "dropped", "drops_by_rule"})
    public record ProviderCounts(
        @JsonProperty("provider") Provider provider,
        @JsonProperty("records_read") int recordsRead,
        @JsonProperty("parse_failures") int parseFailures,
        @JsonProperty("adapted") int adapted,
        @JsonProperty("kept") int kept,
        @JsonProperty("dropped") int dropped,
        @JsonProperty("drops_by_rule") Map<String, Integer> dropsByRule
    ) {}

    /**
     * @return counts for the given provider, or null if absent
     */
    public ProviderCounts countsFor(Provider provider) {
        return providers.stream().filter(p -> p.provider() == provider).findFirst().orElse(null);
    }
}
