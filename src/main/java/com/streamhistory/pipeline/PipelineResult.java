package com.streamhistory.pipeline;

import com.streamhistory.insights.AnnualRecap;
import com.streamhistory.insights.ArtistSummary;
import com.streamhistory.insights.LifetimeStats;

import java.util.List;
import java.util.Map;

/**
 * Everything one run produced, ready for serialization.
 *
 * @param summary run diagnostics
 * @param canonicalLog time-ascending merged event log
 * @param mappingReport artist identity resolution diagnostics
 * @param lifetimeStats all-time statistics
 * @param annualRecaps per-year recaps keyed by year
 * @param artistSummary per-artist statistics keyed by canonical artist name
 */
public record PipelineResult(
    PipelineSummary summary,
    List<StreamEvent> canonicalLog,
    ArtistMappingReport mappingReport,
    LifetimeStats lifetimeStats,
    Map<String, AnnualRecap> annualRecaps,
    Map<String, ArtistSummary> artistSummary
) {
    public PipelineResult {
        canonicalLog = List.copyOf(canonicalLog);
    }
}
