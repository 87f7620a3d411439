package com.streamhistory.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamhistory.insights.AnnualRecap;
import com.streamhistory.insights.AnnualRecapGenerator;
import com.streamhistory.insights.ArtistSummary;
import com.streamhistory.insights.ArtistSummaryGenerator;
import com.streamhistory.insights.InsightGeneratorInterface;
import com.streamhistory.insights.LifetimeStats;
import com.streamhistory.insights.LifetimeStatsGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the stages in order: read, adapt, filter, resolve artist identities, consolidate, aggregate.
 * <p>
 * Each stage receives immutable lists from the previous one. The three insight generators are pure
 * reductions over the same canonical log and run concurrently on a small pool; the outcome is the
 * same as running them one after another.
 * <p>
 * Fatal failures (missing Spotify input) surface as {@link MissingInputException} before any
 * output exists. A missing or unusable Apple Music file degrades the run to Spotify-only mode.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class StreamingHistoryPipeline {
    private static final Logger logger = LoggerFactory.getLogger(StreamingHistoryPipeline.class);

    private final Clock clock;
    private final int failureSampleSize;
    private final HistoryReaderInterface<SpotifyRawRecord> spotifyReader;
    private final HistoryReaderInterface<AppleMusicRawRecord> appleMusicReader;
    private final ProviderAdapterInterface<SpotifyRawRecord> spotifyAdapter;
    private final ProviderAdapterInterface<AppleMusicRawRecord> appleMusicAdapter;
    private final QualityFilter filter;
    private final ArtistResolverInterface resolver;
    private final Consolidator consolidator;
    private final LifetimeStatsGenerator lifetimeGenerator;
    private final AnnualRecapGenerator annualGenerator;
    private final ArtistSummaryGenerator artistGenerator;

    public StreamingHistoryPipeline(PipelineSettings settings, Clock clock) {
        this(settings, clock, new ArtistIdentityResolver(settings));
    }

    public StreamingHistoryPipeline(PipelineSettings settings, Clock clock, ArtistResolverInterface resolver) {
        if (settings == null || clock == null || resolver == null) {
            throw new IllegalArgumentException("Settings, clock and resolver cannot be null");
        }
        this.clock = clock;
        this.failureSampleSize = settings.failureSampleSize();
        this.spotifyReader = new SpotifyHistoryReader(new ObjectMapper(), settings.failureSampleSize());
        this.appleMusicReader = new AppleMusicHistoryReader(settings.failureSampleSize());
        this.spotifyAdapter = new SpotifyAdapter(settings.failureSampleSize());
        this.appleMusicAdapter = new AppleMusicAdapter(settings.failureSampleSize());
        this.filter = new QualityFilter(settings, clock);
        this.resolver = resolver;
        this.consolidator = new Consolidator();
        this.lifetimeGenerator = new LifetimeStatsGenerator(settings, clock);
        this.annualGenerator = new AnnualRecapGenerator(settings);
        this.artistGenerator = new ArtistSummaryGenerator(settings);
    }

    /**
     * Reads the input files and runs every stage.
     * @param input export locations
     * @return the run's documents
     * @throws MissingInputException if Spotify input is absent, unreadable or empty
     */
    public PipelineResult run(PipelineInput input) {
        if (input == null) {
            throw new IllegalArgumentException("Pipeline input cannot be null");
        }
        RawBatch<SpotifyRawRecord> spotify = spotifyReader.read(input.spotifyFiles());
        RawBatch<AppleMusicRawRecord> appleMusic = null;
        String appleMusicSkipReason = null;
        Path applePath = input.appleMusicFile();
        if (applePath == null) {
            logger.info("No Apple Music export given");
        } else if (!Files.isRegularFile(applePath)) {
            appleMusicSkipReason = "Apple Music export not found: " + applePath;
            logger.warn("{}; continuing in Spotify-only mode", appleMusicSkipReason);
        } else {
            try {
                appleMusic = appleMusicReader.read(List.of(applePath));
            } catch (MissingInputException e) {
                appleMusicSkipReason = e.getMessage();
                logger.warn("Ignoring Apple Music export: {}; continuing in Spotify-only mode", e.getMessage());
            }
        }
        return process(spotify, appleMusic, appleMusicSkipReason);
    }

    /**
     * Runs every stage over records that are already in memory.
     * @param spotify decoded Spotify records
     * @param appleMusic decoded Apple Music records, or null when not supplied
     * @return the run's documents
     * @throws MissingInputException if there are no Spotify records
     */
    public PipelineResult process(RawBatch<SpotifyRawRecord> spotify, RawBatch<AppleMusicRawRecord> appleMusic) {
        return process(spotify, appleMusic, null);
    }

    private PipelineResult process(RawBatch<SpotifyRawRecord> spotify, RawBatch<AppleMusicRawRecord> appleMusic,
                                   String appleMusicSkipReason) {
        if (spotify == null || spotify.records().isEmpty()) {
            throw new MissingInputException("spotify", "No Spotify streaming records to process");
        }
        boolean appleMusicSupplied = appleMusic != null;

        AdapterResult spotifyAdapted = spotifyAdapter.adapt(spotify.records());
        AdapterResult appleAdapted = appleMusicSupplied
            ? appleMusicAdapter.adapt(appleMusic.records())
            : AdapterResult.empty(Provider.APPLE_MUSIC);

        QualityFilter.Result spotifyKept = filter.apply(spotifyAdapted.events());
        QualityFilter.Result appleKept = filter.apply(appleAdapted.events());

        ArtistIdentityResolver.Resolution resolution =
            resolver.resolve(spotifyKept.kept(), appleKept.kept(), appleMusicSupplied);

        List<StreamEvent> canonical = consolidator.consolidate(spotifyKept.kept(),
            appleMusicSupplied ? resolution.appleMusicEvents : null);

        Insights insights = generate(canonical);

        List<String> samples = new ArrayList<>();
        addSamples(samples, spotify.failureSamples());
        addSamples(samples, spotifyAdapted.failureSamples());
        if (appleMusicSupplied) {
            addSamples(samples, appleMusic.failureSamples());
            addSamples(samples, appleAdapted.failureSamples());
        }
        Map<String, Integer> totalDrops = new LinkedHashMap<>();
        for (FilterDecision d : FilterDecision.values()) {
            if (d.kept()) continue;
            totalDrops.put(ruleName(d), spotifyKept.decisions().get(d) + appleKept.decisions().get(d));
        }
        PipelineSummary summary = new PipelineSummary(clock.instant(), appleMusicSupplied, appleMusicSkipReason,
            canonical.size(),
            List.of(counts(Provider.SPOTIFY, spotify, spotifyAdapted, spotifyKept),
                counts(Provider.APPLE_MUSIC, appleMusic, appleAdapted, appleKept)),
            totalDrops, samples);

        logger.info("Pipeline finished: {} canonical events ({} Spotify, {} Apple Music)",
            canonical.size(), spotifyKept.kept().size(), resolution.appleMusicEvents.size());
        return new PipelineResult(summary, canonical, resolution.report,
            insights.lifetime, insights.annual, insights.artists);
    }

    private Insights generate(List<StreamEvent> canonical) {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<LifetimeStats> lifetime = pool.submit(() -> timed(lifetimeGenerator, canonical));
            Future<Map<String, AnnualRecap>> annual = pool.submit(() -> timed(annualGenerator, canonical));
            Future<Map<String, ArtistSummary>> artists = pool.submit(() -> timed(artistGenerator, canonical));
            return new Insights(lifetime.get(), annual.get(), artists.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while generating insights", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("Insight generation failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static <T> T timed(InsightGeneratorInterface<T> generator, List<StreamEvent> events) {
        long start = System.nanoTime();
        T document = generator.generate(events);
        logger.debug("Generated {} in {} ms", generator.name(), (System.nanoTime() - start) / 1_000_000);
        return document;
    }

    private void addSamples(List<String> samples, List<String> more) {
        for (String s : more) {
            if (samples.size() >= failureSampleSize) return;
            samples.add(s);
        }
    }

    private static PipelineSummary.ProviderCounts counts(Provider provider, RawBatch<?> raw, AdapterResult adapted,
                                                         QualityFilter.Result filtered) {
        int decodeFailures = raw == null ? 0 : raw.failedCount();
        Map<String, Integer> drops = new LinkedHashMap<>();
        for (FilterDecision d : FilterDecision.values()) {
            if (!d.kept()) drops.put(ruleName(d), filtered.decisions().get(d));
        }
        return new PipelineSummary.ProviderCounts(provider,
            adapted.totalRecords() + decodeFailures,
            adapted.failedCount() + decodeFailures,
            adapted.parsedCount(),
            filtered.kept().size(),
            filtered.dropped(),
            drops);
    }

    static String ruleName(FilterDecision decision) {
        return decision.name().toLowerCase(Locale.ROOT);
    }

    private static final class Insights {
        final LifetimeStats lifetime;
        final Map<String, AnnualRecap> annual;
        final Map<String, ArtistSummary> artists;

        Insights(LifetimeStats lifetime, Map<String, AnnualRecap> annual, Map<String, ArtistSummary> artists) {
            this.lifetime = lifetime;
            this.annual = annual;
            this.artists = artists;
        }
    }
}
