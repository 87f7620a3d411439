package com.streamhistory.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Keeps only events that represent genuine, attributable music listens.
 * <p>
 * Drop rules:
 * <ul>
 *   <li>non-music content (podcast, video, audiobook or unknown media)</li>
 *   <li>incognito sessions</li>
 *   <li>skipped plays shorter than the skip threshold</li>
 *   <li>zero play time</li>
 *   <li>timestamps before the earliest valid instant or after the processing time</li>
 * </ul>
 * The predicate is pure and order independent. Processing time comes from the injected {@link Clock}.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class QualityFilter implements Predicate<StreamEvent> {
    private static final Logger logger = LoggerFactory.getLogger(QualityFilter.class);

    private final long skipThresholdMs;
    private final Instant earliestValid;
    private final Clock clock;

    public QualityFilter(long skipThresholdMs, Instant earliestValid, Clock clock) {
        this.skipThresholdMs = skipThresholdMs;
        this.earliestValid = earliestValid;
        this.clock = clock;
    }

    public QualityFilter(PipelineSettings settings, Clock clock) {
        this(settings.skipThresholdMs(), settings.earliestValidTimestamp(), clock);
    }

    /**
     * Classifies an event against the drop rules.
     * @param event adapted event
     * @return KEPT, or the first rule the event breaks
     */
    public FilterDecision evaluate(StreamEvent event) {
        if (event.contentType() != ContentType.MUSIC) return FilterDecision.NON_MUSIC;
        if (event.incognito()) return FilterDecision.INCOGNITO;
        if (event.skipped() && event.msPlayed() < skipThresholdMs) return FilterDecision.SHORT_SKIP;
        if (event.msPlayed() <= 0) return FilterDecision.NO_PLAYTIME;
        Instant ts = event.timestamp();
        if (ts.isBefore(earliestValid) || ts.isAfter(clock.instant())) return FilterDecision.OUT_OF_RANGE_TIMESTAMP;
        return FilterDecision.KEPT;
    }

    @Override
    public boolean test(StreamEvent event) {
        return evaluate(event).kept();
    }

    /**
     * Applies the filter to a batch and tallies drops per rule.
     * @param events adapted events
     * @return kept events in input order plus per-rule counts
     */
    public Result apply(List<StreamEvent> events) {
        List<StreamEvent> kept = new ArrayList<>(events.size());
        Map<FilterDecision, Integer> counts = new EnumMap<>(FilterDecision.class);
        for (FilterDecision d : FilterDecision.values()) counts.put(d, 0);
        for (StreamEvent e : events) {
            FilterDecision d = evaluate(e);
            counts.merge(d, 1, Integer::sum);
            if (d.kept()) kept.add(e);
        }
        logger.info("Quality filter kept {} of {} events (drops: {})", kept.size(), events.size(), counts);
        return new Result(kept, counts);
    }

    /**
     * @param kept surviving events
     * @param decisions number of events per decision, KEPT included
     */
    public record Result(List<StreamEvent> kept, Map<FilterDecision, Integer> decisions) {
        public Result {
            kept = List.copyOf(kept);
            decisions = Collections.unmodifiableMap(new EnumMap<>(decisions));
        }

        public int dropped() {
            return decisions.entrySet().stream()
                .filter(e -> !e.getKey().kept())
                .mapToInt(Map.Entry::getValue)
                .sum();
        }
    }
}
