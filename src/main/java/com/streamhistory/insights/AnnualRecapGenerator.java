package com.streamhistory.insights;

import com.streamhistory.pipeline.PipelineSettings;
import com.streamhistory.pipeline.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups the canonical log by UTC calendar year and builds one {@link AnnualRecap} per year.
 * <p>
 * Every event lands in exactly one year, so the yearly play totals add up to the lifetime total.
 * Years are keyed by their decimal string and emitted in ascending order.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class AnnualRecapGenerator implements InsightGeneratorInterface<Map<String, AnnualRecap>> {
    private static final Logger logger = LoggerFactory.getLogger(AnnualRecapGenerator.class);

    private final int topListSize;

    public AnnualRecapGenerator(int topListSize) {
        if (topListSize < 1) {
            throw new IllegalArgumentException("topListSize must be >= 1");
        }
        this.topListSize = topListSize;
    }

    public AnnualRecapGenerator(PipelineSettings settings) {
        this(settings.topListSize());
    }

    @Override
    public String name() {
        return "annual recaps";
    }

    @Override
    public Map<String, AnnualRecap> generate(List<StreamEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("Event list cannot be null");
        }
        Map<Integer, StatsAccumulator> years = new TreeMap<>();
        for (StreamEvent e : events) {
            int year = e.timestamp().atZone(Calendars.ZONE).getYear();
            years.computeIfAbsent(year, y -> new StatsAccumulator()).add(e);
        }
        Map<String, AnnualRecap> recaps = new LinkedHashMap<>();
        for (Map.Entry<Integer, StatsAccumulator> entry : years.entrySet()) {
            StatsAccumulator acc = entry.getValue();
            recaps.put(Integer.toString(entry.getKey()), new AnnualRecap(
                entry.getKey(),
                acc.toYearStats(),
                acc.artists().top(topListSize),
                acc.tracks().top(topListSize),
                acc.albums().top(topListSize)));
        }
        logger.info("Generated annual recaps for {} years", recaps.size());
        return Collections.unmodifiableMap(recaps);
    }
}
