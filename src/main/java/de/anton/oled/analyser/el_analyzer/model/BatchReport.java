package de.anton.oled.analyser.el_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch: the results of every sample that completed and the reason for every
 * sample that was aborted.
 */
public final class BatchReport {

    private final List<SampleResult> results = new ArrayList<>();
    private final Map<SampleRun, String> failures = new LinkedHashMap<>();

    public void addResult(SampleResult result) { results.add(result); }
    public void addFailure(SampleRun run, String reason) { failures.put(run, reason); }

    public List<SampleResult> getResults() { return Collections.unmodifiableList(results); }
    public Map<SampleRun, String> getFailures() { return Collections.unmodifiableMap(failures); }

    public boolean hasFailures() { return !failures.isEmpty(); }
    public int total() { return results.size() + failures.size(); }

    @Override
    public String toString() {
        return "BatchReport{processed=" + results.size() + ", failed=" + failures.size() + '}';
    }
}
