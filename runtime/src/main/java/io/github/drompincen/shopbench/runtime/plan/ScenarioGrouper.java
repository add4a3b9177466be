package io.github.drompincen.shopbench.runtime.plan;

import io.github.drompincen.shopbench.protocol.api.TestStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Buckets flat test rows by scenario and platform, applying an inclusive
 * scenario window.
 */
@Component
public class ScenarioGrouper {

    private static final Logger log = LoggerFactory.getLogger(ScenarioGrouper.class);
    private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");
    private static final Pattern PREFIXED = Pattern.compile("^[A-Za-z]+([0-9]+)$");

    public ScenarioGrouping group(List<TestStep> steps, String scenarioStart, String scenarioEnd) {
        List<String> scenarioIds = new ArrayList<>(new TreeSet<>(
                steps.stream().map(TestStep::scenarioId).toList()));
        List<String> selected = filterScenarioIds(scenarioIds, scenarioStart, scenarioEnd);
        if (selected.size() != scenarioIds.size()) {
            log.info("[Grouper] Scenario window [{} .. {}] keeps {} of {} scenarios",
                    scenarioStart, scenarioEnd, selected.size(), scenarioIds.size());
        }
        TreeSet<String> keep = new TreeSet<>(selected);

        SortedMap<String, SortedMap<String, List<TestStep>>> scenarios = new TreeMap<>();
        for (TestStep step : steps) {
            if (!keep.contains(step.scenarioId())) continue;
            scenarios.computeIfAbsent(step.scenarioId(), k -> new TreeMap<>())
                    .computeIfAbsent(step.platformId(), k -> new ArrayList<>())
                    .add(step);
        }
        // List.sort is stable, so equal indexes keep input order
        scenarios.values().forEach(platforms -> platforms.values()
                .forEach(list -> list.sort(Comparator.comparingDouble(TestStep::numericIndex))));
        return new ScenarioGrouping(scenarios);
    }

    static List<String> filterScenarioIds(List<String> scenarioIds, String scenarioStart, String scenarioEnd) {
        if (scenarioStart == null && scenarioEnd == null) return scenarioIds;
        if (scenarioIds.isEmpty()) return scenarioIds;

        String start = scenarioStart != null ? scenarioStart : scenarioIds.get(0);
        String end = scenarioEnd != null ? scenarioEnd : scenarioIds.get(scenarioIds.size() - 1);
        Optional<BigInteger> startNum = parseNumeric(start);
        Optional<BigInteger> endNum = parseNumeric(end);
        boolean numericBounds = startNum.isPresent() || endNum.isPresent();

        List<String> filtered = new ArrayList<>();
        for (String scenarioId : scenarioIds) {
            Optional<BigInteger> num = parseNumeric(scenarioId);
            if (numericBounds && num.isPresent()) {
                if (startNum.isPresent() && num.get().compareTo(startNum.get()) < 0) continue;
                if (endNum.isPresent() && num.get().compareTo(endNum.get()) > 0) continue;
                filtered.add(scenarioId);
                continue;
            }
            if (scenarioId.compareTo(start) < 0 || scenarioId.compareTo(end) > 0) continue;
            filtered.add(scenarioId);
        }
        return filtered;
    }

    /** {@code "7" -> 7}, {@code "Q001" -> 1}; anything else is empty. Suffixes of any length stay numeric. */
    static Optional<BigInteger> parseNumeric(String value) {
        if (value == null) return Optional.empty();
        String text = value.strip();
        if (DIGITS.matcher(text).matches()) return Optional.of(new BigInteger(text));
        Matcher m = PREFIXED.matcher(text);
        if (m.matches()) return Optional.of(new BigInteger(m.group(1)));
        return Optional.empty();
    }
}
