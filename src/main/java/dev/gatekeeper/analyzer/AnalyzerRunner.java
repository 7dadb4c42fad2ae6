package dev.gatekeeper.analyzer;

import dev.gatekeeper.domain.valueobject.ChangedLineSet;
import dev.gatekeeper.domain.valueobject.Finding;
import dev.gatekeeper.domain.valueobject.ReviewConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered analyzer over one file's changed lines.
 *
 * <p>Each analyzer is isolated: a failure is logged and counted as a degraded-analyzer
 * event and never drops the findings of the others. Output is grouped by registration
 * order, then sorted by line number within each analyzer.
 */
public class AnalyzerRunner {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRunner.class);
    static final String FAILURE_METRIC = "gatekeeper.analyzer.failures";

    private final List<Analyzer> analyzers;
    private final MeterRegistry meterRegistry;

    public AnalyzerRunner(List<Analyzer> analyzers, MeterRegistry meterRegistry) {
        this.analyzers = List.copyOf(analyzers);
        this.meterRegistry = meterRegistry;
    }

    public List<Finding> run(String filePath, ChangedLineSet lines, ReviewConfig config) {
        if (lines.isEmpty()) return List.of();

        List<Finding> findings = new ArrayList<>();
        for (Analyzer analyzer : analyzers) {
            if (!analyzer.supports(filePath)) {
                log.trace("{} does not apply to {}", analyzer.name(), filePath);
                continue;
            }
            try {
                List<Finding> produced = new ArrayList<>(analyzer.analyze(filePath, lines, config));
                produced.sort(Comparator.comparingInt(Finding::line));
                findings.addAll(produced);
            } catch (RuntimeException e) {
                log.warn("Analyzer {} failed on {}, continuing without it: {}",
                        analyzer.name(), filePath, e.getMessage(), e);
                failureCounter(analyzer).increment();
            }
        }
        return findings;
    }

    public List<Analyzer> analyzers() {
        return analyzers;
    }

    private Counter failureCounter(Analyzer analyzer) {
        return Counter.builder(FAILURE_METRIC)
                .description("Analyzer invocations that threw and were skipped")
                .tag("analyzer", analyzer.name())
                .register(meterRegistry);
    }
}
