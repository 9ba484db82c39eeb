package com.vidnyan.ecv.application.service;

import com.vidnyan.ecv.application.port.in.GenerateTestsUseCase;
import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.Technique;
import com.vidnyan.ecv.generation.TestGenerationTechnique;
import com.vidnyan.ecv.verification.MultiModalVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Orchestrates test generation: runs each selected technique for each rule, merges the
 * results per rule and passes them through the multi-modal verifier.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TestGenerationService implements GenerateTestsUseCase {

    /** Column order of the work grid, which is also the merge order. */
    private static final List<Technique> MERGE_ORDER = List.of(
            Technique.METAMORPHIC, Technique.SYMBOLIC, Technique.ADVERSARIAL, Technique.CAUSAL);

    private final List<TestGenerationTechnique> techniques;
    private final MultiModalVerifier verifier;
    private final ConditionModel conditionModel;
    private final EcvProperties properties;

    @Override
    public Map<String, List<TestCase>> generateTests(List<Rule> rules, Specification specification,
                                                     boolean parallel, Set<String> techniqueTags) {
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(specification, "specification");
        Instant startTime = Instant.now();
        log.info("Starting test generation for {} rules ({})", rules.size(), parallel ? "parallel" : "sequential");

        // Step 1: Select techniques
        log.info("Step 1: Selecting techniques...");
        Map<Technique, TestGenerationTechnique> selected = select(techniqueTags);
        log.info("Selected techniques: {}", selected.keySet());

        // Step 2: Run the (rule, technique) grid
        log.info("Step 2: Generating candidate test cases...");
        Map<String, Map<Technique, List<TestCase>>> generated = parallel
                ? runParallel(rules, specification, selected)
                : runSequential(rules, specification, selected);

        // Step 3: Merge, tag and verify per rule
        log.info("Step 3: Verifying candidate test cases...");
        Map<String, List<TestCase>> results = new LinkedHashMap<>();
        int candidates = 0;
        for (Rule rule : rules) {
            List<TestCase> merged = merge(rule, specification, generated.getOrDefault(rule.id(), Map.of()));
            candidates += merged.size();
            List<TestCase> verified;
            try {
                verified = verifier.verify(rule, specification, merged, rules);
            } catch (Exception e) {
                log.error("Error verifying test cases for rule {}: {}", rule.id(), e.getMessage());
                verified = List.of();
            }
            results.put(rule.id(), verified);
            log.info("  Rule {}: {} of {} candidates verified", rule.id(), verified.size(), merged.size());
        }

        long total = results.values().stream().mapToInt(List::size).sum();
        log.info("Test generation complete: {} of {} candidates kept in {}ms",
                total, candidates, Duration.between(startTime, Instant.now()).toMillis());
        return results;
    }

    /**
     * Registered techniques restricted to the requested tags, in merge order. Empty = all.
     */
    private Map<Technique, TestGenerationTechnique> select(Set<String> techniqueTags) {
        Set<Technique> requested = EnumSet.noneOf(Technique.class);
        if (techniqueTags != null) {
            for (String tag : techniqueTags) {
                Technique.fromTag(tag).ifPresentOrElse(requested::add,
                        () -> log.warn("Ignoring unknown technique: {}", tag));
            }
        }

        Map<Technique, TestGenerationTechnique> byTag = new EnumMap<>(Technique.class);
        techniques.forEach(t -> byTag.put(t.technique(), t));

        Map<Technique, TestGenerationTechnique> selected = new LinkedHashMap<>();
        for (Technique technique : MERGE_ORDER) {
            boolean wanted = requested.isEmpty() || requested.contains(technique);
            if (wanted && byTag.containsKey(technique)) {
                selected.put(technique, byTag.get(technique));
            }
        }
        requested.stream()
                .filter(t -> !MERGE_ORDER.contains(t))
                .forEach(t -> log.warn("Technique {} cannot be selected on its own, ignoring", t.tag()));
        return selected;
    }

    private Map<String, Map<Technique, List<TestCase>>> runSequential(
            List<Rule> rules, Specification specification, Map<Technique, TestGenerationTechnique> selected) {
        Map<String, Map<Technique, List<TestCase>>> generated = new LinkedHashMap<>();
        for (Rule rule : rules) {
            log.info("  Processing rule: {}", rule.id());
            Map<Technique, List<TestCase>> byTechnique = new EnumMap<>(Technique.class);
            selected.forEach((tag, technique) -> {
                if (technique.supports(rule)) {
                    byTechnique.put(tag, runTask(technique, rule, specification));
                }
            });
            generated.put(rule.id(), byTechnique);
        }
        return generated;
    }

    private Map<String, Map<Technique, List<TestCase>>> runParallel(
            List<Rule> rules, Specification specification, Map<Technique, TestGenerationTechnique> selected) {
        Map<String, Map<Technique, Future<List<TestCase>>>> futures = new LinkedHashMap<>();
        int taskCount = 0;
        for (Rule rule : rules) {
            for (TestGenerationTechnique technique : selected.values()) {
                if (technique.supports(rule)) {
                    taskCount++;
                }
            }
        }
        if (taskCount == 0) {
            return Map.of();
        }

        int poolSize = Math.min(properties.getGeneration().getPoolSize(), taskCount);
        log.info("Dispatching {} tasks to {} workers", taskCount, poolSize);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        Duration timeout = properties.getGeneration().getTaskTimeout();
        boolean bounded = timeout != null && !timeout.isZero() && !timeout.isNegative();
        Long deadline = bounded ? Long.valueOf(System.nanoTime() + timeout.toNanos()) : null;
        try {
            for (Rule rule : rules) {
                Map<Technique, Future<List<TestCase>>> perRule = new EnumMap<>(Technique.class);
                selected.forEach((tag, technique) -> {
                    if (technique.supports(rule)) {
                        perRule.put(tag, executor.submit(() -> runTask(technique, rule, specification)));
                    }
                });
                futures.put(rule.id(), perRule);
            }

            Map<String, Map<Technique, List<TestCase>>> generated = new LinkedHashMap<>();
            for (Rule rule : rules) {
                Map<Technique, List<TestCase>> byTechnique = new EnumMap<>(Technique.class);
                futures.getOrDefault(rule.id(), Map.of()).forEach((tag, future) ->
                        byTechnique.put(tag, await(rule, tag, future, deadline)));
                generated.put(rule.id(), byTechnique);
            }
            return generated;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Result of one pooled task. The deadline is counted from submission, so time spent awaiting
     * earlier tasks is not granted again; null waits without limit.
     */
    private List<TestCase> await(Rule rule, Technique technique, Future<List<TestCase>> future, Long deadline) {
        try {
            if (deadline == null) {
                return future.get();
            }
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Technique {} timed out for rule {} after {}", technique.tag(), rule.id(),
                    properties.getGeneration().getTaskTimeout());
        } catch (ExecutionException e) {
            log.error("Technique {} failed for rule {}: {}", technique.tag(), rule.id(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for technique {} on rule {}", technique.tag(), rule.id());
        }
        return List.of();
    }

    /**
     * One (rule, technique) cell. Failures stay inside the cell.
     */
    private List<TestCase> runTask(TestGenerationTechnique technique, Rule rule, Specification specification) {
        try {
            List<TestCase> tests = technique.generate(rule, specification);
            log.debug("    {} produced {} candidates for rule {}", technique.getName(), tests.size(), rule.id());
            return tests;
        } catch (Exception e) {
            log.error("Error running {} on rule {}: {}", technique.getName(), rule.id(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Candidates of one rule in merge order, tagged, with invalid key paths dropped.
     */
    private List<TestCase> merge(Rule rule, Specification specification,
                                 Map<Technique, List<TestCase>> byTechnique) {
        Set<String> formsInScope = conditionModel.analyze(rule, specification).formsInScope();
        List<TestCase> merged = new ArrayList<>();
        for (Technique technique : MERGE_ORDER) {
            for (TestCase test : byTechnique.getOrDefault(technique, List.of())) {
                TestCase tagged = test.tagged();
                if (hasValidKeyPaths(tagged, specification, formsInScope)) {
                    merged.add(tagged);
                } else {
                    log.warn("Dropping test case for rule {} with undeclared fields: {}",
                            rule.id(), tagged.description());
                }
            }
        }
        return merged;
    }

    private static boolean hasValidKeyPaths(TestCase test, Specification specification, Set<String> formsInScope) {
        for (Map.Entry<String, Map<String, Object>> form : test.testData().entrySet()) {
            if (!formsInScope.contains(form.getKey()) || !specification.hasForm(form.getKey())) {
                return false;
            }
            for (String field : form.getValue().keySet()) {
                if (specification.field(form.getKey(), field).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }
}
