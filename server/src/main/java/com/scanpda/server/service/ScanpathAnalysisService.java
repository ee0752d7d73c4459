package com.scanpda.server.service;

import com.scanpda.server.grammar.Grammar;
import com.scanpda.server.grammar.GrammarLoader;
import com.scanpda.server.grammar.Production;
import com.scanpda.server.grammar.Terminal;
import com.scanpda.server.pda.RecognitionResult;
import com.scanpda.server.pda.StackAutomaton;
import com.scanpda.server.pda.Verdict;
import com.scanpda.server.pda.completion.Completion;
import com.scanpda.server.pda.completion.CompletionEngine;
import com.scanpda.server.pda.diagnosis.MissingStep;
import com.scanpda.server.pda.diagnosis.MissingStepDiagnoser;
import com.scanpda.server.util.ConfigResolver;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

@Service
public class ScanpathAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ScanpathAnalysisService.class);

    /**
     * Everything bound to one grammar, published as a unit so a request never
     * mixes two grammars.
     */
    private static final class Analysis {
        final Grammar grammar;
        final StackAutomaton automaton;
        final CompletionEngine completionEngine;
        final MissingStepDiagnoser diagnoser;

        Analysis(Grammar grammar) {
            this.grammar = grammar;
            this.automaton = new StackAutomaton(grammar);
            this.completionEngine = new CompletionEngine(automaton);
            this.diagnoser = new MissingStepDiagnoser(grammar);
        }
    }

    private final PdaConfig config;
    private volatile Analysis analysis;

    public ScanpathAnalysisService() {
        this(ConfigResolver.loadConfig());
    }

    public ScanpathAnalysisService(PdaConfig config) {
        this.config = config != null ? config : PdaConfig.defaults();
    }

    @PostConstruct
    public void init() {
        String resource = ConfigResolver.resolveGrammarResource(config);
        logger.info("Initializing scanpath analysis with grammar {}", resource);
        useGrammar(new GrammarLoader().loadResource(resource));
    }

    /**
     * Replaces the grammar every later analysis runs against.
     */
    public void useGrammar(Grammar g) {
        this.analysis = new Analysis(g);
        logger.info("Scanpath analysis ready: grammar '{}', alphabet {}", g.getName(), g.getAlphabet());
    }

    public boolean isReady() {
        return analysis != null;
    }

    public Grammar getGrammar() {
        Analysis current = analysis;
        return current != null ? current.grammar : null;
    }

    public PdaConfig getConfig() {
        return config;
    }

    /**
     * @throws com.scanpda.server.grammar.UnknownSymbolException if a label is
     *                                                          outside the
     *                                                          alphabet
     */
    public ScanpathReport analyze(List<String> labels) {
        Analysis current = requireReady();
        return analyzeScanpath(current, current.grammar.scanpath(labels));
    }

    /**
     * @throws com.scanpda.server.grammar.UnknownSymbolException if a terminal
     *                                                          is outside the
     *                                                          alphabet
     */
    public ScanpathReport analyzeScanpath(List<Terminal> input) {
        return analyzeScanpath(requireReady(), input);
    }

    private ScanpathReport analyzeScanpath(Analysis current, List<Terminal> input) {
        RecognitionResult result = current.automaton.run(input);
        List<MissingStep> missing = current.diagnoser.diagnose(result);

        List<Terminal> suffix = null;
        List<Terminal> completed = null;
        Boolean verified = null;
        if (result.getVerdict() == Verdict.INCOMPLETE) {
            if (config.verifyCompletion) {
                Completion completion = current.completionEngine.completeAndVerify(result);
                suffix = completion.getSuffix();
                completed = completion.getCompletedSequence();
                verified = completion.isVerified();
            } else {
                suffix = current.completionEngine.complete(result);
                completed = new ArrayList<>(input);
                completed.addAll(suffix);
            }
        }

        logger.debug("Scanpath {} -> {} (completion={}, missing={})", input, result.getVerdict(), suffix,
                missing.size());
        return new ScanpathReport(current.grammar.getName(), result.getInput(), result.getVerdict(),
                result.getRejection(), config.includeTrace ? result.getTrace() : null, result.getResidualStack(),
                suffix, completed, verified, missing);
    }

    /**
     * Analyzes independent scanpaths concurrently. Labels are checked for
     * every scanpath before any run starts; reports come back in input order.
     */
    public List<ScanpathReport> analyzeAll(List<List<String>> batch) {
        Analysis current = requireReady();
        List<List<Terminal>> inputs = new ArrayList<>(batch.size());
        for (List<String> labels : batch) {
            inputs.add(current.grammar.scanpath(labels));
        }
        if (inputs.isEmpty()) {
            return new ArrayList<>();
        }

        int threads = Math.max(1, Math.min(config.batchThreads, inputs.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ScanpathReport>> futures = new ArrayList<>(inputs.size());
            for (List<Terminal> input : inputs) {
                futures.add(pool.submit(() -> analyzeScanpath(current, input)));
            }
            List<ScanpathReport> reports = new ArrayList<>(futures.size());
            for (Future<ScanpathReport> f : futures) {
                reports.add(f.get());
            }
            logger.info("Analyzed batch of {} scanpaths on {} threads", reports.size(), threads);
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Batch analysis failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    public Map<String, Object> describeGrammar() {
        Grammar grammar = requireReady().grammar;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", grammar.getName());
        out.put("start", grammar.getStart());
        out.put("alphabet", grammar.getAlphabet());
        Map<String, String> productions = new LinkedHashMap<>();
        for (Production p : grammar.getProductions()) {
            productions.put(p.getNonterminal().getLabel(), p.getAlternatives().stream()
                    .map(Object::toString).collect(Collectors.joining(" | ")));
        }
        out.put("productions", productions);
        return out;
    }

    private Analysis requireReady() {
        Analysis current = analysis;
        if (current == null) {
            throw new IllegalStateException("Grammar not loaded yet");
        }
        return current;
    }
}
