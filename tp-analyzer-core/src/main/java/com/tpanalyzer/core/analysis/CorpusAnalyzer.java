package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.AnalysisResult;
import com.tpanalyzer.core.model.CallGraph;
import com.tpanalyzer.core.model.ControlFlowGraph;
import com.tpanalyzer.core.model.ErrorHandler;
import com.tpanalyzer.core.model.HomingProcedure;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.StateDiagram;
import com.tpanalyzer.core.model.SymbolTables;
import com.tpanalyzer.core.parser.EmptyFileException;
import com.tpanalyzer.core.parser.ProgramAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzes a corpus of program texts.
 *
 * <p>Processing happens in two phases:
 * <ol>
 *   <li><b>Parse</b>: each file is assembled into a {@link Program} on a fixed worker
 *       pool. Files are independent, so the parses share no state.</li>
 *   <li><b>Aggregate</b>: after every parse has finished, programs are sorted by name and
 *       the symbol tables, call graph and per-program flow analyses are built on the
 *       calling thread.</li>
 * </ol>
 * A file that cannot be assembled (empty text, or an unexpected parser failure) is listed
 * in {@link AnalysisResult#rejectedFiles()} and does not affect the rest of the corpus.
 * This class never touches the file system.
 */
public class CorpusAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CorpusAnalyzer.class);

    private final AnalyzerConfig config;
    private final ProgramAssembler assembler;
    private final SymbolAggregator symbolAggregator = new SymbolAggregator();
    private final CallGraphBuilder callGraphBuilder = new CallGraphBuilder();
    private final ControlFlowExtractor flowExtractor;
    private final StateMachineDeriver stateDeriver;
    private final ErrorHandlerInventory errorInventory;
    private final HomingAnalyzer homingAnalyzer;

    /**
     * Creates an analyzer.
     *
     * @param config analyzer configuration
     * @throws java.util.regex.PatternSyntaxException if a configured pattern is invalid
     */
    public CorpusAnalyzer(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null").withDefaults();
        this.assembler = new ProgramAssembler(this.config);
        this.flowExtractor = new ControlFlowExtractor(this.config);
        this.stateDeriver = new StateMachineDeriver(this.config);
        this.errorInventory = new ErrorHandlerInventory(this.config);
        this.homingAnalyzer = new HomingAnalyzer(this.config);
    }

    /**
     * Analyzes a corpus.
     *
     * @param filesByName program text keyed by file name
     * @return complete analysis result
     * @throws IllegalStateException if the calling thread is interrupted while waiting for
     *     the parsers
     */
    public AnalysisResult analyze(Map<String, String> filesByName) {
        Objects.requireNonNull(filesByName, "filesByName must not be null");
        log.info("Analyzing {} program files", filesByName.size());

        SortedMap<String, String> rejected = new TreeMap<>();
        List<Program> parsed = parseAll(new TreeMap<>(filesByName), rejected);
        List<Program> programs = deduplicate(parsed, rejected);
        programs.sort(Comparator.comparing(Program::name));

        SymbolTables symbols = symbolAggregator.aggregate(programs);
        CallGraph callGraph = callGraphBuilder.build(programs);

        SortedMap<String, ControlFlowGraph> flowGraphs = new TreeMap<>();
        SortedMap<String, StateDiagram> stateDiagrams = new TreeMap<>();
        List<ErrorHandler> errorHandlers = new ArrayList<>();
        List<HomingProcedure> homingProcedures = new ArrayList<>();
        for (Program program : programs) {
            ControlFlowGraph graph = flowExtractor.extract(program);
            flowGraphs.put(program.name(), graph);
            stateDiagrams.put(program.name(), stateDeriver.derive(program, graph));
            errorHandlers.addAll(errorInventory.inventory(program, graph));
            homingProcedures.addAll(homingAnalyzer.analyze(program, graph));
        }

        AnalysisResult result = new AnalysisResult(programs, rejected, symbols, callGraph,
            flowGraphs, stateDiagrams, errorHandlers, homingProcedures);
        log.info("Analyzed {} programs ({} rejected files, {} warnings, {} dangling calls)",
            programs.size(), rejected.size(), result.warningCount(), callGraph.danglingCalls().size());
        return result;
    }

    /**
     * Analyzes a single program text.
     *
     * @param fileName file name
     * @param text program text
     * @return analysis result for a one-file corpus
     */
    public AnalysisResult analyzeSingle(String fileName, String text) {
        return analyze(Map.of(fileName, text));
    }

    private List<Program> parseAll(SortedMap<String, String> files, Map<String, String> rejected) {
        if (files.isEmpty()) {
            return new ArrayList<>();
        }

        int workers = Math.min(config.effectiveParallelism(), files.size());
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "tp-parser-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            Map<String, Future<Program>> futures = new TreeMap<>();
            files.forEach((fileName, text) ->
                futures.put(fileName, executor.submit(() -> assembler.assemble(fileName, text))));

            List<Program> programs = new ArrayList<>();
            for (Map.Entry<String, Future<Program>> entry : futures.entrySet()) {
                try {
                    programs.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof EmptyFileException) {
                        log.warn("Skipping empty file {}", entry.getKey());
                        rejected.put(entry.getKey(), "empty file");
                    } else {
                        log.warn("Failed to parse {}: {}", entry.getKey(), cause.getMessage(), cause);
                        rejected.put(entry.getKey(), "parse failure: " + cause.getMessage());
                    }
                }
            }
            return programs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing program files", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Program> deduplicate(List<Program> parsed, Map<String, String> rejected) {
        // parsed is in file-name order, so the first file for a name wins
        Map<String, Program> byName = new HashMap<>();
        List<Program> programs = new ArrayList<>();
        for (Program program : parsed) {
            Program existing = byName.putIfAbsent(program.name(), program);
            if (existing == null) {
                programs.add(program);
            } else {
                log.warn("{} declares program {} already defined by {}",
                    program.fileName(), program.name(), existing.fileName());
                rejected.put(program.fileName(), "duplicate program name " + program.name()
                    + " (already defined by " + existing.fileName() + ")");
            }
        }
        return programs;
    }
}
