package org.snrasm.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snrasm.compiler.api.AssemblerOptions;
import org.snrasm.compiler.api.AssemblyResult;
import org.snrasm.compiler.api.ICompiler;
import org.snrasm.compiler.backend.emit.EmissionContext;
import org.snrasm.compiler.backend.emit.EmissionRegistry;
import org.snrasm.compiler.backend.emit.Emitter;
import org.snrasm.compiler.backend.encode.EncodedUnit;
import org.snrasm.compiler.backend.encode.InstructionEncoder;
import org.snrasm.compiler.backend.encode.UnitEncoder;
import org.snrasm.compiler.backend.layout.LayoutEngine;
import org.snrasm.compiler.backend.layout.LayoutResult;
import org.snrasm.compiler.backend.link.Linker;
import org.snrasm.compiler.backend.link.LinkingRegistry;
import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.disasm.Disassembler;
import org.snrasm.compiler.frontend.irgen.IrConverterRegistry;
import org.snrasm.compiler.frontend.irgen.IrGenerator;
import org.snrasm.compiler.frontend.lexer.Lexer;
import org.snrasm.compiler.frontend.parser.Parser;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.ProgramScope;
import org.snrasm.compiler.frontend.semantics.SemanticAnalyzer;
import org.snrasm.compiler.frontend.semantics.Symbol;
import org.snrasm.compiler.frontend.semantics.UnitAnalysis;
import org.snrasm.compiler.frontend.units.ParsedUnit;
import org.snrasm.compiler.frontend.units.SourceUnit;
import org.snrasm.compiler.frontend.units.UnitSplitter;
import org.snrasm.compiler.incremental.ContentHash;
import org.snrasm.compiler.incremental.StageCache;
import org.snrasm.compiler.incremental.UnitArtifact;
import org.snrasm.compiler.ir.IrProgram;
import org.snrasm.compiler.isa.IInstructionSet;
import org.snrasm.compiler.isa.ScenarioInstructionSet;
import org.snrasm.compiler.isa.TextCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The main assembler implementation. This class orchestrates the pipeline from source text
 * to a code block.
 * <p>
 * The file is split into units that are parsed, analyzed and encoded on their own; only
 * symbol collection, layout and linking look at the whole file. Unit results are memoized
 * by content hash, so assembling an edited file only recomputes the units that changed
 * (and all units when a global definition changed). Instances are thread-safe; close them
 * to stop the worker threads.
 */
public class Compiler implements ICompiler, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    /** The file name of diagnostics that are later rebound to the real file. */
    private static final String UNIT_FILE = "<unit>";

    private final AssemblerOptions options;
    private final IInstructionSet isa = ScenarioInstructionSet.getInstance();
    private final TextCodec text;
    private final StageCache<ParsedUnit> parseCache;
    private final StageCache<UnitArtifact> unitCache;
    private final ExecutorService executor;

    public Compiler() {
        this(AssemblerOptions.defaults());
    }

    public Compiler(AssemblerOptions options) {
        this(options,
                new StageCache<>("parse", options.cacheMaxEntries()),
                new StageCache<>("unit", options.cacheMaxEntries()));
    }

    Compiler(AssemblerOptions options, StageCache<ParsedUnit> parseCache, StageCache<UnitArtifact> unitCache) {
        this.options = options;
        this.text = new TextCodec(options.textEncoding());
        this.parseCache = parseCache;
        this.unitCache = unitCache;
        this.executor = Executors.newFixedThreadPool(options.parallelism(), new WorkerThreadFactory());
    }

    @Override
    public AssemblyResult assemble(String source, String fileName) {
        long startTime = System.nanoTime();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(fileName);

        // Phase 1: split and parse every unit
        List<SourceUnit> units = UnitSplitter.split(source);
        List<ParsedUnit> parsed = new ArrayList<>(units.size());
        for (SourceUnit unit : units) {
            ParsedUnit p = parse(unit);
            parsed.add(p);
            p.diagnostics().forEach(d -> diagnostics.report(rebind(d, fileName, unit.offset())));
        }
        long parsedTime = System.nanoTime();

        // Phase 2: collect the file-level symbols
        DiagnosticsEngine scopeDiagnostics = new DiagnosticsEngine(fileName);
        ProgramScope scope = new SemanticAnalyzer(scopeDiagnostics, isa)
                .collect(parsed.stream().map(p -> p.root().shift(p.unit().offset())).toList());
        diagnostics.mergeFrom(scopeDiagnostics, 0);
        long collectedTime = System.nanoTime();

        // Phase 3: analyze, lower and encode every unit in parallel
        List<UnitArtifact> artifacts = compileUnits(parsed, scope);
        List<EncodedUnit> encoded = new ArrayList<>(artifacts.size());
        for (int i = 0; i < artifacts.size(); i++) {
            int offset = units.get(i).offset();
            artifacts.get(i).diagnostics().forEach(d -> diagnostics.report(rebind(d, fileName, offset)));
            encoded.add(artifacts.get(i).code());
        }
        long encodedTime = System.nanoTime();

        // Phase 4: layout, link and emit the block
        LayoutResult layout = new LayoutEngine().layout(encoded, options.baseAddress());
        List<Integer> spanOffsets = units.stream().map(SourceUnit::offset).toList();
        List<byte[]> linked = new Linker(LinkingRegistry.initializeWithDefaults())
                .link(encoded, spanOffsets, layout, diagnostics);
        byte[] code = new Emitter().emit(linked, layout);

        String globalPrefix = Symbol.GLOBAL + "::";
        Map<String, Long> symbols = new LinkedHashMap<>();
        layout.labelToAddress().forEach((key, address) -> {
            if (key.startsWith(globalPrefix)) {
                symbols.put(key.substring(globalPrefix.length()), address);
            }
        });

        long endTime = System.nanoTime();
        LOG.debug("Assembled {}: {} units, {} bytes (parse {} ms, collect {} ms, units {} ms, link {} ms)",
                fileName, units.size(), code.length,
                millis(startTime, parsedTime), millis(parsedTime, collectedTime),
                millis(collectedTime, encodedTime), millis(encodedTime, endTime));
        return new AssemblyResult(code, symbols, diagnostics.getDiagnostics());
    }

    /**
     * @return A disassembler using the same base address, text encoding and label prefix.
     */
    public Disassembler disassembler() {
        return new Disassembler(isa, text, options.baseAddress(), options.labelPrefix());
    }

    public AssemblerOptions options() {
        return options;
    }

    /**
     * Drops all memoized unit results.
     */
    public void invalidateCaches() {
        parseCache.invalidateAll();
        unitCache.invalidateAll();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private ParsedUnit parse(SourceUnit unit) {
        if (!options.cacheEnabled()) {
            return parseUncached(unit);
        }
        return parseCache.computeIfAbsent(ContentHash.of(unit.text()), () -> parseUncached(unit)).relocate(unit);
    }

    private ParsedUnit parseUncached(SourceUnit unit) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(UNIT_FILE);
        Lexer lexer = new Lexer(unit.text(), diagnostics);
        SyntaxNode root = new Parser(lexer.scanTokens(), diagnostics).parse();
        return new ParsedUnit(unit, root, diagnostics.getDiagnostics());
    }

    private List<UnitArtifact> compileUnits(List<ParsedUnit> parsed, ProgramScope scope) {
        List<Future<UnitArtifact>> futures = new ArrayList<>(parsed.size());
        for (ParsedUnit p : parsed) {
            futures.add(executor.submit(() -> compileUnit(p, scope)));
        }
        List<UnitArtifact> artifacts = new ArrayList<>(parsed.size());
        try {
            for (Future<UnitArtifact> future : futures) {
                artifacts.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while compiling units", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Unit compilation failed", e.getCause());
        }
        return artifacts;
    }

    private UnitArtifact compileUnit(ParsedUnit parsed, ProgramScope scope) {
        if (!options.cacheEnabled()) {
            return compileUnitUncached(parsed, scope);
        }
        String key = ContentHash.of(parsed.unit().text(), scope.fingerprint(), text.charset().name());
        return unitCache.computeIfAbsent(key, () -> compileUnitUncached(parsed, scope));
    }

    private UnitArtifact compileUnitUncached(ParsedUnit parsed, ProgramScope scope) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(UNIT_FILE);
        UnitAnalysis analysis = new SemanticAnalyzer(diagnostics, isa).analyzeUnit(parsed.root(), scope);
        IrProgram ir = new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults())
                .generate(parsed.root(), analysis, parsed.unit().name());
        IrProgram emitted = EmissionRegistry.initializeWithDefaults().apply(ir, new EmissionContext(isa));
        EncodedUnit code = new UnitEncoder(new InstructionEncoder(text)).encode(emitted, diagnostics);
        return new UnitArtifact(code, diagnostics.getDiagnostics());
    }

    private static Diagnostic rebind(Diagnostic d, String fileName, int delta) {
        Diagnostic moved = d.shift(delta);
        return new Diagnostic(moved.type(), moved.message(), fileName, moved.span(), moved.labels());
    }

    private static long millis(long from, long to) {
        return (to - from) / 1_000_000;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "snrasm-unit-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
