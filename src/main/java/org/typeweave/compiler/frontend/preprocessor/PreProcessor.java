package org.typeweave.compiler.frontend.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.frontend.lexer.CustomOperatorDef;
import org.typeweave.compiler.frontend.lexer.ScannerOptions;
import org.typeweave.compiler.frontend.lexer.TokenStream;
import org.typeweave.compiler.sourcemap.EditableSource;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The preprocessor for extended host-language source. It runs before the host parser and turns syntax
 * the parser would reject into ordinary host-language text.
 * <p>
 * Enabled extensions run in two phases, each in registration order: first all structural extensions
 * over the tokens of the original text, then all custom operators over the result. The net effect of both
 * phases is expressed as one set of edits over the original text, from which the source map is generated.
 */
public class PreProcessor {

    private static final Logger log = LoggerFactory.getLogger(PreProcessor.class);

    private final SyntaxExtensionRegistry registry;

    /**
     * Constructs a new PreProcessor.
     * @param registry The registry the enabled extensions are looked up in.
     */
    public PreProcessor(SyntaxExtensionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Constructs a PreProcessor over the built-in extensions.
     */
    public PreProcessor() {
        this(SyntaxExtensionRegistry.initialize());
    }

    /**
     * Lists the operator symbols a run with these options recognizes.
     * @param options The options of a run.
     * @return One scanner definition per enabled custom operator.
     */
    public List<CustomOperatorDef> operatorDefinitions(PreprocessOptions options) {
        List<ISyntaxExtension> enabled = new ArrayList<>(registry.select(options.extensions()));
        enabled.addAll(options.customExtensions());
        return enabled.stream()
                .filter(ICustomOperatorExtension.class::isInstance)
                .map(e -> CustomOperatorDef.of(((ICustomOperatorExtension) e).symbol()))
                .toList();
    }

    /**
     * Preprocesses one source text.
     * @param source  The source text.
     * @param options The options of this run.
     * @return The rewritten text and its source map, or the unchanged input.
     */
    public PreprocessResult preprocess(String source, PreprocessOptions options) {
        List<ISyntaxExtension> enabled = new ArrayList<>(registry.select(options.extensions()));
        enabled.addAll(options.customExtensions());
        if (enabled.isEmpty()) {
            return PreprocessResult.unchanged(source);
        }

        List<IStructuralExtension> structural = new ArrayList<>();
        List<ICustomOperatorExtension> operators = new ArrayList<>();
        for (ISyntaxExtension extension : enabled) {
            if (extension instanceof ICustomOperatorExtension op) {
                operators.add(op);
            } else if (extension instanceof IStructuralExtension s) {
                structural.add(s);
            }
        }

        List<CustomOperatorDef> operatorDefs = operators.stream()
                .map(op -> CustomOperatorDef.of(op.symbol()))
                .toList();
        ScannerOptions scannerOptions = ScannerOptions.forFile(operatorDefs, options.fileName());
        String fileName = options.fileName() == null ? "<anonymous>" : options.fileName();

        // Phase 1: structural extensions
        List<Replacement> structuralReplacements = collectStructural(source, structural, scannerOptions, options);
        EditableSource phaseOne = new EditableSource(source);
        for (Replacement r : structuralReplacements) {
            phaseOne.replace(r.start(), r.end(), r.text());
        }
        String intermediate = phaseOne.toString();

        // Phase 2: custom operators
        String code = intermediate;
        List<Replacement> operatorReplacements = List.of();
        if (!operators.isEmpty()) {
            OperatorRewriter rewriter = new OperatorRewriter(operators, scannerOptions, options.maxOperatorIterations());
            OperatorRewriter.Result result = rewriter.rewrite(intermediate);
            if (result.changed()) {
                code = result.code();
                operatorReplacements = result.replacements();
                log.debug("Rewrote {} operator application(s) in {}", result.rewrites(), fileName);
            }
        }

        if (code.equals(source)) {
            return PreprocessResult.unchanged(source);
        }
        return new PreprocessResult(code, true,
                buildMap(source, intermediate, code, structuralReplacements, operatorReplacements, fileName));
    }

    /**
     * Runs each structural extension over a fresh token stream and keeps the replacements that do not
     * overlap an earlier one.
     */
    private List<Replacement> collectStructural(String source, List<IStructuralExtension> structural,
                                                ScannerOptions scannerOptions, PreprocessOptions options) {
        List<Replacement> proposed = new ArrayList<>();
        RewriteOptions rewriteOptions = new RewriteOptions(options.fileName(), options.mode());
        for (IStructuralExtension extension : structural) {
            TokenStream stream = TokenStream.of(source, scannerOptions);
            List<Replacement> replacements = extension.rewrite(stream, source, rewriteOptions);
            if (!replacements.isEmpty()) {
                log.debug("Extension '{}' proposed {} replacement(s)", extension.name(), replacements.size());
            }
            proposed.addAll(replacements);
        }
        // stable: replacements of earlier extensions win at equal starts
        proposed.sort(Comparator.comparingInt(Replacement::start).thenComparingInt(r -> r.isInsertion() ? 0 : 1));

        List<Replacement> accepted = new ArrayList<>(proposed.size());
        for (Replacement candidate : proposed) {
            if (candidate.end() > source.length()) {
                log.warn("Dropping replacement [{}, {}) beyond end of source", candidate.start(), candidate.end());
                continue;
            }
            boolean conflict = accepted.stream().anyMatch(candidate::overlaps);
            if (conflict) {
                log.warn("Dropping replacement [{}, {}) that overlaps an earlier one", candidate.start(), candidate.end());
                continue;
            }
            accepted.add(candidate);
        }
        return accepted;
    }

    private static SourceMap buildMap(String source, String intermediate, String code,
                                      List<Replacement> structural, List<Replacement> operators, String fileName) {
        List<Replacement> combined = operators.isEmpty()
                ? structural
                : ReplacementComposer.compose(intermediate, structural, operators);
        EditableSource edits = new EditableSource(source);
        for (Replacement r : combined) {
            edits.replace(r.start(), r.end(), r.text());
        }
        if (!edits.toString().equals(code)) {
            log.warn("Edit composition for {} diverged from the rewritten text; falling back to a coarse map", fileName);
            return SourceMap.coarse(fileName, fileName, source, code);
        }
        return edits.generateMap(fileName, fileName);
    }
}
