package org.typeweave.compiler.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.host.DependencyExtractor;
import org.typeweave.compiler.host.ICompilerHost;
import org.typeweave.compiler.host.SourceFile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The set of source files reachable from the root files through relative imports, as served by a host.
 * <p>
 * Files are loaded once when the program is created; import cycles are followed at most once per file.
 * The type checker is created lazily over the loaded files.
 */
public class Program {

    private static final Logger log = LoggerFactory.getLogger(Program.class);

    private final ICompilerHost host;
    private final List<String> rootFileNames;
    private final Map<String, SourceFile> files = new LinkedHashMap<>();
    private final Map<String, Set<String>> imports = new LinkedHashMap<>();
    private final List<String> missingFiles = new ArrayList<>();
    private ITypeChecker typeChecker;

    private Program(ICompilerHost host, List<String> rootFileNames) {
        this.host = host;
        this.rootFileNames = rootFileNames.stream().map(host::getCanonicalFileName).toList();
    }

    /**
     * Creates a program by loading the root files and everything they import.
     * @param host          The host serving the files.
     * @param rootFileNames The root file names.
     * @return The program.
     */
    public static Program create(ICompilerHost host, Collection<String> rootFileNames) {
        Program program = new Program(host, List.copyOf(rootFileNames));
        program.load();
        return program;
    }

    private void load() {
        Deque<String> queue = new ArrayDeque<>(rootFileNames);
        while (!queue.isEmpty()) {
            String fileName = queue.poll();
            if (files.containsKey(fileName) || missingFiles.contains(fileName)) {
                continue;
            }
            SourceFile sourceFile = host.getSourceFile(fileName);
            if (sourceFile == null) {
                missingFiles.add(fileName);
                log.debug("Program file not found: {}", fileName);
                continue;
            }
            files.put(fileName, sourceFile);
            Set<String> dependencies = DependencyExtractor.resolveDependencies(sourceFile.text(), fileName, host);
            imports.put(fileName, dependencies);
            queue.addAll(dependencies);
        }
        log.debug("Program loaded {} file(s) from {} root(s)", files.size(), rootFileNames.size());
    }

    public List<String> getRootFileNames() {
        return rootFileNames;
    }

    /**
     * @return The source file, or null if it is not part of the program.
     */
    public SourceFile getSourceFile(String fileName) {
        return files.get(host.getCanonicalFileName(fileName));
    }

    public Collection<SourceFile> getSourceFiles() {
        return Collections.unmodifiableCollection(files.values());
    }

    /**
     * @return The resolved relative imports of a file, empty if it is not part of the program.
     */
    public Set<String> getImports(String fileName) {
        return imports.getOrDefault(host.getCanonicalFileName(fileName), Set.of());
    }

    public List<String> getMissingFiles() {
        return Collections.unmodifiableList(missingFiles);
    }

    /**
     * @return The parse diagnostics of one file, empty if it is not part of the program.
     */
    public List<Diagnostic> getSyntacticDiagnostics(String fileName) {
        SourceFile file = getSourceFile(fileName);
        return file == null ? List.of() : file.parseDiagnostics();
    }

    /**
     * @return The parse diagnostics of every file, in load order.
     */
    public List<Diagnostic> getSyntacticDiagnostics() {
        List<Diagnostic> all = new ArrayList<>();
        for (SourceFile file : files.values()) {
            all.addAll(file.parseDiagnostics());
        }
        return all;
    }

    public ITypeChecker getTypeChecker() {
        if (typeChecker == null) {
            typeChecker = new DeclaredTypeChecker(files.values());
        }
        return typeChecker;
    }

    public ICompilerHost getHost() {
        return host;
    }
}
