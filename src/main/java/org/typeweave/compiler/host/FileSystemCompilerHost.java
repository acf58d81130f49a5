package org.typeweave.compiler.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.frontend.io.SourceLoader;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * The delegate host: serves files from the filesystem and from {@code classpath:} resources exactly as
 * stored, with line endings normalized. Relative names resolve against the current directory.
 */
public class FileSystemCompilerHost implements ICompilerHost {

    private static final Logger log = LoggerFactory.getLogger(FileSystemCompilerHost.class);

    private final Path currentDirectory;

    public FileSystemCompilerHost() {
        this(Path.of("").toAbsolutePath());
    }

    public FileSystemCompilerHost(Path currentDirectory) {
        this.currentDirectory = currentDirectory.toAbsolutePath().normalize();
    }

    @Override
    public SourceFile getSourceFile(String fileName) {
        String text = readFile(fileName);
        return text == null ? null : SourceFile.plain(getCanonicalFileName(fileName), text);
    }

    @Override
    public String readFile(String fileName) {
        try {
            return SourceLoader.load(resolve(fileName)).content();
        } catch (IOException | InvalidPathException e) {
            log.debug("Cannot read {}: {}", fileName, e.getMessage());
            return null;
        }
    }

    @Override
    public boolean fileExists(String fileName) {
        try {
            return SourceLoader.exists(resolve(fileName));
        } catch (InvalidPathException e) {
            log.debug("Invalid file name {}: {}", fileName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getCurrentDirectory() {
        return currentDirectory.toString().replace('\\', '/');
    }

    @Override
    public String getCanonicalFileName(String fileName) {
        if (SourceLoader.isClasspath(fileName)) {
            return fileName;
        }
        return resolve(fileName).replace('\\', '/');
    }

    private String resolve(String fileName) {
        if (SourceLoader.isClasspath(fileName)) {
            return fileName;
        }
        return currentDirectory.resolve(fileName).normalize().toString();
    }
}
