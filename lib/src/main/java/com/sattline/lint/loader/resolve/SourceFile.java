package com.sattline.lint.loader.resolve;

import com.sattline.lint.loader.ParseNode;
import com.sattline.lint.loader.SattLineParseException;
import com.sattline.lint.loader.TreeBuildResult;
import com.sattline.lint.loader.ast.ProgramNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** One node of the {@link ProjectGraph}: a logical name and what became of looking it up. */
public final class SourceFile {
    private final String name;
    private final String extension;
    private final Path path;
    private final FileStatus status;
    private final ParseNode parseTree;
    private final TreeBuildResult buildResult;
    private final SattLineParseException error;
    private final IOException readError;
    private final String referencedBy;

    private SourceFile(
            String name,
            String extension,
            Path path,
            FileStatus status,
            ParseNode parseTree,
            TreeBuildResult buildResult,
            SattLineParseException error,
            IOException readError,
            String referencedBy) {
        this.name = Objects.requireNonNull(name, "name");
        this.extension = Objects.requireNonNull(extension, "extension");
        this.path = path;
        this.status = Objects.requireNonNull(status, "status");
        this.parseTree = parseTree;
        this.buildResult = buildResult;
        this.error = error;
        this.readError = readError;
        this.referencedBy = referencedBy;
    }

    static SourceFile ok(
            String name,
            String extension,
            Path path,
            ParseNode parseTree,
            TreeBuildResult buildResult,
            String referencedBy) {
        return new SourceFile(
                name,
                extension,
                Objects.requireNonNull(path, "path"),
                FileStatus.OK,
                Objects.requireNonNull(parseTree, "parseTree"),
                Objects.requireNonNull(buildResult, "buildResult"),
                null,
                null,
                referencedBy);
    }

    static SourceFile parseError(
            String name, String extension, Path path, SattLineParseException error, String referencedBy) {
        return new SourceFile(
                name,
                extension,
                Objects.requireNonNull(path, "path"),
                FileStatus.PARSE_ERROR,
                null,
                null,
                Objects.requireNonNull(error, "error"),
                null,
                referencedBy);
    }

    static SourceFile unreadable(String name, String extension, Path path, IOException readError, String referencedBy) {
        return new SourceFile(
                name,
                extension,
                Objects.requireNonNull(path, "path"),
                FileStatus.UNREADABLE,
                null,
                null,
                null,
                Objects.requireNonNull(readError, "readError"),
                referencedBy);
    }

    static SourceFile missing(String name, String extension, String referencedBy) {
        return new SourceFile(name, extension, null, FileStatus.MISSING, null, null, null, null, referencedBy);
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    public String getFileName() {
        return name + extension;
    }

    /** Absolute path of the file, empty when it was not found. */
    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    public FileStatus getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == FileStatus.OK;
    }

    public Optional<ProgramNode> getProgram() {
        return buildResult == null ? Optional.empty() : Optional.of(buildResult.getProgram());
    }

    public Optional<ParseNode> getParseTree() {
        return Optional.ofNullable(parseTree);
    }

    public Set<String> getDeclaredNames() {
        return buildResult == null ? Set.of() : buildResult.getDeclaredNames();
    }

    public Set<String> getReferencedNames() {
        return buildResult == null ? Set.of() : buildResult.getReferencedNames();
    }

    public Optional<SattLineParseException> getError() {
        return Optional.ofNullable(error);
    }

    /** I/O failure that kept an existing file from being read. */
    public Optional<IOException> getReadError() {
        return Optional.ofNullable(readError);
    }

    /** Name of the file whose reference caused this one to be looked up; empty for the root. */
    public Optional<String> getReferencedBy() {
        return Optional.ofNullable(referencedBy);
    }

    @Override
    public String toString() {
        return getFileName() + " [" + status + "]";
    }
}
