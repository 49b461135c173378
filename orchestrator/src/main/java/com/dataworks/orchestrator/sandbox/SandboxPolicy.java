package com.dataworks.orchestrator.sandbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Filesystem confinement rules shared by the guard and every capability.
 *
 * The workspace root is canonicalised once at construction. Candidate paths
 * are resolved one segment at a time against real directories: each symbolic
 * link is replaced by its target before the next segment is applied, so
 * {@code link/..} climbs from the link's target, exactly as the OS would.
 * Containment is then checked with {@link Path#startsWith(Path)} on the
 * canonical result, never with a string prefix.
 *
 * <p>Deleting and leaving the workspace are never allowed; the two flags are
 * exposed for reporting only and cannot be switched on.
 */
public final class SandboxPolicy {

    // Same bound Linux uses for nested symlink resolution (MAXSYMLINKS).
    private static final int MAX_LINK_HOPS = 40;

    private final Path workspaceRoot;
    private final int  maxCommandLength;

    public SandboxPolicy(Path workspaceRoot, int maxCommandLength) {
        try {
            Files.createDirectories(workspaceRoot);
            this.workspaceRoot = workspaceRoot.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot prepare workspace root " + workspaceRoot, e);
        }
        this.maxCommandLength = maxCommandLength;
    }

    public Path    workspaceRoot()         { return workspaceRoot; }
    public int     maxCommandLength()      { return maxCommandLength; }
    public boolean allowDelete()           { return false; }
    public boolean allowOutsideWorkspace() { return false; }

    /**
     * Resolve {@code raw} to a canonical path inside the workspace.
     *
     * Relative input is taken relative to the workspace root; absolute input
     * is used as given. The target does not need to exist.
     *
     * @throws SandboxViolationException if the path is blank, malformed, or
     *                                   resolves outside the workspace root
     */
    public Path resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new SandboxViolationException("empty path");
        }
        Path canonical;
        try {
            canonical = canonicalize(raw);
        } catch (InvalidPathException | IOException e) {
            throw new SandboxViolationException("unresolvable path: " + raw);
        }
        if (!canonical.startsWith(workspaceRoot)) {
            throw new SandboxViolationException("path outside workspace: " + raw);
        }
        return canonical;
    }

    /** True when {@code raw} resolves inside the workspace. Never throws. */
    public boolean contains(String raw) {
        try {
            resolve(raw);
            return true;
        } catch (SandboxViolationException e) {
            return false;
        }
    }

    /** Workspace-relative form of a canonical path, using '/' separators. */
    public String relativize(Path canonical) {
        String rel = workspaceRoot.relativize(canonical).toString().replace('\\', '/');
        return rel.isEmpty() ? "." : rel;
    }

    Path canonicalize(String raw) throws IOException {
        Path candidate = Path.of(raw);
        Path absolute  = candidate.isAbsolute() ? candidate : workspaceRoot.resolve(candidate);
        return realize(absolute, 0);
    }

    private Path realize(Path absolute, int hops) throws IOException {
        if (hops > MAX_LINK_HOPS) {
            throw new IOException("too many levels of symbolic links: " + absolute);
        }
        Path current = absolute.getRoot();
        for (Path segment : absolute) {
            String name = segment.toString();
            if (name.equals(".") || name.isEmpty()) {
                continue;
            }
            if (name.equals("..")) {
                Path parent = current.getParent();
                current = parent == null ? current : parent;
                continue;
            }
            Path next = current.resolve(name);
            if (Files.isSymbolicLink(next)) {
                Path target = Files.readSymbolicLink(next);
                current = realize(target.isAbsolute() ? target : current.resolve(target), hops + 1);
            } else {
                current = next;
            }
        }
        return current;
    }
}
