package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.CapabilityContext;
import com.dataworks.orchestrator.capability.CapabilityException;
import com.dataworks.orchestrator.capability.CapabilityResult;
import com.dataworks.orchestrator.sandbox.SandboxPolicy;
import com.dataworks.orchestrator.sandbox.SandboxViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCapabilitiesTest {

    @TempDir Path workspace;

    CapabilityContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new CapabilityContext(UUID.randomUUID(), new SandboxPolicy(workspace, 4096), 50);
    }

    // ------------------------------------------------------------------
    // read_file
    // ------------------------------------------------------------------

    @Test
    void readFile_existing_returnsContent() throws Exception {
        Files.writeString(workspace.resolve("notes.txt"), "hello");

        CapabilityResult result = new ReadFileCapability().invoke(Map.of("path", "notes.txt"), ctx);

        assertThat(result.success()).isTrue();
        assertThat(result.payload()).isEqualTo("hello");
    }

    @Test
    void readFile_missing_returnsFailure() {
        CapabilityResult result = new ReadFileCapability().invoke(Map.of("path", "nope.txt"), ctx);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("file not found: nope.txt");
    }

    @Test
    void readFile_longContent_isTruncated() throws Exception {
        Files.writeString(workspace.resolve("big.txt"), "x".repeat(200));

        CapabilityResult result = new ReadFileCapability().invoke(Map.of("path", "big.txt"), ctx);

        assertThat((String) result.payload()).startsWith("x".repeat(50)).contains("[truncated 150 chars]");
    }

    @Test
    void readFile_outsideWorkspace_refusedEvenWithoutGuard() {
        assertThatThrownBy(() -> new ReadFileCapability().invoke(Map.of("path", "/etc/passwd"), ctx))
                .isInstanceOf(SandboxViolationException.class);
    }

    // ------------------------------------------------------------------
    // write_file
    // ------------------------------------------------------------------

    @Test
    void writeFile_createsParentDirectories() throws Exception {
        CapabilityResult result = new WriteFileCapability()
                .invoke(Map.of("path", "out/deep/report.txt", "content", "42"), ctx);

        assertThat(result.success()).isTrue();
        assertThat(result.payload()).isEqualTo("wrote 2 characters to out/deep/report.txt");
        assertThat(Files.readString(workspace.resolve("out/deep/report.txt"))).isEqualTo("42");
    }

    @Test
    void writeFile_appendTrue_appends() throws Exception {
        Files.writeString(workspace.resolve("log.txt"), "a");

        new WriteFileCapability().invoke(Map.of("path", "log.txt", "content", "b", "append", true), ctx);

        assertThat(Files.readString(workspace.resolve("log.txt"))).isEqualTo("ab");
    }

    @Test
    void writeFile_default_overwrites() throws Exception {
        Files.writeString(workspace.resolve("log.txt"), "old");

        new WriteFileCapability().invoke(Map.of("path", "log.txt", "content", "new"), ctx);

        assertThat(Files.readString(workspace.resolve("log.txt"))).isEqualTo("new");
    }

    // ------------------------------------------------------------------
    // list_files
    // ------------------------------------------------------------------

    @Test
    @SuppressWarnings("unchecked")
    void listFiles_matchesGlobSorted() throws Exception {
        Files.createDirectories(workspace.resolve("docs/sub"));
        Files.writeString(workspace.resolve("b.md"), "");
        Files.writeString(workspace.resolve("docs/a.md"), "");
        Files.writeString(workspace.resolve("docs/sub/c.md"), "");
        Files.writeString(workspace.resolve("docs/skip.txt"), "");

        CapabilityResult result = new ListFilesCapability().invoke(Map.of("pattern", "**.md"), ctx);

        assertThat((List<String>) result.payload()).containsExactly("b.md", "docs/a.md", "docs/sub/c.md");
    }

    @Test
    @SuppressWarnings("unchecked")
    void listFiles_subdirectory_relativeToIt() throws Exception {
        Files.createDirectories(workspace.resolve("docs"));
        Files.writeString(workspace.resolve("docs/a.md"), "");

        CapabilityResult result = new ListFilesCapability().invoke(Map.of("path", "docs"), ctx);

        assertThat((List<String>) result.payload()).containsExactly("a.md");
    }

    @Test
    void listFiles_missingDirectory_fails() {
        CapabilityResult result = new ListFilesCapability().invoke(Map.of("path", "ghost"), ctx);

        assertThat(result.error()).isEqualTo("directory not found: ghost");
    }

    // ------------------------------------------------------------------
    // delete_file
    // ------------------------------------------------------------------

    @Test
    void deleteFile_alwaysRefused_fileSurvives() throws Exception {
        Files.writeString(workspace.resolve("keep.txt"), "x");

        assertThatThrownBy(() -> new DeleteFileCapability().invoke(Map.of("path", "keep.txt"), ctx))
                .isInstanceOf(CapabilityException.class)
                .hasMessage("delete not permitted");
        assertThat(workspace.resolve("keep.txt")).exists();
    }
}
