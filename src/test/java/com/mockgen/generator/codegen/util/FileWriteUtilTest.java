package com.mockgen.generator.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class FileWriteUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteCreatesParentsAndLeavesNoTemporaryFiles() throws IOException {
        Path target = tempDir.resolve("a/b/MockDisplay.java");

        FileWriteUtil.safeWriteString(target, "class MockDisplay {}\n");

        assertThat(Files.readString(target)).isEqualTo("class MockDisplay {}\n");
        try (var files = Files.list(target.getParent())) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void testWriteIfChangedSkipsIdenticalContent() throws IOException {
        Path target = tempDir.resolve("MockDisplay.java");

        assertThat(FileWriteUtil.writeIfChanged(target, "one")).isTrue();
        long modified = Files.getLastModifiedTime(target).toMillis();
        assertThat(FileWriteUtil.writeIfChanged(target, "one")).isFalse();
        assertThat(Files.getLastModifiedTime(target).toMillis()).isEqualTo(modified);
        assertThat(FileWriteUtil.writeIfChanged(target, "two")).isTrue();
        assertThat(Files.readString(target)).isEqualTo("two");
    }
}
