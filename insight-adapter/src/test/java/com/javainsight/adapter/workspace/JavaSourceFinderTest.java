package com.javainsight.adapter.workspace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static com.javainsight.adapter.Fixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class JavaSourceFinderTest {

    @TempDir
    Path root;

    private final JavaSourceFinder finder = new JavaSourceFinder(List.of("out", "build", ".gradle", "node_modules"));

    @Test
    void excludedDirectoriesAreSkippedAtAnyDepth() throws IOException {
        Path kept = write(root, "frameworks/base/A.java", "class A {}");
        write(root, "out/soong/B.java", "class B {}");
        write(root, "frameworks/base/build/C.java", "class C {}");
        write(root, "node_modules/x/D.java", "class D {}");

        assertEquals(List.of(kept), finder.findByExtension(root, ".java"));
    }

    @Test
    void resultsAreSortedByPath() throws IOException {
        Path b = write(root, "b/Z.java", "");
        Path a = write(root, "a/Y.java", "");
        assertEquals(List.of(a, b), finder.findByExtension(root, ".java"));
    }

    @Test
    void exactFileNameMatch() throws IOException {
        Path server = write(root, "services/java/com/android/server/SystemServer.java", "");
        write(root, "services/java/com/android/server/SystemServerTest.java", "");
        assertEquals(List.of(server), finder.findByFileName(root, "SystemServer.java"));
    }

    @Test
    void extensionUnderNamedDirectory() throws IOException {
        write(root, "core/a/x.cpp", "");
        Path jni = write(root, "core/jni/android/y.cpp", "");
        write(root, "jni.cpp", "");
        assertEquals(List.of(jni), finder.findByExtensionUnder(root, "jni", ".cpp"));
    }

    @Test
    void missingRootYieldsNothing() {
        assertTrue(finder.findByExtension(root.resolve("absent"), ".java").isEmpty());
    }
}
