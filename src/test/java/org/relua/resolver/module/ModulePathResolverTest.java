package org.relua.resolver.module;

import org.relua.resolver.io.SourceLoader;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ModulePathResolverTest {

    private static final List<String> EXTENSIONS = List.of(".lua.unluac", ".lua");

    @TempDir
    Path tempDir;

    @Test
    void resolvesDottedIdentifierToNestedFile() throws IOException {
        Path file = write(tempDir.resolve("a/b/c.lua"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        PathResolution resolution = resolver.resolve("a.b.c");

        assertThat(resolution.isResolved()).isTrue();
        assertThat(resolution.path()).isEqualTo(file.toRealPath());
    }

    @Test
    void earlierRootWinsOverEarlierExtension() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        Path expected = write(first.resolve("m.lua"));
        write(second.resolve("m.lua.unluac"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(first, second), EXTENSIONS);

        assertThat(resolver.resolve("m").path()).isEqualTo(expected.toRealPath());
    }

    @Test
    void earlierExtensionWinsWithinRoot() throws IOException {
        Path expected = write(tempDir.resolve("m.lua.unluac"));
        write(tempDir.resolve("m.lua"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        assertThat(resolver.resolve("m").path()).isEqualTo(expected.toRealPath());
    }

    @Test
    void unresolvedResultListsAllCandidates() throws IOException {
        Path other = tempDir.resolve("other");
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir, other), EXTENSIONS);

        PathResolution resolution = resolver.resolve("missing.module");

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.path()).isNull();
        Path first = tempDir.toRealPath();
        Path second = SourceLoader.canonicalize(other);
        assertThat(resolution.candidates()).containsExactly(
            first.resolve("missing/module.lua.unluac"),
            first.resolve("missing/module.lua"),
            second.resolve("missing/module.lua.unluac"),
            second.resolve("missing/module.lua"),
            first.resolve("missing/module/module.lua.unluac"),
            first.resolve("missing/module/module.lua"),
            first.resolve("module.lua.unluac"),
            first.resolve("module.lua"),
            second.resolve("missing/module/module.lua.unluac"),
            second.resolve("missing/module/module.lua"),
            second.resolve("module.lua.unluac"),
            second.resolve("module.lua"));
    }

    @Test
    void fallsBackToPackageDirectoryLayout() throws IOException {
        Path expected = write(tempDir.resolve("net/http/http.lua.unluac"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        PathResolution resolution = resolver.resolve("net.http");

        assertThat(resolution.path()).isEqualTo(expected.toRealPath());
        assertThat(resolution.candidates()).startsWith(
            tempDir.toRealPath().resolve("net/http.lua.unluac"),
            tempDir.toRealPath().resolve("net/http.lua"));
    }

    @Test
    void fallsBackToLastSegmentDirectlyUnderRoot() throws IOException {
        Path expected = write(tempDir.resolve("strings.lua"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        assertThat(resolver.resolve("util.text.strings").path()).isEqualTo(expected.toRealPath());
    }

    @Test
    void standardLayoutInLaterRootWinsOverFallbackInEarlierRoot() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        write(first.resolve("c.lua.unluac"));
        write(first.resolve("a/b/c/c.lua.unluac"));
        Path expected = write(second.resolve("a/b/c.lua"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(first, second), EXTENSIONS);

        assertThat(resolver.resolve("a.b.c").path()).isEqualTo(expected.toRealPath());
    }

    @Test
    void singleSegmentIdentifierTriesEachPathOnce() {
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        PathResolution resolution = resolver.resolve("solo");

        assertThat(resolution.candidates()).doesNotHaveDuplicates().hasSize(4);
    }

    @Test
    void directoriesAreNotModules() throws IOException {
        Files.createDirectories(tempDir.resolve("pkg.lua"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        assertThat(resolver.resolve("pkg").isResolved()).isFalse();
    }

    @Test
    void invalidIdentifiersAreUnresolvedWithoutProbing() {
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        assertThat(resolver.resolve("../escape").candidates()).isEmpty();
        assertThat(resolver.resolve("a..b").candidates()).isEmpty();
        assertThat(resolver.resolve("").isResolved()).isFalse();
    }

    @Test
    void resultsAreCachedForTheLifetimeOfTheResolver() throws IOException {
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);
        assertThat(resolver.resolve("late").isResolved()).isFalse();

        write(tempDir.resolve("late.lua"));

        assertThat(resolver.resolve("late").isResolved()).isFalse();
        assertThat(new ModulePathResolver(List.of(tempDir), EXTENSIONS).resolve("late").isResolved()).isTrue();
    }

    @Test
    void concurrentLookupsShareOneCachedResult() throws Exception {
        write(tempDir.resolve("shared/lib.lua"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PathResolution>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return resolver.resolve("shared.lib");
                }));
            }
            start.countDown();
            PathResolution first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<PathResolution> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
            assertThat(resolver.resolve("shared.lib")).isSameAs(first);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void moduleNameIsRelativeToContainingRoot() throws IOException {
        Path file = write(tempDir.resolve("game/ui/menu.lua.unluac"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir), EXTENSIONS);

        assertThat(resolver.moduleNameOf(file)).isEqualTo("game.ui.menu");
    }

    @Test
    void moduleNameOutsideRootsUsesFileName() throws IOException {
        Path file = write(tempDir.resolve("outside/main.lua"));
        ModulePathResolver resolver = new ModulePathResolver(List.of(tempDir.resolve("roots")), EXTENSIONS);

        assertThat(resolver.moduleNameOf(file)).isEqualTo("main");
    }

    @Test
    void rejectsEmptyExtensionList() {
        assertThatThrownBy(() -> new ModulePathResolver(List.of(tempDir), List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static Path write(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "return {}\n");
        return file;
    }
}
