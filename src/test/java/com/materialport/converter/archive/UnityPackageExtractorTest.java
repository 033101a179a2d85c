package com.materialport.converter.archive;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.materialport.converter.diagnostics.ConversionDiagnostics;
import com.materialport.converter.diagnostics.DiagnosticKind;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static com.materialport.converter.archive.UnityPackageFixture.identifier;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for UnityPackageExtractor.
 */
class UnityPackageExtractorTest {

    @TempDir
    Path tempDir;

    private UnityPackageExtractor extractor() {
        return new UnityPackageExtractor(UnityPackageExtractor.DEFAULT_MAX_CONTENT_BYTES, tempDir);
    }

    private AssetIndex extract(UnityPackageFixture fixture, ConversionDiagnostics diagnostics) throws IOException {
        return extractor().extract(new ByteArrayInputStream(fixture.toBytes()), diagnostics);
    }

    @Test
    void testExtractMaterialsAndTextures() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .asset(identifier(1), "Assets/Materials/Leaf_Mat.mat", "%YAML 1.1")
                .asset(identifier(2), "Assets/Textures/Leaf_Tex.PNG", new byte[] {1, 2, 3})
                .asset(identifier(3), "Assets/Models/Tree.fbx", "model");

        try (AssetIndex index = extract(fixture, new ConversionDiagnostics())) {
            assertThat(index.getPathnames()).containsOnlyKeys(identifier(1), identifier(2), identifier(3));
            assertThat(index.content(identifier(1))).hasValueSatisfying(
                    bytes -> assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("%YAML 1.1"));
            assertThat(index.materialIdentifiers()).containsExactly(identifier(1));

            assertThat(index.textureFileName(identifier(2))).contains("Leaf_Tex.PNG");
            Path texture = index.getTexturePaths().get(identifier(2));
            assertThat(texture.getFileName().toString()).isEqualTo(identifier(2) + ".png");
            assertThat(Files.readAllBytes(texture)).containsExactly(1, 2, 3);
            assertThat(index.getContents()).doesNotContainKey(identifier(2));
        }
    }

    @Test
    void testEveryIndexedIdentifierHasPathname() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .asset(identifier(1), "Assets/A.mat", "a")
                .entry(identifier(2) + "/asset", "orphan".getBytes(StandardCharsets.UTF_8))
                .asset(identifier(3), "Assets/B.tga", new byte[] {9})
                .pathname(identifier(4), "Assets/Folder")
                .entry(identifier(5) + "/asset.meta", "meta".getBytes(StandardCharsets.UTF_8));

        try (AssetIndex index = extract(fixture, new ConversionDiagnostics())) {
            assertThat(index.getPathnames().keySet()).containsAll(index.getContents().keySet());
            assertThat(index.getPathnames().keySet()).containsAll(index.getTexturePaths().keySet());
            assertThat(index.getPathnames().keySet()).containsAll(index.getTextureNames().keySet());
        }
    }

    @Test
    void testAssetWithoutPathnameIsSkippedWithWarning() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .entry(identifier(7) + "/asset", "orphan".getBytes(StandardCharsets.UTF_8))
                .asset(identifier(8), "Assets/Ok.mat", "ok");
        ConversionDiagnostics diagnostics = new ConversionDiagnostics();

        try (AssetIndex index = extract(fixture, diagnostics)) {
            assertThat(index.getContents()).containsOnlyKeys(identifier(8));
        }
        assertThat(diagnostics.getWarnings())
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.getKind()).isEqualTo(DiagnosticKind.ARCHIVE_ENTRY);
                    assertThat(d.getSubject()).isEqualTo(identifier(7));
                });
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testGroupWithOnlyMetaIsSkippedWithWarning() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .entry(identifier(5) + "/asset.meta", "fileFormatVersion: 2".getBytes(StandardCharsets.UTF_8))
                .asset(identifier(6), "Assets/Ok.mat", "ok");
        ConversionDiagnostics diagnostics = new ConversionDiagnostics();

        try (AssetIndex index = extract(fixture, diagnostics)) {
            assertThat(index.getPathnames()).containsOnlyKeys(identifier(6));
        }
        assertThat(diagnostics.getWarnings())
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.getKind()).isEqualTo(DiagnosticKind.ARCHIVE_ENTRY);
                    assertThat(d.getSubject()).isEqualTo(identifier(5));
                    assertThat(d.getMessage()).contains("neither pathname nor asset");
                });
    }

    @Test
    void testEntriesMayArriveInAnyOrder() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .entry(identifier(1) + "/asset", new byte[] {5})
                .asset(identifier(2), "Assets/Other.mat", "other")
                .pathname(identifier(1), "Assets/Late.jpg");

        try (AssetIndex index = extract(fixture, new ConversionDiagnostics())) {
            assertThat(index.textureFileName(identifier(1))).contains("Late.jpg");
            assertThat(index.getContents()).containsOnlyKeys(identifier(2));
        }
    }

    @Test
    void testOversizedContentIsNotRetained() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .asset(identifier(1), "Assets/Big.mat", "x".repeat(64))
                .asset(identifier(2), "Assets/Small.mat", "y");
        ConversionDiagnostics diagnostics = new ConversionDiagnostics();

        try (AssetIndex index = new UnityPackageExtractor(16, tempDir)
                .extract(new ByteArrayInputStream(fixture.toBytes()), diagnostics)) {
            assertThat(index.getContents()).containsOnlyKeys(identifier(2));
            assertThat(index.pathname(identifier(1))).contains("Assets/Big.mat");
        }
        assertThat(diagnostics.count(DiagnosticKind.ARCHIVE_ENTRY)).isEqualTo(1);
    }

    @Test
    void testEntriesOutsideGroupsAreIgnored() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .entry("README.txt", "hello".getBytes(StandardCharsets.UTF_8))
                .entry("not-an-identifier/pathname", "Assets/X.mat".getBytes(StandardCharsets.UTF_8))
                .entry("./" + identifier(3) + "/pathname", "Assets/Dotted.mat".getBytes(StandardCharsets.UTF_8))
                .entry("./" + identifier(3) + "/asset", "dotted".getBytes(StandardCharsets.UTF_8));

        try (AssetIndex index = extract(fixture, new ConversionDiagnostics())) {
            assertThat(index.getPathnames()).containsOnlyKeys(identifier(3));
            assertThat(index.materialIdentifiers()).containsExactly(identifier(3));
        }
    }

    @Test
    void testCloseRemovesExtractedFiles() throws IOException {
        UnityPackageFixture fixture = new UnityPackageFixture()
                .asset(identifier(1), "Assets/T.png", new byte[] {1});

        AssetIndex index = extract(fixture, new ConversionDiagnostics());
        Path workDir = index.getWorkDirectory();
        assertThat(workDir).exists();
        assertThat(index.getTexturePaths().get(identifier(1))).exists();

        index.close();
        index.close();

        assertThat(index.isClosed()).isTrue();
        assertThat(workDir).doesNotExist();
    }

    @Test
    void testCorruptArchiveFailsAndLeavesNoFiles() throws IOException {
        byte[] garbage = "this is not a gzip stream".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor().extract(new ByteArrayInputStream(garbage), new ConversionDiagnostics()))
                .isInstanceOf(ExtractionException.class);

        try (Stream<Path> left = Files.list(tempDir)) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    void testMissingArchiveFileFails() {
        Path missing = tempDir.resolve("missing.unitypackage");

        assertThatThrownBy(() -> extractor().extract(missing, new ConversionDiagnostics()))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("missing.unitypackage");
    }

    @Test
    void testExtractFromFile() throws IOException {
        Path file = new UnityPackageFixture()
                .asset(identifier(1), "Assets/M.mat", "m")
                .writeTo(tempDir.resolve("pack.unitypackage"));

        try (AssetIndex index = extractor().extract(file, new ConversionDiagnostics())) {
            assertThat(index.materialIdentifiers()).hasSize(1);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "Assets/a.png, .png",
            "Assets/a.TGA, .tga",
            "Assets/dir.v2/a.Jpeg, .jpeg",
            "Assets/noext, ''",
            "Assets\\win\\b.jpg, .jpg"
    })
    void testExtensionOf(String pathname, String expected) {
        assertThat(UnityPackageExtractor.extensionOf(pathname)).isEqualTo(expected);
    }
}
