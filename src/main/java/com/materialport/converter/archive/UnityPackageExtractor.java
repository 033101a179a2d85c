package com.materialport.converter.archive;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.diagnostics.ConversionDiagnostics;
import com.materialport.converter.diagnostics.DiagnosticKind;
import com.materialport.converter.util.FileWriteUtil;

/**
 * Reads a gzip-compressed Unity package into an {@link AssetIndex}.
 *
 * Package layout: every asset contributes entries named
 * {@code <identifier>/pathname}, {@code <identifier>/asset} and
 * {@code <identifier>/asset.meta}, in no guaranteed order. Entries are
 * collected first and resolved once the whole stream has been read.
 */
public class UnityPackageExtractor {
    private static final Logger log = LoggerFactory.getLogger(UnityPackageExtractor.class);

    public static final long DEFAULT_MAX_CONTENT_BYTES = 4L * 1024 * 1024;

    static final Set<String> TEXTURE_EXTENSIONS = Set.of(".png", ".tga", ".jpg", ".jpeg");
    static final String WORK_DIR_PREFIX = "materialport_";

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[0-9a-fA-F]{32}");

    private final long maxContentBytes;
    private final Path tempRoot;

    public UnityPackageExtractor() {
        this(DEFAULT_MAX_CONTENT_BYTES, null);
    }

    /**
     * @param maxContentBytes largest non-texture asset kept in memory
     * @param tempRoot        parent of the per-run work directory, or null for the system default
     */
    public UnityPackageExtractor(long maxContentBytes, Path tempRoot) {
        this.maxContentBytes = maxContentBytes;
        this.tempRoot = tempRoot;
    }

    public AssetIndex extract(Path archive, ConversionDiagnostics diagnostics) {
        if (!Files.isRegularFile(archive)) {
            throw new ExtractionException("Archive does not exist or is not a file: " + archive);
        }
        try (InputStream in = Files.newInputStream(archive)) {
            return extract(in, diagnostics);
        } catch (IOException e) {
            throw new ExtractionException("Cannot read archive " + archive + ": " + e.getMessage(), e);
        }
    }

    public AssetIndex extract(InputStream archive, ConversionDiagnostics diagnostics) {
        Path workDir = createWorkDirectory();
        try {
            Map<String, EntryGroup> groups = readEntries(archive, workDir.resolve("raw"));
            AssetIndex index = resolve(groups, workDir, diagnostics);
            log.info("Extracted {} assets: {} textures, {} retained files",
                    index.getPathnames().size(), index.getTexturePaths().size(), index.getContents().size());
            return index;
        } catch (IOException | RuntimeException e) {
            discard(workDir, e);
            if (e instanceof ExtractionException ee) {
                throw ee;
            }
            throw new ExtractionException("Archive is unreadable or corrupt: " + e.getMessage(), e);
        }
    }

    private Path createWorkDirectory() {
        try {
            return tempRoot == null
                    ? Files.createTempDirectory(WORK_DIR_PREFIX)
                    : Files.createTempDirectory(tempRoot, WORK_DIR_PREFIX);
        } catch (IOException e) {
            throw new ExtractionException("Cannot create working directory: " + e.getMessage(), e);
        }
    }

    // Phase 1: group raw entries by identifier; asset bodies are spooled to disk.
    private Map<String, EntryGroup> readEntries(InputStream archive, Path rawDir) throws IOException {
        Map<String, EntryGroup> groups = new LinkedHashMap<>();

        try (TarArchiveInputStream tar = new TarArchiveInputStream(
                new GzipCompressorInputStream(new BufferedInputStream(archive)))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                String name = entry.getName();
                if (name.startsWith("./")) {
                    name = name.substring(2);
                }
                String[] parts = name.split("/", 2);
                if (parts.length < 2 || !IDENTIFIER_PATTERN.matcher(parts[0]).matches()) {
                    log.debug("Skipping entry outside an asset group: {}", name);
                    continue;
                }

                String identifier = parts[0].toLowerCase(Locale.ROOT);
                EntryGroup group = groups.computeIfAbsent(identifier, EntryGroup::new);
                switch (parts[1]) {
                    case "pathname" -> group.pathname = readPathname(tar);
                    case "asset" -> {
                        Path raw = rawDir.resolve(identifier);
                        group.assetSize = FileWriteUtil.safeCopy(tar, raw);
                        group.assetFile = raw;
                    }
                    default -> log.trace("Ignoring {}", name);
                }
            }
        }
        return groups;
    }

    // Phase 2: decide what each complete group becomes.
    private AssetIndex resolve(Map<String, EntryGroup> groups, Path workDir,
                               ConversionDiagnostics diagnostics) throws IOException {
        Map<String, String> pathnames = new LinkedHashMap<>();
        Map<String, byte[]> contents = new LinkedHashMap<>();
        Map<String, Path> texturePaths = new LinkedHashMap<>();
        Map<String, String> textureNames = new LinkedHashMap<>();

        for (EntryGroup group : groups.values()) {
            if (group.pathname == null) {
                log.warn("Asset {} has no pathname entry, skipping", group.identifier);
                diagnostics.warn(DiagnosticKind.ARCHIVE_ENTRY, group.identifier, group.assetFile != null
                        ? "Asset has no pathname entry; skipped"
                        : "Asset group has neither pathname nor asset entry; skipped");
                if (group.assetFile != null) {
                    Files.deleteIfExists(group.assetFile);
                }
                continue;
            }

            pathnames.put(group.identifier, group.pathname);
            if (group.assetFile == null) {
                continue;
            }

            String extension = extensionOf(group.pathname);
            if (TEXTURE_EXTENSIONS.contains(extension)) {
                Path target = workDir.resolve(group.identifier + extension);
                Files.move(group.assetFile, target, StandardCopyOption.REPLACE_EXISTING);
                texturePaths.put(group.identifier, target);
                textureNames.put(group.identifier, baseName(group.pathname));
            } else if (group.assetSize <= maxContentBytes) {
                contents.put(group.identifier, Files.readAllBytes(group.assetFile));
                Files.delete(group.assetFile);
            } else {
                log.warn("Skipping {} ({} bytes exceeds the {} byte limit)",
                        group.pathname, group.assetSize, maxContentBytes);
                diagnostics.warn(DiagnosticKind.ARCHIVE_ENTRY, group.pathname,
                        "Content of " + group.assetSize + " bytes exceeds the retention limit; not retained");
                Files.delete(group.assetFile);
            }
        }

        FileWriteUtil.deleteDirectory(workDir.resolve("raw"));
        return new AssetIndex(pathnames, contents, texturePaths, textureNames, workDir);
    }

    private static String readPathname(InputStream entry) throws IOException {
        String text = new String(entry.readAllBytes(), StandardCharsets.UTF_8).replace("\0", "");
        int lineEnd = text.indexOf('\n');
        String firstLine = (lineEnd >= 0 ? text.substring(0, lineEnd) : text).trim();
        return firstLine.isEmpty() ? null : firstLine;
    }

    static String extensionOf(String pathname) {
        String base = baseName(pathname);
        int dot = base.lastIndexOf('.');
        return dot < 0 ? "" : base.substring(dot).toLowerCase(Locale.ROOT);
    }

    static String baseName(String pathname) {
        int slash = Math.max(pathname.lastIndexOf('/'), pathname.lastIndexOf('\\'));
        return pathname.substring(slash + 1);
    }

    private static void discard(Path workDir, Exception cause) {
        try {
            FileWriteUtil.deleteDirectory(workDir);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private static final class EntryGroup {
        private final String identifier;
        private String pathname;
        private Path assetFile;
        private long assetSize;

        private EntryGroup(String identifier) {
            this.identifier = identifier;
        }
    }
}
