package com.materialport.converter.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.util.FileWriteUtil;

/**
 * Identifier-keyed view of one extracted archive.
 *
 * Every identifier in the content or texture maps also has a pathname.
 * Extracted texture files live under {@link #getWorkDirectory()} and are
 * deleted by {@link #close()}.
 */
public class AssetIndex implements TextureLookup, Closeable {
    private static final Logger log = LoggerFactory.getLogger(AssetIndex.class);

    private final Map<String, String> pathnames;
    private final Map<String, byte[]> contents;
    private final Map<String, Path> texturePaths;
    private final Map<String, String> textureNames;
    private final Path workDirectory;
    private boolean closed;

    AssetIndex(Map<String, String> pathnames, Map<String, byte[]> contents,
               Map<String, Path> texturePaths, Map<String, String> textureNames, Path workDirectory) {
        this.pathnames = Collections.unmodifiableMap(new LinkedHashMap<>(pathnames));
        this.contents = Collections.unmodifiableMap(new LinkedHashMap<>(contents));
        this.texturePaths = Collections.unmodifiableMap(new LinkedHashMap<>(texturePaths));
        this.textureNames = Collections.unmodifiableMap(new LinkedHashMap<>(textureNames));
        this.workDirectory = workDirectory;
    }

    public Map<String, String> getPathnames() {
        return pathnames;
    }

    public Map<String, byte[]> getContents() {
        return contents;
    }

    public Map<String, Path> getTexturePaths() {
        return texturePaths;
    }

    public Map<String, String> getTextureNames() {
        return textureNames;
    }

    public Path getWorkDirectory() {
        return workDirectory;
    }

    public Optional<String> pathname(String identifier) {
        return Optional.ofNullable(pathnames.get(identifier));
    }

    public Optional<byte[]> content(String identifier) {
        return Optional.ofNullable(contents.get(identifier));
    }

    @Override
    public Optional<String> textureFileName(String identifier) {
        return Optional.ofNullable(textureNames.get(identifier));
    }

    /**
     * Identifiers of retained material files, in archive order.
     */
    public List<String> materialIdentifiers() {
        return contents.keySet().stream()
                .filter(id -> pathnames.get(id).toLowerCase(Locale.ROOT).endsWith(".mat"))
                .toList();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Deletes the extracted files. Safe to call more than once.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("Removing extracted files under {}", workDirectory);
        FileWriteUtil.deleteDirectory(workDirectory);
    }
}
