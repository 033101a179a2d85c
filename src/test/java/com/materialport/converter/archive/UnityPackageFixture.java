package com.materialport.converter.archive;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

/**
 * Builds gzip tar packages laid out the way Unity exports them, for tests.
 */
public class UnityPackageFixture {

    private final List<Map.Entry<String, byte[]>> entries = new ArrayList<>();

    public static String identifier(int n) {
        return String.format("%032x", n);
    }

    /**
     * Adds a complete asset group: pathname then asset.
     */
    public UnityPackageFixture asset(String identifier, String pathname, String content) {
        return asset(identifier, pathname, content.getBytes(StandardCharsets.UTF_8));
    }

    public UnityPackageFixture asset(String identifier, String pathname, byte[] content) {
        pathname(identifier, pathname);
        return entry(identifier + "/asset", content);
    }

    public UnityPackageFixture pathname(String identifier, String pathname) {
        return entry(identifier + "/pathname", (pathname + "\n00").getBytes(StandardCharsets.UTF_8));
    }

    public UnityPackageFixture entry(String name, byte[] content) {
        entries.add(Map.entry(name, content));
        return this;
    }

    public byte[] toBytes() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(bytes))) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Map.Entry<String, byte[]> entry : entries) {
                TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey());
                tarEntry.setSize(entry.getValue().length);
                tar.putArchiveEntry(tarEntry);
                tar.write(entry.getValue());
                tar.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    public Path writeTo(Path file) throws IOException {
        Files.write(file, toBytes());
        return file;
    }
}
