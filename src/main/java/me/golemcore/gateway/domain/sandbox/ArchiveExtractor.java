package me.golemcore.gateway.domain.sandbox;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarUtils;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Unpacks uploaded archives into a sandbox directory.
 *
 * <p>
 * The format is sniffed from content. A gzip stream counts as a tarball when
 * its name ends in {@code .tar.gz} or {@code .tgz}, or when the decompressed
 * payload starts with a tar header. Every entry is
 * resolved against the destination and skipped if it would land outside of it
 * (via {@code ..} or an absolute name). Only directories and regular files are
 * materialized; links and special tar entries are ignored. Extraction stops
 * after {@code maxEntries} regular files.
 */
@Component
@Slf4j
public class ArchiveExtractor {

    public static final int HARD_MAX_ENTRIES = 2000;

    private static final int TAR_BLOCK_SIZE = 512;
    private static final int TAR_MAGIC_OFFSET = 257;
    private static final byte[] TAR_MAGIC = { 'u', 's', 't', 'a', 'r' };
    private static final String GZIP_SUFFIX = ".gz";
    private static final String GUNZIP_FALLBACK_NAME = "archive";

    private final int maxEntries;

    @Autowired
    public ArchiveExtractor(GatewayProperties properties) {
        this(properties.getUploads().getMaxExtractFiles());
    }

    public ArchiveExtractor(int maxEntries) {
        this.maxEntries = Math.min(maxEntries, HARD_MAX_ENTRIES);
    }

    /**
     * Extract with the configured entry cap.
     */
    public int extract(Path archive, Path destDir) throws IOException {
        return extract(archive, destDir, maxEntries);
    }

    /**
     * Extract {@code archive} into {@code destDir}.
     *
     * @return number of regular files written; {@code 0} when the file is not a
     *         recognized archive (the caller keeps the original as is)
     */
    public int extract(Path archive, Path destDir, int maxEntries) throws IOException {
        int cap = Math.min(maxEntries, HARD_MAX_ENTRIES);
        Path dest = destDir.toAbsolutePath().normalize();
        ArchiveKind kind = detect(archive);
        log.debug("[Archive] {} detected as {}", archive.getFileName(), kind);

        return switch (kind) {
        case ZIP -> extractZip(archive, dest, cap);
        case TAR -> extractTar(archive, false, dest, cap);
        case TAR_GZIP -> extractTar(archive, true, dest, cap);
        case GZIP -> gunzip(archive, dest) ? 1 : 0;
        case NONE -> 0;
        };
    }

    /**
     * Sniff the archive format from the file's leading bytes.
     */
    public ArchiveKind detect(Path file) throws IOException {
        byte[] head = readHead(file);
        if (isZip(head)) {
            return ArchiveKind.ZIP;
        }
        if (looksLikeTar(head)) {
            return ArchiveKind.TAR;
        }
        if (isGzip(head)) {
            return hasTarGzipName(file) || isGzippedTar(file) ? ArchiveKind.TAR_GZIP : ArchiveKind.GZIP;
        }
        return ArchiveKind.NONE;
    }

    private int extractZip(Path archive, Path dest, int cap) throws IOException {
        int count = 0;
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements() && count < cap) {
                ZipEntry entry = entries.nextElement();
                Path target = resolveInside(dest, entry.getName());
                if (target == null) {
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                if (!prepareParent(dest, target)) {
                    continue;
                }
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                count++;
            }
        }
        log.info("[Archive] Extracted {} file(s) from zip {}", count, archive.getFileName());
        return count;
    }

    private int extractTar(Path archive, boolean gzipped, Path dest, int cap) throws IOException {
        int count = 0;
        InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
        InputStream in = gzipped ? new GzipCompressorInputStream(raw) : raw;
        try (TarArchiveInputStream tar = new TarArchiveInputStream(in)) {
            TarArchiveEntry entry = tar.getNextEntry();
            while (entry != null && count < cap) {
                Path target = resolveInside(dest, entry.getName());
                if (target != null) {
                    if (entry.isDirectory()) {
                        Files.createDirectories(target);
                    } else if (entry.isFile() && prepareParent(dest, target)) {
                        Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                        count++;
                    } else {
                        log.debug("[Archive] Skipping non-regular tar entry: {}", entry.getName());
                    }
                }
                entry = tar.getNextEntry();
            }
        }
        log.info("[Archive] Extracted {} file(s) from tar {}", count, archive.getFileName());
        return count;
    }

    private boolean gunzip(Path archive, Path dest) throws IOException {
        String name = archive.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(GZIP_SUFFIX)) {
            return false;
        }
        String targetName = name.substring(0, name.length() - GZIP_SUFFIX.length());
        if (targetName.isEmpty()) {
            targetName = GUNZIP_FALLBACK_NAME;
        }
        Path target = resolveInside(dest, targetName);
        if (target == null || !prepareParent(dest, target)) {
            return false;
        }
        try (InputStream in = new GzipCompressorInputStream(
                new BufferedInputStream(Files.newInputStream(archive)))) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("[Archive] Decompressed {} to {}", name, target.getFileName());
        return true;
    }

    /**
     * Resolve an entry name against {@code dest}, or return {@code null} if it
     * escapes the destination.
     */
    static Path resolveInside(Path dest, String entryName) {
        if (entryName == null || entryName.isEmpty()) {
            return null;
        }
        try {
            Path target = dest.resolve(entryName).normalize();
            if (!target.startsWith(dest) || target.equals(dest)) {
                log.debug("[Archive] Skipping entry outside destination: {}", entryName);
                return null;
            }
            return target;
        } catch (InvalidPathException e) {
            log.debug("[Archive] Skipping entry with invalid name: {}", entryName);
            return null;
        }
    }

    /**
     * Create the parent directories and verify, after following any existing
     * links, that they are still inside {@code dest}.
     */
    private static boolean prepareParent(Path dest, Path target) throws IOException {
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path realParent = parent.toRealPath();
        Path realDest = dest.toRealPath();
        if (!realParent.startsWith(realDest)) {
            log.warn("[Archive] Link escape blocked: {} -> {}", parent, realParent);
            return false;
        }
        if (Files.isSymbolicLink(target)) {
            Files.delete(target);
        }
        return true;
    }

    private static byte[] readHead(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return in.readNBytes(TAR_BLOCK_SIZE);
        }
    }

    private static boolean isZip(byte[] head) {
        if (head.length < 4 || head[0] != 'P' || head[1] != 'K') {
            return false;
        }
        return (head[2] == 3 && head[3] == 4) || (head[2] == 5 && head[3] == 6) || (head[2] == 7 && head[3] == 8);
    }

    private static boolean isGzip(byte[] head) {
        return head.length >= 2 && (head[0] & 0xff) == 0x1f && (head[1] & 0xff) == 0x8b;
    }

    static boolean looksLikeTar(byte[] head) {
        if (head.length < TAR_BLOCK_SIZE) {
            return false;
        }
        byte[] magic = Arrays.copyOfRange(head, TAR_MAGIC_OFFSET, TAR_MAGIC_OFFSET + TAR_MAGIC.length);
        if (Arrays.equals(magic, TAR_MAGIC)) {
            return true;
        }
        return TarUtils.verifyCheckSum(head);
    }

    private static boolean hasTarGzipName(Path file) {
        String lower = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(".tar.gz") || lower.endsWith(".tgz");
    }

    private static boolean isGzippedTar(Path file) {
        try (InputStream in = new GzipCompressorInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            return looksLikeTar(in.readNBytes(TAR_BLOCK_SIZE));
        } catch (IOException e) {
            log.debug("[Archive] Cannot inspect gzip payload of {}: {}", file.getFileName(), e.getMessage());
            return false;
        }
    }
}
