package com.example.backupuniversal.packager;

import com.example.backupuniversal.packager.PackagerModule.ArchiveFormat;
import com.example.backupuniversal.packager.PackagerModule.CompressionResult;
import com.example.backupuniversal.packager.PackagerModule.Compressor;
import com.example.backupuniversal.packager.PackagerModule.Compressors;
import com.example.backupuniversal.packager.PackagerModule.TarCompressor;
import com.example.backupuniversal.packager.PackagerModule.UnsupportedFormatException;
import com.example.backupuniversal.packager.PackagerModule.ZipCompressor;
import com.example.backupuniversal.scan.Scanner.ExclusionFilter;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PackagerModuleTest {

    @TempDir
    Path tempDir;

    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        source = Files.createDirectories(tempDir.resolve("projeto"));
        Files.writeString(source.resolve("README.md"), "# projeto\n");
        Path src = Files.createDirectories(source.resolve("src").resolve("app"));
        Files.writeString(src.resolve("main.py"), "print('ola')\n");
        Files.writeString(src.resolve("cache.tmp"), "lixo");
        Path deps = Files.createDirectories(source.resolve("node_modules").resolve("pkg"));
        Files.writeString(deps.resolve("index.js"), "module.exports = {}");
        Files.createDirectories(source.resolve("vazio"));
    }

    @ParameterizedTest
    @EnumSource(ArchiveFormat.class)
    void roundTripKeepsTopLevelDirectoryAndSkipsExcluded(ArchiveFormat format) throws IOException {
        Compressor compressor = Compressors.forFormat(format);
        Path archive = tempDir.resolve("saida" + format.extension());
        ExclusionFilter filter = new ExclusionFilter(List.of("*.tmp", "node_modules"));

        CompressionResult result = compressor.compress(source, archive, filter, null, 6);

        assertEquals(2, result.filesAdded());
        assertEquals(1, result.filesExcluded());
        assertEquals(1, result.dirsExcluded());
        assertTrue(Files.size(archive) > 0);

        Path restoreParent = tempDir.resolve("restaurado");
        compressor.decompress(archive, restoreParent);

        Path restored = restoreParent.resolve("projeto");
        assertEquals("# projeto\n", Files.readString(restored.resolve("README.md")));
        assertEquals("print('ola')\n", Files.readString(restored.resolve("src/app/main.py")));
        assertFalse(Files.exists(restored.resolve("src/app/cache.tmp")));
        assertFalse(Files.exists(restored.resolve("node_modules")));
    }

    private static Compressor compressorWith(ArchiveFormat format, PackagerModule.SourceOpener opener) {
        return switch (format) {
            case TAR -> new TarCompressor(opener);
            case ZIP -> new ZipCompressor(opener);
        };
    }

    private static InputStream failsAfter(byte[] prefix) {
        return new InputStream() {
            private int pos;

            @Override
            public int read() throws IOException {
                if (pos < prefix.length) {
                    return prefix[pos++] & 0xff;
                }
                throw new IOException("dispositivo removido");
            }
        };
    }

    @ParameterizedTest
    @EnumSource(ArchiveFormat.class)
    void fileThatCannotBeOpenedIsCountedAsExcluded(ArchiveFormat format) throws IOException {
        Compressor compressor = compressorWith(format, file -> {
            if (file.getFileName().toString().equals("main.py")) {
                throw new AccessDeniedException(file.toString());
            }
            return Files.newInputStream(file);
        });
        Path archive = tempDir.resolve("negado" + format.extension());

        CompressionResult result = compressor.compress(source, archive,
                new ExclusionFilter(List.of("*.tmp", "node_modules")), null, 6);

        assertEquals(1, result.filesAdded());
        assertEquals(2, result.filesExcluded());
        assertEquals(1, result.dirsExcluded());

        Path restoreParent = tempDir.resolve("restaurado");
        compressor.decompress(archive, restoreParent);
        assertEquals("# projeto\n", Files.readString(restoreParent.resolve("projeto/README.md")));
        assertFalse(Files.exists(restoreParent.resolve("projeto/src/app/main.py")));
    }

    @ParameterizedTest
    @EnumSource(ArchiveFormat.class)
    void readFailureInsideAnEntryIsSkippedAndArchiveStaysReadable(ArchiveFormat format) throws IOException {
        Compressor compressor = compressorWith(format, file -> {
            if (file.getFileName().toString().equals("main.py")) {
                return failsAfter("print".getBytes(StandardCharsets.UTF_8));
            }
            return Files.newInputStream(file);
        });
        Path archive = tempDir.resolve("parcial" + format.extension());
        List<Long> calls = new ArrayList<>();

        CompressionResult result = compressor.compress(source, archive, ExclusionFilter.none(), calls::add, 6);

        assertEquals(3, result.filesAdded());
        assertEquals(1, result.filesExcluded());
        assertEquals(List.of(1L, 2L, 3L), calls);

        Path restoreParent = tempDir.resolve("restaurado");
        compressor.decompress(archive, restoreParent);
        Path restored = restoreParent.resolve("projeto");
        assertEquals("# projeto\n", Files.readString(restored.resolve("README.md")));
        assertEquals("lixo", Files.readString(restored.resolve("src/app/cache.tmp")));
        assertEquals("module.exports = {}", Files.readString(restored.resolve("node_modules/pkg/index.js")));
    }

    @Test
    void unreadableDirectoryIsCountedAsExcluded() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path locked = Files.createDirectories(source.resolve("trancado"));
        Files.writeString(locked.resolve("segredo.txt"), "x");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            assumeFalse(Files.isReadable(locked), "root ignora permissões");

            Path archive = tempDir.resolve("trancado.tar.gz");
            CompressionResult result = new TarCompressor().compress(source, archive,
                    new ExclusionFilter(List.of("*.tmp", "node_modules")), null, 6);

            assertEquals(2, result.filesAdded());
            assertEquals(2, result.filesExcluded());
            assertEquals(1, result.dirsExcluded());

            Path restoreParent = tempDir.resolve("restaurado");
            new TarCompressor().decompress(archive, restoreParent);
            assertTrue(Files.exists(restoreParent.resolve("projeto/src/app/main.py")));
            assertFalse(Files.exists(restoreParent.resolve("projeto/trancado")));
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @ParameterizedTest
    @EnumSource(ArchiveFormat.class)
    void progressIsReportedOncePerAddedFile(ArchiveFormat format) throws IOException {
        List<Long> calls = new ArrayList<>();

        Compressors.forFormat(format).compress(source, tempDir.resolve("p" + format.extension()),
                ExclusionFilter.none(), calls::add, 1);

        assertEquals(List.of(1L, 2L, 3L, 4L), calls);
    }

    @Test
    void levelOutsideRangeIsRejected() {
        Path archive = tempDir.resolve("x.zip");

        assertThrows(IllegalArgumentException.class,
                () -> new ZipCompressor().compress(source, archive, null, null, 10));
        assertThrows(IllegalArgumentException.class,
                () -> new TarCompressor().compress(source, tempDir.resolve("x.tar.gz"), null, null, -1));
        assertFalse(Files.exists(archive));
    }

    @Test
    void factorySelectsByTokenAndSuffix() {
        assertInstanceOf(TarCompressor.class, Compressors.forToken("tar"));
        assertInstanceOf(ZipCompressor.class, Compressors.forToken("ZIP"));
        assertInstanceOf(TarCompressor.class, Compressors.forFileName("b_20250101_120000.tar.gz").orElseThrow());
        assertInstanceOf(ZipCompressor.class, Compressors.forFileName("b_20250101_120000.zip").orElseThrow());
        assertTrue(Compressors.forFileName("b_20250101_120000.rar").isEmpty());
        assertEquals(".tar.gz", new TarCompressor().extension());
        assertEquals(".zip", new ZipCompressor().extension());
    }

    @Test
    void unknownFormatTokenFails() {
        UnsupportedFormatException e = assertThrows(UnsupportedFormatException.class,
                () -> Compressors.forToken("rar"));
        assertEquals("rar", e.format());
    }

    @Test
    void tarEntryEscapingDestinationIsRejected() throws IOException {
        Path archive = tempDir.resolve("malicioso.tar.gz");
        byte[] payload = "x".getBytes(StandardCharsets.UTF_8);
        try (OutputStream out = Files.newOutputStream(archive);
             GzipCompressorOutputStream gz = new GzipCompressorOutputStream(out);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gz)) {
            TarArchiveEntry entry = new TarArchiveEntry("../fora.txt");
            entry.setSize(payload.length);
            tar.putArchiveEntry(entry);
            tar.write(payload);
            tar.closeArchiveEntry();
        }

        Path destination = tempDir.resolve("destino");
        IOException e = assertThrows(IOException.class, () -> new TarCompressor().decompress(archive, destination));
        assertTrue(e.getMessage().contains("Path traversal"));
        assertFalse(Files.exists(tempDir.resolve("fora.txt")));
    }

    @Test
    void zipEntryEscapingDestinationIsRejected() throws IOException {
        Path archive = tempDir.resolve("malicioso.zip");
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(archive)) {
            zip.putArchiveEntry(new ZipArchiveEntry("../../fora.txt"));
            zip.write("x".getBytes(StandardCharsets.UTF_8));
            zip.closeArchiveEntry();
        }

        Path destination = tempDir.resolve("destino");
        assertThrows(IOException.class, () -> new ZipCompressor().decompress(archive, destination));
        assertFalse(Files.exists(tempDir.resolve("fora.txt")));
    }

    @Test
    void corruptArchiveFailsToDecompress() throws IOException {
        Path archive = Files.writeString(tempDir.resolve("quebrado.tar.gz"), "isto não é gzip");

        assertThrows(IOException.class, () -> new TarCompressor().decompress(archive, tempDir.resolve("out")));
    }
}
