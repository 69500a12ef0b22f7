package com.example.backupuniversal.catalog;

import com.example.backupuniversal.catalog.Catalog.BackupCatalog;
import com.example.backupuniversal.catalog.Catalog.BackupRecord;
import com.example.backupuniversal.catalog.Catalog.CatalogStatistics;
import com.example.backupuniversal.packager.PackagerModule.ArchiveFormat;
import com.example.backupuniversal.scan.Scanner.DirectoryType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CatalogTest {

    @TempDir
    Path tempDir;

    private Path indexFile;

    @BeforeEach
    void setUp() {
        indexFile = tempDir.resolve("backups").resolve(Catalog.DEFAULT_FILE_NAME);
    }

    static BackupRecord record(String fileName, String dirName, String createdAt, long size) {
        return BackupRecord.builder()
                .fileName(fileName)
                .sourceDirectory("/home/user/" + dirName)
                .directoryName(dirName)
                .createdAt(createdAt)
                .originalSize(size * 2)
                .backupSize(size)
                .compressionRate(50.0)
                .totalFiles(3)
                .hash("d41d8cd98f00b204e9800998ecf8427e")
                .build();
    }

    @Test
    void missingIndexStartsEmpty() {
        BackupCatalog catalog = BackupCatalog.open(indexFile);

        assertTrue(catalog.isEmpty());
        assertFalse(catalog.recoveredFromCorruption());
        assertFalse(Files.exists(indexFile));
    }

    @Test
    void addPersistsAllFieldsAndReloads() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        BackupRecord original = record("backup_app_20250101_120000.zip", "app", "2025-01-01T12:00:00.123456", 1024)
                .toBuilder()
                .excludedFiles(4)
                .excludedDirectories(2)
                .directoryType(DirectoryType.PYTHON)
                .maxCompression(true)
                .format(ArchiveFormat.ZIP)
                .build();

        catalog.add(original);

        BackupRecord loaded = BackupCatalog.open(indexFile).findByFileName(original.fileName()).orElseThrow();
        assertEquals("/home/user/app", loaded.sourceDirectory());
        assertEquals("app", loaded.directoryName());
        assertEquals("2025-01-01T12:00:00.123456", loaded.createdAt());
        assertEquals(2048, loaded.originalSize());
        assertEquals(1024, loaded.backupSize());
        assertEquals(50.0, loaded.compressionRate(), 1e-9);
        assertEquals(3, loaded.totalFiles());
        assertEquals(4, loaded.excludedFiles());
        assertEquals(2, loaded.excludedDirectories());
        assertEquals(DirectoryType.PYTHON, loaded.directoryType());
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", loaded.hash());
        assertTrue(loaded.maxCompression());
        assertEquals(ArchiveFormat.ZIP, loaded.format());
    }

    @Test
    void writesJsonArrayWithExpectedKeysInOrder() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        catalog.add(record("a.tar.gz", "app", "2025-01-01T12:00:00.000000", 10));

        JsonNode root = new ObjectMapper().readTree(indexFile.toFile());
        assertTrue(root.isArray());
        assertEquals(1, root.size());

        List<String> keys = new ArrayList<>();
        Iterator<String> names = root.get(0).fieldNames();
        names.forEachRemaining(keys::add);
        assertEquals(List.of("arquivo", "diretorio_origem", "nome_diretorio", "data_criacao",
                "tamanho_original", "tamanho_backup", "taxa_compressao", "total_arquivos",
                "arquivos_excluidos", "diretorios_excluidos", "tipo_diretorio", "hash_md5",
                "compressao_maxima", "formato"), keys);
        assertEquals("generico", root.get(0).get("tipo_diretorio").asText());
        assertEquals("tar", root.get(0).get("formato").asText());
    }

    @Test
    void loadIgnoresUnknownKeysAndFillsDefaults() throws IOException {
        Files.createDirectories(indexFile.getParent());
        Files.writeString(indexFile, "[{\"arquivo\": \"velho.zip\", \"campo_novo\": 1}]");

        BackupCatalog catalog = BackupCatalog.open(indexFile);

        BackupRecord r = catalog.findByFileName("velho.zip").orElseThrow();
        assertEquals(ArchiveFormat.ZIP, r.format());
        assertEquals(DirectoryType.GENERICO, r.directoryType());
        assertEquals("", r.hash());
        assertEquals(Catalog.UNKNOWN_DIRECTORY, r.directoryKey());
        assertTrue(r.createdAtTime().isEmpty());
    }

    @Test
    void corruptIndexResetsToEmptyAndKeepsCopy() throws IOException {
        Files.createDirectories(indexFile.getParent());
        Files.writeString(indexFile, "{ isto não é json");

        BackupCatalog catalog = BackupCatalog.open(indexFile);

        assertTrue(catalog.isEmpty());
        assertTrue(catalog.recoveredFromCorruption());
        try (Stream<Path> files = Files.list(indexFile.getParent())) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString()
                    .startsWith(Catalog.DEFAULT_FILE_NAME + ".corrompido-")));
        }

        catalog.add(record("novo.tar.gz", "app", "2025-01-02T00:00:00.000000", 1));
        assertEquals(1, BackupCatalog.open(indexFile).size());
    }

    @Test
    void recordWithoutFileNameIsSkippedAndTheRestLoads() throws IOException {
        Files.createDirectories(indexFile.getParent());
        Files.writeString(indexFile, "[{\"arquivo\": \"a.tar.gz\", \"nome_diretorio\": \"app\"},"
                + " {\"nome_diretorio\": \"x\"}, 42, {\"arquivo\": \"b.zip\"}]");

        BackupCatalog catalog = BackupCatalog.open(indexFile);

        assertFalse(catalog.recoveredFromCorruption());
        assertEquals(List.of("a.tar.gz", "b.zip"),
                catalog.all().stream().map(BackupRecord::fileName).collect(Collectors.toList()));

        catalog.add(record("c.tar.gz", "app", "2025-01-02T00:00:00.000000", 1));
        assertEquals(3, BackupCatalog.open(indexFile).size());
    }

    @Test
    void nonArrayRootIsTreatedAsCorrupt() throws IOException {
        Files.createDirectories(indexFile.getParent());
        Files.writeString(indexFile, "{\"arquivo\": \"a.tar.gz\"}");

        BackupCatalog catalog = BackupCatalog.open(indexFile);

        assertTrue(catalog.isEmpty());
        assertTrue(catalog.recoveredFromCorruption());
    }

    @Test
    void groupsByDirectoryInFirstAppearanceOrder() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        catalog.add(record("b1", "beta", "2025-01-01T10:00:00.000000", 1));
        catalog.add(record("a1", "alfa", "2025-01-01T11:00:00.000000", 1));
        catalog.add(record("b2", "beta", "2025-01-01T12:00:00.000000", 1));

        Map<String, List<BackupRecord>> groups = catalog.groupedByDirectory();

        assertEquals(List.of("beta", "alfa"), new ArrayList<>(groups.keySet()));
        assertEquals(2, groups.get("beta").size());
        assertEquals(2, catalog.byDirectory("beta").size());
        assertTrue(catalog.byDirectory("gama").isEmpty());
    }

    @Test
    void sortsByCreationDate() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        catalog.add(record("meio", "app", "2025-01-02T00:00:00.000000", 1));
        catalog.add(record("novo", "app", "2025-01-03T00:00:00.000000", 1));
        catalog.add(record("velho", "app", "2025-01-01T00:00:00.000000", 1));

        assertEquals(List.of("novo", "meio", "velho"), names(catalog.sortedByDate(true)));
        assertEquals(List.of("velho", "meio", "novo"), names(catalog.sortedByDate(false)));
    }

    @Test
    void statisticsSummarizeCatalog() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        assertEquals(0, catalog.statistics().totalBackups());
        assertTrue(catalog.statistics().oldestBackup().isEmpty());

        catalog.add(record("x1", "x", "2025-03-01T00:00:00.000000", 100));
        catalog.add(record("y1", "y", "2025-01-01T00:00:00.000000", 200));
        catalog.add(record("x2", "x", "2025-02-01T00:00:00.000000", 300));

        CatalogStatistics stats = catalog.statistics();
        assertEquals(3, stats.totalBackups());
        assertEquals(600, stats.totalSize());
        assertEquals(2, stats.uniqueDirectories());
        assertEquals("2025-01-01T00:00:00.000000", stats.oldestBackup().orElseThrow());
        assertEquals("2025-03-01T00:00:00.000000", stats.newestBackup().orElseThrow());
    }

    @Test
    void removeAndRemoveAllRewriteIndex() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        catalog.add(record("a", "app", "2025-01-01T00:00:00.000000", 1));
        catalog.add(record("b", "app", "2025-01-02T00:00:00.000000", 1));
        catalog.add(record("c", "app", "2025-01-03T00:00:00.000000", 1));

        assertTrue(catalog.remove("a"));
        assertFalse(catalog.remove("a"));
        assertEquals(2, catalog.removeAll(List.of("b", "c", "inexistente")));
        assertEquals(0, catalog.removeAll(List.of()));

        assertTrue(BackupCatalog.open(indexFile).isEmpty());
    }

    @Test
    void findByHashIgnoresCase() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        catalog.add(record("a", "app", "2025-01-01T00:00:00.000000", 1));

        assertTrue(catalog.findByHash("D41D8CD98F00B204E9800998ECF8427E").isPresent());
        assertTrue(catalog.findByHash("").isEmpty());
        assertTrue(catalog.findByHash("ffff").isEmpty());
    }

    @Test
    void createdAtFromDateTimeUsesMicrosecondPattern() {
        BackupRecord r = BackupRecord.builder()
                .fileName("a")
                .createdAt(LocalDateTime.of(2025, 1, 2, 3, 4, 5, 6_000))
                .build();

        assertEquals("2025-01-02T03:04:05.000006", r.createdAt());
        assertEquals(LocalDateTime.of(2025, 1, 2, 3, 4, 5, 6_000), r.createdAtTime().orElseThrow());
    }

    @Test
    void saveLeavesNoTemporaryFiles() throws IOException {
        BackupCatalog catalog = BackupCatalog.open(indexFile);
        catalog.add(record("a", "app", "2025-01-01T00:00:00.000000", 1));
        catalog.clear();

        try (Stream<Path> files = Files.list(indexFile.getParent())) {
            assertEquals(List.of(indexFile.getFileName().toString()),
                    files.map(p -> p.getFileName().toString()).toList());
        }
        assertEquals("[ ]", Files.readString(indexFile).trim());
    }

    private static List<String> names(List<BackupRecord> records) {
        List<String> out = new ArrayList<>();
        for (BackupRecord r : records) {
            out.add(r.fileName());
        }
        return out;
    }
}
