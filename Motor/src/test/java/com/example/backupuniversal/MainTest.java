package com.example.backupuniversal;

import com.example.backupuniversal.catalog.Catalog;
import com.example.backupuniversal.catalog.Catalog.BackupCatalog;
import com.example.backupuniversal.catalog.Catalog.BackupRecord;
import com.example.backupuniversal.config.AppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private Path source;
    private Path archiveDir;
    private ByteArrayOutputStream buffer;
    private Main main;

    @BeforeEach
    void setUp() throws IOException {
        source = Files.createDirectories(tempDir.resolve("fotos"));
        Files.writeString(source.resolve("ferias.jpg"), "jpeg");
        Files.writeString(source.resolve("lixo.tmp"), "tmp");
        archiveDir = tempDir.resolve("archives");

        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.BACKUP_SOURCE, source.toString(),
                AppConfig.BACKUP_DESTINATION, archiveDir.toString()));
        buffer = new ByteArrayOutputStream();
        main = new Main(config, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private BackupRecord onlyRecord() {
        BackupCatalog catalog = BackupCatalog.open(archiveDir.resolve(Catalog.DEFAULT_FILE_NAME));
        assertEquals(1, catalog.size());
        return catalog.all().get(0);
    }

    @Test
    void defaultActionBacksUpConfiguredSource() {
        assertEquals(Main.EXIT_OK, main.run(new String[0]));

        BackupRecord record = onlyRecord();
        assertTrue(record.fileName().startsWith("backup_fotos_"));
        assertEquals(1, record.totalFiles());
        assertTrue(output().contains(record.fileName()));
    }

    @Test
    void backupFlagsAreApplied() throws IOException {
        Path other = Files.createDirectories(tempDir.resolve("outro"));
        Files.writeString(other.resolve("a.txt"), "a");
        Files.writeString(other.resolve("b.txt"), "b");

        int code = main.run(new String[]{"-d", other.toString(), "--nome", "semanal", "--formato", "zip",
                "--compressao-maxima", "--excluir", "b.txt"});

        assertEquals(Main.EXIT_OK, code);
        BackupRecord record = onlyRecord();
        assertTrue(record.fileName().startsWith("semanal_"));
        assertTrue(record.fileName().endsWith(".zip"));
        assertTrue(record.maxCompression());
        assertEquals(1, record.totalFiles());
    }

    @Test
    void missingSourceExitsWithFailure() {
        assertEquals(Main.EXIT_FAILURE, main.run(new String[]{"--diretorio", tempDir.resolve("nada").toString()}));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--desconhecida"}));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--formato", "rar"}));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--restaurar", "a.tar.gz"}));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--listar-backups", "--estatisticas"}));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"--nome"}));
        assertEquals(Main.EXIT_USAGE, main.run(new String[]{"sobrando"}));
        assertTrue(output().contains("Uso: backup-universal"));
        assertFalse(Files.exists(archiveDir));
    }

    @Test
    void helpListsEveryFlag() {
        assertEquals(Main.EXIT_OK, main.run(new String[]{"--ajuda"}));

        String help = output();
        for (String flag : new String[]{"--diretorio", "--nome", "--formato", "--compressao-maxima", "--excluir",
                "--listar-backups", "--estatisticas", "--limpar-antigos", "--limpar-por-tamanho",
                "--limpar-orfaos", "--restaurar", "--verificar"}) {
            assertTrue(help.contains(flag), flag);
        }
    }

    @Test
    void longFileNamesAreTruncatedInListing() throws IOException {
        String longName = "backup_" + "x".repeat(80) + ".tar.gz";
        BackupCatalog.open(archiveDir.resolve(Catalog.DEFAULT_FILE_NAME)).add(BackupRecord.builder()
                .fileName(longName)
                .directoryName("fotos")
                .createdAt("2025-01-01T10:00:00.000000")
                .build());

        assertEquals(Main.EXIT_OK, main.run(new String[]{"--listar-backups"}));

        assertFalse(output().contains(longName));
        assertTrue(output().contains(longName.substring(0, 57) + "..."));
    }

    @Test
    void listVerifyRestoreAndStatistics() throws IOException {
        assertEquals(Main.EXIT_OK, main.run(new String[0]));
        String fileName = onlyRecord().fileName();

        assertEquals(Main.EXIT_OK, main.run(new String[]{"--listar-backups"}));
        assertTrue(output().contains("fotos (1 backups)"));

        assertEquals(Main.EXIT_OK, main.run(new String[]{"--verificar", fileName}));
        assertEquals(Main.EXIT_FAILURE, main.run(new String[]{"--verificar", "inexistente.tar.gz"}));

        Path destination = tempDir.resolve("restauro").resolve("fotos");
        assertEquals(Main.EXIT_OK, main.run(new String[]{"--restaurar", fileName, destination.toString()}));
        assertEquals("jpeg", Files.readString(destination.resolve("ferias.jpg")));

        assertEquals(Main.EXIT_OK, main.run(new String[]{"--estatisticas"}));
        assertTrue(output().contains("Total de backups: 1"));
    }

    @Test
    void cleanupActionsSucceedOnEmptyCatalog() throws IOException {
        Files.createDirectories(archiveDir);
        Files.writeString(archiveDir.resolve("orfao.tar.gz"), "x");

        assertEquals(Main.EXIT_OK, main.run(new String[]{"--limpar-antigos"}));
        assertEquals(Main.EXIT_OK, main.run(new String[]{"--limpar-por-tamanho"}));
        assertEquals(Main.EXIT_OK, main.run(new String[]{"--limpar-orfaos"}));
        assertFalse(Files.exists(archiveDir.resolve("orfao.tar.gz")));
        assertTrue(output().contains("Arquivos órfãos removidos: 1"));
    }
}
