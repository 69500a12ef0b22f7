package com.example.backupuniversal;

import com.example.backupuniversal.backup.Backup.BackupDefaults;
import com.example.backupuniversal.backup.Backup.BackupLifecycleManager;
import com.example.backupuniversal.backup.Backup.BackupRequest;
import com.example.backupuniversal.backup.Backup.BackupResult;
import com.example.backupuniversal.catalog.Catalog.BackupCatalog;
import com.example.backupuniversal.catalog.Catalog.BackupRecord;
import com.example.backupuniversal.catalog.Catalog.CatalogStatistics;
import com.example.backupuniversal.config.AppConfig;
import com.example.backupuniversal.packager.PackagerModule;
import com.example.backupuniversal.packager.PackagerModule.ArchiveFormat;
import com.example.backupuniversal.packager.PackagerModule.UnsupportedFormatException;
import com.example.backupuniversal.restore.Restore.RestoreManager;
import com.example.backupuniversal.restore.Restore.RestoreResult;
import com.example.backupuniversal.retention.Retention.RetentionManager;
import com.example.backupuniversal.retention.Retention.RetentionStats;
import com.example.backupuniversal.storage.Storage.ArchiveDirectory;
import com.example.backupuniversal.util.Formatters;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entrada de linha de comando. Sem flags de ação, cria um backup.
 *
 * Códigos de saída: 0 sucesso, 1 falha da operação, 2 uso inválido.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final int MAX_NAME_WIDTH = 60;

    private enum Action {
        BACKUP,
        LIST,
        STATISTICS,
        CLEAN_OLD,
        CLEAN_BY_SIZE,
        CLEAN_ORPHANS,
        RESTORE,
        VERIFY
    }

    private final AppConfig config;
    private final PrintStream out;

    public Main(AppConfig config, PrintStream out) {
        this.config = Objects.requireNonNull(config, "config");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        int code = new Main(AppConfig.load(), System.out).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    public int run(String[] args) {
        Arguments options;
        try {
            options = Arguments.parse(args);
        } catch (ParseException e) {
            out.println("Erro: " + e.getMessage());
            printUsage();
            return EXIT_USAGE;
        }
        if (options.help) {
            printUsage();
            return EXIT_OK;
        }

        try {
            BackupCatalog catalog = BackupCatalog.open(config.indexFile());
            ArchiveDirectory archives = new ArchiveDirectory(config.backupDestination());

            return switch (options.action) {
                case LIST -> listBackups(new RestoreManager(catalog, archives));
                case STATISTICS -> printStatistics(catalog);
                case CLEAN_OLD -> cleanOld(new RetentionManager(catalog, archives));
                case CLEAN_BY_SIZE -> cleanBySize(new RetentionManager(catalog, archives));
                case CLEAN_ORPHANS -> cleanOrphans(new RetentionManager(catalog, archives));
                case RESTORE -> restore(new RestoreManager(catalog, archives), options);
                case VERIFY -> verify(new RestoreManager(catalog, archives), options);
                case BACKUP -> backup(new BackupLifecycleManager(catalog, archives, BackupDefaults.fromConfig(config)), options);
            };
        } catch (IllegalStateException e) {
            log.error("Configuração inválida: {}", e.getMessage());
            out.println("Erro de configuração: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    // ==================== Ações ====================

    private int backup(BackupLifecycleManager manager, Arguments options) {
        Path source = options.directory != null ? Path.of(options.directory) : config.sourceDirectory();

        BackupRequest.Builder request = BackupRequest.builder(source)
                .backupName(options.name)
                .format(options.format)
                .exclusions(options.exclusions);
        if (options.maxCompression) {
            request.compressionLevel(PackagerModule.MAX_LEVEL);
        }
        if (!options.exclusions.isEmpty()) {
            out.println("Padrões de exclusão adicionais: " + String.join(", ", options.exclusions));
        }

        BackupResult result;
        try {
            result = manager.createBackup(request.build());
        } catch (NoSuchFileException e) {
            out.println("Diretório não encontrado: " + e.getFile());
            return EXIT_FAILURE;
        } catch (NotDirectoryException e) {
            out.println("O caminho não é um diretório: " + e.getFile());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Falha ao analisar {}: {}", source, e.getMessage());
            out.println("Falha ao analisar o diretório: " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (!result.success()) {
            out.println(result.message());
            out.println("Verifique se o diretório especificado existe e é acessível");
            return EXIT_FAILURE;
        }

        BackupRecord record = result.record().orElseThrow();
        out.println("Backup criado: " + record.fileName());
        out.println("  Arquivos: " + Formatters.formatNumber(record.totalFiles())
                + " | Excluídos: " + Formatters.formatNumber(record.excludedFiles() + record.excludedDirectories()));
        out.println("  Tamanho: " + Formatters.formatBytes(record.originalSize())
                + " -> " + Formatters.formatBytes(record.backupSize())
                + String.format(Locale.ROOT, " (%.1f%%)", record.compressionRate()));
        out.println("  Hash: " + (record.hash().isEmpty() ? "-" : record.hash()));
        return EXIT_OK;
    }

    private int listBackups(RestoreManager restore) {
        Map<String, List<BackupRecord>> grouped = restore.listAvailable();
        if (grouped.isEmpty()) {
            out.println("Nenhum backup encontrado.");
            return EXIT_OK;
        }
        int index = 1;
        for (Map.Entry<String, List<BackupRecord>> group : grouped.entrySet()) {
            out.println(group.getKey() + " (" + group.getValue().size() + " backups)");
            for (BackupRecord r : group.getValue()) {
                String when = r.createdAtTime().map(Formatters::formatDate).orElse(r.createdAt());
                out.printf(Locale.ROOT, "  %2d. %s | %s | %s | %.1f%% | %s%n",
                        index++,
                        Formatters.truncate(r.fileName(), MAX_NAME_WIDTH),
                        when,
                        Formatters.formatBytes(r.backupSize()),
                        r.compressionRate(),
                        r.directoryType().value());
            }
        }
        return EXIT_OK;
    }

    private int printStatistics(BackupCatalog catalog) {
        CatalogStatistics stats = catalog.statistics();
        out.println("Total de backups: " + stats.totalBackups());
        out.println("Tamanho total: " + Formatters.formatBytes(stats.totalSize()));
        out.println("Diretórios distintos: " + stats.uniqueDirectories());
        out.println("Mais antigo: " + stats.oldestBackup().orElse("-"));
        out.println("Mais recente: " + stats.newestBackup().orElse("-"));
        return EXIT_OK;
    }

    private int cleanOld(RetentionManager retention) {
        try {
            RetentionStats stats = retention.cleanupByAgeAndCount(config.daysToKeep(), config.maxBackupsPerDirectory());
            printRetention(stats);
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Falha na limpeza: {}", e.getMessage());
            out.println("Falha na limpeza: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int cleanBySize(RetentionManager retention) {
        try {
            RetentionStats stats = retention.cleanupBySizeGb(config.maxTotalSizeGb());
            printRetention(stats);
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Falha na limpeza por tamanho: {}", e.getMessage());
            out.println("Falha na limpeza por tamanho: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int cleanOrphans(RetentionManager retention) {
        try {
            int removed = retention.removeOrphanFiles();
            out.println("Arquivos órfãos removidos: " + removed);
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Falha ao remover órfãos: {}", e.getMessage());
            out.println("Falha ao remover órfãos: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int restore(RestoreManager restore, Arguments options) {
        RestoreResult result = restore.restoreByName(options.targetFile, Path.of(options.restoreDestination));
        out.println(result.message());
        return result.success() ? EXIT_OK : EXIT_FAILURE;
    }

    private int verify(RestoreManager restore, Arguments options) {
        boolean ok = restore.verifyIntegrity(options.targetFile);
        out.println(ok ? "Integridade OK: " + options.targetFile : "Falha na verificação: " + options.targetFile);
        return ok ? EXIT_OK : EXIT_FAILURE;
    }

    private void printRetention(RetentionStats stats) {
        out.println("Removidos: " + stats.removedCount()
                + " | Espaço liberado: " + Formatters.formatBytes(stats.freedBytes())
                + " | Mantidos: " + stats.keptCount());
    }

    private void printUsage() {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setSyntaxPrefix("Uso: ");
        PrintWriter writer = new PrintWriter(out);
        formatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "backup-universal [opções]", null,
                Arguments.buildOptions(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    // ==================== Argumentos ====================

    static final class Arguments {

        private static final Map<String, Action> ACTIONS = Map.of(
                "listar-backups", Action.LIST,
                "estatisticas", Action.STATISTICS,
                "limpar-antigos", Action.CLEAN_OLD,
                "limpar-por-tamanho", Action.CLEAN_BY_SIZE,
                "limpar-orfaos", Action.CLEAN_ORPHANS,
                "restaurar", Action.RESTORE,
                "verificar", Action.VERIFY);

        Action action = Action.BACKUP;
        boolean help;
        String directory;
        String name;
        ArchiveFormat format;
        boolean maxCompression;
        final List<String> exclusions = new ArrayList<>();
        String targetFile;
        String restoreDestination;

        static Options buildOptions() {
            Options options = new Options();
            options.addOption(Option.builder("h").longOpt("ajuda").desc("mostra esta ajuda").build());
            options.addOption(Option.builder("d").longOpt("diretorio").hasArg().argName("caminho")
                    .desc("diretório de origem (padrão: BACKUP_SOURCE)").build());
            options.addOption(Option.builder().longOpt("nome").hasArg().argName("nome")
                    .desc("nome personalizado do backup").build());
            options.addOption(Option.builder().longOpt("formato").hasArg().argName("tar|zip")
                    .desc("formato do arquivo").build());
            options.addOption(Option.builder().longOpt("compressao-maxima")
                    .desc("usa nível " + PackagerModule.MAX_LEVEL).build());
            options.addOption(Option.builder().longOpt("excluir").hasArg().argName("a,b,...")
                    .desc("padrões de exclusão adicionais").build());

            OptionGroup actions = new OptionGroup();
            actions.addOption(Option.builder().longOpt("listar-backups").desc("lista backups por diretório").build());
            actions.addOption(Option.builder().longOpt("estatisticas").desc("estatísticas do catálogo").build());
            actions.addOption(Option.builder().longOpt("limpar-antigos").desc("limpeza por idade e quantidade").build());
            actions.addOption(Option.builder().longOpt("limpar-por-tamanho").desc("limpeza pelo tamanho total").build());
            actions.addOption(Option.builder().longOpt("limpar-orfaos").desc("remove arquivos fora do catálogo").build());
            actions.addOption(Option.builder().longOpt("restaurar").numberOfArgs(2).argName("arquivo> <destino")
                    .desc("restaura um backup do catálogo").build());
            actions.addOption(Option.builder().longOpt("verificar").hasArg().argName("arquivo")
                    .desc("confere o hash de um backup").build());
            options.addOptionGroup(actions);
            return options;
        }

        static Arguments parse(String[] args) throws ParseException {
            CommandLine line = new DefaultParser().parse(buildOptions(), args);
            if (!line.getArgList().isEmpty()) {
                throw new ParseException("Argumento inesperado: " + line.getArgList().get(0));
            }

            Arguments a = new Arguments();
            a.help = line.hasOption("ajuda");
            a.directory = line.getOptionValue("diretorio");
            a.name = line.getOptionValue("nome");
            if (line.hasOption("formato")) {
                a.format = parseFormat(line.getOptionValue("formato"));
            }
            a.maxCompression = line.hasOption("compressao-maxima");
            if (line.hasOption("excluir")) {
                for (String raw : line.getOptionValues("excluir")) {
                    for (String p : raw.split(",")) {
                        if (!p.isBlank()) {
                            a.exclusions.add(p.trim());
                        }
                    }
                }
            }

            // o grupo de ações já garante no máximo uma
            for (Map.Entry<String, Action> entry : ACTIONS.entrySet()) {
                if (line.hasOption(entry.getKey())) {
                    a.action = entry.getValue();
                }
            }
            if (a.action == Action.RESTORE) {
                String[] values = line.getOptionValues("restaurar");
                a.targetFile = values[0];
                a.restoreDestination = values[1];
            } else if (a.action == Action.VERIFY) {
                a.targetFile = line.getOptionValue("verificar");
            }
            return a;
        }

        private static ArchiveFormat parseFormat(String raw) throws ParseException {
            try {
                return ArchiveFormat.fromToken(raw);
            } catch (UnsupportedFormatException e) {
                throw new ParseException("Formato inválido: " + raw + " (use tar ou zip)");
            }
        }
    }
}
