package com.example.backupuniversal.backup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupuniversal.catalog.Catalog.BackupCatalog;
import com.example.backupuniversal.catalog.Catalog.BackupRecord;
import com.example.backupuniversal.config.AppConfig;
import com.example.backupuniversal.integrity.Integrity.HashAlgorithm;
import com.example.backupuniversal.integrity.Integrity.IntegrityChecker;
import com.example.backupuniversal.packager.PackagerModule;
import com.example.backupuniversal.packager.PackagerModule.ArchiveFormat;
import com.example.backupuniversal.packager.PackagerModule.CompressionResult;
import com.example.backupuniversal.packager.PackagerModule.Compressor;
import com.example.backupuniversal.packager.PackagerModule.Compressors;
import com.example.backupuniversal.packager.PackagerModule.ProgressCallback;
import com.example.backupuniversal.scan.Scanner.DirectoryType;
import com.example.backupuniversal.scan.Scanner.ExclusionFilter;
import com.example.backupuniversal.scan.Scanner.ScanService;
import com.example.backupuniversal.scan.Scanner.SizeEstimate;
import com.example.backupuniversal.storage.Storage.ArchiveDirectory;
import com.example.backupuniversal.util.Formatters;

/**
 * Agrega o orquestrador de backup e os modelos do fluxo de criação.
 */
public final class Backup {

    private Backup() {}

    /** Carimbo usado no nome do arquivo: backup_projeto_20250101_120000.tar.gz */
    public static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    // ==================================================================================
    // Orquestrador
    // ==================================================================================

    /**
     * Ciclo completo de criação: valida origem, estima, compacta, calcula hash e registra.
     *
     * Um registro só entra no catálogo depois que o arquivo foi gravado e o hash calculado.
     * Qualquer falha na compactação apaga o arquivo parcial e nada é registrado.
     */
    public static final class BackupLifecycleManager {

        private static final Logger log = LoggerFactory.getLogger(BackupLifecycleManager.class);

        private final BackupCatalog catalog;
        private final ArchiveDirectory archives;
        private final BackupDefaults defaults;
        private final Function<ArchiveFormat, Compressor> compressorFactory;
        private final ScanService scanService;
        private final IntegrityChecker integrity;
        private final Clock clock;

        public BackupLifecycleManager(AppConfig config) {
            this(BackupCatalog.open(config.indexFile()),
                    new ArchiveDirectory(config.backupDestination()),
                    BackupDefaults.fromConfig(config));
        }

        public BackupLifecycleManager(BackupCatalog catalog, ArchiveDirectory archives, BackupDefaults defaults) {
            this(catalog, archives, defaults, Compressors::forFormat, Clock.systemDefaultZone());
        }

        public BackupLifecycleManager(BackupCatalog catalog,
                                      ArchiveDirectory archives,
                                      BackupDefaults defaults,
                                      Function<ArchiveFormat, Compressor> compressorFactory,
                                      Clock clock) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            this.archives = Objects.requireNonNull(archives, "archives");
            this.defaults = Objects.requireNonNull(defaults, "defaults");
            this.compressorFactory = Objects.requireNonNull(compressorFactory, "compressorFactory");
            this.clock = Objects.requireNonNull(clock, "clock");
            this.scanService = new ScanService();
            this.integrity = new IntegrityChecker();
        }

        public BackupCatalog catalog() {
            return catalog;
        }

        public ArchiveDirectory archives() {
            return archives;
        }

        /**
         * Cria um backup.
         *
         * @throws NoSuchFileException se a origem não existe
         * @throws NotDirectoryException se a origem não é um diretório
         * @throws IOException se a estimativa inicial falhar de forma fatal
         */
        public BackupResult createBackup(BackupRequest request) throws IOException {
            Objects.requireNonNull(request, "request");
            Path source = validateSource(request.sourceDirectory());

            ArchiveFormat format = request.format().orElse(defaults.format());
            int level = request.compressionLevel().orElse(defaults.compressionLevel());
            ExclusionFilter filter = buildFilter(request.exclusions());
            String dirName = directoryName(source);
            DirectoryType type = DirectoryType.detect(source);

            log.info("Iniciando backup de {} (tipo={}, formato={}, nível={})", source, type.value(), format.token(), level);

            // 1ª passada: estimativa (mesmas regras de exclusão)
            SizeEstimate estimate = scanService.estimate(source, filter);
            log.info("Arquivos a processar: {} ({})",
                    Formatters.formatNumber(estimate.fileCount()), Formatters.formatBytes(estimate.totalBytes()));
            notify(request, BackupProgressEvent.Type.SCAN_COMPLETED, source, 0, estimate.fileCount(), "Estimativa concluída");

            Compressor compressor = compressorFactory.apply(format);
            LocalDateTime now = LocalDateTime.now(clock);
            String fileName = archiveName(request.backupName().orElse(null), dirName, now, compressor.extension());
            Path archivePath = archives.ensureExists().resolve(fileName);

            if (level >= PackagerModule.MAX_LEVEL) {
                log.info("Usando compressão máxima");
            }
            log.info("Criando backup: {}", fileName);
            notify(request, BackupProgressEvent.Type.PACK_STARTED, source, 0, estimate.fileCount(), fileName);

            // 2ª passada: compactação
            CompressionResult compression;
            try {
                ProgressTracker tracker = new ProgressTracker(source, estimate.fileCount(), request.progressListener().orElse(null));
                compression = compressor.compress(source, archivePath, filter, tracker, level);
            } catch (IOException | RuntimeException e) {
                log.error("Erro ao criar backup {}: {}", fileName, e.getMessage());
                deletePartial(archivePath);
                notify(request, BackupProgressEvent.Type.ERROR, source, 0, estimate.fileCount(), e.getMessage());
                return BackupResult.failure(fileName, "Erro ao criar backup: " + e.getMessage(), estimate);
            }

            BackupRecord record;
            try {
                long backupSize = Files.size(archivePath);
                String hash = integrity.calculateHash(archivePath, defaults.hashAlgorithm()).orElse("");
                if (hash.isEmpty()) {
                    log.warn("Hash do backup {} não pôde ser calculado; registro ficará sem hash", fileName);
                }

                record = BackupRecord.builder()
                        .fileName(fileName)
                        .sourceDirectory(source.toString())
                        .directoryName(dirName)
                        .createdAt(LocalDateTime.now(clock))
                        .originalSize(estimate.totalBytes())
                        .backupSize(backupSize)
                        .compressionRate(Formatters.compressionRatio(estimate.totalBytes(), backupSize))
                        .totalFiles(compression.filesAdded())
                        .excludedFiles(compression.filesExcluded())
                        .excludedDirectories(compression.dirsExcluded())
                        .directoryType(type)
                        .hash(hash)
                        .maxCompression(level >= PackagerModule.MAX_LEVEL)
                        .format(format)
                        .build();

                catalog.add(record);
            } catch (IOException e) {
                log.error("Falha ao registrar backup {}: {}", fileName, e.getMessage());
                deletePartial(archivePath);
                notify(request, BackupProgressEvent.Type.ERROR, source, compression.filesAdded(), estimate.fileCount(), e.getMessage());
                return BackupResult.failure(fileName, "Falha ao registrar backup: " + e.getMessage(), estimate);
            }

            notify(request, BackupProgressEvent.Type.PACK_COMPLETED, source, compression.filesAdded(), estimate.fileCount(), fileName);
            log.info("Backup concluído: {} | incluídos={} excluídos={} | {} -> {} ({}% de compressão) | hash={}",
                    fileName,
                    Formatters.formatNumber(record.totalFiles()),
                    Formatters.formatNumber(record.excludedFiles() + record.excludedDirectories()),
                    Formatters.formatBytes(record.originalSize()),
                    Formatters.formatBytes(record.backupSize()),
                    String.format(Locale.ROOT, "%.1f", record.compressionRate()),
                    record.hash().isEmpty() ? "-" : record.hash().substring(0, Math.min(16, record.hash().length())));

            return BackupResult.success(record, archivePath, estimate);
        }

        /**
         * Estimativa isolada com as exclusões padrão mais as extras informadas.
         */
        public SizeEstimate estimate(Path sourceDirectory, List<String> extraExclusions) throws IOException {
            Path source = validateSource(sourceDirectory);
            return scanService.estimate(source, buildFilter(extraExclusions));
        }

        // ==================== Auxiliares ====================

        private ExclusionFilter buildFilter(List<String> extra) {
            ExclusionFilter filter = new ExclusionFilter(defaults.exclusions());
            filter.addPatterns(extra);
            return filter;
        }

        static Path validateSource(Path sourceDirectory) throws IOException {
            Objects.requireNonNull(sourceDirectory, "sourceDirectory");
            Path abs = sourceDirectory.toAbsolutePath().normalize();
            if (!Files.exists(abs)) {
                throw new NoSuchFileException(abs.toString(), null, "Diretório não encontrado");
            }
            if (!Files.isDirectory(abs)) {
                throw new NotDirectoryException(abs.toString());
            }
            return abs.toRealPath();
        }

        static String directoryName(Path source) {
            Path name = source.getFileName();
            return name != null ? name.toString() : source.toString();
        }

        static String archiveName(String customName, String dirName, LocalDateTime when, String extension) {
            String base = (customName != null && !customName.isBlank()) ? customName.trim() : "backup_" + dirName;
            return base + "_" + ARCHIVE_STAMP.format(when) + extension;
        }

        private static void deletePartial(Path archivePath) {
            try {
                if (Files.deleteIfExists(archivePath)) {
                    log.info("Arquivo parcial removido: {}", archivePath);
                }
            } catch (IOException e) {
                log.warn("Não foi possível remover arquivo parcial {}: {}", archivePath, e.getMessage());
            }
        }

        private static void notify(BackupRequest request, BackupProgressEvent.Type type, Path root,
                                   long filesAdded, long totalFiles, String message) {
            request.progressListener().ifPresent(l -> safeNotify(l,
                    new BackupProgressEvent(type, root, filesAdded, totalFiles, message)));
        }

        static void safeNotify(BackupProgressListener listener, BackupProgressEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.debug("Listener de progresso lançou exceção: {}", e.toString());
            }
        }
    }

    /**
     * Reporta progresso a cada {@code max(100, total/50)} arquivos (aprox. 2% da estimativa).
     */
    public static final class ProgressTracker implements ProgressCallback {

        private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

        private final Path root;
        private final long totalEstimated;
        private final long reportInterval;
        private final BackupProgressListener listener;
        private long lastReported;

        public ProgressTracker(Path root, long totalEstimated, BackupProgressListener listener) {
            this.root = root;
            this.totalEstimated = totalEstimated;
            this.reportInterval = Math.max(100L, totalEstimated / 50);
            this.listener = listener;
        }

        public long reportInterval() {
            return reportInterval;
        }

        @Override
        public void onFileAdded(long filesAdded) {
            if (filesAdded - lastReported < reportInterval) {
                return;
            }
            lastReported = filesAdded;
            if (totalEstimated > 0) {
                log.info("Progresso: {}/{} arquivos ({})",
                        Formatters.formatNumber(filesAdded),
                        Formatters.formatNumber(totalEstimated),
                        Formatters.formatProgress(filesAdded, totalEstimated));
            } else {
                log.info("Processados: {} arquivos", Formatters.formatNumber(filesAdded));
            }
            if (listener != null) {
                BackupLifecycleManager.safeNotify(listener, new BackupProgressEvent(
                        BackupProgressEvent.Type.FILES_ADDED, root, filesAdded, totalEstimated, null));
            }
        }
    }

    // ==================================================================================
    // Classes de Dados
    // ==================================================================================

    /**
     * Padrões aplicados quando a requisição não informa formato, nível ou exclusões.
     */
    public static final class BackupDefaults {
        private final ArchiveFormat format;
        private final int compressionLevel;
        private final List<String> exclusions;
        private final HashAlgorithm hashAlgorithm;

        private BackupDefaults(Builder b) {
            this.format = Objects.requireNonNull(b.format, "format");
            this.compressionLevel = b.compressionLevel;
            this.exclusions = List.copyOf(b.exclusions);
            this.hashAlgorithm = Objects.requireNonNull(b.hashAlgorithm, "hashAlgorithm");
        }

        public static BackupDefaults fromConfig(AppConfig config) {
            return builder()
                    .format(config.defaultFormat())
                    .compressionLevel(config.compressionLevel())
                    .exclusions(config.allExclusions())
                    .hashAlgorithm(config.hashAlgorithm())
                    .build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public ArchiveFormat format() { return format; }
        public int compressionLevel() { return compressionLevel; }
        public List<String> exclusions() { return exclusions; }
        public HashAlgorithm hashAlgorithm() { return hashAlgorithm; }

        public static final class Builder {
            private ArchiveFormat format = ArchiveFormat.TAR;
            private int compressionLevel = 6;
            private List<String> exclusions = List.of();
            private HashAlgorithm hashAlgorithm = HashAlgorithm.MD5;

            public Builder format(ArchiveFormat v) { this.format = v; return this; }
            public Builder compressionLevel(int v) { this.compressionLevel = v; return this; }
            public Builder exclusions(List<String> v) { this.exclusions = v != null ? v : List.of(); return this; }
            public Builder hashAlgorithm(HashAlgorithm v) { this.hashAlgorithm = v; return this; }

            public BackupDefaults build() {
                return new BackupDefaults(this);
            }
        }
    }

    /**
     * Parâmetros de um backup. Campos vazios caem nos {@link BackupDefaults}.
     */
    public static final class BackupRequest {
        private final Path sourceDirectory;
        private final String backupName;
        private final ArchiveFormat format;
        private final Integer compressionLevel;
        private final List<String> exclusions;
        private final BackupProgressListener progressListener;

        private BackupRequest(Builder b) {
            this.sourceDirectory = Objects.requireNonNull(b.sourceDirectory, "sourceDirectory");
            this.backupName = b.backupName;
            this.format = b.format;
            this.compressionLevel = b.compressionLevel;
            this.exclusions = List.copyOf(b.exclusions);
            this.progressListener = b.progressListener;
        }

        public static Builder builder(Path sourceDirectory) {
            return new Builder().sourceDirectory(sourceDirectory);
        }

        public Path sourceDirectory() { return sourceDirectory; }
        public Optional<String> backupName() { return Optional.ofNullable(backupName).filter(s -> !s.isBlank()); }
        public Optional<ArchiveFormat> format() { return Optional.ofNullable(format); }
        public Optional<Integer> compressionLevel() { return Optional.ofNullable(compressionLevel); }
        public List<String> exclusions() { return exclusions; }
        public Optional<BackupProgressListener> progressListener() { return Optional.ofNullable(progressListener); }

        public static final class Builder {
            private Path sourceDirectory;
            private String backupName;
            private ArchiveFormat format;
            private Integer compressionLevel;
            private final List<String> exclusions = new ArrayList<>();
            private BackupProgressListener progressListener;

            public Builder sourceDirectory(Path v) { this.sourceDirectory = v; return this; }
            public Builder backupName(String v) { this.backupName = v; return this; }
            public Builder format(ArchiveFormat v) { this.format = v; return this; }
            public Builder progressListener(BackupProgressListener l) { this.progressListener = l; return this; }

            /**
             * @throws IllegalArgumentException se fora de 0..9
             */
            public Builder compressionLevel(int v) {
                if (v < PackagerModule.MIN_LEVEL || v > PackagerModule.MAX_LEVEL) {
                    throw new IllegalArgumentException("Nível de compressão deve estar entre 0 e 9: " + v);
                }
                this.compressionLevel = v;
                return this;
            }

            public Builder exclude(String pattern) {
                if (pattern != null && !pattern.isBlank()) {
                    exclusions.add(pattern.trim());
                }
                return this;
            }

            public Builder exclusions(List<String> patterns) {
                if (patterns != null) {
                    patterns.forEach(this::exclude);
                }
                return this;
            }

            public BackupRequest build() {
                return new BackupRequest(this);
            }
        }
    }

    public static final class BackupResult {
        private final boolean success;
        private final String fileName;
        private final BackupRecord record;
        private final Path archivePath;
        private final String message;
        private final SizeEstimate estimate;

        private BackupResult(boolean success, String fileName, BackupRecord record,
                             Path archivePath, String message, SizeEstimate estimate) {
            this.success = success;
            this.fileName = fileName;
            this.record = record;
            this.archivePath = archivePath;
            this.message = message;
            this.estimate = estimate;
        }

        static BackupResult success(BackupRecord record, Path archivePath, SizeEstimate estimate) {
            return new BackupResult(true, record.fileName(), record, archivePath, "Backup concluído com sucesso", estimate);
        }

        static BackupResult failure(String fileName, String message, SizeEstimate estimate) {
            return new BackupResult(false, fileName, null, null, message, estimate);
        }

        public boolean success() { return success; }
        public String fileName() { return fileName; }
        public Optional<BackupRecord> record() { return Optional.ofNullable(record); }
        public Optional<Path> archivePath() { return Optional.ofNullable(archivePath); }
        public String message() { return message; }
        public SizeEstimate estimate() { return estimate; }
    }

    public static final class BackupProgressEvent {

        public enum Type {
            SCAN_COMPLETED,
            PACK_STARTED,
            FILES_ADDED,
            PACK_COMPLETED,
            ERROR
        }

        private final Type type;
        private final Path root;
        private final long filesAdded;
        private final long totalFiles;
        private final String message;

        public BackupProgressEvent(Type type, Path root, long filesAdded, long totalFiles, String message) {
            this.type = type;
            this.root = root;
            this.filesAdded = filesAdded;
            this.totalFiles = totalFiles;
            this.message = message;
        }

        public Type type() { return type; }
        public Path root() { return root; }
        public long filesAdded() { return filesAdded; }
        public long totalFiles() { return totalFiles; }
        public String message() { return message; }

        public double progress() {
            return totalFiles > 0 ? (double) filesAdded / totalFiles : 0.0;
        }
    }

    public interface BackupProgressListener {
        void onEvent(BackupProgressEvent event);
    }
}
