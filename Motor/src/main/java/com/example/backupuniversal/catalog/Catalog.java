package com.example.backupuniversal.catalog;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupuniversal.packager.PackagerModule.ArchiveFormat;
import com.example.backupuniversal.packager.PackagerModule.UnsupportedFormatException;
import com.example.backupuniversal.scan.Scanner.DirectoryType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Catálogo persistente de backups (índice JSON).
 *
 * O arquivo é um array JSON de registros, reescrito por inteiro a cada alteração.
 * As chaves seguem o formato histórico em português para manter compatibilidade
 * com índices já existentes.
 */
public final class Catalog {

    private Catalog() {}

    public static final String DEFAULT_FILE_NAME = "indice_backups.json";
    public static final String UNKNOWN_DIRECTORY = "desconhecido";

    /**
     * Timestamp local com microssegundos: a ordem lexicográfica coincide com a cronológica.
     */
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");

    // Chaves do índice, na ordem em que são gravadas
    static final String K_FILE = "arquivo";
    static final String K_SOURCE = "diretorio_origem";
    static final String K_DIR_NAME = "nome_diretorio";
    static final String K_CREATED = "data_criacao";
    static final String K_ORIGINAL_SIZE = "tamanho_original";
    static final String K_BACKUP_SIZE = "tamanho_backup";
    static final String K_RATE = "taxa_compressao";
    static final String K_TOTAL_FILES = "total_arquivos";
    static final String K_EXCLUDED_FILES = "arquivos_excluidos";
    static final String K_EXCLUDED_DIRS = "diretorios_excluidos";
    static final String K_DIR_TYPE = "tipo_diretorio";
    static final String K_HASH = "hash_md5";
    static final String K_MAX_COMPRESSION = "compressao_maxima";
    static final String K_FORMAT = "formato";

    /**
     * Registro imutável de um backup concluído.
     */
    public static final class BackupRecord {
        private final String fileName;
        private final String sourceDirectory;
        private final String directoryName;
        private final String createdAt;
        private final long originalSize;
        private final long backupSize;
        private final double compressionRate;
        private final long totalFiles;
        private final long excludedFiles;
        private final long excludedDirectories;
        private final DirectoryType directoryType;
        private final String hash;
        private final boolean maxCompression;
        private final ArchiveFormat format;

        private BackupRecord(Builder b) {
            this.fileName = Objects.requireNonNull(b.fileName, "fileName");
            this.sourceDirectory = b.sourceDirectory;
            this.directoryName = b.directoryName;
            this.createdAt = b.createdAt;
            this.originalSize = b.originalSize;
            this.backupSize = b.backupSize;
            this.compressionRate = b.compressionRate;
            this.totalFiles = b.totalFiles;
            this.excludedFiles = b.excludedFiles;
            this.excludedDirectories = b.excludedDirectories;
            this.directoryType = b.directoryType != null ? b.directoryType : DirectoryType.GENERICO;
            this.hash = b.hash != null ? b.hash : "";
            this.maxCompression = b.maxCompression;
            this.format = b.format != null ? b.format : ArchiveFormat.TAR;
        }

        public static Builder builder() {
            return new Builder();
        }

        public Builder toBuilder() {
            return new Builder()
                    .fileName(fileName)
                    .sourceDirectory(sourceDirectory)
                    .directoryName(directoryName)
                    .createdAt(createdAt)
                    .originalSize(originalSize)
                    .backupSize(backupSize)
                    .compressionRate(compressionRate)
                    .totalFiles(totalFiles)
                    .excludedFiles(excludedFiles)
                    .excludedDirectories(excludedDirectories)
                    .directoryType(directoryType)
                    .hash(hash)
                    .maxCompression(maxCompression)
                    .format(format);
        }

        public String fileName() { return fileName; }
        public String sourceDirectory() { return sourceDirectory; }
        public String directoryName() { return directoryName; }
        public String createdAt() { return createdAt; }
        public long originalSize() { return originalSize; }
        public long backupSize() { return backupSize; }
        public double compressionRate() { return compressionRate; }
        public long totalFiles() { return totalFiles; }
        public long excludedFiles() { return excludedFiles; }
        public long excludedDirectories() { return excludedDirectories; }
        public DirectoryType directoryType() { return directoryType; }
        public String hash() { return hash; }
        public boolean maxCompression() { return maxCompression; }
        public ArchiveFormat format() { return format; }

        /**
         * Nome do grupo usado em agrupamentos ("desconhecido" quando ausente).
         */
        public String directoryKey() {
            return directoryName != null ? directoryName : UNKNOWN_DIRECTORY;
        }

        /**
         * Data de criação interpretada; vazio se ausente ou ilegível.
         */
        public Optional<LocalDateTime> createdAtTime() {
            if (createdAt == null || createdAt.isBlank()) {
                return Optional.empty();
            }
            try {
                return Optional.of(LocalDateTime.parse(createdAt, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }

        @Override
        public String toString() {
            return "BackupRecord{" + fileName + ", dir=" + directoryName + ", criado=" + createdAt
                    + ", tamanho=" + backupSize + ", formato=" + format.token() + '}';
        }

        public static final class Builder {
            private String fileName;
            private String sourceDirectory;
            private String directoryName;
            private String createdAt;
            private long originalSize;
            private long backupSize;
            private double compressionRate;
            private long totalFiles;
            private long excludedFiles;
            private long excludedDirectories;
            private DirectoryType directoryType;
            private String hash;
            private boolean maxCompression;
            private ArchiveFormat format;

            public Builder fileName(String v) { this.fileName = v; return this; }
            public Builder sourceDirectory(String v) { this.sourceDirectory = v; return this; }
            public Builder directoryName(String v) { this.directoryName = v; return this; }
            public Builder createdAt(String v) { this.createdAt = v; return this; }
            public Builder createdAt(LocalDateTime v) { this.createdAt = v != null ? TIMESTAMP.format(v) : null; return this; }
            public Builder originalSize(long v) { this.originalSize = v; return this; }
            public Builder backupSize(long v) { this.backupSize = v; return this; }
            public Builder compressionRate(double v) { this.compressionRate = v; return this; }
            public Builder totalFiles(long v) { this.totalFiles = v; return this; }
            public Builder excludedFiles(long v) { this.excludedFiles = v; return this; }
            public Builder excludedDirectories(long v) { this.excludedDirectories = v; return this; }
            public Builder directoryType(DirectoryType v) { this.directoryType = v; return this; }
            public Builder hash(String v) { this.hash = v; return this; }
            public Builder maxCompression(boolean v) { this.maxCompression = v; return this; }
            public Builder format(ArchiveFormat v) { this.format = v; return this; }

            public BackupRecord build() {
                return new BackupRecord(this);
            }
        }
    }

    /**
     * Resumo agregado do catálogo.
     */
    public static final class CatalogStatistics {
        private final int totalBackups;
        private final long totalSize;
        private final int uniqueDirectories;
        private final String oldestBackup;
        private final String newestBackup;

        public CatalogStatistics(int totalBackups, long totalSize, int uniqueDirectories,
                                 String oldestBackup, String newestBackup) {
            this.totalBackups = totalBackups;
            this.totalSize = totalSize;
            this.uniqueDirectories = uniqueDirectories;
            this.oldestBackup = oldestBackup;
            this.newestBackup = newestBackup;
        }

        public int totalBackups() { return totalBackups; }
        public long totalSize() { return totalSize; }
        public int uniqueDirectories() { return uniqueDirectories; }
        public Optional<String> oldestBackup() { return Optional.ofNullable(oldestBackup); }
        public Optional<String> newestBackup() { return Optional.ofNullable(newestBackup); }
    }

    /**
     * Índice em memória sincronizado com o arquivo JSON.
     *
     * Não é thread-safe e não faz lock entre processos: a gravação via arquivo
     * temporário evita truncamento, não concorrência.
     */
    public static final class BackupCatalog {

        private static final Logger log = LoggerFactory.getLogger(BackupCatalog.class);
        private static final DateTimeFormatter CORRUPT_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

        private final Path indexFile;
        private final ObjectMapper mapper;
        private final List<BackupRecord> records = new ArrayList<>();
        private boolean recoveredFromCorruption;

        public BackupCatalog(Path indexFile) {
            this.indexFile = Objects.requireNonNull(indexFile, "indexFile").toAbsolutePath().normalize();
            this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        }

        /**
         * Cria o catálogo e já carrega o conteúdo do disco.
         */
        public static BackupCatalog open(Path indexFile) {
            BackupCatalog catalog = new BackupCatalog(indexFile);
            catalog.load();
            return catalog;
        }

        public Path indexFile() {
            return indexFile;
        }

        /**
         * Carrega o índice do disco substituindo o estado em memória.
         *
         * Arquivo ausente resulta em catálogo vazio. Conteúdo inválido também, mas
         * o arquivo original é copiado para "<nome>.corrompido-<data>" antes.
         * Nunca lança exceção.
         */
        public void load() {
            records.clear();
            recoveredFromCorruption = false;

            if (!Files.exists(indexFile)) {
                log.debug("Índice inexistente, iniciando catálogo vazio: {}", indexFile);
                return;
            }

            try {
                JsonNode root = mapper.readTree(indexFile.toFile());
                records.addAll(parseRecords(root));
                log.debug("Catálogo carregado: {} registros de {}", records.size(), indexFile);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Índice de backups corrompido ({}), reiniciando vazio: {}", indexFile, e.getMessage());
                records.clear();
                recoveredFromCorruption = true;
                preserveCorruptFile();
            }
        }

        /**
         * Grava o catálogo inteiro (arquivo temporário + rename).
         */
        public void save() throws IOException {
            Path parent = indexFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            ArrayNode array = mapper.createArrayNode();
            for (BackupRecord r : records) {
                array.add(toJson(r));
            }

            Path temp = Files.createTempFile(parent, indexFile.getFileName().toString() + ".", ".tmp");
            try {
                mapper.writeValue(temp.toFile(), array);
                moveAtomically(temp, indexFile);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw new IOException("Falha ao gravar índice de backups " + indexFile + ": " + e.getMessage(), e);
            }
        }

        /**
         * Acrescenta um registro e grava imediatamente. Se a gravação falhar,
         * o registro é retirado da memória e o erro propagado.
         */
        public void add(BackupRecord record) throws IOException {
            Objects.requireNonNull(record, "record");
            records.add(record);
            try {
                save();
            } catch (IOException e) {
                records.remove(records.size() - 1);
                throw e;
            }
        }

        /**
         * Remove pelo nome exato do arquivo. Só grava se algo foi removido.
         */
        public boolean remove(String fileName) throws IOException {
            return removeAll(Set.of(Objects.requireNonNull(fileName, "fileName"))) > 0;
        }

        /**
         * Remove vários registros em uma única passada e uma única gravação.
         */
        public int removeAll(Collection<String> fileNames) throws IOException {
            Objects.requireNonNull(fileNames, "fileNames");
            if (fileNames.isEmpty()) {
                return 0;
            }
            Set<String> targets = new HashSet<>(fileNames);
            List<BackupRecord> before = new ArrayList<>(records);
            boolean changed = records.removeIf(r -> targets.contains(r.fileName()));
            if (!changed) {
                return 0;
            }
            try {
                save();
            } catch (IOException e) {
                records.clear();
                records.addAll(before);
                throw e;
            }
            return before.size() - records.size();
        }

        public void clear() throws IOException {
            records.clear();
            save();
        }

        public List<BackupRecord> all() {
            return List.copyOf(records);
        }

        public int size() {
            return records.size();
        }

        public boolean isEmpty() {
            return records.isEmpty();
        }

        public boolean recoveredFromCorruption() {
            return recoveredFromCorruption;
        }

        public List<BackupRecord> byDirectory(String directoryName) {
            List<BackupRecord> out = new ArrayList<>();
            for (BackupRecord r : records) {
                if (Objects.equals(r.directoryName(), directoryName)) {
                    out.add(r);
                }
            }
            return out;
        }

        /**
         * Agrupa por nome de diretório, na ordem em que cada grupo aparece no índice.
         */
        public Map<String, List<BackupRecord>> groupedByDirectory() {
            Map<String, List<BackupRecord>> groups = new LinkedHashMap<>();
            for (BackupRecord r : records) {
                groups.computeIfAbsent(r.directoryKey(), k -> new ArrayList<>()).add(r);
            }
            return groups;
        }

        public List<BackupRecord> sortedByDate(boolean descending) {
            List<BackupRecord> sorted = new ArrayList<>(records);
            Comparator<BackupRecord> byDate = byCreationDate();
            sorted.sort(descending ? byDate.reversed() : byDate);
            return sorted;
        }

        public Optional<BackupRecord> findByFileName(String fileName) {
            for (BackupRecord r : records) {
                if (r.fileName().equals(fileName)) {
                    return Optional.of(r);
                }
            }
            return Optional.empty();
        }

        public Optional<BackupRecord> findByHash(String hash) {
            if (hash == null || hash.isBlank()) {
                return Optional.empty();
            }
            for (BackupRecord r : records) {
                if (r.hash().equalsIgnoreCase(hash.trim())) {
                    return Optional.of(r);
                }
            }
            return Optional.empty();
        }

        public long totalSize() {
            long total = 0;
            for (BackupRecord r : records) {
                total += r.backupSize();
            }
            return total;
        }

        public CatalogStatistics statistics() {
            if (records.isEmpty()) {
                return new CatalogStatistics(0, 0, 0, null, null);
            }
            List<BackupRecord> sorted = sortedByDate(false);
            Set<String> dirs = new HashSet<>();
            for (BackupRecord r : records) {
                dirs.add(r.directoryKey());
            }
            return new CatalogStatistics(
                    records.size(),
                    totalSize(),
                    dirs.size(),
                    sorted.get(0).createdAt(),
                    sorted.get(sorted.size() - 1).createdAt());
        }

        /**
         * Ordenação lexicográfica por data_criacao (ausente conta como "").
         */
        public static Comparator<BackupRecord> byCreationDate() {
            return Comparator.comparing(r -> r.createdAt() != null ? r.createdAt() : "");
        }

        // ==================== JSON ====================

        private ObjectNode toJson(BackupRecord r) {
            ObjectNode node = mapper.createObjectNode();
            node.put(K_FILE, r.fileName());
            node.put(K_SOURCE, r.sourceDirectory());
            node.put(K_DIR_NAME, r.directoryName());
            node.put(K_CREATED, r.createdAt());
            node.put(K_ORIGINAL_SIZE, r.originalSize());
            node.put(K_BACKUP_SIZE, r.backupSize());
            node.put(K_RATE, r.compressionRate());
            node.put(K_TOTAL_FILES, r.totalFiles());
            node.put(K_EXCLUDED_FILES, r.excludedFiles());
            node.put(K_EXCLUDED_DIRS, r.excludedDirectories());
            node.put(K_DIR_TYPE, r.directoryType().value());
            node.put(K_HASH, r.hash());
            node.put(K_MAX_COMPRESSION, r.maxCompression());
            node.put(K_FORMAT, r.format().token());
            return node;
        }

        private List<BackupRecord> parseRecords(JsonNode root) {
            if (root == null || !root.isArray()) {
                throw new IllegalArgumentException("Índice não é um array JSON");
            }
            List<BackupRecord> parsed = new ArrayList<>(root.size());
            int index = 0;
            for (JsonNode element : root) {
                Optional<BackupRecord> record = parseRecord(element);
                if (record.isPresent()) {
                    parsed.add(record.get());
                } else {
                    log.warn("Registro {} do índice ignorado (sem campo '{}'): {}", index, K_FILE, element);
                }
                index++;
            }
            return parsed;
        }

        private Optional<BackupRecord> parseRecord(JsonNode node) {
            if (!node.isObject() || !node.hasNonNull(K_FILE) || node.get(K_FILE).asText().isBlank()) {
                return Optional.empty();
            }
            String fileName = node.get(K_FILE).asText();
            return Optional.of(BackupRecord.builder()
                    .fileName(fileName)
                    .sourceDirectory(text(node, K_SOURCE))
                    .directoryName(text(node, K_DIR_NAME))
                    .createdAt(text(node, K_CREATED))
                    .originalSize(node.path(K_ORIGINAL_SIZE).asLong(0L))
                    .backupSize(node.path(K_BACKUP_SIZE).asLong(0L))
                    .compressionRate(node.path(K_RATE).asDouble(0.0))
                    .totalFiles(node.path(K_TOTAL_FILES).asLong(0L))
                    .excludedFiles(node.path(K_EXCLUDED_FILES).asLong(0L))
                    .excludedDirectories(node.path(K_EXCLUDED_DIRS).asLong(0L))
                    .directoryType(DirectoryType.fromValue(text(node, K_DIR_TYPE)))
                    .hash(node.hasNonNull(K_HASH) ? node.get(K_HASH).asText() : "")
                    .maxCompression(node.path(K_MAX_COMPRESSION).asBoolean(false))
                    .format(parseFormat(text(node, K_FORMAT), fileName))
                    .build());
        }

        private static ArchiveFormat parseFormat(String token, String fileName) {
            if (token != null) {
                try {
                    return ArchiveFormat.fromToken(token);
                } catch (UnsupportedFormatException e) {
                    log.debug("Formato '{}' desconhecido em {}, deduzindo pelo nome", token, fileName);
                }
            }
            return ArchiveFormat.fromFileName(fileName).orElse(ArchiveFormat.TAR);
        }

        private static String text(JsonNode node, String field) {
            JsonNode child = node.get(field);
            return child != null && !child.isNull() ? child.asText() : null;
        }

        // ==================== Arquivo ====================

        private void preserveCorruptFile() {
            Path copy = indexFile.resolveSibling(indexFile.getFileName() + ".corrompido-"
                    + CORRUPT_SUFFIX.format(LocalDateTime.now()));
            try {
                Files.copy(indexFile, copy, StandardCopyOption.REPLACE_EXISTING);
                log.warn("Cópia do índice corrompido mantida em {}", copy);
            } catch (IOException e) {
                log.warn("Não foi possível preservar o índice corrompido {}: {}", indexFile, e.getMessage());
            }
        }

        private static void moveAtomically(Path source, Path destination) throws IOException {
            try {
                Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }
}
