package com.example.backupuniversal.restore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupuniversal.catalog.Catalog.BackupCatalog;
import com.example.backupuniversal.catalog.Catalog.BackupRecord;
import com.example.backupuniversal.integrity.Integrity.HashAlgorithm;
import com.example.backupuniversal.integrity.Integrity.IntegrityChecker;
import com.example.backupuniversal.packager.PackagerModule.Compressor;
import com.example.backupuniversal.packager.PackagerModule.Compressors;
import com.example.backupuniversal.storage.Storage.ArchiveDirectory;

/**
 * Restauração e verificação de backups registrados no catálogo.
 */
public final class Restore {

    private Restore() {}

    public enum RestoreStatus {
        RESTORED,
        NOT_IN_CATALOG,
        ARCHIVE_MISSING,
        UNRECOGNIZED_FORMAT,
        EXTRACTION_FAILED
    }

    /**
     * Resultado de uma restauração. Falhas vêm como status, nunca como exceção.
     */
    public static final class RestoreResult {
        private final String fileName;
        private final RestoreStatus status;
        private final Path extractedTo;
        private final String message;

        private RestoreResult(String fileName, RestoreStatus status, Path extractedTo, String message) {
            this.fileName = fileName;
            this.status = Objects.requireNonNull(status, "status");
            this.extractedTo = extractedTo;
            this.message = message;
        }

        static RestoreResult restored(String fileName, Path extractedTo) {
            return new RestoreResult(fileName, RestoreStatus.RESTORED, extractedTo, "Backup restaurado em " + extractedTo);
        }

        static RestoreResult failed(String fileName, RestoreStatus status, String message) {
            return new RestoreResult(fileName, status, null, message);
        }

        public String fileName() { return fileName; }
        public RestoreStatus status() { return status; }
        public boolean success() { return status == RestoreStatus.RESTORED; }
        public Optional<Path> extractedTo() { return Optional.ofNullable(extractedTo); }
        public String message() { return message; }

        @Override
        public String toString() {
            return "RestoreResult{" + fileName + ", " + status + ", " + message + '}';
        }
    }

    /**
     * Restaura arquivos do catálogo e confere hashes.
     *
     * O compressor usado na extração é escolhido pelo sufixo do nome do arquivo
     * (.tar.gz / .zip), não pelo campo "formato" do registro.
     */
    public static final class RestoreManager {

        private static final Logger log = LoggerFactory.getLogger(RestoreManager.class);

        private final BackupCatalog catalog;
        private final ArchiveDirectory archives;
        private final IntegrityChecker integrity;

        public RestoreManager(BackupCatalog catalog, ArchiveDirectory archives) {
            this(catalog, archives, new IntegrityChecker());
        }

        public RestoreManager(BackupCatalog catalog, ArchiveDirectory archives, IntegrityChecker integrity) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            this.archives = Objects.requireNonNull(archives, "archives");
            this.integrity = Objects.requireNonNull(integrity, "integrity");
        }

        /**
         * Backups agrupados por diretório, cada grupo do mais novo para o mais antigo.
         */
        public Map<String, List<BackupRecord>> listAvailable() {
            Map<String, List<BackupRecord>> grouped = new LinkedHashMap<>();
            for (Map.Entry<String, List<BackupRecord>> e : catalog.groupedByDirectory().entrySet()) {
                List<BackupRecord> sorted = new ArrayList<>(e.getValue());
                sorted.sort(BackupCatalog.byCreationDate().reversed());
                grouped.put(e.getKey(), sorted);
            }
            return grouped;
        }

        public Optional<BackupRecord> findLatest(String directoryName) {
            List<BackupRecord> group = listAvailable().get(directoryName);
            if (group == null || group.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(group.get(0));
        }

        /**
         * Extrai o backup sob {@code destination.getParent()}. O nome final de
         * {@code destination} é apenas indicativo: o arquivo recria a pasta de topo original.
         */
        public RestoreResult restoreByName(String fileName, Path destination) {
            Objects.requireNonNull(fileName, "fileName");
            Objects.requireNonNull(destination, "destination");

            Optional<BackupRecord> record = catalog.findByFileName(fileName);
            if (record.isEmpty()) {
                log.error("Backup não encontrado no catálogo: {}", fileName);
                return RestoreResult.failed(fileName, RestoreStatus.NOT_IN_CATALOG, "Backup não encontrado no catálogo");
            }

            Path archive;
            try {
                archive = archives.resolve(fileName);
            } catch (IllegalArgumentException e) {
                log.error("Nome de backup inválido: {}", fileName);
                return RestoreResult.failed(fileName, RestoreStatus.ARCHIVE_MISSING, e.getMessage());
            }
            if (!Files.isRegularFile(archive)) {
                log.error("Arquivo de backup não encontrado: {}", archive);
                return RestoreResult.failed(fileName, RestoreStatus.ARCHIVE_MISSING, "Arquivo de backup não encontrado: " + archive);
            }

            Optional<Compressor> compressor = Compressors.forFileName(fileName);
            if (compressor.isEmpty()) {
                log.error("Formato de arquivo não reconhecido: {}", fileName);
                return RestoreResult.failed(fileName, RestoreStatus.UNRECOGNIZED_FORMAT, "Formato de arquivo não reconhecido");
            }
            if (compressor.get().format() != record.get().format()) {
                log.warn("Formato registrado ({}) diverge do sufixo de {}; usando o sufixo",
                        record.get().format().token(), fileName);
            }

            Path absolute = destination.toAbsolutePath().normalize();
            Path parent = absolute.getParent() != null ? absolute.getParent() : absolute;

            log.info("Restaurando {} em {}", fileName, parent);
            try {
                Files.createDirectories(parent);
                compressor.get().decompress(archive, parent);
            } catch (IOException | RuntimeException e) {
                log.error("Falha ao restaurar {}: {}", fileName, e.getMessage());
                return RestoreResult.failed(fileName, RestoreStatus.EXTRACTION_FAILED, e.getMessage());
            }

            log.info("Backup {} restaurado com sucesso", fileName);
            return RestoreResult.restored(fileName, parent);
        }

        /**
         * Recalcula o hash do arquivo e compara com o registrado.
         * Falso se o registro, o hash ou o arquivo estiverem ausentes.
         */
        public boolean verifyIntegrity(String fileName) {
            Optional<BackupRecord> record = catalog.findByFileName(fileName);
            if (record.isEmpty()) {
                log.error("Backup não encontrado no catálogo: {}", fileName);
                return false;
            }
            String expected = record.get().hash();
            if (expected == null || expected.isBlank()) {
                log.warn("Backup {} não possui hash registrado", fileName);
                return false;
            }

            Path archive;
            try {
                archive = archives.resolve(fileName);
            } catch (IllegalArgumentException e) {
                log.error("Nome de backup inválido: {}", fileName);
                return false;
            }
            if (!Files.isRegularFile(archive)) {
                log.error("Arquivo de backup não encontrado: {}", archive);
                return false;
            }

            boolean ok = integrity.verify(archive, expected, HashAlgorithm.forHexLength(expected));
            if (ok) {
                log.info("Integridade verificada: {}", fileName);
            } else {
                log.error("Falha na verificação de integridade: {}", fileName);
            }
            return ok;
        }
    }
}
