package com.example.backupuniversal.retention;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupuniversal.catalog.Catalog.BackupCatalog;
import com.example.backupuniversal.catalog.Catalog.BackupRecord;
import com.example.backupuniversal.storage.Storage.ArchiveDirectory;

/**
 * Políticas de retenção: quantidade por diretório, idade e tamanho total.
 */
public final class Retention {

    private Retention() {}

    public static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

    /**
     * Resultado de uma limpeza.
     */
    public static final class RetentionStats {
        private final int removedCount;
        private final long freedBytes;
        private final int keptCount;

        public RetentionStats(int removedCount, long freedBytes, int keptCount) {
            this.removedCount = removedCount;
            this.freedBytes = freedBytes;
            this.keptCount = keptCount;
        }

        public static RetentionStats nothingRemoved(int keptCount) {
            return new RetentionStats(0, 0L, keptCount);
        }

        public int removedCount() { return removedCount; }
        public long freedBytes() { return freedBytes; }
        public int keptCount() { return keptCount; }

        @Override
        public String toString() {
            return "RetentionStats{removidos=" + removedCount + ", liberados=" + freedBytes
                    + ", mantidos=" + keptCount + '}';
        }
    }

    /**
     * Aplica as políticas sobre o catálogo e o diretório de arquivos.
     *
     * Registro cujo arquivo já sumiu é removido normalmente. Registro cujo arquivo
     * existe mas não pôde ser apagado permanece no catálogo.
     */
    public static final class RetentionManager {

        private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

        private final BackupCatalog catalog;
        private final ArchiveDirectory archives;
        private final Clock clock;

        public RetentionManager(BackupCatalog catalog, ArchiveDirectory archives) {
            this(catalog, archives, Clock.systemDefaultZone());
        }

        public RetentionManager(BackupCatalog catalog, ArchiveDirectory archives, Clock clock) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            this.archives = Objects.requireNonNull(archives, "archives");
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        /**
         * Remove, por diretório, os backups além dos {@code maxPerDirectory} mais recentes
         * e também qualquer backup mais velho que {@code daysToKeep} dias.
         */
        public RetentionStats cleanupByAgeAndCount(int daysToKeep, int maxPerDirectory) throws IOException {
            if (daysToKeep < 0) {
                throw new IllegalArgumentException("daysToKeep deve ser >= 0");
            }
            if (maxPerDirectory < 0) {
                throw new IllegalArgumentException("maxPerDirectory deve ser >= 0");
            }
            int initial = catalog.size();
            if (initial == 0) {
                return RetentionStats.nothingRemoved(0);
            }

            LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(daysToKeep);
            log.info("Limpeza por idade/quantidade: manter {} por diretório, corte em {}", maxPerDirectory, cutoff);

            List<String> toRemove = new ArrayList<>();
            long freed = 0;

            for (Map.Entry<String, List<BackupRecord>> group : catalog.groupedByDirectory().entrySet()) {
                List<BackupRecord> backups = new ArrayList<>(group.getValue());
                backups.sort(BackupCatalog.byCreationDate().reversed());

                for (int i = 0; i < backups.size(); i++) {
                    BackupRecord record = backups.get(i);
                    boolean overCount = i >= maxPerDirectory;
                    boolean tooOld = isOlderThan(record, cutoff);
                    if (!overCount && !tooOld) {
                        continue;
                    }
                    Optional<Long> released = deleteArchive(record);
                    if (released.isPresent()) {
                        freed += released.get();
                        toRemove.add(record.fileName());
                        log.debug("Marcado para remoção ({}): {}", overCount ? "quantidade" : "idade", record.fileName());
                    }
                }
            }

            int removed = catalog.removeAll(toRemove);
            RetentionStats stats = new RetentionStats(removed, freed, initial - removed);
            log.info("Limpeza por idade/quantidade concluída: {}", stats);
            return stats;
        }

        /**
         * Remove backups do mais antigo para o mais novo até o total ficar dentro do limite.
         */
        public RetentionStats cleanupBySize(long maxTotalSizeBytes) throws IOException {
            if (maxTotalSizeBytes < 0) {
                throw new IllegalArgumentException("maxTotalSizeBytes deve ser >= 0");
            }
            int initial = catalog.size();
            long total = catalog.totalSize();
            if (total <= maxTotalSizeBytes) {
                return RetentionStats.nothingRemoved(initial);
            }

            log.info("Limpeza por tamanho: total {} bytes acima do limite {} bytes", total, maxTotalSizeBytes);

            List<String> toRemove = new ArrayList<>();
            long freed = 0;
            long remaining = total;

            for (BackupRecord record : catalog.sortedByDate(false)) {
                if (remaining <= maxTotalSizeBytes) {
                    break;
                }
                Optional<Long> released = deleteArchive(record);
                if (released.isEmpty()) {
                    continue;
                }
                toRemove.add(record.fileName());
                freed += released.get();
                remaining -= released.get();
            }

            int removed = catalog.removeAll(toRemove);
            RetentionStats stats = new RetentionStats(removed, freed, initial - removed);
            log.info("Limpeza por tamanho concluída: {}", stats);
            return stats;
        }

        public RetentionStats cleanupBySizeGb(int maxTotalSizeGb) throws IOException {
            return cleanupBySize(maxTotalSizeGb * BYTES_PER_GB);
        }

        /**
         * Apaga arquivos de backup no diretório que não são referenciados pelo catálogo.
         * Registros sem arquivo não são tocados.
         *
         * @return quantidade de arquivos removidos
         */
        public int removeOrphanFiles() throws IOException {
            Set<String> referenced = new HashSet<>();
            for (BackupRecord r : catalog.all()) {
                referenced.add(r.fileName());
            }

            int removed = 0;
            for (Path file : archives.listArchives()) {
                String name = file.getFileName().toString();
                if (referenced.contains(name)) {
                    continue;
                }
                try {
                    archives.delete(name);
                    removed++;
                    log.info("Arquivo órfão removido: {}", name);
                } catch (IOException e) {
                    log.error("Falha ao remover arquivo órfão {}: {}", name, e.getMessage());
                }
            }
            return removed;
        }

        // ==================== Auxiliares ====================

        /**
         * Apaga o arquivo do registro. Vazio se a remoção falhou (registro deve ficar);
         * 0 se o arquivo já não existia.
         */
        private Optional<Long> deleteArchive(BackupRecord record) {
            try {
                return Optional.of(archives.delete(record.fileName()));
            } catch (IOException | IllegalArgumentException e) {
                log.error("Falha ao remover {}: {}", record.fileName(), e.getMessage());
                return Optional.empty();
            }
        }

        private static boolean isOlderThan(BackupRecord record, LocalDateTime cutoff) {
            return record.createdAtTime().map(t -> t.isBefore(cutoff)).orElse(false);
        }
    }
}
