package com.example.backupuniversal.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.example.backupuniversal.catalog.Catalog;
import com.example.backupuniversal.integrity.Integrity.HashAlgorithm;
import com.example.backupuniversal.packager.PackagerModule.ArchiveFormat;
import com.example.backupuniversal.packager.PackagerModule.UnsupportedFormatException;

/**
 * AppConfig
 * ----------
 * Responsável por carregar, validar e expor configurações do backup.
 *
 * PRINCÍPIOS:
 * - Falhar cedo em valores que mudam o comportamento (formato, algoritmo de hash).
 * - Precedência previsível: overrides > System properties > variáveis de ambiente > .env.
 * - Métodos tipados com limites para números (nível, dias, quantidade, GB).
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Diretório de origem padrão quando nenhum é informado. */
    public static final String BACKUP_SOURCE = "BACKUP_SOURCE";
    /** Diretório onde ficam os arquivos de backup. */
    public static final String BACKUP_DESTINATION = "BACKUP_DESTINATION";
    /** Caminho do índice; padrão: destino/indice_backups.json. */
    public static final String BACKUP_INDEX_FILE = "BACKUP_INDEX_FILE";
    /** "tar" (padrão) ou "zip". */
    public static final String BACKUP_FORMAT = "BACKUP_FORMAT";
    /** Nível 0..9. Padrão 6. */
    public static final String BACKUP_COMPRESSION_LEVEL = "BACKUP_COMPRESSION_LEVEL";
    /** "md5" (padrão) ou "sha256". */
    public static final String BACKUP_HASH_ALGORITHM = "BACKUP_HASH_ALGORITHM";
    /** Padrões glob separados por vírgula; substituem a lista embutida. */
    public static final String BACKUP_EXCLUDE_DEFAULT = "BACKUP_EXCLUDE_DEFAULT";
    /** Padrões glob extras separados por vírgula. */
    public static final String BACKUP_EXCLUDE_CUSTOM = "BACKUP_EXCLUDE_CUSTOM";

    public static final String RETENTION_MAX_PER_DIRECTORY = "RETENTION_MAX_PER_DIRECTORY";
    public static final String RETENTION_DAYS_TO_KEEP = "RETENTION_DAYS_TO_KEEP";
    public static final String RETENTION_MAX_TOTAL_SIZE_GB = "RETENTION_MAX_TOTAL_SIZE_GB";

    /** Lista embutida de exclusões (temporários, dependências, builds, lixo de SO). */
    public static final List<String> DEFAULT_EXCLUSIONS = List.of(
            // Temporários
            "*.tmp", "*.temp", "*.log", "*.cache",
            // Node.js
            "node_modules", "npm-debug.log", ".npm",
            // Python
            "__pycache__", "*.pyc", ".pytest_cache", "venv", ".venv",
            // Git
            ".git",
            // IDEs
            ".vscode", ".idea", "*.swp", "*.swo",
            // Builds
            "build", "dist", "target",
            // SO
            ".DS_Store", "Thumbs.db", ".Trash",
            // Imagens de disco
            "*.iso", "*.dmg", "*.img"
    );

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: flags de linha de comando, testes). */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados. */
    private final ConcurrentHashMap<String, String> values;

    // ======= CONSTRUÇÃO / CARGA =======

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes:
     * 1) System properties (java -DCHAVE=valor)
     * 2) Variáveis de ambiente
     * 3) Arquivo .env no diretório atual (se existir), apenas para chaves ausentes
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>(System.getenv());

        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= GETTERS ESPECÍFICOS =======

    public Path sourceDirectory() {
        return find(BACKUP_SOURCE)
                .map(AppConfig::expandHome)
                .orElseGet(() -> Path.of(System.getProperty("user.home")));
    }

    /**
     * Padrão: ~/.bin/data/backups/archives
     */
    public Path backupDestination() {
        return expandHome(getOrDefault(BACKUP_DESTINATION, "~/.bin/data/backups/archives"))
                .toAbsolutePath().normalize();
    }

    public Path indexFile() {
        return find(BACKUP_INDEX_FILE)
                .map(AppConfig::expandHome)
                .orElseGet(() -> backupDestination().resolve(Catalog.DEFAULT_FILE_NAME));
    }

    /**
     * Formato padrão; valor desconhecido falha cedo.
     */
    public ArchiveFormat defaultFormat() {
        String raw = getOrDefault(BACKUP_FORMAT, "tar");
        try {
            return ArchiveFormat.fromToken(raw);
        } catch (UnsupportedFormatException e) {
            throw new IllegalStateException("BACKUP_FORMAT inválido: use 'tar' ou 'zip'", e);
        }
    }

    public int compressionLevel() {
        return intConfig(BACKUP_COMPRESSION_LEVEL, 6, 0, 9);
    }

    public HashAlgorithm hashAlgorithm() {
        String raw = getOrDefault(BACKUP_HASH_ALGORITHM, "md5");
        try {
            return HashAlgorithm.fromName(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("BACKUP_HASH_ALGORITHM inválido: use 'md5' ou 'sha256'", e);
        }
    }

    public List<String> defaultExclusions() {
        return find(BACKUP_EXCLUDE_DEFAULT).map(AppConfig::splitList).orElse(DEFAULT_EXCLUSIONS);
    }

    public List<String> customExclusions() {
        return find(BACKUP_EXCLUDE_CUSTOM).map(AppConfig::splitList).orElse(List.of());
    }

    /**
     * Padrões + customizados, nessa ordem.
     */
    public List<String> allExclusions() {
        List<String> all = new ArrayList<>(defaultExclusions());
        all.addAll(customExclusions());
        return all;
    }

    public int maxBackupsPerDirectory() {
        return intConfig(RETENTION_MAX_PER_DIRECTORY, 5, 1, 10_000);
    }

    public int daysToKeep() {
        return intConfig(RETENTION_DAYS_TO_KEEP, 30, 0, 36_500);
    }

    public int maxTotalSizeGb() {
        return intConfig(RETENTION_MAX_TOTAL_SIZE_GB, 50, 1, 1_000_000);
    }

    // ======= HELPERS =======

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) {
                out.add(p);
            }
        }
        return out;
    }

    static Path expandHome(String raw) {
        String v = raw.trim();
        if (v.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (v.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), v.substring(2));
        }
        return Path.of(v);
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "destination=" + backupDestination() +
                ", index=" + indexFile() +
                ", format=" + getOrDefault(BACKUP_FORMAT, "tar").toLowerCase(Locale.ROOT) +
                ", level=" + compressionLevel() +
                ", hash=" + getOrDefault(BACKUP_HASH_ALGORITHM, "md5").toLowerCase(Locale.ROOT) +
                ", exclusions=" + allExclusions().size() +
                ", maxPerDir=" + maxBackupsPerDirectory() +
                ", days=" + daysToKeep() +
                ", maxGb=" + maxTotalSizeGb() +
                "}";
    }
}
