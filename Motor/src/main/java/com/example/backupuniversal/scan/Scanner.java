package com.example.backupuniversal.scan;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Módulo de varredura usado antes e durante a criação de um backup.
 *
 * Responsabilidades principais:
 * - Decidir se um arquivo/diretório deve ser ignorado ({@link ExclusionFilter});
 * - Estimar tamanho e quantidade de arquivos de uma árvore ({@link ScanService});
 * - Classificar o diretório de origem pelo tipo de projeto ({@link DirectoryType}).
 */
public final class Scanner {

    private Scanner() {}

    /**
     * Resultado da primeira passada sobre a árvore de origem.
     * Usado para dimensionar o relatório de progresso e para o registro no catálogo.
     */
    public static final class SizeEstimate {
        private final long totalBytes;
        private final long fileCount;

        public SizeEstimate(long totalBytes, long fileCount) {
            if (totalBytes < 0 || fileCount < 0) {
                throw new IllegalArgumentException("Estimativa não pode ser negativa");
            }
            this.totalBytes = totalBytes;
            this.fileCount = fileCount;
        }

        public static SizeEstimate empty() {
            return new SizeEstimate(0, 0);
        }

        public long totalBytes() {
            return totalBytes;
        }

        public long fileCount() {
            return fileCount;
        }

        @Override
        public String toString() {
            return "SizeEstimate{totalBytes=" + totalBytes + ", fileCount=" + fileCount + '}';
        }
    }

    /**
     * Filtro de exclusão baseado em padrões glob.
     *
     * Os padrões são testados apenas contra o último componente do caminho
     * (nome do arquivo ou diretório), nunca contra o caminho completo.
     * Resultados positivos ficam em cache pela string de entrada; qualquer
     * alteração na lista de padrões invalida o cache inteiro.
     *
     * Não é thread-safe: pensado para "um filtro por job".
     */
    public static final class ExclusionFilter {

        private static final Logger log = LoggerFactory.getLogger(ExclusionFilter.class);

        private final List<String> patterns = new ArrayList<>();
        private final List<PathMatcher> matchers = new ArrayList<>();
        private final Set<String> excludedCache = new HashSet<>();

        public ExclusionFilter() {
        }

        public ExclusionFilter(Collection<String> initialPatterns) {
            addPatterns(initialPatterns);
        }

        /**
         * Filtro "nenhum" (não exclui nada).
         */
        public static ExclusionFilter none() {
            return new ExclusionFilter();
        }

        /**
         * Retorna true se a entrada (caminho ou nome) deve ser excluída.
         */
        public boolean shouldExclude(String input) {
            if (input == null) {
                return false;
            }
            if (excludedCache.contains(input)) {
                return true;
            }

            Path name = baseName(input);
            if (name == null) {
                return false;
            }

            for (PathMatcher matcher : matchers) {
                if (matcher.matches(name)) {
                    excludedCache.add(input);
                    return true;
                }
            }
            return false;
        }

        public boolean shouldExclude(Path path) {
            return path != null && shouldExclude(path.toString());
        }

        /**
         * Adiciona um padrão glob. Padrões vazios ou repetidos são ignorados.
         *
         * @throws IllegalArgumentException se o glob for inválido (ex.: "[abc")
         */
        public ExclusionFilter addPattern(String pattern) {
            if (pattern == null || pattern.isBlank()) {
                return this;
            }
            String trimmed = pattern.trim();
            if (patterns.contains(trimmed)) {
                return this;
            }
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + trimmed);
            patterns.add(trimmed);
            matchers.add(matcher);
            excludedCache.clear();
            return this;
        }

        public ExclusionFilter addPatterns(Collection<String> newPatterns) {
            if (newPatterns != null) {
                for (String p : newPatterns) {
                    addPattern(p);
                }
            }
            return this;
        }

        /**
         * Remove um padrão. Retorna false se ele não existia.
         */
        public boolean removePattern(String pattern) {
            if (pattern == null) {
                return false;
            }
            int idx = patterns.indexOf(pattern.trim());
            if (idx < 0) {
                return false;
            }
            patterns.remove(idx);
            matchers.remove(idx);
            excludedCache.clear();
            return true;
        }

        /**
         * Retorna nova lista sem os caminhos excluídos, preservando a ordem.
         */
        public List<Path> filterPaths(List<Path> paths) {
            Objects.requireNonNull(paths, "paths");
            List<Path> kept = new ArrayList<>(paths.size());
            for (Path p : paths) {
                if (!shouldExclude(p)) {
                    kept.add(p);
                }
            }
            return kept;
        }

        public void clearCache() {
            excludedCache.clear();
        }

        public List<String> patterns() {
            return List.copyOf(patterns);
        }

        public int size() {
            return patterns.size();
        }

        int cachedEntries() {
            return excludedCache.size();
        }

        /**
         * Cópia independente (mesmos padrões, cache vazio).
         */
        public ExclusionFilter copy() {
            return new ExclusionFilter(patterns);
        }

        @Override
        public String toString() {
            return "ExclusionFilter{" + patterns.size() + " padrões}";
        }

        private static Path baseName(String input) {
            try {
                Path fileName = Path.of(input).getFileName();
                return fileName != null ? fileName : Path.of("");
            } catch (InvalidPathException e) {
                log.debug("Entrada não representa um caminho válido, ignorando filtro: {}", input);
                return null;
            }
        }
    }

    /**
     * Tipo de projeto detectado pelo arquivo-marcador no topo do diretório de origem.
     */
    public enum DirectoryType {
        NODEJS("nodejs"),
        PYTHON("python"),
        JAVA("java"),
        GIT("git"),
        GENERICO("generico");

        private final String value;

        DirectoryType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static DirectoryType fromValue(String raw) {
            if (raw == null) {
                return GENERICO;
            }
            String v = raw.trim().toLowerCase(Locale.ROOT);
            for (DirectoryType t : values()) {
                if (t.value.equals(v)) {
                    return t;
                }
            }
            return GENERICO;
        }

        /**
         * Ordem de precedência: package.json, requirements.txt/setup.py, pom.xml, .git.
         */
        public static DirectoryType detect(Path directory) {
            Objects.requireNonNull(directory, "directory");
            if (Files.exists(directory.resolve("package.json"))) {
                return NODEJS;
            }
            if (Files.exists(directory.resolve("requirements.txt"))
                    || Files.exists(directory.resolve("setup.py"))) {
                return PYTHON;
            }
            if (Files.exists(directory.resolve("pom.xml"))) {
                return JAVA;
            }
            if (Files.exists(directory.resolve(".git"))) {
                return GIT;
            }
            return GENERICO;
        }
    }

    /**
     * Serviço de varredura usado para estimar o tamanho de um backup.
     *
     * Aplica as mesmas regras de exclusão do compressor (diretórios excluídos não
     * são visitados, arquivos excluídos não contam). Erros pontuais de acesso são
     * logados e a varredura continua. Não segue links simbólicos.
     */
    public static final class ScanService {

        private static final Logger log = LoggerFactory.getLogger(ScanService.class);

        public ScanService() {
        }

        /**
         * Soma tamanho e quantidade dos arquivos regulares não excluídos sob {@code root}.
         *
         * @throws IOException se {@code root} não for um diretório ou a varredura falhar de forma fatal
         */
        public SizeEstimate estimate(Path root, ExclusionFilter filter) throws IOException {
            Objects.requireNonNull(root, "root");
            final ExclusionFilter effectiveFilter = (filter != null) ? filter : ExclusionFilter.none();
            final Path canonical = root.toAbsolutePath().normalize();

            if (!Files.isDirectory(canonical)) {
                throw new IOException("Caminho não é um diretório válido: " + canonical);
            }

            final long[] totalBytes = new long[1];
            final long[] fileCount = new long[1];

            Files.walkFileTree(canonical, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    // O root nunca é filtrado.
                    if (!dir.equals(canonical)
                            && effectiveFilter.shouldExclude(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (effectiveFilter.shouldExclude(file.getFileName().toString())) {
                        return FileVisitResult.CONTINUE;
                    }
                    totalBytes[0] += attrs.size();
                    fileCount[0]++;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Ignorando caminho inacessível na estimativa: {} ({})", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });

            return new SizeEstimate(totalBytes[0], fileCount[0]);
        }
    }
}
