package com.example.backupuniversal.storage;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupuniversal.packager.PackagerModule.ArchiveFormat;

/**
 * Acesso ao diretório local onde ficam os arquivos de backup.
 */
public final class Storage {

    private Storage() {}

    /** Metadados mínimos de um arquivo de backup em disco. */
    public static final class ArchiveStat {
        private final long size;
        private final Instant modifiedAt;

        public ArchiveStat(long size, Instant modifiedAt) {
            this.size = size;
            this.modifiedAt = Objects.requireNonNull(modifiedAt, "modifiedAt");
        }

        public long size() { return size; }
        public Instant modifiedAt() { return modifiedAt; }
    }

    /**
     * Diretório de arquivos de backup. As chaves são nomes simples de arquivo
     * (sem separadores), exatamente como gravados no catálogo.
     */
    public static final class ArchiveDirectory {

        private static final Logger log = LoggerFactory.getLogger(ArchiveDirectory.class);

        private final Path root;

        public ArchiveDirectory(Path root) {
            this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        }

        public Path root() {
            return root;
        }

        public Path ensureExists() throws IOException {
            Files.createDirectories(root);
            return root;
        }

        /**
         * @throws IllegalArgumentException se o nome tiver separador ou apontar para fora do diretório
         */
        public Path resolve(String fileName) {
            Objects.requireNonNull(fileName, "fileName");
            if (fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")
                    || fileName.equals(".") || fileName.equals("..")) {
                throw new IllegalArgumentException("Nome de arquivo de backup inválido: " + fileName);
            }
            return root.resolve(fileName);
        }

        public boolean exists(String fileName) {
            return Files.isRegularFile(resolve(fileName));
        }

        public Optional<ArchiveStat> stat(String fileName) throws IOException {
            Path path = resolve(fileName);
            if (!Files.exists(path)) {
                return Optional.empty();
            }
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return Optional.of(new ArchiveStat(attrs.size(), attrs.lastModifiedTime().toInstant()));
        }

        /**
         * Remove o arquivo e devolve os bytes liberados (0 se já não existia).
         *
         * @throws IOException se o arquivo existe mas não pôde ser removido
         */
        public long delete(String fileName) throws IOException {
            Path path = resolve(fileName);
            long size;
            try {
                size = Files.size(path);
            } catch (NoSuchFileException e) {
                return 0L;
            }
            Files.delete(path);
            log.debug("Arquivo de backup removido: {} ({} bytes)", path, size);
            return size;
        }

        /**
         * Arquivos regulares com sufixo conhecido (.tar.gz / .zip), ordenados por nome.
         * Nomes iniciados por ponto também entram.
         * Diretório inexistente resulta em lista vazia.
         */
        public List<Path> listArchives() throws IOException {
            if (!Files.isDirectory(root)) {
                return List.of();
            }
            List<Path> archives = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
                for (Path p : stream) {
                    String name = p.getFileName().toString();
                    if (!Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)) {
                        continue;
                    }
                    if (ArchiveFormat.fromFileName(name).isPresent()) {
                        archives.add(p);
                    }
                }
            }
            archives.sort(Comparator.comparing(p -> p.getFileName().toString()));
            return archives;
        }
    }
}
