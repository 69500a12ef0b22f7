package com.example.backupuniversal.packager;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupuniversal.scan.Scanner.ExclusionFilter;

/**
 * Módulo de empacotamento: transforma uma árvore de diretórios em um arquivo
 * compactado (tar.gz ou zip) e faz o caminho inverso.
 *
 * Responsabilidades:
 * - Caminhar a árvore aplicando o {@link ExclusionFilter} por nome;
 * - Gravar as entradas relativas ao pai do diretório de origem
 *   (o arquivo sempre contém a pasta de topo);
 * - Reportar progresso por arquivo adicionado;
 * - Extrair com proteção contra path traversal.
 */
public final class PackagerModule {

    private PackagerModule() {}

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 9;

    // ==================== Tipos ====================

    /**
     * Formatos suportados. O token é o valor persistido no catálogo ("tar" / "zip").
     */
    public enum ArchiveFormat {
        TAR("tar", ".tar.gz"),
        ZIP("zip", ".zip");

        private final String token;
        private final String extension;

        ArchiveFormat(String token, String extension) {
            this.token = token;
            this.extension = extension;
        }

        public String token() {
            return token;
        }

        public String extension() {
            return extension;
        }

        /**
         * @throws UnsupportedFormatException se o token não for "tar" nem "zip"
         */
        public static ArchiveFormat fromToken(String token) {
            if (token != null) {
                String t = token.trim().toLowerCase(Locale.ROOT);
                for (ArchiveFormat f : values()) {
                    if (f.token.equals(t)) {
                        return f;
                    }
                }
            }
            throw new UnsupportedFormatException(token);
        }

        /**
         * Identifica o formato pelo sufixo do nome do arquivo.
         */
        public static Optional<ArchiveFormat> fromFileName(String fileName) {
            if (fileName == null) {
                return Optional.empty();
            }
            for (ArchiveFormat f : values()) {
                if (fileName.endsWith(f.extension)) {
                    return Optional.of(f);
                }
            }
            return Optional.empty();
        }
    }

    public static final class UnsupportedFormatException extends IllegalArgumentException {
        private static final long serialVersionUID = 1L;
        private final String format;

        public UnsupportedFormatException(String format) {
            super("Formato não suportado: " + format + " (use 'tar' ou 'zip')");
            this.format = format;
        }

        public String format() {
            return format;
        }
    }

    /**
     * Falha fatal ao gravar o arquivo compactado (criação, escrita de entrada ou finalização).
     * O arquivo parcial deve ser descartado por quem chamou.
     */
    public static final class ArchiveWriteException extends IOException {
        private static final long serialVersionUID = 1L;

        public ArchiveWriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Callback chamado a cada arquivo adicionado, com o total acumulado.
     */
    @FunctionalInterface
    public interface ProgressCallback {
        ProgressCallback NONE = filesAdded -> { };

        void onFileAdded(long filesAdded);
    }

    /**
     * Contadores de uma compressão concluída.
     */
    public static final class CompressionResult {
        private final long filesAdded;
        private final long filesExcluded;
        private final long dirsExcluded;

        public CompressionResult(long filesAdded, long filesExcluded, long dirsExcluded) {
            this.filesAdded = filesAdded;
            this.filesExcluded = filesExcluded;
            this.dirsExcluded = dirsExcluded;
        }

        public long filesAdded() { return filesAdded; }
        public long filesExcluded() { return filesExcluded; }
        public long dirsExcluded() { return dirsExcluded; }

        @Override
        public String toString() {
            return "CompressionResult{filesAdded=" + filesAdded
                    + ", filesExcluded=" + filesExcluded
                    + ", dirsExcluded=" + dirsExcluded + '}';
        }
    }

    /**
     * Contrato comum às variantes tar e zip.
     */
    public interface Compressor {

        ArchiveFormat format();

        default String extension() {
            return format().extension();
        }

        /**
         * Compacta {@code sourceDir} em {@code outputPath}.
         *
         * @param level nível de compressão 0..9
         * @throws ArchiveWriteException em falha fatal de escrita
         * @throws IllegalArgumentException se o nível estiver fora de 0..9
         */
        CompressionResult compress(Path sourceDir,
                                   Path outputPath,
                                   ExclusionFilter filter,
                                   ProgressCallback progress,
                                   int level) throws IOException;

        /**
         * Extrai o arquivo completo sob {@code destinationParent}.
         *
         * @throws IOException em falha de leitura ou entrada que escapa do destino
         */
        void decompress(Path archivePath, Path destinationParent) throws IOException;
    }

    // ==================== Caminhada compartilhada ====================

    /**
     * Abre o conteúdo de um arquivo da origem.
     */
    @FunctionalInterface
    interface SourceOpener {
        SourceOpener DEFAULT = Files::newInputStream;

        InputStream open(Path file) throws IOException;
    }

    /**
     * Falha de leitura da origem no meio de uma entrada. O stream de saída continua íntegro.
     */
    static final class EntryReadException extends IOException {
        private static final long serialVersionUID = 1L;

        private final long bytesWritten;

        EntryReadException(String message, long bytesWritten, Throwable cause) {
            super(message, cause);
            this.bytesWritten = bytesWritten;
        }

        long bytesWritten() {
            return bytesWritten;
        }
    }

    /**
     * Recebe cada arquivo aceito já com o stream aberto. Falhas de leitura da origem
     * devem fechar a entrada e sair como {@link EntryReadException}.
     */
    @FunctionalInterface
    interface EntrySink {
        void add(Path file, String entryName, BasicFileAttributes attrs, InputStream in) throws IOException;
    }

    /**
     * Caminha a árvore de origem e entrega ao sink os arquivos não excluídos.
     *
     * Falhas de abertura ou leitura de um arquivo contam como exclusão.
     * Só falhas de escrita no arquivo compactado são fatais.
     */
    static final class TreeArchiver {

        private static final Logger log = LoggerFactory.getLogger(TreeArchiver.class);

        private TreeArchiver() {}

        static CompressionResult walk(Path sourceDir,
                                      ExclusionFilter filter,
                                      ProgressCallback progress,
                                      SourceOpener opener,
                                      EntrySink sink) throws IOException {
            final Path source = sourceDir.toAbsolutePath().normalize();
            final Path base = source.getParent() != null ? source.getParent() : source;
            final ExclusionFilter effectiveFilter = filter != null ? filter : ExclusionFilter.none();
            final ProgressCallback callback = progress != null ? progress : ProgressCallback.NONE;

            final long[] added = new long[1];
            final long[] filesExcluded = new long[1];
            final long[] dirsExcluded = new long[1];

            Files.walkFileTree(source, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(source) && effectiveFilter.shouldExclude(dir.getFileName().toString())) {
                        dirsExcluded[0]++;
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (effectiveFilter.shouldExclude(file.getFileName().toString())) {
                        filesExcluded[0]++;
                        return FileVisitResult.CONTINUE;
                    }

                    InputStream in;
                    try {
                        in = opener.open(file);
                    } catch (IOException e) {
                        log.warn("Arquivo ignorado (sem acesso): {} ({})", file, e.getMessage());
                        filesExcluded[0]++;
                        return FileVisitResult.CONTINUE;
                    }

                    String entryName = base.relativize(file).toString().replace(File.separatorChar, '/');
                    try (in) {
                        sink.add(file, entryName, attrs, in);
                    } catch (EntryReadException e) {
                        log.warn("Arquivo ignorado (falha de leitura após {} bytes): {} ({})",
                                e.bytesWritten(), file, e.getMessage());
                        filesExcluded[0]++;
                        return FileVisitResult.CONTINUE;
                    } catch (IOException e) {
                        throw new ArchiveWriteException("Falha ao gravar entrada " + entryName + ": " + e.getMessage(), e);
                    }

                    added[0]++;
                    callback.onFileAdded(added[0]);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Caminho ignorado (falha de acesso): {} ({})", file, exc.getMessage());
                    filesExcluded[0]++;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        log.warn("Erro ao listar diretório {}: {}", dir, exc.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });

            return new CompressionResult(added[0], filesExcluded[0], dirsExcluded[0]);
        }
    }

    // ==================== Tar (gzip) ====================

    public static final class TarCompressor implements Compressor {

        private static final Logger log = LoggerFactory.getLogger(TarCompressor.class);

        private final SourceOpener opener;

        public TarCompressor() {
            this(SourceOpener.DEFAULT);
        }

        TarCompressor(SourceOpener opener) {
            this.opener = Objects.requireNonNull(opener, "opener");
        }

        @Override
        public ArchiveFormat format() {
            return ArchiveFormat.TAR;
        }

        @Override
        public CompressionResult compress(Path sourceDir,
                                          Path outputPath,
                                          ExclusionFilter filter,
                                          ProgressCallback progress,
                                          int level) throws IOException {
            Objects.requireNonNull(sourceDir, "sourceDir");
            Objects.requireNonNull(outputPath, "outputPath");
            checkLevel(level);

            GzipParameters params = new GzipParameters();
            params.setCompressionLevel(level);

            CompressionResult result;
            try (OutputStream fileOut = new BufferedOutputStream(Files.newOutputStream(outputPath));
                 GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(fileOut, params);
                 TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip, "UTF-8")) {

                tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
                tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
                tar.setAddPaxHeadersForNonAsciiNames(true);

                result = TreeArchiver.walk(sourceDir, filter, progress, opener, (file, entryName, attrs, in) -> {
                    TarArchiveEntry entry = new TarArchiveEntry(file, entryName);
                    entry.setSize(attrs.size());
                    tar.putArchiveEntry(entry);
                    try {
                        copyExactly(in, tar, attrs.size());
                    } catch (EntryReadException e) {
                        // o cabeçalho já declarou o tamanho: completa com zeros, como o GNU tar
                        writeZeros(tar, attrs.size() - e.bytesWritten());
                        tar.closeArchiveEntry();
                        throw e;
                    }
                    tar.closeArchiveEntry();
                });
                tar.finish();
            } catch (ArchiveWriteException e) {
                throw e;
            } catch (IOException e) {
                throw new ArchiveWriteException("Falha ao gravar arquivo tar " + outputPath + ": " + e.getMessage(), e);
            }

            log.debug("Tar concluído: {} -> {} ({})", sourceDir, outputPath, result);
            return result;
        }

        @Override
        public void decompress(Path archivePath, Path destinationParent) throws IOException {
            Objects.requireNonNull(archivePath, "archivePath");
            Path root = prepareDestination(destinationParent);

            try (InputStream fileIn = new BufferedInputStream(Files.newInputStream(archivePath));
                 GzipCompressorInputStream gzip = new GzipCompressorInputStream(fileIn);
                 TarArchiveInputStream tar = new TarArchiveInputStream(gzip, "UTF-8")) {

                TarArchiveEntry entry;
                while ((entry = tar.getNextEntry()) != null) {
                    Path target = safeTarget(root, entry.getName());
                    if (entry.isDirectory()) {
                        Files.createDirectories(target);
                        continue;
                    }
                    if (!entry.isFile()) {
                        log.warn("Entrada não regular ignorada na extração: {}", entry.getName());
                        continue;
                    }
                    Files.createDirectories(target.getParent());
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                    Files.setLastModifiedTime(target, FileTime.fromMillis(entry.getModTime().getTime()));
                }
            }
        }
    }

    // ==================== Zip ====================

    public static final class ZipCompressor implements Compressor {

        private static final Logger log = LoggerFactory.getLogger(ZipCompressor.class);

        private final SourceOpener opener;

        public ZipCompressor() {
            this(SourceOpener.DEFAULT);
        }

        ZipCompressor(SourceOpener opener) {
            this.opener = Objects.requireNonNull(opener, "opener");
        }

        @Override
        public ArchiveFormat format() {
            return ArchiveFormat.ZIP;
        }

        @Override
        public CompressionResult compress(Path sourceDir,
                                          Path outputPath,
                                          ExclusionFilter filter,
                                          ProgressCallback progress,
                                          int level) throws IOException {
            Objects.requireNonNull(sourceDir, "sourceDir");
            Objects.requireNonNull(outputPath, "outputPath");
            checkLevel(level);

            CompressionResult result;
            try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(outputPath)) {
                zip.setMethod(ZipArchiveOutputStream.DEFLATED);
                zip.setLevel(level);
                zip.setEncoding("UTF-8");

                result = TreeArchiver.walk(sourceDir, filter, progress, opener, (file, entryName, attrs, in) -> {
                    ZipArchiveEntry entry = new ZipArchiveEntry(file, entryName);
                    zip.putArchiveEntry(entry);
                    try {
                        copyAll(in, zip);
                    } catch (EntryReadException e) {
                        zip.closeArchiveEntry();
                        throw e;
                    }
                    zip.closeArchiveEntry();
                });
                zip.finish();
            } catch (ArchiveWriteException e) {
                throw e;
            } catch (IOException e) {
                throw new ArchiveWriteException("Falha ao gravar arquivo zip " + outputPath + ": " + e.getMessage(), e);
            }

            log.debug("Zip concluído: {} -> {} ({})", sourceDir, outputPath, result);
            return result;
        }

        @Override
        public void decompress(Path archivePath, Path destinationParent) throws IOException {
            Objects.requireNonNull(archivePath, "archivePath");
            Path root = prepareDestination(destinationParent);

            try (InputStream fileIn = new BufferedInputStream(Files.newInputStream(archivePath));
                 ZipArchiveInputStream zip = new ZipArchiveInputStream(fileIn, "UTF-8")) {

                ZipArchiveEntry entry;
                while ((entry = zip.getNextEntry()) != null) {
                    Path target = safeTarget(root, entry.getName());
                    if (entry.isDirectory()) {
                        Files.createDirectories(target);
                        continue;
                    }
                    if (!zip.canReadEntryData(entry)) {
                        throw new IOException("Entrada zip com método não suportado: " + entry.getName());
                    }
                    Files.createDirectories(target.getParent());
                    Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    // ==================== Fábrica ====================

    public static final class Compressors {

        private Compressors() {}

        public static Compressor forFormat(ArchiveFormat format) {
            Objects.requireNonNull(format, "format");
            return switch (format) {
                case TAR -> new TarCompressor();
                case ZIP -> new ZipCompressor();
            };
        }

        /**
         * @throws UnsupportedFormatException para token desconhecido
         */
        public static Compressor forToken(String token) {
            return forFormat(ArchiveFormat.fromToken(token));
        }

        /**
         * Seleciona pelo sufixo do arquivo (.tar.gz / .zip).
         */
        public static Optional<Compressor> forFileName(String fileName) {
            return ArchiveFormat.fromFileName(fileName).map(Compressors::forFormat);
        }
    }

    // ==================== Auxiliares ====================

    static void checkLevel(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Nível de compressão deve estar entre 0 e 9: " + level);
        }
    }

    private static Path prepareDestination(Path destinationParent) throws IOException {
        Objects.requireNonNull(destinationParent, "destinationParent");
        Path root = destinationParent.toAbsolutePath().normalize();
        Files.createDirectories(root);
        return root;
    }

    /**
     * Resolve a entrada dentro do destino, rejeitando nomes que escapam dele.
     */
    static Path safeTarget(Path root, String entryName) throws IOException {
        Path target = root.resolve(entryName).normalize();
        if (!target.startsWith(root)) {
            throw new IOException("Path traversal detectado: " + entryName);
        }
        return target;
    }

    /**
     * Copia exatamente {@code length} bytes; o tamanho já foi declarado no cabeçalho tar.
     */
    private static final int COPY_BUFFER = 64 * 1024;

    private static void copyExactly(InputStream in, OutputStream out, long length) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER];
        long written = 0;
        while (written < length) {
            int read = readSource(in, buffer, (int) Math.min(buffer.length, length - written), written);
            if (read == -1) {
                throw new EntryReadException("Arquivo encolheu durante a leitura: faltam "
                        + (length - written) + " bytes", written, new EOFException());
            }
            out.write(buffer, 0, read);
            written += read;
        }
    }

    private static void copyAll(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER];
        long written = 0;
        int read;
        while ((read = readSource(in, buffer, buffer.length, written)) != -1) {
            out.write(buffer, 0, read);
            written += read;
        }
    }

    private static int readSource(InputStream in, byte[] buffer, int length, long written)
            throws EntryReadException {
        try {
            return in.read(buffer, 0, length);
        } catch (IOException e) {
            throw new EntryReadException(e.getMessage(), written, e);
        }
    }

    private static void writeZeros(OutputStream out, long count) throws IOException {
        byte[] zeros = new byte[(int) Math.min(COPY_BUFFER, Math.max(count, 1))];
        long remaining = count;
        while (remaining > 0) {
            int chunk = (int) Math.min(zeros.length, remaining);
            out.write(zeros, 0, chunk);
            remaining -= chunk;
        }
    }
}
