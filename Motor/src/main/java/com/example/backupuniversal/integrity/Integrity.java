package com.example.backupuniversal.integrity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verificação de integridade de arquivos de backup via hash de conteúdo.
 */
public final class Integrity {

    private Integrity() {}

    /**
     * Algoritmos suportados. O nome JCA é o usado em {@link MessageDigest#getInstance(String)}.
     */
    public enum HashAlgorithm {
        MD5("MD5", "md5", 32),
        SHA256("SHA-256", "sha256", 64);

        private final String jcaName;
        private final String token;
        private final int hexLength;

        HashAlgorithm(String jcaName, String token, int hexLength) {
            this.jcaName = jcaName;
            this.token = token;
            this.hexLength = hexLength;
        }

        public String jcaName() {
            return jcaName;
        }

        public String token() {
            return token;
        }

        public int hexLength() {
            return hexLength;
        }

        /**
         * Aceita "md5", "sha256" ou "sha-256" (case-insensitive).
         *
         * @throws IllegalArgumentException para qualquer outro nome
         */
        public static HashAlgorithm fromName(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Algoritmo de hash não informado");
            }
            String n = name.trim().toLowerCase(Locale.ROOT).replace("-", "");
            for (HashAlgorithm a : values()) {
                if (a.token.equals(n)) {
                    return a;
                }
            }
            throw new IllegalArgumentException("Algoritmo de hash não suportado: " + name);
        }

        /**
         * Deduz o algoritmo pelo tamanho do hex armazenado: 64 caracteres = SHA-256, resto = MD5.
         */
        public static HashAlgorithm forHexLength(String hex) {
            return hex != null && hex.trim().length() == SHA256.hexLength ? SHA256 : MD5;
        }

        MessageDigest newDigest() {
            try {
                return MessageDigest.getInstance(jcaName);
            } catch (NoSuchAlgorithmException e) {
                // MD5 e SHA-256 são obrigatórios em toda JVM
                throw new IllegalStateException("Algoritmo de hash indisponível no sistema: " + jcaName, e);
            }
        }
    }

    /**
     * Calcula e compara hashes em modo streaming (blocos de 4 KiB).
     *
     * Falhas de I/O nunca propagam: o resultado vira {@link Optional#empty()},
     * que também nunca é considerado igual a um hash esperado.
     */
    public static final class IntegrityChecker {

        private static final Logger log = LoggerFactory.getLogger(IntegrityChecker.class);
        private static final HexFormat HEX = HexFormat.of();
        static final int CHUNK_SIZE = 4096;

        public IntegrityChecker() {
        }

        public Optional<String> calculateHash(Path file, HashAlgorithm algorithm) {
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(algorithm, "algorithm");

            MessageDigest digest = algorithm.newDigest();
            byte[] buffer = new byte[CHUNK_SIZE];
            try (InputStream in = Files.newInputStream(file)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            } catch (IOException e) {
                log.warn("Falha ao calcular hash {} de {}: {}", algorithm.jcaName(), file, e.getMessage());
                return Optional.empty();
            }
            return Optional.of(HEX.formatHex(digest.digest()));
        }

        public Optional<String> calculateMd5(Path file) {
            return calculateHash(file, HashAlgorithm.MD5);
        }

        public Optional<String> calculateSha256(Path file) {
            return calculateHash(file, HashAlgorithm.SHA256);
        }

        /**
         * Recalcula o hash e compara com {@code expectedHex} ignorando maiúsculas/minúsculas.
         */
        public boolean verify(Path file, String expectedHex, HashAlgorithm algorithm) {
            if (expectedHex == null || expectedHex.isBlank()) {
                return false;
            }
            Optional<String> actual = calculateHash(file, algorithm);
            if (actual.isEmpty()) {
                return false;
            }
            boolean ok = actual.get().equalsIgnoreCase(expectedHex.trim());
            if (!ok) {
                log.warn("Hash divergente para {}: esperado={}, atual={}", file, expectedHex, actual.get());
            }
            return ok;
        }

        /**
         * @throws IllegalArgumentException se {@code algorithmName} não for suportado
         */
        public boolean verify(Path file, String expectedHex, String algorithmName) {
            return verify(file, expectedHex, HashAlgorithm.fromName(algorithmName));
        }
    }
}
