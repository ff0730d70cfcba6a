package com.example.dedupe.digest;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

import net.openhft.hashing.LongHashFunction;

/**
 * Agrega os tipos de cálculo de digest de conteúdo usados pelo pipeline de deduplicação.
 *
 * Inclui:
 * - {@link Digest}: valor imutável do digest, com codificação canônica em hex;
 * - {@link DigestFunction}: contrato plugável "caminho -> digest";
 * - {@link DigestAlgorithm}: algoritmos suportados (XXH3, SHA-256, MD5), escolhidos uma vez na inicialização.
 */
public final class DigestModule {

    private DigestModule() {}

    /** Tamanho do bloco de leitura (64KB), o mesmo usado no scanner de backup. */
    static final int BUFFER_SIZE = 64 * 1024;

    private static final HexFormat HEX = HexFormat.of();

    /**
     * Digest do conteúdo completo de um arquivo.
     * Igualdade é por conteúdo dos bytes; {@link #hex()} é a chave usada nas tabelas de duplicados.
     */
    public static final class Digest {
        private final byte[] bytes;
        private final String hex;

        private Digest(byte[] bytes) {
            this.bytes = bytes;
            this.hex = HEX.formatHex(bytes);
        }

        public static Digest of(byte[] bytes) {
            Objects.requireNonNull(bytes, "bytes");
            return new Digest(bytes.clone());
        }

        public static Digest ofLong(long value) {
            byte[] b = new byte[Long.BYTES];
            for (int i = Long.BYTES - 1; i >= 0; i--) {
                b[i] = (byte) value;
                value >>>= 8;
            }
            return new Digest(b);
        }

        public static Digest fromHex(String hex) {
            Objects.requireNonNull(hex, "hex");
            return new Digest(HEX.parseHex(hex.toLowerCase(Locale.ROOT)));
        }

        public byte[] bytes() { return bytes.clone(); }
        public int length() { return bytes.length; }
        public String hex() { return hex; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Digest)) return false;
            return Arrays.equals(bytes, ((Digest) o).bytes);
        }

        @Override
        public int hashCode() { return Arrays.hashCode(bytes); }

        @Override
        public String toString() { return hex; }
    }

    /**
     * Calcula o digest do conteúdo de um arquivo.
     *
     * Implementações precisam ser seguras para chamadas concorrentes em caminhos distintos
     * e não podem vazar estado de hash de um arquivo para outro.
     * Erros são sempre por arquivo e nunca abortam o pipeline.
     */
    @FunctionalInterface
    public interface DigestFunction {
        Digest hash(Path path) throws IOException;
    }

    /** Algoritmos disponíveis. A escolha acontece uma vez, fora do laço de hash. */
    public enum DigestAlgorithm {
        XXH3("xxh3") {
            @Override
            public DigestFunction newFunction() {
                return new Xxh3DigestFunction();
            }
        },
        SHA256("sha256") {
            @Override
            public DigestFunction newFunction() {
                return new MessageDigestFunction("SHA-256");
            }
        },
        MD5("md5") {
            @Override
            public DigestFunction newFunction() {
                return new MessageDigestFunction("MD5");
            }
        };

        private final String id;

        DigestAlgorithm(String id) { this.id = id; }

        public String id() { return id; }

        public abstract DigestFunction newFunction();

        /**
         * Resolve o algoritmo pelo nome (case-insensitive; aceita "sha-256" e "md-5").
         *
         * @throws IllegalArgumentException se o nome for desconhecido
         */
        public static DigestAlgorithm fromName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Algoritmo de hash não informado");
            }
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace("-", "");
            for (DigestAlgorithm algorithm : values()) {
                if (algorithm.id.equals(normalized)) {
                    return algorithm;
                }
            }
            throw new IllegalArgumentException(
                    "Algoritmo de hash inválido '" + name + "': use 'xxh3', 'sha256' ou 'md5'");
        }
    }

    /**
     * DigestFunction baseada em {@link MessageDigest} (SHA-256, MD5...).
     *
     * MessageDigest não é thread-safe: cada thread de worker reaproveita a sua instância,
     * com reset antes de cada arquivo.
     */
    public static final class MessageDigestFunction implements DigestFunction {

        private final String algorithm;
        private final ThreadLocal<MessageDigest> digests;

        public MessageDigestFunction(String algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
            // Falha cedo se o algoritmo não existir na JVM
            newDigest(algorithm);
            this.digests = ThreadLocal.withInitial(() -> newDigest(algorithm));
        }

        public String algorithm() { return algorithm; }

        @Override
        public Digest hash(Path path) throws IOException {
            MessageDigest digest = digests.get();
            digest.reset();
            byte[] buffer = new byte[BUFFER_SIZE];
            try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            } catch (IOException e) {
                digest.reset();
                throw new IOException("Falha ao calcular hash de " + path + ": " + e.getMessage(), e);
            }
            return new Digest(digest.digest());
        }

        private static MessageDigest newDigest(String algorithm) {
            try {
                return MessageDigest.getInstance(algorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalArgumentException("Algoritmo de hash indisponível no sistema: " + algorithm, e);
            }
        }
    }

    /**
     * DigestFunction rápida e não criptográfica (XXH3 de 64 bits, zero-allocation-hashing).
     *
     * O arquivo é lido em blocos; o hash de cada bloco usa o hash acumulado como seed.
     * Sem estado entre arquivos, então uma única instância serve a todos os workers.
     */
    public static final class Xxh3DigestFunction implements DigestFunction {

        @Override
        public Digest hash(Path path) throws IOException {
            byte[] buffer = new byte[BUFFER_SIZE];
            long hash = 0L;
            try (InputStream in = Files.newInputStream(path)) {
                int read;
                while ((read = in.readNBytes(buffer, 0, buffer.length)) > 0) {
                    hash = LongHashFunction.xx3(hash).hashBytes(buffer, 0, read);
                }
            } catch (IOException e) {
                throw new IOException("Falha ao calcular hash de " + path + ": " + e.getMessage(), e);
            }
            return Digest.ofLong(hash);
        }
    }
}
