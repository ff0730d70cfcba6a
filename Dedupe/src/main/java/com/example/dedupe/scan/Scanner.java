package com.example.dedupe.scan;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Módulo de varredura de diretórios usado pelo pipeline de deduplicação.
 *
 * Responsabilidades principais:
 * - Caminhar a árvore a partir de um root, em uma única thread e em ordem lexical por nível;
 * - Emitir eventos de arquivo regular e de diretório em modo streaming via {@link WalkSink};
 * - Ser resiliente a erros pontuais (permissão negada em subdiretório), pulando a subárvore;
 * - Nunca seguir links simbólicos.
 *
 * Não calcula hash: isso é trabalho dos workers do pipeline.
 */
public final class Scanner {

    private Scanner() {}

    /**
     * Destino dos eventos emitidos pelo {@link TreeWalker}.
     *
     * Os métodos de emissão podem bloquear (fila cheia); se a thread for interrompida
     * o walker encerra com {@link WalkOutcome.Status#CANCELLED}.
     */
    public interface WalkSink {

        /** Diretório encontrado (nunca o root). */
        void onDirectory(Path directory) throws InterruptedException;

        /** Arquivo regular encontrado. Links simbólicos e arquivos especiais não chegam aqui. */
        void onFile(Path file) throws InterruptedException;

        /**
         * Erro não-fatal (ex.: permissão negada). O walker continua no próximo item.
         */
        default void onError(Path path, IOException exc) throws InterruptedException { }
    }

    /** Lista os filhos diretos de um diretório (ordem livre; o walker ordena). */
    @FunctionalInterface
    public interface DirectoryLister {
        List<Path> list(Path directory) throws IOException;
    }

    /** Contadores do walk, úteis para log e relatório. */
    public static final class WalkStatistics {
        private final long filesVisited;
        private final long directoriesVisited;
        private final long entriesFailed;

        public WalkStatistics(long filesVisited, long directoriesVisited, long entriesFailed) {
            this.filesVisited = filesVisited;
            this.directoriesVisited = directoriesVisited;
            this.entriesFailed = entriesFailed;
        }

        public static WalkStatistics empty() {
            return new WalkStatistics(0, 0, 0);
        }

        public long filesVisited() { return filesVisited; }
        public long directoriesVisited() { return directoriesVisited; }
        public long entriesFailed() { return entriesFailed; }
    }

    /**
     * Resultado terminal do walk: sucesso, cancelamento ou o primeiro erro irrecuperável.
     */
    public static final class WalkOutcome {

        public enum Status { COMPLETED, CANCELLED, FAILED }

        private final Status status;
        private final IOException failure;
        private final WalkStatistics statistics;

        private WalkOutcome(Status status, IOException failure, WalkStatistics statistics) {
            this.status = Objects.requireNonNull(status, "status");
            this.failure = failure;
            this.statistics = Objects.requireNonNull(statistics, "statistics");
        }

        public static WalkOutcome completed(WalkStatistics statistics) {
            return new WalkOutcome(Status.COMPLETED, null, statistics);
        }

        public static WalkOutcome cancelled(WalkStatistics statistics) {
            return new WalkOutcome(Status.CANCELLED, null, statistics);
        }

        public static WalkOutcome failed(IOException failure, WalkStatistics statistics) {
            return new WalkOutcome(Status.FAILED, Objects.requireNonNull(failure, "failure"), statistics);
        }

        public Status status() { return status; }
        public Optional<IOException> failure() { return Optional.ofNullable(failure); }
        public WalkStatistics statistics() { return statistics; }
        public boolean isCompleted() { return status == Status.COMPLETED; }
    }

    /**
     * Walker sequencial e determinístico.
     *
     * Usa uma pilha explícita de iteradores (pré-ordem, filhos ordenados por nome) no lugar de
     * {@link Files#walkFileTree}, que não garante ordem de visita.
     * Cancelamento é verificado antes de cada emissão.
     *
     * Uma instância pode ser reutilizada; não guarda estado entre walks.
     */
    public static final class TreeWalker {

        private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

        private static final Comparator<Path> BY_NAME =
                Comparator.comparing(p -> p.getFileName().toString());

        private final DirectoryLister lister;

        public TreeWalker() {
            this(TreeWalker::readDirectory);
        }

        /** Permite trocar a listagem de diretórios (ex.: simular permissão negada). */
        public TreeWalker(DirectoryLister lister) {
            this.lister = Objects.requireNonNull(lister, "lister");
        }

        /**
         * Executa o walk a partir de {@code root}.
         *
         * @param root      diretório raiz
         * @param sink      destino dos eventos
         * @param cancelled sinal de cancelamento compartilhado
         * @return o resultado terminal; erros fatais (root inexistente/ilegível) viram {@code FAILED}
         */
        public WalkOutcome walk(Path root, WalkSink sink, BooleanSupplier cancelled) {
            Objects.requireNonNull(root, "root");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(cancelled, "cancelled");

            long files = 0;
            long directories = 0;
            long failed = 0;

            if (cancelled.getAsBoolean()) {
                return WalkOutcome.cancelled(WalkStatistics.empty());
            }

            Deque<Iterator<Path>> pending = new ArrayDeque<>();
            try {
                BasicFileAttributes rootAttrs = Files.readAttributes(root, BasicFileAttributes.class);
                if (!rootAttrs.isDirectory()) {
                    throw new NotDirectoryException(root.toString());
                }
                pending.push(list(root).iterator());
            } catch (NoSuchFileException e) {
                log.error("[SCAN] Diretório raiz não encontrado: {}", root);
                return WalkOutcome.failed(e, WalkStatistics.empty());
            } catch (IOException e) {
                log.error("[SCAN] Falha fatal ao abrir o diretório raiz {}: {}", root, e.toString());
                return WalkOutcome.failed(e, WalkStatistics.empty());
            }

            try {
                while (!pending.isEmpty()) {
                    Iterator<Path> level = pending.peek();
                    if (!level.hasNext()) {
                        pending.pop();
                        continue;
                    }
                    Path entry = level.next();

                    if (cancelled.getAsBoolean()) {
                        log.info("[SCAN] Cancelamento observado; encerrando walk em {}", entry);
                        return WalkOutcome.cancelled(new WalkStatistics(files, directories, failed));
                    }

                    BasicFileAttributes attrs;
                    try {
                        attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                    } catch (IOException e) {
                        failed++;
                        log.warn("[SCAN] Falha ao acessar {}: {}", entry, e.toString());
                        sink.onError(entry, e);
                        continue;
                    }

                    if (attrs.isDirectory()) {
                        directories++;
                        sink.onDirectory(entry);
                        try {
                            pending.push(list(entry).iterator());
                        } catch (IOException e) {
                            // Subárvore ilegível: registra e segue com o restante
                            failed++;
                            log.warn("[SCAN] Diretório ignorado {}: {}", entry, e.toString());
                            sink.onError(entry, e);
                        }
                    } else if (attrs.isRegularFile()) {
                        files++;
                        sink.onFile(entry);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[SCAN] Walk interrompido.");
                return WalkOutcome.cancelled(new WalkStatistics(files, directories, failed));
            }

            WalkStatistics stats = new WalkStatistics(files, directories, failed);
            log.debug("[SCAN] Walk concluído em {}: arquivos={} diretórios={} falhas={}",
                    root, files, directories, failed);
            return WalkOutcome.completed(stats);
        }

        private List<Path> list(Path directory) throws IOException {
            List<Path> children = new ArrayList<>(lister.list(directory));
            children.sort(BY_NAME);
            return children;
        }

        private static List<Path> readDirectory(Path directory) throws IOException {
            List<Path> children = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path child : stream) {
                    children.add(child);
                }
            } catch (DirectoryIteratorException e) {
                throw e.getCause();
            }
            return children;
        }
    }
}
