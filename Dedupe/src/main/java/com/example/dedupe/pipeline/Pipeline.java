package com.example.dedupe.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.dedupe.digest.DigestModule.Digest;
import com.example.dedupe.digest.DigestModule.DigestFunction;
import com.example.dedupe.scan.Scanner.TreeWalker;
import com.example.dedupe.scan.Scanner.WalkOutcome;
import com.example.dedupe.scan.Scanner.WalkSink;
import com.example.dedupe.scan.Scanner.WalkStatistics;

/**
 * Agrega todas as classes do pipeline concorrente de varredura + hash.
 * <p>
 * Inclui:
 * 1. Walker: uma thread sequencial que alimenta a fila de caminhos.
 * 2. Workers: pool fixo que calcula digests em PARALELO.
 * 3. Agregador: consome todas as fontes (diretórios, resultados, desfecho do walk)
 *    e monta as tabelas de duplicados. Único escritor das tabelas.
 * 4. Cancelamento: um único sinal compartilhado por todas as etapas.
 */
public final class Pipeline {

    private Pipeline() {}

    /** Capacidade da fila walker -> workers, por worker. */
    static final int PATHS_PER_WORKER = 64;
    /** Capacidade da fila de eventos que chega ao agregador. */
    static final int EVENT_QUEUE_CAPACITY = 1024;
    /** Tempo máximo aguardando as threads do pipeline encerrarem após cancelamento/erro. */
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    // ==================================================================================
    // CANCELAMENTO
    // ==================================================================================

    /**
     * Sinal de cancelamento compartilhado pelo walker, pelos workers e pelo agregador.
     * Timeout é só um cancelamento agendado ({@link #cancelAfter(Duration)}).
     */
    public static final class Cancellation {

        private static final Logger log = LoggerFactory.getLogger(Cancellation.class);

        private static final ScheduledThreadPoolExecutor TIMER = newTimer();

        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

        public static Cancellation create() {
            return new Cancellation();
        }

        /** Sinal já cancelado; útil em testes e para abortar antes de começar. */
        public static Cancellation cancelled() {
            Cancellation c = new Cancellation();
            c.cancel();
            return c;
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        /** Idempotente: apenas a primeira chamada notifica os listeners. */
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                for (Runnable listener : listeners) {
                    try {
                        listener.run();
                    } catch (RuntimeException e) {
                        log.warn("Listener de cancelamento falhou: {}", e.toString());
                    }
                }
            }
        }

        /**
         * Registra um listener. Se o sinal já estiver cancelado, o listener roda imediatamente.
         */
        public Registration onCancel(Runnable listener) {
            Objects.requireNonNull(listener, "listener");
            listeners.add(listener);
            if (cancelled.get() && listeners.remove(listener)) {
                listener.run();
            }
            return () -> listeners.remove(listener);
        }

        /** Agenda o cancelamento após {@code timeout}. Fechar o registro desarma o timer. */
        public Registration cancelAfter(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            ScheduledFuture<?> future = TIMER.schedule(() -> {
                log.warn("Tempo limite de {}s atingido; cancelando.", timeout.toSeconds());
                cancel();
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        }

        /** Timeouts agendados e ainda não disparados (desarmados saem da fila na hora). */
        static int pendingTimeouts() {
            return TIMER.getQueue().size();
        }

        private static ScheduledThreadPoolExecutor newTimer() {
            ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, namedThreads("dedupe-timeout", true));
            timer.setRemoveOnCancelPolicy(true);
            return timer;
        }

        /** Handle para remover um listener ou desarmar um timeout. */
        @FunctionalInterface
        public interface Registration extends AutoCloseable {
            @Override
            void close();
        }
    }

    // ==================================================================================
    // DTOs
    // ==================================================================================

    /**
     * Contadores de progresso, lidos ao vivo pelo reporter.
     * filesFound: incrementado pelo walker; filesHashed: pelo agregador, só em sucesso.
     */
    public static final class ScanCounters {
        private final AtomicLong filesFound = new AtomicLong();
        private final AtomicLong filesHashed = new AtomicLong();

        public void incrementFound() { filesFound.incrementAndGet(); }
        public void incrementHashed() { filesHashed.incrementAndGet(); }

        public long filesFound() { return filesFound.get(); }
        public long filesHashed() { return filesHashed.get(); }

        /** Lê filesHashed antes de filesFound, de modo que hashed <= found em todo snapshot. */
        public CounterSnapshot snapshot() {
            long hashed = filesHashed.get();
            long found = filesFound.get();
            return new CounterSnapshot(found, hashed);
        }
    }

    public static final class CounterSnapshot {
        private final long filesFound;
        private final long filesHashed;

        public CounterSnapshot(long filesFound, long filesHashed) {
            this.filesFound = filesFound;
            this.filesHashed = filesHashed;
        }

        public long filesFound() { return filesFound; }
        public long filesHashed() { return filesHashed; }
    }

    /** Resultado do hash de um arquivo: digest ou erro, nunca os dois. */
    public static final class HashResult {
        private final Path path;
        private final Digest digest;
        private final Exception error;

        private HashResult(Path path, Digest digest, Exception error) {
            this.path = Objects.requireNonNull(path, "path");
            this.digest = digest;
            this.error = error;
        }

        public static HashResult success(Path path, Digest digest) {
            return new HashResult(path, Objects.requireNonNull(digest, "digest"), null);
        }

        public static HashResult failure(Path path, Exception error) {
            return new HashResult(path, null, Objects.requireNonNull(error, "error"));
        }

        public Path path() { return path; }
        public Optional<Digest> digest() { return Optional.ofNullable(digest); }
        public Optional<Exception> error() { return Optional.ofNullable(error); }
        public boolean isSuccess() { return error == null; }
    }

    /** Falha pontual registrada durante o run (não aborta nada). */
    public static final class PathFailure {

        public enum Stage { WALK, HASH }

        private final Stage stage;
        private final Path path;
        private final String message;

        public PathFailure(Stage stage, Path path, String message) {
            this.stage = Objects.requireNonNull(stage, "stage");
            this.path = Objects.requireNonNull(path, "path");
            this.message = message;
        }

        public Stage stage() { return stage; }
        public Path path() { return path; }
        public String message() { return message; }
    }

    /** Desfecho do run. Cancelamento é distinguível de erro fatal. */
    public static final class Outcome {

        public enum Status { COMPLETED, CANCELLED, FAILED }

        private static final Outcome COMPLETED = new Outcome(Status.COMPLETED, null);
        private static final Outcome CANCELLED = new Outcome(Status.CANCELLED, null);

        private final Status status;
        private final IOException failure;

        private Outcome(Status status, IOException failure) {
            this.status = status;
            this.failure = failure;
        }

        public static Outcome completed() { return COMPLETED; }
        public static Outcome cancelled() { return CANCELLED; }

        public static Outcome failed(IOException failure) {
            return new Outcome(Status.FAILED, Objects.requireNonNull(failure, "failure"));
        }

        static Outcome from(WalkOutcome walk) {
            switch (walk.status()) {
                case CANCELLED:
                    return CANCELLED;
                case FAILED:
                    return failed(walk.failure().orElseGet(() -> new IOException("walk falhou")));
                default:
                    return COMPLETED;
            }
        }

        public Status status() { return status; }
        public Optional<IOException> failure() { return Optional.ofNullable(failure); }
        public boolean isCompleted() { return status == Status.COMPLETED; }
        public boolean isCancelled() { return status == Status.CANCELLED; }

        @Override
        public String toString() {
            return failure == null ? status.name() : status + "(" + failure.getMessage() + ")";
        }
    }

    /**
     * Grupos de duplicados: hex do digest -> caminhos (ordem de descoberta).
     * Só contém grupos com 2+ caminhos. Imutável.
     */
    public static final class DuplicateGroups {
        private final Map<String, List<Path>> groups;

        public DuplicateGroups(Map<String, List<Path>> groups) {
            Map<String, List<Path>> copy = new LinkedHashMap<>();
            Objects.requireNonNull(groups, "groups").forEach((hex, paths) -> {
                if (paths.size() < 2) {
                    throw new IllegalArgumentException("Grupo com menos de 2 caminhos: " + hex);
                }
                copy.put(hex, List.copyOf(paths));
            });
            this.groups = Collections.unmodifiableMap(copy);
        }

        public static DuplicateGroups empty() {
            return new DuplicateGroups(Map.of());
        }

        public Map<String, List<Path>> asMap() { return groups; }
        public List<Path> get(String hex) { return groups.getOrDefault(hex, List.of()); }
        public int size() { return groups.size(); }
        public boolean isEmpty() { return groups.isEmpty(); }

        /** Quantos arquivos sobram além do primeiro de cada grupo. */
        public long redundantFiles() {
            return groups.values().stream().mapToLong(p -> p.size() - 1L).sum();
        }
    }

    /** Retorno imutável do pipeline, entregue só depois que todas as threads terminaram. */
    public static final class PipelineResult {
        private final Path root;
        private final DuplicateGroups duplicates;
        private final Map<Path, Digest> digestsByPath;
        private final int uniqueDigests;
        private final List<Path> directories;
        private final List<PathFailure> failures;
        private final CounterSnapshot counters;
        private final Outcome outcome;

        public PipelineResult(Path root, DuplicateGroups duplicates, Map<Path, Digest> digestsByPath,
                              int uniqueDigests, List<Path> directories, List<PathFailure> failures,
                              CounterSnapshot counters, Outcome outcome) {
            this.root = Objects.requireNonNull(root, "root");
            this.duplicates = Objects.requireNonNull(duplicates, "duplicates");
            this.digestsByPath = Collections.unmodifiableMap(new LinkedHashMap<>(digestsByPath));
            this.uniqueDigests = uniqueDigests;
            this.directories = List.copyOf(directories);
            this.failures = List.copyOf(failures);
            this.counters = Objects.requireNonNull(counters, "counters");
            this.outcome = Objects.requireNonNull(outcome, "outcome");
        }

        public Path root() { return root; }
        public DuplicateGroups duplicates() { return duplicates; }
        public Map<Path, Digest> digestsByPath() { return digestsByPath; }
        public int uniqueDigests() { return uniqueDigests; }
        public List<Path> directories() { return directories; }
        public List<PathFailure> failures() { return failures; }
        public CounterSnapshot counters() { return counters; }
        public Outcome outcome() { return outcome; }
    }

    // ==================================================================================
    // EVENTOS (fan-in para o agregador)
    // ==================================================================================

    static final class Event {

        enum Kind { DIRECTORY, DIRECTORIES_CLOSED, RESULT, WORKER_FINISHED, WALK_ERROR, WALK_FINISHED, WAKE_UP }

        private static final Event DIRECTORIES_CLOSED = new Event(Kind.DIRECTORIES_CLOSED, null, null, null, null);
        private static final Event WORKER_FINISHED = new Event(Kind.WORKER_FINISHED, null, null, null, null);
        private static final Event WAKE_UP = new Event(Kind.WAKE_UP, null, null, null, null);

        final Kind kind;
        final Path path;
        final HashResult result;
        final WalkOutcome walkOutcome;
        final IOException error;

        private Event(Kind kind, Path path, HashResult result, WalkOutcome walkOutcome, IOException error) {
            this.kind = kind;
            this.path = path;
            this.result = result;
            this.walkOutcome = walkOutcome;
            this.error = error;
        }

        static Event directory(Path path) { return new Event(Kind.DIRECTORY, path, null, null, null); }
        static Event directoriesClosed() { return DIRECTORIES_CLOSED; }
        static Event result(HashResult result) { return new Event(Kind.RESULT, result.path(), result, null, null); }
        static Event workerFinished() { return WORKER_FINISHED; }
        static Event walkError(Path path, IOException error) { return new Event(Kind.WALK_ERROR, path, null, null, error); }
        static Event walkFinished(WalkOutcome outcome) { return new Event(Kind.WALK_FINISHED, null, null, outcome, null); }
        static Event wakeUp() { return WAKE_UP; }
    }

    /** Item da fila walker -> workers. {@link #POISON} sinaliza fim de entrada para um worker. */
    static final class FileTask {
        static final FileTask POISON = new FileTask(null);

        final Path path;

        private FileTask(Path path) { this.path = path; }

        static FileTask of(Path path) { return new FileTask(Objects.requireNonNull(path, "path")); }

        boolean isPoison() { return this == POISON; }
    }

    /**
     * Envia um evento, a menos que o run já esteja cancelado (nesse caso o evento é descartado,
     * pois o agregador parou de ler). Se bloqueado e interrompido, propaga a interrupção.
     */
    static <T> boolean send(BlockingQueue<T> queue, T item, Cancellation cancellation) throws InterruptedException {
        if (cancellation.isCancelled()) {
            return false;
        }
        queue.put(item);
        return true;
    }

    static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(daemon);
            return t;
        };
    }

    // ==================================================================================
    // WORKERS (hash em paralelo)
    // ==================================================================================

    /**
     * Pool fixo de W workers homogêneos. Cada worker lê caminhos da fila compartilhada,
     * chama a {@link DigestFunction} de forma síncrona e publica um {@link HashResult}.
     * A ordem dos resultados entre workers não é garantida.
     */
    public static final class HashingWorkerPool {

        private static final Logger log = LoggerFactory.getLogger(HashingWorkerPool.class);

        private final int workerCount;
        private final DigestFunction digestFunction;
        private final ExecutorService executor;

        /**
         * @throws IllegalArgumentException se {@code workerCount < 1}
         */
        public HashingWorkerPool(int workerCount, DigestFunction digestFunction) {
            if (workerCount < 1) {
                throw new IllegalArgumentException("Número de workers deve ser >= 1, recebido " + workerCount);
            }
            this.workerCount = workerCount;
            this.digestFunction = Objects.requireNonNull(digestFunction, "digestFunction");
            this.executor = Executors.newFixedThreadPool(workerCount, namedThreads("dedupe-hash", false));
        }

        public int workerCount() { return workerCount; }

        /**
         * Inicia os workers. Cada um termina ao receber {@link FileTask#POISON}, ao ser
         * interrompido ou ao observar cancelamento, e sempre tenta publicar WORKER_FINISHED.
         */
        void start(BlockingQueue<FileTask> paths, BlockingQueue<Event> events, Cancellation cancellation) {
            for (int i = 0; i < workerCount; i++) {
                executor.execute(() -> work(paths, events, cancellation));
            }
        }

        private void work(BlockingQueue<FileTask> paths, BlockingQueue<Event> events, Cancellation cancellation) {
            try {
                while (!cancellation.isCancelled()) {
                    FileTask task = paths.take();
                    if (task.isPoison()) {
                        break;
                    }
                    HashResult result = hashOne(task.path);
                    if (!send(events, Event.result(result), cancellation)) {
                        log.debug("[HASH] Resultado descartado após cancelamento: {}", task.path);
                        break;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                signalFinished(events, cancellation);
            }
        }

        private void signalFinished(BlockingQueue<Event> events, Cancellation cancellation) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            try {
                send(events, Event.workerFinished(), cancellation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        HashResult hashOne(Path path) {
            try {
                return HashResult.success(path, digestFunction.hash(path));
            } catch (IOException | RuntimeException e) {
                return HashResult.failure(path, e);
            }
        }

        void shutdownNow() {
            executor.shutdownNow();
        }

        void shutdown() {
            executor.shutdown();
        }

        boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return executor.awaitTermination(timeout, unit);
        }
    }

    // ==================================================================================
    // AGREGADOR (fan-in + tabelas de duplicados)
    // ==================================================================================

    /**
     * Dono exclusivo das tabelas path->digest, primeiro-visto e grupos de duplicados.
     *
     * Consome uma fila única de eventos, acompanhando três fontes independentes, cada uma com
     * seu próprio estado (aberta/esgotada): diretórios, resultados (um por worker ativo) e o
     * desfecho do walk. Termina quando todas se esgotam ou quando observa cancelamento/erro fatal.
     */
    public static final class ResultAggregator {

        private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

        private final ScanCounters counters;
        private final Map<Path, Digest> digestsByPath = new LinkedHashMap<>();
        private final Map<String, Path> firstSeen = new HashMap<>();
        private final Map<String, List<Path>> duplicates = new LinkedHashMap<>();
        private final List<Path> directories = new ArrayList<>();
        private final List<PathFailure> failures = new ArrayList<>();

        public ResultAggregator(ScanCounters counters) {
            this.counters = Objects.requireNonNull(counters, "counters");
        }

        /**
         * Drena os eventos até esgotar as três fontes.
         *
         * @param events       fila de fan-in
         * @param workerCount  quantos WORKER_FINISHED esperar
         * @param cancellation sinal compartilhado
         * @return desfecho do run (cancelamento e erro fatal retornam antes do fim das fontes)
         */
        Outcome drain(BlockingQueue<Event> events, int workerCount, Cancellation cancellation) {
            boolean directoriesOpen = true;
            int workersRunning = workerCount;
            boolean outcomePending = true;
            Outcome outcome = Outcome.completed();

            try {
                while (directoriesOpen || workersRunning > 0 || outcomePending) {
                    if (cancellation.isCancelled()) {
                        return Outcome.cancelled();
                    }
                    Event event = events.take();
                    switch (event.kind) {
                        case DIRECTORY:
                            directories.add(event.path);
                            break;
                        case DIRECTORIES_CLOSED:
                            directoriesOpen = false;
                            break;
                        case RESULT:
                            if (cancellation.isCancelled()) {
                                return Outcome.cancelled();
                            }
                            apply(event.result);
                            break;
                        case WORKER_FINISHED:
                            workersRunning--;
                            break;
                        case WALK_ERROR:
                            failures.add(new PathFailure(PathFailure.Stage.WALK, event.path, event.error.getMessage()));
                            break;
                        case WALK_FINISHED:
                            outcomePending = false;
                            outcome = Outcome.from(event.walkOutcome);
                            if (!outcome.isCompleted()) {
                                return outcome;
                            }
                            break;
                        case WAKE_UP:
                        default:
                            break;
                    }
                }
            } catch (InterruptedException e) {
                // Interrupção de quem chamou equivale a cancelar o run inteiro
                Thread.currentThread().interrupt();
                cancellation.cancel();
                return Outcome.cancelled();
            }
            return cancellation.isCancelled() ? Outcome.cancelled() : outcome;
        }

        /**
         * Aplica um resultado: sucesso entra nas tabelas (regra de promoção de duplicado),
         * erro só é registrado.
         */
        void apply(HashResult result) {
            if (!result.isSuccess()) {
                Exception error = result.error().orElseThrow();
                log.warn("[HASH] Erro ao calcular hash de {}: {}", result.path(), error.getMessage());
                failures.add(new PathFailure(PathFailure.Stage.HASH, result.path(), error.getMessage()));
                return;
            }

            Digest digest = result.digest().orElseThrow();
            if (digestsByPath.putIfAbsent(result.path(), digest) != null) {
                log.warn("[HASH] Resultado repetido ignorado: {}", result.path());
                return;
            }
            counters.incrementHashed();

            String hex = digest.hex();
            Path original = firstSeen.putIfAbsent(hex, result.path());
            if (original != null) {
                duplicates.computeIfAbsent(hex, k -> {
                    List<Path> group = new ArrayList<>();
                    group.add(original);
                    return group;
                }).add(result.path());
            }
        }

        PipelineResult toResult(Path root, Outcome outcome) {
            return new PipelineResult(root, new DuplicateGroups(duplicates), digestsByPath, firstSeen.size(),
                    directories, failures, counters.snapshot(), outcome);
        }
    }

    // ==================================================================================
    // PIPELINE (orquestração)
    // ==================================================================================

    /**
     * Liga Walker -> Workers -> Agregador sob um único sinal de cancelamento.
     *
     * O agregador roda na thread de quem chama; o walker em uma thread dedicada.
     * Antes de retornar, aguarda o encerramento de todas as threads criadas.
     */
    public static final class DedupePipeline {

        private static final Logger log = LoggerFactory.getLogger(DedupePipeline.class);

        private final TreeWalker walker;

        public DedupePipeline() {
            this(new TreeWalker());
        }

        public DedupePipeline(TreeWalker walker) {
            this.walker = Objects.requireNonNull(walker, "walker");
        }

        /**
         * Executa o pipeline completo.
         *
         * @param root           diretório raiz (relativo ao diretório de trabalho se não for absoluto)
         * @param digestFunction função de digest injetada
         * @param workerCount    número de workers de hash (>= 1)
         * @param cancellation   sinal compartilhado (timeout = cancelamento agendado)
         * @param counters       contadores por referência, lidos ao vivo pelo progresso
         * @throws NullPointerException     se algum argumento obrigatório for null
         * @throws IllegalArgumentException se {@code workerCount < 1}
         */
        public PipelineResult run(Path root,
                                  DigestFunction digestFunction,
                                  int workerCount,
                                  Cancellation cancellation,
                                  ScanCounters counters) {
            Objects.requireNonNull(root, "root");
            Objects.requireNonNull(digestFunction, "digestFunction");
            Objects.requireNonNull(cancellation, "cancellation");
            Objects.requireNonNull(counters, "counters");
            if (workerCount < 1) {
                throw new IllegalArgumentException("Número de workers deve ser >= 1, recebido " + workerCount);
            }

            Path effectiveRoot = root.toAbsolutePath().normalize();
            ResultAggregator aggregator = new ResultAggregator(counters);

            if (cancellation.isCancelled()) {
                log.info("[PIPELINE] Sinal já cancelado; nada a fazer.");
                return aggregator.toResult(effectiveRoot, Outcome.cancelled());
            }

            BlockingQueue<FileTask> paths = new ArrayBlockingQueue<>(workerCount * PATHS_PER_WORKER);
            BlockingQueue<Event> events = new ArrayBlockingQueue<>(EVENT_QUEUE_CAPACITY);

            HashingWorkerPool pool = new HashingWorkerPool(workerCount, digestFunction);
            ExecutorService walkerExecutor = Executors.newSingleThreadExecutor(namedThreads("dedupe-walker", false));
            // Acorda o agregador; se a fila estiver cheia ele já tem o que ler
            Cancellation.Registration wakeUp = cancellation.onCancel(() -> events.offer(Event.wakeUp()));

            log.info("[PIPELINE] Iniciando varredura de {} com {} workers.", effectiveRoot, workerCount);
            Outcome outcome = Outcome.cancelled();
            try {
                pool.start(paths, events, cancellation);
                walkerExecutor.execute(() -> walk(effectiveRoot, paths, events, workerCount, cancellation, counters));
                outcome = aggregator.drain(events, workerCount, cancellation);
            } finally {
                wakeUp.close();
                shutdown(pool, walkerExecutor, paths, events, !outcome.isCompleted());
            }

            PipelineResult result = aggregator.toResult(effectiveRoot, outcome);
            log.info("[PIPELINE] Desfecho={} encontrados={} hash={} grupos={} diretórios={}",
                    outcome, result.counters().filesFound(), result.counters().filesHashed(),
                    result.duplicates().size(), result.directories().size());
            return result;
        }

        /** Corpo da thread do walker. */
        private void walk(Path root,
                          BlockingQueue<FileTask> paths,
                          BlockingQueue<Event> events,
                          int workerCount,
                          Cancellation cancellation,
                          ScanCounters counters) {
            WalkOutcome outcome;
            try {
                outcome = walker.walk(root, new WalkSink() {
                    @Override
                    public void onDirectory(Path directory) throws InterruptedException {
                        send(events, Event.directory(directory), cancellation);
                    }

                    @Override
                    public void onFile(Path file) throws InterruptedException {
                        counters.incrementFound();
                        send(paths, FileTask.of(file), cancellation);
                    }

                    @Override
                    public void onError(Path path, IOException exc) throws InterruptedException {
                        send(events, Event.walkError(path, exc), cancellation);
                    }
                }, cancellation::isCancelled);
            } catch (RuntimeException e) {
                log.error("[SCAN] Erro inesperado no walker: {}", e.toString(), e);
                outcome = WalkOutcome.failed(new IOException("Erro inesperado no walker", e),
                        WalkStatistics.empty());
            }

            try {
                // Fim de entrada: um POISON por worker, depois fecha diretórios e publica o desfecho
                for (int i = 0; i < workerCount; i++) {
                    if (!send(paths, FileTask.POISON, cancellation)) {
                        break;
                    }
                }
                send(events, Event.directoriesClosed(), cancellation);
                send(events, Event.walkFinished(outcome), cancellation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        /**
         * Encerra walker e workers. Em cancelamento/erro interrompe as threads e esvazia as filas
         * para liberar envios em andamento; sempre aguarda o término antes de devolver o controle.
         */
        private void shutdown(HashingWorkerPool pool,
                              ExecutorService walkerExecutor,
                              BlockingQueue<FileTask> paths,
                              BlockingQueue<Event> events,
                              boolean abort) {
            if (abort) {
                walkerExecutor.shutdownNow();
                pool.shutdownNow();
            } else {
                walkerExecutor.shutdown();
                pool.shutdown();
            }

            long deadline = System.nanoTime() + SHUTDOWN_GRACE.toNanos();
            boolean interrupted = false;
            try {
                while (true) {
                    int dropped = events.size();
                    events.clear();
                    paths.clear();
                    if (abort && dropped > 0) {
                        log.debug("[PIPELINE] {} eventos em trânsito descartados.", dropped);
                    }
                    try {
                        if (walkerExecutor.awaitTermination(50, TimeUnit.MILLISECONDS)
                                && pool.awaitTermination(50, TimeUnit.MILLISECONDS)) {
                            return;
                        }
                    } catch (InterruptedException e) {
                        interrupted = true;
                        walkerExecutor.shutdownNow();
                        pool.shutdownNow();
                    }
                    if (System.nanoTime() > deadline) {
                        log.warn("[PIPELINE] Threads do pipeline não encerraram em {}s.", SHUTDOWN_GRACE.toSeconds());
                        return;
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
