package com.example.dedupe.report;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.dedupe.consolidate.Consolidation.CandidateState;
import com.example.dedupe.consolidate.Consolidation.ConsolidationReport;
import com.example.dedupe.pipeline.Pipeline.CounterSnapshot;
import com.example.dedupe.pipeline.Pipeline.PathFailure;
import com.example.dedupe.pipeline.Pipeline.PipelineResult;
import com.example.dedupe.pipeline.Pipeline.ScanCounters;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Saídas para o usuário: linha de progresso, relatório de duplicados e exportação JSON.
 */
public final class Report {

    private Report() {}

    // ==================================================================================
    // PROGRESSO
    // ==================================================================================

    /**
     * Loga periodicamente "encontrados/hash/tempo" a partir dos contadores ao vivo do pipeline.
     * Ao fechar, loga uma linha final.
     */
    public static final class ProgressReporter implements AutoCloseable {

        private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

        private final ScanCounters counters;
        private final Duration interval;
        private final ScheduledExecutorService scheduler;
        private final long startedAt;

        public ProgressReporter(ScanCounters counters, Duration interval) {
            this.counters = Objects.requireNonNull(counters, "counters");
            this.interval = interval != null ? interval : Duration.ofSeconds(1);
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "dedupe-progress");
                t.setDaemon(true);
                return t;
            });
            this.startedAt = System.nanoTime();
        }

        public ProgressReporter start() {
            long millis = interval.toMillis();
            scheduler.scheduleAtFixedRate(() -> log.info("[PROGRESSO] {}", line()), millis, millis, TimeUnit.MILLISECONDS);
            return this;
        }

        /** Linha de progresso no formato "Encontrados: N | Hash: M | Tempo: Xs". */
        String line() {
            CounterSnapshot snapshot = counters.snapshot();
            return format(snapshot, Duration.ofNanos(System.nanoTime() - startedAt));
        }

        static String format(CounterSnapshot snapshot, Duration elapsed) {
            return String.format("Encontrados: %d | Hash: %d | Tempo: %ds",
                    snapshot.filesFound(), snapshot.filesHashed(), elapsed.toSeconds());
        }

        @Override
        public void close() {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[PROGRESSO] Scheduler não encerrou a tempo.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("[PROGRESSO] {} (finalizado)", line());
        }
    }

    // ==================================================================================
    // RELATÓRIO
    // ==================================================================================

    /**
     * Escreve o relatório de duplicados em texto e, opcionalmente, em JSON.
     */
    public static final class DuplicateReportWriter {

        private static final Logger log = LoggerFactory.getLogger(DuplicateReportWriter.class);

        private static final DateTimeFormatter FILE_STAMP =
                DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

        private final ObjectMapper mapper;
        private final Clock clock;

        public DuplicateReportWriter() {
            this(Clock.systemUTC());
        }

        public DuplicateReportWriter(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            this.mapper = new ObjectMapper()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        }

        /** Lista cada grupo (hash → caminhos) ou avisa que não há duplicados. */
        public void writeDuplicates(PipelineResult result, PrintStream out) {
            Map<String, List<Path>> groups = result.duplicates().asMap();
            if (groups.isEmpty()) {
                out.println("Nenhum duplicado encontrado.");
                return;
            }
            out.println("Duplicados encontrados:");
            groups.forEach((hex, paths) -> {
                out.println("Hash |" + hex + "|:");
                for (Path p : paths) {
                    out.println("  \"" + p + "\"");
                }
            });
        }

        /**
         * Resumo final.
         *
         * @param consolidation relatório do consolidador, ou null quando não houve consolidação
         */
        public void writeSummary(PipelineResult result, ConsolidationReport consolidation, PrintStream out) {
            out.println("Resumo:");
            out.println("  Desfecho: " + result.outcome());
            out.println("  Arquivos encontrados: " + result.counters().filesFound());
            out.println("  Arquivos com hash: " + result.counters().filesHashed());
            out.println("  Hashes únicos: " + result.uniqueDigests());
            out.println("  Diretórios: " + result.directories().size());
            out.println("  Grupos de duplicados: " + result.duplicates().size());
            out.println("  Arquivos redundantes: " + result.duplicates().redundantFiles());
            out.println("  Falhas: " + result.failures().size());
            if (consolidation != null) {
                out.println("  Links criados: " + consolidation.replacementCount());
            }
        }

        /**
         * Grava {@code dedupe-report-<timestamp>.json} em {@code directory} (criado se preciso).
         * A escrita passa por um arquivo temporário e um rename, para nunca deixar JSON pela metade.
         */
        public Path writeJson(PipelineResult result, ConsolidationReport consolidation, Path directory) throws IOException {
            Objects.requireNonNull(directory, "directory");
            Files.createDirectories(directory);
            Instant now = clock.instant();
            Path target = directory.resolve("dedupe-report-" + FILE_STAMP.format(now) + ".json");
            Path tmp = Files.createTempFile(directory, ".dedupe-report-", ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), toDocument(result, consolidation, now));
                moveAtomically(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.info("[REPORT] Relatório JSON gravado em {}", target);
            return target;
        }

        ReportDocument toDocument(PipelineResult result, ConsolidationReport consolidation, Instant generatedAt) {
            List<GroupEntry> groups = new ArrayList<>();
            result.duplicates().asMap().forEach((hex, paths) ->
                    groups.add(new GroupEntry(hex, paths.stream().map(Path::toString).toList())));

            List<FailureEntry> failures = new ArrayList<>();
            for (PathFailure f : result.failures()) {
                failures.add(new FailureEntry(f.stage().name().toLowerCase(Locale.ROOT), f.path().toString(), f.message()));
            }

            LinkSummary links = consolidation == null ? null : new LinkSummary(
                    consolidation.replacementCount(),
                    consolidation.count(CandidateState.ALREADY_LINKED),
                    consolidation.count(CandidateState.FAILED),
                    consolidation.count(CandidateState.REMOVED_BUT_LINK_FAILED));

            return new ReportDocument(
                    generatedAt.toString(),
                    result.root().toString(),
                    result.outcome().status().name().toLowerCase(Locale.ROOT),
                    result.outcome().failure().map(Throwable::getMessage).orElse(null),
                    result.counters().filesFound(),
                    result.counters().filesHashed(),
                    result.uniqueDigests(),
                    result.directories().size(),
                    groups,
                    failures,
                    links);
        }

        private static void moveAtomically(Path source, Path target) throws IOException {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    // ==================================================================================
    // DTOs JSON
    // ==================================================================================

    public record ReportDocument(
            @JsonProperty("generated_at") String generatedAt,
            @JsonProperty("root") String root,
            @JsonProperty("outcome") String outcome,
            @JsonProperty("error") String error,
            @JsonProperty("files_found") long filesFound,
            @JsonProperty("files_hashed") long filesHashed,
            @JsonProperty("unique_digests") int uniqueDigests,
            @JsonProperty("directories") int directories,
            @JsonProperty("duplicate_groups") List<GroupEntry> duplicateGroups,
            @JsonProperty("failures") List<FailureEntry> failures,
            @JsonProperty("links") LinkSummary links) {
    }

    public record GroupEntry(
            @JsonProperty("digest") String digest,
            @JsonProperty("paths") List<String> paths) {
    }

    public record FailureEntry(
            @JsonProperty("stage") String stage,
            @JsonProperty("path") String path,
            @JsonProperty("message") String message) {
    }

    public record LinkSummary(
            @JsonProperty("linked") int linked,
            @JsonProperty("already_linked") int alreadyLinked,
            @JsonProperty("failed") int failed,
            @JsonProperty("removed_but_link_failed") int removedButLinkFailed) {
    }
}
