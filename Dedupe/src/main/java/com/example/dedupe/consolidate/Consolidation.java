package com.example.dedupe.consolidate;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.dedupe.pipeline.Pipeline.DuplicateGroups;

/**
 * Consolidação de duplicados: substitui cada cópia redundante por um hard link para o
 * primeiro caminho do grupo (o "original").
 */
public final class Consolidation {

    private Consolidation() {}

    /** Estado final de cada candidato processado. */
    public enum CandidateState {
        /** Candidato e original já são o mesmo objeto no disco. */
        ALREADY_LINKED,
        /** Substituído por hard link. */
        LINKED,
        /** Erro antes de qualquer alteração no candidato (stat, staging, rename). */
        FAILED,
        /** Fallback removeu o candidato mas não conseguiu criar o link. */
        REMOVED_BUT_LINK_FAILED
    }

    /** Resumo de uma execução do consolidador. */
    public static final class ConsolidationReport {
        private final Map<CandidateState, Integer> counts;

        ConsolidationReport(Map<CandidateState, Integer> counts) {
            EnumMap<CandidateState, Integer> copy = new EnumMap<>(CandidateState.class);
            for (CandidateState state : CandidateState.values()) {
                copy.put(state, counts.getOrDefault(state, 0));
            }
            this.counts = copy;
        }

        /** Quantos candidatos foram de fato trocados por um link nesta execução. */
        public int replacementCount() { return count(CandidateState.LINKED); }

        public int count(CandidateState state) { return counts.getOrDefault(state, 0); }

        public int candidates() {
            return counts.values().stream().mapToInt(Integer::intValue).sum();
        }

        @Override
        public String toString() {
            return "ConsolidationReport" + counts;
        }
    }

    /**
     * Substitui duplicados por hard links, grupo a grupo na ordem de inserção.
     *
     * Cada candidato é independente: falhas são logadas e o próximo segue.
     * O original nunca é removido nem alterado. Executar duas vezes seguidas não troca nada
     * na segunda (todos os candidatos já são o mesmo objeto).
     */
    public static final class DuplicateConsolidator {

        private static final Logger log = LoggerFactory.getLogger(DuplicateConsolidator.class);

        private final LinkOperations fs;

        public DuplicateConsolidator() {
            this(LinkOperations.DEFAULT);
        }

        DuplicateConsolidator(LinkOperations fs) {
            this.fs = Objects.requireNonNull(fs, "fs");
        }

        public ConsolidationReport consolidate(DuplicateGroups groups) {
            Objects.requireNonNull(groups, "groups");
            Map<CandidateState, Integer> counts = new EnumMap<>(CandidateState.class);

            for (Map.Entry<String, List<Path>> group : groups.asMap().entrySet()) {
                List<Path> paths = group.getValue();
                Path original = paths.get(0);
                for (Path candidate : paths.subList(1, paths.size())) {
                    CandidateState state = consolidateOne(original, candidate);
                    counts.merge(state, 1, Integer::sum);
                }
            }

            ConsolidationReport report = new ConsolidationReport(counts);
            log.info("[LINK] Consolidação concluída: {} links criados, {} já ligados, {} falhas.",
                    report.replacementCount(), report.count(CandidateState.ALREADY_LINKED),
                    report.count(CandidateState.FAILED) + report.count(CandidateState.REMOVED_BUT_LINK_FAILED));
            return report;
        }

        CandidateState consolidateOne(Path original, Path candidate) {
            try {
                if (fs.isSameFile(original, candidate)) {
                    log.debug("[LINK] Já ligado: {} -> {}", candidate, original);
                    return CandidateState.ALREADY_LINKED;
                }
            } catch (IOException e) {
                log.warn("[LINK] Falha ao comparar {} com {}: {}", candidate, original, e.toString());
                return CandidateState.FAILED;
            }

            Path staged = stagingPath(candidate);
            try {
                fs.createLink(staged, original);
            } catch (IOException | UnsupportedOperationException e) {
                log.warn("[LINK] Falha ao preparar link para {}: {}", candidate, e.toString());
                return CandidateState.FAILED;
            }

            try {
                fs.moveAtomically(staged, candidate);
                log.info("[LINK] {} -> {}", candidate, original);
                return CandidateState.LINKED;
            } catch (AtomicMoveNotSupportedException e) {
                discard(staged);
                return removeThenLink(original, candidate);
            } catch (IOException e) {
                discard(staged);
                log.warn("[LINK] Falha ao substituir {}: {}", candidate, e.toString());
                return CandidateState.FAILED;
            }
        }

        /** Fallback sem rename atômico: há uma janela em que o candidato não existe. */
        private CandidateState removeThenLink(Path original, Path candidate) {
            try {
                fs.delete(candidate);
            } catch (IOException e) {
                log.warn("[LINK] Falha ao remover {}: {}", candidate, e.toString());
                return CandidateState.FAILED;
            }
            try {
                fs.createLink(candidate, original);
                log.info("[LINK] {} -> {} (sem rename atômico)", candidate, original);
                return CandidateState.LINKED;
            } catch (IOException | UnsupportedOperationException e) {
                log.error("[LINK] {} foi removido mas o link para {} falhou; conteúdo disponível apenas no original: {}",
                        candidate, original, e.toString());
                return CandidateState.REMOVED_BUT_LINK_FAILED;
            }
        }

        private void discard(Path staged) {
            try {
                fs.deleteIfExists(staged);
            } catch (IOException e) {
                log.warn("[LINK] Não foi possível remover o link temporário {}: {}", staged, e.toString());
            }
        }

        /** Nome curto e independente do candidato: nomes longos não podem estourar NAME_MAX. */
        private static Path stagingPath(Path candidate) {
            String name = ".dedupe-" + UUID.randomUUID() + ".tmp";
            return candidate.resolveSibling(name);
        }
    }

    /** Operações de sistema de arquivos usadas pelo consolidador (substituível em testes). */
    interface LinkOperations {

        LinkOperations DEFAULT = new LinkOperations() { };

        default boolean isSameFile(Path a, Path b) throws IOException {
            return Files.isSameFile(a, b);
        }

        default void createLink(Path link, Path existing) throws IOException {
            Files.createLink(link, existing);
        }

        default void moveAtomically(Path source, Path target) throws IOException {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }

        default void delete(Path path) throws IOException {
            Files.delete(path);
        }

        default void deleteIfExists(Path path) throws IOException {
            Files.deleteIfExists(path);
        }
    }
}
