package com.example.dedupe;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.dedupe.config.AppConfig;
import com.example.dedupe.consolidate.Consolidation.ConsolidationReport;
import com.example.dedupe.consolidate.Consolidation.DuplicateConsolidator;
import com.example.dedupe.digest.DigestModule.DigestAlgorithm;
import com.example.dedupe.digest.DigestModule.DigestFunction;
import com.example.dedupe.pipeline.Pipeline.Cancellation;
import com.example.dedupe.pipeline.Pipeline.DedupePipeline;
import com.example.dedupe.pipeline.Pipeline.PipelineResult;
import com.example.dedupe.pipeline.Pipeline.ScanCounters;
import com.example.dedupe.report.Report.DuplicateReportWriter;
import com.example.dedupe.report.Report.ProgressReporter;

/**
 * Entrada de linha de comando: varre um diretório, lista duplicados e opcionalmente os
 * substitui por hard links.
 *
 * Códigos de saída: 0 sucesso, 1 falha, 2 erro de configuração, 130 cancelado.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    static final String USAGE =
            "uso: dedupe [--algo=xxh3|sha256|md5] [--workers=N] [--dry-run] [--hardlink]"
                    + " [--report-dir=DIR] [--timeout=SEGUNDOS] [root]";

    private final AppConfig config;
    private final PrintStream out;

    Main(AppConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        Cancellation cancellation = Cancellation.create();
        CountDownLatch finished = new CountDownLatch(1);

        // SIGINT/SIGTERM: cancela o run e espera o relatório parcial antes da JVM sair
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            cancellation.cancel();
            try {
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "dedupe-shutdown"));

        int code;
        try {
            code = new Main(AppConfig.load(), System.out).run(args, cancellation);
        } finally {
            finished.countDown();
        }
        System.exit(code);
    }

    /**
     * Executa o fluxo completo e devolve o código de saída.
     */
    int run(String[] args, Cancellation cancellation) {
        Path root;
        DigestFunction digestFunction;
        int workers;
        try {
            if (isHelp(args)) {
                out.println(USAGE);
                return EXIT_OK;
            }
            root = applyArguments(args).orElse(Path.of(""));
            DigestAlgorithm algorithm = config.hashAlgorithm();
            digestFunction = algorithm.newFunction();
            workers = config.workers();
            log.info("[CONFIG] {}", config);
        } catch (IllegalArgumentException e) {
            log.error("[CONFIG] {}", e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }

        ScanCounters counters = new ScanCounters();
        Optional<Duration> timeout = config.timeout();
        Cancellation.Registration timer = timeout.map(cancellation::cancelAfter).orElse(() -> { });

        PipelineResult result;
        try (ProgressReporter progress = new ProgressReporter(counters, config.progressInterval()).start()) {
            result = new DedupePipeline().run(root, digestFunction, workers, cancellation, counters);
        } finally {
            timer.close();
        }

        DuplicateReportWriter writer = new DuplicateReportWriter();
        writer.writeDuplicates(result, out);

        ConsolidationReport consolidation = null;
        if (config.dryRun()) {
            out.println("Dry-run: nenhum arquivo foi modificado.");
        }
        if (result.outcome().isCompleted() && config.hardlink()) {
            if (config.dryRun()) {
                log.info("[LINK] Dry-run ativo; consolidação ignorada ({} arquivos redundantes).",
                        result.duplicates().redundantFiles());
            } else {
                consolidation = new DuplicateConsolidator().consolidate(result.duplicates());
            }
        } else if (config.hardlink()) {
            log.warn("[LINK] Run não concluído ({}); consolidação ignorada.", result.outcome());
        }

        writer.writeSummary(result, consolidation, out);

        int code = exitCode(result);
        Optional<Path> reportDir = config.reportDir();
        if (reportDir.isPresent()) {
            try {
                writer.writeJson(result, consolidation, reportDir.get());
            } catch (IOException e) {
                log.error("[REPORT] Falha ao gravar relatório JSON em {}: {}", reportDir.get(), e.toString());
                if (code == EXIT_OK) {
                    code = EXIT_FAILURE;
                }
            }
        }
        return code;
    }

    static int exitCode(PipelineResult result) {
        switch (result.outcome().status()) {
            case CANCELLED:
                log.warn("Execução cancelada; resultados parciais acima.");
                return EXIT_CANCELLED;
            case FAILED:
                log.error("Execução falhou: {}", result.outcome().failure().map(Throwable::getMessage).orElse("?"));
                return EXIT_FAILURE;
            default:
                return EXIT_OK;
        }
    }

    /**
     * Converte os argumentos em overrides do AppConfig e devolve o root posicional, se houver.
     *
     * @throws IllegalArgumentException para opção desconhecida, valor ausente ou mais de um root
     */
    Optional<Path> applyArguments(String[] args) {
        Path root = null;
        for (String arg : args) {
            if (arg.equals("--dry-run")) {
                config.override(AppConfig.DRY_RUN, "true");
            } else if (arg.equals("--hardlink")) {
                config.override(AppConfig.HARDLINK, "true");
            } else if (arg.startsWith("--algo=")) {
                config.override(AppConfig.HASH_ALGORITHM, value(arg));
            } else if (arg.startsWith("--workers=")) {
                config.override(AppConfig.WORKERS, value(arg));
            } else if (arg.startsWith("--report-dir=")) {
                config.override(AppConfig.REPORT_DIR, value(arg));
            } else if (arg.startsWith("--timeout=")) {
                String v = value(arg);
                try {
                    if (Long.parseLong(v) < 0) {
                        throw new IllegalArgumentException("Tempo limite não pode ser negativo: " + v);
                    }
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Tempo limite inválido: '" + v + "'", e);
                }
                config.override(AppConfig.TIMEOUT_SECONDS, v);
            } else if (arg.startsWith("-")) {
                throw new IllegalArgumentException("Opção desconhecida: " + arg);
            } else if (root == null) {
                root = Path.of(arg);
            } else {
                throw new IllegalArgumentException("Apenas um diretório raiz é aceito; recebido também: " + arg);
            }
        }
        return Optional.ofNullable(root);
    }

    private static boolean isHelp(String[] args) {
        for (String arg : args) {
            if (arg.equals("--help") || arg.equals("-h")) {
                return true;
            }
        }
        return false;
    }

    private static String value(String arg) {
        String v = arg.substring(arg.indexOf('=') + 1);
        if (v.isBlank()) {
            throw new IllegalArgumentException("Valor ausente em " + arg);
        }
        return v;
    }
}
