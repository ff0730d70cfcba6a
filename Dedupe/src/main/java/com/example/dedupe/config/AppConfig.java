package com.example.dedupe.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.example.dedupe.digest.DigestModule.DigestAlgorithm;

/**
 * AppConfig
 * ----------
 * Responsável por carregar, validar e expor configurações do dedupe.
 *
 * PRINCÍPIOS:
 * - Falhar cedo (validar antes de iniciar a varredura).
 * - Chaves centralizadas em constantes.
 * - Precedência: overrides (linha de comando) > variáveis de ambiente > System properties > .env.
 * - Métodos tipados com limites para valores numéricos.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Algoritmo de digest: xxh3 (padrão), sha256 ou md5. */
    public static final String HASH_ALGORITHM = "DEDUPE_HASH_ALGORITHM";
    /** Número de workers de hash. Padrão: processadores disponíveis. */
    public static final String WORKERS = "DEDUPE_WORKERS";
    /** Executa a varredura mas não altera nada no disco. */
    public static final String DRY_RUN = "DEDUPE_DRY_RUN";
    /** Substitui duplicados por hard links ao final. */
    public static final String HARDLINK = "DEDUPE_HARDLINK";
    /** Diretório onde gravar o relatório JSON (opcional). */
    public static final String REPORT_DIR = "DEDUPE_REPORT_DIR";
    /** Intervalo (segundos) da linha de progresso. Padrão 1. */
    public static final String PROGRESS_INTERVAL_SECONDS = "DEDUPE_PROGRESS_INTERVAL_SECONDS";
    /** Tempo limite (segundos) do run inteiro; 0 = sem limite. */
    public static final String TIMEOUT_SECONDS = "DEDUPE_TIMEOUT_SECONDS";

    /** Limite superior de workers aceito. */
    public static final int MAX_WORKERS = 256;

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (linha de comando, testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados. */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente (sobrescrevem system properties)
     * 3) Arquivo .env (preenche apenas ausentes)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        System.getenv().forEach(map::put);

        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /** Útil para testes: cria AppConfig a partir de um Map já resolvido. */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /** Busca valor (overrides > values) e devolve Optional sem brancos. */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /** Seta/remove override em runtime. Se value==null, remove o override. */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= GETTERS ESPECÍFICOS =======

    /**
     * Algoritmo de digest configurado.
     *
     * @throws IllegalArgumentException se o nome não for reconhecido
     */
    public DigestAlgorithm hashAlgorithm() {
        return DigestAlgorithm.fromName(getOrDefault(HASH_ALGORITHM, DigestAlgorithm.XXH3.id()));
    }

    /**
     * Número de workers. Ao contrário dos outros inteiros, valor fora da faixa falha cedo:
     * um "--workers=0" explícito é erro de uso, não algo a corrigir em silêncio.
     *
     * @throws IllegalArgumentException se não for inteiro ou estiver fora de [1, MAX_WORKERS]
     */
    public int workers() {
        int def = Math.min(Runtime.getRuntime().availableProcessors(), MAX_WORKERS);
        Optional<String> raw = find(WORKERS);
        if (raw.isEmpty()) {
            return def;
        }
        int v;
        try {
            v = Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Número de workers inválido: '" + raw.get() + "'", e);
        }
        if (v < 1 || v > MAX_WORKERS) {
            throw new IllegalArgumentException("Número de workers deve estar entre 1 e " + MAX_WORKERS + ": " + v);
        }
        return v;
    }

    public boolean dryRun() {
        return bool(DRY_RUN, false);
    }

    public boolean hardlink() {
        return bool(HARDLINK, false);
    }

    public Optional<Path> reportDir() {
        return find(REPORT_DIR).map(Path::of);
    }

    /** Intervalo da linha de progresso. Limites: [1, 3600] segundos. */
    public Duration progressInterval() {
        return Duration.ofSeconds(longConfig(PROGRESS_INTERVAL_SECONDS, 1, 1, 3600));
    }

    /** Tempo limite do run; vazio quando 0 (sem limite). */
    public Optional<Duration> timeout() {
        long seconds = longConfig(TIMEOUT_SECONDS, 0, 0, Long.MAX_VALUE / 1000);
        return seconds == 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
    }

    // ======= HELPERS TIPADOS =======

    /**
     * Lê uma flag booleana tolerante a formatos:
     * "true/1/yes" (case-insensitive) → true; senão, false.
     */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= DIAGNÓSTICO =======

    @Override
    public String toString() {
        return "AppConfig{" +
                "algo=" + safe(() -> hashAlgorithm().id()) +
                ", workers=" + safe(() -> Integer.toString(workers())) +
                ", dryRun=" + dryRun() +
                ", hardlink=" + hardlink() +
                ", reportDir=" + find(REPORT_DIR).orElse("unset") +
                ", progress=" + progressInterval().toSeconds() + "s" +
                ", timeout=" + timeout().map(d -> d.toSeconds() + "s").orElse("none") +
                "}";
    }

    /** Helper para não explodir toString() caso getters lancem. */
    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException e) { return "error:" + e.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
