package com.foldermatch.app.config;

import java.time.Duration;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import com.foldermatch.app.model.FilterCriteria;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuracao central.
 * Valores vem de uma system property da JVM, depois do ambiente, depois de um .env local,
 * depois do padrao embutido.
 */
public final class Config {

    static final String ENV_MAX_PARALLELISM = "FOLDERMATCH_MAX_PARALLELISM";
    static final String ENV_SCAN_TIMEOUT_MINUTES = "FOLDERMATCH_SCAN_TIMEOUT_MINUTES";
    static final String ENV_NETWORK_PROBE_TIMEOUT_MS = "FOLDERMATCH_NETWORK_PROBE_TIMEOUT_MS";
    static final String ENV_MAX_HASH_RETRIES = "FOLDERMATCH_MAX_HASH_RETRIES";
    static final String ENV_RETRY_DELAY_CAP_MS = "FOLDERMATCH_RETRY_DELAY_CAP_MS";
    static final String ENV_MIN_SIMILARITY = "FOLDERMATCH_MIN_SIMILARITY";
    static final String ENV_MIN_SIZE_MB = "FOLDERMATCH_MIN_SIZE_MB";

    // Overrides via system property (testes/CI)
    static final String PROP_MAX_PARALLELISM = "foldermatch.maxParallelism";
    static final String PROP_SCAN_TIMEOUT_MINUTES = "foldermatch.scanTimeoutMinutes";
    static final String PROP_NETWORK_PROBE_TIMEOUT_MS = "foldermatch.networkProbeTimeoutMs";
    static final String PROP_MAX_HASH_RETRIES = "foldermatch.maxHashRetries";
    static final String PROP_RETRY_DELAY_CAP_MS = "foldermatch.retryDelayCapMs";
    static final String PROP_MIN_SIMILARITY = "foldermatch.minSimilarity";
    static final String PROP_MIN_SIZE_MB = "foldermatch.minSizeMb";

    // Logger precisa ser inicializado antes de qualquer inicializador estatico que o use
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private Config() {}

    public static int getMaxParallelism() {
        return getInt(ENV_MAX_PARALLELISM, AnalysisSettings.defaultParallelism(), 1, 256);
    }

    public static Duration getScanTimeout() {
        return Duration.ofMinutes(getInt(ENV_SCAN_TIMEOUT_MINUTES, 30, 1, 24 * 60));
    }

    public static Duration getNetworkProbeTimeout() {
        return Duration.ofMillis(getInt(ENV_NETWORK_PROBE_TIMEOUT_MS, 5000, 100, 60_000));
    }

    public static int getMaxHashRetries() {
        return getInt(ENV_MAX_HASH_RETRIES, 1, 0, 10);
    }

    public static Duration getRetryDelayCap() {
        return Duration.ofMillis(getInt(ENV_RETRY_DELAY_CAP_MS, 5000, 0, 60_000));
    }

    public static double getMinSimilarity() {
        String raw = getEnvOrDotenv(ENV_MIN_SIMILARITY);
        if (raw == null) return FilterCriteria.DEFAULT_MIN_SIMILARITY;
        double value = NumberUtils.toDouble(raw, Double.NaN);
        if (Double.isNaN(value) || value < 0 || value > 100) {
            logger.warn("Valor invalido {}='{}', usando padrao {}", ENV_MIN_SIMILARITY, raw, FilterCriteria.DEFAULT_MIN_SIMILARITY);
            return FilterCriteria.DEFAULT_MIN_SIMILARITY;
        }
        return value;
    }

    public static long getMinSizeBytes() {
        return getInt(ENV_MIN_SIZE_MB, 1, 0, 1024 * 1024) * 1024L * 1024L;
    }

    /**
     * Retrato de todas as configuracoes, resolvidas agora.
     */
    public static AnalysisSettings analysisSettings() {
        return new AnalysisSettings(
                getMaxParallelism(),
                getScanTimeout(),
                getNetworkProbeTimeout(),
                getMaxHashRetries(),
                getRetryDelayCap(),
                new FilterCriteria(getMinSimilarity(), getMinSizeBytes(), null, null)
        );
    }

    private static int getInt(String key, int fallback, int min, int max) {
        String raw = getEnvOrDotenv(key);
        if (raw == null) return fallback;
        if (!NumberUtils.isParsable(raw)) {
            logger.warn("Valor invalido {}='{}', usando padrao {}", key, raw, fallback);
            return fallback;
        }
        int value = NumberUtils.toInt(raw, Integer.MIN_VALUE);
        if (value < min || value > max) {
            logger.warn("{}={} out of range [{}, {}], using default {}", key, raw, min, max, fallback);
            return fallback;
        }
        return value;
    }

    /**
     * System property primeiro, depois o ambiente do SO, depois o .env.
     */
    static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (StringUtils.isNotBlank(propVal)) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (StringUtils.isNotBlank(envVal)) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        return StringUtils.isBlank(fileVal) ? null : fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_MAX_PARALLELISM -> PROP_MAX_PARALLELISM;
            case ENV_SCAN_TIMEOUT_MINUTES -> PROP_SCAN_TIMEOUT_MINUTES;
            case ENV_NETWORK_PROBE_TIMEOUT_MS -> PROP_NETWORK_PROBE_TIMEOUT_MS;
            case ENV_MAX_HASH_RETRIES -> PROP_MAX_HASH_RETRIES;
            case ENV_RETRY_DELAY_CAP_MS -> PROP_RETRY_DELAY_CAP_MS;
            case ENV_MIN_SIMILARITY -> PROP_MIN_SIMILARITY;
            case ENV_MIN_SIZE_MB -> PROP_MIN_SIZE_MB;
            default -> null;
        };
    }
}
