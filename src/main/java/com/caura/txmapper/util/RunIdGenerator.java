package com.caura.txmapper.util;

import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Generates reconciliation run identifiers of the form
 * {@code <platform>_<yyyyMMdd_HHmmss>_<8 hex>}, e.g. {@code stripe_20250728_123013_3f9a1c2e}.
 * <p>
 * The timestamp keeps ids sortable per platform; the random suffix keeps two runs started
 * in the same second apart. Stateless apart from the clock, so safe to share.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_SINGLETON)
public class RunIdGenerator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern RUN_ID = Pattern.compile("[a-z0-9_]+_\\d{8}_\\d{6}_[0-9a-f]{8}");
    private static final Pattern UNSAFE = Pattern.compile("[^a-z0-9]+");

    private final Clock clock;

    public RunIdGenerator() {
        this(Clock.systemDefaultZone());
    }

    RunIdGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Generates a new run id for the given platform.
     *
     * @param platform source platform; lowercased, with runs of other characters collapsed to '_'
     * @return a new run id
     */
    public String generate(String platform) {
        String prefix = sanitize(platform);
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        String suffix = String.format("%08x", ThreadLocalRandom.current().nextInt());
        return prefix + "_" + timestamp + "_" + suffix;
    }

    /**
     * Validates whether a given string has the run id format.
     */
    public boolean isValid(String runId) {
        return runId != null && RUN_ID.matcher(runId).matches();
    }

    private static String sanitize(String platform) {
        if (platform == null || platform.isBlank()) {
            return "run";
        }
        String cleaned = UNSAFE.matcher(platform.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        cleaned = cleaned.replaceAll("^_+|_+$", "");
        return cleaned.isEmpty() ? "run" : cleaned;
    }
}
