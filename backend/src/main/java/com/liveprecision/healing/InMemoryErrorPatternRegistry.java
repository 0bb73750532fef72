package com.liveprecision.healing;

import com.liveprecision.common.BoundedHistory;
import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ErrorPattern;
import com.liveprecision.domain.Severity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Copy-on-write registry: writers replace an immutable list under the registry lock, readers scan the
 * current list without locking.
 */
@Slf4j
public class InMemoryErrorPatternRegistry implements ErrorPatternRegistry {

    private static final int SYNTHESIZED_MATCH_LENGTH = 50;

    private final Clock clock;
    private final BoundedHistory<ErrorSnapshot> recentErrors;
    private final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private volatile List<ErrorPattern> snapshot = List.of();

    public InMemoryErrorPatternRegistry(Clock clock, int recentErrorsSize) {
        this.clock = clock;
        this.recentErrors = new BoundedHistory<>(recentErrorsSize);
    }

    @Override
    public void seed(Collection<ErrorPattern> patterns) {
        patterns.forEach(this::learn);
    }

    @Override
    public ErrorPattern learn(ErrorPattern pattern) {
        synchronized (writeLock) {
            Optional<ErrorPattern> existing = find(pattern.getId());
            if (existing.isPresent()) {
                return existing.get();
            }
            List<ErrorPattern> next = new ArrayList<>(snapshot);
            next.add(pattern);
            snapshot = List.copyOf(next);
            log.debug("Registered error pattern {}", pattern);
            return pattern;
        }
    }

    @Override
    public DetectionOutcome detect(Throwable error, Map<String, Object> context) {
        Instant now = clock.instant();
        String errorType = error.getClass().getSimpleName();
        recentErrors.add(new ErrorSnapshot(now, errorType, error.getMessage(), context));
        errorCounts.computeIfAbsent(errorType, k -> new AtomicLong()).incrementAndGet();

        List<ErrorPattern> matched = match(snapshot, error);
        boolean learned = false;
        if (matched.isEmpty()) {
            synchronized (writeLock) {
                // another thread may have learned a matching pattern meanwhile
                matched = match(snapshot, error);
                if (matched.isEmpty()) {
                    matched = List.of(learn(synthesize(error)));
                    learned = true;
                }
            }
        }
        matched.forEach(p -> p.recordOccurrence(now));
        return DetectionOutcome.of(error, matched, learned);
    }

    @Override
    public Optional<ErrorPattern> find(String id) {
        return snapshot.stream().filter(p -> p.getId().equals(id)).findFirst();
    }

    @Override
    public List<ErrorPattern> patterns() {
        return snapshot;
    }

    @Override
    public List<ErrorSnapshot> recentErrors() {
        return recentErrors.snapshot();
    }

    @Override
    public Map<String, Long> errorCountsByType() {
        Map<String, Long> counts = new TreeMap<>();
        errorCounts.forEach((type, count) -> counts.put(type, count.get()));
        return counts;
    }

    @Override
    public void recordOutcome(String patternId, boolean success) {
        find(patternId).ifPresent(p -> p.adjustSuccessRate(success ? 1.1 : 0.9));
    }

    private static List<ErrorPattern> match(List<ErrorPattern> patterns, Throwable error) {
        String text = ErrorPattern.matchText(error);
        return patterns.stream().filter(p -> p.matches(text)).toList();
    }

    private ErrorPattern synthesize(Throwable error) {
        String errorType = error.getClass().getSimpleName();
        String message = error.getMessage() == null ? "" : error.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);
        String regex = message.isBlank()
                ? Pattern.quote(errorType)
                : Pattern.quote(message.substring(0, Math.min(SYNTHESIZED_MATCH_LENGTH, message.length())));
        String id = "auto_" + errorType + "_" + (snapshot.size() + 1);

        ErrorCategory category;
        Severity severity;
        boolean autoFix = false;
        if (error instanceof ArithmeticException || error instanceof IllegalArgumentException
                || lower.contains("calculation")) {
            category = ErrorCategory.CALCULATION;
            severity = Severity.HIGH;
            autoFix = true;
        } else if (lower.contains("network") || lower.contains("connection")) {
            category = ErrorCategory.NETWORK;
            severity = Severity.MEDIUM;
        } else if (lower.contains("database") || lower.contains("sql")) {
            category = ErrorCategory.DATABASE;
            severity = Severity.HIGH;
        } else {
            category = ErrorCategory.SYSTEM;
            severity = Severity.MEDIUM;
        }
        log.info("Learned new error pattern {} ({}/{}) from {}", id, category.code(), severity.code(), errorType);
        return new ErrorPattern(id, regex, errorType, category, severity, autoFix,
                "Investigate " + errorType + " and add a dedicated handler");
    }
}
