package com.liveprecision.healing;

import com.liveprecision.domain.ErrorPattern;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thread-safe store of known error patterns. Matching reads a snapshot without locking; only occurrence
 * counters and success rates are updated, each under its pattern's lock.
 */
public interface ErrorPatternRegistry {

    /** Adds patterns whose ids are not yet registered. */
    void seed(Collection<ErrorPattern> patterns);

    /**
     * Registers {@code pattern} unless its id is taken.
     *
     * @return the registered pattern with that id
     */
    ErrorPattern learn(ErrorPattern pattern);

    /**
     * Matches {@code error} against every known pattern, recording an occurrence on each hit. When nothing
     * matches, a pattern is synthesized from the error, learned and returned.
     */
    DetectionOutcome detect(Throwable error, Map<String, Object> context);

    Optional<ErrorPattern> find(String id);

    List<ErrorPattern> patterns();

    List<ErrorSnapshot> recentErrors();

    Map<String, Long> errorCountsByType();

    /**
     * Learning feedback: success multiplies the pattern's success rate by 1.1, failure by 0.9.
     */
    void recordOutcome(String patternId, boolean success);
}
