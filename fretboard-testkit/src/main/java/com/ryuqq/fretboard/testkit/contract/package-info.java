/**
 * Contract test infrastructure.
 *
 * <p>{@link com.ryuqq.fretboard.testkit.contract.AbstractVoicingContractTest} bundles the
 * fixtures and property assertions that every voicing search, capo suggestion and
 * transition must satisfy. Extend it to run the same checks against custom options,
 * instruments or {@link com.ryuqq.fretboard.core.spi.ShapeDifficultyEstimator} implementations.</p>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.testkit.contract;
