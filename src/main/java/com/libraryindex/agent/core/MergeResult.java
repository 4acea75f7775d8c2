package com.libraryindex.agent.core;

/**
 * Outcome of a synthesis merge.
 *
 * @param text        the single merged text, or the placeholder
 * @param rounds      merge rounds executed; 0 for empty or single input
 * @param fallbacks   pairs that fell back to concatenation
 * @param placeholder true when no usable input existed
 * @param interrupted true when cancellation stopped the merge between rounds;
 *                    {@code text} then joins the current level unmerged
 */
public record MergeResult(String text, int rounds, int fallbacks, boolean placeholder, boolean interrupted) {
}
