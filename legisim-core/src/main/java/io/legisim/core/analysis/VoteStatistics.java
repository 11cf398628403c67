package io.legisim.core.analysis;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/// Distribution of the number of votes a repetition took to pass.
///
/// @param count number of repetitions
/// @param mean mean number of votes
/// @param standardDeviation sample standard deviation, `NaN` for fewer than two rows
/// @param min fewest votes
/// @param median median number of votes
/// @param max most votes
public record VoteStatistics(
        long count, double mean, double standardDeviation, double min, double median, double max) {

    static VoteStatistics from(DescriptiveStatistics statistics) {
        return new VoteStatistics(
                statistics.getN(),
                statistics.getMean(),
                statistics.getStandardDeviation(),
                statistics.getMin(),
                statistics.getPercentile(50),
                statistics.getMax());
    }
}
