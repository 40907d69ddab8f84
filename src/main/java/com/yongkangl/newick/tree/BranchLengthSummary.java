package com.yongkangl.newick.tree;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.Locale;

/**
 * Statistics over the branch lengths present in a tree. Nodes without a length are skipped.
 */
public class BranchLengthSummary {
    private final SummaryStatistics statistics;

    private BranchLengthSummary(SummaryStatistics statistics) {
        this.statistics = statistics;
    }

    public static BranchLengthSummary of(Tree tree) {
        Validate.notNull(tree, "tree");
        SummaryStatistics statistics = new SummaryStatistics();
        for (Node node : tree.getNodes()) {
            node.getLength().ifPresent(statistics::addValue);
        }
        return new BranchLengthSummary(statistics);
    }

    /**
     * Sum of branch lengths on the path from the node up to the root. The root's own length is not
     * part of any path; missing lengths count as zero.
     */
    public static double rootToTipDistance(Node node) {
        double distance = 0.0;
        for (Node current = node; current.getParent() != null; current = current.getParent()) {
            distance += current.getLength().orElse(0.0);
        }
        return distance;
    }

    public long getCount() {
        return statistics.getN();
    }

    public double getTotalLength() {
        return statistics.getSum();
    }

    public double getMean() {
        return statistics.getMean();
    }

    public double getMin() {
        return statistics.getMin();
    }

    public double getMax() {
        return statistics.getMax();
    }

    @Override
    public String toString() {
        if (getCount() == 0) {
            return "no branch lengths";
        }
        return String.format(Locale.ROOT, "branches=%d total=%.6g mean=%.6g min=%.6g max=%.6g",
                getCount(), getTotalLength(), getMean(), getMin(), getMax());
    }
}
