package com.pharmaforecast.model;

import java.util.List;

/**
 * Gradient-boosted regression trees as exported by XGBoost's JSON dump.
 * The prediction is the base score plus the leaf value reached in every tree.
 */
public final class TreeEnsembleModel implements DemandModel {

    private final double baseScore;
    private final List<Node> trees;

    public TreeEnsembleModel(double baseScore, List<Node> trees) {
        this.baseScore = baseScore;
        this.trees = List.copyOf(trees);
    }

    @Override
    public double predict(FeatureVector features) {
        double[] x = features.toArray();
        double sum = baseScore;
        for (Node root : trees) {
            sum += root.evaluate(x);
        }
        return sum;
    }

    @Override
    public String describe() {
        return "gbtree(" + trees.size() + " trees)";
    }

    public int treeCount() {
        return trees.size();
    }

    public sealed interface Node permits Leaf, Split {
        double evaluate(double[] x);
    }

    public record Leaf(double value) implements Node {
        @Override
        public double evaluate(double[] x) {
            return value;
        }
    }

    /** Goes to {@code yes} when {@code x[feature] < threshold}, {@code missing} when the value is NaN. */
    public record Split(int feature, double threshold, Node yes, Node no, Node missing) implements Node {
        @Override
        public double evaluate(double[] x) {
            Node current = this;
            while (current instanceof Split split) {
                double value = x[split.feature()];
                if (Double.isNaN(value)) {
                    current = split.missing();
                } else {
                    current = value < split.threshold() ? split.yes() : split.no();
                }
            }
            return ((Leaf) current).value();
        }
    }
}
