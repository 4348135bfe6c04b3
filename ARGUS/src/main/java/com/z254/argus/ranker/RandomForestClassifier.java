package com.z254.argus.ranker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.z254.argus.config.ArgusProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Bagged ensemble of {@link DecisionTree}s.
 * <p>
 * Each tree is grown on a bootstrap sample with {@code floor(sqrt(p))} candidate
 * features per split and its own seed derived from the forest seed, so training
 * is reproducible even though trees are grown in parallel.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RandomForestClassifier {

    private int featureCount;
    private List<DecisionTree> trees = new ArrayList<>();

    public static RandomForestClassifier fit(double[][] x, boolean[] y, ArgusProperties.Ranker.Forest settings) {
        if (x.length == 0) {
            throw new IllegalArgumentException("Cannot train a forest without samples");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("Expected " + x.length + " labels, got " + y.length);
        }
        int columns = x[0].length;
        DecisionTree.Settings treeSettings = new DecisionTree.Settings(
                settings.getMaxDepth(),
                settings.getMinSamplesSplit(),
                settings.getMinSamplesLeaf(),
                Math.max(1, (int) Math.floor(Math.sqrt(columns))));

        List<DecisionTree> grown = IntStream.range(0, settings.getTrees())
                .parallel()
                .mapToObj(i -> {
                    Random random = new Random(settings.getSeed() + i);
                    int[] bootstrap = new int[x.length];
                    for (int s = 0; s < bootstrap.length; s++) {
                        bootstrap[s] = random.nextInt(x.length);
                    }
                    return DecisionTree.grow(x, y, bootstrap, treeSettings, random);
                })
                .collect(Collectors.toList());
        return new RandomForestClassifier(columns, grown);
    }

    /**
     * Mean positive-class probability across trees.
     */
    public double predictProbability(double[] row) {
        if (row.length != featureCount) {
            throw new IllegalArgumentException(
                    "Expected " + featureCount + " features, got " + row.length);
        }
        double sum = 0;
        for (DecisionTree tree : trees) {
            sum += tree.predict(row);
        }
        return trees.isEmpty() ? 0.0 : sum / trees.size();
    }

    public boolean predict(double[] row) {
        return predictProbability(row) >= 0.5;
    }

    @JsonIgnore
    public int size() {
        return trees.size();
    }
}
