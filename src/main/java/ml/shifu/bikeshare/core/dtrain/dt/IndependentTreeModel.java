/*
 * Copyright [2013-2015] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.bikeshare.core.dtrain.dt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * {@link IndependentTreeModel} is a light GBT model which only depends on trees and engineered feature names.
 * 
 * <p>
 * Raw score is the weighted sum of tree predicts, {@link #convertToProbability(double)} turns it into the probability
 * of positive label by the loss used in training.
 * 
 * <p>
 * Instance is immutable after training and safe to be shared across threads.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public class IndependentTreeModel {

    private final List<TreeNode> trees;

    private final List<String> featureNames;

    private final String lossType;

    private final Loss loss;

    IndependentTreeModel(List<TreeNode> trees, List<String> featureNames, String lossType) {
        this.trees = Collections.unmodifiableList(copyOf(trees));
        this.featureNames = Collections.unmodifiableList(new ArrayList<String>(featureNames));
        this.lossType = lossType;
        this.loss = GBTTrainer.getLoss(lossType);
    }

    /**
     * Compute raw score of one engineered feature vector.
     * 
     * @param data
     *            feature vector in {@link #getFeatureNames()} order
     * @return raw score
     */
    public double compute(double[] data) {
        if(data.length != featureNames.size()) {
            throw new IllegalArgumentException("Feature vector size " + data.length + " is not the same as model "
                    + "feature size " + featureNames.size());
        }
        double score = 0d;
        for(TreeNode treeNode: trees) {
            score += treeNode.getLearningRate() * treeNode.predict(data);
        }
        return score;
    }

    public double convertToProbability(double score) {
        return loss.convertToProbability(score);
    }

    public double computeProbability(double[] data) {
        return convertToProbability(compute(data));
    }

    /**
     * Feature importance accumulated over all trees, sorted by importance descending. Features never used in a
     * split are not included.
     * 
     * @return feature name to importance map
     */
    public Map<String, Double> getFeatureImportance() {
        Map<Integer, Double> importances = new HashMap<Integer, Double>();
        for(TreeNode treeNode: trees) {
            for(Entry<Integer, Double> entry: treeNode.computeFeatureImportance().entrySet()) {
                Double current = importances.get(entry.getKey());
                importances.put(entry.getKey(), current == null ? entry.getValue() : current + entry.getValue());
            }
        }

        List<Entry<Integer, Double>> entryList = new ArrayList<Entry<Integer, Double>>(importances.entrySet());
        Collections.sort(entryList, new Comparator<Entry<Integer, Double>>() {
            @Override
            public int compare(Entry<Integer, Double> o1, Entry<Integer, Double> o2) {
                return o2.getValue().compareTo(o1.getValue());
            }
        });

        Map<String, Double> result = new LinkedHashMap<String, Double>();
        for(Entry<Integer, Double> entry: entryList) {
            result.put(featureNames.get(entry.getKey()), entry.getValue());
        }
        return result;
    }

    /**
     * @return deep copies of the trees, changes on them never reach the model
     */
    public List<TreeNode> getTrees() {
        return copyOf(trees);
    }

    private static List<TreeNode> copyOf(List<TreeNode> trees) {
        List<TreeNode> copies = new ArrayList<TreeNode>(trees.size());
        for(TreeNode tree: trees) {
            copies.add(new TreeNode(tree));
        }
        return copies;
    }

    public int getTreeNum() {
        return trees.size();
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public String getLossType() {
        return lossType;
    }

}
