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

import java.util.HashMap;
import java.util.Map;

/**
 * Wrapper of one tree with its id and weight in the ensemble.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public class TreeNode {

    private final int treeId;

    private final Node node;

    /**
     * # of nodes in current tree, root included.
     */
    private int nodeNum;

    /**
     * Weight of such tree when summing scores, 1 for the first GBT tree and learning rate for others.
     */
    private final double learningRate;

    public TreeNode(int treeId, Node node, double learningRate) {
        this.treeId = treeId;
        this.node = node;
        this.nodeNum = 1;
        this.learningRate = learningRate;
    }

    /**
     * Deep copy of the tree, later changes on either side are not visible to the other.
     */
    TreeNode(TreeNode other) {
        this.treeId = other.treeId;
        this.node = new Node(other.node);
        this.nodeNum = other.nodeNum;
        this.learningRate = other.learningRate;
    }

    public Node getNode() {
        return node;
    }

    public void incrNodeNum() {
        nodeNum += 1;
    }

    /**
     * @return # of leaves, each split turns one leaf into two.
     */
    public int getLeafNum() {
        return (nodeNum + 1) / 2;
    }

    public double getLearningRate() {
        return learningRate;
    }

    /**
     * Walk down from root by the split of each node until a leaf.
     * 
     * @param data
     *            the engineered feature vector
     * @return predict value of the leaf
     */
    public double predict(double[] data) {
        Node currNode = this.node;
        while(currNode.getSplit() != null && !currNode.isRealLeaf()) {
            Split split = currNode.getSplit();
            if(split.isLeft(data[split.getColumnNum()])) {
                currNode = currNode.getLeft();
            } else {
                currNode = currNode.getRight();
            }
        }
        return currNode.getPredict() == null ? 0d : currNode.getPredict().getPredict();
    }

    /**
     * Compute tree model feature importance by accumulating gain. Check scikit-learn for details:
     * https://github.com/scikit-learn/scikit-learn/blob/master/sklearn/tree/_tree.pyx#L1056
     * 
     * @return a map with (column_id, feature_importance.)
     */
    public Map<Integer, Double> computeFeatureImportance() {
        Map<Integer, Double> importances = new HashMap<Integer, Double>();
        double rootWgtCnt = node.getWgtCnt();
        if(rootWgtCnt > 0d) {
            preOrder(importances, node, rootWgtCnt);
        }
        return importances;
    }

    private void preOrder(Map<Integer, Double> importances, Node node, double rootWgtCnt) {
        if(node == null) {
            return;
        }
        computeImportance(importances, node, rootWgtCnt);
        preOrder(importances, node.getLeft(), rootWgtCnt);
        preOrder(importances, node.getRight(), rootWgtCnt);
    }

    private void computeImportance(Map<Integer, Double> importances, Node node, double rootWgtCnt) {
        if(!node.isRealLeaf()) {
            int featureId = node.getSplit().getColumnNum();
            // gain * wgtcount is count* impurity - leftCount * leftImpurity - rightCount * rightImpurity
            double contribution = (node.getGain() * node.getWgtCnt()) / rootWgtCnt;
            Double current = importances.get(featureId);
            importances.put(featureId, current == null ? contribution : current + contribution);
        }
    }

    @Override
    public String toString() {
        return "TreeNode [treeId=" + treeId + ", node=" + node.getId() + ", nodeNum=" + nodeNum + "]";
    }

}
