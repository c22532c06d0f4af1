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

/**
 * Binary tree node. Node ids are like heap indexes: root is 1, left child of node i is 2i and right child is 2i+1.
 * 
 * <p>
 * Stats fields like {@link #leftPredict} and {@link #wgtCntRatio} are only needed when growing the tree.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public class Node {

    public static final int ROOT_INDEX = 1;

    private final int id;

    /**
     * Split of current node, null for leaf node.
     */
    private Split split;

    private Node left;

    private Node right;

    private Predict predict;

    private double impurity;

    private double gain;

    /**
     * Weighted count of records in current node.
     */
    private double wgtCnt;

    /**
     * {@link #wgtCnt} divided by weighted count of root node.
     */
    private double wgtCntRatio = 1d;

    private Predict leftPredict;

    private double leftImpurity;

    private Predict rightPredict;

    private double rightImpurity;

    public Node(int id) {
        this.id = id;
    }

    public Node(int id, Predict predict, double impurity) {
        this.id = id;
        this.predict = predict;
        this.impurity = impurity;
    }

    /**
     * Deep copy of a sub tree. {@link Split} and {@link Predict} are immutable and shared.
     */
    Node(Node other) {
        this.id = other.id;
        this.split = other.split;
        this.left = other.left == null ? null : new Node(other.left);
        this.right = other.right == null ? null : new Node(other.right);
        this.predict = other.predict;
        this.impurity = other.impurity;
        this.gain = other.gain;
        this.wgtCnt = other.wgtCnt;
        this.wgtCntRatio = other.wgtCntRatio;
        this.leftPredict = other.leftPredict;
        this.leftImpurity = other.leftImpurity;
        this.rightPredict = other.rightPredict;
        this.rightImpurity = other.rightImpurity;
    }

    public int getId() {
        return id;
    }

    public Split getSplit() {
        return split;
    }

    public void setSplit(Split split) {
        this.split = split;
    }

    public Node getLeft() {
        return left;
    }

    public void setLeft(Node left) {
        this.left = left;
    }

    public Node getRight() {
        return right;
    }

    public void setRight(Node right) {
        this.right = right;
    }

    public Predict getPredict() {
        return predict;
    }

    public void setPredict(Predict predict) {
        this.predict = predict;
    }

    public double getImpurity() {
        return impurity;
    }

    public void setImpurity(double impurity) {
        this.impurity = impurity;
    }

    public double getGain() {
        return gain;
    }

    public void setGain(double gain) {
        this.gain = gain;
    }

    public double getWgtCnt() {
        return wgtCnt;
    }

    public void setWgtCnt(double wgtCnt) {
        this.wgtCnt = wgtCnt;
    }

    public double getWgtCntRatio() {
        return wgtCntRatio;
    }

    public void setWgtCntRatio(double wgtCntRatio) {
        this.wgtCntRatio = wgtCntRatio;
    }

    public Predict getLeftPredict() {
        return leftPredict;
    }

    public void setLeftPredict(Predict leftPredict) {
        this.leftPredict = leftPredict;
    }

    public double getLeftImpurity() {
        return leftImpurity;
    }

    public void setLeftImpurity(double leftImpurity) {
        this.leftImpurity = leftImpurity;
    }

    public Predict getRightPredict() {
        return rightPredict;
    }

    public void setRightPredict(Predict rightPredict) {
        this.rightPredict = rightPredict;
    }

    public double getRightImpurity() {
        return rightImpurity;
    }

    public void setRightImpurity(double rightImpurity) {
        this.rightImpurity = rightImpurity;
    }

    /**
     * Check if node is real for leaf, a node without any child is a leaf.
     * 
     * @return if it is real leaf node
     */
    public boolean isRealLeaf() {
        return this.left == null && this.right == null;
    }

    /**
     * Depth of node id, root is in level 1.
     * 
     * @param nodeIndex
     *            the node id
     * @return the level
     */
    public static int indexToLevel(int nodeIndex) {
        return Integer.numberOfTrailingZeros(Integer.highestOneBit(nodeIndex)) + 1;
    }

    public static int leftIndex(int id) {
        return id << 1;
    }

    public static int rightIndex(int id) {
        return (id << 1) + 1;
    }

    @Override
    public String toString() {
        return "Node [id=" + id + ", split=" + split + ", predict=" + predict + ", gain=" + gain + ", wgtCnt="
                + wgtCnt + "]";
    }

    /**
     * Print tree structure under current node, one node per line.
     * 
     * @return the tree in string
     */
    public String toTree() {
        StringBuilder sb = new StringBuilder();
        toTree(sb, this, 0);
        return sb.toString();
    }

    private static void toTree(StringBuilder sb, Node node, int indent) {
        if(node == null) {
            return;
        }
        for(int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        if(node.isRealLeaf()) {
            sb.append("leaf ").append(node.id).append(": ")
                    .append(node.predict == null ? 0d : node.predict.getPredict()).append('\n');
        } else {
            sb.append("node ").append(node.id).append(": f").append(node.split.getColumnNum()).append(" < ")
                    .append(node.split.getThreshold()).append('\n');
            toTree(sb, node.left, indent + 1);
            toTree(sb, node.right, indent + 1);
        }
    }

}
