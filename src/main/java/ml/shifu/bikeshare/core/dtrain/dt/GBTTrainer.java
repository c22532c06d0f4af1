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
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Random;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.FeatureMatrix;
import ml.shifu.bikeshare.container.obj.ModelTrainConf;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.Constants;

/**
 * In-memory gradient boost decision tree trainer.
 * 
 * <p>
 * Each feature is cut into bins firstly, bin statistics of residuals are collected per tree node and
 * {@link Impurity} picks the best split. Trees are built leaf-wise: nodes wait in a priority queue ordered by
 * {@code wgtCntRatio * gain} and the best one is split until {@link #maxLeaves} is reached or no node can be split.
 * Nodes in level {@link #maxDepth} are not split.
 * 
 * <p>
 * The first tree fits the negative gradient at score 0 and is added without learning rate, later trees are added
 * with learning rate.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public class GBTTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(GBTTrainer.class);

    private final int treeNum;

    private final double learningRate;

    private final int maxDepth;

    private final int maxLeaves;

    private final int maxBins;

    private final double baggingSampleRate;

    private final long baggingSampleSeed;

    private final String lossType;

    private final Loss loss;

    private final Impurity impurity;

    public GBTTrainer(ModelTrainConf trainConf) {
        this.treeNum = trainConf.getIntParam(Constants.TREE_NUM, Constants.DEFAULT_TREE_NUM);
        this.learningRate = trainConf.getDoubleParam(Constants.LEARNING_RATE, Constants.DEFAULT_LEARNING_RATE);
        this.maxDepth = trainConf.getIntParam(Constants.MAX_DEPTH, Constants.DEFAULT_MAX_DEPTH);
        this.maxLeaves = trainConf.getIntParam(Constants.MAX_LEAVES, Constants.DEFAULT_MAX_LEAVES);
        this.maxBins = trainConf.getIntParam(Constants.MAX_BINS, Constants.DEFAULT_MAX_BINS);
        this.baggingSampleRate = trainConf.getDoubleParam(Constants.BAGGING_SAMPLE_RATE,
                Constants.DEFAULT_BAGGING_SAMPLE_RATE);
        this.baggingSampleSeed = trainConf.getLongParam(Constants.BAGGING_SAMPLE_SEED, Constants.DEFAULT_SEED);
        this.lossType = trainConf.getStringParam(Constants.LOSS, Constants.DEFAULT_LOSS);
        int minInstancesPerNode = trainConf.getIntParam(Constants.MIN_INSTANCES_PER_NODE,
                Constants.DEFAULT_MIN_INSTANCES_PER_NODE);
        double minInfoGain = trainConf.getDoubleParam(Constants.MIN_INFO_GAIN, Constants.DEFAULT_MIN_INFO_GAIN);
        String impurityType = trainConf.getStringParam(Constants.IMPURITY, Constants.DEFAULT_IMPURITY);

        validateParams(minInstancesPerNode);
        this.loss = getLoss(lossType);
        this.impurity = Impurity.of(impurityType, minInstancesPerNode, minInfoGain);

        LOG.info("Trainer init params: treeNum={}, learningRate={}, maxDepth={}, maxLeaves={}, "
                + "minInstancesPerNode={}, minInfoGain={}, maxBins={}, baggingSampleRate={}, loss={}, impurity={}",
                new Object[] { treeNum, learningRate, maxDepth, maxLeaves, minInstancesPerNode, minInfoGain, maxBins,
                        baggingSampleRate, lossType, impurityType });
    }

    private void validateParams(int minInstancesPerNode) {
        StringBuilder sb = new StringBuilder();
        if(treeNum <= 0) {
            sb.append(Constants.TREE_NUM).append(" should be larger than 0. ");
        }
        if(learningRate <= 0d || learningRate > 1d) {
            sb.append(Constants.LEARNING_RATE).append(" should be in (0, 1]. ");
        }
        if(maxDepth <= 0 || maxDepth > 20) {
            sb.append(Constants.MAX_DEPTH).append(" should be in [1, 20]. ");
        }
        if(maxLeaves < 2) {
            sb.append(Constants.MAX_LEAVES).append(" should be at least 2. ");
        }
        if(maxBins < 2) {
            sb.append(Constants.MAX_BINS).append(" should be at least 2. ");
        }
        if(minInstancesPerNode < 1) {
            sb.append(Constants.MIN_INSTANCES_PER_NODE).append(" should be at least 1. ");
        }
        if(baggingSampleRate <= 0d || baggingSampleRate > 1d) {
            sb.append(Constants.BAGGING_SAMPLE_RATE).append(" should be in (0, 1]. ");
        }
        if(sb.length() > 0) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION, sb.toString().trim());
        }
    }

    static Loss getLoss(String lossType) {
        if(StringUtils.isBlank(lossType) || "log".equalsIgnoreCase(lossType)) {
            return new LogLoss();
        } else if("squared".equalsIgnoreCase(lossType)) {
            return new SquaredLoss();
        }
        throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION, "Loss " + lossType
                + " is not supported, only log and squared.");
    }

    /**
     * Train GBT model.
     * 
     * @param data
     *            engineered training features with labels
     * @param labelColumnName
     *            name of the boolean label column
     * @return the trained model
     */
    public IndependentTreeModel train(FeatureMatrix data, String labelColumnName) {
        if(data == null || StringUtils.isBlank(labelColumnName)
                || !labelColumnName.equalsIgnoreCase(data.getLabelColumnName())) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_NO_TARGET_COLUMN, "Label column " + labelColumnName
                    + " is not found in training data.");
        }
        if(data.getFeatureCount() == 0) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_NO_FEATURE_COLUMN);
        }
        if(data.getRowCount() == 0) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_NO_TRAINING_DATA);
        }

        int rowCount = data.getRowCount();
        int featureCount = data.getFeatureCount();

        List<List<Double>> binBoundaries = new ArrayList<List<Double>>(featureCount);
        for(int i = 0; i < featureCount; i++) {
            binBoundaries.add(FeatureBinning.computeBinBoundary(data.getColumn(i), maxBins));
            LOG.debug("Feature {} has {} bins.", data.getFeatureNames().get(i), binBoundaries.get(i).size());
        }

        int[][] binIndexes = new int[rowCount][featureCount];
        for(int r = 0; r < rowCount; r++) {
            double[] row = data.getRow(r);
            for(int i = 0; i < featureCount; i++) {
                binIndexes[r][i] = FeatureBinning.getBinIndex(row[i], binBoundaries.get(i));
            }
        }

        double[] scores = new double[rowCount];
        double[] residuals = new double[rowCount];
        Random baggingRandom = new Random(baggingSampleSeed);
        List<TreeNode> trees = new ArrayList<TreeNode>(treeNum);
        double trainError = 0d;
        for(int treeId = 0; treeId < treeNum; treeId++) {
            for(int r = 0; r < rowCount; r++) {
                residuals[r] = -loss.computeGradient(scores[r], data.getLabel(r));
            }

            int[] rows = sampleRows(rowCount, baggingRandom);
            double weight = treeId == 0 ? 1d : learningRate;
            TreeNode tree = buildTree(treeId, weight, data, binIndexes, binBoundaries, residuals, rows);
            trees.add(tree);

            trainError = 0d;
            for(int r = 0; r < rowCount; r++) {
                scores[r] += weight * tree.predict(data.getRow(r));
                trainError += loss.computeError(scores[r], data.getLabel(r));
            }
            trainError /= rowCount;
            LOG.debug("Tree {} is done with {} leaves, train error {}.", treeId, tree.getLeafNum(), trainError);
            if(LOG.isTraceEnabled()) {
                LOG.trace("Tree {}:\n{}", treeId, tree.getNode().toTree());
            }

            if(tree.getNode().isRealLeaf()) {
                LOG.warn("Root node of tree {} cannot be split, stop training with {} trees.", treeId, trees.size());
                break;
            }
        }

        IndependentTreeModel model = new IndependentTreeModel(trees, data.getFeatureNames(), lossType);
        LOG.info("Training is done with {} trees on {} records, final train error {}.", trees.size(), rowCount,
                trainError);
        LOG.info("Feature importance: {}", model.getFeatureImportance());
        return model;
    }

    private int[] sampleRows(int rowCount, Random baggingRandom) {
        if(baggingSampleRate >= 1d) {
            return allRows(rowCount);
        }

        int[] sampled = new int[rowCount];
        int size = 0;
        for(int i = 0; i < rowCount; i++) {
            if(baggingRandom.nextDouble() < baggingSampleRate) {
                sampled[size++] = i;
            }
        }
        if(size == 0) {
            // tiny data with tiny rate, fall back to all rows
            return allRows(rowCount);
        }
        int[] rows = new int[size];
        System.arraycopy(sampled, 0, rows, 0, size);
        return rows;
    }

    private static int[] allRows(int rowCount) {
        int[] rows = new int[rowCount];
        for(int i = 0; i < rowCount; i++) {
            rows[i] = i;
        }
        return rows;
    }

    private TreeNode buildTree(int treeId, double weight, FeatureMatrix data, int[][] binIndexes,
            List<List<Double>> binBoundaries, double[] residuals, int[] rootRows) {
        Node root = new Node(Node.ROOT_INDEX);
        TreeNode tree = new TreeNode(treeId, root, weight);

        double sum = 0d;
        for(int r: rootRows) {
            sum += residuals[r];
        }
        double rootWgtCnt = rootRows.length;
        root.setPredict(new Predict(sum / rootWgtCnt));
        root.setWgtCnt(rootWgtCnt);

        PriorityQueue<Node> toSplitQueue = new PriorityQueue<Node>(64, new Comparator<Node>() {
            @Override
            public int compare(Node o1, Node o2) {
                return Double.compare(o2.getWgtCntRatio() * o2.getGain(), o1.getWgtCntRatio() * o1.getGain());
            }
        });
        Map<Integer, int[]> nodeRows = new HashMap<Integer, int[]>();
        nodeRows.put(root.getId(), rootRows);
        offerIfSplittable(toSplitQueue, root, rootRows, binIndexes, binBoundaries, residuals, rootWgtCnt);

        while(!toSplitQueue.isEmpty()) {
            Node doneNode = toSplitQueue.poll();
            if(tree.getLeafNum() + 1 > maxLeaves) {
                // max leaves reached, current node and the ones left in queue are final leaves
                doneNode.setSplit(null);
                for(Node node: toSplitQueue) {
                    node.setSplit(null);
                }
                toSplitQueue.clear();
                break;
            }

            int[] rows = nodeRows.remove(doneNode.getId());
            Split split = doneNode.getSplit();
            int leftSize = 0;
            for(int r: rows) {
                if(split.isLeft(data.getRow(r)[split.getColumnNum()])) {
                    leftSize += 1;
                }
            }
            int[] leftRows = new int[leftSize];
            int[] rightRows = new int[rows.length - leftSize];
            int l = 0, k = 0;
            for(int r: rows) {
                if(split.isLeft(data.getRow(r)[split.getColumnNum()])) {
                    leftRows[l++] = r;
                } else {
                    rightRows[k++] = r;
                }
            }

            Node left = new Node(Node.leftIndex(doneNode.getId()), doneNode.getLeftPredict(),
                    doneNode.getLeftImpurity());
            left.setWgtCnt(leftRows.length);
            doneNode.setLeft(left);
            tree.incrNodeNum();

            Node right = new Node(Node.rightIndex(doneNode.getId()), doneNode.getRightPredict(),
                    doneNode.getRightImpurity());
            right.setWgtCnt(rightRows.length);
            doneNode.setRight(right);
            tree.incrNodeNum();

            nodeRows.put(left.getId(), leftRows);
            nodeRows.put(right.getId(), rightRows);
            offerIfSplittable(toSplitQueue, left, leftRows, binIndexes, binBoundaries, residuals, rootWgtCnt);
            offerIfSplittable(toSplitQueue, right, rightRows, binIndexes, binBoundaries, residuals, rootWgtCnt);
        }
        return tree;
    }

    private void offerIfSplittable(PriorityQueue<Node> toSplitQueue, Node node, int[] rows, int[][] binIndexes,
            List<List<Double>> binBoundaries, double[] residuals, double rootWgtCnt) {
        if(Node.indexToLevel(node.getId()) >= maxDepth) {
            LOG.trace("Node {} is in max depth and set to leaf.", node.getId());
            return;
        }
        GainInfo maxGainInfo = computeBestSplit(rows, binIndexes, binBoundaries, residuals);
        if(maxGainInfo == null) {
            return;
        }
        populateGainInfoToNode(node, maxGainInfo, rootWgtCnt);
        toSplitQueue.offer(node);
    }

    private GainInfo computeBestSplit(int[] rows, int[][] binIndexes, List<List<Double>> binBoundaries,
            double[] residuals) {
        List<GainInfo> gainList = new ArrayList<GainInfo>();
        for(int i = 0; i < binBoundaries.size(); i++) {
            List<Double> binBoundary = binBoundaries.get(i);
            if(binBoundary.size() <= 1) {
                // constant feature
                continue;
            }
            double[] stats = new double[binBoundary.size() * impurity.getStatsSize()];
            for(int r: rows) {
                impurity.featureUpdate(stats, binIndexes[r][i], residuals[r], 1d);
            }
            GainInfo gainInfo = impurity.computeImpurity(stats, i, binBoundary);
            if(gainInfo != null) {
                gainList.add(gainInfo);
            }
        }
        return GainInfo.getGainInfoByMaxGain(gainList);
    }

    private void populateGainInfoToNode(Node doneNode, GainInfo maxGainInfo, double rootWgtCnt) {
        doneNode.setPredict(maxGainInfo.getPredict());
        doneNode.setSplit(maxGainInfo.getSplit());
        doneNode.setGain(maxGainInfo.getGain());
        doneNode.setImpurity(maxGainInfo.getImpurity());
        doneNode.setLeftImpurity(maxGainInfo.getLeftImpurity());
        doneNode.setRightImpurity(maxGainInfo.getRightImpurity());
        doneNode.setLeftPredict(maxGainInfo.getLeftPredict());
        doneNode.setRightPredict(maxGainInfo.getRightPredict());
        doneNode.setWgtCnt(maxGainInfo.getWgtCnt());
        doneNode.setWgtCntRatio(maxGainInfo.getWgtCnt() / rootWgtCnt);
    }

}
