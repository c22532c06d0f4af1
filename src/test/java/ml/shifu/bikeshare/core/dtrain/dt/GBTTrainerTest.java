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

import java.util.Arrays;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.bikeshare.container.FeatureMatrix;
import ml.shifu.bikeshare.container.obj.ModelTrainConf;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.Constants;

public class GBTTrainerTest {

    private static final String LABEL = "RentalType";

    /**
     * Label is true when x &gt;= 50, noise has no relation with label.
     */
    private static FeatureMatrix separable() {
        FeatureMatrix matrix = new FeatureMatrix(Arrays.asList("x", "noise"), LABEL);
        for(int i = 0; i < 100; i++) {
            matrix.addRow(new double[] { i, (i * 37) % 11 }, i >= 50);
        }
        return matrix;
    }

    private static ModelTrainConf conf(int treeNum) {
        ModelTrainConf trainConf = new ModelTrainConf();
        trainConf.getParams().put(Constants.TREE_NUM, treeNum);
        return trainConf;
    }

    @Test
    public void testSeparable() {
        IndependentTreeModel model = new GBTTrainer(conf(20)).train(separable(), LABEL);
        Assert.assertTrue(model.getTreeNum() > 1);
        Assert.assertEquals(model.getLossType(), "log");
        Assert.assertEquals(model.getFeatureNames(), Arrays.asList("x", "noise"));

        Assert.assertTrue(model.computeProbability(new double[] { 10d, 3d }) < 0.5d);
        Assert.assertTrue(model.computeProbability(new double[] { 49d, 3d }) < 0.5d);
        Assert.assertTrue(model.computeProbability(new double[] { 50d, 3d }) > 0.5d);
        Assert.assertTrue(model.computeProbability(new double[] { 1000d, 3d }) > 0.5d);

        TreeNode first = model.getTrees().get(0);
        Assert.assertEquals(first.getLearningRate(), 1d);
        Assert.assertEquals(first.getNode().getSplit().getColumnNum(), 0);
        Assert.assertEquals(first.getNode().getSplit().getThreshold(), 49.5d, 1e-9);
        Assert.assertEquals(model.getTrees().get(1).getLearningRate(), 0.2d, 1e-9);

        Map<String, Double> importance = model.getFeatureImportance();
        Assert.assertEquals(importance.keySet().iterator().next(), "x");
    }

    @Test
    public void testDeterministic() {
        ModelTrainConf trainConf = conf(10);
        trainConf.getParams().put(Constants.BAGGING_SAMPLE_RATE, 0.7d);
        IndependentTreeModel first = new GBTTrainer(trainConf).train(separable(), LABEL);
        IndependentTreeModel second = new GBTTrainer(trainConf).train(separable(), LABEL);
        Assert.assertEquals(first.getTreeNum(), second.getTreeNum());
        for(int i = 0; i < 100; i += 7) {
            double[] row = new double[] { i, i % 5 };
            Assert.assertEquals(first.compute(row), second.compute(row));
        }
    }

    @Test
    public void testMaxLeaves() {
        ModelTrainConf trainConf = conf(5);
        trainConf.getParams().put(Constants.MAX_LEAVES, 2);
        trainConf.getParams().put(Constants.MIN_INSTANCES_PER_NODE, 1);
        FeatureMatrix matrix = new FeatureMatrix(Arrays.asList("x"), LABEL);
        for(int i = 0; i < 60; i++) {
            matrix.addRow(new double[] { i }, (i / 10) % 2 == 0);
        }
        for(TreeNode tree: new GBTTrainer(trainConf).train(matrix, LABEL).getTrees()) {
            Assert.assertTrue(tree.getLeafNum() <= 2, tree.toString());
        }
    }

    @Test
    public void testMaxDepthOne() {
        ModelTrainConf trainConf = conf(5);
        trainConf.getParams().put(Constants.MAX_DEPTH, 1);
        IndependentTreeModel model = new GBTTrainer(trainConf).train(separable(), LABEL);
        // a root only tree cannot improve, training stops after it
        Assert.assertEquals(model.getTreeNum(), 1);
        Assert.assertTrue(model.getTrees().get(0).getNode().isRealLeaf());
        Assert.assertTrue(model.getFeatureImportance().isEmpty());
    }

    @Test
    public void testSingleClass() {
        FeatureMatrix matrix = new FeatureMatrix(Arrays.asList("x"), LABEL);
        for(int i = 0; i < 30; i++) {
            matrix.addRow(new double[] { i }, true);
        }
        IndependentTreeModel model = new GBTTrainer(conf(10)).train(matrix, LABEL);
        Assert.assertEquals(model.getTreeNum(), 1);
        Assert.assertTrue(model.computeProbability(new double[] { 5d }) > 0.5d);
    }

    @Test
    public void testSquaredLoss() {
        ModelTrainConf trainConf = conf(10);
        trainConf.getParams().put(Constants.LOSS, "squared");
        trainConf.getParams().put(Constants.IMPURITY, "variance");
        IndependentTreeModel model = new GBTTrainer(trainConf).train(separable(), LABEL);
        Assert.assertEquals(model.computeProbability(new double[] { 90d, 0d }), 1d, 1e-9);
        Assert.assertEquals(model.computeProbability(new double[] { 5d, 0d }), 0d, 1e-9);
    }

    @Test
    public void testLogLoss() {
        Loss loss = GBTTrainer.getLoss("log");
        Assert.assertEquals(loss.computeGradient(0d, 1f), -1d, 1e-9);
        Assert.assertEquals(loss.computeGradient(0d, 0f), 1d, 1e-9);
        Assert.assertEquals(loss.computeError(0d, 1f), Math.log(2d), 1e-9);
        Assert.assertEquals(loss.convertToProbability(0d), 0.5d, 1e-9);
        Assert.assertEquals(loss.convertToProbability(-1000d), 0d, 1e-9);
        Assert.assertEquals(loss.convertToProbability(1000d), 1d, 1e-9);
    }

    @Test
    public void testMissingLabelColumn() {
        try {
            new GBTTrainer(conf(5)).train(separable(), "Label");
            Assert.fail("Label column is not in the matrix.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_NO_TARGET_COLUMN);
        }
    }

    @Test
    public void testEmptyData() {
        try {
            new GBTTrainer(conf(5)).train(new FeatureMatrix(Arrays.asList("x"), LABEL), LABEL);
            Assert.fail("Empty data cannot be trained.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_NO_TRAINING_DATA);
        }
    }

    @Test
    public void testInvalidParams() {
        ModelTrainConf trainConf = conf(0);
        trainConf.getParams().put(Constants.LEARNING_RATE, 1.5d);
        try {
            new GBTTrainer(trainConf);
            Assert.fail("Invalid params should be rejected.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION);
            Assert.assertTrue(e.getMessage().contains(Constants.TREE_NUM));
            Assert.assertTrue(e.getMessage().contains(Constants.LEARNING_RATE));
        }
    }

    @Test(expectedExceptions = BikeShareException.class)
    public void testUnknownLoss() {
        GBTTrainer.getLoss("hinge");
    }

}
