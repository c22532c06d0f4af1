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
package ml.shifu.bikeshare.core.eval;

import java.util.ArrayList;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.bikeshare.container.BinaryClassificationMetrics;
import ml.shifu.bikeshare.container.ConfusionMatrixObject;
import ml.shifu.bikeshare.container.PerformanceObject;
import ml.shifu.bikeshare.container.obj.ModelNormalizeConf;
import ml.shifu.bikeshare.container.obj.ModelTrainConf;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.core.FittedPipeline;
import ml.shifu.bikeshare.core.dtrain.dt.GBTTrainer;
import ml.shifu.bikeshare.core.eval.BinaryClassificationEvaluator.ScoredRecord;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.core.norm.FeaturePipeline;
import ml.shifu.bikeshare.core.norm.FeatureTransformer;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.Constants;
import ml.shifu.bikeshare.util.RentalDataGenerator;

public class BinaryClassificationEvaluatorTest {

    private final BinaryClassificationEvaluator evaluator = new BinaryClassificationEvaluator();

    private static List<ScoredRecord> scored(double[] scores, boolean[] labels) {
        List<ScoredRecord> records = new ArrayList<ScoredRecord>();
        for(int i = 0; i < scores.length; i++) {
            records.add(new ScoredRecord(scores[i], scores[i], labels[i]));
        }
        return records;
    }

    @Test
    public void testPerfectRanking() {
        BinaryClassificationMetrics metrics = evaluator.evaluate(scored(new double[] { 0.1d, 0.9d, 0.3d, 0.8d },
                new boolean[] { false, true, false, true }));
        Assert.assertEquals(metrics.getAuc(), 1d, 1e-9);
        Assert.assertEquals(metrics.getF1Score(), 1d, 1e-9);
        Assert.assertEquals(metrics.getAccuracy(), 1d, 1e-9);
    }

    @Test
    public void testInverseRanking() {
        BinaryClassificationMetrics metrics = evaluator.evaluate(scored(new double[] { 0.9d, 0.1d, 0.8d, 0.3d },
                new boolean[] { false, true, false, true }));
        Assert.assertEquals(metrics.getAuc(), 0d, 1e-9);
        // nothing is predicted right
        Assert.assertEquals(metrics.getF1Score(), 0d, 1e-9);
        Assert.assertEquals(metrics.getAccuracy(), 0d, 1e-9);
    }

    @Test
    public void testTiedScores() {
        BinaryClassificationMetrics metrics = evaluator.evaluate(scored(new double[] { 0.4d, 0.4d, 0.4d, 0.4d },
                new boolean[] { false, true, false, true }));
        Assert.assertEquals(metrics.getAuc(), 0.5d, 1e-9);
        // 0.4 is not larger than 0.5, all predicted as false
        Assert.assertEquals(metrics.getRecall(), 0d, 1e-9);
        Assert.assertEquals(metrics.getF1Score(), 0d, 1e-9);
        Assert.assertEquals(metrics.getAccuracy(), 0.5d, 1e-9);
    }

    @Test
    public void testConfusionMatrix() {
        BinaryClassificationMetrics metrics = evaluator.evaluate(scored(new double[] { 0.9d, 0.4d, 0.6d, 0.1d },
                new boolean[] { true, true, false, false }));
        ConfusionMatrixObject cmo = metrics.getConfusionMatrix();
        Assert.assertEquals(cmo.getTp(), 1d, 1e-9);
        Assert.assertEquals(cmo.getFn(), 1d, 1e-9);
        Assert.assertEquals(cmo.getFp(), 1d, 1e-9);
        Assert.assertEquals(cmo.getTn(), 1d, 1e-9);
        Assert.assertEquals(metrics.getPrecision(), 0.5d, 1e-9);
        Assert.assertEquals(metrics.getRecall(), 0.5d, 1e-9);
        Assert.assertEquals(metrics.getF1Score(), 0.5d, 1e-9);
        Assert.assertEquals(metrics.getAuc(), 0.75d, 1e-9);

        double expectedLogLoss = -(Math.log(0.9d) + Math.log(0.4d) + Math.log(0.4d) + Math.log(0.9d)) / 4d;
        Assert.assertEquals(metrics.getLogLoss(), expectedLogLoss, 1e-9);

        // returned matrix is a copy
        cmo.setTp(100d);
        Assert.assertEquals(metrics.getConfusionMatrix().getTp(), 1d, 1e-9);
    }

    @Test
    public void testThreshold() {
        BinaryClassificationMetrics metrics = new BinaryClassificationEvaluator(0.3d).evaluate(scored(new double[] {
                0.9d, 0.4d, 0.6d, 0.1d }, new boolean[] { true, true, false, false }));
        Assert.assertEquals(metrics.getRecall(), 1d, 1e-9);
        Assert.assertEquals(metrics.getPrecision(), 2d / 3d, 1e-9);
    }

    @Test
    public void testSingleClass() {
        try {
            evaluator.evaluate(scored(new double[] { 0.9d, 0.4d }, new boolean[] { true, true }));
            Assert.fail("AUC is undefined with one class.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_EVAL_SINGLE_CLASS);
        }
    }

    @Test
    public void testEmptyTestSet() {
        try {
            evaluator.evaluate(null, new ArrayList<RentalRecord>());
            Assert.fail("Empty test set cannot be evaluated.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_NO_EVAL_SET);
        }
    }

    @Test
    public void testScoreThenEvaluate() {
        List<RentalRecord> trainSet = RentalDataGenerator.generate(300, 5L);
        FeatureTransformer transformer = new FeaturePipeline(new ModelNormalizeConf()).fit(trainSet);
        ModelTrainConf trainConf = new ModelTrainConf();
        trainConf.getParams().put(Constants.TREE_NUM, 5);
        FittedPipeline pipeline = new FittedPipeline(transformer, new GBTTrainer(trainConf).train(
                transformer.transform(trainSet, Constants.TARGET_COLUMN_NAME), Constants.TARGET_COLUMN_NAME));

        List<RentalRecord> testSet = RentalDataGenerator.generate(50, 6L);
        List<ScoredRecord> scored = evaluator.score(pipeline, testSet);
        Assert.assertEquals(scored.size(), testSet.size());
        for(int i = 0; i < testSet.size(); i++) {
            double score = pipeline.score(testSet.get(i));
            Assert.assertEquals(scored.get(i).score, score, 0d);
            Assert.assertEquals(scored.get(i).probability, pipeline.convertToProbability(score), 0d);
            Assert.assertEquals(scored.get(i).label, testSet.get(i).getRentalType().booleanValue());
        }

        BinaryClassificationMetrics inTwoSteps = evaluator.evaluate(scored);
        BinaryClassificationMetrics inOneStep = evaluator.evaluate(pipeline, testSet);
        Assert.assertEquals(inTwoSteps.getAuc(), inOneStep.getAuc(), 0d);
        Assert.assertEquals(inTwoSteps.getLogLoss(), inOneStep.getLogLoss(), 0d);

        List<RentalRecord> unlabeled = new ArrayList<RentalRecord>();
        unlabeled.add(RentalRecord.builder().season(1).month(1).hour(8).weatherCondition(1).build());
        try {
            evaluator.score(pipeline, unlabeled);
            Assert.fail("Record without label cannot be scored for evaluation.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_INVALID_TARGET_VALUE);
        }
    }

    @Test
    public void testPerformanceObject() {
        ConfusionMatrixObject cmo = new ConfusionMatrixObject();
        cmo.setTp(3d);
        cmo.setFp(1d);
        cmo.setTn(4d);
        cmo.setFn(2d);
        cmo.setScore(0.7d);
        PerformanceObject po = BinaryClassificationEvaluator.setPerformanceObject(cmo);
        Assert.assertEquals(po.binLowestScore, 0.7d, 1e-9);
        Assert.assertEquals(po.actionRate, 0.4d, 1e-9);
        Assert.assertEquals(po.recall, 0.6d, 1e-9);
        Assert.assertEquals(po.precision, 0.75d, 1e-9);
        Assert.assertEquals(po.fpr, 0.2d, 1e-9);
    }

}
