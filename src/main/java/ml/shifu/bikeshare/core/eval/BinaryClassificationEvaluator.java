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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.BinaryClassificationMetrics;
import ml.shifu.bikeshare.container.ConfusionMatrixObject;
import ml.shifu.bikeshare.container.PerformanceObject;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.core.FittedPipeline;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.Constants;

/**
 * Evaluate a {@link FittedPipeline} on labeled records.
 * 
 * <p>
 * AUC is the trapezoid area of the ROC curve built by walking scores descending, records with the same score are
 * added to one point. F1, precision, recall and accuracy use the predicted label, which is true if probability is over
 * the threshold.
 */
public class BinaryClassificationEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(BinaryClassificationEvaluator.class);

    /**
     * Probability is cut into [EPSILON, 1 - EPSILON] in log loss.
     */
    private static final double EPSILON = 1e-15;

    private final double threshold;

    public BinaryClassificationEvaluator() {
        this(Constants.DEFAULT_PROBABILITY_THRESHOLD);
    }

    public BinaryClassificationEvaluator(double threshold) {
        this.threshold = threshold;
    }

    public BinaryClassificationMetrics evaluate(FittedPipeline pipeline, List<RentalRecord> testSet) {
        return evaluate(score(pipeline, testSet));
    }

    /**
     * Score labeled records by the pipeline.
     * 
     * @param pipeline
     *            fitted pipeline
     * @param testSet
     *            records with labels
     * @return scored records in test set order
     */
    public List<ScoredRecord> score(FittedPipeline pipeline, List<RentalRecord> testSet) {
        if(testSet == null || testSet.isEmpty()) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_NO_EVAL_SET);
        }

        List<ScoredRecord> scored = new ArrayList<ScoredRecord>(testSet.size());
        for(RentalRecord record: testSet) {
            if(!record.hasRentalType()) {
                throw new BikeShareException(BikeShareErrorCode.ERROR_INVALID_TARGET_VALUE,
                        "Record without label cannot be evaluated: " + record);
            }
            double score = pipeline.score(record);
            scored.add(new ScoredRecord(score, pipeline.convertToProbability(score), record.getRentalType()));
        }
        LOG.debug("{} records are scored.", scored.size());
        return scored;
    }

    /**
     * Compute metrics of scored records.
     */
    public BinaryClassificationMetrics evaluate(List<ScoredRecord> scored) {
        long positives = 0L;
        for(ScoredRecord record: scored) {
            if(record.label) {
                positives += 1;
            }
        }
        long negatives = scored.size() - positives;
        if(positives == 0L || negatives == 0L) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_EVAL_SINGLE_CLASS, "AUC is undefined with "
                    + positives + " positive and " + negatives + " negative records in evaluation data.");
        }

        // points are ordered by recall ascending too, so the same list serves as PR curve
        List<PerformanceObject> curve = buildRoc(scored, positives, negatives);
        double auc = AreaUnderCurve.ofRoc(curve);
        LOG.debug("Area under PR curve: {}", AreaUnderCurve.ofPr(curve));

        ConfusionMatrixObject cmo = new ConfusionMatrixObject();
        cmo.setScore(threshold);
        double logLoss = 0d;
        for(ScoredRecord record: scored) {
            boolean predicted = record.probability > threshold;
            if(record.label) {
                if(predicted) {
                    cmo.setTp(cmo.getTp() + 1d);
                } else {
                    cmo.setFn(cmo.getFn() + 1d);
                }
            } else {
                if(predicted) {
                    cmo.setFp(cmo.getFp() + 1d);
                } else {
                    cmo.setTn(cmo.getTn() + 1d);
                }
            }
            double p = Math.max(EPSILON, Math.min(1d - EPSILON, record.probability));
            logLoss -= record.label ? Math.log(p) : Math.log(1d - p);
        }
        logLoss /= scored.size();

        double precision = safeDivide(cmo.getTp(), cmo.getTp() + cmo.getFp());
        double recall = safeDivide(cmo.getTp(), cmo.getTp() + cmo.getFn());
        double f1 = safeDivide(2d * precision * recall, precision + recall);
        double accuracy = (cmo.getTp() + cmo.getTn()) / cmo.getTotal();

        BinaryClassificationMetrics metrics = new BinaryClassificationMetrics(auc, f1, accuracy, precision, recall,
                logLoss, cmo);
        LOG.info("Evaluation on {} records: {}", scored.size(), metrics);
        return metrics;
    }

    /**
     * ROC points from (0, 0) to (1, 1), ordered by fpr ascending.
     */
    private static List<PerformanceObject> buildRoc(List<ScoredRecord> scored, long positives, long negatives) {
        List<ScoredRecord> sorted = new ArrayList<ScoredRecord>(scored);
        Collections.sort(sorted, new Comparator<ScoredRecord>() {
            @Override
            public int compare(ScoredRecord o1, ScoredRecord o2) {
                return Double.compare(o2.score, o1.score);
            }
        });

        List<PerformanceObject> roc = new ArrayList<PerformanceObject>();
        ConfusionMatrixObject cmo = new ConfusionMatrixObject();
        cmo.setTn(negatives);
        cmo.setFn(positives);
        cmo.setScore(Double.POSITIVE_INFINITY);
        roc.add(setPerformanceObject(cmo));

        int i = 0;
        while(i < sorted.size()) {
            double score = sorted.get(i).score;
            // records with same score move together
            while(i < sorted.size() && Double.compare(sorted.get(i).score, score) == 0) {
                if(sorted.get(i).label) {
                    cmo.setTp(cmo.getTp() + 1d);
                    cmo.setFn(cmo.getFn() - 1d);
                } else {
                    cmo.setFp(cmo.getFp() + 1d);
                    cmo.setTn(cmo.getTn() - 1d);
                }
                i += 1;
            }
            cmo.setScore(score);
            roc.add(setPerformanceObject(cmo));
        }
        return roc;
    }

    static PerformanceObject setPerformanceObject(ConfusionMatrixObject confMatObject) {
        PerformanceObject po = new PerformanceObject();
        po.binLowestScore = confMatObject.getScore();
        po.tp = confMatObject.getTp();
        po.tn = confMatObject.getTn();
        po.fp = confMatObject.getFp();
        po.fn = confMatObject.getFn();

        // Action Rate, TP + FP / Total;
        po.actionRate = (confMatObject.getTp() + confMatObject.getFp()) / confMatObject.getTotal();
        // recall = TP / (TP+FN)
        po.recall = safeDivide(confMatObject.getTp(), confMatObject.getTp() + confMatObject.getFn());
        // precision = TP / (TP+FP), 1 if nothing is predicted as positive
        po.precision = (confMatObject.getTp() + confMatObject.getFp()) == 0d ? 1d : confMatObject.getTp()
                / (confMatObject.getTp() + confMatObject.getFp());
        // FPR, False Positive Rate (fp/(fp+tn))
        po.fpr = safeDivide(confMatObject.getFp(), confMatObject.getFp() + confMatObject.getTn());
        return po;
    }

    private static double safeDivide(double numerator, double denominator) {
        return denominator == 0d ? 0d : numerator / denominator;
    }

    /**
     * Score, probability and true label of one record.
     */
    /**
     * Raw score, probability and true label of one record.
     */
    public static class ScoredRecord {

        final double score;

        final double probability;

        final boolean label;

        public ScoredRecord(double score, double probability, boolean label) {
            this.score = score;
            this.probability = probability;
            this.label = label;
        }
    }

}
