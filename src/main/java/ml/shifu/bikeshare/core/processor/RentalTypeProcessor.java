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
package ml.shifu.bikeshare.core.processor;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.BinaryClassificationMetrics;
import ml.shifu.bikeshare.container.FeatureMatrix;
import ml.shifu.bikeshare.container.PredictionResult;
import ml.shifu.bikeshare.container.TrainTestSplit;
import ml.shifu.bikeshare.container.obj.ModelConfig;
import ml.shifu.bikeshare.container.obj.RentalColumn;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.core.ClassBalanceReporter;
import ml.shifu.bikeshare.core.DataLoader;
import ml.shifu.bikeshare.core.DataSplitter;
import ml.shifu.bikeshare.core.FittedPipeline;
import ml.shifu.bikeshare.core.PredictionEngine;
import ml.shifu.bikeshare.core.dtrain.dt.GBTTrainer;
import ml.shifu.bikeshare.core.dtrain.dt.IndependentTreeModel;
import ml.shifu.bikeshare.core.eval.BinaryClassificationEvaluator;
import ml.shifu.bikeshare.core.eval.BinaryClassificationEvaluator.ScoredRecord;
import ml.shifu.bikeshare.core.norm.FeaturePipeline;
import ml.shifu.bikeshare.core.norm.FeatureTransformer;
import ml.shifu.bikeshare.util.CommonUtils;

/**
 * Whole rental type workflow: load, class balance, split, fit pipeline and train, evaluate, predict examples.
 * Progress is printed to the given console stream, any failure is thrown to the caller.
 */
public class RentalTypeProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(RentalTypeProcessor.class);

    /**
     * Summer working day noon with clear weather.
     */
    public static final RentalRecord EXAMPLE_CLEAR_WEATHER = RentalRecord.builder().season(1).month(6).hour(12)
            .holiday(0).weekday(3).workingDay(1).weatherCondition(1).temperature(18.0f).humidity(75.0f)
            .windspeed(8.0f).build();

    /**
     * Winter working day afternoon with bad weather.
     */
    public static final RentalRecord EXAMPLE_BAD_WEATHER = RentalRecord.builder().season(4).month(12).hour(16)
            .holiday(0).weekday(5).workingDay(1).weatherCondition(4).temperature(-2.0f).humidity(90.0f)
            .windspeed(20.0f).build();

    private final ModelConfig modelConfig;

    private final PrintStream out;

    private List<PredictionResult> examplePredictions = Collections.emptyList();

    public RentalTypeProcessor(ModelConfig modelConfig, PrintStream out) {
        this.modelConfig = modelConfig;
        this.out = out;
    }

    /**
     * Run all steps.
     * 
     * @return evaluation metrics on test partition
     */
    public BinaryClassificationMetrics run() {
        LOG.info("Step Start: rental type prediction");
        long start = System.currentTimeMillis();
        out.println("Предсказание типа аренды велосипеда");

        out.println("Загрузка данных...");
        List<RentalRecord> records = new DataLoader(modelConfig.getDataSet()).load(modelConfig.getDataSet()
                .getDataPath());
        new ClassBalanceReporter(out).report(records);

        out.println("Разделение данных...");
        TrainTestSplit split = new DataSplitter(modelConfig.getSplit()).split(records);

        out.println("Создание пайплайна...");
        FeaturePipeline featurePipeline = new FeaturePipeline(modelConfig.getNormalize());

        out.println("Обучение модели...");
        FittedPipeline pipeline = fit(featurePipeline, split.getTrainSet());

        BinaryClassificationEvaluator evaluator = new BinaryClassificationEvaluator();
        out.println("Выполняем оценку...");
        List<ScoredRecord> scored = evaluator.score(pipeline, split.getTestSet());

        out.println("Оценка качества модели...");
        BinaryClassificationMetrics metrics = evaluator.evaluate(scored);
        out.println(String.format(Locale.ROOT, "AUC: %.2f", metrics.getAuc()));
        out.println(String.format(Locale.ROOT, "F1 Score: %.2f", metrics.getF1Score()));

        out.println("Создаем движок предсказаний...");
        PredictionEngine engine = new PredictionEngine(pipeline);
        List<PredictionResult> results = new ArrayList<PredictionResult>();
        for(RentalRecord example: Arrays.asList(EXAMPLE_CLEAR_WEATHER, EXAMPLE_BAD_WEATHER)) {
            PredictionResult result = engine.predict(example);
            results.add(result);
            out.println(formatExample(example, result));
        }
        this.examplePredictions = Collections.unmodifiableList(results);

        LOG.info("Step Finished: rental type prediction with {} ms", (System.currentTimeMillis() - start));
        return metrics;
    }

    private FittedPipeline fit(FeaturePipeline featurePipeline, List<RentalRecord> trainSet) {
        FeatureTransformer transformer = featurePipeline.fit(trainSet);
        FeatureMatrix matrix = transformer.transform(trainSet, RentalColumn.RENTAL_TYPE.getColumnName());
        IndependentTreeModel model = new GBTTrainer(modelConfig.getTrain()).train(matrix, modelConfig.getDataSet()
                .getTargetColumnName());
        return new FittedPipeline(transformer, model);
    }

    static String formatExample(RentalRecord example, PredictionResult result) {
        return String.format(Locale.ROOT, "Пример: %s погода, темп %s, предсказание: %s (вероятность: %.2f)",
                CommonUtils.formatCategory(example.getWeatherCondition()),
                CommonUtils.formatCategory(example.getTemperature()),
                StringUtils.capitalize(String.valueOf(result.getPredictedLabel())), result.getProbability());
    }

    public List<PredictionResult> getExamplePredictions() {
        return examplePredictions;
    }

}
