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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import ml.shifu.bikeshare.container.BinaryClassificationMetrics;
import ml.shifu.bikeshare.container.PredictionResult;
import ml.shifu.bikeshare.container.obj.ModelConfig;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.Constants;
import ml.shifu.bikeshare.util.RentalDataGenerator;

public class RentalTypeProcessorTest {

    private File tmpDir;

    private File dataFile;

    @BeforeClass
    public void setUp() throws IOException {
        tmpDir = new File(FileUtils.getTempDirectory(), "bikeshare-processor-" + System.nanoTime());
        FileUtils.forceMkdir(tmpDir);
        dataFile = RentalDataGenerator.writeCsv(new File(tmpDir, "bike_sharing.csv"),
                RentalDataGenerator.generate(1000, 17L));
    }

    @AfterClass
    public void tearDown() {
        FileUtils.deleteQuietly(tmpDir);
    }

    private ModelConfig modelConfig() {
        ModelConfig modelConfig = new ModelConfig();
        modelConfig.getDataSet().setDataPath(dataFile.getAbsolutePath());
        modelConfig.getTrain().getParams().put(Constants.TREE_NUM, 30);
        return modelConfig;
    }

    @Test
    public void testRun() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        RentalTypeProcessor processor = new RentalTypeProcessor(modelConfig(), new PrintStream(bytes, true,
                StandardCharsets.UTF_8));
        BinaryClassificationMetrics metrics = processor.run();

        Assert.assertTrue(metrics.getAuc() > 0.8d, metrics.toString());
        Assert.assertTrue(metrics.getF1Score() >= 0d && metrics.getF1Score() <= 1d);
        Assert.assertEquals(metrics.getConfusionMatrix().getTotal(), 100d, 1e-9);

        List<PredictionResult> examples = processor.getExamplePredictions();
        Assert.assertEquals(examples.size(), 2);

        String[] lines = new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\r?\\n");
        Assert.assertEquals(lines[0], "Предсказание типа аренды велосипеда");
        Assert.assertEquals(lines[1], "Загрузка данных...");
        Assert.assertEquals(lines[2], "Распределение классов:");
        Assert.assertEquals(lines[5], "Разделение данных...");
        Assert.assertEquals(lines[6], "Создание пайплайна...");
        Assert.assertEquals(lines[7], "Обучение модели...");
        Assert.assertEquals(lines[8], "Выполняем оценку...");
        Assert.assertEquals(lines[9], "Оценка качества модели...");
        Assert.assertTrue(lines[10].matches("AUC: \\d\\.\\d\\d"), lines[10]);
        Assert.assertTrue(lines[11].matches("F1 Score: \\d\\.\\d\\d"), lines[11]);
        Assert.assertEquals(lines[12], "Создаем движок предсказаний...");
        Assert.assertEquals(lines[13], RentalTypeProcessor.formatExample(RentalTypeProcessor.EXAMPLE_CLEAR_WEATHER,
                examples.get(0)));
        Assert.assertTrue(lines[13].startsWith("Пример: 1 погода, темп 18, предсказание: "), lines[13]);
        Assert.assertTrue(lines[14].startsWith("Пример: 4 погода, темп -2, предсказание: "), lines[14]);
        Assert.assertEquals(lines.length, 15);
    }

    @Test
    public void testRepeatable() {
        BinaryClassificationMetrics first = new RentalTypeProcessor(modelConfig(), new PrintStream(
                new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)).run();
        BinaryClassificationMetrics second = new RentalTypeProcessor(modelConfig(), new PrintStream(
                new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)).run();
        Assert.assertEquals(first.getAuc(), second.getAuc(), 0d);
        Assert.assertEquals(first.getF1Score(), second.getF1Score(), 0d);
    }

    @Test
    public void testFormatExample() {
        Assert.assertEquals(RentalTypeProcessor.formatExample(RentalTypeProcessor.EXAMPLE_BAD_WEATHER,
                new PredictionResult(false, 0.123d, -1d)),
                "Пример: 4 погода, темп -2, предсказание: False (вероятность: 0.12)");
        Assert.assertEquals(RentalTypeProcessor.formatExample(RentalTypeProcessor.EXAMPLE_CLEAR_WEATHER,
                new PredictionResult(true, 0.875d, 1d)),
                "Пример: 1 погода, темп 18, предсказание: True (вероятность: 0.88)");
    }

    @Test
    public void testWrongTargetColumn() {
        ModelConfig modelConfig = modelConfig();
        modelConfig.getDataSet().setTargetColumnName("Label");
        try {
            new RentalTypeProcessor(modelConfig, new PrintStream(new ByteArrayOutputStream(), true,
                    StandardCharsets.UTF_8)).run();
            Assert.fail("Unknown target column should fail training.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_NO_TARGET_COLUMN);
        }
    }

    @Test
    public void testMissingData() {
        ModelConfig modelConfig = modelConfig();
        modelConfig.getDataSet().setDataPath(new File(tmpDir, "none.csv").getAbsolutePath());
        try {
            new RentalTypeProcessor(modelConfig, new PrintStream(new ByteArrayOutputStream(), true,
                    StandardCharsets.UTF_8)).run();
            Assert.fail("Missing data file should fail.");
        } catch (BikeShareException e) {
            Assert.assertEquals(e.getError(), BikeShareErrorCode.ERROR_INPUT_NOT_FOUND);
        }
    }

}
