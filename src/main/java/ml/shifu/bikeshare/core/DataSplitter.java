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
package ml.shifu.bikeshare.core;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.TrainTestSplit;
import ml.shifu.bikeshare.container.obj.ModelSplitConf;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.util.PermutationShuffler;
import ml.shifu.bikeshare.util.Shuffler;

/**
 * Split records into train and test partitions. Test partition has {@code round(N * testFraction)} records picked by
 * a seeded permutation, records in both partitions keep the source order.
 */
public class DataSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(DataSplitter.class);

    private final double testFraction;

    private final long seed;

    public DataSplitter(ModelSplitConf splitConf) {
        this(splitConf.getTestFraction(), splitConf.getSeed());
    }

    public DataSplitter(double testFraction, long seed) {
        if(testFraction < 0d || testFraction >= 1d || Double.isNaN(testFraction)) {
            throw new IllegalArgumentException("Test fraction should be in [0, 1), but is " + testFraction);
        }
        this.testFraction = testFraction;
        this.seed = seed;
    }

    public TrainTestSplit split(List<RentalRecord> records) {
        int size = records.size();
        int testSize = (int) Math.round(size * testFraction);

        boolean[] isTest = new boolean[size];
        Shuffler shuffler = new PermutationShuffler(size, seed);
        for(int i = 0; i < testSize; i++) {
            isTest[shuffler.getIndex(i)] = true;
        }

        List<RentalRecord> trainSet = new ArrayList<RentalRecord>(size - testSize);
        List<RentalRecord> testSet = new ArrayList<RentalRecord>(testSize);
        for(int i = 0; i < size; i++) {
            if(isTest[i]) {
                testSet.add(records.get(i));
            } else {
                trainSet.add(records.get(i));
            }
        }

        LOG.info("Split {} records into {} train records and {} test records with seed {}.", new Object[] { size,
                trainSet.size(), testSet.size(), seed });
        return new TrainTestSplit(trainSet, testSet);
    }

}
