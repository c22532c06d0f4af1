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
package ml.shifu.bikeshare.container;

import java.util.Collections;
import java.util.List;

import ml.shifu.bikeshare.container.obj.RentalRecord;

/**
 * Two disjoint partitions of one data set.
 */
public class TrainTestSplit {

    private final List<RentalRecord> trainSet;

    private final List<RentalRecord> testSet;

    public TrainTestSplit(List<RentalRecord> trainSet, List<RentalRecord> testSet) {
        this.trainSet = Collections.unmodifiableList(trainSet);
        this.testSet = Collections.unmodifiableList(testSet);
    }

    public List<RentalRecord> getTrainSet() {
        return trainSet;
    }

    public List<RentalRecord> getTestSet() {
        return testSet;
    }

    @Override
    public String toString() {
        return "TrainTestSplit [trainSize=" + trainSet.size() + ", testSize=" + testSet.size() + "]";
    }

}
