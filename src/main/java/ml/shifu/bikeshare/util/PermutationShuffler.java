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
package ml.shifu.bikeshare.util;

import java.util.Random;

/**
 * A {@link Shuffler} implementation that provides permutation index mapping. A permutation of [0, {@link #recordSize})
 * is created by Fisher-Yates shuffle with a seeded {@link Random}, the same seed always gives the same permutation.
 *
 * @author Junshi Guo
 */
public class PermutationShuffler implements Shuffler {

    /**
     * Max index range. Should be set on construction and never change for one instance.
     */
    private final int recordSize;

    /**
     * Internally held permutation mapping from index -> permutation[index].
     */
    private final int[] permutation;

    public PermutationShuffler(int recordSize, long seed) {
        if(recordSize < 0) {
            throw new IllegalArgumentException("Record size should not be negative, but is " + recordSize);
        }
        this.recordSize = recordSize;
        this.permutation = new int[recordSize];
        for(int i = 0; i < recordSize; i++) {
            this.permutation[i] = i;
        }
        Random random = new Random(seed);
        int temp, pos;
        for(int i = recordSize; i > 1; i--) {
            pos = random.nextInt(i);
            temp = permutation[pos];
            permutation[pos] = permutation[i - 1];
            permutation[i - 1] = temp;
        }
    }

    @Override
    public int getIndex(int i) {
        if(i < 0 || i >= recordSize) {
            throw new IndexOutOfBoundsException("Index " + i + " is out of [0, " + recordSize + ")");
        }
        return permutation[i];
    }

    @Override
    public int getRecordSize() {
        return this.recordSize;
    }
}
