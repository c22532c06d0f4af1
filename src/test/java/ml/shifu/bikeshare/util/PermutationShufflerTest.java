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

import java.util.HashSet;
import java.util.Set;

import org.testng.Assert;
import org.testng.annotations.Test;

public class PermutationShufflerTest {

    @Test
    public void testPermutation() {
        Shuffler shuffler = new PermutationShuffler(100, 7L);
        Assert.assertEquals(shuffler.getRecordSize(), 100);
        Set<Integer> indexes = new HashSet<Integer>();
        for(int i = 0; i < 100; i++) {
            int index = shuffler.getIndex(i);
            Assert.assertTrue(index >= 0 && index < 100);
            indexes.add(index);
        }
        Assert.assertEquals(indexes.size(), 100);
    }

    @Test
    public void testSameSeedSameOrder() {
        Shuffler first = new PermutationShuffler(50, 0L);
        Shuffler second = new PermutationShuffler(50, 0L);
        for(int i = 0; i < 50; i++) {
            Assert.assertEquals(first.getIndex(i), second.getIndex(i));
        }
    }

    @Test
    public void testEmpty() {
        Assert.assertEquals(new PermutationShuffler(0, 0L).getRecordSize(), 0);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testOutOfRange() {
        new PermutationShuffler(3, 0L).getIndex(3);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeSize() {
        new PermutationShuffler(-1, 0L);
    }

}
