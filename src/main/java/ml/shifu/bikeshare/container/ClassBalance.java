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

/**
 * Record counts per label value.
 */
public class ClassBalance {

    private final long countFalse;

    private final long countTrue;

    public ClassBalance(long countFalse, long countTrue) {
        this.countFalse = countFalse;
        this.countTrue = countTrue;
    }

    public long getCountFalse() {
        return countFalse;
    }

    public long getCountTrue() {
        return countTrue;
    }

    public long getTotal() {
        return countFalse + countTrue;
    }

    public boolean hasBothClasses() {
        return countFalse > 0 && countTrue > 0;
    }

    @Override
    public String toString() {
        return "ClassBalance [countFalse=" + countFalse + ", countTrue=" + countTrue + "]";
    }

}
