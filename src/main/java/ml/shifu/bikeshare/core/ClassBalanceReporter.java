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

import java.io.PrintStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.ClassBalance;
import ml.shifu.bikeshare.container.obj.RentalRecord;

/**
 * Count records per label value and print the distribution. A missing class is only warned, the run goes on.
 */
public class ClassBalanceReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ClassBalanceReporter.class);

    private final PrintStream out;

    public ClassBalanceReporter(PrintStream out) {
        this.out = out;
    }

    public ClassBalance report(List<RentalRecord> records) {
        long countFalse = 0L, countTrue = 0L;
        for(RentalRecord record: records) {
            if(Boolean.TRUE.equals(record.getRentalType())) {
                countTrue += 1L;
            } else if(Boolean.FALSE.equals(record.getRentalType())) {
                countFalse += 1L;
            }
        }
        ClassBalance balance = new ClassBalance(countFalse, countTrue);

        out.println("Распределение классов:");
        out.println("  RentalType = False: " + countFalse + " записей");
        out.println("  RentalType = True:  " + countTrue + " записей");
        LOG.info("Class balance of {} records: {}", records.size(), balance);

        if(!balance.hasBothClasses()) {
            out.println("Внимание: В данных не хватает одного из классов!");
            LOG.warn("Only one class is found in data, false count {}, true count {}.", countFalse, countTrue);
        }
        return balance;
    }

}
