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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.bikeshare.container.ClassBalance;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.util.RentalDataGenerator;

public class ClassBalanceReporterTest {

    @Test
    public void testReport() {
        List<RentalRecord> records = RentalDataGenerator.generate(500, 2L);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ClassBalance balance = new ClassBalanceReporter(new PrintStream(bytes, true, StandardCharsets.UTF_8))
                .report(records);

        Assert.assertEquals(balance.getTotal(), 500L);
        Assert.assertTrue(balance.hasBothClasses());

        String console = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(console.contains("Распределение классов:"));
        Assert.assertTrue(console.contains("  RentalType = False: " + balance.getCountFalse() + " записей"));
        Assert.assertTrue(console.contains("  RentalType = True:  " + balance.getCountTrue() + " записей"));
        Assert.assertFalse(console.contains("Внимание"));
    }

    @Test
    public void testSingleClass() {
        List<RentalRecord> records = new ArrayList<RentalRecord>();
        for(RentalRecord record: RentalDataGenerator.generate(50, 2L)) {
            if(record.getRentalType()) {
                records.add(record);
            }
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ClassBalance balance = new ClassBalanceReporter(new PrintStream(bytes, true, StandardCharsets.UTF_8))
                .report(records);

        Assert.assertEquals(balance.getCountFalse(), 0L);
        Assert.assertEquals(balance.getCountTrue(), (long) records.size());
        Assert.assertFalse(balance.hasBothClasses());
        String console = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(console.contains("Внимание: В данных не хватает одного из классов!"));
    }

    @Test
    public void testEmpty() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ClassBalance balance = new ClassBalanceReporter(new PrintStream(bytes, true, StandardCharsets.UTF_8))
                .report(new ArrayList<RentalRecord>());
        Assert.assertEquals(balance.getTotal(), 0L);
        Assert.assertFalse(balance.hasBothClasses());
    }

}
