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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

public class BikeShareCLITest {

    private File tmpDir;

    @BeforeClass
    public void setUp() throws IOException {
        tmpDir = new File(FileUtils.getTempDirectory(), "bikeshare-cli-" + System.nanoTime());
        FileUtils.forceMkdir(tmpDir);
    }

    @AfterClass
    public void tearDown() {
        FileUtils.deleteQuietly(tmpDir);
    }

    @Test
    public void testRunWithMissingData() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        System.setProperty(Environment.DATA_PATH, new File(tmpDir, "missing.csv").getAbsolutePath());
        try {
            Assert.assertFalse(BikeShareCLI.run(out));
        } finally {
            System.clearProperty(Environment.DATA_PATH);
        }
        String console = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(console.contains("Ошибка: "));
        Assert.assertTrue(console.contains("Стек вызовов: "));
        Assert.assertTrue(console.contains("missing.csv"));
    }

    @Test
    public void testRunWithData() throws IOException {
        File data = RentalDataGenerator.writeCsv(new File(tmpDir, "bike_sharing.csv"),
                RentalDataGenerator.generate(300, 3L));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        System.setProperty(Environment.DATA_PATH, data.getAbsolutePath());
        try {
            Assert.assertTrue(BikeShareCLI.run(out));
        } finally {
            System.clearProperty(Environment.DATA_PATH);
        }
        String console = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(console.contains("AUC: "));
        Assert.assertFalse(console.contains("Ошибка: "));
    }

    @Test
    public void testRunWithMalformedUserConfig() throws IOException {
        File userHome = new File(tmpDir, "home");
        FileUtils.write(new File(userHome, ".bikeshareconfig"), "bikeshare.noPause=\\u12\n", StandardCharsets.UTF_8);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        String oldUserHome = System.getProperty("user.home");
        System.setProperty("user.home", userHome.getAbsolutePath());
        Environment.reset();
        try {
            Assert.assertFalse(BikeShareCLI.run(out));
            Assert.assertFalse(BikeShareCLI.isNoPause());
        } finally {
            System.setProperty("user.home", oldUserHome);
            Environment.reset();
        }
        String console = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(console.contains("Ошибка: Cannot load bikeshare config"), console);
        Assert.assertTrue(console.contains(".bikeshareconfig"), console);
    }

    @Test
    public void testWaitForKey() {
        BikeShareCLI.waitForKey(new ByteArrayInputStream(new byte[0]));
        BikeShareCLI.waitForKey(new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("closed");
            }
        });
    }

}
