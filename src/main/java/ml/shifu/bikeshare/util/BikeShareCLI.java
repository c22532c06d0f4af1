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

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.obj.ModelConfig;
import ml.shifu.bikeshare.core.processor.RentalTypeProcessor;
import ml.shifu.bikeshare.exception.BikeShareException;

/**
 * Console entry of rental type prediction. Settings come from ModelConfig.json and -D properties, see
 * {@link Environment}.
 */
public class BikeShareCLI {

    private static final Logger log = LoggerFactory.getLogger(BikeShareCLI.class);

    public static void main(String[] args) {
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        boolean success = run(out);
        out.println(success ? "\nНажмите любую клавишу для завершения..." : "Нажмите любую клавишу для завершения...");
        if(!isNoPause()) {
            waitForKey(System.in);
        }
    }

    /**
     * @return true if key press wait is disabled, false also when bikeshare config cannot be read
     */
    static boolean isNoPause() {
        try {
            return Environment.getBoolean(Environment.NO_PAUSE, Boolean.FALSE);
        } catch (BikeShareException e) {
            log.warn("Cannot read {}, wait for key press: {}", Environment.NO_PAUSE, e.getMessage());
            return false;
        }
    }

    /**
     * Run the whole workflow, any failure is printed to console and logged.
     * 
     * @param out
     *            console stream
     * @return true if no error
     */
    static boolean run(PrintStream out) {
        try {
            ModelConfig modelConfig = ModelConfig.loadModelConfig();
            new RentalTypeProcessor(modelConfig, out).run();
            return true;
        } catch (BikeShareException e) {
            log.error("Error:" + e.getError().toString() + "; msg:" + e.getMessage(), e);
            printError(out, e);
        } catch (Exception e) {
            log.error("Error in running, please check the stack, msg:" + e.toString(), e);
            printError(out, e);
        }
        return false;
    }

    private static void printError(PrintStream out, Exception e) {
        out.println("Ошибка: " + e.getMessage());
        out.println("Стек вызовов: " + ExceptionUtils.getStackTrace(e));
        System.err.println(Constants.CONTACT_MESSAGE);
    }

    static void waitForKey(InputStream in) {
        try {
            // -1 on closed input is fine
            in.read();
        } catch (IOException e) {
            log.warn("Cannot read from console: {}", e.getMessage());
        }
    }

}
