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
package ml.shifu.bikeshare.exception;

/**
 * BikeShareException, contain error code
 */
public class BikeShareException extends RuntimeException {

    private static final long serialVersionUID = -4417264531094512397L;

    /**
     * error code
     */
    private BikeShareErrorCode error = null;

    public BikeShareException(BikeShareErrorCode code) {
        super(code.getDescription());
        setError(code);
    }

    public BikeShareException(BikeShareErrorCode code, Exception e) {
        super(code.getDescription(), e);
        this.setError(code);
    }

    public BikeShareException(BikeShareErrorCode code, String msg) {
        super(msg);
        this.setError(code);
    }

    public BikeShareException(BikeShareErrorCode code, Exception e, String msg) {
        super(msg, e);
        this.setError(code);
    }

    public BikeShareErrorCode getError() {
        return error;
    }

    public void setError(BikeShareErrorCode error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return "BikeShareException [error=" + error + ", msg=" + getMessage() + "]";
    }

}
