/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.statevault;

/**
 * Exception thrown when a persistence operation fails.
 * <p>
 * The {@link dev.mars.statevault.engine.PersistenceCoordinator}
 * converts these into return values; they only reach the host for programming
 * errors such as an unknown component id.
 */
public class StateVaultException extends RuntimeException {

    private final ErrorCode errorCode;

    public StateVaultException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StateVaultException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    @Override
    public String getMessage() {
        return "[" + errorCode.code() + "] " + super.getMessage();
    }
}
