/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.kubeauth.login;

import javax.naming.AuthenticationException;
import lombok.Getter;

/**
 * Failed login. Carries an error code telling the reason, whose {@link ErrorClass} tells how the caller should
 * treat it.
 */
public class KubeAuthenticationException extends AuthenticationException {

    /**
     * How a failure is reported to the caller.
     */
    public enum ErrorClass {
        /** The request itself is wrong. */
        INVALID_REQUEST(400),
        /** The caller is not allowed to log in. */
        PERMISSION_DENIED(403),
        /** The outcome could not be determined, the caller may retry. */
        UNAVAILABLE(502),
        /** The login was abandoned before completing. */
        CANCELED(503),
        /** Recorded in a successful response, never thrown. */
        WARNING(200);

        @Getter
        private final int httpStatus;

        ErrorClass(int httpStatus) {
            this.httpStatus = httpStatus;
        }
    }

    public enum ErrorCode {
        MISSING_ROLE(ErrorClass.INVALID_REQUEST),
        MISSING_JWT(ErrorClass.INVALID_REQUEST),
        INVALID_ROLE_NAME(ErrorClass.INVALID_REQUEST),
        MALFORMED_CLAIMS(ErrorClass.PERMISSION_DENIED),
        INVALID_SIGNATURE(ErrorClass.PERMISSION_DENIED),
        TOKEN_EXPIRED(ErrorClass.PERMISSION_DENIED),
        TOKEN_NOT_YET_VALID(ErrorClass.PERMISSION_DENIED),
        INVALID_ISSUER(ErrorClass.PERMISSION_DENIED),
        INVALID_AUDIENCE(ErrorClass.PERMISSION_DENIED),
        TOKEN_REVIEW_DENIED(ErrorClass.PERMISSION_DENIED),
        IDENTITY_MISMATCH(ErrorClass.PERMISSION_DENIED),
        SERVICE_ACCOUNT_NOT_AUTHORIZED(ErrorClass.PERMISSION_DENIED),
        NAMESPACE_NOT_AUTHORIZED(ErrorClass.PERMISSION_DENIED),
        INCOMPLETE_IDENTITY(ErrorClass.PERMISSION_DENIED),
        REVIEW_UNAVAILABLE(ErrorClass.UNAVAILABLE),
        BACKEND_NOT_CONFIGURED(ErrorClass.UNAVAILABLE),
        CANCELED(ErrorClass.CANCELED),
        ANNOTATION_FETCH_FAILED(ErrorClass.WARNING);

        @Getter
        private final ErrorClass errorClass;

        ErrorCode(ErrorClass errorClass) {
            this.errorClass = errorClass;
        }
    }

    @Getter
    private final ErrorCode errorCode;

    public KubeAuthenticationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public KubeAuthenticationException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message);
        initCause(cause);
    }

    public ErrorClass getErrorClass() {
        return errorCode.getErrorClass();
    }

    public int getHttpStatus() {
        return errorCode.getErrorClass().getHttpStatus();
    }
}
