// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.stratus.sql.exceptions;

import java.util.Objects;

/**
 * 语义分析阶段抛出的异常。
 *
 * 通过 {@link ErrorCode} 区分用户错误（语法、对象不存在、参数错误等）与分析器自身的 bug
 * （{@link ErrorCode#INTERNAL_ERROR}）。内部错误的消息带有 [INTERNAL] 前缀。
 */
public class AnalysisException extends RuntimeException {

    /** 错误类别 */
    public enum ErrorCode {
        SYNTAX_ERROR,
        UNSUPPORTED,
        NOT_FOUND,
        BAD_ARGUMENTS,
        AMBIGUOUS_NAME,
        DUPLICATE_NAME,
        TYPE_MISMATCH,
        // a bug of the analyzer, never caused by user input
        INTERNAL_ERROR,
        NESTING_TOO_DEEP,
        EXPRESSION_EXCEEDS_LIMIT,
        CANCELLED;

        public boolean isInternal() {
            return this == INTERNAL_ERROR;
        }
    }

    private final ErrorCode errorCode;
    private final String message;

    public AnalysisException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode can not be null");
        this.message = message;
    }

    public AnalysisException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode can not be null");
        this.message = message;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isInternal() {
        return errorCode.isInternal();
    }

    @Override
    public String getMessage() {
        return errorCode.isInternal() ? "[INTERNAL] " + message : message;
    }

    public static AnalysisException syntax(String message) {
        return new AnalysisException(ErrorCode.SYNTAX_ERROR, message);
    }

    public static AnalysisException unsupported(String message) {
        return new AnalysisException(ErrorCode.UNSUPPORTED, message);
    }

    public static AnalysisException notFound(String message) {
        return new AnalysisException(ErrorCode.NOT_FOUND, message);
    }

    public static AnalysisException badArguments(String message) {
        return new AnalysisException(ErrorCode.BAD_ARGUMENTS, message);
    }

    public static AnalysisException internal(String message) {
        return new AnalysisException(ErrorCode.INTERNAL_ERROR, message);
    }
}
