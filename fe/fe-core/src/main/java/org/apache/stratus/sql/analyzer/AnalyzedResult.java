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

package org.apache.stratus.sql.analyzer;

import com.google.common.base.Preconditions;

import java.util.Objects;
import java.util.Optional;

/**
 * 语句分析的结果。SELECT_QUERY 携带 {@link AnalyzeQueryState}，EXPLAIN 携带被解释语句的分析结果。
 */
public class AnalyzedResult {

    /** kind of the analyzed statement */
    public enum Kind {
        SELECT_QUERY,
        EXPLAIN
    }

    private final Kind kind;
    private final Optional<AnalyzeQueryState> selectQueryState;
    private final Optional<AnalyzedResult> explained;

    private AnalyzedResult(Kind kind, Optional<AnalyzeQueryState> selectQueryState,
            Optional<AnalyzedResult> explained) {
        this.kind = kind;
        this.selectQueryState = selectQueryState;
        this.explained = explained;
    }

    public static AnalyzedResult selectQuery(AnalyzeQueryState state) {
        return new AnalyzedResult(Kind.SELECT_QUERY,
                Optional.of(Objects.requireNonNull(state, "state can not be null")), Optional.empty());
    }

    public static AnalyzedResult explain(AnalyzedResult explained) {
        return new AnalyzedResult(Kind.EXPLAIN, Optional.empty(),
                Optional.of(Objects.requireNonNull(explained, "explained can not be null")));
    }

    public Kind getKind() {
        return kind;
    }

    public AnalyzeQueryState getSelectQueryState() {
        Preconditions.checkState(kind == Kind.SELECT_QUERY, "%s result has no select query state", kind);
        return selectQueryState.get();
    }

    public AnalyzedResult getExplained() {
        Preconditions.checkState(kind == Kind.EXPLAIN, "%s result has no explained statement", kind);
        return explained.get();
    }

    @Override
    public String toString() {
        return kind == Kind.SELECT_QUERY
                ? "SelectQuery(" + selectQueryState.get() + ")"
                : "Explain(" + explained.get() + ")";
    }
}
