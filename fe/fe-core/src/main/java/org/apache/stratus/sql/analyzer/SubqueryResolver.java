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

import org.apache.stratus.qe.StatementContext;
import org.apache.stratus.sql.ast.QueryStatement;
import org.apache.stratus.sql.exceptions.AnalysisException;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 分析 FROM 子句中的派生表。
 *
 * 对子查询递归调用完整的语句分析，只取其 finalize schema，以别名为前缀（没有别名时不加前缀）。
 * 子查询的其他分析结果在此丢弃。
 */
public class SubqueryResolver {
    private static final Logger LOG = LogManager.getLogger(SubqueryResolver.class);

    private final StatementContext statementContext;

    public SubqueryResolver(StatementContext statementContext) {
        this.statementContext = Objects.requireNonNull(statementContext, "statementContext can not be null");
    }

    /**
     * Analyze the derived table and return its output columns.
     *
     * @throws AnalysisException NESTING_TOO_DEEP beyond Config.max_subquery_nesting_depth,
     *         INTERNAL_ERROR if the subquery is not analyzed to a select query
     */
    public QualifiedSchema resolve(QueryStatement subquery, Optional<String> alias) {
        statementContext.enterSubquery();
        AnalyzedResult analyzedResult;
        try {
            analyzedResult = statementContext.getStatementAnalyzer().analyze(subquery, statementContext);
        } finally {
            statementContext.exitSubquery();
        }
        if (analyzedResult.getKind() != AnalyzedResult.Kind.SELECT_QUERY) {
            LOG.warn("subquery {} is analyzed to {}", subquery.toSql(), analyzedResult.getKind());
            throw AnalysisException.internal("Derived table must be analyzed to a select query, but got "
                    + analyzedResult.getKind());
        }
        QualifiedSchema finalizeSchema = analyzedResult.getSelectQueryState().getFinalizeSchema();
        List<String> prefix = alias.<List<String>>map(ImmutableList::of).orElse(ImmutableList.of());
        return QualifiedSchema.fromSlots(finalizeSchema.getColumns(), prefix);
    }
}
