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
import org.apache.stratus.sql.ast.ExplainStatement;
import org.apache.stratus.sql.ast.QueryStatement;
import org.apache.stratus.sql.ast.SelectStatement;
import org.apache.stratus.sql.exceptions.AnalysisException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 按语句类型分发：SELECT 交给 {@link SelectAnalyzer}，EXPLAIN 分析被解释的语句。
 */
public class QueryAnalyzer implements StatementAnalyzer {
    private static final Logger LOG = LogManager.getLogger(QueryAnalyzer.class);

    private final SelectAnalyzer selectAnalyzer = new SelectAnalyzer();

    @Override
    public AnalyzedResult analyze(QueryStatement statement, StatementContext statementContext) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("analyze statement: {}", statement.toSql());
        }
        if (statement instanceof SelectStatement) {
            AnalyzeQueryState state = selectAnalyzer.analyze((SelectStatement) statement, statementContext);
            return AnalyzedResult.selectQuery(state);
        } else if (statement instanceof ExplainStatement) {
            QueryStatement explained = ((ExplainStatement) statement).getStatement();
            return AnalyzedResult.explain(analyze(explained, statementContext));
        }
        throw AnalysisException.unsupported("Unsupported statement " + statement.getClass().getSimpleName());
    }
}
