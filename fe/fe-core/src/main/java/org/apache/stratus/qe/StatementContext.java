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

package org.apache.stratus.qe;

import org.apache.stratus.catalog.TableIf;
import org.apache.stratus.common.Config;
import org.apache.stratus.sql.analyzer.QueryAnalyzer;
import org.apache.stratus.sql.analyzer.StatementAnalyzer;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 单条语句分析期间共享的上下文。
 *
 * tables: 语句中引用过的表，同一张表在一条语句中只向 Catalog 查询一次。
 * subqueryDepth: 当前正在分析的派生表嵌套层数。
 *
 * 只被分析该语句的线程访问，不是线程安全的。
 */
public class StatementContext {
    private final ConnectContext connectContext;
    private final StatementAnalyzer statementAnalyzer;

    // lower case [db, table] -> table
    private final Map<List<String>, TableIf> tables = Maps.newHashMap();
    private int subqueryDepth = 0;
    private int maxSubqueryDepth = 0;

    public StatementContext(ConnectContext connectContext) {
        this(connectContext, new QueryAnalyzer());
    }

    public StatementContext(ConnectContext connectContext, StatementAnalyzer statementAnalyzer) {
        this.connectContext = Objects.requireNonNull(connectContext, "connectContext can not be null");
        this.statementAnalyzer = Objects.requireNonNull(statementAnalyzer, "statementAnalyzer can not be null");
    }

    public ConnectContext getConnectContext() {
        return connectContext;
    }

    public StatementAnalyzer getStatementAnalyzer() {
        return statementAnalyzer;
    }

    /**
     * Get the table from the catalog on first use and return the same object afterwards.
     *
     * @throws AnalysisException NOT_FOUND if the database or the table does not exist
     */
    public TableIf getAndCacheTable(String dbName, String tableName) {
        List<String> key = ImmutableList.of(dbName.toLowerCase(Locale.ROOT), tableName.toLowerCase(Locale.ROOT));
        TableIf table = tables.get(key);
        if (table == null) {
            table = connectContext.getEnv().getCatalog().getTableOrAnalysisException(dbName, tableName);
            tables.put(key, table);
        }
        return table;
    }

    public Map<List<String>, TableIf> getTables() {
        return tables;
    }

    /**
     * 进入一层派生表。超过 Config.max_subquery_nesting_depth 时抛出 NESTING_TOO_DEEP。
     */
    public void enterSubquery() {
        if (subqueryDepth >= Config.max_subquery_nesting_depth) {
            throw new AnalysisException(ErrorCode.NESTING_TOO_DEEP, String.format(
                    "Subquery is too deeply nested, the maximum nesting depth is %d (max_subquery_nesting_depth)",
                    Config.max_subquery_nesting_depth));
        }
        subqueryDepth++;
        maxSubqueryDepth = Math.max(maxSubqueryDepth, subqueryDepth);
    }

    public void exitSubquery() {
        if (subqueryDepth <= 0) {
            throw AnalysisException.internal("exit subquery without entering one");
        }
        subqueryDepth--;
    }

    public int getSubqueryDepth() {
        return subqueryDepth;
    }

    public int getMaxSubqueryDepth() {
        return maxSubqueryDepth;
    }
}
