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

import org.apache.stratus.catalog.Column;
import org.apache.stratus.catalog.Env;
import org.apache.stratus.catalog.InternalCatalog;
import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.common.Config;
import org.apache.stratus.qe.ConnectContext;
import org.apache.stratus.qe.StatementContext;
import org.apache.stratus.sql.ast.JoinOperator;
import org.apache.stratus.sql.ast.QueryStatement;
import org.apache.stratus.sql.ast.SelectStatement;
import org.apache.stratus.sql.ast.TableFactor;
import org.apache.stratus.sql.ast.TableWithJoins;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.BinaryOperator;
import org.apache.stratus.sql.trees.expressions.BinaryOperator.Operator;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.Slot;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.function.Executable;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Catalog fixture and AST helpers for analyzer tests.
 *
 * default.a(id INT NOT NULL)
 * default.b(id INT NOT NULL, x VARCHAR)
 * default.c(x VARCHAR, y BIGINT)
 * default.t(x INT, name VARCHAR, score DOUBLE)
 * db2.a(z INT)
 */
public abstract class AnalyzerTestBase {
    protected InternalCatalog catalog;
    protected ConnectContext connectContext;
    protected StatementContext statementContext;

    @BeforeEach
    public void setUpCatalog() {
        catalog = new InternalCatalog();
        catalog.createDatabase(Config.default_database);
        catalog.createDatabase("db2");
        catalog.createTable(Config.default_database, "a", ImmutableList.of(
                new Column("id", PrimitiveType.INT, false)));
        catalog.createTable(Config.default_database, "b", ImmutableList.of(
                new Column("id", PrimitiveType.INT, false),
                new Column("x", PrimitiveType.VARCHAR)));
        catalog.createTable(Config.default_database, "c", ImmutableList.of(
                new Column("x", PrimitiveType.VARCHAR),
                new Column("y", PrimitiveType.BIGINT)));
        catalog.createTable(Config.default_database, "t", ImmutableList.of(
                new Column("x", PrimitiveType.INT),
                new Column("name", PrimitiveType.VARCHAR),
                new Column("score", PrimitiveType.DOUBLE)));
        catalog.createTable("db2", "a", ImmutableList.of(
                new Column("z", PrimitiveType.INT)));
        connectContext = new ConnectContext(new Env(catalog));
        statementContext = new StatementContext(connectContext);
    }

    protected AnalyzeQueryState analyze(QueryStatement statement) {
        AnalyzedResult result = new QueryAnalyzer().analyze(statement, statementContext);
        return result.getSelectQueryState();
    }

    protected ResolvedRelation resolveFrom(TableWithJoins... from) {
        List<RelationRpnItem> rpn = RelationRpnBuilder.build(ImmutableList.copyOf(from));
        return new RelationResolver(statementContext).resolve(rpn);
    }

    protected static SelectStatement.Builder select(Expression... items) {
        return SelectStatement.builder().select(items);
    }

    protected static SelectStatement selectStarFrom(TableWithJoins... from) {
        return SelectStatement.builder().select(UnboundStar.all()).from(from).build();
    }

    protected static TableFactor.Table table(String... nameParts) {
        return TableFactor.table(nameParts);
    }

    protected static TableWithJoins from(TableFactor relation) {
        return new TableWithJoins(relation);
    }

    protected static TableFactor.Derived derived(QueryStatement subquery, String alias) {
        return new TableFactor.Derived(false, subquery, Optional.ofNullable(alias));
    }

    protected static UnboundSlot slot(String... nameParts) {
        return new UnboundSlot(nameParts);
    }

    protected static BinaryOperator eq(Expression left, Expression right) {
        return new BinaryOperator(Operator.EQ, left, right);
    }

    protected static JoinOperator innerOn(Expression condition) {
        return JoinOperator.inner(condition);
    }

    protected static List<String> names(QualifiedSchema schema) {
        return schema.getColumns().stream().map(Slot::toString).collect(Collectors.toList());
    }

    protected static AnalysisException assertAnalysisError(ErrorCode expected, Executable executable) {
        AnalysisException exception = Assertions.assertThrows(AnalysisException.class, executable);
        Assertions.assertEquals(expected, exception.getErrorCode(), exception.getMessage());
        return exception;
    }
}
