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

import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.sql.ast.JoinOperator;
import org.apache.stratus.sql.ast.TableFunctionArg;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.Literal;
import org.apache.stratus.sql.trees.expressions.Slot;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

public class RelationResolverTest extends AnalyzerTestBase {

    @Test
    public void testCommaAndJoin() {
        // FROM a, b JOIN c ON b.x = c.x
        ResolvedRelation relation = resolveFrom(
                from(table("a")),
                from(table("b")).join(table("c"), innerOn(eq(slot("b", "x"), slot("c", "x")))));
        Assertions.assertEquals(ImmutableList.of(
                "default.a.id", "default.b.id", "default.b.x", "default.c.x", "default.c.y"),
                names(relation.getSchema()));
        Assertions.assertEquals(1, relation.getJoinConditions().size());
        // conditions are bound later
        ResolvedRelation.JoinCondition condition = relation.getJoinConditions().get(0);
        Assertions.assertTrue(condition.getCondition().hasUnbound());
        // the ON condition sees only b and c
        Assertions.assertEquals(ImmutableList.of("default.b.id", "default.b.x", "default.c.x", "default.c.y"),
                names(condition.getScope()));
    }

    @Test
    public void testNoFrom() {
        ResolvedRelation relation = resolveFrom();
        Assertions.assertEquals(ImmutableList.of("system.one.dummy"), names(relation.getSchema()));
        Assertions.assertTrue(relation.getJoinConditions().isEmpty());
    }

    @Test
    public void testAliasAndDatabase() {
        ResolvedRelation relation = resolveFrom(from(table("a").withAlias("t1")), from(table("db2", "a")));
        Assertions.assertEquals(ImmutableList.of("t1.id", "db2.a.z"), names(relation.getSchema()));

        connectContext.setDatabase("db2");
        Assertions.assertEquals(ImmutableList.of("db2.a.z"), names(resolveFrom(from(table("a"))).getSchema()));
    }

    @Test
    public void testTableNotFound() {
        AnalysisException exception = assertAnalysisError(ErrorCode.NOT_FOUND,
                () -> resolveFrom(from(table("no_such_table"))));
        Assertions.assertTrue(exception.getMessage().contains("no_such_table"), exception.getMessage());
        assertAnalysisError(ErrorCode.NOT_FOUND, () -> resolveFrom(from(table("no_such_db", "a"))));
    }

    @Test
    public void testTableNameTooLong() {
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> resolveFrom(from(table("catalog", "default", "a"))));
    }

    @Test
    public void testTableFunction() {
        ResolvedRelation relation = resolveFrom(
                from(table("numbers").withArgs(TableFunctionArg.of(Literal.of(10)))));
        List<Slot> columns = relation.getSchema().getColumns();
        Assertions.assertEquals(1, columns.size());
        Assertions.assertEquals("number", columns.get(0).getName());
        Assertions.assertTrue(columns.get(0).getQualifier().isEmpty());
        Assertions.assertEquals(PrimitiveType.BIGINT, columns.get(0).getDataType());
        Assertions.assertFalse(columns.get(0).nullable());
    }

    @Test
    public void testTableFunctionArguments() {
        // arguments are analyzed against an empty schema
        assertAnalysisError(ErrorCode.NOT_FOUND, () -> resolveFrom(
                from(table("numbers").withArgs(TableFunctionArg.of(slot("x"))))));
        assertAnalysisError(ErrorCode.BAD_ARGUMENTS, () -> resolveFrom(
                from(table("numbers").withArgs(TableFunctionArg.of(Literal.of("x"))))));
        assertAnalysisError(ErrorCode.NOT_FOUND, () -> resolveFrom(
                from(table("no_such_function").withArgs(TableFunctionArg.of(Literal.of(1))))));
    }

    @Test
    public void testMalformedRpn() {
        RelationResolver resolver = new RelationResolver(statementContext);
        RelationRpnItem tableA = new RelationRpnItem.TableItem(ImmutableList.of("a"), Optional.empty());
        RelationRpnItem tableB = new RelationRpnItem.TableItem(ImmutableList.of("b"), Optional.empty());
        RelationRpnItem cross = new RelationRpnItem.JoinItem(JoinOperator.cross());

        AnalysisException twoOperands = assertAnalysisError(ErrorCode.INTERNAL_ERROR,
                () -> resolver.resolve(ImmutableList.of(tableA, tableB)));
        Assertions.assertTrue(twoOperands.isInternal());
        Assertions.assertTrue(twoOperands.getMessage().startsWith("[INTERNAL] "), twoOperands.getMessage());

        assertAnalysisError(ErrorCode.INTERNAL_ERROR, () -> resolver.resolve(ImmutableList.of(tableA, cross)));
        assertAnalysisError(ErrorCode.INTERNAL_ERROR, () -> resolver.resolve(ImmutableList.of()));
    }

    @Test
    public void testLeftJoinNullable() {
        ResolvedRelation relation = resolveFrom(
                from(table("a")).join(table("b"), JoinOperator.leftOuter(eq(slot("a", "id"), slot("b", "id")))));
        List<Slot> columns = relation.getSchema().getColumns();
        Assertions.assertFalse(columns.get(0).nullable());
        Assertions.assertTrue(columns.get(1).nullable());
        Assertions.assertTrue(columns.get(2).nullable());
    }

    @Test
    public void testCancelled() {
        connectContext.cancel();
        assertAnalysisError(ErrorCode.CANCELLED, () -> resolveFrom(from(table("a"))));

        connectContext.resetCancelled();
        Assertions.assertEquals(1, resolveFrom(from(table("a"))).getSchema().size());
    }

    @Test
    public void testTableIsCachedPerStatement() {
        resolveFrom(from(table("a").withAlias("x1")), from(table("A").withAlias("x2")));
        Assertions.assertEquals(1, statementContext.getTables().size());
        Assertions.assertTrue(statementContext.getTables().containsKey(ImmutableList.of("default", "a")));
    }
}
