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
import org.apache.stratus.sql.ast.ExplainStatement;
import org.apache.stratus.sql.ast.JoinOperator;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.Alias;
import org.apache.stratus.sql.trees.expressions.BinaryOperator;
import org.apache.stratus.sql.trees.expressions.BinaryOperator.Operator;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.Literal;
import org.apache.stratus.sql.trees.expressions.OrderKey;
import org.apache.stratus.sql.trees.expressions.SlotReference;
import org.apache.stratus.sql.trees.expressions.functions.AggregateFunction;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SelectAnalyzerTest extends AnalyzerTestBase {

    private static UnboundFunction countStar() {
        return new UnboundFunction("count");
    }

    private static BinaryOperator gt(Expression left, Expression right) {
        return new BinaryOperator(Operator.GT, left, right);
    }

    private static OrderKey asc(Expression expr) {
        return new OrderKey(expr, true, true);
    }

    @Test
    public void testAmbiguousColumn() {
        AnalysisException exception = assertAnalysisError(ErrorCode.AMBIGUOUS_NAME,
                () -> analyze(select(slot("id")).from(from(table("a")), from(table("b"))).build()));
        Assertions.assertTrue(exception.getMessage().startsWith("id is ambiguous"), exception.getMessage());

        AnalyzeQueryState state = analyze(select(slot("a", "id")).from(from(table("a")), from(table("b"))).build());
        Assertions.assertEquals(ImmutableList.of("id"), names(state.getFinalizeSchema()));
        Assertions.assertEquals("default.a.id", state.getProjectionExpressions().get(0).toString());
    }

    @Test
    public void testSelectWithoutFrom() {
        AnalyzeQueryState state = analyze(select(Literal.of(1)).build());
        Assertions.assertEquals(ImmutableList.of("system.one.dummy"), names(state.getJoinedSchema()));
        Assertions.assertEquals(ImmutableList.of("1"), names(state.getFinalizeSchema()));
        Assertions.assertEquals(PrimitiveType.BIGINT, state.getFinalizeSchema().getColumns().get(0).getDataType());
        Assertions.assertFalse(state.isAggregating());
        Assertions.assertEquals(state.getJoinedSchema(), state.getBeforeAggrSchema());
        Assertions.assertEquals(state.getJoinedSchema(), state.getAfterAggrSchema());
    }

    @Test
    public void testStarExpansion() {
        AnalyzeQueryState state = analyze(select(new UnboundStar(ImmutableList.of("c")), UnboundStar.all())
                .from(from(table("a")), from(table("c")))
                .build());
        Assertions.assertEquals(ImmutableList.of("x", "y", "id", "x", "y"), names(state.getFinalizeSchema()));

        assertAnalysisError(ErrorCode.NOT_FOUND, () -> analyze(select(new UnboundStar(ImmutableList.of("b")))
                .from(from(table("a"))).build()));
        // star is only allowed in the select list
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> analyze(select(slot("id"))
                .from(from(table("a"))).where(UnboundStar.all()).build()));
    }

    @Test
    public void testDuplicateAlias() {
        assertAnalysisError(ErrorCode.DUPLICATE_NAME, () -> analyze(select(
                new UnboundAlias(slot("x"), "v"), new UnboundAlias(slot("score"), "V"))
                .from(from(table("t"))).build()));
    }

    @Test
    public void testFilter() {
        AnalyzeQueryState state = analyze(select(UnboundStar.all()).from(from(table("t")))
                .where(gt(slot("score"), Literal.of(1.5))).build());
        Assertions.assertTrue(state.getFilterPredicate().isPresent());
        Assertions.assertFalse(state.getFilterPredicate().get().hasUnbound());
        Assertions.assertEquals(PrimitiveType.BOOLEAN, state.getFilterPredicate().get().getDataType());

        assertAnalysisError(ErrorCode.TYPE_MISMATCH, () -> analyze(select(UnboundStar.all())
                .from(from(table("t"))).where(slot("x")).build()));
        assertAnalysisError(ErrorCode.TYPE_MISMATCH, () -> analyze(select(UnboundStar.all())
                .from(from(table("t"))).where(gt(slot("x"), Literal.of("a"))).build()));
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> analyze(select(UnboundStar.all())
                .from(from(table("t"))).where(gt(countStar(), Literal.of(1))).build()));
    }

    @Test
    public void testGroupByHavingOrderBy() {
        // SELECT name, count(*) AS cnt FROM t GROUP BY name HAVING cnt > 1 ORDER BY cnt
        AnalyzeQueryState state = analyze(select(slot("name"), new UnboundAlias(countStar(), "cnt"))
                .from(from(table("t")))
                .groupBy(slot("name"))
                .having(gt(slot("cnt"), Literal.of(1)))
                .orderBy(asc(slot("cnt")))
                .build());

        Assertions.assertTrue(state.isAggregating());
        Assertions.assertEquals(ImmutableList.of("default.t.name"),
                ImmutableList.of(state.getGroupByExpressions().get(0).toString()));
        Assertions.assertEquals(1, state.getAggregateExpressions().size());
        Assertions.assertTrue(state.getAggregateExpressions().get(0) instanceof AggregateFunction);
        Assertions.assertEquals("count(*)", state.getAggregateExpressions().get(0).toSql());

        Assertions.assertEquals(ImmutableList.of("default.t.x", "default.t.name", "default.t.score"),
                names(state.getBeforeAggrSchema()));
        Assertions.assertEquals(ImmutableList.of("default.t.name", "count(*)"), names(state.getAfterAggrSchema()));
        Assertions.assertEquals(ImmutableList.of("name", "cnt"), names(state.getFinalizeSchema()));
        Assertions.assertFalse(state.getFinalizeSchema().getColumns().get(1).nullable());

        Assertions.assertEquals("(count(*) > 1)", state.getHavingPredicate().get().toSql());
        Assertions.assertEquals(state.getAggregateExpressions().get(0),
                state.getOrderByExpressions().get(0).getExpr());
        Assertions.assertTrue(state.getProjectionExpressions().get(1) instanceof Alias);
        Assertions.assertEquals(ImmutableList.of("cnt"), ImmutableList.copyOf(state.getProjectionAliases().keySet()));
        Assertions.assertFalse(state.getBeforeHavingExpressions().isEmpty());
    }

    @Test
    public void testGroupByAliasOfExpression() {
        AnalyzeQueryState state = analyze(select(
                new UnboundAlias(new UnboundFunction("upper", slot("name")), "u"), countStar())
                .from(from(table("t")))
                .groupBy(slot("u"))
                .build());
        Assertions.assertEquals("upper(name)", state.getGroupByExpressions().get(0).toSql());
        Assertions.assertEquals(ImmutableList.of("default.t.x", "default.t.name", "default.t.score", "upper(name)"),
                names(state.getBeforeAggrSchema()));
        Assertions.assertEquals(ImmutableList.of("upper(name)", "count(*)"), names(state.getAfterAggrSchema()));
        Assertions.assertEquals(ImmutableList.of("u", "count(*)"), names(state.getFinalizeSchema()));
    }

    @Test
    public void testGroupByColumnWinsOverAlias() {
        // x is a column of t, so GROUP BY x does not refer to the alias
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> analyze(select(
                new UnboundAlias(slot("score"), "x"), countStar())
                .from(from(table("t")))
                .groupBy(slot("x"))
                .build()));
    }

    @Test
    public void testGroupByPosition() {
        AnalyzeQueryState state = analyze(select(slot("name"), countStar())
                .from(from(table("t")))
                .groupBy(Literal.of(1))
                .build());
        Assertions.assertEquals(ImmutableList.of("default.t.name"),
                ImmutableList.of(state.getGroupByExpressions().get(0).toString()));

        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> analyze(select(slot("name"), countStar())
                .from(from(table("t"))).groupBy(Literal.of(2)).build()));
        assertAnalysisError(ErrorCode.BAD_ARGUMENTS, () -> analyze(select(slot("name"), countStar())
                .from(from(table("t"))).groupBy(Literal.of(3)).build()));
        assertAnalysisError(ErrorCode.BAD_ARGUMENTS, () -> analyze(select(slot("name"), countStar())
                .from(from(table("t"))).groupBy(Literal.of(0)).build()));
    }

    @Test
    public void testGroupByKeysAreDeduplicated() {
        AnalyzeQueryState state = analyze(select(slot("name"))
                .from(from(table("t")))
                .groupBy(slot("name"), slot("t", "name"), Literal.of(1))
                .build());
        Assertions.assertEquals(1, state.getGroupByExpressions().size());
    }

    @Test
    public void testColumnNotInGroupBy() {
        AnalysisException exception = assertAnalysisError(ErrorCode.SYNTAX_ERROR,
                () -> analyze(select(slot("x"), countStar()).from(from(table("t"))).groupBy(slot("name")).build()));
        Assertions.assertTrue(exception.getMessage().contains("GROUP BY"), exception.getMessage());

        // aggregate without GROUP BY
        assertAnalysisError(ErrorCode.SYNTAX_ERROR,
                () -> analyze(select(slot("x"), countStar()).from(from(table("t"))).build()));
    }

    @Test
    public void testHavingWithoutAggregation() {
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> analyze(select(slot("x"))
                .from(from(table("t"))).having(gt(slot("x"), Literal.of(1))).build()));
    }

    @Test
    public void testHavingCollectsAggregates() {
        AnalyzeQueryState state = analyze(select(slot("name"))
                .from(from(table("t")))
                .groupBy(slot("name"))
                .having(gt(new UnboundFunction("sum", slot("x")), Literal.of(10)))
                .build());
        Assertions.assertEquals("sum(x)", state.getAggregateExpressions().get(0).toSql());
        Assertions.assertEquals(PrimitiveType.BIGINT, state.getAggregateExpressions().get(0).getDataType());
        Assertions.assertEquals(ImmutableList.of("default.t.name", "sum(x)"), names(state.getAfterAggrSchema()));
        Assertions.assertEquals(ImmutableList.of("name"), names(state.getFinalizeSchema()));
    }

    @Test
    public void testOrderByAliasFirst() {
        AnalyzeQueryState state = analyze(select(new UnboundAlias(slot("score"), "x"))
                .from(from(table("t")))
                .orderBy(asc(slot("x")))
                .build());
        SlotReference orderBy = (SlotReference) state.getOrderByExpressions().get(0).getExpr();
        Assertions.assertEquals("default.t.score", orderBy.toString());
        Assertions.assertTrue(state.getOrderByExpressions().get(0).isAsc());

        AnalyzeQueryState positional = analyze(select(slot("x"), slot("score"))
                .from(from(table("t")))
                .orderBy(new OrderKey(Literal.of(2), false, false))
                .build());
        Assertions.assertEquals("default.t.score", positional.getOrderByExpressions().get(0).getExpr().toString());
    }

    @Test
    public void testOrderByAggregate() {
        AnalyzeQueryState state = analyze(select(slot("name"))
                .from(from(table("t")))
                .groupBy(slot("name"))
                .orderBy(asc(countStar()))
                .build());
        Assertions.assertEquals(ImmutableList.of("default.t.name", "count(*)"), names(state.getAfterAggrSchema()));
    }

    @Test
    public void testJoinPredicates() {
        AnalyzeQueryState state = analyze(selectStarFrom(
                from(table("a")).join(table("b"), innerOn(eq(slot("a", "id"), slot("b", "id"))))));
        Assertions.assertEquals(1, state.getJoinPredicates().size());
        Assertions.assertEquals("(id = id)", state.getJoinPredicates().get(0).toSql());
        Assertions.assertFalse(state.getJoinPredicates().get(0).hasUnbound());

        assertAnalysisError(ErrorCode.TYPE_MISMATCH, () -> analyze(selectStarFrom(
                from(table("a")).join(table("b"), JoinOperator.inner(slot("a", "id"))))));
        assertAnalysisError(ErrorCode.NOT_FOUND, () -> analyze(selectStarFrom(
                from(table("a")).join(table("b"), innerOn(eq(slot("a", "id"), slot("c", "id")))))));
    }

    @Test
    public void testJoinConditionSeesOnlyItsOwnOperands() {
        // FROM a JOIN c ON id = 1, b: b.id is joined later and does not make id ambiguous
        AnalyzeQueryState state = analyze(selectStarFrom(
                from(table("a")).join(table("c"), innerOn(eq(slot("id"), Literal.of(1)))),
                from(table("b"))));
        BinaryOperator predicate = (BinaryOperator) state.getJoinPredicates().get(0);
        Assertions.assertEquals("default.a.id", predicate.left().toString());
        // the WHERE clause still sees the whole FROM clause
        assertAnalysisError(ErrorCode.AMBIGUOUS_NAME, () -> analyze(select(UnboundStar.all())
                .from(from(table("a")).join(table("c"), innerOn(eq(slot("id"), Literal.of(1)))), from(table("b")))
                .where(eq(slot("id"), Literal.of(1)))
                .build()));

        // FROM b JOIN a ON b.x = c.x, c: c is not in scope of that ON
        AnalysisException e = assertAnalysisError(ErrorCode.NOT_FOUND, () -> analyze(selectStarFrom(
                from(table("b")).join(table("a"), innerOn(eq(slot("b", "x"), slot("c", "x")))),
                from(table("c")))));
        Assertions.assertTrue(e.getMessage().contains("c.x"), e.getMessage());
    }

    @Test
    public void testExplain() {
        AnalyzedResult result = new QueryAnalyzer().analyze(
                new ExplainStatement(selectStarFrom(from(table("a")))), statementContext);
        Assertions.assertEquals(AnalyzedResult.Kind.EXPLAIN, result.getKind());
        AnalyzedResult explained = result.getExplained();
        Assertions.assertEquals(AnalyzedResult.Kind.SELECT_QUERY, explained.getKind());
        Assertions.assertEquals(ImmutableList.of("id"), names(explained.getSelectQueryState().getFinalizeSchema()));
        Assertions.assertThrows(IllegalStateException.class, result::getSelectQueryState);
    }

    @Test
    public void testFunctions() {
        assertAnalysisError(ErrorCode.NOT_FOUND, () -> analyze(select(
                new UnboundFunction("no_such_function", slot("x"))).from(from(table("t"))).build()));
        assertAnalysisError(ErrorCode.BAD_ARGUMENTS, () -> analyze(select(
                new UnboundFunction("upper", slot("y"))).from(from(table("c"))).build()));
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> analyze(select(
                new UnboundFunction("sum", countStar())).from(from(table("t"))).build()));

        AnalyzeQueryState state = analyze(select(new UnboundFunction("ABS", slot("score")))
                .from(from(table("t"))).build());
        Assertions.assertEquals(ImmutableList.of("abs(score)"), names(state.getFinalizeSchema()));
        Assertions.assertEquals(PrimitiveType.DOUBLE, state.getFinalizeSchema().getColumns().get(0).getDataType());
    }

    @Test
    public void testCancelled() {
        connectContext.cancel();
        assertAnalysisError(ErrorCode.CANCELLED, () -> analyze(selectStarFrom(from(table("a")))));
    }
}
