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

import org.apache.stratus.common.Config;
import org.apache.stratus.sql.ast.ExplainStatement;
import org.apache.stratus.sql.ast.SelectStatement;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.Literal;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

public class SubqueryResolverTest extends AnalyzerTestBase {
    private final int originNestingDepth = Config.max_subquery_nesting_depth;

    @AfterEach
    public void tearDown() {
        Config.max_subquery_nesting_depth = originNestingDepth;
    }

    private QualifiedSchema resolve(SelectStatement subquery, String alias) {
        return new SubqueryResolver(statementContext).resolve(subquery, Optional.ofNullable(alias));
    }

    @Test
    public void testAliasedDerivedTable() {
        QualifiedSchema schema = resolve(select(slot("x")).from(from(table("t"))).build(), "s");
        Assertions.assertEquals(ImmutableList.of("s.x"), names(schema));
        Assertions.assertEquals(0, statementContext.getSubqueryDepth());
        Assertions.assertEquals(1, statementContext.getMaxSubqueryDepth());
    }

    @Test
    public void testUnaliasedDerivedTable() {
        QualifiedSchema schema = resolve(select(slot("x"), slot("name")).from(from(table("t"))).build(), null);
        Assertions.assertEquals(ImmutableList.of("x", "name"), names(schema));
    }

    @Test
    public void testProjectionAliases() {
        SelectStatement subquery = select(
                new UnboundAlias(slot("score"), "s1"),
                new UnboundAlias(new UnboundFunction("upper", slot("name")), "n"),
                Literal.of(1))
                .from(from(table("t")))
                .build();
        Assertions.assertEquals(ImmutableList.of("d.s1", "d.n", "d.1"), names(resolve(subquery, "d")));
    }

    @Test
    public void testOuterQueryReadsDerivedColumns() {
        SelectStatement inner = select(new UnboundAlias(slot("x"), "v")).from(from(table("t"))).build();
        AnalyzeQueryState state = analyze(select(slot("s", "v")).from(from(derived(inner, "s"))).build());
        Assertions.assertEquals(ImmutableList.of("s.v"), names(state.getJoinedSchema()));
        Assertions.assertEquals(ImmutableList.of("v"), names(state.getFinalizeSchema()));

        // inner columns are not visible outside
        assertAnalysisError(ErrorCode.NOT_FOUND,
                () -> analyze(select(slot("x")).from(from(derived(inner, "s"))).build()));
    }

    @Test
    public void testExplainIsNotADerivedTable() {
        ExplainStatement explain = new ExplainStatement(selectStarFrom(from(table("a"))));
        AnalysisException exception = assertAnalysisError(ErrorCode.INTERNAL_ERROR,
                () -> new SubqueryResolver(statementContext).resolve(explain, Optional.of("s")));
        Assertions.assertTrue(exception.getMessage().startsWith("[INTERNAL] "), exception.getMessage());
        Assertions.assertEquals(0, statementContext.getSubqueryDepth());
    }

    @Test
    public void testNestingDepth() {
        Config.max_subquery_nesting_depth = 2;
        SelectStatement level1 = selectStarFrom(from(table("a")));
        SelectStatement level2 = selectStarFrom(from(derived(level1, "l1")));
        SelectStatement level3 = selectStarFrom(from(derived(level2, "l2")));

        AnalyzeQueryState state = analyze(level3);
        Assertions.assertEquals(ImmutableList.of("l2.id"), names(state.getJoinedSchema()));
        Assertions.assertEquals(2, statementContext.getMaxSubqueryDepth());

        SelectStatement level4 = selectStarFrom(from(derived(level3, "l3")));
        assertAnalysisError(ErrorCode.NESTING_TOO_DEEP, () -> analyze(level4));
        // depth is restored after a failure
        Assertions.assertEquals(0, statementContext.getSubqueryDepth());
    }

    @Test
    public void testDuplicateDerivedAlias() {
        SelectStatement inner = select(slot("x")).from(from(table("t"))).build();
        assertAnalysisError(ErrorCode.DUPLICATE_NAME,
                () -> analyze(selectStarFrom(from(derived(inner, "s")), from(derived(inner, "s")))));

        // unaliased derived tables do not conflict, but their columns can not be referenced by name
        AnalyzeQueryState state = analyze(selectStarFrom(from(derived(inner, null)), from(derived(inner, null))));
        Assertions.assertEquals(ImmutableList.of("x", "x"), names(state.getFinalizeSchema()));
        assertAnalysisError(ErrorCode.AMBIGUOUS_NAME,
                () -> analyze(select(slot("x")).from(from(derived(inner, null)), from(derived(inner, null))).build()));
    }
}
