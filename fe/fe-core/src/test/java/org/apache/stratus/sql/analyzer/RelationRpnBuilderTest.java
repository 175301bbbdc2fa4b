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
import org.apache.stratus.sql.ast.JoinOperator;
import org.apache.stratus.sql.ast.JoinType;
import org.apache.stratus.sql.ast.TableFactor;
import org.apache.stratus.sql.ast.TableFunctionArg;
import org.apache.stratus.sql.ast.TableWithJoins;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.Literal;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

public class RelationRpnBuilderTest extends AnalyzerTestBase {

    @Test
    public void testEmptyFromUsesOneRowTable() {
        List<RelationRpnItem> rpn = RelationRpnBuilder.build(ImmutableList.of());
        Assertions.assertEquals(1, rpn.size());
        RelationRpnItem.TableItem item = (RelationRpnItem.TableItem) rpn.get(0);
        Assertions.assertEquals(ImmutableList.of(Config.system_database, Config.one_row_table), item.getNameParts());
        Assertions.assertFalse(item.getAlias().isPresent());
    }

    @Test
    public void testCommaAndExplicitJoin() {
        // FROM a, b JOIN c ON b.x = c.x
        JoinOperator on = innerOn(eq(slot("b", "x"), slot("c", "x")));
        List<RelationRpnItem> rpn = RelationRpnBuilder.build(ImmutableList.of(
                from(table("a")),
                from(table("b")).join(table("c"), on)));

        Assertions.assertEquals(5, rpn.size());
        Assertions.assertEquals(ImmutableList.of("a"), ((RelationRpnItem.TableItem) rpn.get(0)).getNameParts());
        Assertions.assertEquals(ImmutableList.of("b"), ((RelationRpnItem.TableItem) rpn.get(1)).getNameParts());
        Assertions.assertEquals(ImmutableList.of("c"), ((RelationRpnItem.TableItem) rpn.get(2)).getNameParts());
        Assertions.assertEquals(on, ((RelationRpnItem.JoinItem) rpn.get(3)).getJoinOperator());
        Assertions.assertEquals(JoinType.CROSS_JOIN,
                ((RelationRpnItem.JoinItem) rpn.get(4)).getJoinOperator().getJoinType());
    }

    @Test
    public void testNestedJoinIsFlattened() {
        // FROM a JOIN b, (c JOIN d), e
        TableWithJoins first = from(table("a")).join(table("b"), JoinOperator.cross());
        TableWithJoins nested = from(new TableFactor.NestedJoin(
                from(table("c")).join(table("d"), JoinOperator.cross())));
        List<RelationRpnItem> rpn = RelationRpnBuilder.build(ImmutableList.of(first, nested, from(table("e"))));

        Assertions.assertEquals(9, rpn.size());
        Assertions.assertEquals(5, rpn.stream().filter(RelationRpnItem::isOperand).count());
        // a b J c d J J e J
        boolean[] operands = {true, true, false, true, true, false, false, true, false};
        for (int i = 0; i < operands.length; i++) {
            Assertions.assertEquals(operands[i], rpn.get(i).isOperand(), "item " + i + " of " + rpn);
        }
    }

    @Test
    public void testTableFunctionAndDerived() {
        List<RelationRpnItem> rpn = RelationRpnBuilder.build(ImmutableList.of(
                from(table("numbers").withArgs(TableFunctionArg.of(Literal.of(10)))),
                from(derived(selectStarFrom(from(table("a"))), "s"))));
        Assertions.assertTrue(rpn.get(0) instanceof RelationRpnItem.TableFunctionItem);
        RelationRpnItem.DerivedItem derivedItem = (RelationRpnItem.DerivedItem) rpn.get(1);
        Assertions.assertEquals(Optional.of("s"), derivedItem.getAlias());
        Assertions.assertTrue(rpn.get(2) instanceof RelationRpnItem.JoinItem);
    }

    @Test
    public void testUnsupportedFactors() {
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> RelationRpnBuilder.build(ImmutableList.of(
                from(table("a").withHints(slot("nolock"))))));
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> RelationRpnBuilder.build(ImmutableList.of(
                from(table("numbers").withArgs(TableFunctionArg.of(Literal.of(1))).withAlias("n")))));
        assertAnalysisError(ErrorCode.SYNTAX_ERROR, () -> RelationRpnBuilder.build(ImmutableList.of(
                from(table("system", "numbers").withArgs(TableFunctionArg.of(Literal.of(1)))))));
        assertAnalysisError(ErrorCode.UNSUPPORTED, () -> RelationRpnBuilder.build(ImmutableList.of(
                from(new TableFactor.Derived(true, selectStarFrom(from(table("a"))), Optional.of("s"))))));
        assertAnalysisError(ErrorCode.UNSUPPORTED, () -> RelationRpnBuilder.build(ImmutableList.of(
                from(new TableFactor.TableFunction(slot("x"), Optional.empty())))));
        JoinOperator semi = new JoinOperator(JoinType.LEFT_SEMI_JOIN,
                Optional.of(eq(slot("a", "id"), slot("b", "id"))));
        assertAnalysisError(ErrorCode.UNSUPPORTED, () -> RelationRpnBuilder.build(ImmutableList.of(
                from(table("a")).join(table("b"), semi))));
    }
}
