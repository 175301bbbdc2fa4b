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

package org.apache.stratus.sql.trees.expressions;

import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.common.Config;
import org.apache.stratus.sql.analyzer.UnboundFunction;
import org.apache.stratus.sql.analyzer.UnboundSlot;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.exceptions.UnboundException;
import org.apache.stratus.sql.trees.expressions.BinaryOperator.Operator;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ExpressionTest {
    private final int originDepthLimit = Config.expr_depth_limit;
    private final int originChildrenLimit = Config.expr_children_limit;

    @AfterEach
    public void tearDown() {
        Config.expr_depth_limit = originDepthLimit;
        Config.expr_children_limit = originChildrenLimit;
    }

    @Test
    public void testDepthLimit() {
        Config.expr_depth_limit = 3;
        Expression expr = new Not(new Not(Literal.TRUE));
        Assertions.assertEquals(3, expr.getDepth());
        AnalysisException exception = Assertions.assertThrows(AnalysisException.class, () -> new Not(expr));
        Assertions.assertEquals(ErrorCode.EXPRESSION_EXCEEDS_LIMIT, exception.getErrorCode());
    }

    @Test
    public void testChildrenLimit() {
        Config.expr_children_limit = 3;
        Expression sum = new BinaryOperator(Operator.ADD, Literal.of(1), Literal.of(2));
        Assertions.assertEquals(2, sum.getWidth());
        Assertions.assertThrows(AnalysisException.class,
                () -> new BinaryOperator(Operator.ADD, sum, sum));
    }

    @Test
    public void testUnbound() {
        Expression expr = new BinaryOperator(Operator.EQ, new UnboundSlot("t", "x"), Literal.of(1));
        Assertions.assertTrue(expr.hasUnbound());
        Assertions.assertFalse(Literal.of(1).hasUnbound());
        Assertions.assertThrows(UnboundException.class, () -> new UnboundSlot("x").getDataType());
        Assertions.assertEquals("(`t`.`x` = 1)", expr.toSql());
        Assertions.assertEquals(new UnboundFunction("COUNT"), new UnboundFunction("count"));
    }

    @Test
    public void testTypes() {
        SlotReference x = new SlotReference("x", PrimitiveType.INT, false, ImmutableList.of("t"));
        Assertions.assertEquals(PrimitiveType.BIGINT,
                new BinaryOperator(Operator.ADD, x, Literal.of(1)).getDataType());
        Assertions.assertEquals(PrimitiveType.DOUBLE,
                new BinaryOperator(Operator.DIVIDE, x, Literal.of(1)).getDataType());
        Assertions.assertTrue(new BinaryOperator(Operator.DIVIDE, x, Literal.of(1)).nullable());
        Assertions.assertFalse(new BinaryOperator(Operator.LT, x, Literal.of(1)).nullable());
        Assertions.assertEquals(PrimitiveType.INT, new Alias(x, "y").toSlot().getDataType());
        Assertions.assertTrue(new Alias(x, "y").toSlot().getQualifier().isEmpty());
        Assertions.assertFalse(x.isConstant());
        Assertions.assertTrue(Literal.of(1).isConstant());
    }

    @Test
    public void testCheckLegality() {
        Expression mismatch = new BinaryOperator(Operator.AND, Literal.of(1), Literal.of("a"));
        AnalysisException exception = Assertions.assertThrows(AnalysisException.class, mismatch::checkLegality);
        Assertions.assertEquals(ErrorCode.TYPE_MISMATCH, exception.getErrorCode());
        new BinaryOperator(Operator.AND, Literal.TRUE, Literal.NULL).checkLegality();
    }
}
