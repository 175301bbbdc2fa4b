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

package org.apache.stratus.catalog;

import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.Literal;
import org.apache.stratus.sql.trees.expressions.SlotReference;
import org.apache.stratus.sql.trees.expressions.functions.AggregateFunction;
import org.apache.stratus.sql.trees.expressions.functions.BoundFunction;
import org.apache.stratus.sql.trees.expressions.functions.BoundFunction.NullableMode;
import org.apache.stratus.sql.trees.expressions.functions.FunctionBuilder;
import org.apache.stratus.sql.trees.expressions.functions.ScalarFunction;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class FunctionRegistryTest {
    private final FunctionRegistry registry = new FunctionRegistry();

    private static final SlotReference NULLABLE_INT = new SlotReference("i", PrimitiveType.INT, true);
    private static final SlotReference NOT_NULL_VARCHAR = new SlotReference("s", PrimitiveType.VARCHAR, false);

    @Test
    public void testScalarFunction() {
        BoundFunction upper = registry.buildFunction("UPPER", ImmutableList.of(NOT_NULL_VARCHAR), false);
        Assertions.assertTrue(upper instanceof ScalarFunction);
        Assertions.assertEquals(PrimitiveType.VARCHAR, upper.getDataType());
        Assertions.assertFalse(upper.nullable());
        Assertions.assertEquals("upper(s)", upper.toSql());

        BoundFunction abs = registry.buildFunction("abs", ImmutableList.of(NULLABLE_INT), false);
        Assertions.assertEquals(PrimitiveType.INT, abs.getDataType());
        Assertions.assertTrue(abs.nullable());
    }

    @Test
    public void testCoalesce() {
        List<Expression> args = ImmutableList.of(NULLABLE_INT, Literal.of(0));
        BoundFunction coalesce = registry.buildFunction("coalesce", args, false);
        Assertions.assertEquals(PrimitiveType.BIGINT, coalesce.getDataType());
        Assertions.assertFalse(coalesce.nullable());
    }

    @Test
    public void testAggregateFunction() {
        Assertions.assertTrue(registry.isAggregateFunction("COUNT"));
        Assertions.assertFalse(registry.isAggregateFunction("upper"));
        Assertions.assertFalse(registry.isAggregateFunction("no_such_function"));

        BoundFunction countStar = registry.buildFunction("count", ImmutableList.of(), false);
        Assertions.assertTrue(countStar instanceof AggregateFunction);
        Assertions.assertEquals("count(*)", countStar.toSql());
        Assertions.assertFalse(countStar.nullable());

        BoundFunction countDistinct = registry.buildFunction("count", ImmutableList.of(NULLABLE_INT), true);
        Assertions.assertEquals("count(DISTINCT i)", countDistinct.toSql());
        Assertions.assertEquals(PrimitiveType.BIGINT, countDistinct.getDataType());

        Assertions.assertEquals(PrimitiveType.DOUBLE, registry.buildFunction("sum",
                ImmutableList.of(Literal.of(1.5)), false).getDataType());
        Assertions.assertEquals(PrimitiveType.VARCHAR, registry.buildFunction("max",
                ImmutableList.of(NOT_NULL_VARCHAR), false).getDataType());
    }

    @Test
    public void testErrors() {
        AnalysisException notFound = Assertions.assertThrows(AnalysisException.class,
                () -> registry.buildFunction("no_such_function", ImmutableList.of(), false));
        Assertions.assertEquals(ErrorCode.NOT_FOUND, notFound.getErrorCode());

        AnalysisException badArguments = Assertions.assertThrows(AnalysisException.class,
                () -> registry.buildFunction("length", ImmutableList.of(NULLABLE_INT), false));
        Assertions.assertEquals(ErrorCode.BAD_ARGUMENTS, badArguments.getErrorCode());

        Assertions.assertEquals(ErrorCode.BAD_ARGUMENTS, Assertions.assertThrows(AnalysisException.class,
                () -> registry.buildFunction("upper", ImmutableList.of(NOT_NULL_VARCHAR), true)).getErrorCode());
    }

    @Test
    public void testRegisterMoreFunctions() {
        FunctionRegistry extended = new FunctionRegistry() {
            @Override
            protected void afterRegisterBuiltinFunctions(Map<String, FunctionBuilder> name2Builders) {
                name2Builders.put("pi", FunctionBuilder.scalar("pi", NullableMode.ALWAYS_NOT_NULLABLE,
                        FunctionSignature.ret(PrimitiveType.DOUBLE).args()));
            }
        };
        Assertions.assertTrue(extended.tryGetBuiltinBuilder("PI").isPresent());
        Assertions.assertFalse(registry.tryGetBuiltinBuilder("pi").isPresent());
        Assertions.assertEquals("pi()", extended.buildFunction("pi", ImmutableList.of(), false).toSql());
    }
}
