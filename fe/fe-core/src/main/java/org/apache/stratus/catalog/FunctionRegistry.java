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
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.functions.BoundFunction;
import org.apache.stratus.sql.trees.expressions.functions.BoundFunction.NullableMode;
import org.apache.stratus.sql.trees.expressions.functions.FunctionBuilder;

import com.google.common.annotations.VisibleForTesting;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;

/**
 * 标量函数与聚合函数的注册表。
 *
 * 函数名不区分大小写。每个函数有一个或多个签名，查找时按参数类型选择第一个匹配的签名。
 */
@ThreadSafe
public class FunctionRegistry {

    private final Map<String, FunctionBuilder> name2BuiltinBuilders;

    public FunctionRegistry() {
        name2BuiltinBuilders = new ConcurrentHashMap<>();
        registerBuiltinFunctions();
        afterRegisterBuiltinFunctions(name2BuiltinBuilders);
    }

    // this function is used to test.
    // for example, you can create child class of FunctionRegistry and add more functions in this method
    @VisibleForTesting
    protected void afterRegisterBuiltinFunctions(Map<String, FunctionBuilder> name2Builders) {}

    private void registerBuiltinFunctions() {
        // scalar functions
        register(FunctionBuilder.scalar("abs", NullableMode.PROPAGATE,
                FunctionSignature.retFollowFirstArgument().args(PrimitiveType.DOUBLE)));
        register(FunctionBuilder.scalar("upper", NullableMode.PROPAGATE,
                FunctionSignature.ret(PrimitiveType.VARCHAR).args(PrimitiveType.VARCHAR)));
        register(FunctionBuilder.scalar("lower", NullableMode.PROPAGATE,
                FunctionSignature.ret(PrimitiveType.VARCHAR).args(PrimitiveType.VARCHAR)));
        register(FunctionBuilder.scalar("length", NullableMode.PROPAGATE,
                FunctionSignature.ret(PrimitiveType.INT).args(PrimitiveType.VARCHAR)));
        register(FunctionBuilder.scalar("concat", NullableMode.PROPAGATE,
                FunctionSignature.ret(PrimitiveType.VARCHAR).varArgs(PrimitiveType.VARCHAR)));
        register(FunctionBuilder.scalar("coalesce", NullableMode.ALL_ARGUMENTS_NULLABLE,
                FunctionSignature.retWiderOfArguments().varArgs(PrimitiveType.ANY)));
        register(FunctionBuilder.scalar("now", NullableMode.ALWAYS_NOT_NULLABLE,
                FunctionSignature.ret(PrimitiveType.DATETIME).args()));
        register(FunctionBuilder.scalar("to_date", NullableMode.PROPAGATE,
                FunctionSignature.ret(PrimitiveType.DATE).args(PrimitiveType.DATETIME)));

        // aggregate functions, count(*) is bound with no argument
        register(FunctionBuilder.aggregate("count", NullableMode.ALWAYS_NOT_NULLABLE,
                FunctionSignature.ret(PrimitiveType.BIGINT).args(),
                FunctionSignature.ret(PrimitiveType.BIGINT).varArgs(PrimitiveType.ANY)));
        register(FunctionBuilder.aggregate("sum", NullableMode.ALWAYS_NULLABLE,
                FunctionSignature.ret(PrimitiveType.BIGINT).args(PrimitiveType.BIGINT),
                FunctionSignature.ret(PrimitiveType.DOUBLE).args(PrimitiveType.DOUBLE)));
        register(FunctionBuilder.aggregate("avg", NullableMode.ALWAYS_NULLABLE,
                FunctionSignature.ret(PrimitiveType.DOUBLE).args(PrimitiveType.DOUBLE)));
        register(FunctionBuilder.aggregate("min", NullableMode.ALWAYS_NULLABLE,
                FunctionSignature.retFollowFirstArgument().args(PrimitiveType.ANY)));
        register(FunctionBuilder.aggregate("max", NullableMode.ALWAYS_NULLABLE,
                FunctionSignature.retFollowFirstArgument().args(PrimitiveType.ANY)));
    }

    /** register or replace a function */
    public void register(FunctionBuilder builder) {
        name2BuiltinBuilders.put(builder.getName().toLowerCase(Locale.ROOT), builder);
    }

    public Optional<FunctionBuilder> tryGetBuiltinBuilder(String name) {
        return Optional.ofNullable(name2BuiltinBuilders.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean isAggregateFunction(String name) {
        return tryGetBuiltinBuilder(name).map(FunctionBuilder::isAggregate).orElse(false);
    }

    /**
     * 根据函数名和已绑定的参数构建函数调用。
     *
     * @throws AnalysisException NOT_FOUND 函数不存在；BAD_ARGUMENTS 没有签名能接受这些参数
     */
    public BoundFunction buildFunction(String name, List<Expression> arguments, boolean distinct) {
        FunctionBuilder builder = tryGetBuiltinBuilder(name)
                .orElseThrow(() -> AnalysisException.notFound("Can not found function '" + name + "'"));
        return builder.build(arguments, distinct);
    }
}
