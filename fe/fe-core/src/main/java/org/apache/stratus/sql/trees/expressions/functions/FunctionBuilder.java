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

package org.apache.stratus.sql.trees.expressions.functions;

import org.apache.stratus.catalog.FunctionSignature;
import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.functions.BoundFunction.NullableMode;
import org.apache.stratus.sql.util.Utils;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * 根据已绑定的参数选择签名并构建 BoundFunction。
 */
public class FunctionBuilder {
    private final String name;
    private final boolean aggregate;
    private final List<FunctionSignature> signatures;
    private final NullableMode nullableMode;

    private FunctionBuilder(String name, boolean aggregate, NullableMode nullableMode,
            List<FunctionSignature> signatures) {
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.aggregate = aggregate;
        this.nullableMode = Objects.requireNonNull(nullableMode, "nullableMode can not be null");
        this.signatures = Utils.fastToImmutableList(signatures);
    }

    public static FunctionBuilder scalar(String name, NullableMode nullableMode, FunctionSignature... signatures) {
        return new FunctionBuilder(name, false, nullableMode, ImmutableList.copyOf(signatures));
    }

    public static FunctionBuilder aggregate(String name, NullableMode nullableMode, FunctionSignature... signatures) {
        return new FunctionBuilder(name, true, nullableMode, ImmutableList.copyOf(signatures));
    }

    public String getName() {
        return name;
    }

    public boolean isAggregate() {
        return aggregate;
    }

    public List<FunctionSignature> getSignatures() {
        return signatures;
    }

    /**
     * 按声明顺序选取第一个能接受实参类型的签名。
     *
     * @throws AnalysisException BAD_ARGUMENTS if no signature accepts the arguments
     */
    public BoundFunction build(List<Expression> arguments, boolean distinct) {
        if (distinct && !aggregate) {
            throw AnalysisException.badArguments("DISTINCT is only allowed in aggregate function, but got "
                    + name + "(DISTINCT ...)");
        }
        List<PrimitiveType> argTypes = arguments.stream()
                .map(Expression::getDataType)
                .collect(ImmutableList.toImmutableList());
        for (FunctionSignature signature : signatures) {
            if (signature.matches(argTypes)) {
                return aggregate
                        ? new AggregateFunction(name, distinct, signature, nullableMode, arguments)
                        : new ScalarFunction(name, signature, nullableMode, arguments);
            }
        }
        throw AnalysisException.badArguments("Can not find the compatibility function signature: "
                + name + argTypes + ", candidate signatures are: " + signatures);
    }
}
