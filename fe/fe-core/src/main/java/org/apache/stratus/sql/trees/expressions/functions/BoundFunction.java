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
import org.apache.stratus.sql.trees.expressions.Expression;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 已绑定函数（Bound Function）的基类。
 * <p>
 * 解析阶段产出的是 UnboundFunction，只有函数名和参数表达式；
 * 语义分析阶段通过 FunctionRegistry 选定签名后得到 BoundFunction，类型由签名推导。
 */
public abstract class BoundFunction extends Expression {

    /** 结果可空性的推导方式 */
    public enum NullableMode {
        // nullable if any argument is nullable
        PROPAGATE,
        // nullable only if all arguments are nullable, e.g. coalesce
        ALL_ARGUMENTS_NULLABLE,
        ALWAYS_NULLABLE,
        ALWAYS_NOT_NULLABLE
    }

    protected final String name;
    protected final FunctionSignature signature;
    protected final NullableMode nullableMode;

    protected BoundFunction(String name, FunctionSignature signature, NullableMode nullableMode,
            List<Expression> arguments) {
        super(arguments);
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.signature = Objects.requireNonNull(signature, "signature can not be null");
        this.nullableMode = Objects.requireNonNull(nullableMode, "nullableMode can not be null");
    }

    public String getName() {
        return name;
    }

    public FunctionSignature getSignature() {
        return signature;
    }

    public NullableMode getNullableMode() {
        return nullableMode;
    }

    public List<Expression> getArguments() {
        return children;
    }

    public List<PrimitiveType> getArgumentsTypes() {
        return children.stream().map(Expression::getDataType).collect(ImmutableList.toImmutableList());
    }

    @Override
    public PrimitiveType getDataType() {
        return signature.computeReturnType(getArgumentsTypes());
    }

    @Override
    public boolean nullable() {
        switch (nullableMode) {
            case PROPAGATE:
                return children.stream().anyMatch(Expression::nullable);
            case ALL_ARGUMENTS_NULLABLE:
                return children.stream().allMatch(Expression::nullable);
            case ALWAYS_NULLABLE:
                return true;
            case ALWAYS_NOT_NULLABLE:
                return false;
            default:
                throw new IllegalStateException("unknown nullable mode " + nullableMode);
        }
    }

    protected String argumentsToSql() {
        return children.stream().map(Expression::toSql).collect(Collectors.joining(", "));
    }

    @Override
    protected boolean extraEquals(Expression other) {
        BoundFunction that = (BoundFunction) other;
        return name.equals(that.name) && nullableMode == that.nullableMode;
    }

    @Override
    protected int extraHashCode() {
        return name.hashCode();
    }
}
