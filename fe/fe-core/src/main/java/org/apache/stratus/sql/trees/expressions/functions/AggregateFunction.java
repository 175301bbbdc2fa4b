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
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;

import java.util.List;

/**
 * 聚合函数调用，例如 count(*)、sum(DISTINCT x)。
 */
public class AggregateFunction extends BoundFunction {
    private final boolean distinct;

    public AggregateFunction(String name, boolean distinct, FunctionSignature signature, NullableMode nullableMode,
            List<Expression> arguments) {
        super(name, signature, nullableMode, arguments);
        this.distinct = distinct;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public String toSql() {
        if (children.isEmpty()) {
            return name + "(*)";
        }
        return name + "(" + (distinct ? "DISTINCT " : "") + argumentsToSql() + ")";
    }

    @Override
    protected boolean extraEquals(Expression other) {
        return super.extraEquals(other) && distinct == ((AggregateFunction) other).distinct;
    }

    @Override
    public AggregateFunction withChildren(List<Expression> children) {
        return new AggregateFunction(name, distinct, signature, nullableMode, children);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitAggregateFunction(this, context);
    }
}
