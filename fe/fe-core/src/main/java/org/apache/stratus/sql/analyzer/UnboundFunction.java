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

import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression for unbound function.
 * count(*) 解析为没有参数的 UnboundFunction。
 */
public class UnboundFunction extends Expression implements Unbound {
    private final String name;
    private final boolean distinct;

    public UnboundFunction(String name, Expression... arguments) {
        this(name, false, ImmutableList.copyOf(arguments));
    }

    public UnboundFunction(String name, boolean distinct, List<Expression> arguments) {
        super(arguments);
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.distinct = distinct;
    }

    public String getName() {
        return name;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<Expression> getArguments() {
        return children;
    }

    @Override
    public String toSql() {
        if (children.isEmpty()) {
            return name + "()";
        }
        return name + "(" + (distinct ? "DISTINCT " : "")
                + children.stream().map(Expression::toSql).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    protected boolean extraEquals(Expression other) {
        UnboundFunction that = (UnboundFunction) other;
        return distinct == that.distinct && name.equalsIgnoreCase(that.name);
    }

    @Override
    protected int extraHashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public UnboundFunction withChildren(List<Expression> children) {
        return new UnboundFunction(name, distinct, children);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnboundFunction(this, context);
    }
}
