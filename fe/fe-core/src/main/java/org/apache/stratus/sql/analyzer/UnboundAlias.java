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

import org.apache.stratus.sql.exceptions.UnboundException;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.NamedExpression;
import org.apache.stratus.sql.trees.expressions.Slot;
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Expression for unbound alias: {@code expr AS name} in the select list.
 */
public class UnboundAlias extends NamedExpression implements Unbound {
    private final String alias;

    public UnboundAlias(Expression child, String alias) {
        super(child);
        this.alias = Objects.requireNonNull(alias, "alias can not be null");
    }

    public Expression child() {
        return child(0);
    }

    @Override
    public String getName() {
        return alias;
    }

    @Override
    public List<String> getQualifier() {
        return ImmutableList.of();
    }

    @Override
    public Slot toSlot() {
        throw new UnboundException(toSql() + ".toSlot()");
    }

    @Override
    public String toSql() {
        return child().toSql() + " AS `" + alias + "`";
    }

    @Override
    protected boolean extraEquals(Expression other) {
        return alias.equals(((UnboundAlias) other).alias);
    }

    @Override
    protected int extraHashCode() {
        return alias.hashCode();
    }

    @Override
    public UnboundAlias withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.size() == 1);
        return new UnboundAlias(children.get(0), alias);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnboundAlias(this, context);
    }
}
