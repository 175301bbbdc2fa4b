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
import org.apache.stratus.sql.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Star in the select list: {@code *} or {@code t.*}.
 */
public class UnboundStar extends NamedExpression implements Unbound {
    private final List<String> qualifier;

    public UnboundStar(List<String> qualifier) {
        super();
        this.qualifier = Utils.fastToImmutableList(Objects.requireNonNull(qualifier, "qualifier can not be null"));
    }

    public static UnboundStar all() {
        return new UnboundStar(ImmutableList.of());
    }

    @Override
    public String getName() {
        throw new UnboundException("*.getName()");
    }

    @Override
    public List<String> getQualifier() {
        return qualifier;
    }

    @Override
    public Slot toSlot() {
        throw new UnboundException(toSql() + ".toSlot()");
    }

    @Override
    public String toSql() {
        return qualifier.isEmpty() ? "*" : Utils.toSqlName(qualifier) + ".*";
    }

    @Override
    protected boolean extraEquals(Expression other) {
        return qualifier.equals(((UnboundStar) other).qualifier);
    }

    @Override
    protected int extraHashCode() {
        return qualifier.hashCode();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.isEmpty());
        return this;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnboundStar(this, context);
    }
}
