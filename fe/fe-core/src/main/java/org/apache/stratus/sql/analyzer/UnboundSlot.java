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
 * 列引用，名称由一到多段组成：col、t.col、db.t.col。
 */
public class UnboundSlot extends NamedExpression implements Unbound {
    private final List<String> nameParts;

    public UnboundSlot(String... nameParts) {
        this(ImmutableList.copyOf(nameParts));
    }

    public UnboundSlot(List<String> nameParts) {
        super();
        this.nameParts = Utils.fastToImmutableList(Objects.requireNonNull(nameParts, "nameParts can not be null"));
        Preconditions.checkArgument(!this.nameParts.isEmpty(), "column name can not be empty");
    }

    public List<String> getNameParts() {
        return nameParts;
    }

    @Override
    public String getName() {
        return nameParts.get(nameParts.size() - 1);
    }

    @Override
    public List<String> getQualifier() {
        return nameParts.subList(0, nameParts.size() - 1);
    }

    @Override
    public Slot toSlot() {
        throw new UnboundException(toSql() + ".toSlot()");
    }

    @Override
    public String toSql() {
        return Utils.toSqlName(nameParts);
    }

    @Override
    protected boolean extraEquals(Expression other) {
        return nameParts.equals(((UnboundSlot) other).nameParts);
    }

    @Override
    protected int extraHashCode() {
        return nameParts.hashCode();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.isEmpty());
        return this;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnboundSlot(this, context);
    }
}
