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
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Expression for alias, such as col1 as c1.
 */
public class Alias extends NamedExpression {

    private final String name;

    /**
     * constructor of Alias.
     *
     * @param child expression that alias represents for
     * @param name alias name
     */
    public Alias(Expression child, String name) {
        super(child);
        this.name = Objects.requireNonNull(name, "name can not be null");
    }

    /**
     * 将 Alias 转换为 SlotReference，作为投影阶段的输出列。
     * 输出列没有前缀，外层查询引用派生表时会加上派生表的别名。
     */
    @Override
    public Slot toSlot() {
        return new SlotReference(name, child().getDataType(), child().nullable(), ImmutableList.of());
    }

    public Expression child() {
        return child(0);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getQualifier() {
        return ImmutableList.of();
    }

    @Override
    public PrimitiveType getDataType() {
        return child().getDataType();
    }

    @Override
    public boolean nullable() {
        return child().nullable();
    }

    @Override
    public String toSql() {
        return child().toSql() + " AS `" + name + "`";
    }

    @Override
    protected boolean extraEquals(Expression other) {
        return name.equals(((Alias) other).name);
    }

    @Override
    protected int extraHashCode() {
        return name.hashCode();
    }

    @Override
    public Alias withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.size() == 1);
        return new Alias(children.get(0), name);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitAlias(this, context);
    }
}
