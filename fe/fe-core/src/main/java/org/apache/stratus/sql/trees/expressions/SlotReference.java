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

import org.apache.stratus.catalog.Column;
import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;
import org.apache.stratus.sql.util.Utils;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Reference to slot in expression.
 *
 * qualifier 是列的名称前缀，例如 [db, table]、[alias]，表函数和未命名子查询的列没有前缀。
 */
public class SlotReference extends Slot {
    protected final String name;
    protected final PrimitiveType dataType;
    protected final boolean nullable;
    protected final List<String> qualifier;

    public SlotReference(String name, PrimitiveType dataType) {
        this(name, dataType, true, ImmutableList.of());
    }

    public SlotReference(String name, PrimitiveType dataType, boolean nullable) {
        this(name, dataType, nullable, ImmutableList.of());
    }

    /**
     * Constructor for SlotReference.
     *
     * @param name slot reference name
     * @param dataType slot reference data type
     * @param nullable true if nullable
     * @param qualifier slot reference qualifier
     */
    public SlotReference(String name, PrimitiveType dataType, boolean nullable, List<String> qualifier) {
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType can not be null");
        this.nullable = nullable;
        this.qualifier = Utils.fastToImmutableList(Objects.requireNonNull(qualifier, "qualifier can not be null"));
    }

    /**
     * get SlotReference from a column
     * @param column the column which contains type info
     * @param qualifier the qualifier of SlotReference
     */
    public static SlotReference fromColumn(Column column, List<String> qualifier) {
        return new SlotReference(column.getName(), column.getType(), column.isAllowNull(), qualifier);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getQualifier() {
        return qualifier;
    }

    public String getQualifiedName() {
        return Utils.qualifiedName(qualifier, name);
    }

    @Override
    public PrimitiveType getDataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public SlotReference withQualifier(List<String> qualifier) {
        return new SlotReference(name, dataType, nullable, qualifier);
    }

    @Override
    public SlotReference withNullable(boolean nullable) {
        if (this.nullable == nullable) {
            return this;
        }
        return new SlotReference(name, dataType, nullable, qualifier);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitSlotReference(this, context);
    }

    @Override
    public String toSql() {
        return name;
    }

    @Override
    protected boolean extraEquals(Expression other) {
        SlotReference that = (SlotReference) other;
        return nullable == that.nullable && dataType == that.dataType
                && name.equals(that.name) && qualifier.equals(that.qualifier);
    }

    @Override
    protected int extraHashCode() {
        return Objects.hash(name, qualifier);
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
