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

import java.util.List;
import java.util.Objects;

/**
 * 常量：整数、浮点数、字符串、布尔值或 NULL。
 */
public class Literal extends Expression {
    public static final Literal NULL = new Literal(null, PrimitiveType.NULL_TYPE);
    public static final Literal TRUE = new Literal(true, PrimitiveType.BOOLEAN);
    public static final Literal FALSE = new Literal(false, PrimitiveType.BOOLEAN);

    private final Object value;
    private final PrimitiveType dataType;

    private Literal(Object value, PrimitiveType dataType) {
        super();
        this.value = value;
        this.dataType = dataType;
    }

    public static Literal of(long value) {
        return new Literal(value, PrimitiveType.BIGINT);
    }

    public static Literal of(double value) {
        return new Literal(value, PrimitiveType.DOUBLE);
    }

    public static Literal of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Literal of(String value) {
        return new Literal(Objects.requireNonNull(value, "use Literal.NULL for null"), PrimitiveType.VARCHAR);
    }

    public Object getValue() {
        return value;
    }

    public boolean isNullLiteral() {
        return dataType == PrimitiveType.NULL_TYPE;
    }

    public boolean isIntegerLiteral() {
        return dataType.isIntegerType();
    }

    /** value of an integer literal */
    public long getLongValue() {
        Preconditions.checkState(isIntegerLiteral(), "%s is not an integer literal", toSql());
        return (Long) value;
    }

    @Override
    public PrimitiveType getDataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toSql() {
        if (value == null) {
            return "NULL";
        }
        if (dataType == PrimitiveType.VARCHAR) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        if (dataType == PrimitiveType.BOOLEAN) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        return String.valueOf(value);
    }

    @Override
    protected boolean extraEquals(Expression other) {
        Literal that = (Literal) other;
        return dataType == that.dataType && Objects.equals(value, that.value);
    }

    @Override
    protected int extraHashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.isEmpty());
        return this;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
