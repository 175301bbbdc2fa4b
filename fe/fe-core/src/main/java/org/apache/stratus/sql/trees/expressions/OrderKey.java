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

import java.util.Objects;

/**
 * ORDER BY 中的一项：表达式、升降序与 NULL 的位置。
 */
public class OrderKey {
    private final Expression expr;
    private final boolean isAsc;
    private final boolean nullFirst;

    public OrderKey(Expression expr, boolean isAsc, boolean nullFirst) {
        this.expr = Objects.requireNonNull(expr, "expr can not be null");
        this.isAsc = isAsc;
        this.nullFirst = nullFirst;
    }

    public Expression getExpr() {
        return expr;
    }

    public boolean isAsc() {
        return isAsc;
    }

    public boolean isNullFirst() {
        return nullFirst;
    }

    public OrderKey withExpression(Expression expr) {
        return new OrderKey(expr, isAsc, nullFirst);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OrderKey that = (OrderKey) o;
        return isAsc == that.isAsc && nullFirst == that.nullFirst && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, isAsc, nullFirst);
    }

    @Override
    public String toString() {
        return expr.toSql() + (isAsc ? " ASC" : " DESC") + (nullFirst ? " NULLS FIRST" : " NULLS LAST");
    }
}
