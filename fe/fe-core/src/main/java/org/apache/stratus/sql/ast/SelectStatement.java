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

package org.apache.stratus.sql.ast;

import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.OrderKey;
import org.apache.stratus.sql.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * SELECT 语句的语法树。
 *
 * selectList 中的元素为未绑定的表达式：UnboundStar、UnboundAlias 或任意表达式。
 * from 为空表示没有 FROM 子句，例如 SELECT 1。
 */
public class SelectStatement extends QueryStatement {
    private final List<Expression> selectList;
    private final List<TableWithJoins> from;
    private final Optional<Expression> where;
    private final List<Expression> groupBy;
    private final Optional<Expression> having;
    private final List<OrderKey> orderBy;

    /** SelectStatement */
    public SelectStatement(List<Expression> selectList, List<TableWithJoins> from, Optional<Expression> where,
            List<Expression> groupBy, Optional<Expression> having, List<OrderKey> orderBy) {
        this.selectList = Utils.fastToImmutableList(Objects.requireNonNull(selectList, "selectList can not be null"));
        this.from = Utils.fastToImmutableList(Objects.requireNonNull(from, "from can not be null"));
        this.where = Objects.requireNonNull(where, "where can not be null");
        this.groupBy = Utils.fastToImmutableList(Objects.requireNonNull(groupBy, "groupBy can not be null"));
        this.having = Objects.requireNonNull(having, "having can not be null");
        this.orderBy = Utils.fastToImmutableList(Objects.requireNonNull(orderBy, "orderBy can not be null"));
        Preconditions.checkArgument(!this.selectList.isEmpty(), "select list can not be empty");
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Expression> getSelectList() {
        return selectList;
    }

    public List<TableWithJoins> getFrom() {
        return from;
    }

    public Optional<Expression> getWhere() {
        return where;
    }

    public List<Expression> getGroupBy() {
        return groupBy;
    }

    public Optional<Expression> getHaving() {
        return having;
    }

    public List<OrderKey> getOrderBy() {
        return orderBy;
    }

    @Override
    public String toSql() {
        StringBuilder sb = new StringBuilder("SELECT ");
        sb.append(selectList.stream().map(Expression::toSql).collect(Collectors.joining(", ")));
        if (!from.isEmpty()) {
            sb.append(" FROM ").append(from.stream().map(TableWithJoins::toSql).collect(Collectors.joining(", ")));
        }
        where.ifPresent(w -> sb.append(" WHERE ").append(w.toSql()));
        if (!groupBy.isEmpty()) {
            sb.append(" GROUP BY ").append(groupBy.stream().map(Expression::toSql).collect(Collectors.joining(", ")));
        }
        having.ifPresent(h -> sb.append(" HAVING ").append(h.toSql()));
        if (!orderBy.isEmpty()) {
            sb.append(" ORDER BY ").append(orderBy.stream().map(OrderKey::toString).collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    /** builder of SelectStatement, mostly used by the parser and tests */
    public static class Builder {
        private final List<Expression> selectList = Lists.newArrayList();
        private final List<TableWithJoins> from = Lists.newArrayList();
        private Expression where;
        private final List<Expression> groupBy = Lists.newArrayList();
        private Expression having;
        private final List<OrderKey> orderBy = Lists.newArrayList();

        public Builder select(Expression... items) {
            selectList.addAll(ImmutableList.copyOf(items));
            return this;
        }

        public Builder from(TableWithJoins... relations) {
            from.addAll(ImmutableList.copyOf(relations));
            return this;
        }

        public Builder where(Expression predicate) {
            this.where = predicate;
            return this;
        }

        public Builder groupBy(Expression... keys) {
            groupBy.addAll(ImmutableList.copyOf(keys));
            return this;
        }

        public Builder having(Expression predicate) {
            this.having = predicate;
            return this;
        }

        public Builder orderBy(OrderKey... keys) {
            orderBy.addAll(ImmutableList.copyOf(keys));
            return this;
        }

        public SelectStatement build() {
            return new SelectStatement(selectList, from, Optional.ofNullable(where), groupBy,
                    Optional.ofNullable(having), orderBy);
        }
    }
}
