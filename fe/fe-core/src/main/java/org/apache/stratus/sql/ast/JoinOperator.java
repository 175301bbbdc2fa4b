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

import com.google.common.base.Preconditions;

import java.util.Objects;
import java.util.Optional;

/**
 * Join 类型与可选的 ON 条件。CROSS JOIN 没有条件。
 */
public class JoinOperator {
    private final JoinType joinType;
    private final Optional<Expression> condition;

    public JoinOperator(JoinType joinType, Optional<Expression> condition) {
        this.joinType = Objects.requireNonNull(joinType, "joinType can not be null");
        this.condition = Objects.requireNonNull(condition, "condition can not be null");
        Preconditions.checkArgument(joinType != JoinType.CROSS_JOIN || !condition.isPresent(),
                "cross join can not have a condition");
    }

    public static JoinOperator cross() {
        return new JoinOperator(JoinType.CROSS_JOIN, Optional.empty());
    }

    public static JoinOperator inner(Expression condition) {
        return new JoinOperator(JoinType.INNER_JOIN, Optional.of(condition));
    }

    public static JoinOperator leftOuter(Expression condition) {
        return new JoinOperator(JoinType.LEFT_OUTER_JOIN, Optional.of(condition));
    }

    public static JoinOperator rightOuter(Expression condition) {
        return new JoinOperator(JoinType.RIGHT_OUTER_JOIN, Optional.of(condition));
    }

    public static JoinOperator fullOuter(Expression condition) {
        return new JoinOperator(JoinType.FULL_OUTER_JOIN, Optional.of(condition));
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public Optional<Expression> getCondition() {
        return condition;
    }

    public String toSql() {
        return joinType.toSql() + condition.map(c -> " ON " + c.toSql()).orElse("");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JoinOperator that = (JoinOperator) o;
        return joinType == that.joinType && condition.equals(that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(joinType, condition);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
