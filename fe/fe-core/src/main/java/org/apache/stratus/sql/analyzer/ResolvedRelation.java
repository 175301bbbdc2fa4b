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
import org.apache.stratus.sql.util.Utils;

import java.util.List;
import java.util.Objects;

/**
 * FROM 子句的解析结果：组合后的 schema，以及按出现顺序收集的 ON 条件（尚未绑定）。
 * 每个 ON 条件带着它所属 join 组合出的 schema，条件只能引用这个 schema 中的列。
 */
public class ResolvedRelation {
    private final QualifiedSchema schema;
    private final List<JoinCondition> joinConditions;

    public ResolvedRelation(QualifiedSchema schema, List<JoinCondition> joinConditions) {
        this.schema = Objects.requireNonNull(schema, "schema can not be null");
        this.joinConditions = Utils.fastToImmutableList(
                Objects.requireNonNull(joinConditions, "joinConditions can not be null"));
    }

    public QualifiedSchema getSchema() {
        return schema;
    }

    public List<JoinCondition> getJoinConditions() {
        return joinConditions;
    }

    @Override
    public String toString() {
        return "ResolvedRelation(" + schema + ", " + joinConditions + ")";
    }

    /** an unbound ON condition and the schema of the two operands its join composes */
    public static class JoinCondition {
        private final Expression condition;
        private final QualifiedSchema scope;

        public JoinCondition(Expression condition, QualifiedSchema scope) {
            this.condition = Objects.requireNonNull(condition, "condition can not be null");
            this.scope = Objects.requireNonNull(scope, "scope can not be null");
        }

        public Expression getCondition() {
            return condition;
        }

        public QualifiedSchema getScope() {
            return scope;
        }

        @Override
        public String toString() {
            return condition + " in " + scope;
        }
    }
}
