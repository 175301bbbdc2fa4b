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

import org.apache.stratus.qe.StatementContext;
import org.apache.stratus.sql.ast.TableWithJoins;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.NamedExpression;
import org.apache.stratus.sql.trees.expressions.OrderKey;
import org.apache.stratus.sql.util.Utils;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一条 SELECT 语句的分析结果。
 *
 * create() 解析 FROM 子句，得到 joinedSchema 与尚未绑定的 ON 条件，其余字段为空。
 * 之后各阶段按 join 谓词 -> 过滤 -> group by -> 聚合 -> having -> order by -> 投影 -> schema 的顺序，
 * 通过 withXxx() 在前一阶段的结果上产生新的对象，对象本身不可变。
 *
 * 只有 finalizeSchema 对外暴露：外层查询引用派生表时只使用它。
 */
public class AnalyzeQueryState {
    private final QualifiedSchema joinedSchema;
    // ON conditions of the FROM clause, unbound, each with the schema of its own join
    private final List<ResolvedRelation.JoinCondition> joinConditions;
    private final List<Expression> joinPredicates;
    private final Optional<Expression> filterPredicate;
    private final List<Expression> beforeGroupByExpressions;
    private final List<Expression> groupByExpressions;
    private final List<Expression> aggregateExpressions;
    private final List<Expression> beforeHavingExpressions;
    private final Optional<Expression> havingPredicate;
    private final List<OrderKey> orderByExpressions;
    private final List<NamedExpression> projectionExpressions;
    private final QualifiedSchema beforeAggrSchema;
    private final QualifiedSchema afterAggrSchema;
    private final QualifiedSchema finalizeSchema;
    private final Map<String, Expression> projectionAliases;

    private AnalyzeQueryState(Builder builder) {
        this.joinedSchema = Objects.requireNonNull(builder.joinedSchema, "joinedSchema can not be null");
        this.joinConditions = Utils.fastToImmutableList(builder.joinConditions);
        this.joinPredicates = Utils.fastToImmutableList(builder.joinPredicates);
        this.filterPredicate = Objects.requireNonNull(builder.filterPredicate, "filterPredicate can not be null");
        this.beforeGroupByExpressions = Utils.fastToImmutableList(builder.beforeGroupByExpressions);
        this.groupByExpressions = Utils.fastToImmutableList(builder.groupByExpressions);
        this.aggregateExpressions = Utils.fastToImmutableList(builder.aggregateExpressions);
        this.beforeHavingExpressions = Utils.fastToImmutableList(builder.beforeHavingExpressions);
        this.havingPredicate = Objects.requireNonNull(builder.havingPredicate, "havingPredicate can not be null");
        this.orderByExpressions = Utils.fastToImmutableList(builder.orderByExpressions);
        this.projectionExpressions = Utils.fastToImmutableList(builder.projectionExpressions);
        this.beforeAggrSchema = Objects.requireNonNull(builder.beforeAggrSchema, "beforeAggrSchema can not be null");
        this.afterAggrSchema = Objects.requireNonNull(builder.afterAggrSchema, "afterAggrSchema can not be null");
        this.finalizeSchema = Objects.requireNonNull(builder.finalizeSchema, "finalizeSchema can not be null");
        this.projectionAliases = ImmutableMap.copyOf(builder.projectionAliases);
    }

    /**
     * Resolve the FROM clause. Only the joined schema and the join conditions are filled,
     * every other schema is {@link QualifiedSchema#empty()} and every other list is empty.
     */
    public static AnalyzeQueryState create(StatementContext statementContext, List<TableWithJoins> from) {
        List<RelationRpnItem> rpn = RelationRpnBuilder.build(from);
        ResolvedRelation relation = new RelationResolver(statementContext).resolve(rpn);
        Builder builder = new Builder();
        builder.joinedSchema = relation.getSchema();
        builder.joinConditions = relation.getJoinConditions();
        return new AnalyzeQueryState(builder);
    }

    public AnalyzeQueryState withJoinPredicates(List<Expression> joinPredicates) {
        Builder builder = toBuilder();
        builder.joinPredicates = joinPredicates;
        return new AnalyzeQueryState(builder);
    }

    public AnalyzeQueryState withFilterPredicate(Optional<Expression> filterPredicate) {
        Builder builder = toBuilder();
        builder.filterPredicate = filterPredicate;
        return new AnalyzeQueryState(builder);
    }

    public AnalyzeQueryState withGroupBy(List<Expression> groupByExpressions) {
        Builder builder = toBuilder();
        builder.groupByExpressions = groupByExpressions;
        return new AnalyzeQueryState(builder);
    }

    /** aggregate and before group by expressions */
    public AnalyzeQueryState withAggregates(List<Expression> aggregateExpressions,
            List<Expression> beforeGroupByExpressions) {
        Builder builder = toBuilder();
        builder.aggregateExpressions = aggregateExpressions;
        builder.beforeGroupByExpressions = beforeGroupByExpressions;
        return new AnalyzeQueryState(builder);
    }

    public AnalyzeQueryState withHaving(Optional<Expression> havingPredicate,
            List<Expression> beforeHavingExpressions) {
        Builder builder = toBuilder();
        builder.havingPredicate = havingPredicate;
        builder.beforeHavingExpressions = beforeHavingExpressions;
        return new AnalyzeQueryState(builder);
    }

    public AnalyzeQueryState withOrderBy(List<OrderKey> orderByExpressions) {
        Builder builder = toBuilder();
        builder.orderByExpressions = orderByExpressions;
        return new AnalyzeQueryState(builder);
    }

    public AnalyzeQueryState withProjection(List<NamedExpression> projectionExpressions,
            Map<String, Expression> projectionAliases) {
        Builder builder = toBuilder();
        builder.projectionExpressions = projectionExpressions;
        builder.projectionAliases = projectionAliases;
        return new AnalyzeQueryState(builder);
    }

    /** schemas derived from the joined schema and the expression lists */
    public AnalyzeQueryState withSchemas(QualifiedSchema beforeAggrSchema, QualifiedSchema afterAggrSchema,
            QualifiedSchema finalizeSchema) {
        Builder builder = toBuilder();
        builder.beforeAggrSchema = beforeAggrSchema;
        builder.afterAggrSchema = afterAggrSchema;
        builder.finalizeSchema = finalizeSchema;
        return new AnalyzeQueryState(builder);
    }

    public QualifiedSchema getJoinedSchema() {
        return joinedSchema;
    }

    public List<ResolvedRelation.JoinCondition> getJoinConditions() {
        return joinConditions;
    }

    public List<Expression> getJoinPredicates() {
        return joinPredicates;
    }

    public Optional<Expression> getFilterPredicate() {
        return filterPredicate;
    }

    public List<Expression> getBeforeGroupByExpressions() {
        return beforeGroupByExpressions;
    }

    public List<Expression> getGroupByExpressions() {
        return groupByExpressions;
    }

    public List<Expression> getAggregateExpressions() {
        return aggregateExpressions;
    }

    public List<Expression> getBeforeHavingExpressions() {
        return beforeHavingExpressions;
    }

    public Optional<Expression> getHavingPredicate() {
        return havingPredicate;
    }

    public List<OrderKey> getOrderByExpressions() {
        return orderByExpressions;
    }

    public List<NamedExpression> getProjectionExpressions() {
        return projectionExpressions;
    }

    public QualifiedSchema getBeforeAggrSchema() {
        return beforeAggrSchema;
    }

    public QualifiedSchema getAfterAggrSchema() {
        return afterAggrSchema;
    }

    public QualifiedSchema getFinalizeSchema() {
        return finalizeSchema;
    }

    public Map<String, Expression> getProjectionAliases() {
        return projectionAliases;
    }

    /** whether the query has GROUP BY or aggregate functions */
    public boolean isAggregating() {
        return !groupByExpressions.isEmpty() || !aggregateExpressions.isEmpty();
    }

    private Builder toBuilder() {
        Builder builder = new Builder();
        builder.joinedSchema = joinedSchema;
        builder.joinConditions = joinConditions;
        builder.joinPredicates = joinPredicates;
        builder.filterPredicate = filterPredicate;
        builder.beforeGroupByExpressions = beforeGroupByExpressions;
        builder.groupByExpressions = groupByExpressions;
        builder.aggregateExpressions = aggregateExpressions;
        builder.beforeHavingExpressions = beforeHavingExpressions;
        builder.havingPredicate = havingPredicate;
        builder.orderByExpressions = orderByExpressions;
        builder.projectionExpressions = projectionExpressions;
        builder.beforeAggrSchema = beforeAggrSchema;
        builder.afterAggrSchema = afterAggrSchema;
        builder.finalizeSchema = finalizeSchema;
        builder.projectionAliases = projectionAliases;
        return builder;
    }

    @Override
    public String toString() {
        return "AnalyzeQueryState{"
                + "joinedSchema=" + joinedSchema
                + ", filterPredicate=" + filterPredicate
                + ", groupBy=" + groupByExpressions
                + ", aggregates=" + aggregateExpressions
                + ", havingPredicate=" + havingPredicate
                + ", orderBy=" + orderByExpressions
                + ", projection=" + projectionExpressions
                + ", finalizeSchema=" + finalizeSchema
                + '}';
    }

    private static class Builder {
        private QualifiedSchema joinedSchema;
        private List<ResolvedRelation.JoinCondition> joinConditions = ImmutableList.of();
        private List<Expression> joinPredicates = ImmutableList.of();
        private Optional<Expression> filterPredicate = Optional.empty();
        private List<Expression> beforeGroupByExpressions = ImmutableList.of();
        private List<Expression> groupByExpressions = ImmutableList.of();
        private List<Expression> aggregateExpressions = ImmutableList.of();
        private List<Expression> beforeHavingExpressions = ImmutableList.of();
        private Optional<Expression> havingPredicate = Optional.empty();
        private List<OrderKey> orderByExpressions = ImmutableList.of();
        private List<NamedExpression> projectionExpressions = ImmutableList.of();
        private QualifiedSchema beforeAggrSchema = QualifiedSchema.empty();
        private QualifiedSchema afterAggrSchema = QualifiedSchema.empty();
        private QualifiedSchema finalizeSchema = QualifiedSchema.empty();
        private Map<String, Expression> projectionAliases = ImmutableMap.of();
    }
}
