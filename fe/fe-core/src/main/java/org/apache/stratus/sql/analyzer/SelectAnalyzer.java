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

import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.qe.StatementContext;
import org.apache.stratus.sql.ast.SelectStatement;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.Alias;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.Literal;
import org.apache.stratus.sql.trees.expressions.NamedExpression;
import org.apache.stratus.sql.trees.expressions.OrderKey;
import org.apache.stratus.sql.trees.expressions.Slot;
import org.apache.stratus.sql.trees.expressions.SlotReference;
import org.apache.stratus.sql.trees.expressions.functions.AggregateFunction;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SELECT 语句的分析流程。
 *
 * 在 {@link AnalyzeQueryState#create} 得到的 joinedSchema 上依次执行：
 * <ol>
 *   <li>join 谓词：绑定 ON 条件；</li>
 *   <li>投影：展开 *，记录 expr AS name 的别名，供后续阶段引用；</li>
 *   <li>过滤：绑定 WHERE，不允许聚合函数；</li>
 *   <li>group by：可以引用投影别名或投影位置（GROUP BY 1）；</li>
 *   <li>聚合：收集投影中的聚合函数；</li>
 *   <li>having：绑定 HAVING，收集其中的聚合函数；</li>
 *   <li>order by：单段名称优先匹配投影别名，可以引用投影位置；</li>
 *   <li>校验：聚合查询中，聚合函数之外的列必须出现在 GROUP BY 中；</li>
 *   <li>schema：计算聚合前、聚合后与最终输出的 schema。</li>
 * </ol>
 * 每个阶段开始前检查会话是否被取消。
 */
public class SelectAnalyzer {
    private static final Logger LOG = LogManager.getLogger(SelectAnalyzer.class);

    /**
     * Analyze the statement, returning the state with every stage applied.
     */
    public AnalyzeQueryState analyze(SelectStatement statement, StatementContext statementContext) {
        AnalyzeQueryState state = AnalyzeQueryState.create(statementContext, statement.getFrom());
        logStage("from", state);

        checkCancelled(statementContext);
        state = analyzeJoinPredicates(state, statementContext);
        logStage("join predicates", state);

        checkCancelled(statementContext);
        state = analyzeProjection(statement, state, statementContext);
        logStage("projection", state);

        checkCancelled(statementContext);
        state = analyzeFilter(statement, state, statementContext);
        logStage("filter", state);

        checkCancelled(statementContext);
        state = analyzeGroupBy(statement, state, statementContext);
        logStage("group by", state);

        checkCancelled(statementContext);
        state = analyzeAggregate(state);
        logStage("aggregate", state);

        checkCancelled(statementContext);
        state = analyzeHaving(statement, state, statementContext);
        logStage("having", state);

        checkCancelled(statementContext);
        state = analyzeOrderBy(statement, state, statementContext);
        logStage("order by", state);

        checkCancelled(statementContext);
        validateAggregation(state);

        state = analyzeSchemas(state);
        logStage("schemas", state);
        return state;
    }

    private AnalyzeQueryState analyzeJoinPredicates(AnalyzeQueryState state, StatementContext statementContext) {
        ImmutableList.Builder<Expression> predicates = ImmutableList.builder();
        for (ResolvedRelation.JoinCondition joinCondition : state.getJoinConditions()) {
            // only the two operands of its own join are visible to an ON condition
            ExpressionAnalyzer analyzer = new ExpressionAnalyzer(statementContext, joinCondition.getScope(), false);
            predicates.add(checkBoolean(analyzer.analyze(joinCondition.getCondition()), "JOIN ON"));
        }
        return state.withJoinPredicates(predicates.build());
    }

    private AnalyzeQueryState analyzeProjection(SelectStatement statement, AnalyzeQueryState state,
            StatementContext statementContext) {
        QualifiedSchema joinedSchema = state.getJoinedSchema();
        ExpressionAnalyzer analyzer = new ExpressionAnalyzer(statementContext, joinedSchema, true);
        ImmutableList.Builder<NamedExpression> projections = ImmutableList.builder();
        Map<String, Expression> aliases = Maps.newLinkedHashMap();
        Set<String> aliasNames = Sets.newHashSet();
        for (Expression item : statement.getSelectList()) {
            if (item instanceof UnboundStar) {
                projections.addAll(joinedSchema.expandStar(((UnboundStar) item).getQualifier()));
            } else if (item instanceof UnboundAlias) {
                UnboundAlias unboundAlias = (UnboundAlias) item;
                if (!aliasNames.add(unboundAlias.getName().toLowerCase(Locale.ROOT))) {
                    throw new AnalysisException(ErrorCode.DUPLICATE_NAME,
                            "Duplicate alias name '" + unboundAlias.getName() + "' in select list");
                }
                Expression bound = analyzer.analyze(unboundAlias.child());
                aliases.put(unboundAlias.getName(), bound);
                projections.add(new Alias(bound, unboundAlias.getName()));
            } else {
                Expression bound = analyzer.analyze(item);
                projections.add(bound instanceof NamedExpression
                        ? (NamedExpression) bound
                        : new Alias(bound, bound.toSql()));
            }
        }
        return state.withProjection(projections.build(), aliases);
    }

    private AnalyzeQueryState analyzeFilter(SelectStatement statement, AnalyzeQueryState state,
            StatementContext statementContext) {
        if (!statement.getWhere().isPresent()) {
            return state;
        }
        ExpressionAnalyzer analyzer = new ExpressionAnalyzer(statementContext, state.getJoinedSchema(), false);
        Expression predicate = checkBoolean(analyzer.analyze(statement.getWhere().get()), "WHERE");
        return state.withFilterPredicate(Optional.of(predicate));
    }

    private AnalyzeQueryState analyzeGroupBy(SelectStatement statement, AnalyzeQueryState state,
            StatementContext statementContext) {
        if (statement.getGroupBy().isEmpty()) {
            return state;
        }
        ExpressionAnalyzer analyzer = new ExpressionAnalyzer(statementContext, state.getJoinedSchema(), false)
                .withAliases(state.getProjectionAliases(), false);
        Set<Expression> groupBy = Sets.newLinkedHashSet();
        for (Expression key : statement.getGroupBy()) {
            Optional<Expression> positional = projectionAt(key, state, "GROUP BY");
            Expression bound = positional.isPresent() ? positional.get() : analyzer.analyze(key);
            if (bound.containsAggregate()) {
                throw AnalysisException.syntax("GROUP BY expression must not contain aggregate functions: "
                        + bound.toSql());
            }
            groupBy.add(bound);
        }
        return state.withGroupBy(ImmutableList.copyOf(groupBy));
    }

    private AnalyzeQueryState analyzeAggregate(AnalyzeQueryState state) {
        Set<Expression> aggregates = Sets.newLinkedHashSet(state.getAggregateExpressions());
        for (NamedExpression projection : state.getProjectionExpressions()) {
            collectAggregates(projection, aggregates);
        }
        return withAggregates(state, aggregates);
    }

    private AnalyzeQueryState analyzeHaving(SelectStatement statement, AnalyzeQueryState state,
            StatementContext statementContext) {
        if (!statement.getHaving().isPresent()) {
            return state;
        }
        ExpressionAnalyzer analyzer = new ExpressionAnalyzer(statementContext, state.getJoinedSchema(), true)
                .withAliases(state.getProjectionAliases(), false);
        Expression predicate = checkBoolean(analyzer.analyze(statement.getHaving().get()), "HAVING");
        Set<Expression> aggregates = Sets.newLinkedHashSet(state.getAggregateExpressions());
        collectAggregates(predicate, aggregates);
        if (state.getGroupByExpressions().isEmpty() && aggregates.isEmpty()) {
            throw AnalysisException.syntax("HAVING clause requires GROUP BY or aggregate functions: "
                    + predicate.toSql());
        }
        state = withAggregates(state, aggregates);
        return state.withHaving(Optional.of(predicate), state.getBeforeHavingExpressions());
    }

    private AnalyzeQueryState analyzeOrderBy(SelectStatement statement, AnalyzeQueryState state,
            StatementContext statementContext) {
        if (statement.getOrderBy().isEmpty()) {
            return state;
        }
        ExpressionAnalyzer analyzer = new ExpressionAnalyzer(statementContext, state.getJoinedSchema(), true)
                .withAliases(state.getProjectionAliases(), true);
        ImmutableList.Builder<OrderKey> orderKeys = ImmutableList.builder();
        Set<Expression> aggregates = Sets.newLinkedHashSet(state.getAggregateExpressions());
        for (OrderKey orderKey : statement.getOrderBy()) {
            Optional<Expression> positional = projectionAt(orderKey.getExpr(), state, "ORDER BY");
            Expression bound = positional.isPresent() ? positional.get() : analyzer.analyze(orderKey.getExpr());
            collectAggregates(bound, aggregates);
            orderKeys.add(orderKey.withExpression(bound));
        }
        state = withAggregates(state, aggregates);
        return state.withOrderBy(orderKeys.build());
    }

    /**
     * 聚合查询中，投影、HAVING 与 ORDER BY 里聚合函数之外的列必须被 GROUP BY 覆盖。
     */
    private void validateAggregation(AnalyzeQueryState state) {
        if (!state.isAggregating()) {
            return;
        }
        Set<Expression> groupBy = Sets.newHashSet(state.getGroupByExpressions());
        for (NamedExpression projection : state.getProjectionExpressions()) {
            checkCoveredByGroupBy(unwrapAlias(projection), groupBy);
        }
        state.getHavingPredicate().ifPresent(having -> checkCoveredByGroupBy(having, groupBy));
        for (OrderKey orderKey : state.getOrderByExpressions()) {
            checkCoveredByGroupBy(orderKey.getExpr(), groupBy);
        }
    }

    private void checkCoveredByGroupBy(Expression expr, Set<Expression> groupBy) {
        if (groupBy.contains(expr) || expr instanceof AggregateFunction) {
            return;
        }
        if (expr instanceof Slot) {
            throw AnalysisException.syntax("'" + expr + "' must appear in the GROUP BY clause"
                    + " or be used in an aggregate function");
        }
        for (Expression child : expr.children()) {
            checkCoveredByGroupBy(child, groupBy);
        }
    }

    /**
     * before aggregate: joined columns, then the computed group by keys and aggregate arguments;
     * after aggregate: group by keys, then aggregate outputs;
     * finalize: one unqualified column for each projection.
     */
    private AnalyzeQueryState analyzeSchemas(AnalyzeQueryState state) {
        QualifiedSchema beforeAggrSchema = state.getJoinedSchema();
        QualifiedSchema afterAggrSchema = state.getJoinedSchema();
        List<Expression> beforeHaving = ImmutableList.of();
        if (state.isAggregating()) {
            ImmutableList.Builder<Slot> beforeAggr = ImmutableList.builder();
            beforeAggr.addAll(state.getJoinedSchema().getColumns());
            for (Expression expr : state.getBeforeGroupByExpressions()) {
                if (!(expr instanceof Slot)) {
                    beforeAggr.add(toSlot(expr));
                }
            }
            beforeAggrSchema = QualifiedSchema.of(beforeAggr.build());

            ImmutableList.Builder<Slot> afterAggr = ImmutableList.builder();
            for (Expression key : state.getGroupByExpressions()) {
                afterAggr.add(key instanceof Slot ? (Slot) key : toSlot(key));
            }
            for (Expression aggregate : state.getAggregateExpressions()) {
                afterAggr.add(toSlot(aggregate));
            }
            afterAggrSchema = QualifiedSchema.of(afterAggr.build());

            Set<Expression> afterAggrExpressions = Sets.newLinkedHashSet();
            state.getHavingPredicate().ifPresent(afterAggrExpressions::add);
            for (NamedExpression projection : state.getProjectionExpressions()) {
                afterAggrExpressions.add(unwrapAlias(projection));
            }
            for (OrderKey orderKey : state.getOrderByExpressions()) {
                afterAggrExpressions.add(orderKey.getExpr());
            }
            beforeHaving = ImmutableList.copyOf(afterAggrExpressions);
        }

        ImmutableList.Builder<Slot> finalize = ImmutableList.builder();
        for (NamedExpression projection : state.getProjectionExpressions()) {
            finalize.add(projection.toSlot().withQualifier(ImmutableList.of()));
        }
        return state.withHaving(state.getHavingPredicate(), beforeHaving)
                .withSchemas(beforeAggrSchema, afterAggrSchema, QualifiedSchema.of(finalize.build()));
    }

    /**
     * GROUP BY 1 / ORDER BY 1 refer to the first projection.
     */
    private Optional<Expression> projectionAt(Expression expr, AnalyzeQueryState state, String clause) {
        if (!(expr instanceof Literal) || !((Literal) expr).isIntegerLiteral()) {
            return Optional.empty();
        }
        long position = ((Literal) expr).getLongValue();
        List<NamedExpression> projections = state.getProjectionExpressions();
        if (position < 1 || position > projections.size()) {
            throw AnalysisException.badArguments(String.format("%s position %d is not in select list (1..%d)",
                    clause, position, projections.size()));
        }
        return Optional.of(unwrapAlias(projections.get((int) position - 1)));
    }

    private static AnalyzeQueryState withAggregates(AnalyzeQueryState state, Collection<Expression> aggregates) {
        Set<Expression> beforeGroupBy = Sets.newLinkedHashSet(state.getGroupByExpressions());
        for (Expression aggregate : aggregates) {
            beforeGroupBy.addAll(aggregate.children());
        }
        return state.withAggregates(ImmutableList.copyOf(aggregates), ImmutableList.copyOf(beforeGroupBy));
    }

    private static void collectAggregates(Expression expr, Set<Expression> aggregates) {
        List<AggregateFunction> found = expr.collectToList(AggregateFunction.class::isInstance);
        aggregates.addAll(found);
    }

    private static Expression unwrapAlias(NamedExpression expr) {
        return expr instanceof Alias ? ((Alias) expr).child() : expr;
    }

    private static Slot toSlot(Expression expr) {
        return new SlotReference(expr.toSql(), expr.getDataType(), expr.nullable());
    }

    private static Expression checkBoolean(Expression predicate, String clause) {
        PrimitiveType type = predicate.getDataType();
        if (!type.canImplicitCastTo(PrimitiveType.BOOLEAN)) {
            throw new AnalysisException(ErrorCode.TYPE_MISMATCH, String.format(
                    "%s clause must be a BOOLEAN expression, but %s is %s", clause, predicate.toSql(), type));
        }
        return predicate;
    }

    private static void checkCancelled(StatementContext statementContext) {
        statementContext.getConnectContext().checkCancelled();
    }

    private static void logStage(String stage, AnalyzeQueryState state) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("finish analyzing {}: {}", stage, state);
        }
    }
}
