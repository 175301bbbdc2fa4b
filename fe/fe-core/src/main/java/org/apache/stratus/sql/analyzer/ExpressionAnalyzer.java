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

import org.apache.stratus.catalog.FunctionRegistry;
import org.apache.stratus.qe.StatementContext;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.trees.expressions.Alias;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.Literal;
import org.apache.stratus.sql.trees.expressions.SlotReference;
import org.apache.stratus.sql.trees.expressions.functions.BoundFunction;
import org.apache.stratus.sql.trees.expressions.visitor.DefaultExpressionRewriter;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 将解析器产出的表达式绑定到一个 {@link QualifiedSchema}：
 * UnboundSlot -> SlotReference，UnboundFunction -> ScalarFunction / AggregateFunction，
 * UnboundAlias -> Alias。绑定后检查每个节点的参数类型。
 *
 * aliases: 投影中 expr AS name 的别名到已绑定表达式的映射，用于 GROUP BY / HAVING / ORDER BY
 * 中对别名的引用。aliasFirst 为 true 时单段名称先匹配别名，否则只在 schema 中找不到时才匹配别名。
 */
public class ExpressionAnalyzer extends DefaultExpressionRewriter<Void> {
    private final StatementContext statementContext;
    private final QualifiedSchema schema;
    private final boolean allowAggregate;
    // lower case alias -> bound expression
    private final Map<String, Expression> aliases;
    private final boolean aliasFirst;

    public ExpressionAnalyzer(StatementContext statementContext, QualifiedSchema schema, boolean allowAggregate) {
        this(statementContext, schema, allowAggregate, ImmutableMap.of(), false);
    }

    private ExpressionAnalyzer(StatementContext statementContext, QualifiedSchema schema, boolean allowAggregate,
            Map<String, Expression> aliases, boolean aliasFirst) {
        this.statementContext = Objects.requireNonNull(statementContext, "statementContext can not be null");
        this.schema = Objects.requireNonNull(schema, "schema can not be null");
        this.allowAggregate = allowAggregate;
        this.aliases = Objects.requireNonNull(aliases, "aliases can not be null");
        this.aliasFirst = aliasFirst;
    }

    /**
     * Analyzer that can also bind a single part name to a projection alias.
     *
     * @param aliases alias name to bound expression, looked up case insensitively
     * @param aliasFirst whether an alias wins over a column of the schema with the same name
     */
    public ExpressionAnalyzer withAliases(Map<String, Expression> aliases, boolean aliasFirst) {
        ImmutableMap.Builder<String, Expression> lowerCaseAliases = ImmutableMap.builder();
        aliases.forEach((name, expr) -> lowerCaseAliases.put(name.toLowerCase(Locale.ROOT), expr));
        return new ExpressionAnalyzer(statementContext, schema, allowAggregate,
                lowerCaseAliases.buildKeepingLast(), aliasFirst);
    }

    public QualifiedSchema getSchema() {
        return schema;
    }

    /**
     * Bind the expression.
     *
     * @throws AnalysisException if a name can not be resolved, a function does not exist or does not accept
     *         its arguments, or an aggregate function appears where it is not allowed
     */
    public Expression analyze(Expression expression) {
        Expression bound = expression.accept(this, null);
        if (!allowAggregate && bound.containsAggregate()) {
            throw AnalysisException.syntax("Aggregate function is not allowed here: " + expression.toSql());
        }
        return bound;
    }

    public List<Expression> analyze(List<Expression> expressions) {
        return expressions.stream().map(this::analyze).collect(ImmutableList.toImmutableList());
    }

    @Override
    public Expression visit(Expression expr, Void context) {
        Expression rewritten = rewriteChildren(this, expr, context);
        rewritten.checkLegality();
        return rewritten;
    }

    @Override
    public Expression visitSlotReference(SlotReference slotReference, Void context) {
        return slotReference;
    }

    @Override
    public Expression visitLiteral(Literal literal, Void context) {
        return literal;
    }

    @Override
    public Expression visitUnboundSlot(UnboundSlot unboundSlot, Void context) {
        List<String> nameParts = unboundSlot.getNameParts();
        if (nameParts.size() == 1 && !aliases.isEmpty()) {
            Optional<Expression> aliased = Optional.ofNullable(
                    aliases.get(unboundSlot.getName().toLowerCase(Locale.ROOT)));
            if (aliased.isPresent() && (aliasFirst || schema.findSlotIgnoreCase(nameParts).isEmpty())) {
                return aliased.get();
            }
        }
        return schema.resolve(nameParts);
    }

    @Override
    public Expression visitUnboundStar(UnboundStar unboundStar, Void context) {
        throw AnalysisException.syntax("'" + unboundStar.toSql() + "' is only allowed in the select list");
    }

    @Override
    public Expression visitUnboundAlias(UnboundAlias unboundAlias, Void context) {
        return new Alias(unboundAlias.child().accept(this, context), unboundAlias.getName());
    }

    @Override
    public Expression visitUnboundFunction(UnboundFunction unboundFunction, Void context) {
        FunctionRegistry functionRegistry = statementContext.getConnectContext().getEnv().getFunctionRegistry();
        ImmutableList.Builder<Expression> arguments = ImmutableList.builderWithExpectedSize(unboundFunction.arity());
        for (Expression argument : unboundFunction.getArguments()) {
            arguments.add(argument.accept(this, context));
        }
        List<Expression> boundArguments = arguments.build();
        if (functionRegistry.isAggregateFunction(unboundFunction.getName())) {
            for (Expression argument : boundArguments) {
                if (argument.containsAggregate()) {
                    throw AnalysisException.syntax("aggregate function cannot contain aggregate parameters: "
                            + unboundFunction.toSql());
                }
            }
        }
        BoundFunction function = functionRegistry.buildFunction(
                unboundFunction.getName(), boundArguments, unboundFunction.isDistinct());
        function.checkLegality();
        return function;
    }
}
