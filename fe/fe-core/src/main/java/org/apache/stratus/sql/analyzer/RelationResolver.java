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

import org.apache.stratus.catalog.TableIf;
import org.apache.stratus.qe.StatementContext;
import org.apache.stratus.sql.ast.JoinOperator;
import org.apache.stratus.sql.ast.TableFunctionArg;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.functions.table.TableValuedFunction;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 以栈的方式求值 FROM 子句的 RPN，得到组合后的 schema。
 *
 * 关系操作数依次解析并入栈：
 *   普通表: 从 Catalog 获取表结构，前缀为别名或 [db, table]；
 *   表函数: 在空 schema 上分析参数，从表函数注册表获取输出结构，无前缀；
 *   派生表: 交给 {@link SubqueryResolver}，前缀为别名或无前缀。
 * join 运算符弹出右、左两个 schema，组合后入栈；ON 条件连同组合出的 schema 留给后续的谓词分析，
 * 因此 ON 条件看不到之后才 join 进来的关系。
 *
 * 操作数严格按顺序逐个解析，每个操作数之前检查会话是否被取消。
 * 求值结束时栈中必须恰好剩一个 schema，否则是 RPN 构建的 bug。
 */
public class RelationResolver implements RelationRpnVisitor<QualifiedSchema, RelationResolver.FoldContext> {
    private static final Logger LOG = LogManager.getLogger(RelationResolver.class);
    private static final String RPN_BUG_MESSAGE = "Relation RPN does not reduce to a single schema";

    private final StatementContext statementContext;
    private final SubqueryResolver subqueryResolver;

    public RelationResolver(StatementContext statementContext) {
        this.statementContext = Objects.requireNonNull(statementContext, "statementContext can not be null");
        this.subqueryResolver = new SubqueryResolver(statementContext);
    }

    /**
     * Resolve the FROM clause given as RPN.
     *
     * @throws AnalysisException INTERNAL_ERROR if the RPN does not reduce to exactly one schema
     */
    public ResolvedRelation resolve(List<RelationRpnItem> rpn) {
        FoldContext foldContext = new FoldContext();
        for (RelationRpnItem item : rpn) {
            statementContext.getConnectContext().checkCancelled();
            QualifiedSchema schema = item.accept(this, foldContext);
            if (LOG.isDebugEnabled()) {
                LOG.debug("resolved {} to {}", item, schema);
            }
            foldContext.stack.push(schema);
        }
        if (foldContext.stack.size() != 1) {
            LOG.warn("relation rpn {} reduced to {} schemas", rpn, foldContext.stack.size());
            throw AnalysisException.internal(RPN_BUG_MESSAGE);
        }
        return new ResolvedRelation(foldContext.stack.pop(), foldContext.joinConditions.build());
    }

    @Override
    public QualifiedSchema visitTable(RelationRpnItem.TableItem table, FoldContext context) {
        List<String> tableQualifier = TableNameResolver.resolve(table.getNameParts(),
                statementContext.getConnectContext().getDatabase());
        TableIf tableIf = statementContext.getAndCacheTable(tableQualifier.get(0), tableQualifier.get(1));
        List<String> prefix = table.getAlias()
                .<List<String>>map(ImmutableList::of)
                .orElse(tableQualifier);
        return QualifiedSchema.fromColumns(tableIf.getBaseSchema(), prefix);
    }

    @Override
    public QualifiedSchema visitTableFunction(RelationRpnItem.TableFunctionItem tableFunction, FoldContext context) {
        if (tableFunction.getNameParts().size() != 1) {
            throw AnalysisException.syntax("Table function name must be a single identifier, but got "
                    + String.join(".", tableFunction.getNameParts()));
        }
        // arguments can not reference any column
        ExpressionAnalyzer analyzer = new ExpressionAnalyzer(statementContext, QualifiedSchema.empty(), false);
        ImmutableList.Builder<Expression> args = ImmutableList.builderWithExpectedSize(
                tableFunction.getArgs().size());
        for (TableFunctionArg arg : tableFunction.getArgs()) {
            args.add(analyzer.analyze(arg.getValue()));
        }
        TableValuedFunction function = statementContext.getConnectContext().getEnv().getTableFunctionRegistry()
                .getTableFunction(tableFunction.getNameParts().get(0), args.build());
        return QualifiedSchema.fromColumns(function.getTableSchema(), ImmutableList.of());
    }

    @Override
    public QualifiedSchema visitDerived(RelationRpnItem.DerivedItem derived, FoldContext context) {
        return subqueryResolver.resolve(derived.getSubquery(), derived.getAlias());
    }

    @Override
    public QualifiedSchema visitJoin(RelationRpnItem.JoinItem join, FoldContext context) {
        if (context.stack.size() < 2) {
            LOG.warn("join operator {} has only {} operands", join, context.stack.size());
            throw AnalysisException.internal(RPN_BUG_MESSAGE);
        }
        QualifiedSchema right = context.stack.pop();
        QualifiedSchema left = context.stack.pop();
        JoinOperator joinOperator = join.getJoinOperator();
        QualifiedSchema joined = QualifiedSchema.join(left, right, joinOperator.getJoinType());
        joinOperator.getCondition().ifPresent(
                condition -> context.joinConditions.add(new ResolvedRelation.JoinCondition(condition, joined)));
        return joined;
    }

    /** state of one evaluation: the operand stack and the collected join conditions */
    static class FoldContext {
        private final Deque<QualifiedSchema> stack = new ArrayDeque<>();
        private final ImmutableList.Builder<ResolvedRelation.JoinCondition> joinConditions = ImmutableList.builder();
    }
}
