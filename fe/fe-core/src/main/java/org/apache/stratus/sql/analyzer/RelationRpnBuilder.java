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

import org.apache.stratus.common.Config;
import org.apache.stratus.sql.ast.Join;
import org.apache.stratus.sql.ast.JoinOperator;
import org.apache.stratus.sql.ast.TableFactor;
import org.apache.stratus.sql.ast.TableFactorVisitor;
import org.apache.stratus.sql.ast.TableWithJoins;
import org.apache.stratus.sql.exceptions.AnalysisException;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * 将 FROM 子句转换为后缀表达式（RPN）。
 *
 * 每个逗号分隔的项依次展开：先是基础关系，然后每个显式 JOIN 的关系后面跟一个 join 运算符；
 * 从第二项开始，每项之后追加一个 CROSS JOIN。括号中的 join 组原地展开。
 *
 * 示例：
 * FROM a, b JOIN c ON b.x = c.x
 * => [a, b, c, JOIN(ON b.x = c.x), CROSS JOIN]
 *
 * 没有 FROM 子句时只产生系统库的单行表 system.one。
 */
public class RelationRpnBuilder implements TableFactorVisitor<Void, Void> {
    private static final Logger LOG = LogManager.getLogger(RelationRpnBuilder.class);

    private final ImmutableList.Builder<RelationRpnItem> rpn = ImmutableList.builder();
    private boolean empty = true;

    private RelationRpnBuilder() {
    }

    /**
     * Build the RPN of a FROM clause.
     *
     * @throws AnalysisException SYNTAX_ERROR or UNSUPPORTED for a construct the analyzer does not support
     */
    public static List<RelationRpnItem> build(List<TableWithJoins> from) {
        RelationRpnBuilder builder = new RelationRpnBuilder();
        if (from.isEmpty()) {
            builder.visitDummyTable();
        } else {
            builder.visit(from);
        }
        List<RelationRpnItem> result = builder.rpn.build();
        if (LOG.isDebugEnabled()) {
            LOG.debug("relation rpn: {}", result);
        }
        return result;
    }

    private void visitDummyTable() {
        push(new RelationRpnItem.TableItem(ImmutableList.of(Config.system_database, Config.one_row_table),
                Optional.empty()));
    }

    private void visit(List<TableWithJoins> from) {
        for (TableWithJoins tableWithJoins : from) {
            boolean first = empty;
            visitJoins(tableWithJoins);
            // FROM a, b is a CROSS JOIN b
            if (!first) {
                push(new RelationRpnItem.JoinItem(JoinOperator.cross()));
            }
        }
    }

    private void visitJoins(TableWithJoins tableWithJoins) {
        tableWithJoins.getRelation().accept(this, null);
        for (Join join : tableWithJoins.getJoins()) {
            if (join.getJoinOperator().getJoinType().isSemiOrAntiJoin()) {
                throw AnalysisException.unsupported("Unsupported join type "
                        + join.getJoinOperator().getJoinType().toSql());
            }
            join.getRelation().accept(this, null);
            push(new RelationRpnItem.JoinItem(join.getJoinOperator()));
        }
    }

    @Override
    public Void visitTable(TableFactor.Table table, Void context) {
        if (!table.getWithHints().isEmpty()) {
            throw AnalysisException.syntax("MSSQL-specific `WITH (...)` hints is unsupported.");
        }
        if (table.getArgs().isEmpty()) {
            push(new RelationRpnItem.TableItem(table.getNameParts(), table.getAlias()));
            return null;
        }
        if (table.getAlias().isPresent()) {
            throw AnalysisException.syntax("Table function can not have an alias: " + table.toSql());
        }
        if (table.getNameParts().size() >= 2) {
            throw AnalysisException.syntax("Table function name must be a single identifier, but got "
                    + String.join(".", table.getNameParts()));
        }
        push(new RelationRpnItem.TableFunctionItem(table.getNameParts(), table.getArgs()));
        return null;
    }

    @Override
    public Void visitDerived(TableFactor.Derived derived, Void context) {
        if (derived.isLateral()) {
            throw AnalysisException.unsupported("Cannot SELECT LATERAL subquery.");
        }
        push(new RelationRpnItem.DerivedItem(derived.getSubquery(), derived.getAlias()));
        return null;
    }

    @Override
    public Void visitNestedJoin(TableFactor.NestedJoin nestedJoin, Void context) {
        visitJoins(nestedJoin.getTableWithJoins());
        return null;
    }

    @Override
    public Void visitTableFunction(TableFactor.TableFunction tableFunction, Void context) {
        throw AnalysisException.unsupported("Unsupported table function: " + tableFunction.toSql());
    }

    private void push(RelationRpnItem item) {
        rpn.add(item);
        empty = false;
    }
}
