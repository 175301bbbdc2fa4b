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
import org.apache.stratus.sql.util.Utils;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * FROM 子句中的一个关系。
 *
 * Table: 表名，带参数时为表函数，例如 numbers(10)；
 * Derived: 括号中的子查询；
 * NestedJoin: 括号中的 join 组；
 * TableFunction: TABLE(expr) 形式的内联表函数。
 */
public abstract class TableFactor {

    private TableFactor() {
    }

    public abstract <R, C> R accept(TableFactorVisitor<R, C> visitor, C context);

    public abstract String toSql();

    @Override
    public String toString() {
        return toSql();
    }

    public static Table table(String... nameParts) {
        return new Table(ImmutableList.copyOf(nameParts), Optional.empty(), ImmutableList.of(), ImmutableList.of());
    }

    /** a named table or a table function call */
    public static final class Table extends TableFactor {
        private final List<String> nameParts;
        private final Optional<String> alias;
        private final List<TableFunctionArg> args;
        private final List<Expression> withHints;

        /** Table */
        public Table(List<String> nameParts, Optional<String> alias, List<TableFunctionArg> args,
                List<Expression> withHints) {
            this.nameParts = Utils.fastToImmutableList(Objects.requireNonNull(nameParts, "nameParts can not be null"));
            this.alias = Objects.requireNonNull(alias, "alias can not be null");
            this.args = Utils.fastToImmutableList(Objects.requireNonNull(args, "args can not be null"));
            this.withHints = Utils.fastToImmutableList(Objects.requireNonNull(withHints, "withHints can not be null"));
        }

        public List<String> getNameParts() {
            return nameParts;
        }

        public Optional<String> getAlias() {
            return alias;
        }

        public List<TableFunctionArg> getArgs() {
            return args;
        }

        public List<Expression> getWithHints() {
            return withHints;
        }

        public Table withAlias(String alias) {
            return new Table(nameParts, Optional.of(alias), args, withHints);
        }

        public Table withArgs(TableFunctionArg... args) {
            return new Table(nameParts, alias, ImmutableList.copyOf(args), withHints);
        }

        public Table withHints(Expression... hints) {
            return new Table(nameParts, alias, args, ImmutableList.copyOf(hints));
        }

        @Override
        public <R, C> R accept(TableFactorVisitor<R, C> visitor, C context) {
            return visitor.visitTable(this, context);
        }

        @Override
        public String toSql() {
            StringBuilder sb = new StringBuilder(Utils.toSqlName(nameParts));
            if (!args.isEmpty()) {
                sb.append('(').append(args.stream().map(TableFunctionArg::toSql).collect(Collectors.joining(", ")))
                        .append(')');
            }
            alias.ifPresent(a -> sb.append(" AS `").append(a).append('`'));
            if (!withHints.isEmpty()) {
                sb.append(" WITH (")
                        .append(withHints.stream().map(Expression::toSql).collect(Collectors.joining(", ")))
                        .append(')');
            }
            return sb.toString();
        }
    }

    /** parenthesized subquery */
    public static final class Derived extends TableFactor {
        private final boolean lateral;
        private final QueryStatement subquery;
        private final Optional<String> alias;

        public Derived(boolean lateral, QueryStatement subquery, Optional<String> alias) {
            this.lateral = lateral;
            this.subquery = Objects.requireNonNull(subquery, "subquery can not be null");
            this.alias = Objects.requireNonNull(alias, "alias can not be null");
        }

        public boolean isLateral() {
            return lateral;
        }

        public QueryStatement getSubquery() {
            return subquery;
        }

        public Optional<String> getAlias() {
            return alias;
        }

        @Override
        public <R, C> R accept(TableFactorVisitor<R, C> visitor, C context) {
            return visitor.visitDerived(this, context);
        }

        @Override
        public String toSql() {
            return (lateral ? "LATERAL (" : "(") + subquery.toSql() + ")"
                    + alias.map(a -> " AS `" + a + "`").orElse("");
        }
    }

    /** parenthesized join group, e.g. {@code (a JOIN b ON ...)} */
    public static final class NestedJoin extends TableFactor {
        private final TableWithJoins tableWithJoins;

        public NestedJoin(TableWithJoins tableWithJoins) {
            this.tableWithJoins = Objects.requireNonNull(tableWithJoins, "tableWithJoins can not be null");
        }

        public TableWithJoins getTableWithJoins() {
            return tableWithJoins;
        }

        @Override
        public <R, C> R accept(TableFactorVisitor<R, C> visitor, C context) {
            return visitor.visitNestedJoin(this, context);
        }

        @Override
        public String toSql() {
            return "(" + tableWithJoins.toSql() + ")";
        }
    }

    /** TABLE(expr) */
    public static final class TableFunction extends TableFactor {
        private final Expression expr;
        private final Optional<String> alias;

        public TableFunction(Expression expr, Optional<String> alias) {
            this.expr = Objects.requireNonNull(expr, "expr can not be null");
            this.alias = Objects.requireNonNull(alias, "alias can not be null");
        }

        public Expression getExpr() {
            return expr;
        }

        public Optional<String> getAlias() {
            return alias;
        }

        @Override
        public <R, C> R accept(TableFactorVisitor<R, C> visitor, C context) {
            return visitor.visitTableFunction(this, context);
        }

        @Override
        public String toSql() {
            return "TABLE(" + expr.toSql() + ")" + alias.map(a -> " AS `" + a + "`").orElse("");
        }
    }
}
