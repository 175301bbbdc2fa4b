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

import org.apache.stratus.sql.ast.JoinOperator;
import org.apache.stratus.sql.ast.QueryStatement;
import org.apache.stratus.sql.ast.TableFunctionArg;
import org.apache.stratus.sql.util.Utils;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * FROM 子句后缀表达式（逆波兰式）中的一项：三种关系操作数，或者一个 join 运算符。
 *
 * 只有下面四个子类，通过 {@link RelationRpnVisitor} 访问。
 */
public abstract class RelationRpnItem {

    private RelationRpnItem() {
    }

    public abstract <R, C> R accept(RelationRpnVisitor<R, C> visitor, C context);

    public boolean isOperand() {
        return !(this instanceof JoinItem);
    }

    /** catalog table, optionally aliased */
    public static final class TableItem extends RelationRpnItem {
        private final List<String> nameParts;
        private final Optional<String> alias;

        public TableItem(List<String> nameParts, Optional<String> alias) {
            this.nameParts = Utils.fastToImmutableList(Objects.requireNonNull(nameParts, "nameParts can not be null"));
            this.alias = Objects.requireNonNull(alias, "alias can not be null");
        }

        public List<String> getNameParts() {
            return nameParts;
        }

        public Optional<String> getAlias() {
            return alias;
        }

        @Override
        public <R, C> R accept(RelationRpnVisitor<R, C> visitor, C context) {
            return visitor.visitTable(this, context);
        }

        @Override
        public String toString() {
            return "Table(" + String.join(".", nameParts) + alias.map(a -> " AS " + a).orElse("") + ")";
        }
    }

    /** table valued function call, its output columns are not qualified */
    public static final class TableFunctionItem extends RelationRpnItem {
        private final List<String> nameParts;
        private final List<TableFunctionArg> args;

        public TableFunctionItem(List<String> nameParts, List<TableFunctionArg> args) {
            this.nameParts = Utils.fastToImmutableList(Objects.requireNonNull(nameParts, "nameParts can not be null"));
            this.args = Utils.fastToImmutableList(Objects.requireNonNull(args, "args can not be null"));
        }

        public List<String> getNameParts() {
            return nameParts;
        }

        public List<TableFunctionArg> getArgs() {
            return args;
        }

        @Override
        public <R, C> R accept(RelationRpnVisitor<R, C> visitor, C context) {
            return visitor.visitTableFunction(this, context);
        }

        @Override
        public String toString() {
            return "TableFunction(" + String.join(".", nameParts) + "("
                    + args.stream().map(TableFunctionArg::toSql).collect(Collectors.joining(", ")) + "))";
        }
    }

    /** derived table */
    public static final class DerivedItem extends RelationRpnItem {
        private final QueryStatement subquery;
        private final Optional<String> alias;

        public DerivedItem(QueryStatement subquery, Optional<String> alias) {
            this.subquery = Objects.requireNonNull(subquery, "subquery can not be null");
            this.alias = Objects.requireNonNull(alias, "alias can not be null");
        }

        public QueryStatement getSubquery() {
            return subquery;
        }

        public Optional<String> getAlias() {
            return alias;
        }

        @Override
        public <R, C> R accept(RelationRpnVisitor<R, C> visitor, C context) {
            return visitor.visitDerived(this, context);
        }

        @Override
        public String toString() {
            return "Derived(" + subquery.toSql() + ")" + alias.map(a -> " AS " + a).orElse("");
        }
    }

    /** join the two operands on top of the stack */
    public static final class JoinItem extends RelationRpnItem {
        private final JoinOperator joinOperator;

        public JoinItem(JoinOperator joinOperator) {
            this.joinOperator = Objects.requireNonNull(joinOperator, "joinOperator can not be null");
        }

        public JoinOperator getJoinOperator() {
            return joinOperator;
        }

        @Override
        public <R, C> R accept(RelationRpnVisitor<R, C> visitor, C context) {
            return visitor.visitJoin(this, context);
        }

        @Override
        public String toString() {
            return "Join(" + joinOperator.toSql() + ")";
        }
    }
}
