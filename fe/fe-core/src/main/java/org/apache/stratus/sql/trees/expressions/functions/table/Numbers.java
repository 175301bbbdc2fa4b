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

package org.apache.stratus.sql.trees.expressions.functions.table;

import org.apache.stratus.catalog.Column;
import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.Literal;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * numbers(n)：产生 0 到 n - 1 的 n 行，只有一列 number。
 * numbers_mt、numbers_local 的结构与之相同。
 */
public class Numbers extends TableValuedFunction {
    private static final List<Column> SCHEMA = ImmutableList.of(
            new Column("number", PrimitiveType.BIGINT, false));

    private final long totalNumbers;

    /**
     * @throws AnalysisException BAD_ARGUMENTS unless there is exactly one non-negative integer literal
     */
    public Numbers(String name, List<Expression> arguments) {
        super(name, arguments);
        if (arguments.size() != 1) {
            throw AnalysisException.badArguments(
                    "Table function " + name + " requires exactly one argument, but got " + arguments.size());
        }
        Expression arg = arguments.get(0);
        if (!(arg instanceof Literal) || !((Literal) arg).isIntegerLiteral()) {
            throw AnalysisException.badArguments(
                    "Table function " + name + " requires an integer literal argument, but got " + arg.toSql());
        }
        this.totalNumbers = ((Literal) arg).getLongValue();
        if (totalNumbers < 0) {
            throw AnalysisException.badArguments(
                    "Table function " + name + " requires a non-negative argument, but got " + totalNumbers);
        }
    }

    public long getTotalNumbers() {
        return totalNumbers;
    }

    @Override
    public List<Column> getTableSchema() {
        return SCHEMA;
    }
}
