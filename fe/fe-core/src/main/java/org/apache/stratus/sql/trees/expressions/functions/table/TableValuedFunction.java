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
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.util.Utils;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 表函数：以标量参数产生一个关系。输出列不带名称前缀。
 */
public abstract class TableValuedFunction {
    protected final String name;
    protected final List<Expression> arguments;

    protected TableValuedFunction(String name, List<Expression> arguments) {
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.arguments = Utils.fastToImmutableList(Objects.requireNonNull(arguments, "arguments can not be null"));
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    /**
     * Output schema of the function.
     */
    public abstract List<Column> getTableSchema();

    @Override
    public String toString() {
        return name + "(" + arguments.stream().map(Expression::toSql).collect(Collectors.joining(", ")) + ")";
    }
}
