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

import java.util.Objects;
import java.util.Optional;

/**
 * 表函数参数，可以是位置参数 {@code f(1)} 或命名参数 {@code f(n => 1)}。
 */
public class TableFunctionArg {
    private final Optional<String> name;
    private final Expression value;

    public TableFunctionArg(Optional<String> name, Expression value) {
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.value = Objects.requireNonNull(value, "value can not be null");
    }

    public static TableFunctionArg of(Expression value) {
        return new TableFunctionArg(Optional.empty(), value);
    }

    public static TableFunctionArg named(String name, Expression value) {
        return new TableFunctionArg(Optional.of(name), value);
    }

    public Optional<String> getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public String toSql() {
        return name.map(n -> n + " => ").orElse("") + value.toSql();
    }
}
