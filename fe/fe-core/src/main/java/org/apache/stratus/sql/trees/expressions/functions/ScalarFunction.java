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

package org.apache.stratus.sql.trees.expressions.functions;

import org.apache.stratus.catalog.FunctionSignature;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;

import java.util.List;

/**
 * 标量函数调用。
 */
public class ScalarFunction extends BoundFunction {

    public ScalarFunction(String name, FunctionSignature signature, NullableMode nullableMode,
            List<Expression> arguments) {
        super(name, signature, nullableMode, arguments);
    }

    @Override
    public String toSql() {
        return name + "(" + argumentsToSql() + ")";
    }

    @Override
    public ScalarFunction withChildren(List<Expression> children) {
        return new ScalarFunction(name, signature, nullableMode, children);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitScalarFunction(this, context);
    }
}
