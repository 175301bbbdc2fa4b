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

package org.apache.stratus.sql.trees.expressions;

import org.apache.stratus.sql.exceptions.UnboundException;

import java.util.List;

/**
 * 有名字的表达式：列引用或带别名的表达式，可以作为某一阶段的输出列。
 */
public abstract class NamedExpression extends Expression {

    protected NamedExpression(Expression... children) {
        super(children);
    }

    protected NamedExpression(List<Expression> children) {
        super(children);
    }

    public abstract String getName() throws UnboundException;

    public abstract List<String> getQualifier();

    /**
     * Output column of this expression for the next stage.
     */
    public abstract Slot toSlot() throws UnboundException;
}
