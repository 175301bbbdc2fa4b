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

import java.util.List;

/**
 * 计划中某一阶段输入或输出的一列。
 */
public abstract class Slot extends NamedExpression {

    protected Slot() {
        super();
    }

    @Override
    public Slot toSlot() {
        return this;
    }

    public abstract Slot withQualifier(List<String> qualifier);

    public abstract Slot withNullable(boolean nullable);

    @Override
    public Expression withChildren(List<Expression> children) {
        if (!children.isEmpty()) {
            throw new IllegalArgumentException("slot has no children");
        }
        return this;
    }
}
