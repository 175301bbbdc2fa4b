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

import org.apache.stratus.catalog.PrimitiveType;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;

import com.google.common.base.Preconditions;

import java.util.List;

/**
 * Not expression: not a.
 */
public class Not extends Expression {

    public Not(Expression child) {
        super(child);
    }

    public Expression child() {
        return child(0);
    }

    @Override
    public void checkLegality() {
        if (!child().getDataType().canImplicitCastTo(PrimitiveType.BOOLEAN)) {
            throw new AnalysisException(ErrorCode.TYPE_MISMATCH,
                    "NOT requires a BOOLEAN argument, but " + child().toSql() + " is " + child().getDataType());
        }
    }

    @Override
    public PrimitiveType getDataType() {
        return PrimitiveType.BOOLEAN;
    }

    @Override
    public boolean nullable() {
        return child().nullable();
    }

    @Override
    public String toSql() {
        return "(NOT " + child().toSql() + ")";
    }

    @Override
    public Not withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.size() == 1);
        return new Not(children.get(0));
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitNot(this, context);
    }
}
