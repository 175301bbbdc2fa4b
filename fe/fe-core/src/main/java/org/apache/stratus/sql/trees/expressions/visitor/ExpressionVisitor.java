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

package org.apache.stratus.sql.trees.expressions.visitor;

import org.apache.stratus.sql.analyzer.UnboundAlias;
import org.apache.stratus.sql.analyzer.UnboundFunction;
import org.apache.stratus.sql.analyzer.UnboundSlot;
import org.apache.stratus.sql.analyzer.UnboundStar;
import org.apache.stratus.sql.trees.expressions.Alias;
import org.apache.stratus.sql.trees.expressions.BinaryOperator;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.Literal;
import org.apache.stratus.sql.trees.expressions.Not;
import org.apache.stratus.sql.trees.expressions.SlotReference;
import org.apache.stratus.sql.trees.expressions.functions.AggregateFunction;
import org.apache.stratus.sql.trees.expressions.functions.ScalarFunction;

/**
 * Use the visitor pattern to iterate over all expressions for expression rewriting.
 */
public abstract class ExpressionVisitor<R, C> {

    public abstract R visit(Expression expr, C context);

    public R visitSlotReference(SlotReference slotReference, C context) {
        return visit(slotReference, context);
    }

    public R visitAlias(Alias alias, C context) {
        return visit(alias, context);
    }

    public R visitLiteral(Literal literal, C context) {
        return visit(literal, context);
    }

    public R visitBinaryOperator(BinaryOperator binaryOperator, C context) {
        return visit(binaryOperator, context);
    }

    public R visitNot(Not not, C context) {
        return visit(not, context);
    }

    public R visitScalarFunction(ScalarFunction scalarFunction, C context) {
        return visit(scalarFunction, context);
    }

    public R visitAggregateFunction(AggregateFunction aggregateFunction, C context) {
        return visit(aggregateFunction, context);
    }

    /* ********************************************************************************************
     * Unbound expressions
     * ********************************************************************************************/

    public R visitUnboundSlot(UnboundSlot unboundSlot, C context) {
        return visit(unboundSlot, context);
    }

    public R visitUnboundStar(UnboundStar unboundStar, C context) {
        return visit(unboundStar, context);
    }

    public R visitUnboundFunction(UnboundFunction unboundFunction, C context) {
        return visit(unboundFunction, context);
    }

    public R visitUnboundAlias(UnboundAlias unboundAlias, C context) {
        return visit(unboundAlias, context);
    }
}
