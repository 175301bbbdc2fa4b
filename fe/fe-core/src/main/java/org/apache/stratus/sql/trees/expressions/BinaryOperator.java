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
import java.util.Objects;

/**
 * 二元运算：算术、比较与 AND / OR。
 */
public class BinaryOperator extends Expression {

    /** 运算符 */
    public enum Operator {
        ADD("+", Kind.ARITHMETIC),
        SUBTRACT("-", Kind.ARITHMETIC),
        MULTIPLY("*", Kind.ARITHMETIC),
        DIVIDE("/", Kind.ARITHMETIC),
        MOD("%", Kind.ARITHMETIC),
        EQ("=", Kind.COMPARISON),
        NE("<>", Kind.COMPARISON),
        LT("<", Kind.COMPARISON),
        LE("<=", Kind.COMPARISON),
        GT(">", Kind.COMPARISON),
        GE(">=", Kind.COMPARISON),
        AND("AND", Kind.LOGICAL),
        OR("OR", Kind.LOGICAL);

        private final String symbol;
        private final Kind kind;

        Operator(String symbol, Kind kind) {
            this.symbol = symbol;
            this.kind = kind;
        }

        public String getSymbol() {
            return symbol;
        }

        public Kind getKind() {
            return kind;
        }
    }

    /** operator category */
    public enum Kind {
        ARITHMETIC, COMPARISON, LOGICAL
    }

    private final Operator op;

    public BinaryOperator(Operator op, Expression left, Expression right) {
        super(left, right);
        this.op = Objects.requireNonNull(op, "op can not be null");
    }

    public Operator getOp() {
        return op;
    }

    public Expression left() {
        return child(0);
    }

    public Expression right() {
        return child(1);
    }

    @Override
    public void checkLegality() {
        PrimitiveType l = left().getDataType();
        PrimitiveType r = right().getDataType();
        switch (op.getKind()) {
            case ARITHMETIC:
                if (!(l.isNumericType() || l.isNull()) || !(r.isNumericType() || r.isNull())) {
                    throw typeMismatch(l, r);
                }
                break;
            case COMPARISON:
                if (PrimitiveType.widerOf(l, r) == null) {
                    throw typeMismatch(l, r);
                }
                break;
            case LOGICAL:
                if (!l.canImplicitCastTo(PrimitiveType.BOOLEAN) || !r.canImplicitCastTo(PrimitiveType.BOOLEAN)) {
                    throw typeMismatch(l, r);
                }
                break;
            default:
                throw new IllegalStateException("unknown operator kind " + op.getKind());
        }
    }

    private AnalysisException typeMismatch(PrimitiveType l, PrimitiveType r) {
        return new AnalysisException(ErrorCode.TYPE_MISMATCH,
                "Can not apply operator " + op.getSymbol() + " to " + l + " and " + r + " in " + toSql());
    }

    @Override
    public PrimitiveType getDataType() {
        if (op.getKind() != Kind.ARITHMETIC) {
            return PrimitiveType.BOOLEAN;
        }
        if (op == Operator.DIVIDE) {
            return PrimitiveType.DOUBLE;
        }
        PrimitiveType wider = PrimitiveType.widerOf(left().getDataType(), right().getDataType());
        if (wider == null || wider.isNull()) {
            return PrimitiveType.BIGINT;
        }
        return wider.isIntegerType() ? PrimitiveType.BIGINT : PrimitiveType.DOUBLE;
    }

    @Override
    public boolean nullable() {
        // x / 0 and x % 0 evaluate to NULL
        return left().nullable() || right().nullable() || op == Operator.DIVIDE || op == Operator.MOD;
    }

    @Override
    public String toSql() {
        return "(" + left().toSql() + " " + op.getSymbol() + " " + right().toSql() + ")";
    }

    @Override
    protected boolean extraEquals(Expression other) {
        return op == ((BinaryOperator) other).op;
    }

    @Override
    protected int extraHashCode() {
        return op.hashCode();
    }

    @Override
    public BinaryOperator withChildren(List<Expression> children) {
        Preconditions.checkArgument(children.size() == 2);
        return new BinaryOperator(op, children.get(0), children.get(1));
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryOperator(this, context);
    }
}
