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
import org.apache.stratus.common.Config;
import org.apache.stratus.sql.analyzer.Unbound;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.exceptions.UnboundException;
import org.apache.stratus.sql.trees.AbstractTreeNode;
import org.apache.stratus.sql.trees.expressions.functions.AggregateFunction;
import org.apache.stratus.sql.trees.expressions.visitor.ExpressionVisitor;

import java.util.List;
import java.util.Objects;

/**
 * 表达式的抽象基类。
 * 解析器产出的表达式树中包含未绑定的节点（{@link Unbound}），经过 ExpressionAnalyzer
 * 绑定后得到带类型的表达式。构造时检查表达式树的深度与宽度限制。
 */
public abstract class Expression extends AbstractTreeNode<Expression> {

    /** 表达式树的深度（从根到最深叶节点的路径长度） */
    private final int depth;

    /** 表达式树的宽度（叶子节点数） */
    private final int width;

    /** 标记表达式是否包含未绑定的符号 */
    private final boolean hasUnbound;

    protected Expression(Expression... children) {
        super(children);
        int maxChildDepth = 0;
        int sumChildWidth = 0;
        boolean hasUnbound = false;
        for (Expression child : children) {
            maxChildDepth = Math.max(maxChildDepth, child.depth);
            sumChildWidth += child.width;
            hasUnbound |= child.hasUnbound;
        }
        this.depth = maxChildDepth + 1;
        this.width = children.length == 0 ? 1 : sumChildWidth;
        this.hasUnbound = hasUnbound || this instanceof Unbound;
        checkLimit();
    }

    protected Expression(List<Expression> children) {
        this(children.toArray(new Expression[0]));
    }

    /**
     * 检查表达式树的限制。
     * 验证表达式的深度和宽度是否超过配置的最大值，如果超过则抛出异常。
     */
    private void checkLimit() {
        if (depth > Config.expr_depth_limit) {
            throw new AnalysisException(ErrorCode.EXPRESSION_EXCEEDS_LIMIT,
                    String.format("Exceeded the maximum depth of an expression tree (%s).", Config.expr_depth_limit));
        }
        if (width > Config.expr_children_limit) {
            throw new AnalysisException(ErrorCode.EXPRESSION_EXCEEDS_LIMIT,
                    String.format("Exceeded the maximum children of an expression tree (%s).",
                            Config.expr_children_limit));
        }
    }

    public abstract <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);

    public PrimitiveType getDataType() throws UnboundException {
        throw new UnboundException(toSql() + ".getDataType()");
    }

    public boolean nullable() throws UnboundException {
        throw new UnboundException(toSql() + ".nullable()");
    }

    /**
     * 绑定完成后检查参数类型是否合法，不合法时抛出 TYPE_MISMATCH。
     */
    public void checkLegality() {
    }

    public abstract String toSql();

    public int getDepth() {
        return depth;
    }

    public int getWidth() {
        return width;
    }

    public boolean hasUnbound() {
        return hasUnbound;
    }

    public boolean containsAggregate() {
        return anyMatch(AggregateFunction.class::isInstance);
    }

    public boolean isConstant() {
        return !anyMatch(e -> e instanceof Slot || e instanceof Unbound || e instanceof AggregateFunction);
    }

    public Alias alias(String alias) {
        return new Alias(this, alias);
    }

    /** 子类比较自身特有的字段，children 已经比较过 */
    protected boolean extraEquals(Expression that) {
        return true;
    }

    protected int extraHashCode() {
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Expression that = (Expression) o;
        return depth == that.depth && width == that.width
                && children.equals(that.children) && extraEquals(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), children, extraHashCode());
    }

    @Override
    public String toString() {
        return toSql();
    }
}
