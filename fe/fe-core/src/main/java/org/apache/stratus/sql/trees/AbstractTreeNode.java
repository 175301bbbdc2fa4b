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

package org.apache.stratus.sql.trees;

import org.apache.stratus.sql.util.Utils;

import java.util.List;

/**
 * 树节点的抽象基类，为表达式提供不可变的子节点列表。
 *
 * @param <NODE_TYPE> 节点类型
 */
public abstract class AbstractTreeNode<NODE_TYPE extends TreeNode<NODE_TYPE>>
        implements TreeNode<NODE_TYPE> {

    /** 子节点列表，使用不可变列表存储 */
    protected final List<NODE_TYPE> children;

    @SafeVarargs
    protected AbstractTreeNode(NODE_TYPE... children) {
        this.children = Utils.fastToImmutableList(children);
    }

    protected AbstractTreeNode(List<NODE_TYPE> children) {
        // 直接生成不可变列表，避免额外的列表克隆
        this.children = Utils.fastToImmutableList(children);
    }

    @Override
    public NODE_TYPE child(int index) {
        return children.get(index);
    }

    @Override
    public List<NODE_TYPE> children() {
        return children;
    }

    @Override
    public int arity() {
        return children.size();
    }
}
