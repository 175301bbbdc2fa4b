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

import org.apache.stratus.sql.util.Utils;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * FROM 子句中以逗号分隔的一项：一个基础关系，后接零到多个显式 JOIN。
 */
public class TableWithJoins {
    private final TableFactor relation;
    private final List<Join> joins;

    public TableWithJoins(TableFactor relation) {
        this(relation, ImmutableList.of());
    }

    public TableWithJoins(TableFactor relation, List<Join> joins) {
        this.relation = Objects.requireNonNull(relation, "relation can not be null");
        this.joins = Utils.fastToImmutableList(Objects.requireNonNull(joins, "joins can not be null"));
    }

    public TableFactor getRelation() {
        return relation;
    }

    public List<Join> getJoins() {
        return joins;
    }

    public TableWithJoins join(TableFactor right, JoinOperator joinOperator) {
        return new TableWithJoins(relation, ImmutableList.<Join>builder()
                .addAll(joins).add(new Join(right, joinOperator)).build());
    }

    public String toSql() {
        StringBuilder sb = new StringBuilder(relation.toSql());
        for (Join join : joins) {
            sb.append(' ').append(join.toSql());
        }
        return sb.toString();
    }
}
