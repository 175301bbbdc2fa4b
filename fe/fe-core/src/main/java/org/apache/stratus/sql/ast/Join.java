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

import java.util.Objects;

/**
 * One explicit join in a {@link TableWithJoins}: the joined relation and how it is joined.
 */
public class Join {
    private final TableFactor relation;
    private final JoinOperator joinOperator;

    public Join(TableFactor relation, JoinOperator joinOperator) {
        this.relation = Objects.requireNonNull(relation, "relation can not be null");
        this.joinOperator = Objects.requireNonNull(joinOperator, "joinOperator can not be null");
    }

    public TableFactor getRelation() {
        return relation;
    }

    public JoinOperator getJoinOperator() {
        return joinOperator;
    }

    public String toSql() {
        return joinOperator.getJoinType().toSql() + " " + relation.toSql()
                + joinOperator.getCondition().map(c -> " ON " + c.toSql()).orElse("");
    }
}
