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

/**
 * All join types in the FROM clause.
 */
public enum JoinType {
    INNER_JOIN("INNER JOIN"),
    LEFT_OUTER_JOIN("LEFT OUTER JOIN"),
    RIGHT_OUTER_JOIN("RIGHT OUTER JOIN"),
    FULL_OUTER_JOIN("FULL OUTER JOIN"),
    CROSS_JOIN("CROSS JOIN"),
    LEFT_SEMI_JOIN("LEFT SEMI JOIN"),
    LEFT_ANTI_JOIN("LEFT ANTI JOIN");

    private final String sql;

    JoinType(String sql) {
        this.sql = sql;
    }

    public boolean isOuterJoin() {
        return this == LEFT_OUTER_JOIN || this == RIGHT_OUTER_JOIN || this == FULL_OUTER_JOIN;
    }

    /** whether the columns of the left side may be filled with null */
    public boolean isLeftNullable() {
        return this == RIGHT_OUTER_JOIN || this == FULL_OUTER_JOIN;
    }

    /** whether the columns of the right side may be filled with null */
    public boolean isRightNullable() {
        return this == LEFT_OUTER_JOIN || this == FULL_OUTER_JOIN;
    }

    public boolean isSemiOrAntiJoin() {
        return this == LEFT_SEMI_JOIN || this == LEFT_ANTI_JOIN;
    }

    public String toSql() {
        return sql;
    }
}
