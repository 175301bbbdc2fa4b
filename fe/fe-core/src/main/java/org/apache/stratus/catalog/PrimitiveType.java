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

package org.apache.stratus.catalog;

/**
 * 列与表达式的语义类型。
 *
 * ANY 只用于函数签名，表示可以接受任意类型的参数，不会出现在表结构中。
 */
public enum PrimitiveType {
    NULL_TYPE("NULL", -1),
    BOOLEAN("BOOLEAN", -1),
    TINYINT("TINYINT", 0),
    SMALLINT("SMALLINT", 1),
    INT("INT", 2),
    BIGINT("BIGINT", 3),
    FLOAT("FLOAT", 4),
    DOUBLE("DOUBLE", 5),
    VARCHAR("VARCHAR", -1),
    DATE("DATE", -1),
    DATETIME("DATETIME", -1),
    ANY("ANY", -1);

    private final String description;
    // position in the numeric widening order, -1 for non numeric types
    private final int numericRank;

    PrimitiveType(String description, int numericRank) {
        this.description = description;
        this.numericRank = numericRank;
    }

    public boolean isNumericType() {
        return numericRank >= 0;
    }

    public boolean isIntegerType() {
        return numericRank >= 0 && numericRank <= BIGINT.numericRank;
    }

    public boolean isNull() {
        return this == NULL_TYPE;
    }

    /**
     * 是否可以隐式转换为 target：相同类型、NULL、数值类型向更宽的数值类型、DATE 到 DATETIME。
     */
    public boolean canImplicitCastTo(PrimitiveType target) {
        if (this == target || target == ANY || this == NULL_TYPE) {
            return true;
        }
        if (isNumericType() && target.isNumericType()) {
            return numericRank <= target.numericRank;
        }
        return this == DATE && target == DATETIME;
    }

    /**
     * The narrowest type both sides can be implicitly cast to, or null if there is none.
     */
    public static PrimitiveType widerOf(PrimitiveType left, PrimitiveType right) {
        if (left.canImplicitCastTo(right)) {
            return right;
        }
        if (right.canImplicitCastTo(left)) {
            return left;
        }
        return null;
    }

    @Override
    public String toString() {
        return description;
    }
}
