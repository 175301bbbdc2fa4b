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

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * 表结构中的一列。
 */
public class Column {
    private final String name;
    private final PrimitiveType type;
    private final boolean isAllowNull;
    private final String comment;

    public Column(String name, PrimitiveType type) {
        this(name, type, true, "");
    }

    public Column(String name, PrimitiveType type, boolean isAllowNull) {
        this(name, type, isAllowNull, "");
    }

    /** Column */
    public Column(String name, PrimitiveType type, boolean isAllowNull, String comment) {
        Preconditions.checkArgument(StringUtils.isNotEmpty(name), "column name can not be empty");
        Preconditions.checkArgument(type != PrimitiveType.ANY, "column %s can not be of type ANY", name);
        this.name = name;
        this.type = Objects.requireNonNull(type, "type can not be null");
        this.isAllowNull = isAllowNull;
        this.comment = comment == null ? "" : comment;
    }

    public String getName() {
        return name;
    }

    public PrimitiveType getType() {
        return type;
    }

    public boolean isAllowNull() {
        return isAllowNull;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Column column = (Column) o;
        return isAllowNull == column.isAllowNull && name.equals(column.name) && type == column.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, isAllowNull);
    }

    @Override
    public String toString() {
        return "`" + name + "` " + type + (isAllowNull ? " NULL" : " NOT NULL");
    }
}
