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

import org.apache.stratus.sql.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 普通表的元数据。列名在表内不区分大小写唯一。
 */
public class Table implements TableIf {
    private final String databaseName;
    private final String name;
    private final List<Column> baseSchema;

    /** Table */
    public Table(String databaseName, String name, List<Column> baseSchema) {
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName can not be null");
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.baseSchema = Utils.fastToImmutableList(Objects.requireNonNull(baseSchema, "baseSchema can not be null"));
        Set<String> names = Sets.newHashSet();
        for (Column column : this.baseSchema) {
            Preconditions.checkArgument(names.add(column.getName().toLowerCase(Locale.ROOT)),
                    "duplicate column %s in table %s.%s", column.getName(), databaseName, name);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDatabaseName() {
        return databaseName;
    }

    @Override
    public List<Column> getBaseSchema() {
        return baseSchema;
    }

    @Override
    public String toString() {
        return "Table(" + getQualifiedName() + ", " + baseSchema + ")";
    }
}
