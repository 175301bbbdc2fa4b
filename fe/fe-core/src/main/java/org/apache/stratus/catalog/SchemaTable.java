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

import org.apache.stratus.common.Config;

import com.google.common.collect.ImmutableList;

/**
 * 系统库中的内置表。
 *
 * one: 只有一行一列（dummy）的表，用于没有 FROM 子句的查询，例如 SELECT 1。
 */
public class SchemaTable extends Table {

    public SchemaTable(String name, ImmutableList<Column> schema) {
        super(Config.system_database, name, schema);
    }

    /**
     * The single row relation of the system database.
     */
    public static SchemaTable one() {
        return new SchemaTable(Config.one_row_table,
                ImmutableList.of(new Column("dummy", PrimitiveType.TINYINT, false, "single row placeholder")));
    }
}
