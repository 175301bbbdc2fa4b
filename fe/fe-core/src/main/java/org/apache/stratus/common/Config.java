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

package org.apache.stratus.common;

/**
 * FE 分析器配置项。默认值在此声明，可由 fe.conf 覆盖。
 */
public class Config extends ConfigBase {

    @ConfField(mutable = true, description = {"派生表（FROM 子查询）允许的最大嵌套层数。",
            "The maximum nesting depth of derived tables in a FROM clause."})
    public static int max_subquery_nesting_depth = 64;

    @ConfField(mutable = true, description = {"表达式树的最大深度。",
            "The maximum depth of an expression tree."})
    public static int expr_depth_limit = 3000;

    @ConfField(mutable = true, description = {"表达式树的最大宽度。",
            "The maximum children of an expression tree."})
    public static int expr_children_limit = 10000;

    @ConfField(description = {"新会话的默认数据库。", "Current database of a new session."})
    public static String default_database = "default";

    @ConfField(description = {"系统库名称。", "Name of the system database."})
    public static String system_database = "system";

    @ConfField(description = {"没有 FROM 子句时使用的单行系统表。",
            "Single-row system table used by a query without FROM clause."})
    public static String one_row_table = "one";

    @ConfField(mutable = true, description = {"列数超过该值时，QualifiedSchema 构建列名索引。",
            "Column count above which a qualified schema indexes column names."})
    public static int schema_name_index_threshold = 500;
}
