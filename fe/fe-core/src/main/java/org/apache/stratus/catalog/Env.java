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

import java.util.Objects;

/**
 * 一个 FE 实例的元数据环境：Catalog、标量/聚合函数注册表、表函数注册表。
 */
public class Env {
    private final CatalogIf catalog;
    private final FunctionRegistry functionRegistry;
    private final TableFunctionRegistry tableFunctionRegistry;

    public Env(CatalogIf catalog) {
        this(catalog, new FunctionRegistry(), new TableFunctionRegistry());
    }

    /** Env */
    public Env(CatalogIf catalog, FunctionRegistry functionRegistry, TableFunctionRegistry tableFunctionRegistry) {
        this.catalog = Objects.requireNonNull(catalog, "catalog can not be null");
        this.functionRegistry = Objects.requireNonNull(functionRegistry, "functionRegistry can not be null");
        this.tableFunctionRegistry = Objects.requireNonNull(tableFunctionRegistry,
                "tableFunctionRegistry can not be null");
    }

    public CatalogIf getCatalog() {
        return catalog;
    }

    public FunctionRegistry getFunctionRegistry() {
        return functionRegistry;
    }

    public TableFunctionRegistry getTableFunctionRegistry() {
        return tableFunctionRegistry;
    }
}
