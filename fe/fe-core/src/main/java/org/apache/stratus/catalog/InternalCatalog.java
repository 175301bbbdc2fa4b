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
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;

/**
 * 内存中的 Catalog 实现。
 *
 * 库名与表名不区分大小写。创建时自动注册系统库及其中的 one 表。
 */
@ThreadSafe
public class InternalCatalog implements CatalogIf {
    private static final Logger LOG = LogManager.getLogger(InternalCatalog.class);

    // lower case db name -> lower case table name -> table
    private final Map<String, Map<String, TableIf>> databases = new ConcurrentHashMap<>();

    public InternalCatalog() {
        createDatabase(Config.system_database);
        createTable(SchemaTable.one());
    }

    /** create database if not exists */
    public void createDatabase(String dbName) {
        databases.computeIfAbsent(normalize(dbName), k -> new ConcurrentHashMap<>());
    }

    /**
     * Register a table, the database must exist.
     */
    public void createTable(TableIf table) {
        Map<String, TableIf> tables = databases.get(normalize(table.getDatabaseName()));
        if (tables == null) {
            throw AnalysisException.notFound("Unknown database '" + table.getDatabaseName() + "'");
        }
        TableIf previous = tables.putIfAbsent(normalize(table.getName()), table);
        if (previous != null) {
            LOG.warn("table {} already exists", table.getQualifiedName());
            throw new AnalysisException(ErrorCode.DUPLICATE_NAME,
                    "Table '" + table.getQualifiedName() + "' already exists");
        }
    }

    /** convenience for tests and bootstrap code */
    public void createTable(String dbName, String tableName, List<Column> schema) {
        createTable(new Table(dbName, tableName, ImmutableList.copyOf(schema)));
    }

    @Override
    public TableIf getTableOrAnalysisException(String dbName, String tableName) {
        Map<String, TableIf> tables = databases.get(normalize(dbName));
        if (tables == null) {
            throw AnalysisException.notFound("Unknown database '" + dbName + "'");
        }
        TableIf table = tables.get(normalize(tableName));
        if (table == null) {
            throw AnalysisException.notFound("Unknown table '" + dbName + "." + tableName + "'");
        }
        return table;
    }

    @Override
    public boolean databaseExists(String dbName) {
        return databases.containsKey(normalize(dbName));
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
