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

package org.apache.stratus.sql.analyzer;

import org.apache.stratus.sql.exceptions.AnalysisException;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Resolve a table name of the FROM clause to [db, table].
 */
public class TableNameResolver {

    private TableNameResolver() {
    }

    /**
     * table -> [currentDb, table]; db.table -> [db, table].
     *
     * @throws AnalysisException SYNTAX_ERROR for any other number of name parts
     */
    public static List<String> resolve(List<String> nameParts, String currentDb) {
        switch (nameParts.size()) {
            case 0:
                throw AnalysisException.syntax("Table name is empty");
            case 1:
                return ImmutableList.of(currentDb, nameParts.get(0));
            case 2:
                return ImmutableList.of(nameParts.get(0), nameParts.get(1));
            default:
                throw AnalysisException.syntax("Table name must be [`db`].`table`, but got "
                        + String.join(".", nameParts));
        }
    }
}
