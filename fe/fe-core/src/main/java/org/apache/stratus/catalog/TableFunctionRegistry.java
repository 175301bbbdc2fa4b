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

import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.trees.expressions.Expression;
import org.apache.stratus.sql.trees.expressions.functions.table.Numbers;
import org.apache.stratus.sql.trees.expressions.functions.table.TableValuedFunction;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import javax.annotation.concurrent.ThreadSafe;

/**
 * 表函数注册表。函数名不区分大小写。
 */
@ThreadSafe
public class TableFunctionRegistry {

    private final Map<String, BiFunction<String, List<Expression>, TableValuedFunction>> name2Factories =
            new ConcurrentHashMap<>();

    public TableFunctionRegistry() {
        register("numbers", Numbers::new);
        register("numbers_mt", Numbers::new);
        register("numbers_local", Numbers::new);
    }

    public void register(String name, BiFunction<String, List<Expression>, TableValuedFunction> factory) {
        name2Factories.put(name.toLowerCase(Locale.ROOT), factory);
    }

    /**
     * 以已分析的参数实例化表函数。
     *
     * @throws AnalysisException NOT_FOUND 函数不存在；BAD_ARGUMENTS 参数形式不受支持
     */
    public TableValuedFunction getTableFunction(String name, List<Expression> resolvedArgs) {
        String lowerName = name.toLowerCase(Locale.ROOT);
        BiFunction<String, List<Expression>, TableValuedFunction> factory = name2Factories.get(lowerName);
        if (factory == null) {
            throw AnalysisException.notFound("Unknown table function '" + name + "'");
        }
        return factory.apply(lowerName, resolvedArgs);
    }
}
