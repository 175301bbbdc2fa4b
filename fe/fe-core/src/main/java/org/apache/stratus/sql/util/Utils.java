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

package org.apache.stratus.sql.util;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Utils for the sql analyzer.
 */
public class Utils {

    /**
     * 返回不可变列表。如果已经是 ImmutableList，直接返回，避免 ImmutableList.copyOf 的额外拷贝。
     */
    @SuppressWarnings("unchecked")
    public static <E> ImmutableList<E> fastToImmutableList(List<? extends E> list) {
        if (list instanceof ImmutableList) {
            return (ImmutableList<E>) list;
        }
        return ImmutableList.copyOf(list);
    }

    @SafeVarargs
    public static <E> ImmutableList<E> fastToImmutableList(E... array) {
        return ImmutableList.copyOf(array);
    }

    /**
     * Fully qualified name, e.g. [db, t, c] -> "db.t.c".
     */
    public static String qualifiedName(List<String> qualifier, String name) {
        if (qualifier.isEmpty()) {
            return name;
        }
        return StringUtils.join(qualifier, ".") + "." + name;
    }

    /** backquoted sql form of a name path: `db`.`t` */
    public static String toSqlName(List<String> nameParts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nameParts.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append('`').append(nameParts.get(i)).append('`');
        }
        return sb.toString();
    }

    /**
     * Suffix match ignoring case: whether {@code suffix} equals the last parts of {@code qualifier}.
     */
    public static boolean endsWithIgnoreCase(List<String> qualifier, List<String> suffix) {
        if (suffix.size() > qualifier.size()) {
            return false;
        }
        int offset = qualifier.size() - suffix.size();
        for (int i = 0; i < suffix.size(); i++) {
            if (!qualifier.get(offset + i).equalsIgnoreCase(suffix.get(i))) {
                return false;
            }
        }
        return true;
    }
}
