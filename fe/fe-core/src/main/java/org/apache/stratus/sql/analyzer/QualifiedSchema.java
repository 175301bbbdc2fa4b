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

import org.apache.stratus.catalog.Column;
import org.apache.stratus.common.Config;
import org.apache.stratus.sql.ast.JoinType;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;
import org.apache.stratus.sql.trees.expressions.Slot;
import org.apache.stratus.sql.trees.expressions.SlotReference;
import org.apache.stratus.sql.util.Utils;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 带名称前缀的有序列集合，用于解析 col、t.col、db.t.col 形式的列引用。
 *
 * 每一列的 qualifier 是它的名称前缀：
 *   普通表: [db, table]；
 *   带别名的表或派生表: [alias]；
 *   表函数与未命名派生表: []。
 *
 * 示例：
 * a(id) / b(id, x)
 * select * from a, b;
 *
 * columns: default.a.id, default.b.id, default.b.x
 * resolve([a, id]) -> default.a.id
 * resolve([x])     -> default.b.x
 * resolve([id])    -> AMBIGUOUS_NAME
 *
 * 同一 schema 中 (qualifier, name) 不能重复，qualifier 为空的列除外。
 * 不可变，join 总是返回新的 schema，列的顺序保持不变。
 */
public class QualifiedSchema {
    private static final QualifiedSchema EMPTY = new QualifiedSchema(ImmutableList.of());

    private final List<Slot> columns;

    // 列数超过 Config.schema_name_index_threshold 时构建名称到列的映射，键是大写列名
    private final boolean buildNameToSlot;
    private final Supplier<ListMultimap<String, Slot>> nameToSlot;

    private QualifiedSchema(List<Slot> columns) {
        this.columns = Utils.fastToImmutableList(Objects.requireNonNull(columns, "columns can not be null"));
        checkUniqueQualifiedNames(this.columns);
        this.buildNameToSlot = this.columns.size() > Config.schema_name_index_threshold;
        this.nameToSlot = buildNameToSlot ? Suppliers.memoize(this::buildNameToSlot) : null;
    }

    public static QualifiedSchema empty() {
        return EMPTY;
    }

    /**
     * Schema of columns that already carry their qualifiers.
     *
     * @throws AnalysisException DUPLICATE_NAME if a qualified name repeats
     */
    public static QualifiedSchema of(List<? extends Slot> columns) {
        return columns.isEmpty() ? EMPTY : new QualifiedSchema(ImmutableList.copyOf(columns));
    }

    /**
     * 由表结构构建 schema，所有列使用同一个名称前缀。
     */
    public static QualifiedSchema fromColumns(List<Column> columns, List<String> prefix) {
        return of(columns.stream()
                .map(column -> SlotReference.fromColumn(column, prefix))
                .collect(ImmutableList.toImmutableList()));
    }

    /**
     * Re-qualify existing columns, e.g. the output of a derived table with its alias.
     */
    public static QualifiedSchema fromSlots(List<? extends Slot> slots, List<String> prefix) {
        return of(slots.stream()
                .map(slot -> slot.withQualifier(prefix))
                .collect(ImmutableList.toImmutableList()));
    }

    /**
     * 组合两个关系的 schema：左侧的列在前，右侧的列在后，不去重也不重排。
     * 外连接中可能补 NULL 的一侧的列变为 nullable。
     */
    public static QualifiedSchema join(QualifiedSchema left, QualifiedSchema right, JoinType joinType) {
        ImmutableList.Builder<Slot> columns = ImmutableList.builderWithExpectedSize(left.size() + right.size());
        for (Slot slot : left.columns) {
            columns.add(joinType.isLeftNullable() ? slot.withNullable(true) : slot);
        }
        for (Slot slot : right.columns) {
            columns.add(joinType.isRightNullable() ? slot.withNullable(true) : slot);
        }
        return new QualifiedSchema(columns.build());
    }

    public List<Slot> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * All columns referenced by the name. The last part is the column name, the preceding parts
     * must match the end of the column's qualifier. Case insensitive.
     */
    public List<Slot> findSlotIgnoreCase(List<String> nameParts) {
        String name = nameParts.get(nameParts.size() - 1);
        List<String> qualifier = nameParts.subList(0, nameParts.size() - 1);
        List<Slot> candidates = findSlotIgnoreCase(name);
        if (qualifier.isEmpty()) {
            return candidates;
        }
        return candidates.stream()
                .filter(slot -> Utils.endsWithIgnoreCase(slot.getQualifier(), qualifier))
                .collect(ImmutableList.toImmutableList());
    }

    /** findSlotIgnoreCase */
    public List<Slot> findSlotIgnoreCase(String slotName) {
        if (!buildNameToSlot) {
            Slot[] array = new Slot[columns.size()];
            int filterIndex = 0;
            for (Slot slot : columns) {
                if (slot.getName().equalsIgnoreCase(slotName)) {
                    array[filterIndex++] = slot;
                }
            }
            return Arrays.asList(array).subList(0, filterIndex);
        } else {
            return nameToSlot.get().get(slotName.toUpperCase(Locale.ROOT));
        }
    }

    /**
     * 解析列引用，恰好匹配一列时返回该列。
     *
     * @throws AnalysisException NOT_FOUND 没有匹配的列；AMBIGUOUS_NAME 匹配多列
     */
    public Slot resolve(List<String> nameParts) {
        List<Slot> bound = findSlotIgnoreCase(nameParts);
        if (bound.size() == 1) {
            return bound.get(0);
        }
        String name = String.join(".", nameParts);
        if (bound.isEmpty()) {
            throw AnalysisException.notFound("Unknown column '" + name + "'");
        }
        throw new AnalysisException(ErrorCode.AMBIGUOUS_NAME, String.format("%s is ambiguous: %s.",
                name, bound.stream().map(Slot::toString).collect(Collectors.joining(", "))));
    }

    /**
     * Columns selected by {@code *} (empty qualifier) or {@code t.*}, in schema order.
     *
     * @throws AnalysisException NOT_FOUND if a qualified star matches no column
     */
    public List<Slot> expandStar(List<String> qualifier) {
        if (qualifier.isEmpty()) {
            return columns;
        }
        List<Slot> slots = columns.stream()
                .filter(slot -> Utils.endsWithIgnoreCase(slot.getQualifier(), qualifier))
                .collect(ImmutableList.toImmutableList());
        if (slots.isEmpty()) {
            throw AnalysisException.notFound("Unknown table '" + String.join(".", qualifier) + "'");
        }
        return slots;
    }

    private ListMultimap<String, Slot> buildNameToSlot() {
        ListMultimap<String, Slot> map = LinkedListMultimap.create(columns.size());
        for (Slot slot : columns) {
            map.put(slot.getName().toUpperCase(Locale.ROOT), slot);
        }
        return map;
    }

    private static void checkUniqueQualifiedNames(List<Slot> columns) {
        Set<List<String>> qualifiedNames = Sets.newHashSetWithExpectedSize(columns.size());
        for (Slot slot : columns) {
            if (slot.getQualifier().isEmpty()) {
                continue;
            }
            ImmutableList.Builder<String> key = ImmutableList.builder();
            for (String part : slot.getQualifier()) {
                key.add(part.toLowerCase(Locale.ROOT));
            }
            key.add(slot.getName().toLowerCase(Locale.ROOT));
            if (!qualifiedNames.add(key.build())) {
                throw new AnalysisException(ErrorCode.DUPLICATE_NAME, "Duplicate column name '"
                        + Utils.qualifiedName(slot.getQualifier(), slot.getName())
                        + "', use an alias to distinguish the relations");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return columns.equals(((QualifiedSchema) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.stream().map(Slot::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
