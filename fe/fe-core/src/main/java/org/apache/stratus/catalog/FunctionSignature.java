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
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * 函数签名类。
 * <p>
 * 表示一个函数的签名信息，包括返回类型、参数类型列表、是否支持可变参数等。
 * 用于函数重载匹配和类型推导。
 */
public class FunctionSignature {

    /** 返回类型的推导方式 */
    public enum ReturnMode {
        // returnType is used as is
        FIXED,
        // same type as the first argument
        FOLLOW_FIRST_ARGUMENT,
        // narrowest type all arguments can be cast to
        WIDER_OF_ARGUMENTS
    }

    /** 函数的返回类型，ReturnMode 不是 FIXED 时为 ANY */
    public final PrimitiveType returnType;
    public final ReturnMode returnMode;
    /** 是否支持可变参数（varargs），可变参数的类型是最后一个参数类型 */
    public final boolean hasVarArgs;
    /** 参数类型列表 */
    public final List<PrimitiveType> argumentsTypes;
    /** 参数数量（arity） */
    public final int arity;

    private FunctionSignature(PrimitiveType returnType, ReturnMode returnMode, boolean hasVarArgs,
            List<PrimitiveType> argumentsTypes) {
        this.returnType = Objects.requireNonNull(returnType, "returnType is not null");
        this.returnMode = Objects.requireNonNull(returnMode, "returnMode is not null");
        this.argumentsTypes = Utils.fastToImmutableList(
                Objects.requireNonNull(argumentsTypes, "argumentsTypes is not null"));
        this.hasVarArgs = hasVarArgs;
        this.arity = argumentsTypes.size();
        Preconditions.checkArgument(!hasVarArgs || arity > 0, "varargs signature needs an argument type");
    }

    public static FuncSigBuilder ret(PrimitiveType returnType) {
        return new FuncSigBuilder(returnType, ReturnMode.FIXED);
    }

    public static FuncSigBuilder retFollowFirstArgument() {
        return new FuncSigBuilder(PrimitiveType.ANY, ReturnMode.FOLLOW_FIRST_ARGUMENT);
    }

    public static FuncSigBuilder retWiderOfArguments() {
        return new FuncSigBuilder(PrimitiveType.ANY, ReturnMode.WIDER_OF_ARGUMENTS);
    }

    /**
     * 获取指定索引位置的参数类型。
     * 如果支持可变参数且索引超出参数数量，返回可变参数类型。
     */
    public PrimitiveType getArgType(int index) {
        if (hasVarArgs && index >= arity) {
            return argumentsTypes.get(arity - 1);
        }
        return argumentsTypes.get(index);
    }

    /**
     * 检查实参类型能否匹配该签名：参数个数相符，且每个实参都可以隐式转换为形参类型。
     */
    public boolean matches(List<PrimitiveType> actualTypes) {
        if (hasVarArgs ? actualTypes.size() < arity - 1 : actualTypes.size() != arity) {
            return false;
        }
        for (int i = 0; i < actualTypes.size(); i++) {
            if (!actualTypes.get(i).canImplicitCastTo(getArgType(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Return type for the given argument types, which must match this signature.
     */
    public PrimitiveType computeReturnType(List<PrimitiveType> actualTypes) {
        switch (returnMode) {
            case FIXED:
                return returnType;
            case FOLLOW_FIRST_ARGUMENT:
                return actualTypes.get(0);
            case WIDER_OF_ARGUMENTS: {
                PrimitiveType result = PrimitiveType.NULL_TYPE;
                for (PrimitiveType type : actualTypes) {
                    PrimitiveType wider = PrimitiveType.widerOf(result, type);
                    if (wider == null) {
                        return PrimitiveType.VARCHAR;
                    }
                    result = wider;
                }
                return result;
            }
            default:
                throw new IllegalStateException("unknown return mode " + returnMode);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < arity; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(argumentsTypes.get(i));
            if (hasVarArgs && i == arity - 1) {
                sb.append("...");
            }
        }
        sb.append(") -> ").append(returnMode == ReturnMode.FIXED ? returnType.toString() : returnMode.name());
        return sb.toString();
    }

    /** 函数签名的构造器 */
    public static class FuncSigBuilder {
        private final PrimitiveType returnType;
        private final ReturnMode returnMode;

        private FuncSigBuilder(PrimitiveType returnType, ReturnMode returnMode) {
            this.returnType = returnType;
            this.returnMode = returnMode;
        }

        public FunctionSignature args(PrimitiveType... argTypes) {
            return new FunctionSignature(returnType, returnMode, false, ImmutableList.copyOf(argTypes));
        }

        public FunctionSignature varArgs(PrimitiveType... argTypes) {
            return new FunctionSignature(returnType, returnMode, true, ImmutableList.copyOf(argTypes));
        }
    }
}
