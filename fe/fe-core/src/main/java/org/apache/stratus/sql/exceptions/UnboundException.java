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

package org.apache.stratus.sql.exceptions;

/**
 * 在未绑定的表达式上调用了只有绑定后才有意义的方法（例如 getDataType）。
 * 出现该异常说明分析流程有 bug。
 */
public class UnboundException extends RuntimeException {
    public UnboundException(String message) {
        super(String.format("%s is not implemented for unbound expression", message));
    }
}
