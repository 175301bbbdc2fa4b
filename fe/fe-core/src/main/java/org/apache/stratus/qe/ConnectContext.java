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

package org.apache.stratus.qe;

import org.apache.stratus.catalog.Env;
import org.apache.stratus.common.Config;
import org.apache.stratus.sql.exceptions.AnalysisException;
import org.apache.stratus.sql.exceptions.AnalysisException.ErrorCode;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个客户端会话的上下文：元数据环境、当前数据库与取消标记。
 *
 * 分析过程只在一个线程中进行，cancel() 可以由其他线程调用（例如客户端断开连接）。
 */
public class ConnectContext {
    private static final Logger LOG = LogManager.getLogger(ConnectContext.class);

    private final Env env;
    private volatile String currentDb;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ConnectContext(Env env) {
        this(env, Config.default_database);
    }

    public ConnectContext(Env env, String currentDb) {
        this.env = Objects.requireNonNull(env, "env can not be null");
        setDatabase(currentDb);
    }

    public Env getEnv() {
        return env;
    }

    public String getDatabase() {
        return currentDb;
    }

    public void setDatabase(String db) {
        Preconditions.checkArgument(StringUtils.isNotEmpty(db), "database can not be empty");
        this.currentDb = db;
    }

    /**
     * Request the running analysis to stop. Takes effect at the next relation or stage boundary.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("analysis of session with database {} is cancelled", currentDb);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** reset the flag before analyzing the next statement */
    public void resetCancelled() {
        cancelled.set(false);
    }

    public void checkCancelled() {
        if (isCancelled()) {
            throw new AnalysisException(ErrorCode.CANCELLED, "Analysis is cancelled");
        }
    }
}
