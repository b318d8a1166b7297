/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.aff4.store.util;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.jackrabbit.aff4.store.Document;
import org.apache.jackrabbit.aff4.store.DocumentStore;
import org.apache.jackrabbit.aff4.store.DocumentStoreException;
import org.apache.jackrabbit.aff4.store.UpdateOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements a <code>DocumentStore</code> wrapper and logs all calls.
 */
public class LoggingDocumentStoreWrapper implements DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingDocumentStoreWrapper.class);

    private final DocumentStore store;

    public LoggingDocumentStoreWrapper(DocumentStore store) {
        this.store = store;
    }

    @CheckForNull
    @Override
    public Document find(String key) {
        try {
            logMethod("find", key);
            return logResult(store.find(key));
        } catch (Exception e) {
            logException(e);
            throw convert(e);
        }
    }

    @Nonnull
    @Override
    public List<Document> query(String fromKey, String toKey, int limit) {
        try {
            logMethod("query", fromKey, toKey, limit);
            return logResult(store.query(fromKey, toKey, limit));
        } catch (Exception e) {
            logException(e);
            throw convert(e);
        }
    }

    @CheckForNull
    @Override
    public Document createOrUpdate(UpdateOp update) throws DocumentStoreException {
        try {
            logMethod("createOrUpdate", update);
            return logResult(store.createOrUpdate(update));
        } catch (Exception e) {
            logException(e);
            throw convert(e);
        }
    }

    @Override
    public void dispose() {
        try {
            logMethod("dispose");
            store.dispose();
        } catch (Exception e) {
            logException(e);
            throw convert(e);
        }
    }

    private static void logMethod(String methodName, Object... args) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        StringBuilder buff = new StringBuilder("ds");
        buff.append('.').append(methodName).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                buff.append(", ");
            }
            buff.append(quote(args[i]));
        }
        buff.append(");");
        LOG.debug(buff.toString());
    }

    public static String quote(Object o) {
        if (o == null) {
            return "null";
        } else if (o instanceof String) {
            return '"' + ((String) o).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return o.toString();
    }

    private static RuntimeException convert(Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        LOG.debug("// unexpected exception type: {}", e.getClass().getName());
        return DocumentStoreException.convert(e);
    }

    private static void logException(Exception e) {
        LOG.debug("// exception: {}", e.toString());
    }

    private static <T> T logResult(T result) {
        LOG.debug("// {}", quote(result));
        return result;
    }
}
