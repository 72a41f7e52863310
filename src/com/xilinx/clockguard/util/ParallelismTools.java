/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of ClockGuard.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */


package com.xilinx.clockguard.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;

/**
 * Runs independent tasks on a shared pool of daemon threads, or on the
 * calling thread when parallel processing is off (see {@link Params#CG_PARALLEL}).
 */
public class ParallelismTools {

    private static final int THREADS = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    private static final ThreadPoolExecutor pool = new ThreadPoolExecutor(THREADS, THREADS,
            0, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            (r) -> {
                Thread t = Executors.defaultThreadFactory().newThread(r);
                t.setDaemon(true);
                return t;
            });

    private static boolean parallel = Params.CG_PARALLEL;

    /**
     * Global setter to control parallel processing.
     * @param parallel Enable parallel processing.
     */
    public static void setParallel(boolean parallel) {
        ParallelismTools.parallel = parallel;
    }

    public static boolean getParallel() {
        return parallel;
    }

    /**
     * Submits a task to the pool, or runs it right away if parallel
     * processing is off.
     * @param task Task to be performed.
     * @return A Future holding the value returned by the task.
     */
    public static <T> Future<T> submit(@NotNull Callable<T> task) {
        if (!getParallel()) {
            CompletableFuture<T> f = new CompletableFuture<>();
            try {
                f.complete(task.call());
            } catch (Exception e) {
                f.completeExceptionally(e);
            }
            return f;
        }
        return pool.submit(task);
    }

    /**
     * Blocks until the task behind the future is complete. A runtime exception
     * thrown by the task is rethrown as is.
     * @param future Future of a previously submitted task.
     * @return Value returned by the task.
     */
    public static <T> T get(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RuntimeException(e.getCause());
        }
    }

    /**
     * Runs all tasks and waits for them.
     * @param tasks Tasks to be performed.
     * @return Their results, in the order of the tasks.
     */
    public static <T> List<T> invokeAll(@NotNull List<Callable<T>> tasks) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(submit(task));
        }
        List<T> results = new ArrayList<>(tasks.size());
        for (Future<T> f : futures) {
            results.add(get(f));
        }
        return results;
    }
}
