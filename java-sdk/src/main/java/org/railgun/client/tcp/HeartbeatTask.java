/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.railgun.client.tcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Periodically signals client liveness to the server on a dedicated thread.
 *
 * <p>The task does not own the connection. Each cycle it asks the emitter to send one
 * heartbeat; the emitter answers {@code false} once the connection is torn down, which
 * stops the task. {@link #stop()} stops it from outside and is observed within one interval.
 */
final class HeartbeatTask implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatTask.class);

    enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    private final Duration interval;
    private final BooleanSupplier emitter;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile State state = State.NEW;
    private Thread thread;

    HeartbeatTask(Duration interval, BooleanSupplier emitter) {
        this.interval = interval;
        this.emitter = emitter;
    }

    synchronized void start(String threadName) {
        if (state != State.NEW) {
            throw new IllegalStateException("Heartbeat task already started");
        }
        state = State.RUNNING;
        thread = new Thread(this, threadName);
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void run() {
        long intervalNanos = interval.toNanos();
        int sent = 0;
        try {
            while (stopSignal.getCount() > 0) {
                if (!emitter.getAsBoolean()) {
                    log.debug("Connection torn down, stopping heartbeats");
                    break;
                }
                sent++;
                if (stopSignal.await(intervalNanos, TimeUnit.NANOSECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = State.STOPPED;
            log.trace("Heartbeat task finished after {} heartbeats", sent);
        }
    }

    void stop() {
        stopSignal.countDown();
    }

    /**
     * Waits for the heartbeat thread to finish. Must not be called while holding the
     * connection lock, since the thread may be waiting for it.
     */
    void awaitTermination() {
        Thread current;
        synchronized (this) {
            current = thread;
        }
        if (current == null || current == Thread.currentThread()) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                current.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    State state() {
        return state;
    }

    boolean isRunning() {
        return state == State.RUNNING;
    }
}
