////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspclient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspclient.jsonrpc.Message;

/**
 * Bounded buffer of server-initiated messages (notifications, and requests
 * the client does not answer), filled by the reader thread and drained by
 * whoever is interested, e.g. a diagnostics view.
 *
 * <p>With {@link OverflowPolicy#DROP_OLDEST} (the default) {@link #offer}
 * never blocks: when the buffer is full the oldest message is evicted, so a
 * flood of notifications cannot stall responses behind it. With
 * {@link OverflowPolicy#BLOCK} the reader waits for space instead and no
 * message is lost.</p>
 */
public class NotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(NotificationSink.class);

    public static final int DEFAULT_CAPACITY = 100;

    public enum OverflowPolicy {
        DROP_OLDEST,
        BLOCK
    }

    private final BlockingQueue<Message> queue;
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private final AtomicLong dropped = new AtomicLong();

    public NotificationSink() {
        this(DEFAULT_CAPACITY, OverflowPolicy.DROP_OLDEST);
    }

    public NotificationSink(int capacity, OverflowPolicy overflowPolicy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.overflowPolicy = overflowPolicy;
    }

    /**
     * Buffer a message according to the overflow policy.
     *
     * @return {@code true} if the message was buffered; {@code false} only
     *         when a blocking offer was interrupted
     */
    public boolean offer(Message message) {
        if (overflowPolicy == OverflowPolicy.BLOCK) {
            try {
                queue.put(message);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                dropped.incrementAndGet();
                logger.debug("Interrupted while buffering {}", message);
                return false;
            }
        }
        while (!queue.offer(message)) {
            Message evicted = queue.poll();
            if (evicted != null) {
                long total = dropped.incrementAndGet();
                logger.warn("Notification buffer full ({}), dropped {} (total dropped: {})",
                        capacity, evicted, total);
            }
        }
        return true;
    }

    /** The oldest buffered message, or {@code null} if none. */
    public Message poll() {
        return queue.poll();
    }

    /**
     * The oldest buffered message, waiting up to {@code timeout} for one.
     *
     * @return the message, or {@code null} if none arrived in time
     */
    public Message poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Remove and return everything currently buffered, oldest first. */
    public List<Message> drain() {
        List<Message> messages = new ArrayList<>(queue.size());
        queue.drainTo(messages);
        return messages;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    /** Messages lost to overflow (or to an interrupted blocking offer). */
    public long droppedCount() {
        return dropped.get();
    }
}
