/**
 * Copyright 2013 Apigee Corporation.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package io.apigee.rerunner.core;

import io.apigee.rerunner.core.internal.PoolNameFactory;
import io.apigee.rerunner.kernel.cache.OutputMessageCache;
import io.apigee.rerunner.kernel.msg.MessageKind;
import io.apigee.rerunner.kernel.msg.OutputMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delivers the output of sessions to their viewers. Large messages are kept in a cache shared by
 * all sessions, and a message that a viewer was sent recently enough is replaced by a reference
 * to it. A session's run generation goes up every time one of its runs finishes, and cached
 * messages that the session has not seen for more than "maxCachedMessageAge" generations are
 * assumed to be gone from the viewer.
 */
public class OutputDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(OutputDispatcher.class);

    private final OutputMessageCache<SessionCoordinator> cache;
    private final int minCachedMessageSize;
    private final IdentityHashMap<SessionCoordinator, SessionInfo> sessions =
        new IdentityHashMap<SessionCoordinator, SessionInfo>();

    private ScheduledExecutorService flusher;

    public OutputDispatcher(int maxCachedMessageAge, int minCachedMessageSize)
    {
        this.cache = new OutputMessageCache<SessionCoordinator>(maxCachedMessageAge);
        this.minCachedMessageSize = minCachedMessageSize;
    }

    public OutputMessageCache<SessionCoordinator> getCache() {
        return cache;
    }

    public synchronized void addSession(SessionCoordinator session, DeliveryTransport transport)
    {
        if (sessions.containsKey(session)) {
            throw new IllegalStateException("Session " + session.getId() + " was already added");
        }
        sessions.put(session, new SessionInfo(session, transport));
    }

    /**
     * Stop delivering to a session, and shut it down.
     */
    public void removeSession(SessionCoordinator session)
    {
        synchronized (this) {
            sessions.remove(session);
        }
        session.shutdown();
    }

    /**
     * Return the run generation of a session, or -1 if the session is not known.
     */
    public synchronized int getRunGeneration(SessionCoordinator session)
    {
        SessionInfo info = sessions.get(session);
        return (info == null ? -1 : info.getGeneration());
    }

    /**
     * Return a message that was previously replaced by a reference, or null if it is no longer
     * cached.
     */
    public OutputMessage getCachedMessage(String hash)
    {
        return cache.getMessage(hash);
    }

    /**
     * Send everything that a session has queued.
     *
     * @return the number of messages sent
     */
    public int flushSession(SessionCoordinator session)
    {
        SessionInfo info;
        synchronized (this) {
            info = sessions.get(session);
        }
        if (info == null) {
            return 0;
        }
        return info.flush();
    }

    public void flushAll()
    {
        List<SessionInfo> all;
        synchronized (this) {
            all = new ArrayList<SessionInfo>(sessions.values());
        }
        for (SessionInfo info : all) {
            info.flush();
        }
    }

    /**
     * Flush all sessions periodically on a background thread.
     */
    public synchronized void start(long period, TimeUnit unit)
    {
        if (flusher != null) {
            throw new IllegalStateException("Already started");
        }
        flusher = Executors.newSingleThreadScheduledExecutor(new PoolNameFactory("Rerunner Dispatcher"));
        flusher.scheduleWithFixedDelay(new Runnable() {
            @Override
            public void run()
            {
                try {
                    flushAll();
                } catch (RuntimeException re) {
                    // An exception here would cancel all future flushes
                    log.error("Error flushing sessions: {}", re, re);
                }
            }
        }, period, period, unit);
    }

    public synchronized void stop()
    {
        if (flusher != null) {
            flusher.shutdown();
            flusher = null;
        }
    }

    boolean isCacheable(OutputMessage msg)
    {
        if ((msg.getKind() == MessageKind.INITIALIZE) || (msg.getKind() == MessageKind.REFERENCE)) {
            return false;
        }
        return msg.getEncodedSize() >= minCachedMessageSize;
    }

    private final class SessionInfo
    {
        private final SessionCoordinator session;
        private final DeliveryTransport transport;
        private int generation;

        SessionInfo(SessionCoordinator session, DeliveryTransport transport)
        {
            this.session = session;
            this.transport = transport;
        }

        synchronized int getGeneration() {
            return generation;
        }

        synchronized int flush()
        {
            List<OutputMessage> queued = session.flushOutboundQueue();
            if (queued.isEmpty()) {
                return 0;
            }

            // The cache only learns about a batch once the viewer has it
            ArrayList<OutputMessage> toSend = new ArrayList<OutputMessage>(queued.size());
            ArrayList<OutputMessage> toCache = new ArrayList<OutputMessage>();
            ArrayList<Integer> cacheGenerations = new ArrayList<Integer>();
            int gen = generation;
            for (OutputMessage msg : queued) {
                boolean cacheable = isCacheable(msg);
                OutputMessage m = msg.withMetadata(msg.getMetadata().withCacheable(cacheable));
                if (cacheable) {
                    if (cache.hasMessageReference(m, session, gen)) {
                        toSend.add(m.createReference());
                    } else {
                        toSend.add(m);
                    }
                    toCache.add(m);
                    cacheGenerations.add(gen);
                } else {
                    toSend.add(m);
                }
                if (m.getKind() == MessageKind.RUN_FINISHED) {
                    // Stand-in for the expiry pass that follows each finished run
                    toCache.add(null);
                    cacheGenerations.add(++gen);
                }
            }

            try {
                transport.deliver(session.getId(), toSend);
            } catch (IOException ioe) {
                log.warn("Error delivering {} messages to session {}: {}",
                         toSend.size(), session.getId(), ioe.toString());
                return 0;
            }

            for (int i = 0; i < toCache.size(); i++) {
                OutputMessage m = toCache.get(i);
                int g = cacheGenerations.get(i);
                if (m == null) {
                    cache.removeExpiredSessionEntries(session, g);
                } else {
                    cache.addMessage(m, session, g);
                }
            }
            generation = gen;
            return toSend.size();
        }
    }
}
