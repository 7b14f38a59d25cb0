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
package io.apigee.rerunner.kernel.cache;

import io.apigee.rerunner.kernel.msg.OutputMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * A cache of output messages, keyed by content hash. For each message the cache remembers which
 * sessions were sent the message and at which run generation of that session. The delivery layer
 * uses this to send a reference instead of a large message that the viewer already holds.
 * <p>
 * A session's reference to a message expires once the session has run more than "maxAge"
 * generations since it last saw the message, and a message is evicted once no session refers to it.
 * Sessions are held weakly, so a session that goes away without expiring its entries does not
 * keep them alive forever. The cache may be used by many sessions at once and is thread-safe.
 * </p>
 *
 * @param <S> the type of the session object. Sessions are compared by identity unless they
 *            override equals.
 */
public class OutputMessageCache<S>
{
    private static final Logger log = LoggerFactory.getLogger(OutputMessageCache.class);

    private final int maxAge;
    private final HashMap<String, Entry<S>> entries = new HashMap<String, Entry<S>>();

    public OutputMessageCache(int maxAge)
    {
        if (maxAge < 0) {
            throw new IllegalArgumentException("maxAge must not be negative");
        }
        this.maxAge = maxAge;
    }

    public int getMaxAge() {
        return maxAge;
    }

    /**
     * Add a message to the cache and record that "session" was sent it at "generation".
     * Adding the same message again for the same session just refreshes the generation.
     */
    public synchronized void addMessage(OutputMessage msg, S session, int generation)
    {
        String hash = msg.getHash();
        Entry<S> entry = entries.get(hash);
        if (entry == null) {
            entry = new Entry<S>(msg);
            entries.put(hash, entry);
        }
        entry.addSessionRef(session, generation);
    }

    /**
     * Return the message with the given hash, or null if it is not (or no longer) cached.
     */
    public synchronized OutputMessage getMessage(String hash)
    {
        Entry<S> entry = entries.get(hash);
        return (entry == null ? null : entry.msg);
    }

    /**
     * Return true if "session" was sent "msg" recently enough that it should still have it.
     */
    public synchronized boolean hasMessageReference(OutputMessage msg, S session, int generation)
    {
        Entry<S> entry = entries.get(msg.getHash());
        if ((entry == null) || !entry.hasSessionRef(session)) {
            return false;
        }
        return entry.getSessionRefAge(session, generation) <= maxAge;
    }

    /**
     * Drop every reference that "session" holds which is older than the maximum age, and evict the
     * messages that are left with no references. Called each time the session finishes a run.
     */
    public synchronized void removeExpiredSessionEntries(S session, int generation)
    {
        Iterator<Map.Entry<String, Entry<S>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry<S>> e = it.next();
            Entry<S> entry = e.getValue();
            if (!entry.hasRefs()) {
                // Every session that referred to it was garbage-collected
                it.remove();
                continue;
            }
            if (!entry.hasSessionRef(session)) {
                continue;
            }

            int age = entry.getSessionRefAge(session, generation);
            if (age > maxAge) {
                if (log.isDebugEnabled()) {
                    log.debug("Removing expired entry [session={}, hash={}, age={}]",
                              System.identityHashCode(session), e.getKey(), age);
                }
                entry.removeSessionRef(session);
                if (!entry.hasRefs()) {
                    it.remove();
                }
            }
        }
    }

    public synchronized void clear()
    {
        entries.clear();
    }

    /**
     * Return the number of cached messages.
     */
    public synchronized int size()
    {
        return entries.size();
    }

    /**
     * Return the number of sessions that currently refer to the message with the given hash.
     */
    public synchronized int getReferenceCount(String hash)
    {
        Entry<S> entry = entries.get(hash);
        return (entry == null ? 0 : entry.sessionGenerations.size());
    }

    private static final class Entry<S>
    {
        final OutputMessage msg;
        final WeakHashMap<S, Integer> sessionGenerations = new WeakHashMap<S, Integer>();

        Entry(OutputMessage msg)
        {
            this.msg = msg;
        }

        void addSessionRef(S session, int generation)
        {
            Integer prev = sessionGenerations.get(session);
            int gen = generation;
            if ((prev != null) && (gen < prev)) {
                log.error("New generation ({}) is less than the previous generation ({}) for message {}",
                          gen, prev, msg.getHash());
                gen = prev;
            }
            sessionGenerations.put(session, gen);
        }

        boolean hasSessionRef(S session)
        {
            return sessionGenerations.containsKey(session);
        }

        int getSessionRefAge(S session, int generation)
        {
            return generation - sessionGenerations.get(session);
        }

        void removeSessionRef(S session)
        {
            sessionGenerations.remove(session);
        }

        boolean hasRefs()
        {
            return !sessionGenerations.isEmpty();
        }
    }
}
