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
package io.apigee.rerunner.core.test;

import io.apigee.rerunner.core.DeliveryTransport;
import io.apigee.rerunner.core.OutputDispatcher;
import io.apigee.rerunner.core.RerunEnvironment;
import io.apigee.rerunner.core.ScriptEvent;
import io.apigee.rerunner.core.ScriptEventListener;
import io.apigee.rerunner.core.SessionCoordinator;
import io.apigee.rerunner.core.SessionState;
import io.apigee.rerunner.core.StringScriptSource;
import io.apigee.rerunner.kernel.InputState;
import io.apigee.rerunner.kernel.msg.MessageKind;
import io.apigee.rerunner.kernel.msg.OutputMessage;
import io.apigee.rerunner.kernel.msg.OutputMessages;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class OutputDispatcherTest
{
    private static final long TIMEOUT_SECS = 10L;

    // Writes a 5000-character string, which is over the cache threshold, unless "big" is false
    private static final String SCRIPT =
        "if (st.input('big', true)) {\n" +
        "  st.write(new Array(5001).join('x'));\n" +
        "} else {\n" +
        "  st.write('small');\n" +
        "}";

    private static final InputState BIG = InputState.builder().put("big", true).build();
    private static final InputState SMALL = InputState.builder().put("big", false).build();

    private RerunEnvironment env;
    private OutputDispatcher dispatcher;
    private LinkedBlockingQueue<ScriptEvent> events;

    @Before
    public void setUp()
    {
        env = new RerunEnvironment()
            .setMaxCachedMessageAge(1)
            .setMinCachedMessageSize(1000);
        dispatcher = env.createDispatcher();
        events = new LinkedBlockingQueue<ScriptEvent>();
    }

    @After
    public void tearDown()
    {
        dispatcher.stop();
        env.close();
    }

    private SessionCoordinator createSession(DeliveryTransport transport)
    {
        SessionCoordinator s = env.createSession(new StringScriptSource("big.js", SCRIPT));
        s.setEventListener(new ScriptEventListener() {
            @Override
            public void onScriptEvent(ScriptEvent event)
            {
                if (event.getType() == ScriptEvent.Type.SHUTDOWN) {
                    events.add(event);
                }
            }
        });
        dispatcher.addSession(s, transport);
        return s;
    }

    private void run(SessionCoordinator s, InputState state)
        throws InterruptedException
    {
        s.requestRerun(state);
        assertNotNull("Timed out waiting for the run", events.poll(TIMEOUT_SECS, TimeUnit.SECONDS));
    }

    private static OutputMessage findDelta(List<OutputMessage> msgs)
    {
        for (OutputMessage m : msgs) {
            if ((m.getKind() == MessageKind.DELTA) || (m.getKind() == MessageKind.REFERENCE)) {
                return m;
            }
        }
        return null;
    }

    @Test
    public void testReferenceWithinMaxAge()
        throws InterruptedException
    {
        RecordingTransport t = new RecordingTransport();
        SessionCoordinator s = createSession(t);
        assertEquals(0, dispatcher.getRunGeneration(s));

        run(s, BIG);
        assertTrue(dispatcher.flushSession(s) > 0);
        OutputMessage first = findDelta(t.next());
        assertEquals(MessageKind.DELTA, first.getKind());
        assertTrue(first.getMetadata().isCacheable());
        assertEquals(1, dispatcher.getRunGeneration(s));
        assertEquals(1, dispatcher.getCache().size());

        run(s, BIG);
        dispatcher.flushSession(s);
        OutputMessage second = findDelta(t.next());
        assertEquals(MessageKind.REFERENCE, second.getKind());
        assertEquals(first.getHash(), second.getAttribute(OutputMessage.REF_HASH));
        assertEquals(0, second.getMetadata().getDeltaId());
        assertEquals(2, dispatcher.getRunGeneration(s));

        OutputMessage cached = dispatcher.getCachedMessage(first.getHash());
        assertNotNull(cached);
        assertEquals(5000, cached.getBodyLength());
    }

    @Test
    public void testFullPayloadAfterExpiry()
        throws InterruptedException
    {
        RecordingTransport t = new RecordingTransport();
        SessionCoordinator s = createSession(t);

        run(s, BIG);
        dispatcher.flushSession(s);
        String hash = findDelta(t.next()).getHash();

        // One run without the message takes the session past the maximum age
        run(s, SMALL);
        dispatcher.flushSession(s);
        OutputMessage small = findDelta(t.next());
        assertEquals(MessageKind.DELTA, small.getKind());
        assertFalse(small.getMetadata().isCacheable());
        assertEquals(2, dispatcher.getRunGeneration(s));
        assertNull(dispatcher.getCachedMessage(hash));
        assertEquals(0, dispatcher.getCache().size());

        run(s, BIG);
        dispatcher.flushSession(s);
        OutputMessage again = findDelta(t.next());
        assertEquals(MessageKind.DELTA, again.getKind());
        assertEquals(hash, again.getHash());
    }

    @Test
    public void testSessionsShareEntries()
        throws InterruptedException
    {
        RecordingTransport t1 = new RecordingTransport();
        RecordingTransport t2 = new RecordingTransport();
        SessionCoordinator s1 = createSession(t1);
        SessionCoordinator s2 = createSession(t2);

        run(s1, BIG);
        run(s2, BIG);
        dispatcher.flushAll();

        OutputMessage m1 = findDelta(t1.next());
        OutputMessage m2 = findDelta(t2.next());
        // Each session gets the full message the first time
        assertEquals(MessageKind.DELTA, m1.getKind());
        assertEquals(MessageKind.DELTA, m2.getKind());
        assertEquals(1, dispatcher.getCache().size());
        assertEquals(2, dispatcher.getCache().getReferenceCount(m1.getHash()));
    }

    @Test
    public void testInitializeNotCached()
        throws InterruptedException
    {
        RecordingTransport t = new RecordingTransport();
        SessionCoordinator s = createSession(t);
        run(s, BIG);
        dispatcher.flushSession(s);
        List<OutputMessage> msgs = t.next();
        assertEquals(MessageKind.INITIALIZE, msgs.get(0).getKind());
        assertFalse(msgs.get(0).getMetadata().isCacheable());
    }

    @Test
    public void testTransportFailure()
        throws InterruptedException
    {
        final RecordingTransport t = new RecordingTransport();
        final AtomicBoolean fail = new AtomicBoolean(true);
        SessionCoordinator s = createSession(new DeliveryTransport() {
            @Override
            public void deliver(String sessionId, List<OutputMessage> msgs)
                throws IOException
            {
                if (fail.getAndSet(false)) {
                    throw new IOException("Viewer went away");
                }
                t.deliver(sessionId, msgs);
            }
        });
        run(s, BIG);
        assertEquals(0, dispatcher.flushSession(s));
        // Nothing reached the viewer, so nothing is recorded for it
        assertEquals(0, dispatcher.getCache().size());
        assertEquals(0, dispatcher.getRunGeneration(s));

        run(s, BIG);
        assertTrue(dispatcher.flushSession(s) > 0);
        OutputMessage m = findDelta(t.next());
        assertEquals(MessageKind.DELTA, m.getKind());
        assertEquals(5000, m.getBodyLength());
        assertEquals(1, dispatcher.getCache().size());
        assertEquals(1, dispatcher.getRunGeneration(s));
    }

    @Test
    public void testRemoveSession()
        throws InterruptedException
    {
        SessionCoordinator s = createSession(new RecordingTransport());
        dispatcher.removeSession(s);
        assertEquals(SessionState.SHUTDOWN_REQUESTED, s.getState());
        assertEquals(-1, dispatcher.getRunGeneration(s));
        assertEquals(0, dispatcher.flushSession(s));
    }

    @Test
    public void testScheduledFlush()
        throws InterruptedException
    {
        RecordingTransport t = new RecordingTransport();
        SessionCoordinator s = createSession(t);
        dispatcher.start(20L, TimeUnit.MILLISECONDS);
        s.requestRerun(BIG);

        // The flusher may deliver the run in more than one batch
        ArrayList<OutputMessage> all = new ArrayList<OutputMessage>();
        while ((all.isEmpty()) || (all.get(all.size() - 1).getKind() != MessageKind.SESSION_STATE_CHANGED) ||
               "true".equals(all.get(all.size() - 1).getAttribute(OutputMessages.RUNNING))) {
            all.addAll(t.next());
        }
        assertNotNull(findDelta(all));
    }

    private static final class RecordingTransport
        implements DeliveryTransport
    {
        private final LinkedBlockingQueue<List<OutputMessage>> batches =
            new LinkedBlockingQueue<List<OutputMessage>>();

        @Override
        public void deliver(String sessionId, List<OutputMessage> msgs)
        {
            batches.add(msgs);
        }

        List<OutputMessage> next()
            throws InterruptedException
        {
            List<OutputMessage> b = batches.poll(TIMEOUT_SECS, TimeUnit.SECONDS);
            assertNotNull("Timed out waiting for delivery", b);
            return b;
        }
    }
}
