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

import io.apigee.rerunner.core.OutputSink;
import io.apigee.rerunner.core.ScriptCompileException;
import io.apigee.rerunner.core.ScriptEvent;
import io.apigee.rerunner.core.ScriptEventListener;
import io.apigee.rerunner.core.ScriptRequest;
import io.apigee.rerunner.core.StringScriptSource;
import io.apigee.rerunner.core.internal.RhinoContextFactory;
import io.apigee.rerunner.core.internal.ScriptController;
import io.apigee.rerunner.core.internal.ScriptRequestQueue;
import io.apigee.rerunner.kernel.InputState;
import io.apigee.rerunner.kernel.msg.MessageKind;
import io.apigee.rerunner.kernel.msg.OutputMessage;
import io.apigee.rerunner.kernel.msg.OutputMessages;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class ScriptControllerTest
{
    private static final long TIMEOUT_SECS = 10L;

    private ExecutorService pool;
    private RhinoContextFactory factory;
    private ScriptRequestQueue queue;
    private LinkedBlockingQueue<ScriptEvent> events;
    private Output output;

    @Before
    public void setUp()
    {
        pool = Executors.newCachedThreadPool();
        factory = new RhinoContextFactory();
        factory.setInstructionThreshold(1000);
        queue = new ScriptRequestQueue();
        events = new LinkedBlockingQueue<ScriptEvent>();
        output = new Output();
    }

    @After
    public void tearDown()
    {
        pool.shutdownNow();
    }

    private ScriptController createController(StringScriptSource source)
    {
        return new ScriptController("test", source, factory, pool, queue, InputState.EMPTY,
                                    new ScriptEventListener() {
                                        @Override
                                        public void onScriptEvent(ScriptEvent event)
                                        {
                                            events.add(event);
                                        }
                                    }, output);
    }

    private ScriptController createController(String script)
    {
        return createController(new StringScriptSource("test.js", script));
    }

    private ScriptEvent nextEvent()
        throws InterruptedException
    {
        ScriptEvent e = events.poll(TIMEOUT_SECS, TimeUnit.SECONDS);
        assertNotNull("Timed out waiting for a script event", e);
        return e;
    }

    private void expectEvents(ScriptEvent.Type... types)
        throws InterruptedException
    {
        for (ScriptEvent.Type t : types) {
            assertEquals(t, nextEvent().getType());
        }
    }

    private void waitForTexts(int count)
        throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECS);
        while (output.getTexts().size() < count) {
            assertTrue("Timed out waiting for output", System.currentTimeMillis() < deadline);
            Thread.sleep(10L);
        }
    }

    private static InputState state(String id, double val)
    {
        return InputState.builder().put(id, val).build();
    }

    @Test
    public void testRequestsInOrder()
        throws InterruptedException
    {
        ScriptController c = createController("st.write('v=' + st.input('a', 0));");
        c.enqueue(ScriptRequest.RERUN, state("a", 1));
        c.enqueue(ScriptRequest.STOP, null);
        c.enqueue(ScriptRequest.RERUN, state("a", 2));
        c.start();

        expectEvents(ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        // The STOP is waiting at the first write of run 1, so only run 2 writes anything
        assertEquals(1, output.getTexts().size());
        assertEquals("v=2", output.getTexts().get(0));
        assertEquals(2, c.getRunCount());
    }

    @Test
    public void testStopBeforeStart()
        throws InterruptedException
    {
        ScriptController c = createController("st.write('hello');");
        c.enqueue(ScriptRequest.STOP, null);
        c.start();

        expectEvents(ScriptEvent.Type.SHUTDOWN);
        assertEquals(0, c.getRunCount());
        assertTrue(output.getMessages().isEmpty());
    }

    @Test
    public void testSingleShutdown()
        throws InterruptedException
    {
        ScriptController c = createController("st.write('hello');");
        c.enqueue(ScriptRequest.RERUN, null);
        c.enqueue(ScriptRequest.SHUTDOWN, null);
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        assertNull(events.poll(250L, TimeUnit.MILLISECONDS));
        assertTrue(c.isTerminated());
        // The RERUN after the SHUTDOWN is left for whoever owns the queue
        assertEquals(1, queue.size());

        try {
            c.enqueue(ScriptRequest.RERUN, null);
            assertFalse("Expected an exception after shutdown", true);
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testDoubleStart()
        throws InterruptedException
    {
        ScriptController c = createController("st.write('hello');");
        c.start();
        try {
            c.start();
            assertFalse("Expected an exception on the second start", true);
        } catch (IllegalStateException expected) {
        }
        expectEvents(ScriptEvent.Type.SHUTDOWN);
    }

    @Test
    public void testCompileErrorThenRecovery()
        throws InterruptedException
    {
        StringScriptSource src = new StringScriptSource("broken.js", "st.write('a');\nvar = ;");
        ScriptController c = createController(src);
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        ScriptEvent stopped = nextEvent();
        assertEquals(ScriptEvent.Type.STOPPED_WITH_COMPILE_ERROR, stopped.getType());
        ScriptCompileException err = stopped.getCompileError();
        assertEquals(ScriptCompileException.SYNTAX_ERROR, err.getErrorType());
        assertEquals("broken.js", err.getSourceName());
        assertEquals(2, err.getLine());
        expectEvents(ScriptEvent.Type.SHUTDOWN);
        assertTrue(output.getMessages().isEmpty());

        src.setScript("st.write('fixed');");
        ScriptController c2 = createController(src);
        c2.enqueue(ScriptRequest.RERUN, null);
        c2.start();
        expectEvents(ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        assertEquals("fixed", output.getTexts().get(0));
    }

    @Test
    public void testMissingScript()
        throws InterruptedException
    {
        ScriptController c = createController(new StringScriptSource("missing.js", null));
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        ScriptEvent stopped = nextEvent();
        assertEquals(ScriptEvent.Type.STOPPED_WITH_COMPILE_ERROR, stopped.getType());
        assertEquals(ScriptCompileException.NOT_FOUND, stopped.getCompileError().getErrorType());
        expectEvents(ScriptEvent.Type.SHUTDOWN);
    }

    @Test
    public void testRuntimeErrorBecomesOutput()
        throws InterruptedException
    {
        ScriptController c = createController("st.write('before');\nvar x = null;\nx.foo;");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        List<OutputMessage> msgs = output.getMessages();
        assertEquals(2, msgs.size());
        assertEquals("before", msgs.get(0).getBodyString());
        OutputMessage ex = msgs.get(1);
        assertEquals(OutputMessages.ELEMENT_EXCEPTION, ex.getAttribute(OutputMessages.ELEMENT));
        assertEquals("TypeError", ex.getAttribute(OutputMessages.ERROR_TYPE));
        assertEquals(1, ex.getMetadata().getDeltaId());
    }

    @Test
    public void testThrownErrorBecomesOutput()
        throws InterruptedException
    {
        ScriptController c = createController("throw new RangeError('out of range');");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        OutputMessage ex = output.getMessages().get(0);
        assertEquals("RangeError", ex.getAttribute(OutputMessages.ERROR_TYPE));
        assertEquals("out of range", ex.getAttribute(OutputMessages.ERROR_MESSAGE));
    }

    @Test
    public void testStopInterruptsLoop()
        throws InterruptedException
    {
        ScriptController c = createController("st.write('start');\nwhile (true) {}");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        waitForTexts(1);
        c.enqueue(ScriptRequest.STOP, null);
        expectEvents(ScriptEvent.Type.STOPPED_WITH_SUCCESS, ScriptEvent.Type.SHUTDOWN);
        assertEquals(1, output.getTexts().size());
    }

    @Test
    public void testScriptCannotCatchStop()
        throws InterruptedException
    {
        ScriptController c =
            createController("try {\n  while (true) {}\n} catch (e) {\n  st.write('caught');\n}");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        c.enqueue(ScriptRequest.STOP, null);
        expectEvents(ScriptEvent.Type.STOPPED_WITH_SUCCESS, ScriptEvent.Type.SHUTDOWN);
        assertFalse(output.getTexts().contains("caught"));
    }

    @Test
    public void testShutdownDuringRun()
        throws InterruptedException
    {
        ScriptController c = createController("while (true) {}");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        synchronized (queue) {
            c.enqueue(ScriptRequest.SHUTDOWN, null);
            c.enqueue(ScriptRequest.RERUN, null);
        }
        expectEvents(ScriptEvent.Type.STOPPED_WITH_SUCCESS, ScriptEvent.Type.SHUTDOWN);
        assertNull(events.poll(250L, TimeUnit.MILLISECONDS));
        assertEquals(1, c.getRunCount());
        // The stopping run took only the SHUTDOWN
        assertEquals(1, queue.size());
    }

    @Test
    public void testRerunThenStopDuringRun()
        throws InterruptedException
    {
        ScriptController c = createController(
            "var n = st.input('n', 0);\n" +
            "if (n == 0) { while (true) {} }\n" +
            "st.write('n=' + n);");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        synchronized (queue) {
            c.enqueue(ScriptRequest.RERUN, state("n", 1));
            c.enqueue(ScriptRequest.STOP, null);
        }
        // The RERUN restarts the script with its state, then the STOP ends the new run
        expectEvents(ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        assertEquals(2, c.getRunCount());
        assertEquals(1.0, c.getInputState().get("n"));
        assertTrue(output.getTexts().isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    public void testRerunMidExecution()
        throws InterruptedException
    {
        ScriptController c = createController(
            "var n = st.input('n', 0);\n" +
            "st.write('run ' + n);\n" +
            "if (n == 0) { while (true) {} }\n" +
            "st.write('done ' + st.runCount);");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        waitForTexts(1);
        c.enqueue(ScriptRequest.RERUN, state("n", 1));

        // No SHUTDOWN between the two runs
        expectEvents(ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        List<String> texts = output.getTexts();
        assertEquals("run 0", texts.get(0));
        assertEquals("run 1", texts.get(1));
        assertEquals("done 2", texts.get(2));
        assertEquals(1.0, c.getInputState().get("n"));
    }

    @Test
    public void testCheckpointFunction()
        throws InterruptedException
    {
        // With instruction counting off, only output and st.checkpoint() can interrupt
        factory.setInstructionThreshold(0);
        ScriptController c = createController("st.write('start');\nwhile (true) { st.checkpoint(); }");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED);
        c.enqueue(ScriptRequest.STOP, null);
        expectEvents(ScriptEvent.Type.STOPPED_WITH_SUCCESS, ScriptEvent.Type.SHUTDOWN);
    }

    @Test
    public void testTriggersReset()
        throws InterruptedException
    {
        ScriptController c = createController("st.write('clicked=' + st.button('go'));");
        InputState s = InputState.builder().put("name", "x").trigger("go").build();
        c.enqueue(ScriptRequest.RERUN, s);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS);
        ScriptEvent shutdown = nextEvent();
        assertEquals(ScriptEvent.Type.SHUTDOWN, shutdown.getType());
        assertEquals("clicked=true", output.getTexts().get(0));
        assertFalse(shutdown.getFinalState().isTriggered("go"));
        assertEquals("x", shutdown.getFinalState().get("name"));
    }

    @Test
    public void testElements()
        throws InterruptedException
    {
        ScriptController c = createController(
            "st.markdown('# Title');\n" +
            "st.json({a: 1, b: [true, 'x']});\n" +
            "st.error('oops');\n" +
            "st.write('a', 2, true);");
        c.enqueue(ScriptRequest.RERUN, null);
        c.start();

        expectEvents(ScriptEvent.Type.STARTED, ScriptEvent.Type.STOPPED_WITH_SUCCESS,
                     ScriptEvent.Type.SHUTDOWN);
        List<OutputMessage> msgs = output.getMessages();
        assertEquals(4, msgs.size());
        assertEquals(OutputMessages.ELEMENT_MARKDOWN, msgs.get(0).getAttribute(OutputMessages.ELEMENT));
        assertEquals("# Title", msgs.get(0).getBodyString());
        assertEquals(OutputMessages.ELEMENT_JSON, msgs.get(1).getAttribute(OutputMessages.ELEMENT));
        assertEquals("{\"a\":1,\"b\":[true,\"x\"]}", msgs.get(1).getBodyString());
        assertEquals(OutputMessages.ELEMENT_ERROR, msgs.get(2).getAttribute(OutputMessages.ELEMENT));
        assertEquals("a 2 true", msgs.get(3).getBodyString());
        for (int i = 0; i < msgs.size(); i++) {
            assertEquals(MessageKind.DELTA, msgs.get(i).getKind());
            assertEquals(i, msgs.get(i).getMetadata().getDeltaId());
        }
    }

    private static final class Output
        implements OutputSink
    {
        private final ArrayList<OutputMessage> messages = new ArrayList<OutputMessage>();

        @Override
        public synchronized void enqueueOutput(OutputMessage msg)
        {
            messages.add(msg);
        }

        synchronized List<OutputMessage> getMessages()
        {
            return new ArrayList<OutputMessage>(messages);
        }

        synchronized List<String> getTexts()
        {
            ArrayList<String> texts = new ArrayList<String>();
            for (OutputMessage m : messages) {
                if (OutputMessages.ELEMENT_TEXT.equals(m.getAttribute(OutputMessages.ELEMENT))) {
                    texts.add(m.getBodyString());
                }
            }
            return texts;
        }
    }
}
