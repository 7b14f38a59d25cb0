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
package io.apigee.rerunner.core.internal;

import io.apigee.rerunner.core.OutputSink;
import io.apigee.rerunner.core.ScriptCompileException;
import io.apigee.rerunner.core.ScriptEvent;
import io.apigee.rerunner.core.ScriptEventListener;
import io.apigee.rerunner.core.ScriptRequest;
import io.apigee.rerunner.core.ScriptSource;
import io.apigee.rerunner.kernel.InputState;
import io.apigee.rerunner.kernel.msg.OutputMessage;
import io.apigee.rerunner.kernel.msg.OutputMessages;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextAction;
import org.mozilla.javascript.EcmaError;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.JavaScriptException;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Script;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the script of one session, over and over, on a single worker thread. Control requests
 * are taken from the session's queue in order. While the script is executing, the queue is
 * also checked at every checkpoint, so that a STOP or a RERUN takes effect without waiting for
 * the script to finish.
 * <p>
 * A controller runs until it finds its queue empty or receives a SHUTDOWN, and then delivers
 * exactly one SHUTDOWN event. It may not be restarted after that.
 */
public class ScriptController
    implements Runnable
{
    /** The Rhino thread-local key under which the running controller is stored. */
    public static final String CONTROLLER = "_rerunnerController";

    private static final Logger log = LoggerFactory.getLogger(ScriptController.class);

    private final String name;
    private final ScriptSource source;
    private final RhinoContextFactory contextFactory;
    private final ExecutorService pool;
    private final ScriptRequestQueue queue;
    private final ScriptEventListener listener;
    private final OutputSink sink;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean terminated;
    private volatile Thread worker;
    private volatile InputState inputState;
    private volatile int runCount;

    // Only touched by the worker thread
    private boolean executing;
    // Set once a signal is on its way out, so that the unwind takes no further requests
    private boolean signalled;
    private boolean shutdownRequested;
    private int deltaCount;

    public ScriptController(String name, ScriptSource source, RhinoContextFactory contextFactory,
                            ExecutorService pool, ScriptRequestQueue queue, InputState initialState,
                            ScriptEventListener listener, OutputSink sink)
    {
        this.name = name;
        this.source = source;
        this.contextFactory = contextFactory;
        this.pool = pool;
        this.queue = queue;
        this.inputState = (initialState == null ? InputState.EMPTY : initialState);
        this.listener = listener;
        this.sink = sink;
    }

    /**
     * Start processing requests on a thread from the pool.
     *
     * @throws IllegalStateException if the controller was already started
     */
    public void start()
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Script controller " + name + " was already started");
        }
        pool.execute(this);
    }

    /**
     * Add a control request. This may be called from any thread.
     *
     * @param state the new input state for a RERUN, or null to keep the current one
     * @throws IllegalStateException if the controller has already shut down
     */
    public void enqueue(ScriptRequest request, InputState state)
    {
        if (terminated) {
            throw new IllegalStateException("Script controller " + name + " has shut down");
        }
        queue.enqueue(request, state);
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Return the input state that the script currently sees.
     */
    public InputState getInputState() {
        return inputState;
    }

    /**
     * Return the number of times that a script run started on this controller.
     */
    public int getRunCount() {
        return runCount;
    }

    /**
     * A checkpoint. If the script is executing on the calling thread and a request is waiting,
     * take the request and throw the signal that carries it out. Otherwise do nothing.
     */
    public void requestInterruptCheck()
    {
        if ((Thread.currentThread() != worker) || !executing || signalled) {
            return;
        }
        ScriptRequestQueue.Request r = queue.dequeue();
        if (r == null) {
            return;
        }
        signalled = true;
        if (log.isDebugEnabled()) {
            log.debug("{}: interrupting script for {}", name, r);
        }
        switch (r.getType()) {
        case STOP:
            throw new StopSignal();
        case SHUTDOWN:
            shutdownRequested = true;
            throw new StopSignal();
        case RERUN:
            throw new RerunSignal(r.getState());
        default:
            throw new AssertionError("Unknown request " + r.getType());
        }
    }

    /**
     * Send one element of output on behalf of the running script. This is also a checkpoint.
     */
    public void emitElement(String element, String content)
    {
        requestInterruptCheck();
        sink.enqueueOutput(OutputMessages.element(element, content, deltaCount++));
    }

    @Override
    public void run()
    {
        worker = Thread.currentThread();
        String oldName = worker.getName();
        try {
            worker.setName("Rerunner: " + name);
        } catch (SecurityException ignore) {
        }

        try {
            contextFactory.call(new ContextAction<Object>() {
                @Override
                public Object run(Context cx)
                {
                    cx.putThreadLocal(CONTROLLER, ScriptController.this);
                    try {
                        runLoop(cx);
                    } finally {
                        cx.removeThreadLocal(CONTROLLER);
                    }
                    return null;
                }
            });
        } catch (RuntimeException re) {
            log.error("Script controller {} failed: {}", name, re, re);
        } finally {
            terminated = true;
            try {
                worker.setName(oldName);
            } catch (SecurityException ignore) {
            }
            if (log.isDebugEnabled()) {
                log.debug("{}: shutting down after {} runs", name, runCount);
            }
            fireEvent(ScriptEvent.shutdown(inputState));
        }
    }

    private void runLoop(Context cx)
    {
        while (!shutdownRequested) {
            ScriptRequestQueue.Request r = queue.dequeue();
            if (r == null) {
                break;
            }
            switch (r.getType()) {
            case STOP:
                log.debug("{}: ignoring STOP because no script is running", name);
                break;
            case SHUTDOWN:
                shutdownRequested = true;
                break;
            case RERUN:
                runScript(cx, r.getState());
                break;
            default:
                throw new AssertionError("Unknown request " + r.getType());
            }
        }
    }

    /**
     * Run the script, and keep running it for as long as runs are interrupted by new RERUN
     * requests.
     */
    private void runScript(Context cx, InputState newState)
    {
        RerunSignal rerun = runOnce(cx, newState);
        while ((rerun != null) && !shutdownRequested) {
            rerun = runOnce(cx, rerun.getState());
        }
    }

    private RerunSignal runOnce(Context cx, InputState newState)
    {
        if (executing) {
            throw new IllegalStateException("Script " + name + " is already executing");
        }
        deltaCount = 0;
        runCount++;
        fireEvent(ScriptEvent.started());

        Script compiled;
        try {
            compiled = compile(cx);
        } catch (ScriptCompileException sce) {
            if (log.isDebugEnabled()) {
                log.debug("{}: compile error: {}", name, sce.getMessage());
            }
            fireEvent(ScriptEvent.stoppedWithCompileError(sce));
            return null;
        }

        if (newState != null) {
            inputState = newState;
        }

        RerunSignal rerun = null;
        Throwable failure = null;
        signalled = false;
        executing = true;
        try {
            // A fresh global scope for every run, so nothing leaks from the previous one
            ScriptableObject scope = cx.initStandardObjects();
            ScriptApi.install(cx, scope);
            compiled.exec(cx, scope);
        } catch (RerunSignal rs) {
            rerun = rs;
        } catch (StopSignal ss) {
            log.debug("{}: script stopped", name);
        } catch (StackOverflowError soe) {
            failure = soe;
        } catch (Exception e) {
            failure = e;
        } finally {
            executing = false;
            signalled = false;
        }

        if (failure != null) {
            if (log.isDebugEnabled()) {
                log.debug("{}: script failed: {}", name, failure);
            }
            sink.enqueueOutput(exceptionMessage(failure));
        }

        inputState = inputState.withTriggersReset();
        fireEvent(ScriptEvent.stoppedWithSuccess());
        return rerun;
    }

    private Script compile(Context cx)
        throws ScriptCompileException
    {
        String text;
        try {
            text = source.load();
        } catch (IOException ioe) {
            throw ScriptCompileException.fromLoadError(source.getName(), ioe);
        }
        try {
            return cx.compileString(text, source.getName(), 1, null);
        } catch (EvaluatorException ee) {
            throw ScriptCompileException.fromParseError(ee);
        }
    }

    private OutputMessage exceptionMessage(Throwable t)
    {
        if (t instanceof EcmaError) {
            EcmaError ee = (EcmaError)t;
            return OutputMessages.exception(ee.getName(), ee.getErrorMessage(),
                                            ee.getScriptStackTrace(), deltaCount++);
        }
        if (t instanceof JavaScriptException) {
            JavaScriptException je = (JavaScriptException)t;
            String type = "Error";
            String msg = je.details();
            if (je.getValue() instanceof Scriptable) {
                Scriptable err = (Scriptable)je.getValue();
                Object n = ScriptableObject.getProperty(err, "name");
                Object m = ScriptableObject.getProperty(err, "message");
                if (n instanceof CharSequence) {
                    type = n.toString();
                }
                if (m instanceof CharSequence) {
                    msg = m.toString();
                }
            }
            return OutputMessages.exception(type, msg, je.getScriptStackTrace(), deltaCount++);
        }
        if (t instanceof RhinoException) {
            RhinoException re = (RhinoException)t;
            return OutputMessages.exception(t.getClass().getSimpleName(), re.details(),
                                            re.getScriptStackTrace(), deltaCount++);
        }
        return OutputMessages.exception(t, deltaCount++);
    }

    private void fireEvent(ScriptEvent event)
    {
        if (log.isDebugEnabled()) {
            log.debug("{}: {}", name, event);
        }
        try {
            listener.onScriptEvent(event);
        } catch (RuntimeException re) {
            log.warn("Script event listener failed on {}: {}", event, re, re);
        }
    }
}
