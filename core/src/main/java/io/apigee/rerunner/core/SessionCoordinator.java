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

import io.apigee.rerunner.core.internal.RunSnapshot;
import io.apigee.rerunner.core.internal.ScriptController;
import io.apigee.rerunner.core.internal.ScriptRequestQueue;
import io.apigee.rerunner.core.internal.SourceWatcher;
import io.apigee.rerunner.kernel.InputState;
import io.apigee.rerunner.kernel.msg.FinishedStatus;
import io.apigee.rerunner.kernel.msg.OutputMessage;
import io.apigee.rerunner.kernel.msg.OutputMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * One viewer's session. It turns the viewer's actions into control requests for a script
 * controller, which it creates as needed, and turns the controller's events and output into the
 * queue of messages that go back to the viewer.
 * <p>
 * All state is guarded by this object's monitor. Script events arrive on the controller's
 * worker thread.
 */
public class SessionCoordinator
    implements OutputSink
{
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private final String id = UUID.randomUUID().toString();
    private final RerunEnvironment env;
    private final ScriptSource source;
    private final ScriptRequestQueue requests = new ScriptRequestQueue();
    private final boolean displayEnabled;
    private final boolean liveSave;

    private final ArrayList<OutputMessage> outbound = new ArrayList<OutputMessage>();
    private final ArrayList<OutputMessage> currentRun = new ArrayList<OutputMessage>();
    private String currentRunId;

    private SessionState state = SessionState.NOT_RUNNING;
    private InputState inputState = InputState.EMPTY;
    private boolean runOnSave;
    private boolean initializeSent;
    private boolean preheated;
    private InputState preheatState;
    private ScriptController controller;
    private SourceWatcher watcher;
    private ScriptEventListener eventListener;

    SessionCoordinator(RerunEnvironment env, ScriptSource source)
    {
        this.env = env;
        this.source = source;
        this.displayEnabled = env.isDisplayEnabled();
        this.liveSave = env.isLiveSave();
        this.runOnSave = env.isRunOnSave();

        if (source.getFile() != null) {
            watcher = new SourceWatcher(source.getFile(), new Runnable() {
                @Override
                public void run()
                {
                    onSourceChanged();
                }
            });
            try {
                watcher.start(env.getScriptPool());
            } catch (IOException ioe) {
                log.warn("Cannot watch {} for changes: {}", source.getFile(), ioe.toString());
                watcher = null;
            }
        }
    }

    public String getId() {
        return id;
    }

    public ScriptSource getSource() {
        return source;
    }

    public synchronized SessionState getState() {
        return state;
    }

    /**
     * The input state that the last run finished with, which is the one that the next rerun
     * starts from unless it brings its own.
     */
    public synchronized InputState getInputState() {
        return inputState;
    }

    public synchronized boolean isRunOnSave() {
        return runOnSave;
    }

    /**
     * Register a listener that sees every script event after this session has handled it.
     */
    public synchronized void setEventListener(ScriptEventListener l) {
        this.eventListener = l;
    }

    /**
     * Run the script again, or as soon as the current run is stopped.
     *
     * @param newState the input state to run with, or null to keep the current one
     */
    public synchronized void requestRerun(InputState newState)
    {
        enqueueRequest(ScriptRequest.RERUN, newState);
    }

    /**
     * Handle a rerun request from a viewer. A "preheat" request is sent before any viewer
     * connects, so that the script has already run by the time one does. The first real request
     * after that is skipped if it would only repeat the preheated run.
     */
    public synchronized void handleRerunRequest(InputState newState, boolean preheat)
    {
        if (preheat) {
            preheated = true;
            preheatState = (newState == null ? inputState : newState);
        } else if (preheated) {
            preheated = false;
            if ((newState == null) || newState.isEmpty() || newState.equals(preheatState)) {
                log.debug("Session {}: skipping rerun that repeats the preheated run", id);
                return;
            }
        }
        requestRerun(newState);
    }

    public synchronized void requestStop()
    {
        enqueueRequest(ScriptRequest.STOP, null);
    }

    /**
     * Stop the script, if it is running, and stop processing requests for good. The controller
     * shuts down asynchronously.
     */
    public synchronized void shutdown()
    {
        if (state == SessionState.SHUTDOWN_REQUESTED) {
            return;
        }
        if (controller != null) {
            requests.enqueue(ScriptRequest.SHUTDOWN, null);
        }
        state = SessionState.SHUTDOWN_REQUESTED;
        if (watcher != null) {
            watcher.stop();
            watcher = null;
        }
        log.debug("Session {} shutting down", id);
    }

    /**
     * Add a message for the viewer. If the script is running on the calling thread then this is
     * also a checkpoint, so it may throw the signal that stops the script.
     */
    @Override
    public synchronized void enqueueOutput(OutputMessage msg)
    {
        if (!displayEnabled) {
            return;
        }
        if (controller != null) {
            controller.requestInterruptCheck();
        }
        outbound.add(msg);
        currentRun.add(msg);
    }

    /**
     * Show an error that happened outside of a script run, such as one that prevented a run from
     * being started. The viewer is made to clear its output first.
     */
    public synchronized void enqueueException(Throwable t)
    {
        handleEvent(ScriptEvent.stoppedWithSuccess());
        handleEvent(ScriptEvent.started());
        handleEvent(ScriptEvent.stoppedWithSuccess());
        enqueueOutput(OutputMessages.exception(t, 0));
    }

    /**
     * Remove and return all the messages waiting to be sent to the viewer.
     */
    public synchronized List<OutputMessage> flushOutboundQueue()
    {
        ArrayList<OutputMessage> msgs = new ArrayList<OutputMessage>(outbound);
        outbound.clear();
        return msgs;
    }

    public synchronized void setRunOnSave(boolean runOnSave)
    {
        this.runOnSave = runOnSave;
        enqueueOutput(OutputMessages.sessionStateChanged(state == SessionState.RUNNING, runOnSave));
    }

    /**
     * Called when the script's source has changed.
     */
    public synchronized void onSourceChanged()
    {
        if (state == SessionState.SHUTDOWN_REQUESTED) {
            return;
        }
        if (runOnSave) {
            requestRerun(null);
        } else {
            enqueueOutput(OutputMessages.scriptChangedOnDisk());
        }
    }

    /**
     * Save the output of the current or last run to the storage backend in the background.
     *
     * @return the location of the saved run, once it is saved
     * @throws IllegalStateException if there is no storage backend, or nothing has run yet
     */
    public synchronized Future<String> saveRun()
    {
        if (env.getStorage() == null) {
            throw new IllegalStateException("No storage backend is configured");
        }
        if (currentRunId == null) {
            throw new IllegalStateException("Nothing has run yet");
        }
        return submitSave(state != SessionState.RUNNING);
    }

    private Future<String> submitSave(boolean finished)
    {
        final StorageBackend storage = env.getStorage();
        final RunSnapshot snap = new RunSnapshot(currentRunId, source.getName(), currentRun, finished);
        return env.getAsyncPool().submit(new Callable<String>() {
            @Override
            public String call()
                throws IOException
            {
                try {
                    String location = storage.saveRunFiles(snap.getRunId(), snap.toFiles());
                    if (log.isDebugEnabled()) {
                        log.debug("Saved run {} to {}", snap.getRunId(), location);
                    }
                    return location;
                } catch (IOException ioe) {
                    log.warn("Error saving run {}: {}", snap.getRunId(), ioe.toString());
                    throw ioe;
                }
            }
        });
    }

    private void liveSave(boolean finished)
    {
        if (!liveSave || (env.getStorage() == null)) {
            return;
        }
        try {
            submitSave(finished);
        } catch (RuntimeException re) {
            // A full async pool rejects the task
            log.warn("Cannot save run {}: {}", currentRunId, re.toString());
        }
    }

    private void enqueueRequest(ScriptRequest type, InputState newState)
    {
        if (state == SessionState.SHUTDOWN_REQUESTED) {
            log.warn("Discarding {} request for session {} after shutdown", type, id);
            return;
        }
        requests.enqueue(type, newState);
        if (controller == null) {
            createController();
        }
    }

    private void createController()
    {
        controller = new ScriptController(source.getName(), source, env.getContextFactory(),
                                          env.getScriptPool(), requests, inputState,
                                          new EventHandler(), this);
        controller.start();
    }

    private void maybeEnqueueInitialize()
    {
        if (initializeSent) {
            return;
        }
        enqueueOutput(OutputMessages.initialize(id, env.getMaxCachedMessageAge(), runOnSave,
                                                state == SessionState.RUNNING, env.getEngineVersion()));
        initializeSent = true;
    }

    private synchronized void handleEvent(ScriptEvent event)
    {
        SessionState prevState = state;

        switch (event.getType()) {
        case STARTED:
            if (state != SessionState.SHUTDOWN_REQUESTED) {
                state = SessionState.RUNNING;
            }
            outbound.clear();
            currentRun.clear();
            maybeEnqueueInitialize();
            currentRunId = UUID.randomUUID().toString();
            File file = source.getFile();
            enqueueOutput(OutputMessages.newRun(currentRunId, source.getName(),
                                                file == null ? source.getName() : file.getPath()));
            liveSave(false);
            break;

        case STOPPED_WITH_SUCCESS:
        case STOPPED_WITH_COMPILE_ERROR:
            if (state != SessionState.SHUTDOWN_REQUESTED) {
                state = SessionState.NOT_RUNNING;
            }
            if (controller != null) {
                inputState = controller.getInputState();
            }
            boolean success = (event.getType() == ScriptEvent.Type.STOPPED_WITH_SUCCESS);
            enqueueOutput(OutputMessages.runFinished(success ? FinishedStatus.SUCCESS
                                                             : FinishedStatus.COMPILE_ERROR));
            liveSave(true);
            if (!success) {
                enqueueOutput(event.getCompileError().toMessage());
            }
            break;

        case SHUTDOWN:
            inputState = event.getFinalState();
            controller = null;
            if ((state != SessionState.SHUTDOWN_REQUESTED) && requests.hasRequest()) {
                log.debug("Session {}: requests arrived during shutdown, restarting", id);
                createController();
            }
            break;

        default:
            throw new AssertionError("Unknown event " + event.getType());
        }

        boolean wasRunning = (prevState == SessionState.RUNNING);
        boolean isRunning = (state == SessionState.RUNNING);
        if (wasRunning != isRunning) {
            enqueueOutput(OutputMessages.sessionStateChanged(isRunning, runOnSave));
        }

        if (eventListener != null) {
            try {
                eventListener.onScriptEvent(event);
            } catch (RuntimeException re) {
                log.warn("Event listener failed on {}: {}", event, re.toString());
            }
        }
    }

    private final class EventHandler
        implements ScriptEventListener
    {
        @Override
        public void onScriptEvent(ScriptEvent event)
        {
            handleEvent(event);
        }
    }
}
