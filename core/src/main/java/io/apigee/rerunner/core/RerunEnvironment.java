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
import io.apigee.rerunner.core.internal.RhinoContextFactory;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextAction;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.StackStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * This class is the root of all script processing. Typically it will be created once per process.
 * It holds the configuration, the thread pools and the Rhino context factory that every session
 * created from it shares. All the setters must be called before the first session is created in
 * order to have any effect.
 */
public class RerunEnvironment
{
    private static final Logger log = LoggerFactory.getLogger(RerunEnvironment.class);

    public static final int DEFAULT_MAX_CACHED_MESSAGE_AGE = 2;
    public static final int DEFAULT_MIN_CACHED_MESSAGE_SIZE = 10 * 1024;
    public static final int DEFAULT_CHECKPOINT_INSTRUCTIONS = 10000;

    public static final int CORE_POOL_SIZE    = 50;
    public static final int MAX_POOL_SIZE     = 1000;
    public static final int POOL_QUEUE_SIZE   = 8;
    public static final long POOL_TIMEOUT_SECS = 60L;

    private boolean             initialized;
    private final Object        initializationLock = new Object();
    private ExecutorService     asyncPool;
    private boolean             ownAsyncPool;
    private ExecutorService     scriptPool;
    private RhinoContextFactory contextFactory;
    private String              engineVersion;

    private int                 maxCachedMessageAge = DEFAULT_MAX_CACHED_MESSAGE_AGE;
    private int                 minCachedMessageSize = DEFAULT_MIN_CACHED_MESSAGE_SIZE;
    private int                 checkpointInstructions = DEFAULT_CHECKPOINT_INSTRUCTIONS;
    private boolean             runOnSave;
    private boolean             liveSave;
    private boolean             displayEnabled = true;
    private StorageBackend      storage;

    /**
     * Create a session that runs the specified script.
     */
    public SessionCoordinator createSession(ScriptSource source)
    {
        initialize();
        return new SessionCoordinator(this, source);
    }

    /**
     * Create a dispatcher that uses this environment's cache settings.
     */
    public OutputDispatcher createDispatcher()
    {
        return new OutputDispatcher(maxCachedMessageAge, minCachedMessageSize);
    }

    /**
     * Free the thread pools. Shut sessions down before calling this: a script that is still
     * executing only has its thread interrupted, and scripts do not check for interrupts.
     */
    public void close()
    {
        synchronized (initializationLock) {
            if (!initialized) {
                return;
            }
            scriptPool.shutdownNow();
            if (ownAsyncPool) {
                asyncPool.shutdown();
                asyncPool = null;
                ownAsyncPool = false;
            }
            initialized = false;
        }
    }

    /**
     * The number of runs for which a viewer is assumed to still hold a message that it was sent. Default is 2.
     */
    public RerunEnvironment setMaxCachedMessageAge(int age)
    {
        if (age < 0) {
            throw new IllegalArgumentException("maxCachedMessageAge must not be negative");
        }
        this.maxCachedMessageAge = age;
        return this;
    }

    public int getMaxCachedMessageAge() {
        return maxCachedMessageAge;
    }

    /**
     * Messages smaller than this many bytes are always sent in full. Default is 10 KB.
     */
    public RerunEnvironment setMinCachedMessageSize(int size)
    {
        this.minCachedMessageSize = size;
        return this;
    }

    public int getMinCachedMessageSize() {
        return minCachedMessageSize;
    }

    /**
     * Set whether a change to a script file reruns it right away. Sessions start with this value
     * and may change it later.
     */
    public RerunEnvironment setRunOnSave(boolean runOnSave)
    {
        this.runOnSave = runOnSave;
        return this;
    }

    public boolean isRunOnSave() {
        return runOnSave;
    }

    /**
     * Set whether every run is saved to the storage backend as it starts and as it finishes.
     */
    public RerunEnvironment setLiveSave(boolean liveSave)
    {
        this.liveSave = liveSave;
        return this;
    }

    public boolean isLiveSave() {
        return liveSave;
    }

    /**
     * If false, sessions discard all output. Useful when running scripts for their side effects.
     */
    public RerunEnvironment setDisplayEnabled(boolean displayEnabled)
    {
        this.displayEnabled = displayEnabled;
        return this;
    }

    public boolean isDisplayEnabled() {
        return displayEnabled;
    }

    /**
     * Set how many interpreted instructions a script may run between two checks for a STOP or a
     * RERUN. Zero turns the checks off. Default is 10000.
     */
    public RerunEnvironment setCheckpointInstructions(int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("checkpointInstructions must not be negative");
        }
        this.checkpointInstructions = count;
        return this;
    }

    public int getCheckpointInstructions() {
        return checkpointInstructions;
    }

    public RerunEnvironment setStorage(StorageBackend storage)
    {
        this.storage = storage;
        return this;
    }

    public StorageBackend getStorage() {
        return storage;
    }

    /**
     * Use an existing thread pool for background work such as saves, instead of creating one.
     * The pool is not shut down by "close".
     */
    public RerunEnvironment setAsyncPool(ExecutorService pool)
    {
        this.asyncPool = pool;
        return this;
    }

    /**
     * Internal: Get the thread pool for async tasks.
     */
    public ExecutorService getAsyncPool() {
        return asyncPool;
    }

    /**
     * Internal: Get the thread pool for script threads.
     */
    public ExecutorService getScriptPool() {
        return scriptPool;
    }

    /**
     * Internal: Get the Rhino ContextFactory for this environment.
     */
    public RhinoContextFactory getContextFactory() {
        return contextFactory;
    }

    /**
     * The version of the script engine, as reported to viewers.
     */
    public String getEngineVersion() {
        return engineVersion;
    }

    private void initialize()
    {
        synchronized (initializationLock) {
            if (initialized) {
                return;
            }

            try {
                RhinoException.setStackStyle(StackStyle.V8);
            } catch (Throwable t) {
                log.debug("Running on a version of Rhino without V8-style stack traces");
            }

            if (asyncPool == null) {
                // Used for background saves, which must never hold up a script thread
                ThreadPoolExecutor pool =
                    new ThreadPoolExecutor(CORE_POOL_SIZE, MAX_POOL_SIZE, POOL_TIMEOUT_SECS, TimeUnit.SECONDS,
                                           new ArrayBlockingQueue<Runnable>(POOL_QUEUE_SIZE),
                                           new PoolNameFactory("Rerunner Async Pool"),
                                           new ThreadPoolExecutor.AbortPolicy());
                pool.allowCoreThreadTimeOut(true);
                asyncPool = pool;
                ownAsyncPool = true;
            }

            // Script threads live as long as their controller, and source watchers as long as
            // their session, so this pool grows as needed and shrinks to zero when idle.
            scriptPool = Executors.newCachedThreadPool(new PoolNameFactory("Rerunner Script Thread"));

            contextFactory = new RhinoContextFactory();
            contextFactory.setInstructionThreshold(checkpointInstructions);

            engineVersion = contextFactory.call(new ContextAction<String>() {
                @Override
                public String run(Context cx)
                {
                    return cx.getImplementationVersion();
                }
            });
            if (log.isDebugEnabled()) {
                log.debug("Initialized with {}", engineVersion);
            }

            initialized = true;
        }
    }
}
