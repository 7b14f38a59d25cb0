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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;

/**
 * Watches a script file and calls back when its content changes. Editors often touch a file
 * several times for one save, so the callback only runs when the MD5 of the content is
 * different from the last one seen.
 */
public class SourceWatcher
    implements Runnable
{
    private static final Logger log = LoggerFactory.getLogger(SourceWatcher.class);

    private final File file;
    private final Runnable onChange;
    private WatchService watcher;
    private byte[] lastDigest;

    public SourceWatcher(File file, Runnable onChange)
    {
        this.file = file.getAbsoluteFile();
        this.onChange = onChange;
    }

    /**
     * Start watching, using a thread from the specified pool for as long as the watch lasts.
     */
    public synchronized void start(ExecutorService pool)
        throws IOException
    {
        if (watcher != null) {
            throw new IllegalStateException("Already watching " + file);
        }
        lastDigest = digest();
        watcher = FileSystems.getDefault().newWatchService();
        file.getParentFile().toPath().register(watcher,
                                               StandardWatchEventKinds.ENTRY_CREATE,
                                               StandardWatchEventKinds.ENTRY_MODIFY);
        pool.execute(this);
    }

    public synchronized void stop()
    {
        if (watcher == null) {
            return;
        }
        try {
            watcher.close();
        } catch (IOException ioe) {
            log.debug("Error closing watch service for {}: {}", file, ioe);
        }
    }

    @Override
    public void run()
    {
        WatchService ws;
        synchronized (this) {
            ws = watcher;
        }
        Path name = file.toPath().getFileName();
        try {
            while (true) {
                WatchKey key = ws.take();
                boolean touched = false;
                for (WatchEvent<?> ev : key.pollEvents()) {
                    if (name.equals(ev.context())) {
                        touched = true;
                    }
                }
                key.reset();
                if (touched && contentChanged()) {
                    if (log.isDebugEnabled()) {
                        log.debug("Script {} changed", file);
                    }
                    try {
                        onChange.run();
                    } catch (RuntimeException re) {
                        log.warn("Error handling change to {}: {}", file, re.toString());
                    }
                }
            }
        } catch (ClosedWatchServiceException cwe) {
            log.debug("Stopped watching {}", file);
        } catch (InterruptedException ie) {
            log.debug("Interrupted while watching {}", file);
            Thread.currentThread().interrupt();
        }
    }

    private boolean contentChanged()
    {
        byte[] d = digest();
        if ((d == null) || Arrays.equals(d, lastDigest)) {
            return false;
        }
        lastDigest = d;
        return true;
    }

    private byte[] digest()
    {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return md.digest(Files.readAllBytes(file.toPath()));
        } catch (IOException ioe) {
            // Probably in the middle of being replaced
            log.debug("Cannot read {}: {}", file, ioe);
            return null;
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(e);
        }
    }
}
