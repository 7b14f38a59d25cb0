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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Map;

/**
 * Saves runs to a local directory. Each run goes in its own subdirectory, named after the run id.
 */
public class FileStorage
    implements StorageBackend
{
    private static final Logger log = LoggerFactory.getLogger(FileStorage.class);

    private final File root;

    public FileStorage(File root)
    {
        this.root = root.getAbsoluteFile();
    }

    public File getRoot() {
        return root;
    }

    @Override
    public String saveRunFiles(String runId, Map<String, ByteBuffer> files)
        throws IOException
    {
        checkName(runId);
        File dir = new File(root, runId);
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("Cannot create directory " + dir);
        }

        for (Map.Entry<String, ByteBuffer> e : files.entrySet()) {
            checkName(e.getKey());
            File f = new File(dir, e.getKey());
            FileOutputStream out = new FileOutputStream(f);
            try {
                FileChannel chan = out.getChannel();
                ByteBuffer buf = e.getValue().duplicate();
                while (buf.hasRemaining()) {
                    chan.write(buf);
                }
            } finally {
                out.close();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Saved {} files for run {} to {}", files.size(), runId, dir);
        }
        return dir.toURI().toString();
    }

    private static void checkName(String name)
        throws IOException
    {
        if ((name == null) || name.isEmpty() || name.startsWith(".") ||
            (name.indexOf('/') >= 0) || (name.indexOf('\\') >= 0)) {
            throw new IOException("Invalid file name \"" + name + '\"');
        }
    }
}
