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

import io.apigee.rerunner.kernel.msg.MessageCodec;
import io.apigee.rerunner.kernel.msg.OutputMessage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * An immutable copy of the messages of one run, in the form in which a storage backend saves it:
 * a "manifest.properties" file that describes the run, plus one file per message, holding the
 * message's canonical encoding, named "0000.msg", "0001.msg" and so on.
 */
public class RunSnapshot
{
    public static final String MANIFEST = "manifest.properties";

    public static final String RUN_ID = "runId";
    public static final String NAME = "name";
    public static final String FINISHED = "finished";
    public static final String MESSAGE_COUNT = "messageCount";

    private final String runId;
    private final String name;
    private final boolean finished;
    private final List<OutputMessage> messages;

    public RunSnapshot(String runId, String name, List<OutputMessage> messages, boolean finished)
    {
        this.runId = runId;
        this.name = name;
        this.finished = finished;
        this.messages = Collections.unmodifiableList(new ArrayList<OutputMessage>(messages));
    }

    public String getRunId() {
        return runId;
    }

    public String getName() {
        return name;
    }

    /**
     * False if the run was still going when the snapshot was taken.
     */
    public boolean isFinished() {
        return finished;
    }

    public List<OutputMessage> getMessages() {
        return messages;
    }

    public static String messageFileName(int index)
    {
        return String.format("%04d.msg", index);
    }

    /**
     * Produce the files that make up this run, in the order in which they should be written.
     */
    public Map<String, ByteBuffer> toFiles()
        throws IOException
    {
        LinkedHashMap<String, ByteBuffer> files = new LinkedHashMap<String, ByteBuffer>();

        Properties manifest = new Properties();
        manifest.setProperty(RUN_ID, runId);
        manifest.setProperty(NAME, name);
        manifest.setProperty(FINISHED, String.valueOf(finished));
        manifest.setProperty(MESSAGE_COUNT, String.valueOf(messages.size()));
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        manifest.store(bos, "Saved run " + runId);
        files.put(MANIFEST, ByteBuffer.wrap(bos.toByteArray()));

        int i = 0;
        for (OutputMessage msg : messages) {
            files.put(messageFileName(i), MessageCodec.encode(msg, true));
            i++;
        }
        return files;
    }
}
