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
package io.apigee.rerunner.kernel.msg;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Factory methods for the messages that the runtime itself produces: lifecycle markers, session
 * events, and the elements that a script emits.
 */
public class OutputMessages
{
    public static final String SESSION_ID = "sessionId";
    public static final String MAX_CACHED_MESSAGE_AGE = "maxCachedMessageAge";
    public static final String RUN_ON_SAVE = "runOnSave";
    public static final String RUNNING = "running";
    public static final String ENGINE_VERSION = "engineVersion";
    public static final String RUN_ID = "runId";
    public static final String NAME = "name";
    public static final String SCRIPT_PATH = "scriptPath";
    public static final String STATUS = "status";
    public static final String EVENT = "event";
    public static final String ELEMENT = "element";
    public static final String ERROR_TYPE = "type";
    public static final String ERROR_MESSAGE = "message";
    public static final String LINE = "line";
    public static final String COLUMN = "column";

    public static final String EVENT_COMPILE_ERROR = "scriptCompilationException";
    public static final String EVENT_SCRIPT_CHANGED = "scriptChangedOnDisk";

    public static final String ELEMENT_TEXT = "text";
    public static final String ELEMENT_MARKDOWN = "markdown";
    public static final String ELEMENT_ERROR = "error";
    public static final String ELEMENT_JSON = "json";
    public static final String ELEMENT_EXCEPTION = "exception";

    public static OutputMessage initialize(String sessionId, int maxCachedMessageAge,
                                           boolean runOnSave, boolean running,
                                           String engineVersion)
    {
        return OutputMessage.builder(MessageKind.INITIALIZE)
            .attribute(SESSION_ID, sessionId)
            .attribute(MAX_CACHED_MESSAGE_AGE, maxCachedMessageAge)
            .attribute(RUN_ON_SAVE, runOnSave)
            .attribute(RUNNING, running)
            .attribute(ENGINE_VERSION, engineVersion)
            .build();
    }

    public static OutputMessage newRun(String runId, String name, String scriptPath)
    {
        return OutputMessage.builder(MessageKind.NEW_RUN)
            .attribute(RUN_ID, runId)
            .attribute(NAME, name)
            .attribute(SCRIPT_PATH, scriptPath)
            .build();
    }

    public static OutputMessage runFinished(FinishedStatus status)
    {
        return OutputMessage.builder(MessageKind.RUN_FINISHED)
            .attribute(STATUS, status.getCode())
            .build();
    }

    public static OutputMessage sessionStateChanged(boolean running, boolean runOnSave)
    {
        return OutputMessage.builder(MessageKind.SESSION_STATE_CHANGED)
            .attribute(RUNNING, running)
            .attribute(RUN_ON_SAVE, runOnSave)
            .build();
    }

    public static OutputMessage scriptChangedOnDisk()
    {
        return OutputMessage.builder(MessageKind.SESSION_EVENT)
            .attribute(EVENT, EVENT_SCRIPT_CHANGED)
            .build();
    }

    /**
     * A compile error is reported as a session event and not as part of the run, so that the
     * viewer keeps showing the output of the previous run.
     *
     * @param line the line of the error, or zero if not known
     * @param column the column of the error, or zero if not known
     */
    public static OutputMessage compileError(String type, String message, int line, int column)
    {
        OutputMessage.Builder b = OutputMessage.builder(MessageKind.SESSION_EVENT)
            .attribute(EVENT, EVENT_COMPILE_ERROR)
            .attribute(ERROR_TYPE, type)
            .attribute(ERROR_MESSAGE, message);
        if (line > 0) {
            b.attribute(LINE, line);
        }
        if (column > 0) {
            b.attribute(COLUMN, column);
        }
        return b.build();
    }

    /**
     * An element produced by the script, such as a line of text.
     */
    public static OutputMessage element(String element, String content, int deltaId)
    {
        return OutputMessage.builder(MessageKind.DELTA)
            .attribute(ELEMENT, element)
            .body(content)
            .deltaId(deltaId)
            .build();
    }

    /**
     * An exception element, rendered in place of the output that the failed script would have
     * produced. The stack trace is the body.
     */
    public static OutputMessage exception(String type, String message, String stack, int deltaId)
    {
        return OutputMessage.builder(MessageKind.DELTA)
            .attribute(ELEMENT, ELEMENT_EXCEPTION)
            .attribute(ERROR_TYPE, type)
            .attribute(ERROR_MESSAGE, message)
            .body(stack)
            .deltaId(deltaId)
            .build();
    }

    public static OutputMessage exception(Throwable t, int deltaId)
    {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        t.printStackTrace(pw);
        pw.flush();
        return exception(t.getClass().getSimpleName(), t.getMessage(), sw.toString(), deltaId);
    }
}
