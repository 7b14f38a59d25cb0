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

import io.apigee.rerunner.kernel.InputState;

/**
 * A lifecycle event of a script controller.
 */
public class ScriptEvent
{
    public enum Type
    {
        STARTED,
        STOPPED_WITH_SUCCESS,
        STOPPED_WITH_COMPILE_ERROR,
        SHUTDOWN
    }

    private static final ScriptEvent STARTED = new ScriptEvent(Type.STARTED, null, null);
    private static final ScriptEvent SUCCESS = new ScriptEvent(Type.STOPPED_WITH_SUCCESS, null, null);

    private final Type type;
    private final ScriptCompileException compileError;
    private final InputState finalState;

    private ScriptEvent(Type type, ScriptCompileException compileError, InputState finalState)
    {
        this.type = type;
        this.compileError = compileError;
        this.finalState = finalState;
    }

    public static ScriptEvent started() {
        return STARTED;
    }

    public static ScriptEvent stoppedWithSuccess() {
        return SUCCESS;
    }

    public static ScriptEvent stoppedWithCompileError(ScriptCompileException e) {
        return new ScriptEvent(Type.STOPPED_WITH_COMPILE_ERROR, e, null);
    }

    public static ScriptEvent shutdown(InputState finalState) {
        return new ScriptEvent(Type.SHUTDOWN, null, finalState);
    }

    public Type getType() {
        return type;
    }

    /**
     * Only set for STOPPED_WITH_COMPILE_ERROR.
     */
    public ScriptCompileException getCompileError() {
        return compileError;
    }

    /**
     * Only set for SHUTDOWN: the input state that the last run left behind.
     */
    public InputState getFinalState() {
        return finalState;
    }

    @Override
    public String toString()
    {
        return (compileError == null) ? type.toString() : type + ": " + compileError.getMessage();
    }
}
