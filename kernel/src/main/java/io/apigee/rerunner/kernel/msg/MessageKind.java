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

/**
 * The kinds of output message that a session sends to its viewer.
 */
public enum MessageKind
{
    /** Sent once per session, before the first run starts. */
    INITIALIZE,
    /** Marker: a new run of the script has started. */
    NEW_RUN,
    /** Output produced by the script itself. */
    DELTA,
    /** Marker: the run finished, with a status. */
    RUN_FINISHED,
    /** Marker: the session switched between running and not running. */
    SESSION_STATE_CHANGED,
    /** Out-of-run notifications such as a compile error or a changed script file. */
    SESSION_EVENT,
    /** Points to a previously delivered message by its hash. */
    REFERENCE
}
